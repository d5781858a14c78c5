package com.everrich.walletledger.controller;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.everrich.walletledger.dto.TransferRequest;
import com.everrich.walletledger.dto.WalletSummary;
import com.everrich.walletledger.service.LedgerService;

@RestController
@RequestMapping("/api/transfers")
public class TransferController {

    private static final Logger log = LoggerFactory.getLogger(TransferController.class);

    private final LedgerService ledgerService;

    public TransferController(LedgerService ledgerService) {
        this.ledgerService = ledgerService;
    }

    @PostMapping
    public ResponseEntity<List<WalletSummary>> transfer(@RequestBody TransferRequest request) {
        log.info("REST call: transfer {} from '{}' to '{}'",
                request.getAmount(), request.getFromWallet(), request.getToWallet());
        return new ResponseEntity<>(ledgerService.transfer(request), HttpStatus.CREATED);
    }
}
