package com.everrich.walletledger.controller;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.everrich.walletledger.dto.StrategyOption;
import com.everrich.walletledger.dto.TransactionRequest;
import com.everrich.walletledger.dto.TransactionView;
import com.everrich.walletledger.service.LedgerService;

@RestController
@RequestMapping("/api/wallets/{walletName}/transactions")
public class TransactionRESTController {

    private static final Logger log = LoggerFactory.getLogger(TransactionRESTController.class);

    private final LedgerService ledgerService;

    public TransactionRESTController(LedgerService ledgerService) {
        this.ledgerService = ledgerService;
    }

    @GetMapping
    public List<TransactionView> listTransactions(@PathVariable String walletName,
            @RequestParam(defaultValue = "false") boolean filtered) {
        return ledgerService.listTransactions(walletName, filtered);
    }

    @PostMapping
    public ResponseEntity<TransactionView> addTransaction(@PathVariable String walletName,
            @RequestBody TransactionRequest request) {
        log.info("REST call: add {} {} '{}' to wallet '{}'",
                request.getType(), request.getAmount(), request.getCategory(), walletName);
        return new ResponseEntity<>(ledgerService.addTransaction(walletName, request), HttpStatus.CREATED);
    }

    @DeleteMapping
    public ResponseEntity<Void> deleteAllTransactions(@PathVariable String walletName) {
        ledgerService.deleteAllTransactions(walletName);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/sorting")
    public List<StrategyOption> getSortingOptions(@PathVariable String walletName) {
        return ledgerService.getTransactionSortingOptions(walletName);
    }

    @PutMapping("/sorting/{key}")
    public List<StrategyOption> setSorting(@PathVariable String walletName, @PathVariable String key) {
        ledgerService.setTransactionSorting(walletName, key);
        return ledgerService.getTransactionSortingOptions(walletName);
    }

    // Positions are 1-based in the current sort order.

    @GetMapping("/position/{position}")
    public TransactionView getTransactionAt(@PathVariable String walletName, @PathVariable int position) {
        return ledgerService.getTransactionAt(walletName, position);
    }

    @PutMapping("/position/{position}")
    public TransactionView updateTransactionAt(@PathVariable String walletName, @PathVariable int position,
            @RequestBody TransactionRequest request) {
        return ledgerService.updateTransactionAt(walletName, position, request);
    }

    @DeleteMapping("/position/{position}")
    public ResponseEntity<Void> deleteTransactionAt(@PathVariable String walletName, @PathVariable int position) {
        ledgerService.deleteTransactionAt(walletName, position);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}")
    public TransactionView getTransaction(@PathVariable String walletName, @PathVariable String id) {
        return ledgerService.getTransaction(walletName, id);
    }

    @GetMapping(value = "/{id}/details", produces = MediaType.TEXT_PLAIN_VALUE)
    public String getTransactionDetails(@PathVariable String walletName, @PathVariable String id) {
        return ledgerService.getTransactionDetails(walletName, id);
    }

    @PutMapping("/{id}")
    public TransactionView updateTransaction(@PathVariable String walletName, @PathVariable String id,
            @RequestBody TransactionRequest request) {
        log.info("REST call: update transaction {} in wallet '{}'", id, walletName);
        return ledgerService.updateTransaction(walletName, id, request);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteTransaction(@PathVariable String walletName, @PathVariable String id) {
        log.info("REST call: delete transaction {} from wallet '{}'", id, walletName);
        ledgerService.deleteTransaction(walletName, id);
        return ResponseEntity.noContent().build();
    }
}
