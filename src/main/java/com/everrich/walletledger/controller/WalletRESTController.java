package com.everrich.walletledger.controller;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
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

import com.everrich.walletledger.dto.DepositSummary;
import com.everrich.walletledger.dto.PeriodSummary;
import com.everrich.walletledger.dto.StrategyOption;
import com.everrich.walletledger.dto.WalletRequest;
import com.everrich.walletledger.dto.WalletSummary;
import com.everrich.walletledger.dto.WalletUpdateRequest;
import com.everrich.walletledger.service.LedgerService;

@RestController
@RequestMapping("/api/wallets")
public class WalletRESTController {

    private static final Logger log = LoggerFactory.getLogger(WalletRESTController.class);

    private final LedgerService ledgerService;

    public WalletRESTController(LedgerService ledgerService) {
        this.ledgerService = ledgerService;
    }

    @GetMapping
    public List<WalletSummary> listWallets() {
        return ledgerService.listWallets();
    }

    @PostMapping
    public ResponseEntity<WalletSummary> createWallet(@RequestBody WalletRequest request) {
        log.info("REST call: create {} wallet '{}'", request.getWalletType(), request.getName());
        return new ResponseEntity<>(ledgerService.createWallet(request), HttpStatus.CREATED);
    }

    @GetMapping("/current")
    public ResponseEntity<Object> getCurrentWallet() {
        return ledgerService.getCurrentWallet()
                .<ResponseEntity<Object>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("error", "No current wallet")));
    }

    @PutMapping("/current/{name}")
    public WalletSummary switchWallet(@PathVariable String name) {
        return ledgerService.switchWallet(name);
    }

    @GetMapping("/sorting")
    public List<StrategyOption> getSortingOptions() {
        return ledgerService.getWalletSortingOptions();
    }

    @PutMapping("/sorting/{key}")
    public List<StrategyOption> setSorting(@PathVariable String key) {
        ledgerService.setWalletSorting(key);
        return ledgerService.getWalletSortingOptions();
    }

    @GetMapping("/{name}")
    public WalletSummary getWallet(@PathVariable String name) {
        return ledgerService.getWallet(name);
    }

    @PutMapping("/{name}")
    public WalletSummary updateWallet(@PathVariable String name, @RequestBody WalletUpdateRequest request) {
        log.info("REST call: update wallet '{}'", name);
        return ledgerService.updateWallet(name, request);
    }

    @DeleteMapping("/{name}")
    public ResponseEntity<Void> removeWallet(@PathVariable String name) {
        log.info("REST call: remove wallet '{}'", name);
        ledgerService.removeWallet(name);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{name}/deposit")
    public DepositSummary getDeposit(@PathVariable String name) {
        return ledgerService.getDeposit(name);
    }

    @GetMapping("/{name}/summary")
    public PeriodSummary getSummary(@PathVariable String name,
            @RequestParam(defaultValue = "false") boolean filtered) {
        return ledgerService.getSummary(name, filtered);
    }
}
