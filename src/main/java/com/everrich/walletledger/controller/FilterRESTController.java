package com.everrich.walletledger.controller;

import java.util.List;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.everrich.walletledger.dto.FilterRequest;
import com.everrich.walletledger.dto.FilterView;
import com.everrich.walletledger.service.LedgerService;

@RestController
@RequestMapping("/api")
public class FilterRESTController {

    private final LedgerService ledgerService;

    public FilterRESTController(LedgerService ledgerService) {
        this.ledgerService = ledgerService;
    }

    @GetMapping("/filters/presets")
    public Map<String, Map<String, String>> getPresets() {
        return ledgerService.getFilterPresets();
    }

    @GetMapping("/wallets/{walletName}/filters")
    public List<FilterView> listFilters(@PathVariable String walletName) {
        return ledgerService.listFilters(walletName);
    }

    @PostMapping("/wallets/{walletName}/filters")
    public List<FilterView> addFilter(@PathVariable String walletName, @RequestBody FilterRequest request) {
        return ledgerService.addFilter(walletName, request);
    }

    /**
     * @param index 1-based position in the active filter list
     */
    @DeleteMapping("/wallets/{walletName}/filters/{index}")
    public List<FilterView> removeFilter(@PathVariable String walletName, @PathVariable int index) {
        return ledgerService.removeFilter(walletName, index);
    }

    @DeleteMapping("/wallets/{walletName}/filters")
    public ResponseEntity<Void> clearFilters(@PathVariable String walletName) {
        ledgerService.clearFilters(walletName);
        return ResponseEntity.noContent().build();
    }
}
