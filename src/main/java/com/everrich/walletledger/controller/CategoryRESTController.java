package com.everrich.walletledger.controller;

import java.util.Map;
import java.util.Set;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.everrich.walletledger.entities.TransactionType;
import com.everrich.walletledger.service.LedgerService;

@RestController
@RequestMapping("/api/categories")
public class CategoryRESTController {

    private final LedgerService ledgerService;

    public CategoryRESTController(LedgerService ledgerService) {
        this.ledgerService = ledgerService;
    }

    @GetMapping
    public Map<TransactionType, Set<String>> getCategories() {
        return ledgerService.getCategories();
    }

    @PostMapping
    public ResponseEntity<Map<TransactionType, Set<String>>> addCategory(@RequestBody Map<String, String> payload) {
        String name = payload.get("name");
        String type = payload.get("type");
        ledgerService.addCategory(name, type == null ? null : TransactionType.fromValue(type));
        return new ResponseEntity<>(ledgerService.getCategories(), HttpStatus.CREATED);
    }
}
