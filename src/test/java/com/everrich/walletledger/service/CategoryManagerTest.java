package com.everrich.walletledger.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;

import org.junit.jupiter.api.Test;

import com.everrich.walletledger.entities.TransactionType;

class CategoryManagerTest {

    private final CategoryManager categoryManager = new CategoryManager();

    @Test
    void seedsDefaultCategories() {
        assertTrue(categoryManager.categoryExists("Salary", TransactionType.INCOME));
        assertTrue(categoryManager.categoryExists("Health", TransactionType.EXPENSE));
        assertFalse(categoryManager.categoryExists("Salary", TransactionType.EXPENSE));
        assertEquals(5, categoryManager.getCategories(TransactionType.INCOME).size());
        assertEquals(7, categoryManager.getCategories(TransactionType.EXPENSE).size());
    }

    @Test
    void addCategory_isPerDirectionAndIdempotent() {
        categoryManager.addCategory("Crypto", TransactionType.INCOME);
        categoryManager.addCategory("Crypto", TransactionType.INCOME);

        assertTrue(categoryManager.categoryExists("Crypto", TransactionType.INCOME));
        assertFalse(categoryManager.categoryExists("Crypto", TransactionType.EXPENSE));
        assertEquals(6, categoryManager.getCategories(TransactionType.INCOME).size());
    }

    @Test
    void returnedSetIsACopy() {
        Set<String> income = categoryManager.getCategories(TransactionType.INCOME);
        income.add("Lottery");

        assertFalse(categoryManager.categoryExists("Lottery", TransactionType.INCOME));
    }
}
