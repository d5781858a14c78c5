package com.everrich.walletledger.service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.everrich.walletledger.entities.TransactionType;

/**
 * Known category names per direction, shared by every wallet of one {@link WalletManager}.
 * Categories only accumulate; there is no removal.
 */
public class CategoryManager {

    private static final List<String> DEFAULT_INCOME_CATEGORIES =
            List.of("Salary", "Freelance", "Investment", "Gift", "Other");
    private static final List<String> DEFAULT_EXPENSE_CATEGORIES =
            List.of("Food", "Transport", "Entertainment", "Bills", "Shopping", "Health", "Other");

    private final Set<String> incomeCategories = new LinkedHashSet<>(DEFAULT_INCOME_CATEGORIES);
    private final Set<String> expenseCategories = new LinkedHashSet<>(DEFAULT_EXPENSE_CATEGORIES);

    /**
     * Returns a copy; changing it does not affect the manager.
     */
    public Set<String> getCategories(TransactionType type) {
        return new LinkedHashSet<>(categoriesFor(type));
    }

    public void addCategory(String category, TransactionType type) {
        categoriesFor(type).add(category);
    }

    public boolean categoryExists(String category, TransactionType type) {
        return categoriesFor(type).contains(category);
    }

    private Set<String> categoriesFor(TransactionType type) {
        return type == TransactionType.INCOME ? incomeCategories : expenseCategories;
    }
}
