package com.everrich.walletledger.service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

import com.everrich.walletledger.entities.Transaction;
import com.everrich.walletledger.entities.TransactionType;

/**
 * Totals and category breakdowns over an arbitrary set of transactions,
 * e.g. a filtered view of a wallet.
 */
public final class TransactionStatistics {

    private TransactionStatistics() {
    }

    public static double total(Collection<Transaction> transactions, TransactionType type) {
        double total = 0.0;
        for (Transaction t : transactions) {
            if (t.getType() == type) {
                total += t.getAmount();
            }
        }
        return total;
    }

    public static double balance(Collection<Transaction> transactions) {
        double balance = 0.0;
        for (Transaction t : transactions) {
            balance += t.getSignedAmount();
        }
        return balance;
    }

    /**
     * Sum of amounts per category for one direction; zero totals are dropped.
     */
    public static Map<String, Double> totalsByCategory(Collection<Transaction> transactions, TransactionType type) {
        Map<String, Double> totals = new LinkedHashMap<>();
        for (Transaction t : transactions) {
            if (t.getType() == type) {
                totals.merge(t.getCategory(), t.getAmount(), Double::sum);
            }
        }
        totals.values().removeIf(v -> v == 0.0);
        return totals;
    }

    /**
     * Share of {@code total} per category, in percent. Empty when the total is zero.
     */
    public static Map<String, Double> percentages(Map<String, Double> totalsByCategory, double total) {
        Map<String, Double> percentages = new LinkedHashMap<>();
        if (total <= 0) {
            return percentages;
        }
        totalsByCategory.forEach((category, amount) -> percentages.put(category, amount / total * 100));
        return percentages;
    }
}
