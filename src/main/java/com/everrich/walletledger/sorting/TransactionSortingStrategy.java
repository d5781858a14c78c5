package com.everrich.walletledger.sorting;

import java.util.Comparator;
import java.util.Locale;

import com.everrich.walletledger.entities.Transaction;

public enum TransactionSortingStrategy implements SortingStrategy<Transaction> {

    MOST_RECENT("1", "Most Recent",
            Comparator.comparing(Transaction::getCreatedAt).reversed()),

    HIGH_TO_LOW("2", "High to Low",
            Comparator.comparingDouble((Transaction t) -> Math.abs(t.getAmount())).reversed()),

    CATEGORY_ALPHABETICAL("3", "Alphabetical by Category",
            Comparator.comparing((Transaction t) -> t.getCategory().toLowerCase(Locale.ROOT))
                    .thenComparing(Comparator.comparing(Transaction::getCreatedAt).reversed()));

    private final String key;
    private final String name;
    private final Comparator<Transaction> comparator;

    TransactionSortingStrategy(String key, String name, Comparator<Transaction> primary) {
        this.key = key;
        this.name = name;
        // id as last tiebreaker keeps the order total
        this.comparator = primary.thenComparing(Transaction::getId);
    }

    @Override
    public String getKey() {
        return key;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Comparator<Transaction> comparator() {
        return comparator;
    }
}
