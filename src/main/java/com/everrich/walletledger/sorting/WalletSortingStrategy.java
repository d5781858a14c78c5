package com.everrich.walletledger.sorting;

import java.util.Comparator;
import java.util.Locale;

import com.everrich.walletledger.entities.Wallet;

public enum WalletSortingStrategy implements SortingStrategy<Wallet> {

    NAME("1", "Name (A-Z)",
            Comparator.comparing((Wallet w) -> w.getName().toLowerCase(Locale.ROOT))),

    BALANCE("2", "Balance (High to Low)",
            Comparator.comparingDouble(Wallet::getBalance).reversed()),

    NEWEST("3", "Newest First",
            Comparator.comparing(Wallet::getCreatedAt).reversed());

    private final String key;
    private final String name;
    private final Comparator<Wallet> comparator;

    WalletSortingStrategy(String key, String name, Comparator<Wallet> primary) {
        this.key = key;
        this.name = name;
        this.comparator = primary.thenComparing(Wallet::getId);
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
    public Comparator<Wallet> comparator() {
        return comparator;
    }
}
