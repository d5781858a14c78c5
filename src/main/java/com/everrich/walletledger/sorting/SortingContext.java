package com.everrich.walletledger.sorting;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.everrich.walletledger.entities.Transaction;
import com.everrich.walletledger.entities.Wallet;

/**
 * Holds the active sorting strategy for one collection (a wallet's ledger or the wallet list).
 * Sorting is recomputed on every call; nothing is cached across mutations.
 */
public class SortingContext<T> {

    private static final Logger log = LoggerFactory.getLogger(SortingContext.class);

    private final Map<String, SortingStrategy<T>> strategies = new LinkedHashMap<>();
    private SortingStrategy<T> currentStrategy;

    public SortingContext(List<? extends SortingStrategy<T>> available, SortingStrategy<T> initial) {
        for (SortingStrategy<T> strategy : available) {
            strategies.put(strategy.getKey(), strategy);
        }
        this.currentStrategy = initial;
    }

    public static SortingContext<Transaction> forTransactions() {
        return new SortingContext<>(List.of(TransactionSortingStrategy.values()),
                TransactionSortingStrategy.MOST_RECENT);
    }

    public static SortingContext<Wallet> forWallets() {
        return new SortingContext<>(List.of(WalletSortingStrategy.values()), WalletSortingStrategy.NAME);
    }

    public SortingStrategy<T> getCurrentStrategy() {
        return currentStrategy;
    }

    /**
     * @return false for an unknown key; the previous strategy stays active
     */
    public boolean setStrategy(String key) {
        SortingStrategy<T> strategy = key == null ? null : strategies.get(key.trim());
        if (strategy == null) {
            log.warn("Unknown sorting strategy key '{}', keeping '{}'", key, currentStrategy.getName());
            return false;
        }
        currentStrategy = strategy;
        log.debug("Sorting strategy set to '{}'", strategy.getName());
        return true;
    }

    public List<T> sort(Collection<? extends T> items) {
        return currentStrategy.sort(items);
    }

    /**
     * Key to display name, in key order.
     */
    public Map<String, String> getAvailableStrategies() {
        Map<String, String> available = new LinkedHashMap<>();
        strategies.forEach((key, strategy) -> available.put(key, strategy.getName()));
        return available;
    }
}
