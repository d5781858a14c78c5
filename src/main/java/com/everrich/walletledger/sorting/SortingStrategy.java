package com.everrich.walletledger.sorting;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * An ordering of transactions or wallets, selectable by a short key.
 */
public interface SortingStrategy<T> {

    String getKey();

    String getName();

    /**
     * Must define a total order so that repeated sorts of the same set agree.
     */
    Comparator<T> comparator();

    default List<T> sort(Collection<? extends T> items) {
        List<T> sorted = new ArrayList<>(items);
        sorted.sort(comparator());
        return sorted;
    }
}
