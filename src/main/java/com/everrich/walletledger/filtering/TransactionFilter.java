package com.everrich.walletledger.filtering;

import com.everrich.walletledger.entities.Transaction;

/**
 * A predicate over transactions. Active filters are combined with logical AND.
 */
public interface TransactionFilter {

    boolean matches(Transaction transaction);

    /**
     * Short label shown in the filter summary.
     */
    String getName();

    String getDescription();
}
