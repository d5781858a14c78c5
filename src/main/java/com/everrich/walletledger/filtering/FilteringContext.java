package com.everrich.walletledger.filtering;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.everrich.walletledger.entities.Transaction;

/**
 * Ordered list of active filters for one wallet. A transaction is kept only if every
 * active filter matches. Filtering never touches the underlying ledger.
 */
public class FilteringContext {

    private static final Logger log = LoggerFactory.getLogger(FilteringContext.class);

    private final List<TransactionFilter> filters = new ArrayList<>();

    public void addFilter(TransactionFilter filter) {
        filters.add(filter);
        log.debug("Filter added: {}", filter.getName());
    }

    /**
     * @param index zero-based position in {@link #getActiveFilters()}
     * @return false if the index is out of range
     */
    public boolean removeFilter(int index) {
        if (index < 0 || index >= filters.size()) {
            return false;
        }
        TransactionFilter removed = filters.remove(index);
        log.debug("Filter removed: {}", removed.getName());
        return true;
    }

    public void clearFilters() {
        filters.clear();
    }

    public boolean hasFilters() {
        return !filters.isEmpty();
    }

    public List<TransactionFilter> getActiveFilters() {
        return Collections.unmodifiableList(filters);
    }

    public String getFilterSummary() {
        return filters.stream().map(TransactionFilter::getName).collect(Collectors.joining(" AND "));
    }

    public boolean matches(Transaction transaction) {
        for (TransactionFilter filter : filters) {
            if (!filter.matches(transaction)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Keeps the input order of {@code transactions}.
     */
    public List<Transaction> apply(Collection<Transaction> transactions) {
        return transactions.stream().filter(this::matches).collect(Collectors.toList());
    }
}
