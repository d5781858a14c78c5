package com.everrich.walletledger.filtering;

import java.util.Locale;

import com.everrich.walletledger.entities.Transaction;
import com.everrich.walletledger.exception.LedgerValidationException;

public class DescriptionFilter implements TransactionFilter {

    private final String query;
    private final boolean caseSensitive;

    public DescriptionFilter(String query, boolean caseSensitive) {
        if (query == null || query.isEmpty()) {
            throw new LedgerValidationException("Description search text is required");
        }
        this.query = query;
        this.caseSensitive = caseSensitive;
    }

    @Override
    public boolean matches(Transaction transaction) {
        String description = transaction.getDescription();
        if (caseSensitive) {
            return description.contains(query);
        }
        return description.toLowerCase(Locale.ROOT).contains(query.toLowerCase(Locale.ROOT));
    }

    @Override
    public String getName() {
        return "Description: \"" + query + "\"";
    }

    @Override
    public String getDescription() {
        return "Description contains \"" + query + "\"" + (caseSensitive ? " (case-sensitive)" : "");
    }
}
