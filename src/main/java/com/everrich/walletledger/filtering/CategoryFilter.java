package com.everrich.walletledger.filtering;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

import com.everrich.walletledger.entities.Transaction;
import com.everrich.walletledger.exception.LedgerValidationException;

/**
 * Category membership, either keeping (include mode) or dropping (exclude mode)
 * the listed categories. Names compare case-insensitively.
 */
public class CategoryFilter implements TransactionFilter {

    private final Set<String> categories;
    private final Set<String> normalized = new LinkedHashSet<>();
    private final boolean exclude;

    public CategoryFilter(Collection<String> categories, boolean exclude) {
        if (categories == null || categories.isEmpty()) {
            throw new LedgerValidationException("Category filter needs at least one category");
        }
        Set<String> names = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        for (String category : categories) {
            if (category != null && !category.isBlank()) {
                names.add(category.trim());
                normalized.add(category.trim().toLowerCase(Locale.ROOT));
            }
        }
        if (names.isEmpty()) {
            throw new LedgerValidationException("Category filter needs at least one category");
        }
        this.categories = Collections.unmodifiableSet(names);
        this.exclude = exclude;
    }

    public static CategoryFilter including(Collection<String> categories) {
        return new CategoryFilter(categories, false);
    }

    public static CategoryFilter excluding(Collection<String> categories) {
        return new CategoryFilter(categories, true);
    }

    @Override
    public boolean matches(Transaction transaction) {
        boolean listed = normalized.contains(transaction.getCategory().toLowerCase(Locale.ROOT));
        return exclude != listed;
    }

    public Set<String> getCategories() {
        return categories;
    }

    public boolean isExclude() {
        return exclude;
    }

    @Override
    public String getName() {
        return (exclude ? "Excluding: " : "Category: ") + String.join(", ", categories);
    }

    @Override
    public String getDescription() {
        return (exclude ? "Hide " : "Show only ") + String.join(", ", categories);
    }
}
