package com.everrich.walletledger.filtering;

import java.util.Locale;

import com.everrich.walletledger.entities.Transaction;
import com.everrich.walletledger.exception.LedgerValidationException;

/**
 * Inclusive range over the positive magnitude of a transaction. Either bound may be null.
 */
public class AmountFilter implements TransactionFilter {

    private final Double min;
    private final Double max;
    private final String label;

    private AmountFilter(Double min, Double max, String label) {
        if (min != null && max != null && min > max) {
            throw new LedgerValidationException("Minimum amount " + min + " exceeds maximum " + max);
        }
        if ((min != null && min < 0) || (max != null && max < 0)) {
            throw new LedgerValidationException("Amount bounds must not be negative");
        }
        this.min = min;
        this.max = max;
        this.label = label;
    }

    public static AmountFilter between(Double min, Double max) {
        if (min == null && max == null) {
            throw new LedgerValidationException("Amount filter needs a minimum or a maximum");
        }
        return new AmountFilter(min, max, "Range");
    }

    public static AmountFilter large(double threshold) {
        return new AmountFilter(threshold, null, "Large");
    }

    public static AmountFilter small(double threshold) {
        return new AmountFilter(null, threshold, "Small");
    }

    @Override
    public boolean matches(Transaction transaction) {
        double amount = Math.abs(transaction.getAmount());
        return (min == null || amount >= min) && (max == null || amount <= max);
    }

    public Double getMin() {
        return min;
    }

    public Double getMax() {
        return max;
    }

    @Override
    public String getName() {
        return "Amount: " + label;
    }

    @Override
    public String getDescription() {
        if (max == null) {
            return ">= " + format(min);
        }
        if (min == null) {
            return "<= " + format(max);
        }
        return format(min) + " - " + format(max);
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
