package com.everrich.walletledger.filtering;

import com.everrich.walletledger.entities.Transaction;
import com.everrich.walletledger.entities.TransactionType;

/**
 * Filters by direction and by whether a transaction carries the transfer category.
 */
public class TypeFilter implements TransactionFilter {

    enum TransferMode {
        INCLUDE,
        EXCLUDE,
        ONLY
    }

    private final TransactionType type;
    private final TransferMode transferMode;
    private final String label;

    TypeFilter(TransactionType type, TransferMode transferMode, String label) {
        this.type = type;
        this.transferMode = transferMode;
        this.label = label;
    }

    public static TypeFilter incomeOnly(boolean includeTransfers) {
        return new TypeFilter(TransactionType.INCOME,
                includeTransfers ? TransferMode.INCLUDE : TransferMode.EXCLUDE,
                includeTransfers ? "Income Only" : "Income Only (no transfers)");
    }

    public static TypeFilter expenseOnly(boolean includeTransfers) {
        return new TypeFilter(TransactionType.EXPENSE,
                includeTransfers ? TransferMode.INCLUDE : TransferMode.EXCLUDE,
                includeTransfers ? "Expense Only" : "Expense Only (no transfers)");
    }

    public static TypeFilter transfersOnly() {
        return new TypeFilter(null, TransferMode.ONLY, "Transfers Only");
    }

    public static TypeFilter noTransfers() {
        return new TypeFilter(null, TransferMode.EXCLUDE, "No Transfers");
    }

    @Override
    public boolean matches(Transaction transaction) {
        if (type != null && transaction.getType() != type) {
            return false;
        }
        switch (transferMode) {
            case EXCLUDE:
                return !transaction.isTransferCategory();
            case ONLY:
                return transaction.isTransferCategory();
            case INCLUDE:
            default:
                return true;
        }
    }

    @Override
    public String getName() {
        return "Type: " + label;
    }

    @Override
    public String getDescription() {
        String direction = type == null ? "Income and expense" : type.getLabel() + " transactions";
        switch (transferMode) {
            case EXCLUDE:
                return direction + ", transfers excluded";
            case ONLY:
                return direction + ", transfers only";
            case INCLUDE:
            default:
                return direction + ", transfers included";
        }
    }
}
