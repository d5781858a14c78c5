package com.everrich.walletledger.entities;

/**
 * Direction of a monetary movement. The symbol is used when rendering signed amounts.
 */
public enum TransactionType {
    INCOME("+", "Income"),
    EXPENSE("-", "Expense");

    private final String symbol;
    private final String label;

    TransactionType(String symbol, String label) {
        this.symbol = symbol;
        this.label = label;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getLabel() {
        return label;
    }

    public static TransactionType fromValue(String value) {
        for (TransactionType type : TransactionType.values()) {
            if (type.name().equalsIgnoreCase(value) || type.symbol.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown transaction type: " + value);
    }
}
