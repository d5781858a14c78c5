package com.everrich.walletledger.filtering;

import java.util.Optional;
import java.util.function.Supplier;

public enum TypePreset {
    INCOME("1", "Income Only", () -> TypeFilter.incomeOnly(true)),
    INCOME_NO_TRANSFERS("2", "Income Only (no transfers)", () -> TypeFilter.incomeOnly(false)),
    EXPENSE("3", "Expense Only", () -> TypeFilter.expenseOnly(true)),
    EXPENSE_NO_TRANSFERS("4", "Expense Only (no transfers)", () -> TypeFilter.expenseOnly(false)),
    TRANSFERS_ONLY("5", "Transfers Only", TypeFilter::transfersOnly),
    NO_TRANSFERS("6", "No Transfers", TypeFilter::noTransfers);

    private final String key;
    private final String label;
    private final Supplier<TypeFilter> factory;

    TypePreset(String key, String label, Supplier<TypeFilter> factory) {
        this.key = key;
        this.label = label;
        this.factory = factory;
    }

    public String getKey() {
        return key;
    }

    public String getLabel() {
        return label;
    }

    public TypeFilter create() {
        return factory.get();
    }

    public static Optional<TypePreset> fromKey(String key) {
        for (TypePreset preset : values()) {
            if (preset.key.equals(key) || preset.name().equalsIgnoreCase(key)) {
                return Optional.of(preset);
            }
        }
        return Optional.empty();
    }
}
