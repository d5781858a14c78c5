package com.everrich.walletledger.filtering;

import java.util.Optional;

public enum AmountPreset {
    LARGE("1", "Large amounts"),
    SMALL("2", "Small amounts");

    private final String key;
    private final String label;

    AmountPreset(String key, String label) {
        this.key = key;
        this.label = label;
    }

    public String getKey() {
        return key;
    }

    public String getLabel() {
        return label;
    }

    public AmountFilter create(double largeThreshold, double smallThreshold) {
        return this == LARGE ? AmountFilter.large(largeThreshold) : AmountFilter.small(smallThreshold);
    }

    public static Optional<AmountPreset> fromKey(String key) {
        for (AmountPreset preset : values()) {
            if (preset.key.equals(key) || preset.name().equalsIgnoreCase(key)) {
                return Optional.of(preset);
            }
        }
        return Optional.empty();
    }
}
