package com.everrich.walletledger.filtering;

import java.time.LocalDate;
import java.util.Optional;
import java.util.function.Function;

import com.everrich.walletledger.service.DateRange;
import com.everrich.walletledger.service.DateUtils;

public enum DatePreset {
    TODAY("1", "Today", DateUtils::today),
    THIS_WEEK("2", "This Week", DateUtils::thisWeek),
    LAST_WEEK("3", "Last Week", DateUtils::lastWeek),
    THIS_MONTH("4", "This Month", DateUtils::thisMonth),
    LAST_MONTH("5", "Last Month", DateUtils::lastMonth),
    THIS_YEAR("6", "This Year", DateUtils::thisYear),
    LAST_YEAR("7", "Last Year", DateUtils::lastYear);

    private final String key;
    private final String label;
    private final Function<LocalDate, DateRange> resolver;

    DatePreset(String key, String label, Function<LocalDate, DateRange> resolver) {
        this.key = key;
        this.label = label;
        this.resolver = resolver;
    }

    public String getKey() {
        return key;
    }

    public String getLabel() {
        return label;
    }

    public DateRange resolve(LocalDate today) {
        return resolver.apply(today);
    }

    public static Optional<DatePreset> fromKey(String key) {
        for (DatePreset preset : values()) {
            if (preset.key.equals(key) || preset.name().equalsIgnoreCase(key)) {
                return Optional.of(preset);
            }
        }
        return Optional.empty();
    }
}
