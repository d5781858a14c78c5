package com.everrich.walletledger.filtering;

import java.time.Clock;
import java.time.LocalDate;
import java.util.function.Function;

import com.everrich.walletledger.entities.Transaction;
import com.everrich.walletledger.exception.LedgerValidationException;
import com.everrich.walletledger.service.DateRange;

/**
 * Keeps transactions whose date falls into an inclusive range.
 * Preset ranges are resolved against the clock on every match, so "Today" stays today.
 */
public class DateFilter implements TransactionFilter {

    private final String label;
    private final Function<LocalDate, DateRange> rangeResolver;
    private final Clock clock;

    private DateFilter(String label, Function<LocalDate, DateRange> rangeResolver, Clock clock) {
        this.label = label;
        this.rangeResolver = rangeResolver;
        this.clock = clock;
    }

    public static DateFilter forPreset(DatePreset preset, Clock clock) {
        return new DateFilter(preset.getLabel(), preset::resolve, clock);
    }

    /**
     * Either bound may be null for an open-ended range.
     */
    public static DateFilter between(LocalDate start, LocalDate end) {
        if (start != null && end != null && end.isBefore(start)) {
            throw new LedgerValidationException("Date range end " + end + " is before start " + start);
        }
        DateRange range = new DateRange(start, end);
        return new DateFilter("Custom Range", today -> range, Clock.systemDefaultZone());
    }

    public DateRange currentRange() {
        return rangeResolver.apply(LocalDate.now(clock));
    }

    @Override
    public boolean matches(Transaction transaction) {
        return currentRange().contains(transaction.getCreatedAt().toLocalDate());
    }

    @Override
    public String getName() {
        return "Date: " + label;
    }

    @Override
    public String getDescription() {
        return currentRange().toString();
    }
}
