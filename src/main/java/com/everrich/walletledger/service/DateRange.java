package com.everrich.walletledger.service;

import java.time.LocalDate;

/**
 * Inclusive date range. A null bound is open.
 */
public class DateRange {
    private final LocalDate start;
    private final LocalDate end;

    public DateRange(LocalDate start, LocalDate end) {
        this.start = start;
        this.end = end;
    }

    public LocalDate getStart() { return start; }
    public LocalDate getEnd() { return end; }

    public boolean contains(LocalDate date) {
        return (start == null || !date.isBefore(start)) && (end == null || !date.isAfter(end));
    }

    @Override
    public String toString() {
        return (start == null ? "..." : start.toString()) + " to " + (end == null ? "..." : end.toString());
    }
}
