package com.everrich.walletledger.service;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.TemporalAdjusters;

/**
 * Calendar helpers shared by the date filters and the deposit interest engine.
 */
public final class DateUtils {

    private DateUtils() {
        // Private constructor to prevent instantiation
    }

    /**
     * Advances by whole calendar months, clamping the day to the last valid day
     * of the resulting month (Jan 31 + 1 month = Feb 28, or Feb 29 in a leap year).
     */
    public static LocalDate addMonthsClamped(LocalDate date, int months) {
        return date.plusMonths(months);
    }

    /**
     * Counts completed monthly anniversaries of {@code start} up to and including {@code end}.
     * An anniversary that falls on a shorter month is clamped to that month's last day,
     * so a partial final month never counts but a clamped one does.
     */
    public static int wholeMonthsBetween(LocalDate start, LocalDate end) {
        if (end.isBefore(start)) {
            return 0;
        }
        int months = (end.getYear() - start.getYear()) * 12 + (end.getMonthValue() - start.getMonthValue());
        if (addMonthsClamped(start, months).isAfter(end)) {
            months--;
        }
        return Math.max(months, 0);
    }

    public static DateRange today(LocalDate today) {
        return new DateRange(today, today);
    }

    public static DateRange thisWeek(LocalDate today) {
        LocalDate monday = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        return new DateRange(monday, monday.plusDays(6));
    }

    public static DateRange lastWeek(LocalDate today) {
        return thisWeek(today.minusWeeks(1));
    }

    public static DateRange thisMonth(LocalDate today) {
        YearMonth ym = YearMonth.from(today);
        return new DateRange(ym.atDay(1), ym.atEndOfMonth());
    }

    public static DateRange lastMonth(LocalDate today) {
        YearMonth lastMonth = YearMonth.from(today).minusMonths(1);
        return new DateRange(lastMonth.atDay(1), lastMonth.atEndOfMonth());
    }

    public static DateRange thisYear(LocalDate today) {
        return new DateRange(today.with(TemporalAdjusters.firstDayOfYear()),
                today.with(TemporalAdjusters.lastDayOfYear()));
    }

    public static DateRange lastYear(LocalDate today) {
        LocalDate previous = today.minusYears(1);
        return new DateRange(previous.with(TemporalAdjusters.firstDayOfYear()),
                previous.with(TemporalAdjusters.lastDayOfYear()));
    }
}
