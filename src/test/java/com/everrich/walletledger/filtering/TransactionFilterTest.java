package com.everrich.walletledger.filtering;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.everrich.walletledger.entities.Transaction;
import com.everrich.walletledger.entities.TransactionType;
import com.everrich.walletledger.entities.Transfer;
import com.everrich.walletledger.exception.LedgerValidationException;

class TransactionFilterTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 15, 10, 0);
    private static final Clock CLOCK = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);

    private static Transaction expense(double amount, LocalDateTime when) {
        return new Transaction(amount, TransactionType.EXPENSE, "Food", "", when);
    }

    @Test
    void datePresets_resolveAgainstClock() {
        DateFilter thisMonth = DateFilter.forPreset(DatePreset.THIS_MONTH, CLOCK);
        DateFilter lastWeek = DateFilter.forPreset(DatePreset.LAST_WEEK, CLOCK);

        assertTrue(thisMonth.matches(expense(1, LocalDateTime.of(2024, 5, 1, 0, 0))));
        assertFalse(thisMonth.matches(expense(1, LocalDateTime.of(2024, 4, 30, 23, 59))));
        assertTrue(lastWeek.matches(expense(1, LocalDateTime.of(2024, 5, 12, 22, 0))));
        assertFalse(lastWeek.matches(expense(1, LocalDateTime.of(2024, 5, 13, 0, 0))));
        assertEquals("Date: This Month", thisMonth.getName());
    }

    @Test
    void customDateRange_isInclusive() {
        DateFilter range = DateFilter.between(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));

        assertTrue(range.matches(expense(1, LocalDateTime.of(2024, 1, 31, 23, 59))));
        assertFalse(range.matches(expense(1, LocalDateTime.of(2024, 2, 1, 0, 0))));
        assertThrows(LedgerValidationException.class,
                () -> DateFilter.between(LocalDate.of(2024, 2, 1), LocalDate.of(2024, 1, 1)));
    }

    @Test
    void typePresets_treatTransfersByCategory() {
        Transaction salary = new Transaction(100, TransactionType.INCOME, "Salary", "", NOW);
        Transfer incoming = new Transfer(50, TransactionType.INCOME, "", NOW, "w1");

        assertTrue(TypePreset.INCOME.create().matches(incoming));
        assertFalse(TypePreset.INCOME_NO_TRANSFERS.create().matches(incoming));
        assertTrue(TypePreset.INCOME_NO_TRANSFERS.create().matches(salary));
        assertTrue(TypePreset.TRANSFERS_ONLY.create().matches(incoming));
        assertFalse(TypePreset.TRANSFERS_ONLY.create().matches(salary));
        assertFalse(TypePreset.EXPENSE.create().matches(salary));
        assertTrue(TypePreset.fromKey("6").isPresent());
        assertTrue(TypePreset.fromKey("7").isEmpty());
    }

    @Test
    void categoryFilter_excludeMode() {
        CategoryFilter notFood = CategoryFilter.excluding(List.of("food", "bills"));

        assertFalse(notFood.matches(expense(5, NOW)));
        assertTrue(notFood.matches(new Transaction(5, TransactionType.EXPENSE, "Health", "", NOW)));
        assertThrows(LedgerValidationException.class, () -> CategoryFilter.including(List.of(" ")));
    }

    @Test
    void amountFilters_compareMagnitudeInclusively() {
        AmountFilter large = AmountPreset.LARGE.create(1000, 100);
        AmountFilter small = AmountPreset.SMALL.create(1000, 100);
        AmountFilter range = AmountFilter.between(10.0, 20.0);

        assertTrue(large.matches(expense(1000, NOW)));
        assertFalse(large.matches(expense(999.99, NOW)));
        assertTrue(small.matches(expense(100, NOW)));
        assertTrue(range.matches(expense(10, NOW)));
        assertTrue(range.matches(expense(20, NOW)));
        assertFalse(range.matches(expense(20.01, NOW)));
        assertThrows(LedgerValidationException.class, () -> AmountFilter.between(null, null));
        assertThrows(LedgerValidationException.class, () -> AmountFilter.between(30.0, 20.0));
    }

    @Test
    void descriptionFilter_caseSensitivity() {
        Transaction coffee = new Transaction(4, TransactionType.EXPENSE, "Food", "Morning Coffee", NOW);

        assertTrue(new DescriptionFilter("coffee", false).matches(coffee));
        assertFalse(new DescriptionFilter("coffee", true).matches(coffee));
        assertThrows(LedgerValidationException.class, () -> new DescriptionFilter("", false));
    }
}
