package com.everrich.walletledger.sorting;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.everrich.walletledger.entities.Transaction;
import com.everrich.walletledger.entities.TransactionType;

class SortingContextTest {

    private static final LocalDateTime BASE = LocalDateTime.of(2024, 1, 1, 0, 0);

    private final Transaction food = new Transaction(20, TransactionType.EXPENSE, "food", "", BASE);
    private final Transaction salary = new Transaction(900, TransactionType.INCOME, "Salary", "", BASE.plusDays(2));
    private final Transaction bills = new Transaction(150, TransactionType.EXPENSE, "Bills", "", BASE.plusDays(1));
    private final Transaction lateFood = new Transaction(5, TransactionType.EXPENSE, "Food", "", BASE.plusDays(3));

    private final List<Transaction> all = List.of(food, salary, bills, lateFood);

    @Test
    void defaultsToMostRecent() {
        SortingContext<Transaction> context = SortingContext.forTransactions();

        assertSame(TransactionSortingStrategy.MOST_RECENT, context.getCurrentStrategy());
        assertEquals(List.of(lateFood, salary, bills, food), context.sort(all));
    }

    @Test
    void highToLow_usesMagnitude() {
        SortingContext<Transaction> context = SortingContext.forTransactions();
        assertTrue(context.setStrategy("2"));

        assertEquals(List.of(salary, bills, food, lateFood), context.sort(all));
    }

    @Test
    void categoryOrder_isCaseInsensitiveThenNewestFirst() {
        SortingContext<Transaction> context = SortingContext.forTransactions();
        assertTrue(context.setStrategy("3"));

        assertEquals(List.of(bills, lateFood, food, salary), context.sort(all));
    }

    @Test
    void unknownKey_keepsCurrentStrategy() {
        SortingContext<Transaction> context = SortingContext.forTransactions();
        context.setStrategy("2");

        assertFalse(context.setStrategy("9"));
        assertFalse(context.setStrategy(null));
        assertSame(TransactionSortingStrategy.HIGH_TO_LOW, context.getCurrentStrategy());
    }

    @Test
    void sortDoesNotModifyInput() {
        SortingContext<Transaction> context = SortingContext.forTransactions();
        List<Transaction> input = new ArrayList<>(all);

        context.sort(input);

        assertEquals(all, input);
    }

    @Test
    void availableStrategies_areListedInKeyOrder() {
        assertEquals(List.of("1", "2", "3"),
                List.copyOf(SortingContext.forTransactions().getAvailableStrategies().keySet()));
        assertEquals("Name (A-Z)", SortingContext.forWallets().getAvailableStrategies().get("1"));
    }
}
