package com.everrich.walletledger.entities;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.everrich.walletledger.exception.LedgerValidationException;
import com.everrich.walletledger.filtering.CategoryFilter;
import com.everrich.walletledger.service.CategoryManager;

class WalletTest {

    private static final LocalDateTime BASE = LocalDateTime.of(2024, 3, 10, 12, 0);

    private CategoryManager categoryManager;
    private Wallet wallet;

    @BeforeEach
    void setUp() {
        categoryManager = new CategoryManager();
        wallet = new Wallet("Main", "usd", "everyday");
        wallet.attach(categoryManager, id -> Optional.empty());
    }

    private Transaction add(double amount, TransactionType type, String category, int dayOffset) {
        Transaction t = new Transaction(amount, type, category, "", BASE.plusDays(dayOffset));
        wallet.addTransaction(t);
        return t;
    }

    private void assertAggregatesMatchStore() {
        double income = 0;
        double expense = 0;
        for (Transaction t : wallet.getTransactions()) {
            if (t.getType() == TransactionType.INCOME) {
                income += t.getAmount();
            } else {
                expense += t.getAmount();
            }
        }
        assertEquals(income, wallet.getTotalIncome(), 1e-9);
        assertEquals(expense, wallet.getTotalExpense(), 1e-9);
        assertEquals(income - expense, wallet.getBalance(), 1e-9);
    }

    @Test
    void newWallet_normalizesCurrencyAndStartsEmpty() {
        assertEquals("USD", wallet.getCurrency());
        assertEquals(0.0, wallet.getBalance());
        assertEquals(0, wallet.getTransactionCount());
        assertEquals(WalletType.REGULAR, wallet.getType());
        assertEquals("Main (USD)", wallet.toString());
    }

    @Test
    void blankName_isRejected() {
        assertThrows(LedgerValidationException.class, () -> new Wallet("  ", "USD", null));
    }

    @Test
    void startingBalance_isBookedOnAttach() {
        Wallet funded = new Wallet("Savings", "USD", "", 250.0, BASE);
        funded.attach(categoryManager, id -> Optional.empty());

        assertEquals(1, funded.getTransactionCount());
        Transaction opening = funded.getSortedTransactions().get(0);
        assertEquals(TransactionType.INCOME, opening.getType());
        assertEquals(Wallet.DEFAULT_STARTING_BALANCE_CATEGORY, opening.getCategory());
        assertEquals(250.0, funded.getBalance(), 1e-9);
    }

    @Test
    void negativeStartingBalance_isBookedAsExpense() {
        Wallet overdrawn = new Wallet("Card", "USD", "", -40.0, BASE);
        overdrawn.attach(categoryManager, id -> Optional.empty());

        assertEquals(40.0, overdrawn.getTotalExpense(), 1e-9);
        assertEquals(-40.0, overdrawn.getBalance(), 1e-9);
    }

    @Test
    void addTransaction_beforeAttach_fails() {
        Wallet detached = new Wallet("Loose", "USD", "");
        Transaction t = new Transaction(10, TransactionType.INCOME, "Salary", "", BASE);
        assertFalse(detached.isAttached());
        assertTrue(wallet.isAttached());
        assertThrows(IllegalStateException.class, () -> detached.addTransaction(t));
    }

    @Test
    void addTransaction_updatesAggregatesAndRegistersCategory() {
        add(100, TransactionType.INCOME, "Salary", 0);
        add(30, TransactionType.EXPENSE, "Pets", 1);

        assertEquals(100.0, wallet.getTotalIncome(), 1e-9);
        assertEquals(30.0, wallet.getTotalExpense(), 1e-9);
        assertEquals(70.0, wallet.getBalance(), 1e-9);
        assertTrue(categoryManager.categoryExists("Pets", TransactionType.EXPENSE));
        assertAggregatesMatchStore();
    }

    @Test
    void positions_followCurrentSortOrder() {
        Transaction older = add(10, TransactionType.EXPENSE, "Food", 0);
        Transaction newer = add(500, TransactionType.INCOME, "Salary", 3);

        assertEquals(newer.getId(), wallet.getTransactionByPosition(1).orElseThrow().getId());
        assertEquals(older.getId(), wallet.getTransactionByPosition(2).orElseThrow().getId());
        assertTrue(wallet.getTransactionByPosition(0).isEmpty());
        assertTrue(wallet.getTransactionByPosition(3).isEmpty());

        assertTrue(wallet.getSortingContext().setStrategy("2"));
        assertEquals(newer.getId(), wallet.getTransactionByPosition(1).orElseThrow().getId());
    }

    @Test
    void updateTransaction_replacesRecordAndKeepsId() {
        Transaction t = add(40, TransactionType.EXPENSE, "Food", 0);

        boolean updated = wallet.updateTransaction(t.getId(), TransactionEdit.builder()
                .amount(60.0)
                .type(TransactionType.INCOME)
                .category("Gift")
                .build());

        assertTrue(updated);
        Transaction stored = wallet.getTransactionById(t.getId()).orElseThrow();
        assertEquals(60.0, stored.getAmount());
        assertEquals(TransactionType.INCOME, stored.getType());
        assertEquals("Gift", stored.getCategory());
        assertEquals(60.0, wallet.getBalance(), 1e-9);
        assertAggregatesMatchStore();
    }

    @Test
    void updateTransaction_withInvalidAmount_leavesWalletUnchanged() {
        Transaction t = add(40, TransactionType.EXPENSE, "Food", 0);

        assertThrows(LedgerValidationException.class,
                () -> wallet.updateTransaction(t.getId(), TransactionEdit.builder().amount(-5.0).build()));
        assertEquals(-40.0, wallet.getBalance(), 1e-9);
        assertEquals(40.0, wallet.getTransactionById(t.getId()).orElseThrow().getAmount());
    }

    @Test
    void transferCategory_isReservedForTransfers() {
        assertThrows(LedgerValidationException.class,
                () -> new Transaction(40, TransactionType.EXPENSE, "transfer", "", BASE));
        assertEquals(Transaction.TRANSFER_CATEGORY,
                new Transfer(40, TransactionType.EXPENSE, "", BASE, wallet.getId()).getCategory());
    }

    @Test
    void editIntoTransferCategory_isRejectedAndLeavesRecord() {
        Transaction t = add(40, TransactionType.EXPENSE, "Food", 0);

        assertThrows(LedgerValidationException.class, () -> wallet.updateTransaction(t.getId(),
                TransactionEdit.builder().category("Transfer").build()));

        assertEquals("Food", wallet.getTransactionById(t.getId()).orElseThrow().getCategory());
        assertEquals(-40.0, wallet.getBalance(), 1e-9);
        assertAggregatesMatchStore();
    }

    @Test
    void updateAndDelete_unknownReferences_returnFalse() {
        add(40, TransactionType.EXPENSE, "Food", 0);

        assertFalse(wallet.updateTransaction("nope", TransactionEdit.builder().amount(1.0).build()));
        assertFalse(wallet.updateTransactionAt(5, TransactionEdit.builder().amount(1.0).build()));
        assertFalse(wallet.deleteTransaction("nope"));
        assertFalse(wallet.deleteTransactionAt(2));
        assertEquals(1, wallet.getTransactionCount());
    }

    @Test
    void deleteTransactionAt_removesContribution() {
        add(100, TransactionType.INCOME, "Salary", 0);
        add(25, TransactionType.EXPENSE, "Food", 1);

        assertTrue(wallet.deleteTransactionAt(1));

        assertEquals(1, wallet.getTransactionCount());
        assertEquals(100.0, wallet.getBalance(), 1e-9);
        assertAggregatesMatchStore();
    }

    @Test
    void categoryBreakdowns() {
        add(300, TransactionType.INCOME, "Salary", 0);
        add(100, TransactionType.INCOME, "Gift", 1);
        add(30, TransactionType.EXPENSE, "Food", 2);
        add(10, TransactionType.EXPENSE, "Food", 3);
        add(60, TransactionType.EXPENSE, "Bills", 4);

        Map<String, Double> expenses = wallet.getExpenseByCategory();
        assertEquals(40.0, expenses.get("Food"), 1e-9);
        assertEquals(60.0, expenses.get("Bills"), 1e-9);

        assertEquals(75.0, wallet.getIncomePercentages().get("Salary"), 1e-9);
        assertEquals(40.0, wallet.getExpensePercentages().get("Food"), 1e-9);

        Map<String, Double> net = wallet.getCategoryTotals();
        assertEquals(-40.0, net.get("Food"), 1e-9);
        assertEquals(300.0, net.get("Salary"), 1e-9);

        double turnover = 300 + 100 + 30 + 10 + 60;
        assertEquals(300 / turnover * 100, wallet.getCategoryPercentages().get("Salary"), 1e-9);
    }

    @Test
    void percentages_areEmptyWhenTotalsAreZero() {
        assertTrue(wallet.getIncomePercentages().isEmpty());
        assertTrue(wallet.getExpensePercentages().isEmpty());
        assertTrue(wallet.getCategoryPercentages().isEmpty());

        add(50, TransactionType.INCOME, "Salary", 0);
        assertTrue(wallet.getExpensePercentages().isEmpty());
    }

    @Test
    void filteredView_keepsSortOrder() {
        Transaction a = add(10, TransactionType.EXPENSE, "Food", 0);
        add(20, TransactionType.INCOME, "Salary", 1);
        Transaction c = add(30, TransactionType.EXPENSE, "Food", 2);

        wallet.getFilteringContext().addFilter(CategoryFilter.including(List.of("food")));

        List<Transaction> filtered = wallet.getFilteredTransactions();
        assertEquals(List.of(c.getId(), a.getId()), filtered.stream().map(Transaction::getId).toList());
    }
}
