package com.everrich.walletledger.entities;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.everrich.walletledger.exception.LedgerInvariantException;
import com.everrich.walletledger.exception.LedgerValidationException;
import com.everrich.walletledger.filtering.FilteringContext;
import com.everrich.walletledger.service.CategoryManager;
import com.everrich.walletledger.service.TransactionStatistics;
import com.everrich.walletledger.service.WalletRegistry;
import com.everrich.walletledger.sorting.SortingContext;

/**
 * A named ledger of transactions with running totals.
 *
 * Totals are maintained incrementally on every insert, update and delete so that
 * {@code balance == totalIncome - totalExpense} and both match the sum of signed amounts.
 * A wallet must be attached to a {@link CategoryManager} (normally by the
 * {@link com.everrich.walletledger.service.WalletManager}) before transactions can be added.
 */
public class Wallet {

    private static final Logger log = LoggerFactory.getLogger(Wallet.class);

    public static final String DEFAULT_STARTING_BALANCE_CATEGORY = "Initial Balance";

    private final String id;
    private String name;
    private String currency;
    private String description;
    private final LocalDateTime createdAt;

    private final Map<String, Transaction> transactions = new LinkedHashMap<>();
    private double totalIncome;
    private double totalExpense;
    private double balance;

    private final SortingContext<Transaction> sortingContext = SortingContext.forTransactions();
    private final FilteringContext filteringContext = new FilteringContext();

    private CategoryManager categoryManager;
    private WalletRegistry registry;
    private double pendingStartingBalance;
    private String startingBalanceCategory = DEFAULT_STARTING_BALANCE_CATEGORY;

    public Wallet(String name, String currency, String description) {
        this(name, currency, description, 0.0, LocalDateTime.now());
    }

    public Wallet(String name, String currency, String description, double startingBalance,
            LocalDateTime createdAt) {
        this.id = UUID.randomUUID().toString();
        this.name = requireName(name);
        this.currency = requireCurrency(currency);
        this.description = description == null ? "" : description;
        this.createdAt = createdAt == null ? LocalDateTime.now() : createdAt;
        if (Double.isNaN(startingBalance) || Double.isInfinite(startingBalance)) {
            throw new LedgerValidationException("Starting balance must be a finite number");
        }
        this.pendingStartingBalance = startingBalance;
    }

    /**
     * Connects the wallet to the shared category manager and to the wallet lookup used for
     * transfer partners. A pending starting balance is booked at this point, once.
     */
    public void attach(CategoryManager categoryManager, WalletRegistry registry) {
        if (this.categoryManager != null && this.categoryManager != categoryManager) {
            throw new IllegalStateException("Wallet '" + name + "' is already attached to another manager");
        }
        this.categoryManager = categoryManager;
        this.registry = registry;
        for (Transaction t : transactions.values()) {
            categoryManager.addCategory(t.getCategory(), t.getType());
        }
        if (pendingStartingBalance != 0.0) {
            TransactionType type = pendingStartingBalance > 0 ? TransactionType.INCOME : TransactionType.EXPENSE;
            addTransaction(new Transaction(Math.abs(pendingStartingBalance), type, startingBalanceCategory,
                    "Starting balance", createdAt));
            log.debug("Booked starting balance {} for wallet '{}'", pendingStartingBalance, name);
            pendingStartingBalance = 0.0;
        }
    }

    public boolean isAttached() {
        return categoryManager != null;
    }

    public WalletType getType() {
        return WalletType.REGULAR;
    }

    // ========== Ledger mutations ==========

    /**
     * Registers the category, books the amount into the totals and stores the transaction.
     * Ids are generated, so duplicates are not checked.
     */
    public void addTransaction(Transaction transaction) {
        requireAttached();
        categoryManager.addCategory(transaction.getCategory(), transaction.getType());
        include(transaction);
        transactions.put(transaction.getId(), transaction);
        log.debug("Added transaction {} ({}) to wallet '{}', balance now {}",
                transaction.getId(), transaction, name, balance);
    }

    /**
     * @return false if no transaction has this id
     */
    public boolean updateTransaction(String transactionId, TransactionEdit edit) {
        Transaction current = transactions.get(transactionId);
        if (current == null) {
            return false;
        }
        if (current instanceof Transfer) {
            updateTransfer((Transfer) current, edit);
            return true;
        }
        Transaction replacement = current.withChanges(edit);
        exclude(current);
        categoryManager.addCategory(replacement.getCategory(), replacement.getType());
        transactions.put(transactionId, replacement);
        include(replacement);
        log.debug("Updated transaction {} in wallet '{}', balance now {}", transactionId, name, balance);
        return true;
    }

    public boolean updateTransactionAt(int position, TransactionEdit edit) {
        return getTransactionByPosition(position)
                .map(t -> updateTransaction(t.getId(), edit))
                .orElse(false);
    }

    private void updateTransfer(Transfer transfer, TransactionEdit edit) {
        if (edit.touchesTransferLockedFields()) {
            log.debug("Ignoring type/category change on transfer {}", transfer.getId());
        }
        if (edit.getAmount() != null) {
            Transaction.validateAmount(edit.getAmount());
        }
        Partner partner = resolvePartner(transfer);

        exclude(transfer);
        partner.wallet().exclude(partner.transfer());
        boolean synced = transfer.update(edit, partner.transfer());
        include(transfer);
        partner.wallet().include(partner.transfer());

        if (!synced) {
            throw new LedgerInvariantException("Transfer " + transfer.getId() + " lost its connected side");
        }
        log.debug("Updated transfer {} in wallet '{}' and {} in wallet '{}'",
                transfer.getId(), name, partner.transfer().getId(), partner.wallet().getName());
    }

    public boolean deleteTransaction(String transactionId) {
        return deleteTransaction(transactionId, true);
    }

    /**
     * Removes a transaction and its contribution to the totals. For a linked transfer with
     * {@code cascade} set, the connected side is deleted from its own wallet (without cascading
     * back) and both links are cleared.
     *
     * @return false if no transaction has this id
     */
    public boolean deleteTransaction(String transactionId, boolean cascade) {
        Transaction transaction = transactions.get(transactionId);
        if (transaction == null) {
            return false;
        }
        if (cascade && transaction instanceof Transfer && !((Transfer) transaction).isDetached()) {
            Transfer transfer = (Transfer) transaction;
            Partner partner = resolvePartner(transfer);
            removeEntry(transfer);
            partner.wallet().deleteTransaction(partner.transfer().getId(), false);
            transfer.detach();
            partner.transfer().detach();
            log.debug("Deleted transfer {} from wallet '{}' together with {} from wallet '{}'",
                    transfer.getId(), name, partner.transfer().getId(), partner.wallet().getName());
        } else {
            removeEntry(transaction);
            log.debug("Deleted transaction {} from wallet '{}', balance now {}", transactionId, name, balance);
        }
        return true;
    }

    public boolean deleteTransactionAt(int position) {
        return getTransactionByPosition(position)
                .map(t -> deleteTransaction(t.getId(), true))
                .orElse(false);
    }

    /**
     * Deletes every transaction, cascading into transfer partners in other wallets.
     */
    public void deleteAllTransactions() {
        for (String transactionId : new ArrayList<>(transactions.keySet())) {
            deleteTransaction(transactionId, true);
        }
    }

    private void removeEntry(Transaction transaction) {
        exclude(transaction);
        transactions.remove(transaction.getId());
    }

    private Partner resolvePartner(Transfer transfer) {
        if (transfer.isDetached() || registry == null) {
            throw new LedgerInvariantException("Transfer " + transfer.getId() + " in wallet '" + name
                    + "' has no connected side");
        }
        Wallet partnerWallet = registry.findWalletById(transfer.getConnectedWalletId())
                .orElseThrow(() -> new LedgerInvariantException("Transfer " + transfer.getId()
                        + " points at missing wallet " + transfer.getConnectedWalletId()));
        Transaction candidate = partnerWallet.transactions.get(transfer.getConnectedId());
        if (!(candidate instanceof Transfer) || !transfer.isLinkedTo((Transfer) candidate)) {
            throw new LedgerInvariantException("Transfer " + transfer.getId() + " points at missing transfer "
                    + transfer.getConnectedId() + " in wallet '" + partnerWallet.getName() + "'");
        }
        return new Partner(partnerWallet, (Transfer) candidate);
    }

    private record Partner(Wallet wallet, Transfer transfer) {
    }

    private void include(Transaction transaction) {
        double amount = transaction.getAmount();
        if (transaction.getType() == TransactionType.INCOME) {
            totalIncome += amount;
            balance += amount;
        } else {
            totalExpense += amount;
            balance -= amount;
        }
    }

    private void exclude(Transaction transaction) {
        double amount = transaction.getAmount();
        if (transaction.getType() == TransactionType.INCOME) {
            totalIncome -= amount;
            balance -= amount;
        } else {
            totalExpense -= amount;
            balance += amount;
        }
    }

    private void requireAttached() {
        if (!isAttached()) {
            throw new IllegalStateException("Wallet '" + name + "' is not attached to a category manager");
        }
    }

    // ========== Lookups and views ==========

    /**
     * 1-based position in the current sort order.
     */
    public Optional<Transaction> getTransactionByPosition(int position) {
        List<Transaction> sorted = getSortedTransactions();
        if (position < 1 || position > sorted.size()) {
            return Optional.empty();
        }
        return Optional.of(sorted.get(position - 1));
    }

    public Optional<Transaction> getTransactionById(String transactionId) {
        return Optional.ofNullable(transactions.get(transactionId));
    }

    public List<Transaction> getSortedTransactions() {
        return sortingContext.sort(transactions.values());
    }

    /**
     * Active filters applied to the sorted view; the result keeps the sort order.
     */
    public List<Transaction> getFilteredTransactions() {
        return filteringContext.apply(getSortedTransactions());
    }

    public Collection<Transaction> getTransactions() {
        return Collections.unmodifiableCollection(transactions.values());
    }

    public int getTransactionCount() {
        return transactions.size();
    }

    // ========== Category breakdowns ==========

    public Map<String, Double> getIncomeByCategory() {
        return TransactionStatistics.totalsByCategory(transactions.values(), TransactionType.INCOME);
    }

    public Map<String, Double> getExpenseByCategory() {
        return TransactionStatistics.totalsByCategory(transactions.values(), TransactionType.EXPENSE);
    }

    public Map<String, Double> getIncomePercentages() {
        return TransactionStatistics.percentages(getIncomeByCategory(), totalIncome);
    }

    public Map<String, Double> getExpensePercentages() {
        return TransactionStatistics.percentages(getExpenseByCategory(), totalExpense);
    }

    /**
     * Net signed amount per category; categories netting to zero are left out.
     */
    public Map<String, Double> getCategoryTotals() {
        Map<String, Double> totals = new LinkedHashMap<>();
        for (Transaction t : transactions.values()) {
            totals.merge(t.getCategory(), t.getSignedAmount(), Double::sum);
        }
        totals.values().removeIf(v -> v == 0.0);
        return totals;
    }

    /**
     * Share of each category in the total turnover (income and expense magnitudes together).
     */
    public Map<String, Double> getCategoryPercentages() {
        // TODO: confirm with product whether income categories should be normalized against total income here
        Map<String, Double> magnitudes = new LinkedHashMap<>();
        double turnover = 0.0;
        for (Transaction t : transactions.values()) {
            magnitudes.merge(t.getCategory(), Math.abs(t.getAmount()), Double::sum);
            turnover += Math.abs(t.getAmount());
        }
        return TransactionStatistics.percentages(magnitudes, turnover);
    }

    // ========== Accessors ==========

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    /**
     * Renaming a wallet that belongs to a manager must go through
     * {@link com.everrich.walletledger.service.WalletManager#updateWallet}.
     */
    public void setName(String name) {
        this.name = requireName(name);
    }

    public String getCurrency() {
        return currency;
    }

    public void setCurrency(String currency) {
        this.currency = requireCurrency(currency);
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description == null ? "" : description;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public double getTotalIncome() {
        return totalIncome;
    }

    public double getTotalExpense() {
        return totalExpense;
    }

    public double getBalance() {
        return balance;
    }

    public SortingContext<Transaction> getSortingContext() {
        return sortingContext;
    }

    public FilteringContext getFilteringContext() {
        return filteringContext;
    }

    public CategoryManager getCategoryManager() {
        return categoryManager;
    }

    public String getStartingBalanceCategory() {
        return startingBalanceCategory;
    }

    public void setStartingBalanceCategory(String startingBalanceCategory) {
        this.startingBalanceCategory = startingBalanceCategory;
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new LedgerValidationException("Wallet name must not be empty");
        }
        return name.trim();
    }

    private static String requireCurrency(String currency) {
        if (currency == null || currency.isBlank()) {
            throw new LedgerValidationException("Wallet currency must not be empty");
        }
        return currency.trim().toUpperCase();
    }

    @Override
    public String toString() {
        return name + " (" + currency + ")";
    }
}
