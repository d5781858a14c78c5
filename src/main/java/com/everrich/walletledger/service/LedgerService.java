package com.everrich.walletledger.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.everrich.walletledger.config.LedgerProperties;
import com.everrich.walletledger.dto.DepositSummary;
import com.everrich.walletledger.dto.FilterRequest;
import com.everrich.walletledger.dto.FilterView;
import com.everrich.walletledger.dto.PeriodSummary;
import com.everrich.walletledger.dto.StrategyOption;
import com.everrich.walletledger.dto.TransactionRequest;
import com.everrich.walletledger.dto.TransactionView;
import com.everrich.walletledger.dto.TransferRequest;
import com.everrich.walletledger.dto.WalletRequest;
import com.everrich.walletledger.dto.WalletSummary;
import com.everrich.walletledger.dto.WalletUpdateRequest;
import com.everrich.walletledger.entities.DepositWallet;
import com.everrich.walletledger.entities.Transaction;
import com.everrich.walletledger.entities.TransactionType;
import com.everrich.walletledger.entities.Wallet;
import com.everrich.walletledger.entities.WalletType;
import com.everrich.walletledger.exception.InvalidTransferException;
import com.everrich.walletledger.exception.LedgerValidationException;
import com.everrich.walletledger.exception.TransactionNotFoundException;
import com.everrich.walletledger.exception.WalletNotFoundException;
import com.everrich.walletledger.filtering.AmountFilter;
import com.everrich.walletledger.filtering.AmountPreset;
import com.everrich.walletledger.filtering.CategoryFilter;
import com.everrich.walletledger.filtering.DateFilter;
import com.everrich.walletledger.filtering.DatePreset;
import com.everrich.walletledger.filtering.DescriptionFilter;
import com.everrich.walletledger.filtering.FilteringContext;
import com.everrich.walletledger.filtering.TransactionFilter;
import com.everrich.walletledger.filtering.TypePreset;
import com.everrich.walletledger.sorting.SortingContext;

/**
 * Entry point for the HTTP layer. Translates requests into {@link WalletManager} calls and
 * turns "not found" results into exceptions.
 *
 * The in-memory ledger is not thread-safe, so every call runs under one fair lock.
 */
@Service
public class LedgerService {

    private static final Logger log = LoggerFactory.getLogger(LedgerService.class);

    private static final Set<String> RESERVED_WALLET_NAMES = Set.of("current", "sorting");

    private final WalletManager walletManager;
    private final LedgerProperties properties;
    private final Clock clock;

    private final ReentrantLock ledgerLock = new ReentrantLock(true); // fair lock

    public LedgerService(WalletManager walletManager, LedgerProperties properties, Clock clock) {
        this.walletManager = walletManager;
        this.properties = properties;
        this.clock = clock;
        log.info("LedgerService initialized, default currency {}", properties.getDefaultCurrency());
    }

    private <T> T locked(Supplier<T> action) {
        ledgerLock.lock();
        try {
            return action.get();
        } finally {
            ledgerLock.unlock();
        }
    }

    private void locked(Runnable action) {
        locked(() -> {
            action.run();
            return null;
        });
    }

    // ========== Wallets ==========

    public WalletSummary createWallet(WalletRequest request) {
        return locked(() -> {
            requireAvailableName(request.getName(), null);
            Wallet wallet = buildWallet(request);
            walletManager.addWallet(wallet);
            return summarize(wallet);
        });
    }

    private Wallet buildWallet(WalletRequest request) {
        String currency = request.getCurrency() == null || request.getCurrency().isBlank()
                ? properties.getDefaultCurrency()
                : request.getCurrency();
        double startingBalance = request.getStartingBalance() == null ? 0.0 : request.getStartingBalance();
        LocalDateTime now = LocalDateTime.now(clock);
        WalletType type = request.getWalletType() == null ? WalletType.REGULAR : request.getWalletType();

        Wallet wallet;
        if (type == WalletType.DEPOSIT) {
            boolean capitalization = request.getCapitalization() != null && request.getCapitalization();
            wallet = new DepositWallet(request.getName(), currency, request.getDescription(), startingBalance,
                    request.getInterestRate(), request.getTermMonths(), capitalization, now, clock);
        } else {
            if (request.getInterestRate() != null || request.getTermMonths() != null
                    || request.getCapitalization() != null) {
                throw new LedgerValidationException("Interest settings are only allowed for deposit wallets");
            }
            wallet = new Wallet(request.getName(), currency, request.getDescription(), startingBalance, now);
        }
        wallet.setStartingBalanceCategory(properties.getStartingBalanceCategory());
        return wallet;
    }

    public List<WalletSummary> listWallets() {
        return locked(() -> {
            List<WalletSummary> summaries = new ArrayList<>();
            for (Wallet wallet : walletManager.getSortedWallets()) {
                summaries.add(summarize(wallet));
            }
            return summaries;
        });
    }

    public WalletSummary getWallet(String name) {
        return locked(() -> summarize(requireWallet(name)));
    }

    public DepositSummary getDeposit(String name) {
        return locked(() -> {
            Wallet wallet = requireWallet(name);
            if (!(wallet instanceof DepositWallet)) {
                throw new LedgerValidationException("Wallet '" + wallet.getName() + "' is not a deposit wallet");
            }
            return DepositSummary.from((DepositWallet) wallet);
        });
    }

    /**
     * All checks run before anything is applied, so a rejected update leaves the wallet as it was.
     */
    public WalletSummary updateWallet(String name, WalletUpdateRequest request) {
        return locked(() -> {
            Wallet wallet = requireWallet(name);
            if (request.getName() != null && !request.getName().equals(wallet.getName())) {
                requireAvailableName(request.getName(), wallet);
            }
            if (request.hasDepositFields()) {
                if (!(wallet instanceof DepositWallet)) {
                    throw new LedgerValidationException(
                            "Interest settings are only allowed for deposit wallets");
                }
                applyDepositSettings((DepositWallet) wallet, request);
            }
            walletManager.updateWallet(name, request.getName(), request.getCurrency(), request.getDescription());
            return summarize(wallet);
        });
    }

    private void applyDepositSettings(DepositWallet deposit, WalletUpdateRequest request) {
        double previousRate = deposit.getInterestRate();
        int previousTerm = deposit.getTermMonths();
        boolean previousCapitalization = deposit.isCapitalization();
        try {
            if (request.getInterestRate() != null) {
                deposit.setInterestRate(request.getInterestRate());
            }
            if (request.getTermMonths() != null) {
                deposit.setTermMonths(request.getTermMonths());
            }
            if (request.getCapitalization() != null) {
                deposit.setCapitalization(request.getCapitalization());
            }
        } catch (LedgerValidationException e) {
            deposit.setInterestRate(previousRate);
            deposit.setTermMonths(previousTerm);
            deposit.setCapitalization(previousCapitalization);
            throw e;
        }
    }

    /**
     * Names that would shadow the fixed {@code /api/wallets/...} sub-paths are refused.
     */
    private void requireAvailableName(String name, Wallet renamed) {
        if (name == null || name.isBlank()) {
            throw new LedgerValidationException("Wallet name must not be empty");
        }
        if (RESERVED_WALLET_NAMES.contains(name.trim().toLowerCase(Locale.ROOT))) {
            throw new LedgerValidationException("Wallet name '" + name.trim() + "' is reserved");
        }
        Optional<Wallet> existing = walletManager.getWallet(name);
        if (existing.isPresent() && existing.get() != renamed) {
            throw new LedgerValidationException("Wallet '" + name + "' already exists");
        }
    }

    public void removeWallet(String name) {
        locked(() -> {
            if (!walletManager.removeWallet(name)) {
                throw new WalletNotFoundException(name);
            }
        });
    }

    public Optional<WalletSummary> getCurrentWallet() {
        return locked(() -> Optional.ofNullable(walletManager.getCurrentWallet()).map(this::summarize));
    }

    public WalletSummary switchWallet(String name) {
        return locked(() -> {
            if (!walletManager.switchWallet(name)) {
                throw new WalletNotFoundException(name);
            }
            log.info("Switched current wallet to '{}'", walletManager.getCurrentWallet().getName());
            return summarize(walletManager.getCurrentWallet());
        });
    }

    public List<StrategyOption> getWalletSortingOptions() {
        return locked(() -> optionsOf(walletManager.getSortingContext()));
    }

    public void setWalletSorting(String key) {
        locked(() -> {
            if (!walletManager.getSortingContext().setStrategy(key)) {
                throw new LedgerValidationException("Unknown wallet sorting option: " + key);
            }
        });
    }

    // ========== Transactions ==========

    public TransactionView addTransaction(String walletName, TransactionRequest request) {
        return locked(() -> {
            Wallet wallet = requireWallet(walletName);
            if (request.getAmount() == null) {
                throw new LedgerValidationException("Amount is required");
            }
            LocalDateTime createdAt = request.getCreatedAt() == null ? LocalDateTime.now(clock)
                    : request.getCreatedAt();
            Transaction transaction = new Transaction(request.getAmount(), request.getType(),
                    request.getCategory(), request.getDescription(), createdAt);
            wallet.addTransaction(transaction);
            log.info("Added {} to wallet '{}'", transaction, wallet.getName());
            return viewOf(wallet, transaction);
        });
    }

    /**
     * Positions in the result always refer to the full sorted view, so they can be passed
     * straight to the position endpoints even when the list is filtered.
     */
    public List<TransactionView> listTransactions(String walletName, boolean filtered) {
        return locked(() -> {
            Wallet wallet = requireWallet(walletName);
            List<Transaction> sorted = wallet.getSortedTransactions();
            Collection<Transaction> shown = filtered ? wallet.getFilteringContext().apply(sorted) : sorted;
            Map<String, Integer> positions = positionsOf(sorted);
            List<TransactionView> views = new ArrayList<>();
            for (Transaction t : shown) {
                views.add(TransactionView.from(t, positions.get(t.getId())));
            }
            return views;
        });
    }

    public TransactionView getTransaction(String walletName, String transactionId) {
        return locked(() -> {
            Wallet wallet = requireWallet(walletName);
            return viewOf(wallet, requireTransaction(wallet, transactionId));
        });
    }

    public TransactionView getTransactionAt(String walletName, int position) {
        return locked(() -> {
            Wallet wallet = requireWallet(walletName);
            Transaction transaction = wallet.getTransactionByPosition(position)
                    .orElseThrow(() -> new TransactionNotFoundException(wallet.getName(), "#" + position));
            return TransactionView.from(transaction, position);
        });
    }

    public String getTransactionDetails(String walletName, String transactionId) {
        return locked(() -> {
            Wallet wallet = requireWallet(walletName);
            return requireTransaction(wallet, transactionId).toDetailedString();
        });
    }

    public TransactionView updateTransaction(String walletName, String transactionId, TransactionRequest request) {
        return locked(() -> {
            Wallet wallet = requireWallet(walletName);
            if (!wallet.updateTransaction(transactionId, request.toEdit())) {
                throw new TransactionNotFoundException(wallet.getName(), transactionId);
            }
            log.info("Updated transaction {} in wallet '{}'", transactionId, wallet.getName());
            return viewOf(wallet, requireTransaction(wallet, transactionId));
        });
    }

    public TransactionView updateTransactionAt(String walletName, int position, TransactionRequest request) {
        return locked(() -> {
            Wallet wallet = requireWallet(walletName);
            Transaction target = wallet.getTransactionByPosition(position)
                    .orElseThrow(() -> new TransactionNotFoundException(wallet.getName(), "#" + position));
            wallet.updateTransaction(target.getId(), request.toEdit());
            log.info("Updated transaction #{} ({}) in wallet '{}'", position, target.getId(), wallet.getName());
            return viewOf(wallet, requireTransaction(wallet, target.getId()));
        });
    }

    public void deleteTransaction(String walletName, String transactionId) {
        locked(() -> {
            Wallet wallet = requireWallet(walletName);
            if (!wallet.deleteTransaction(transactionId)) {
                throw new TransactionNotFoundException(wallet.getName(), transactionId);
            }
            log.info("Deleted transaction {} from wallet '{}'", transactionId, wallet.getName());
        });
    }

    public void deleteTransactionAt(String walletName, int position) {
        locked(() -> {
            Wallet wallet = requireWallet(walletName);
            if (!wallet.deleteTransactionAt(position)) {
                throw new TransactionNotFoundException(wallet.getName(), "#" + position);
            }
            log.info("Deleted transaction #{} from wallet '{}'", position, wallet.getName());
        });
    }

    public void deleteAllTransactions(String walletName) {
        locked(() -> {
            Wallet wallet = requireWallet(walletName);
            int count = wallet.getTransactionCount();
            wallet.deleteAllTransactions();
            log.info("Deleted all {} transaction(s) from wallet '{}'", count, wallet.getName());
        });
    }

    public List<StrategyOption> getTransactionSortingOptions(String walletName) {
        return locked(() -> optionsOf(requireWallet(walletName).getSortingContext()));
    }

    public void setTransactionSorting(String walletName, String key) {
        locked(() -> {
            Wallet wallet = requireWallet(walletName);
            if (!wallet.getSortingContext().setStrategy(key)) {
                throw new LedgerValidationException("Unknown transaction sorting option: " + key);
            }
        });
    }

    // ========== Filters ==========

    public List<FilterView> listFilters(String walletName) {
        return locked(() -> filterViewsOf(requireWallet(walletName).getFilteringContext()));
    }

    public List<FilterView> addFilter(String walletName, FilterRequest request) {
        return locked(() -> {
            Wallet wallet = requireWallet(walletName);
            TransactionFilter filter = buildFilter(request);
            wallet.getFilteringContext().addFilter(filter);
            log.info("Added filter '{}' to wallet '{}'", filter.getName(), wallet.getName());
            return filterViewsOf(wallet.getFilteringContext());
        });
    }

    /**
     * @param index 1-based, as listed by {@link #listFilters(String)}
     */
    public List<FilterView> removeFilter(String walletName, int index) {
        return locked(() -> {
            Wallet wallet = requireWallet(walletName);
            if (!wallet.getFilteringContext().removeFilter(index - 1)) {
                throw new LedgerValidationException("No active filter at position " + index);
            }
            return filterViewsOf(wallet.getFilteringContext());
        });
    }

    public void clearFilters(String walletName) {
        locked(() -> requireWallet(walletName).getFilteringContext().clearFilters());
    }

    TransactionFilter buildFilter(FilterRequest request) {
        if (request.getKind() == null) {
            throw new LedgerValidationException("Filter kind is required");
        }
        String kind = request.getKind().trim().toUpperCase(Locale.ROOT);
        switch (kind) {
            case "DATE":
                if (request.getPreset() != null) {
                    DatePreset preset = DatePreset.fromKey(request.getPreset())
                            .orElseThrow(() -> unknownPreset("date", request.getPreset()));
                    return DateFilter.forPreset(preset, clock);
                }
                if (request.getStartDate() == null && request.getEndDate() == null) {
                    throw new LedgerValidationException("Date filter needs a preset, a start date or an end date");
                }
                return DateFilter.between(request.getStartDate(), request.getEndDate());
            case "TYPE":
                return TypePreset.fromKey(request.getPreset())
                        .orElseThrow(() -> unknownPreset("type", request.getPreset()))
                        .create();
            case "CATEGORY":
                return new CategoryFilter(request.getCategories(), request.isExclude());
            case "AMOUNT":
                if (request.getPreset() != null) {
                    return AmountPreset.fromKey(request.getPreset())
                            .orElseThrow(() -> unknownPreset("amount", request.getPreset()))
                            .create(properties.getLargeAmountThreshold(), properties.getSmallAmountThreshold());
                }
                return AmountFilter.between(request.getMinAmount(), request.getMaxAmount());
            case "DESCRIPTION":
                return new DescriptionFilter(request.getQuery(), request.isCaseSensitive());
            default:
                throw new LedgerValidationException("Unknown filter kind: " + request.getKind());
        }
    }

    private static LedgerValidationException unknownPreset(String kind, String key) {
        return new LedgerValidationException("Unknown " + kind + " preset: " + key);
    }

    public Map<String, Map<String, String>> getFilterPresets() {
        Map<String, Map<String, String>> presets = new LinkedHashMap<>();
        Map<String, String> dates = new LinkedHashMap<>();
        for (DatePreset preset : DatePreset.values()) {
            dates.put(preset.getKey(), preset.getLabel());
        }
        Map<String, String> types = new LinkedHashMap<>();
        for (TypePreset preset : TypePreset.values()) {
            types.put(preset.getKey(), preset.getLabel());
        }
        Map<String, String> amounts = new LinkedHashMap<>();
        for (AmountPreset preset : AmountPreset.values()) {
            amounts.put(preset.getKey(), preset.getLabel());
        }
        presets.put("date", dates);
        presets.put("type", types);
        presets.put("amount", amounts);
        return presets;
    }

    // ========== Summaries and categories ==========

    public PeriodSummary getSummary(String walletName, boolean filtered) {
        return locked(() -> {
            Wallet wallet = requireWallet(walletName);
            FilteringContext filters = wallet.getFilteringContext();
            List<Transaction> shown = filtered ? wallet.getFilteredTransactions() : wallet.getSortedTransactions();

            double income = TransactionStatistics.total(shown, TransactionType.INCOME);
            double expense = TransactionStatistics.total(shown, TransactionType.EXPENSE);
            Map<String, Double> incomeByCategory =
                    TransactionStatistics.totalsByCategory(shown, TransactionType.INCOME);
            Map<String, Double> expenseByCategory =
                    TransactionStatistics.totalsByCategory(shown, TransactionType.EXPENSE);

            return PeriodSummary.builder()
                    .walletName(wallet.getName())
                    .currency(wallet.getCurrency())
                    .filtered(filtered && filters.hasFilters())
                    .filterSummary(filtered && filters.hasFilters() ? filters.getFilterSummary() : null)
                    .transactionCount(shown.size())
                    .totalTransactionCount(wallet.getTransactionCount())
                    .totalIncome(income)
                    .totalExpense(expense)
                    .balance(TransactionStatistics.balance(shown))
                    .overallBalance(wallet.getBalance())
                    .incomeByCategory(incomeByCategory)
                    .expenseByCategory(expenseByCategory)
                    .incomePercentages(TransactionStatistics.percentages(incomeByCategory, income))
                    .expensePercentages(TransactionStatistics.percentages(expenseByCategory, expense))
                    .build();
        });
    }

    public Map<TransactionType, Set<String>> getCategories() {
        return locked(() -> {
            CategoryManager categories = walletManager.getCategoryManager();
            Map<TransactionType, Set<String>> result = new EnumMap<>(TransactionType.class);
            for (TransactionType type : TransactionType.values()) {
                result.put(type, categories.getCategories(type));
            }
            return result;
        });
    }

    public void addCategory(String category, TransactionType type) {
        if (category == null || category.isBlank()) {
            throw new LedgerValidationException("Category name must not be empty");
        }
        if (type == null) {
            throw new LedgerValidationException("Category type is required");
        }
        locked(() -> walletManager.getCategoryManager().addCategory(category.trim(), type));
    }

    // ========== Transfers ==========

    /**
     * @return the updated source and target wallets, in that order
     */
    public List<WalletSummary> transfer(TransferRequest request) {
        return locked(() -> {
            Wallet source = requireWallet(request.getFromWallet());
            Wallet target = requireWallet(request.getToWallet());
            if (source == target) {
                throw new InvalidTransferException("Cannot transfer to the same wallet");
            }
            if (request.getAmount() == null || !(request.getAmount() > 0)) {
                throw new InvalidTransferException("Transfer amount must be positive");
            }
            LocalDateTime createdAt = request.getCreatedAt() == null ? LocalDateTime.now(clock)
                    : request.getCreatedAt();
            boolean done = walletManager.transfer(source.getName(), target.getName(), request.getAmount(),
                    request.getDescription(), createdAt);
            if (!done) {
                throw new InvalidTransferException("Transfer from '" + source.getName() + "' to '"
                        + target.getName() + "' was rejected");
            }
            return List.of(summarize(source), summarize(target));
        });
    }

    // ========== Helpers ==========

    private Wallet requireWallet(String name) {
        return walletManager.getWallet(name).orElseThrow(() -> new WalletNotFoundException(name));
    }

    private static Transaction requireTransaction(Wallet wallet, String transactionId) {
        return wallet.getTransactionById(transactionId)
                .orElseThrow(() -> new TransactionNotFoundException(wallet.getName(), transactionId));
    }

    private WalletSummary summarize(Wallet wallet) {
        return new WalletSummary(wallet, wallet == walletManager.getCurrentWallet());
    }

    private static TransactionView viewOf(Wallet wallet, Transaction transaction) {
        Integer position = positionsOf(wallet.getSortedTransactions()).get(transaction.getId());
        return TransactionView.from(transaction, position == null ? 0 : position);
    }

    private static Map<String, Integer> positionsOf(List<Transaction> sorted) {
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < sorted.size(); i++) {
            positions.put(sorted.get(i).getId(), i + 1);
        }
        return positions;
    }

    private static <T> List<StrategyOption> optionsOf(SortingContext<T> context) {
        String active = context.getCurrentStrategy().getKey();
        List<StrategyOption> options = new ArrayList<>();
        context.getAvailableStrategies()
                .forEach((key, name) -> options.add(new StrategyOption(key, name, key.equals(active))));
        return options;
    }

    private static List<FilterView> filterViewsOf(FilteringContext context) {
        List<FilterView> views = new ArrayList<>();
        List<TransactionFilter> active = context.getActiveFilters();
        for (int i = 0; i < active.size(); i++) {
            views.add(new FilterView(i + 1, active.get(i).getName(), active.get(i).getDescription()));
        }
        return views;
    }
}
