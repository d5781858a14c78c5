package com.everrich.walletledger.service;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.everrich.walletledger.entities.TransactionType;
import com.everrich.walletledger.entities.Transfer;
import com.everrich.walletledger.entities.Wallet;
import com.everrich.walletledger.exception.LedgerValidationException;
import com.everrich.walletledger.sorting.SortingContext;

/**
 * Owns all wallets, the current-wallet cursor and the shared {@link CategoryManager},
 * and creates linked transfers between wallets.
 *
 * Not thread-safe; concurrent callers must serialize access (see {@link LedgerService}).
 */
public class WalletManager implements WalletRegistry {

    private static final Logger log = LoggerFactory.getLogger(WalletManager.class);

    // lowercased name -> wallet
    private final Map<String, Wallet> wallets = new LinkedHashMap<>();
    private final CategoryManager categoryManager;
    private final SortingContext<Wallet> sortingContext = SortingContext.forWallets();
    private Wallet currentWallet;

    public WalletManager() {
        this(new CategoryManager());
    }

    public WalletManager(CategoryManager categoryManager) {
        this.categoryManager = categoryManager;
    }

    /**
     * Attaches the wallet to this manager and books its starting balance.
     * The first wallet added becomes the current wallet.
     */
    public void addWallet(Wallet wallet) {
        String key = keyOf(wallet.getName());
        if (wallets.containsKey(key)) {
            throw new LedgerValidationException("Wallet '" + wallet.getName() + "' already exists");
        }
        wallet.attach(categoryManager, this);
        wallets.put(key, wallet);
        if (currentWallet == null) {
            currentWallet = wallet;
        }
        log.info("Added {} wallet '{}' ({})", wallet.getType(), wallet.getName(), wallet.getId());
    }

    public Optional<Wallet> getWallet(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(wallets.get(keyOf(name)));
    }

    @Override
    public Optional<Wallet> findWalletById(String walletId) {
        return wallets.values().stream()
                .filter(w -> w.getId().equals(walletId))
                .findFirst();
    }

    public Collection<Wallet> getWallets() {
        return Collections.unmodifiableCollection(wallets.values());
    }

    public List<Wallet> getSortedWallets() {
        return sortingContext.sort(wallets.values());
    }

    public int getWalletCount() {
        return wallets.size();
    }

    public Wallet getCurrentWallet() {
        return currentWallet;
    }

    public boolean switchWallet(String name) {
        Optional<Wallet> wallet = getWallet(name);
        wallet.ifPresent(w -> currentWallet = w);
        return wallet.isPresent();
    }

    /**
     * Deletes every transaction of the wallet first, which also removes transfer partners
     * from other wallets, then drops the wallet. If it was current, another remaining wallet
     * (or none) becomes current.
     */
    public boolean removeWallet(String name) {
        Optional<Wallet> found = getWallet(name);
        if (found.isEmpty()) {
            return false;
        }
        Wallet wallet = found.get();
        int count = wallet.getTransactionCount();
        wallet.deleteAllTransactions();
        wallets.remove(keyOf(wallet.getName()));

        if (currentWallet == wallet) {
            currentWallet = wallets.isEmpty() ? null : wallets.values().iterator().next();
        }
        log.info("Removed wallet '{}' and its {} transaction(s)", wallet.getName(), count);
        return true;
    }

    /**
     * Null arguments leave the field unchanged.
     *
     * @return false if no wallet has {@code oldName}
     */
    public boolean updateWallet(String oldName, String newName, String currency, String description) {
        Optional<Wallet> found = getWallet(oldName);
        if (found.isEmpty()) {
            return false;
        }
        Wallet wallet = found.get();
        if (newName != null && !newName.equals(wallet.getName())) {
            if (newName.isBlank()) {
                throw new LedgerValidationException("Wallet name must not be empty");
            }
            String newKey = keyOf(newName);
            Wallet existing = wallets.get(newKey);
            if (existing != null && existing != wallet) {
                throw new LedgerValidationException("Wallet '" + newName + "' already exists");
            }
            wallets.remove(keyOf(wallet.getName()));
            wallet.setName(newName);
            wallets.put(newKey, wallet);
        }
        if (currency != null && !currency.isBlank()) {
            wallet.setCurrency(currency);
        }
        if (description != null) {
            wallet.setDescription(description);
        }
        log.info("Updated wallet '{}'", wallet.getName());
        return true;
    }

    /**
     * Books an expense transfer on the source wallet and an income transfer on the target,
     * linked to each other. Either both sides end up stored or neither does.
     *
     * @return false if a wallet is unknown, both names refer to the same wallet, or the amount
     *         is not positive
     */
    public boolean transfer(String fromWalletName, String toWalletName, double amount, String description,
            LocalDateTime createdAt) {
        Optional<Wallet> from = getWallet(fromWalletName);
        Optional<Wallet> to = getWallet(toWalletName);
        if (from.isEmpty() || to.isEmpty()) {
            log.warn("Transfer rejected: unknown wallet ({} -> {})", fromWalletName, toWalletName);
            return false;
        }
        if (from.get() == to.get()) {
            log.warn("Transfer rejected: source and target are the same wallet '{}'", fromWalletName);
            return false;
        }
        if (!(amount > 0) || Double.isInfinite(amount)) {
            log.warn("Transfer rejected: amount must be positive, got {}", amount);
            return false;
        }
        Wallet source = from.get();
        Wallet target = to.get();
        LocalDateTime when = createdAt == null ? LocalDateTime.now() : createdAt;

        Transfer outgoing = new Transfer(amount, TransactionType.EXPENSE, description, when, source.getId());
        Transfer incoming = new Transfer(amount, TransactionType.INCOME, description, when, target.getId());
        Transfer.link(outgoing, incoming);

        source.addTransaction(outgoing);
        try {
            target.addTransaction(incoming);
        } catch (RuntimeException e) {
            log.error("Rolling back transfer {} from '{}' after failure on '{}'",
                    outgoing.getId(), source.getName(), target.getName(), e);
            source.deleteTransaction(outgoing.getId(), false);
            outgoing.detach();
            incoming.detach();
            throw e;
        }
        log.info("Transferred {} from '{}' to '{}' ({} / {})",
                amount, source.getName(), target.getName(), outgoing.getId(), incoming.getId());
        return true;
    }

    public CategoryManager getCategoryManager() {
        return categoryManager;
    }

    public SortingContext<Wallet> getSortingContext() {
        return sortingContext;
    }

    private static String keyOf(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
