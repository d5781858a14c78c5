package com.everrich.walletledger.entities;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.UUID;

import com.everrich.walletledger.exception.LedgerValidationException;

/**
 * A single monetary movement inside one wallet.
 *
 * The amount is always a positive magnitude; the sign comes from the
 * {@link TransactionType}. Edits replace the record wholesale and keep the id.
 */
public class Transaction {

    public static final String TRANSFER_CATEGORY = "Transfer";

    private static final DateTimeFormatter DETAIL_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final String id;
    private final TransactionType type;
    private final String category;
    private double amount;
    private String description;
    private LocalDateTime createdAt;

    public Transaction(double amount, TransactionType type, String category, String description,
            LocalDateTime createdAt) {
        this(generateId(), amount, type, category, description, createdAt);
    }

    protected Transaction(String id, double amount, TransactionType type, String category, String description,
            LocalDateTime createdAt) {
        validateAmount(amount);
        if (type == null) {
            throw new LedgerValidationException("Transaction type is required");
        }
        if (category == null || category.isBlank()) {
            throw new LedgerValidationException("Transaction category is required");
        }
        if (TRANSFER_CATEGORY.equalsIgnoreCase(category.trim()) && !(this instanceof Transfer)) {
            throw new LedgerValidationException("Category '" + TRANSFER_CATEGORY + "' is reserved for transfers");
        }
        this.id = id;
        this.amount = amount;
        this.type = type;
        this.category = category.trim();
        this.description = description == null ? "" : description;
        this.createdAt = createdAt == null ? LocalDateTime.now() : createdAt;
    }

    static String generateId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    static void validateAmount(double amount) {
        if (!(amount > 0) || Double.isInfinite(amount)) {
            throw new LedgerValidationException("Amount must be positive, got " + amount);
        }
    }

    /**
     * Builds the replacement record for an edit. The id is preserved.
     */
    public Transaction withChanges(TransactionEdit edit) {
        return new Transaction(
                id,
                edit.getAmount() != null ? edit.getAmount() : amount,
                edit.getType() != null ? edit.getType() : type,
                edit.getCategory() != null ? edit.getCategory() : category,
                edit.getDescription() != null ? edit.getDescription() : description,
                edit.getCreatedAt() != null ? edit.getCreatedAt() : createdAt);
    }

    public double getSignedAmount() {
        return type == TransactionType.EXPENSE ? -Math.abs(amount) : Math.abs(amount);
    }

    public boolean isTransferCategory() {
        return TRANSFER_CATEGORY.equals(category);
    }

    public String getId() {
        return id;
    }

    public double getAmount() {
        return amount;
    }

    public TransactionType getType() {
        return type;
    }

    public String getCategory() {
        return category;
    }

    public String getDescription() {
        return description;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    // Only a synchronized transfer update mutates a record in place.
    void applyAmount(double amount) {
        this.amount = amount;
    }

    void applyDescription(String description) {
        this.description = description;
    }

    void applyCreatedAt(LocalDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public String toDetailedString() {
        return "ID: " + id + "\n"
                + "Type: " + type.getSymbol() + " (" + type.getLabel() + ")\n"
                + "Amount: " + type.getSymbol() + formatAmount(amount) + "\n"
                + "Category: " + category + "\n"
                + "Description: " + (description.isEmpty() ? "N/A" : description) + "\n"
                + "Date: " + createdAt.format(DETAIL_FORMAT);
    }

    @Override
    public String toString() {
        return category + " - " + type.getSymbol() + formatAmount(amount);
    }

    private static String formatAmount(double value) {
        return String.format(Locale.ROOT, "%.2f", Math.abs(value));
    }
}
