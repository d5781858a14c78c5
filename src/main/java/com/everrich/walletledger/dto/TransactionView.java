package com.everrich.walletledger.dto;

import java.time.LocalDateTime;

import com.everrich.walletledger.entities.Transaction;
import com.everrich.walletledger.entities.TransactionType;
import com.everrich.walletledger.entities.Transfer;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A transaction as shown to callers, with its 1-based position in the view it came from.
 */
@Getter
@AllArgsConstructor
public class TransactionView {

    private final int position;
    private final String id;
    private final TransactionType type;
    private final double amount;
    private final double signedAmount;
    private final String category;
    private final String description;
    private final LocalDateTime createdAt;
    private final boolean transfer;
    private final String connectedWalletId;
    private final String connectedId;

    public static TransactionView from(Transaction t, int position) {
        Transfer transfer = t instanceof Transfer ? (Transfer) t : null;
        return new TransactionView(
                position,
                t.getId(),
                t.getType(),
                t.getAmount(),
                t.getSignedAmount(),
                t.getCategory(),
                t.getDescription(),
                t.getCreatedAt(),
                transfer != null,
                transfer != null ? transfer.getConnectedWalletId() : null,
                transfer != null ? transfer.getConnectedId() : null);
    }
}
