package com.everrich.walletledger.entities;

import java.time.LocalDateTime;

import lombok.Builder;
import lombok.Getter;

/**
 * New values for an existing transaction. A null field keeps the current value.
 * Type and category are ignored when the edit is applied to a {@link Transfer}.
 */
@Getter
@Builder
public class TransactionEdit {

    private final Double amount;
    private final TransactionType type;
    private final String category;
    private final String description;
    private final LocalDateTime createdAt;

    public boolean touchesTransferLockedFields() {
        return type != null || category != null;
    }
}
