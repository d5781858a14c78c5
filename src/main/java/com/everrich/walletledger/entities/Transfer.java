package com.everrich.walletledger.entities;

import java.time.LocalDateTime;

/**
 * One side of a money movement between two wallets.
 *
 * Both links are held by id only: {@code walletId} names the wallet that stores this side,
 * {@code connectedWalletId}/{@code connectedId} name the paired record on the other wallet.
 * Either both sides point at each other or both links are cleared.
 */
public class Transfer extends Transaction {

    private final String walletId;
    private String connectedWalletId;
    private String connectedId;

    public Transfer(double amount, TransactionType type, String description, LocalDateTime createdAt,
            String walletId) {
        super(amount, type, TRANSFER_CATEGORY, description, createdAt);
        this.walletId = walletId;
    }

    /**
     * Cross-links two freshly created transfer sides.
     */
    public static void link(Transfer outgoing, Transfer incoming) {
        outgoing.connectedWalletId = incoming.walletId;
        outgoing.connectedId = incoming.getId();
        incoming.connectedWalletId = outgoing.walletId;
        incoming.connectedId = outgoing.getId();
    }

    /**
     * Applies amount, description and date to this side and to {@code connected}.
     * Category and direction stay fixed on both sides.
     *
     * @return false if {@code connected} is missing or is not linked back to this record
     */
    public boolean update(TransactionEdit edit, Transfer connected) {
        if (connected == null || !isLinkedTo(connected)) {
            return false;
        }
        if (edit.getAmount() != null) {
            validateAmount(edit.getAmount());
            applyAmount(edit.getAmount());
            connected.applyAmount(edit.getAmount());
        }
        if (edit.getDescription() != null) {
            applyDescription(edit.getDescription());
            connected.applyDescription(edit.getDescription());
        }
        if (edit.getCreatedAt() != null) {
            applyCreatedAt(edit.getCreatedAt());
            connected.applyCreatedAt(edit.getCreatedAt());
        }
        return true;
    }

    public boolean isLinkedTo(Transfer other) {
        return getId().equals(other.connectedId) && other.getId().equals(connectedId)
                && walletId.equals(other.connectedWalletId) && other.walletId.equals(connectedWalletId);
    }

    public boolean isDetached() {
        return connectedId == null;
    }

    public void detach() {
        connectedWalletId = null;
        connectedId = null;
    }

    /**
     * Transfers are edited in place through {@link #update(TransactionEdit, Transfer)}.
     */
    @Override
    public Transaction withChanges(TransactionEdit edit) {
        throw new UnsupportedOperationException("Transfers are updated together with their connected side");
    }

    public String getWalletId() {
        return walletId;
    }

    public String getConnectedWalletId() {
        return connectedWalletId;
    }

    public String getConnectedId() {
        return connectedId;
    }

    @Override
    public String toDetailedString() {
        return super.toDetailedString() + "\n"
                + "Linked: " + (isDetached() ? "N/A" : connectedId + " @ wallet " + connectedWalletId);
    }
}
