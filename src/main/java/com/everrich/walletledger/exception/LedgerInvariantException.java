package com.everrich.walletledger.exception;

/**
 * Signals that the transfer linking invariant was broken somewhere else,
 * e.g. a linked transfer whose partner no longer exists. Not a user error.
 */
public class LedgerInvariantException extends IllegalStateException {
    public LedgerInvariantException(String message) {
        super(message);
    }
}
