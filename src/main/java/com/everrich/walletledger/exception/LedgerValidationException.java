package com.everrich.walletledger.exception;

/**
 * Raised when input cannot be accepted into the ledger: non-positive amounts,
 * blank or duplicate wallet names, bad deposit terms, malformed filters.
 */
public class LedgerValidationException extends RuntimeException {
    public LedgerValidationException(String message) {
        super(message);
    }
}
