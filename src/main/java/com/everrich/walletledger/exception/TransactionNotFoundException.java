package com.everrich.walletledger.exception;

public class TransactionNotFoundException extends RuntimeException {
    public TransactionNotFoundException(String walletName, String reference) {
        super("Transaction " + reference + " not found in wallet " + walletName);
    }
}
