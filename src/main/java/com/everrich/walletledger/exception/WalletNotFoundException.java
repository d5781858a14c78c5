package com.everrich.walletledger.exception;

public class WalletNotFoundException extends RuntimeException {
    public WalletNotFoundException(String walletName) {
        super("Wallet not found: " + walletName);
    }
}
