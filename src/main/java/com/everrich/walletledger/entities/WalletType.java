package com.everrich.walletledger.entities;

public enum WalletType {
    REGULAR,
    DEPOSIT
}
