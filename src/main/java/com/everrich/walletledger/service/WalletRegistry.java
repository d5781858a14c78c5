package com.everrich.walletledger.service;

import java.util.Optional;

import com.everrich.walletledger.entities.Wallet;

/**
 * Resolves a wallet by id. Transfers only remember ids, so a wallet uses this
 * to reach the partner side of a transfer.
 */
public interface WalletRegistry {

    Optional<Wallet> findWalletById(String walletId);
}
