package com.everrich.walletledger.dto;

import com.everrich.walletledger.entities.WalletType;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Payload for creating a wallet. Interest rate and term belong to deposit wallets only.
 */
@Getter
@Setter
@NoArgsConstructor
public class WalletRequest {

    private String name;
    private WalletType walletType = WalletType.REGULAR;
    private String currency;
    private String description;
    private Double startingBalance;

    private Double interestRate;
    private Integer termMonths;
    private Boolean capitalization;
}
