package com.everrich.walletledger.dto;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Partial wallet update; null fields are left unchanged.
 */
@Getter
@Setter
@NoArgsConstructor
public class WalletUpdateRequest {

    private String name;
    private String currency;
    private String description;

    private Double interestRate;
    private Integer termMonths;
    private Boolean capitalization;

    public boolean hasDepositFields() {
        return interestRate != null || termMonths != null || capitalization != null;
    }
}
