package com.everrich.walletledger.dto;

import java.time.LocalDateTime;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class TransferRequest {

    private String fromWallet;
    private String toWallet;
    private Double amount;
    private String description;
    private LocalDateTime createdAt;
}
