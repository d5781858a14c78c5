package com.everrich.walletledger.dto;

import java.time.LocalDateTime;

import com.everrich.walletledger.entities.TransactionEdit;
import com.everrich.walletledger.entities.TransactionType;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class TransactionRequest {

    private Double amount;
    private TransactionType type;
    private String category;
    private String description;

    private LocalDateTime createdAt;

    public TransactionEdit toEdit() {
        return TransactionEdit.builder()
                .amount(amount)
                .type(type)
                .category(category)
                .description(description)
                .createdAt(createdAt)
                .build();
    }
}
