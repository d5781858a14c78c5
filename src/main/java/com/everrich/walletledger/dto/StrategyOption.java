package com.everrich.walletledger.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class StrategyOption {

    private final String key;
    private final String name;
    private final boolean active;
}
