package com.everrich.walletledger.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class FilterView {

    // 1-based, as accepted by the remove endpoint
    private final int index;
    private final String name;
    private final String description;
}
