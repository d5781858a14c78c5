package com.everrich.walletledger.dto;

import java.time.LocalDate;
import java.util.List;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Describes one filter to add to a wallet's view.
 *
 * kind: DATE (preset key, or startDate/endDate), TYPE (preset key), CATEGORY (categories, exclude),
 * AMOUNT (preset key, or minAmount/maxAmount), DESCRIPTION (query, caseSensitive).
 */
@Getter
@Setter
@NoArgsConstructor
public class FilterRequest {

    private String kind;
    private String preset;

    private LocalDate startDate;
    private LocalDate endDate;

    private List<String> categories;
    private boolean exclude;

    private Double minAmount;
    private Double maxAmount;

    private String query;
    private boolean caseSensitive;
}
