package com.everrich.walletledger.dto;

import java.util.Map;

import lombok.Builder;
import lombok.Getter;

/**
 * Totals and category breakdown over a wallet's view, filtered or not.
 * {@code overallBalance} is always the balance of the whole wallet.
 */
@Getter
@Builder
public class PeriodSummary {

    private final String walletName;
    private final String currency;
    private final boolean filtered;
    private final String filterSummary;
    private final int transactionCount;
    private final int totalTransactionCount;
    private final double totalIncome;
    private final double totalExpense;
    private final double balance;
    private final double overallBalance;
    private final Map<String, Double> incomeByCategory;
    private final Map<String, Double> expenseByCategory;
    private final Map<String, Double> incomePercentages;
    private final Map<String, Double> expensePercentages;
}
