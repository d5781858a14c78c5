package com.everrich.walletledger.dto;

import java.time.LocalDate;

import com.everrich.walletledger.entities.DepositWallet;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class DepositSummary {

    private final double principal;
    private final double interestRate;
    private final int termMonths;
    private final boolean capitalization;
    private final LocalDate maturityDate;
    private final boolean matured;
    private final long daysUntilMaturity;
    private final int monthsElapsed;
    private final double accruedInterest;
    private final double totalInterest;
    private final double maturityAmount;

    public static DepositSummary from(DepositWallet wallet) {
        return DepositSummary.builder()
                .principal(wallet.getPrincipal())
                .interestRate(wallet.getInterestRate())
                .termMonths(wallet.getTermMonths())
                .capitalization(wallet.isCapitalization())
                .maturityDate(wallet.getMaturityDate())
                .matured(wallet.isMatured())
                .daysUntilMaturity(wallet.getDaysUntilMaturity())
                .monthsElapsed(wallet.getMonthsElapsed())
                .accruedInterest(wallet.calculateAccruedInterest())
                .totalInterest(wallet.calculateTotalInterest())
                .maturityAmount(wallet.calculateMaturityAmount())
                .build();
    }
}
