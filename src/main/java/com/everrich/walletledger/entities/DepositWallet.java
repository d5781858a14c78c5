package com.everrich.walletledger.entities;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

import com.everrich.walletledger.exception.LedgerValidationException;
import com.everrich.walletledger.service.DateUtils;

/**
 * A fixed-term deposit. Interest accrues monthly on the principal, either compounded
 * (capitalization) or simple. All interest math is plain floating point; rounding is left
 * to whoever displays the numbers.
 */
public class DepositWallet extends Wallet {

    private double interestRate;
    private int termMonths;
    private boolean capitalization;
    private LocalDate maturityDate;
    private final Clock clock;

    public DepositWallet(String name, String currency, String description, double initialDeposit,
            Double interestRate, Integer termMonths, boolean capitalization, Clock clock) {
        this(name, currency, description, initialDeposit, interestRate, termMonths, capitalization,
                LocalDateTime.now(clock), clock);
    }

    public DepositWallet(String name, String currency, String description, double initialDeposit,
            Double interestRate, Integer termMonths, boolean capitalization, LocalDateTime createdAt, Clock clock) {
        super(name, currency, description, initialDeposit, createdAt);
        this.interestRate = requireInterestRate(interestRate);
        this.termMonths = requireTermMonths(termMonths);
        this.capitalization = capitalization;
        this.clock = clock;
        this.maturityDate = DateUtils.addMonthsClamped(getCreatedAt().toLocalDate(), this.termMonths);
    }

    @Override
    public WalletType getType() {
        return WalletType.DEPOSIT;
    }

    /**
     * Everything ever deposited; later inflows are not separated out.
     */
    public double getPrincipal() {
        return getTotalIncome();
    }

    public double getMonthlyRate() {
        return interestRate / 12 / 100;
    }

    /**
     * Completed months between creation and today, capped at maturity. A partially elapsed
     * month does not count.
     */
    public int getMonthsElapsed() {
        LocalDate today = LocalDate.now(clock);
        LocalDate end = today.isAfter(maturityDate) ? maturityDate : today;
        return DateUtils.wholeMonthsBetween(getCreatedAt().toLocalDate(), end);
    }

    public double calculateAccruedInterest() {
        return interestFor(getMonthsElapsed());
    }

    public double calculateTotalInterest() {
        return interestFor(termMonths);
    }

    public double calculateMaturityAmount() {
        return getPrincipal() + calculateTotalInterest();
    }

    private double interestFor(int months) {
        double principal = getPrincipal();
        double monthlyRate = getMonthlyRate();
        if (capitalization) {
            return principal * Math.pow(1 + monthlyRate, months) - principal;
        }
        return principal * monthlyRate * months;
    }

    public boolean isMatured() {
        return !LocalDate.now(clock).isBefore(maturityDate);
    }

    public long getDaysUntilMaturity() {
        if (isMatured()) {
            return 0;
        }
        return ChronoUnit.DAYS.between(LocalDate.now(clock), maturityDate);
    }

    public double getInterestRate() {
        return interestRate;
    }

    public void setInterestRate(Double interestRate) {
        this.interestRate = requireInterestRate(interestRate);
    }

    public int getTermMonths() {
        return termMonths;
    }

    /**
     * Changing the term moves the maturity date; the creation date stays the anchor.
     */
    public void setTermMonths(Integer termMonths) {
        this.termMonths = requireTermMonths(termMonths);
        this.maturityDate = DateUtils.addMonthsClamped(getCreatedAt().toLocalDate(), this.termMonths);
    }

    public boolean isCapitalization() {
        return capitalization;
    }

    public void setCapitalization(boolean capitalization) {
        this.capitalization = capitalization;
    }

    public LocalDate getMaturityDate() {
        return maturityDate;
    }

    private static double requireInterestRate(Double interestRate) {
        if (interestRate == null) {
            throw new LedgerValidationException("Interest rate is required for deposit wallets");
        }
        if (interestRate.isNaN() || interestRate < 0 || interestRate > 100) {
            throw new LedgerValidationException("Interest rate must be between 0 and 100, got " + interestRate);
        }
        return interestRate;
    }

    private static int requireTermMonths(Integer termMonths) {
        if (termMonths == null || termMonths < 1) {
            throw new LedgerValidationException("Deposit term must be at least one month, got " + termMonths);
        }
        return termMonths;
    }
}
