package com.everrich.walletledger.dto;

import java.time.LocalDateTime;

import com.everrich.walletledger.entities.DepositWallet;
import com.everrich.walletledger.entities.Wallet;
import com.everrich.walletledger.entities.WalletType;

/**
 * DTO representing the balance summary for a wallet.
 * Deposit wallets additionally carry their interest figures.
 */
public class WalletSummary {

    private String id;
    private String name;
    private WalletType type;
    private String currency;
    private String description;
    private LocalDateTime createdAt;
    private double totalIncome;
    private double totalExpense;
    private double balance;
    private int transactionCount;
    private boolean current;
    private DepositSummary deposit;

    public WalletSummary() {
    }

    public WalletSummary(Wallet wallet, boolean current) {
        this.id = wallet.getId();
        this.name = wallet.getName();
        this.type = wallet.getType();
        this.currency = wallet.getCurrency();
        this.description = wallet.getDescription();
        this.createdAt = wallet.getCreatedAt();
        this.totalIncome = wallet.getTotalIncome();
        this.totalExpense = wallet.getTotalExpense();
        this.balance = wallet.getBalance();
        this.transactionCount = wallet.getTransactionCount();
        this.current = current;
        if (wallet instanceof DepositWallet) {
            this.deposit = DepositSummary.from((DepositWallet) wallet);
        }
    }

    // Getters and Setters

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public WalletType getType() {
        return type;
    }

    public void setType(WalletType type) {
        this.type = type;
    }

    public String getCurrency() {
        return currency;
    }

    public void setCurrency(String currency) {
        this.currency = currency;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(LocalDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public double getTotalIncome() {
        return totalIncome;
    }

    public void setTotalIncome(double totalIncome) {
        this.totalIncome = totalIncome;
    }

    public double getTotalExpense() {
        return totalExpense;
    }

    public void setTotalExpense(double totalExpense) {
        this.totalExpense = totalExpense;
    }

    public double getBalance() {
        return balance;
    }

    public void setBalance(double balance) {
        this.balance = balance;
    }

    public int getTransactionCount() {
        return transactionCount;
    }

    public void setTransactionCount(int transactionCount) {
        this.transactionCount = transactionCount;
    }

    public boolean isCurrent() {
        return current;
    }

    public void setCurrent(boolean current) {
        this.current = current;
    }

    public DepositSummary getDeposit() {
        return deposit;
    }

    public void setDeposit(DepositSummary deposit) {
        this.deposit = deposit;
    }

    @Override
    public String toString() {
        return "WalletSummary{" +
                "name='" + name + '\'' +
                ", type=" + type +
                ", balance=" + balance +
                ", transactionCount=" + transactionCount +
                '}';
    }
}
