package com.everrich.walletledger.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Ledger settings. These can be customized in application.properties.
 */
@Component
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    /**
     * Currency used when a wallet is created without one.
     * Default: USD
     */
    private String defaultCurrency = "USD";

    /**
     * Lower bound (inclusive) of the "large amounts" filter preset.
     * Default: 1000
     */
    private double largeAmountThreshold = 1000.0;

    /**
     * Upper bound (inclusive) of the "small amounts" filter preset.
     * Default: 100
     */
    private double smallAmountThreshold = 100.0;

    /**
     * Category of the transaction booked for a wallet's starting balance.
     * Default: Initial Balance
     */
    private String startingBalanceCategory = "Initial Balance";

    public String getDefaultCurrency() {
        return defaultCurrency;
    }

    public void setDefaultCurrency(String defaultCurrency) {
        this.defaultCurrency = defaultCurrency;
    }

    public double getLargeAmountThreshold() {
        return largeAmountThreshold;
    }

    public void setLargeAmountThreshold(double largeAmountThreshold) {
        this.largeAmountThreshold = largeAmountThreshold;
    }

    public double getSmallAmountThreshold() {
        return smallAmountThreshold;
    }

    public void setSmallAmountThreshold(double smallAmountThreshold) {
        this.smallAmountThreshold = smallAmountThreshold;
    }

    public String getStartingBalanceCategory() {
        return startingBalanceCategory;
    }

    public void setStartingBalanceCategory(String startingBalanceCategory) {
        this.startingBalanceCategory = startingBalanceCategory;
    }
}
