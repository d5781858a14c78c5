package com.everrich.walletledger.config;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.everrich.walletledger.service.CategoryManager;
import com.everrich.walletledger.service.WalletManager;

@Configuration
public class LedgerConfig {

    private static final Logger log = LoggerFactory.getLogger(LedgerConfig.class);

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock ledgerClock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public WalletManager walletManager() {
        WalletManager walletManager = new WalletManager(new CategoryManager());
        log.info("WalletManager created with an empty ledger");
        return walletManager;
    }
}
