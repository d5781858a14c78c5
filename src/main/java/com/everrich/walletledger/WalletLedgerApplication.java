package com.everrich.walletledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WalletLedgerApplication {

	public static void main(String[] args) {
		SpringApplication.run(WalletLedgerApplication.class, args);
	}

}
