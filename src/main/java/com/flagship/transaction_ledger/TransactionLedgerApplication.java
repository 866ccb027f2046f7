package com.flagship.transaction_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TransactionLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TransactionLedgerApplication.class, args);
    }
}
