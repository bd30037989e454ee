package com.flagship.creator_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CreatorLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CreatorLedgerApplication.class, args);
    }
}
