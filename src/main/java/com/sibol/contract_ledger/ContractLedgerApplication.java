package com.sibol.contract_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ContractLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContractLedgerApplication.class, args);
    }
}
