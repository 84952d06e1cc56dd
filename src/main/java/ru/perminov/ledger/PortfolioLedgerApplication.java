package ru.perminov.ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PortfolioLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PortfolioLedgerApplication.class, args);
    }
}
