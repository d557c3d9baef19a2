package com.ledgerimport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LedgerImportApplication {

    public static void main(String[] args) {
        SpringApplication.run(LedgerImportApplication.class, args);
    }
}
