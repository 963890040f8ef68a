package com.ledgerbook.backup;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class LedgerBackupApplication {

    public static void main(String[] args) {
        SpringApplication.run(LedgerBackupApplication.class, args);
    }
}
