package com.foliovault;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FolioVaultApplication {

    public static void main(String[] args) {
        SpringApplication.run(FolioVaultApplication.class, args);
    }
}
