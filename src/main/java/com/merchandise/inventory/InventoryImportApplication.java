package com.merchandise.inventory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot Application
 */
@SpringBootApplication
public class InventoryImportApplication {

    public static void main(String[] args) {
        SpringApplication.run(InventoryImportApplication.class, args);
    }
}
