package com.purchasingpower.uicatalog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class UiCatalogApplication {

    public static void main(String[] args) {
        SpringApplication.run(UiCatalogApplication.class, args);
    }
}
