package com.ayni.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Ayni Donation Ledger API Application
 *
 * Escrowed peer-to-peer donations with reputation aggregation.
 */
@SpringBootApplication(scanBasePackages = "com.ayni")
@EntityScan(basePackages = "com.ayni.core.domain")
@EnableJpaRepositories(basePackages = "com.ayni.core.repository")
public class AyniApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(AyniApiApplication.class, args);
    }
}
