package com.bulut;

import com.bulut.config.BulutProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main application class for Bulut.
 *
 * Bulut resolves human-readable wallet aliases to addresses and executes
 * signature-authorized payment intents against a settlement rail, while
 * keeping an append-only ledger of what was executed. Intent parsing,
 * custody and settlement itself are delegated to external services.
 */
@SpringBootApplication
@EnableConfigurationProperties(BulutProperties.class)
public class BulutApplication {

    public static void main(String[] args) {
        SpringApplication.run(BulutApplication.class, args);
    }
}
