package com.bulut.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Externalized configuration under the {@code bulut} prefix.
 */
@ConfigurationProperties(prefix = "bulut")
@Data
public class BulutProperties {

    private Domain domain = new Domain();
    private Store store = new Store();
    private Ledger ledger = new Ledger();
    private Alias alias = new Alias();
    private Dispatch dispatch = new Dispatch();
    private Rail rail = new Rail();
    private Parser parser = new Parser();

    /**
     * EIP-712 domain every client signature is bound to.
     */
    @Data
    public static class Domain {
        private String name = "Bulut";
        private String version = "1";
        /**
         * Arc mainnet: 4224
         */
        private Long chainId = 4224L;
        private String verifyingContract = "0x000000000000000000000000000000000000b017";
    }

    @Data
    public static class Store {
        /**
         * jpa or memory
         */
        private String type = "jpa";
    }

    @Data
    public static class Ledger {
        private int defaultPageSize = 50;
        private int maxPageSize = 100;
    }

    @Data
    public static class Alias {
        private int searchDefaultLimit = 10;
        private int searchMaxLimit = 50;
    }

    @Data
    public static class Dispatch {
        /**
         * Allowed distance of the split share total from 100, in percentage points.
         */
        private BigDecimal splitTolerance = new BigDecimal("0.01");
        private double minConfidence = 0.5;
        private Duration railTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Rail {
        /**
         * simulated or circle
         */
        private String mode = "simulated";
        private String explorerUrl = "https://explorer.arc.network";
        private Circle circle = new Circle();
    }

    @Data
    public static class Circle {
        private String baseUrl = "https://api.circle.com/v1/w3s";
        private String apiKey;
        private String entityId;
        private String walletId;
        private String tokenId;

        /**
         * Currency code of {@code tokenId}; instructions in any other
         * currency are refused.
         */
        private String currency = "USDC";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(25);
    }

    @Data
    public static class Parser {
        private String url = "http://localhost:8001";
        private Duration timeout = Duration.ofSeconds(10);
    }
}
