package com.bulut.rail.circle;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * DTOs for the Circle Wallets transfer API.
 *
 * Circle uses camelCase JSON, so these opt out of the application-wide naming
 * strategy.
 */
public class CircleDTOs {

    /**
     * Transfer request: move {@code amounts} of {@code tokenId} from the
     * configured wallet to {@code destinationAddress}.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
    public static class TransferRequest {
        private String idempotencyKey;
        private String entityId;
        private String walletId;
        private String tokenId;
        private String destinationAddress;
        private List<String> amounts;
        private String feeLevel;
        private String refId;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
    public static class TransferResponse {
        private TransferData data;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
    public static class TransferData {
        private String id;
        /**
         * INITIATED, QUEUED, SENT, CONFIRMED, COMPLETE, FAILED, ...
         */
        private String state;
        private String txHash;
        private String errorReason;
    }
}
