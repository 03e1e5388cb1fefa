package com.bulut.rail;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * What a settlement rail reported for one instruction.
 */
@Value
@Builder
public class RailResult {

    public static final String PARTIAL_STATUS = "partial";

    boolean success;

    String transactionHash;

    /**
     * Status as the rail reports it; recorded as-is.
     */
    String status;

    /**
     * Rail's own id for the transfer(s).
     */
    String reference;

    String error;

    /**
     * Split legs the rail submitted before a later leg failed. Empty unless
     * the instruction failed part-way.
     */
    @Builder.Default
    List<SettledLeg> settledLegs = List.of();

    public boolean isPartial() {
        return !success && !settledLegs.isEmpty();
    }

    public static RailResult succeeded(String transactionHash, String status, String reference) {
        return RailResult.builder()
            .success(true)
            .transactionHash(transactionHash)
            .status(status)
            .reference(reference)
            .build();
    }

    public static RailResult failed(String error) {
        return RailResult.builder()
            .success(false)
            .status("failed")
            .error(error)
            .build();
    }

    public static RailResult partiallyFailed(String error, List<SettledLeg> settledLegs) {
        return RailResult.builder()
            .success(false)
            .status(PARTIAL_STATUS)
            .error(error)
            .settledLegs(List.copyOf(settledLegs))
            .build();
    }

    @Value
    public static class SettledLeg {
        String toAddress;
        BigDecimal amount;
        String transactionHash;
        String reference;
    }
}
