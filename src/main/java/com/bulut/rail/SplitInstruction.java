package com.bulut.rail;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class SplitInstruction {
    String intentId;
    String fromAddress;
    BigDecimal totalAmount;
    String currency;
    String memo;
    List<SplitLeg> legs;

    /**
     * One recipient of a split, with its resolved address and computed amount.
     */
    @Value
    public static class SplitLeg {
        String alias;
        String address;
        BigDecimal share;
        BigDecimal amount;
    }
}
