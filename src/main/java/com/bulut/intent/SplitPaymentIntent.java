package com.bulut.intent;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;
import java.util.List;

/**
 * One amount divided among several recipients by percentage share.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class SplitPaymentIntent extends PaymentIntent {

    private List<Recipient> recipients;

    private String memo;

    @Override
    public PaymentType paymentType() {
        return PaymentType.SPLIT;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitSplit(this);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Recipient {
        private String alias;

        /**
         * Percentage of the total, 0-100.
         */
        private BigDecimal share;
    }
}
