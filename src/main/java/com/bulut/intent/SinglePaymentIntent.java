package com.bulut.intent;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * One-off transfer to one recipient.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class SinglePaymentIntent extends PaymentIntent {

    private String recipientAlias;

    private String memo;

    @Override
    public PaymentType paymentType() {
        return PaymentType.SINGLE;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitSingle(this);
    }
}
