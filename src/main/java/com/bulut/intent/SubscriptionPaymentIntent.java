package com.bulut.intent;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.time.LocalDate;

/**
 * Recurring payment to one recipient.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class SubscriptionPaymentIntent extends PaymentIntent {

    private String recipientAlias;

    private Frequency frequency;

    private LocalDate startDate;

    @Override
    public PaymentType paymentType() {
        return PaymentType.SUBSCRIPTION;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitSubscription(this);
    }
}
