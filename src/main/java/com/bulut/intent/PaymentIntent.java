package com.bulut.intent;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.AccessLevel;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;

/**
 * Structured payment intent produced by the external parser.
 *
 * Exactly three variants, all in this package; code that branches on the
 * variant goes through {@link #accept(Visitor)} so a new variant fails to
 * compile until every branch handles it. Intents are inputs only: the core
 * never mutates them.
 */
@Data
@SuperBuilder
@NoArgsConstructor(access = AccessLevel.PACKAGE)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "payment_type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = SinglePaymentIntent.class, name = "single"),
    @JsonSubTypes.Type(value = SubscriptionPaymentIntent.class, name = "subscription"),
    @JsonSubTypes.Type(value = SplitPaymentIntent.class, name = "split")
})
public abstract class PaymentIntent {

    private BigDecimal amount;

    private String currency;

    /**
     * Parser certainty in [0, 1].
     */
    private Double confidence;

    private IntentError error;

    public abstract PaymentType paymentType();

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {

        R visitSingle(SinglePaymentIntent intent);

        R visitSubscription(SubscriptionPaymentIntent intent);

        R visitSplit(SplitPaymentIntent intent);
    }
}
