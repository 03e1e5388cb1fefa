package com.bulut.subscription;

import com.bulut.intent.Frequency;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Recurring payment set up by a successful subscription intent.
 *
 * Later instalments are driven by a recurring-execution process outside this
 * service; here the record is created and can be cancelled by its payer.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Subscription {

    private String id;

    private String intentId;

    private String fromAddress;

    private String toAddress;

    private BigDecimal amount;

    private String currency;

    private Frequency frequency;

    private SubscriptionStatus status;

    private LocalDate nextPayment;

    private String transactionHash;

    private Instant createdAt;

    private Instant cancelledAt;

    public boolean isActive() {
        return status == SubscriptionStatus.ACTIVE;
    }
}
