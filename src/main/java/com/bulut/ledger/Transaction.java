package com.bulut.ledger;

import com.bulut.intent.PaymentType;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Immutable record of an executed transfer.
 *
 * Transactions are never updated or deleted - the ledger is append-only.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Transaction {

    public static final String MULTIPLE_RECIPIENTS = "multiple";

    /**
     * Ledger-assigned identifier, {@code tx_} + 16 hex characters.
     */
    String id;

    /**
     * Hash reported by the settlement rail.
     */
    String transactionHash;

    String intentId;

    String fromAddress;

    /**
     * Canonical recipient address, or {@link #MULTIPLE_RECIPIENTS} for splits.
     */
    String toAddress;

    BigDecimal amount;

    String currency;

    PaymentType paymentType;

    /**
     * Status as reported by the rail, e.g. {@code confirmed} or {@code INITIATED}.
     */
    String status;

    String memo;

    /**
     * Rail's own reference for the transfer, if any.
     */
    String railReference;

    Instant timestamp;

    public boolean involves(String canonicalAddress) {
        return canonicalAddress.equals(fromAddress) || canonicalAddress.equals(toAddress);
    }
}
