package com.bulut.dispatch;

import com.bulut.common.exception.ErrorCode;
import com.bulut.intent.PaymentType;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Result of an executed intent, as returned to the caller and as recorded for
 * idempotent retries.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaymentResponse {

    private boolean success;

    private String intentId;

    private PaymentType paymentType;

    private String transactionId;

    private String transactionHash;

    /**
     * Ledger ids of split legs that settled before a later leg failed.
     */
    private List<String> settledTransactionIds;

    /**
     * Status reported by the settlement rail, or {@code failed}, {@code partial}
     * or {@code pending} (rail still working after the timeout).
     */
    private String status;

    private String explorerUrl;

    private BigDecimal amount;

    private String currency;

    private String fromAddress;

    private String toAddress;

    private String subscriptionId;

    /**
     * Rail error, verbatim.
     */
    private String error;

    private ErrorCode code;

    private Instant timestamp;
}
