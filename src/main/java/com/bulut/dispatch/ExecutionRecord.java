package com.bulut.dispatch;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Per-intent execution state, keyed by intent id.
 *
 * Written once when the intent is claimed ({@link DispatchState#AUTHORIZED})
 * and once more when the rail answers. A terminal record is returned as-is for
 * every later submission of the same intent id.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionRecord {

    private String intentId;

    private String fromAddress;

    /**
     * Hex digest of the structured message the payer signed.
     */
    private String messageDigest;

    private DispatchState state;

    private PaymentResponse response;

    private Instant startedAt;

    private Instant completedAt;
}
