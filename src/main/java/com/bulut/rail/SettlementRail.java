package com.bulut.rail;

/**
 * Capability that actually moves funds once a payment is authorized.
 *
 * The dispatcher is written once against this interface; which implementation
 * backs it (a custodial transfer service, or the in-memory simulation) is a
 * deployment choice made by {@code bulut.rail.mode}.
 *
 * Contract for implementations:
 * - a failure the rail itself reports is returned as {@link RailResult#failed}
 *   with the rail's message verbatim
 * - transport failures (unreachable, timed out) are thrown as
 *   {@link com.bulut.common.exception.UpstreamException}
 * - the intent id on each instruction is unique per payment and SHOULD be
 *   used as the rail's own idempotency key where the rail supports one
 */
public interface SettlementRail {

    /**
     * One-off transfer to one recipient.
     */
    RailResult sendPayment(TransferInstruction instruction);

    /**
     * Set up a recurring payment.
     */
    RailResult createSubscription(SubscriptionInstruction instruction);

    /**
     * Pay several recipients from one authorization. Leg amounts already sum to
     * the total.
     */
    RailResult splitPayment(SplitInstruction instruction);

    /**
     * Get the rail name, used for logging.
     */
    String getRailName();
}
