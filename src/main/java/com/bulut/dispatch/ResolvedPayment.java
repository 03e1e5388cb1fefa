package com.bulut.dispatch;

import com.bulut.intent.PaymentIntent;
import com.bulut.rail.SplitInstruction;
import lombok.Value;

import java.util.List;

/**
 * An intent after recipient resolution.
 */
@Value
class ResolvedPayment {

    PaymentIntent intent;

    /**
     * Recipient as bound into the signed message: the canonical address, or
     * for splits the {@code address:share} list in intent order.
     */
    String signedRecipient;

    /**
     * Recipient as recorded in the ledger: the canonical address or
     * {@code multiple}.
     */
    String ledgerRecipient;

    /**
     * Empty unless the intent is a split.
     */
    List<SplitInstruction.SplitLeg> legs;
}
