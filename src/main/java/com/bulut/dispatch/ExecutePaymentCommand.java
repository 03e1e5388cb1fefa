package com.bulut.dispatch;

import com.bulut.intent.PaymentIntent;
import lombok.Builder;
import lombok.Value;

/**
 * Everything the dispatcher needs to authorize and execute one intent.
 */
@Value
@Builder
public class ExecutePaymentCommand {

    /**
     * Caller-chosen nonce; one signature authorizes this id once.
     */
    String intentId;

    PaymentIntent intent;

    String userSignature;

    /**
     * Payer address claimed in the request body.
     */
    String userAddress;

    /**
     * Address of the authenticated wallet ({@code X-Wallet-Address}).
     */
    String headerAddress;

    /**
     * Signature carried by the authenticated request ({@code X-Signature}).
     */
    String headerSignature;
}
