package com.bulut.common;

import java.util.regex.Pattern;

/**
 * Helpers for caller-supplied intent identifiers.
 *
 * An intent id is the replay-protection nonce of a payment: one signature
 * authorizes exactly one intent id, once.
 */
public final class IntentId {

    private static final Pattern SHAPE = Pattern.compile("^[A-Za-z0-9_.:-]{1,128}$");

    private IntentId() {
    }

    public static boolean isValid(String intentId) {
        return intentId != null && SHAPE.matcher(intentId).matches();
    }
}
