package com.bulut.intent;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The three payment shapes an intent can take.
 */
public enum PaymentType {
    @JsonProperty("single")
    SINGLE("single"),

    @JsonProperty("subscription")
    SUBSCRIPTION("subscription"),

    @JsonProperty("split")
    SPLIT("split");

    private final String wireName;

    PaymentType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Name used on the wire and inside signed messages.
     */
    public String getWireName() {
        return wireName;
    }
}
