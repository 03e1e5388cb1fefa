package com.bulut.intent;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Recurrence of a subscription payment.
 */
public enum Frequency {
    @JsonProperty("daily")
    DAILY,

    @JsonProperty("weekly")
    WEEKLY,

    @JsonProperty("monthly")
    MONTHLY,

    @JsonProperty("yearly")
    YEARLY
}
