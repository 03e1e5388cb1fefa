package com.bulut.subscription;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum SubscriptionStatus {
    @JsonProperty("active")
    ACTIVE,

    @JsonProperty("cancelled")
    CANCELLED
}
