package com.bulut.api.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class HealthResponse {
    String status;
    Instant timestamp;
    String store;
    String rail;
    int aliases;
    int transactions;
    int subscriptions;
}
