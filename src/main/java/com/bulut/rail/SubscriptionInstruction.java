package com.bulut.rail;

import com.bulut.intent.Frequency;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class SubscriptionInstruction {
    String intentId;
    String fromAddress;
    String toAddress;
    BigDecimal amount;
    String currency;
    Frequency frequency;
    LocalDate startDate;
}
