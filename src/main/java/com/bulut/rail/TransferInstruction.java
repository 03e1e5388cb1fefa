package com.bulut.rail;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class TransferInstruction {
    String intentId;
    String fromAddress;
    String toAddress;
    BigDecimal amount;
    String currency;
    String memo;
}
