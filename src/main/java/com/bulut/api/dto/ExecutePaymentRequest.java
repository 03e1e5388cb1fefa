package com.bulut.api.dto;

import com.bulut.intent.PaymentIntent;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * DTO for executing a parsed payment intent.
 */
@Data
public class ExecutePaymentRequest {

    @NotBlank(message = "Intent ID is required")
    private String intentId;

    @NotNull(message = "Payment intent is required")
    private PaymentIntent paymentIntent;

    @NotBlank(message = "User signature is required")
    private String userSignature;

    @NotBlank(message = "User address is required")
    private String userAddress;
}
