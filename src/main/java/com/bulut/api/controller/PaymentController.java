package com.bulut.api.controller;

import com.bulut.api.dto.ExecutePaymentRequest;
import com.bulut.api.dto.ProcessCommandRequest;
import com.bulut.dispatch.DispatchOutcome;
import com.bulut.dispatch.ExecutePaymentCommand;
import com.bulut.dispatch.PaymentDispatcher;
import com.bulut.dispatch.PaymentResponse;
import com.bulut.intent.IntentParserClient;
import com.bulut.intent.PaymentIntent;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for parsing and executing payment intents.
 */
@RestController
@RequiredArgsConstructor
@Tag(name = "Payments", description = "Payment intent API")
public class PaymentController {

    private final PaymentDispatcher paymentDispatcher;
    private final IntentParserClient intentParserClient;

    @PostMapping("/process_command")
    @Operation(summary = "Parse a natural-language command into a payment intent")
    public ResponseEntity<PaymentIntent> processCommand(@Valid @RequestBody ProcessCommandRequest request) {
        PaymentIntent intent = intentParserClient.parse(
            request.getText(),
            request.getUserId(),
            request.getTimezone()
        );
        return ResponseEntity.ok(intent);
    }

    /**
     * Rail failures come back as a {@code success=false} body with 502; every
     * other failure goes through {@link GlobalExceptionHandler}.
     */
    @PostMapping("/execute_payment")
    @Operation(summary = "Authorize and execute a signed payment intent")
    public ResponseEntity<PaymentResponse> executePayment(
            @Valid @RequestBody ExecutePaymentRequest request,
            @RequestHeader("X-Wallet-Address") String walletAddress,
            @RequestHeader("X-Signature") String signature) {

        ExecutePaymentCommand command = ExecutePaymentCommand.builder()
            .intentId(request.getIntentId())
            .intent(request.getPaymentIntent())
            .userSignature(request.getUserSignature())
            .userAddress(request.getUserAddress())
            .headerAddress(walletAddress)
            .headerSignature(signature)
            .build();

        DispatchOutcome outcome = paymentDispatcher.dispatch(command);
        if (outcome.isRejected()) {
            throw outcome.toException();
        }

        PaymentResponse response = outcome.getResponse();
        HttpStatus status = response.isSuccess() ? HttpStatus.OK : HttpStatus.BAD_GATEWAY;
        return ResponseEntity.status(status).body(response);
    }
}
