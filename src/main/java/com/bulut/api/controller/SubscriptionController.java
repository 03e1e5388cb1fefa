package com.bulut.api.controller;

import com.bulut.api.dto.SubscriptionListResponse;
import com.bulut.common.AddressCodec;
import com.bulut.subscription.Subscription;
import com.bulut.subscription.SubscriptionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for recurring payments.
 */
@RestController
@RequestMapping("/subscriptions")
@RequiredArgsConstructor
@Tag(name = "Subscriptions", description = "Subscription API")
public class SubscriptionController {

    private final SubscriptionService subscriptionService;

    @GetMapping("/{address}")
    @Operation(summary = "List active subscriptions paid by an address")
    public ResponseEntity<SubscriptionListResponse> getSubscriptions(@PathVariable String address) {
        String canonical = AddressCodec.normalize(address);
        List<Subscription> subscriptions = subscriptionService.getActiveSubscriptions(canonical);
        return ResponseEntity.ok(new SubscriptionListResponse(canonical, subscriptions.size(), subscriptions));
    }

    @DeleteMapping("/{subscriptionId}")
    @Operation(summary = "Cancel a subscription (payer only)")
    public ResponseEntity<Subscription> cancel(@PathVariable String subscriptionId,
                                               @RequestHeader("X-Wallet-Address") String walletAddress) {
        return ResponseEntity.ok(subscriptionService.cancel(subscriptionId, walletAddress));
    }
}
