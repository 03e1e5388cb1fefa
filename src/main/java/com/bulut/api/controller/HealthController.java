package com.bulut.api.controller;

import com.bulut.alias.AliasRegistry;
import com.bulut.api.dto.HealthResponse;
import com.bulut.ledger.TransactionLedger;
import com.bulut.rail.SettlementRail;
import com.bulut.store.StoreFactory;
import com.bulut.subscription.SubscriptionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

@RestController
@RequiredArgsConstructor
@Tag(name = "Health", description = "Service status")
public class HealthController {

    private final AliasRegistry aliasRegistry;
    private final TransactionLedger ledger;
    private final SubscriptionService subscriptionService;
    private final StoreFactory storeFactory;
    private final SettlementRail settlementRail;
    private final Clock clock;

    @GetMapping("/health")
    @Operation(summary = "Service status and record counts")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(HealthResponse.builder()
            .status("healthy")
            .timestamp(clock.instant())
            .store(storeFactory.getStoreName())
            .rail(settlementRail.getRailName())
            .aliases(aliasRegistry.count())
            .transactions(ledger.count())
            .subscriptions(subscriptionService.count())
            .build());
    }
}
