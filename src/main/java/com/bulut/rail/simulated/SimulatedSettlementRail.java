package com.bulut.rail.simulated;

import com.bulut.rail.RailResult;
import com.bulut.rail.SettlementRail;
import com.bulut.rail.SplitInstruction;
import com.bulut.rail.SubscriptionInstruction;
import com.bulut.rail.TransferInstruction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Simulated settlement rail for testing and development.
 *
 * Every instruction succeeds immediately with a random 32-byte transaction
 * hash. No funds move.
 *
 * NOT FOR PRODUCTION: use a real rail adapter ({@code bulut.rail.mode=circle}).
 */
@Component
@ConditionalOnProperty(prefix = "bulut.rail", name = "mode", havingValue = "simulated", matchIfMissing = true)
@Slf4j
public class SimulatedSettlementRail implements SettlementRail {

    @Override
    public RailResult sendPayment(TransferInstruction instruction) {
        String hash = newHash(instruction.getIntentId());
        log.info("Simulated transfer: intent={}, {} -> {}, amount={} {}, hash={}",
            instruction.getIntentId(), instruction.getFromAddress(), instruction.getToAddress(),
            instruction.getAmount(), instruction.getCurrency(), hash);
        return RailResult.succeeded(hash, "confirmed", "sim_" + hash.substring(2, 12));
    }

    @Override
    public RailResult createSubscription(SubscriptionInstruction instruction) {
        String hash = newHash(instruction.getIntentId());
        log.info("Simulated subscription: intent={}, {} -> {}, amount={} {} {}, hash={}",
            instruction.getIntentId(), instruction.getFromAddress(), instruction.getToAddress(),
            instruction.getAmount(), instruction.getCurrency(), instruction.getFrequency(), hash);
        return RailResult.succeeded(hash, "active", "sim_" + hash.substring(2, 12));
    }

    @Override
    public RailResult splitPayment(SplitInstruction instruction) {
        String hash = newHash(instruction.getIntentId());
        log.info("Simulated split: intent={}, from={}, total={} {}, legs={}, hash={}",
            instruction.getIntentId(), instruction.getFromAddress(), instruction.getTotalAmount(),
            instruction.getCurrency(), instruction.getLegs().size(), hash);
        return RailResult.succeeded(hash, "confirmed", "sim_" + hash.substring(2, 12));
    }

    @Override
    public String getRailName() {
        return "SimulatedRail";
    }

    private static String newHash(String intentId) {
        byte[] digest = Hash.sha256((intentId + "|" + UUID.randomUUID()).getBytes(StandardCharsets.UTF_8));
        return Numeric.toHexString(digest);
    }
}
