package com.bulut.rail.circle;

import com.bulut.common.exception.UpstreamException;
import com.bulut.config.BulutProperties;
import com.bulut.rail.RailResult;
import com.bulut.rail.SettlementRail;
import com.bulut.rail.SplitInstruction;
import com.bulut.rail.SubscriptionInstruction;
import com.bulut.rail.TransferInstruction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Settlement rail backed by Circle developer-controlled wallets.
 *
 * Mapping:
 * - single payment: one transfer
 * - subscription: the first instalment as one transfer; later instalments are
 *   the recurring executor's job
 * - split: one transfer per leg under a shared refId, in leg order, stopping
 *   at the first leg Circle rejects
 *
 * Only the currency of the configured token is accepted. Legs of a split that
 * were submitted before a later leg failed are reported back so they can be
 * recorded.
 *
 * Circle idempotency keys are derived from the intent id (and leg index), so
 * a retried instruction never creates a second transfer on Circle's side.
 */
@Component
@ConditionalOnProperty(prefix = "bulut.rail", name = "mode", havingValue = "circle")
@Slf4j
public class CircleSettlementRail implements SettlementRail {

    private static final String FAILED_STATE = "FAILED";

    private final CircleClient circleClient;
    private final BulutProperties.Circle config;

    public CircleSettlementRail(CircleClient circleClient, BulutProperties properties) {
        this.circleClient = circleClient;
        this.config = properties.getRail().getCircle();
    }

    @Override
    public RailResult sendPayment(TransferInstruction instruction) {
        if (!supports(instruction.getCurrency())) {
            return unsupported(instruction.getIntentId(), instruction.getCurrency());
        }
        return single(instruction.getIntentId(), instruction.getToAddress(), instruction.getAmount());
    }

    @Override
    public RailResult createSubscription(SubscriptionInstruction instruction) {
        if (!supports(instruction.getCurrency())) {
            return unsupported(instruction.getIntentId(), instruction.getCurrency());
        }
        return single(instruction.getIntentId(), instruction.getToAddress(), instruction.getAmount());
    }

    @Override
    public RailResult splitPayment(SplitInstruction instruction) {
        if (!supports(instruction.getCurrency())) {
            return unsupported(instruction.getIntentId(), instruction.getCurrency());
        }
        String refId = refId(instruction.getIntentId());
        List<SplitInstruction.SplitLeg> legs = instruction.getLegs();
        List<String> settled = new ArrayList<>();
        List<RailResult.SettledLeg> settledLegs = new ArrayList<>();
        CircleDTOs.TransferData first = null;

        for (int i = 0; i < legs.size(); i++) {
            SplitInstruction.SplitLeg leg = legs.get(i);
            CircleDTOs.TransferData data;
            try {
                data = circleClient.createTransfer(request(instruction.getIntentId() + "#" + i, refId,
                    leg.getAddress(), leg.getAmount()));
            } catch (UpstreamException e) {
                if (settled.isEmpty()) {
                    throw e;
                }
                return splitFailure(instruction.getIntentId(), partialFailure(i, legs.size(), settled, e.getMessage()),
                    settledLegs);
            }
            if (FAILED_STATE.equalsIgnoreCase(data.getState())) {
                return splitFailure(instruction.getIntentId(),
                    partialFailure(i, legs.size(), settled, data.getErrorReason()), settledLegs);
            }
            settled.add(data.getId());
            settledLegs.add(new RailResult.SettledLeg(leg.getAddress(), leg.getAmount(), hashOrId(data), data.getId()));
            if (first == null) {
                first = data;
            }
        }

        log.info("Circle split settled: refId={}, legs={}", refId, settled);
        return RailResult.succeeded(hashOrId(first), first.getState(), String.join(",", settled));
    }

    @Override
    public String getRailName() {
        return "Circle";
    }

    private RailResult single(String intentId, String toAddress, BigDecimal amount) {
        CircleDTOs.TransferData data = circleClient.createTransfer(
            request(intentId, refId(intentId), toAddress, amount));

        if (FAILED_STATE.equalsIgnoreCase(data.getState())) {
            log.warn("Circle transfer failed: intent={}, id={}, reason={}", intentId, data.getId(), data.getErrorReason());
            return RailResult.failed("Circle transfer " + data.getId() + " failed: " + data.getErrorReason());
        }

        log.info("Circle transfer accepted: intent={}, id={}, state={}", intentId, data.getId(), data.getState());
        return RailResult.succeeded(hashOrId(data), data.getState(), data.getId());
    }

    private boolean supports(String currency) {
        return currency != null && currency.trim().equalsIgnoreCase(config.getCurrency());
    }

    private RailResult unsupported(String intentId, String currency) {
        log.warn("Circle refused intent {}: currency {} is not the configured {} token", intentId, currency,
            config.getCurrency());
        return RailResult.failed("Unsupported currency " + currency + ": Circle wallet holds "
            + config.getCurrency());
    }

    private static RailResult splitFailure(String intentId, String error, List<RailResult.SettledLeg> settledLegs) {
        log.warn("Circle split stopped: intent={}, {}", intentId, error);
        if (settledLegs.isEmpty()) {
            return RailResult.failed(error);
        }
        return RailResult.partiallyFailed(error, settledLegs);
    }

    private CircleDTOs.TransferRequest request(String idempotencySeed, String refId,
                                               String destination, BigDecimal amount) {
        return CircleDTOs.TransferRequest.builder()
            .idempotencyKey(UUID.nameUUIDFromBytes(idempotencySeed.getBytes(StandardCharsets.UTF_8)).toString())
            .entityId(config.getEntityId())
            .walletId(config.getWalletId())
            .tokenId(config.getTokenId())
            .destinationAddress(destination)
            .amounts(List.of(amount.toPlainString()))
            .feeLevel("MEDIUM")
            .refId(refId)
            .build();
    }

    private static String refId(String intentId) {
        return "bulut-" + intentId;
    }

    private static String hashOrId(CircleDTOs.TransferData data) {
        // Circle fills txHash once the transfer is broadcast
        return data.getTxHash() != null ? data.getTxHash().toLowerCase(Locale.ROOT) : data.getId();
    }

    private static String partialFailure(int index, int total, List<String> settled, String reason) {
        if (settled.isEmpty()) {
            return "Circle split leg 1 of " + total + " failed: " + reason;
        }
        return String.format("Circle split leg %d of %d failed after legs %s were submitted: %s",
            index + 1, total, settled, reason);
    }

}
