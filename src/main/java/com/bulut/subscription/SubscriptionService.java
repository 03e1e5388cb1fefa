package com.bulut.subscription;

import com.bulut.common.AddressCodec;
import com.bulut.common.exception.AuthorizationException;
import com.bulut.common.exception.ErrorCode;
import com.bulut.common.exception.NotFoundException;
import com.bulut.store.KeyValueStore;
import com.bulut.store.StoreFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Service for managing subscription records.
 */
@Service
@Slf4j
public class SubscriptionService {

    static final String NAMESPACE = "subscriptions";

    private final KeyValueStore<Subscription> subscriptions;
    private final Clock clock;

    public SubscriptionService(StoreFactory storeFactory, Clock clock) {
        this.subscriptions = storeFactory.open(NAMESPACE, Subscription.class);
        this.clock = clock;
    }

    /**
     * Store a new active subscription; the first payment is due on the start date.
     */
    public Subscription create(Subscription draft) {
        Instant now = clock.instant();
        String id = "sub_" + Numeric.toHexStringNoPrefix(Hash.sha256(
            (draft.getIntentId() + "|" + draft.getFromAddress() + "|" + draft.getToAddress() + "|" + now)
                .getBytes(StandardCharsets.UTF_8))).substring(0, 16);

        Subscription subscription = draft.toBuilder()
            .id(id)
            .fromAddress(AddressCodec.normalize(draft.getFromAddress()))
            .toAddress(AddressCodec.normalize(draft.getToAddress()))
            .status(SubscriptionStatus.ACTIVE)
            .createdAt(now)
            .build();

        if (!subscriptions.putIfAbsent(id, subscription)) {
            // id derives from the intent id, which executes at most once
            throw new IllegalStateException("Duplicate subscription id " + id);
        }

        log.info("Created {} subscription {}: from={}, to={}, amount={} {}, first payment {}",
            subscription.getFrequency(), id, subscription.getFromAddress(), subscription.getToAddress(),
            subscription.getAmount(), subscription.getCurrency(), subscription.getNextPayment());
        return subscription;
    }

    public Subscription getSubscription(String id) {
        return subscriptions.get(id)
            .orElseThrow(() -> new NotFoundException(ErrorCode.SUBSCRIPTION_NOT_FOUND, "subscription " + id));
    }

    /**
     * Active subscriptions paid by {@code address}.
     */
    public List<Subscription> getActiveSubscriptions(String address) {
        String payer = AddressCodec.normalize(address);
        return subscriptions.values().stream()
            .filter(s -> s.isActive() && s.getFromAddress().equals(payer))
            .collect(Collectors.toList());
    }

    /**
     * Cancel a subscription. Only its payer may do so; cancelling twice is a no-op.
     */
    public Subscription cancel(String id, String requestingAddress) {
        String requester = AddressCodec.normalize(requestingAddress);
        while (true) {
            Subscription current = getSubscription(id);
            if (!current.getFromAddress().equals(requester)) {
                log.warn("Subscription cancel rejected: {} does not own {}", requester, id);
                throw new AuthorizationException(ErrorCode.NOT_OWNER);
            }
            if (!current.isActive()) {
                return current;
            }
            Subscription cancelled = current.toBuilder()
                .status(SubscriptionStatus.CANCELLED)
                .cancelledAt(clock.instant())
                .build();
            if (subscriptions.compareAndSet(id, current, cancelled)) {
                log.info("Cancelled subscription {} for {}", id, requester);
                return cancelled;
            }
        }
    }

    public int count() {
        return subscriptions.size();
    }
}
