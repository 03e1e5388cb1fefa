package com.bulut.dispatch;

import com.bulut.alias.AliasRegistry;
import com.bulut.common.AddressCodec;
import com.bulut.common.IntentId;
import com.bulut.common.exception.ErrorCategory;
import com.bulut.common.exception.ErrorCode;
import com.bulut.common.exception.UpstreamException;
import com.bulut.config.BulutProperties;
import com.bulut.intent.PaymentIntent;
import com.bulut.intent.SinglePaymentIntent;
import com.bulut.intent.SplitPaymentIntent;
import com.bulut.intent.SubscriptionPaymentIntent;
import com.bulut.ledger.Transaction;
import com.bulut.ledger.TransactionLedger;
import com.bulut.rail.RailResult;
import com.bulut.rail.SettlementRail;
import com.bulut.rail.SplitInstruction;
import com.bulut.rail.SubscriptionInstruction;
import com.bulut.rail.TransferInstruction;
import com.bulut.signature.SignatureAuthorizer;
import com.bulut.signature.StructuredMessage;
import com.bulut.store.KeyValueStore;
import com.bulut.store.StoreFactory;
import com.bulut.subscription.Subscription;
import com.bulut.subscription.SubscriptionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.web3j.utils.Numeric;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Authorizes and executes payment intents.
 *
 * Dispatch flow:
 * 1. Validate the intent's shape (amount, aliases, split shares, parser gating)
 * 2. Cross-check the body's payer against the authenticated wallet
 * 3. Return the recorded result if this intent id already executed
 * 4. Resolve every recipient alias; one miss rejects the whole intent
 * 5. Verify the payer's signature over the resolved intent
 * 6. Claim the intent id, call the settlement rail with a bounded wait
 * 7. Record the transaction (and subscription) on success
 *
 * A rail call that outlives the wait is not abandoned: the intent stays
 * {@link DispatchState#TIMED_OUT} and is completed, ledger entry included,
 * whenever the rail answers.
 *
 * Steps 1-5 return {@link StepResult}s; the first failure ends the intent as
 * {@link DispatchState#REJECTED} and nothing is written.
 */
@Service
@Slf4j
public class PaymentDispatcher {

    static final String NAMESPACE = "executions";

    private static final BigDecimal HUNDRED = new BigDecimal("100");
    private static final int LEG_SCALE = 6;
    private static final String FAILED_STATUS = "failed";
    private static final String PENDING_STATUS = "pending";

    private final AliasRegistry aliasRegistry;
    private final SignatureAuthorizer signatureAuthorizer;
    private final TransactionLedger ledger;
    private final SubscriptionService subscriptionService;
    private final SettlementRail rail;
    private final Executor railExecutor;
    private final KeyValueStore<ExecutionRecord> executions;
    private final BulutProperties.Dispatch config;
    private final String explorerUrl;
    private final Clock clock;

    public PaymentDispatcher(AliasRegistry aliasRegistry,
                             SignatureAuthorizer signatureAuthorizer,
                             TransactionLedger ledger,
                             SubscriptionService subscriptionService,
                             SettlementRail rail,
                             @Qualifier("railExecutor") Executor railExecutor,
                             StoreFactory storeFactory,
                             BulutProperties properties,
                             Clock clock) {
        this.aliasRegistry = aliasRegistry;
        this.signatureAuthorizer = signatureAuthorizer;
        this.ledger = ledger;
        this.subscriptionService = subscriptionService;
        this.rail = rail;
        this.railExecutor = railExecutor;
        this.executions = storeFactory.open(NAMESPACE, ExecutionRecord.class);
        this.config = properties.getDispatch();
        this.explorerUrl = properties.getRail().getExplorerUrl();
        this.clock = clock;

        log.info("Payment dispatcher using {} rail, timeout={}", rail.getRailName(), config.getRailTimeout());
    }

    public DispatchOutcome dispatch(ExecutePaymentCommand command) {
        String intentId = command.getIntentId();
        log.debug("Intent {} {}", intentId, DispatchState.RECEIVED);

        StepResult<PaymentIntent> shape = validateShape(command);
        if (!shape.isOk()) {
            return reject(intentId, shape);
        }
        PaymentIntent intent = shape.getValue();

        StepResult<String> caller = checkCaller(command);
        if (!caller.isOk()) {
            return reject(intentId, caller);
        }
        String payer = caller.getValue();

        Optional<ExecutionRecord> existing = executions.get(intentId);
        if (existing.isPresent()) {
            return replay(command, payer, existing.get());
        }

        StepResult<ResolvedPayment> resolved = resolveRecipients(intent);
        if (!resolved.isOk()) {
            return reject(intentId, resolved);
        }
        ResolvedPayment payment = resolved.getValue();
        log.debug("Intent {} {}: to={}", intentId, DispatchState.RECIPIENTS_RESOLVED, payment.getLedgerRecipient());

        StepResult<byte[]> authorized = authorize(command, payer, payment);
        if (!authorized.isOk()) {
            return reject(intentId, authorized);
        }

        ExecutionRecord claim = ExecutionRecord.builder()
            .intentId(intentId)
            .fromAddress(payer)
            .messageDigest(Numeric.toHexString(authorized.getValue()))
            .state(DispatchState.AUTHORIZED)
            .startedAt(clock.instant())
            .build();
        if (!executions.putIfAbsent(intentId, claim)) {
            // a concurrent submission of the same intent id claimed it first
            return executions.get(intentId)
                .map(record -> replay(command, payer, record))
                .orElseGet(() -> reject(intentId,
                    StepResult.fail(ErrorCode.INTENT_IN_PROGRESS, "Intent " + intentId + " is being executed")));
        }
        log.info("Intent {} {}: {} {} {} from {}", intentId, DispatchState.AUTHORIZED,
            intent.paymentType().getWireName(), intent.getAmount(), currencyOf(intent), payer);

        return DispatchOutcome.executed(execute(claim, payment), false);
    }

    /**
     * Shape checks that need no lookups. A failed split check never reaches
     * alias resolution.
     */
    StepResult<PaymentIntent> validateShape(ExecutePaymentCommand command) {
        if (!IntentId.isValid(command.getIntentId())) {
            return StepResult.fail(ErrorCode.INVALID_FORMAT, "Invalid intent id");
        }
        PaymentIntent intent = command.getIntent();
        if (intent == null) {
            return StepResult.fail(ErrorCode.INVALID_INTENT, "Payment intent is required");
        }
        if (intent.getError() != null) {
            return StepResult.fail(ErrorCode.INVALID_INTENT,
                "Intent could not be parsed: " + intent.getError().getMessage());
        }
        if (intent.getConfidence() != null && intent.getConfidence() < config.getMinConfidence()) {
            return StepResult.fail(ErrorCode.LOW_CONFIDENCE, String.format(Locale.ROOT,
                "Intent confidence %.2f is below %.2f", intent.getConfidence(), config.getMinConfidence()));
        }
        if (intent.getAmount() == null || intent.getAmount().signum() <= 0) {
            return StepResult.fail(ErrorCode.INVALID_AMOUNT, "Amount must be positive");
        }
        if (intent.getCurrency() == null || intent.getCurrency().isBlank()) {
            return StepResult.fail(ErrorCode.INVALID_INTENT, "Currency is required");
        }

        StepResult<Void> variant = intent.accept(new PaymentIntent.Visitor<StepResult<Void>>() {
            @Override
            public StepResult<Void> visitSingle(SinglePaymentIntent single) {
                return checkAlias(single.getRecipientAlias());
            }

            @Override
            public StepResult<Void> visitSubscription(SubscriptionPaymentIntent subscription) {
                if (subscription.getFrequency() == null || subscription.getStartDate() == null) {
                    return StepResult.fail(ErrorCode.INVALID_INTENT, "Subscription needs a frequency and start date");
                }
                return checkAlias(subscription.getRecipientAlias());
            }

            @Override
            public StepResult<Void> visitSplit(SplitPaymentIntent split) {
                return checkSplit(split);
            }
        });
        if (!variant.isOk()) {
            return variant.propagate();
        }
        return StepResult.ok(intent);
    }

    private StepResult<Void> checkSplit(SplitPaymentIntent split) {
        List<SplitPaymentIntent.Recipient> recipients = split.getRecipients();
        if (recipients == null || recipients.size() < 2) {
            return StepResult.fail(ErrorCode.INVALID_SPLIT, "A split needs at least two recipients");
        }
        BigDecimal total = BigDecimal.ZERO;
        for (SplitPaymentIntent.Recipient recipient : recipients) {
            if (recipient == null) {
                return StepResult.fail(ErrorCode.INVALID_SPLIT, "Split recipients must not be empty entries");
            }
            StepResult<Void> alias = checkAlias(recipient.getAlias());
            if (!alias.isOk()) {
                return alias;
            }
            if (recipient.getShare() == null || recipient.getShare().signum() <= 0) {
                return StepResult.fail(ErrorCode.INVALID_SPLIT, "Every share must be positive");
            }
            total = total.add(recipient.getShare());
        }
        if (total.subtract(HUNDRED).abs().compareTo(config.getSplitTolerance()) > 0) {
            return StepResult.fail(ErrorCode.INVALID_SPLIT,
                "Split shares must sum to 100%, got " + total.stripTrailingZeros().toPlainString() + "%");
        }
        return StepResult.ok(null);
    }

    private static StepResult<Void> checkAlias(String alias) {
        if (!AddressCodec.isAlias(alias)) {
            return StepResult.fail(ErrorCode.INVALID_FORMAT, "Invalid recipient alias: " + alias);
        }
        return StepResult.ok(null);
    }

    private static StepResult<String> checkCaller(ExecutePaymentCommand command) {
        if (!AddressCodec.isAddress(command.getUserAddress())) {
            return StepResult.fail(ErrorCode.INVALID_FORMAT, "Invalid payer address");
        }
        String payer = AddressCodec.normalize(command.getUserAddress());
        if (!AddressCodec.isAddress(command.getHeaderAddress())
            || !AddressCodec.normalize(command.getHeaderAddress()).equals(payer)) {
            return StepResult.fail(ErrorCode.ADDRESS_MISMATCH, "Authenticated wallet does not match payer");
        }
        if (command.getHeaderSignature() != null
            && !command.getHeaderSignature().trim().equalsIgnoreCase(String.valueOf(command.getUserSignature()).trim())) {
            return StepResult.fail(ErrorCode.INVALID_SIGNATURE, "Header signature does not match body signature");
        }
        return StepResult.ok(payer);
    }

    StepResult<ResolvedPayment> resolveRecipients(PaymentIntent intent) {
        return intent.accept(new PaymentIntent.Visitor<StepResult<ResolvedPayment>>() {
            @Override
            public StepResult<ResolvedPayment> visitSingle(SinglePaymentIntent single) {
                return resolveOne(single, single.getRecipientAlias());
            }

            @Override
            public StepResult<ResolvedPayment> visitSubscription(SubscriptionPaymentIntent subscription) {
                return resolveOne(subscription, subscription.getRecipientAlias());
            }

            @Override
            public StepResult<ResolvedPayment> visitSplit(SplitPaymentIntent split) {
                return resolveSplit(split);
            }
        });
    }

    private StepResult<ResolvedPayment> resolveOne(PaymentIntent intent, String alias) {
        Optional<String> address = aliasRegistry.resolve(alias);
        if (address.isEmpty()) {
            return recipientNotFound(alias);
        }
        return StepResult.ok(new ResolvedPayment(intent, address.get(), address.get(), List.of()));
    }

    private StepResult<ResolvedPayment> resolveSplit(SplitPaymentIntent split) {
        List<String> addresses = new ArrayList<>();
        for (SplitPaymentIntent.Recipient recipient : split.getRecipients()) {
            Optional<String> address = aliasRegistry.resolve(recipient.getAlias());
            if (address.isEmpty()) {
                return recipientNotFound(recipient.getAlias());
            }
            addresses.add(address.get());
        }

        List<SplitPaymentIntent.Recipient> recipients = split.getRecipients();
        List<SplitInstruction.SplitLeg> legs = new ArrayList<>();
        List<String> signed = new ArrayList<>();
        BigDecimal allocated = BigDecimal.ZERO;
        for (int i = 0; i < recipients.size(); i++) {
            SplitPaymentIntent.Recipient recipient = recipients.get(i);
            BigDecimal amount = i == recipients.size() - 1
                ? split.getAmount().subtract(allocated)
                : legAmount(split.getAmount(), recipient.getShare());
            allocated = allocated.add(amount);
            legs.add(new SplitInstruction.SplitLeg(AddressCodec.normalizeAlias(recipient.getAlias()),
                addresses.get(i), recipient.getShare(), amount));
            signed.add(addresses.get(i) + ":" + SignatureAuthorizer.canonicalAmount(recipient.getShare()));
        }
        return StepResult.ok(new ResolvedPayment(split, String.join(",", signed),
            Transaction.MULTIPLE_RECIPIENTS, List.copyOf(legs)));
    }

    /**
     * {@code total * share / 100}, truncated to six decimals; the last leg
     * takes whatever truncation left over.
     */
    static BigDecimal legAmount(BigDecimal total, BigDecimal share) {
        return total.multiply(share).divide(HUNDRED, LEG_SCALE, RoundingMode.DOWN);
    }

    private static StepResult<ResolvedPayment> recipientNotFound(String alias) {
        return StepResult.fail(ErrorCode.RECIPIENT_NOT_FOUND,
            "Recipient not found: " + AddressCodec.display(AddressCodec.normalizeAlias(alias)));
    }

    /**
     * Verify the payer signed exactly this resolved intent.
     *
     * @return the digest of the verified message
     */
    private StepResult<byte[]> authorize(ExecutePaymentCommand command, String payer, ResolvedPayment payment) {
        PaymentIntent intent = payment.getIntent();
        StructuredMessage message = signatureAuthorizer.buildAuthorizationMessage(
            command.getIntentId(),
            intent.paymentType().getWireName(),
            payer,
            payment.getSignedRecipient(),
            intent.getAmount(),
            intent.getCurrency());

        if (!signatureAuthorizer.verify(message, command.getUserSignature(), payer)) {
            return StepResult.fail(ErrorCode.INVALID_SIGNATURE, "Payment signature did not verify");
        }
        return StepResult.ok(message.digest());
    }

    /**
     * Answer a resubmitted intent id from its record. The caller must still
     * prove it is the payer who signed the original message.
     */
    private DispatchOutcome replay(ExecutePaymentCommand command, String payer, ExecutionRecord record) {
        String intentId = record.getIntentId();
        if (!record.getState().isTerminal()) {
            log.info("Intent {} resubmitted while {}", intentId, record.getState());
            return reject(intentId,
                StepResult.fail(ErrorCode.INTENT_IN_PROGRESS, "Intent " + intentId + " is being executed"));
        }
        if (!record.getFromAddress().equals(payer)
            || !signatureAuthorizer.verifyDigest(Numeric.hexStringToByteArray(record.getMessageDigest()),
                command.getUserSignature(), payer)) {
            return reject(intentId,
                StepResult.fail(ErrorCode.INVALID_SIGNATURE, "Intent id already used by another authorization"));
        }
        log.info("Intent {} already {}; returning recorded result", intentId, record.getState());
        return DispatchOutcome.executed(record, true);
    }

    /**
     * Call the rail on the rail executor, wait at most the configured timeout
     * and store the outcome. The rail call cannot be interrupted, so after a
     * timeout it keeps running and its answer completes the intent later.
     */
    private ExecutionRecord execute(ExecutionRecord claim, ResolvedPayment payment) {
        Duration timeout = config.getRailTimeout();
        AtomicBoolean detached = new AtomicBoolean();
        AtomicBoolean lateAnswerTaken = new AtomicBoolean();
        CompletableFuture<RailResult> call =
            CompletableFuture.supplyAsync(() -> submit(claim, payment), railExecutor);
        Runnable completeLate = () -> {
            if (lateAnswerTaken.compareAndSet(false, true)) {
                completeAfterTimeout(claim, payment, call);
            }
        };
        call.whenComplete((result, error) -> {
            if (detached.get()) {
                completeLate.run();
            }
        });

        try {
            RailResult result = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return store(finish(claim, payment, result, ErrorCode.RAIL_EXECUTION_FAILED));
        } catch (ExecutionException e) {
            return store(finishWithError(claim, payment, e.getCause()));
        } catch (TimeoutException e) {
            log.error("{} rail did not answer intent {} within {}; waiting for it in the background",
                rail.getRailName(), claim.getIntentId(), timeout);
            return detach(claim, payment, call, detached, completeLate,
                rail.getRailName() + " rail timed out after " + timeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return detach(claim, payment, call, detached, completeLate,
                "Interrupted while waiting for the " + rail.getRailName() + " rail");
        }
    }

    /**
     * Park the intent as {@link DispatchState#TIMED_OUT}. The record is stored
     * before the late-answer hook is armed, so a late answer always lands on top.
     */
    private ExecutionRecord detach(ExecutionRecord claim, ResolvedPayment payment, CompletableFuture<RailResult> call,
                                   AtomicBoolean detached, Runnable completeLate, String message) {
        Instant now = clock.instant();
        ExecutionRecord pending = claim.toBuilder()
            .state(DispatchState.TIMED_OUT)
            .response(baseResponse(claim, payment, now)
                .success(false)
                .status(PENDING_STATUS)
                .error(message)
                .code(ErrorCode.RAIL_TIMEOUT)
                .build())
            .build();
        executions.put(claim.getIntentId(), pending);
        detached.set(true);
        if (call.isDone()) {
            completeLate.run();
        }
        return pending;
    }

    private void completeAfterTimeout(ExecutionRecord claim, ResolvedPayment payment,
                                      CompletableFuture<RailResult> call) {
        try {
            ExecutionRecord finished;
            try {
                finished = finish(claim, payment, call.join(), ErrorCode.RAIL_EXECUTION_FAILED);
            } catch (CompletionException e) {
                finished = finishWithError(claim, payment, e.getCause());
            }
            store(finished);
            log.info("Intent {} completed after timeout: {}", claim.getIntentId(), finished.getState());
        } catch (RuntimeException e) {
            log.error("Could not record late rail answer for intent {}; record stays {}",
                claim.getIntentId(), DispatchState.TIMED_OUT, e);
        }
    }

    private ExecutionRecord store(ExecutionRecord finished) {
        executions.put(finished.getIntentId(), finished);
        return finished;
    }

    private ExecutionRecord finishWithError(ExecutionRecord claim, ResolvedPayment payment, Throwable cause) {
        if (cause instanceof UpstreamException) {
            UpstreamException upstream = (UpstreamException) cause;
            log.error("{} rail failed intent {}: {}", upstream.getService(), claim.getIntentId(),
                upstream.getMessage());
            return finish(claim, payment, RailResult.failed(upstream.getMessage()), upstream.getCode());
        }
        log.error("Unexpected {} rail failure for intent {}", rail.getRailName(), claim.getIntentId(), cause);
        return finish(claim, payment, RailResult.failed(String.valueOf(cause.getMessage())),
            ErrorCode.RAIL_EXECUTION_FAILED);
    }

    /**
     * Turn the rail's answer into the final record. Split legs that settled
     * before a failure are written to the ledger with status {@code partial}.
     */
    private ExecutionRecord finish(ExecutionRecord claim, ResolvedPayment payment, RailResult result,
                                   ErrorCode failureCode) {
        Instant now = clock.instant();
        PaymentIntent intent = payment.getIntent();

        if (!result.isSuccess()) {
            List<String> settledIds = recordSettledLegs(claim, intent, result);
            log.warn("Intent {} {}: {} {}{}", claim.getIntentId(), DispatchState.EXECUTED_FAILED,
                failureCode, result.getError(), settledIds.isEmpty() ? "" : ", settled legs " + settledIds);
            PaymentResponse failure = baseResponse(claim, payment, now)
                .success(false)
                .status(result.isPartial() ? RailResult.PARTIAL_STATUS : FAILED_STATUS)
                .settledTransactionIds(settledIds.isEmpty() ? null : settledIds)
                .error(result.getError())
                .code(failureCode)
                .build();
            return claim.toBuilder()
                .state(DispatchState.EXECUTED_FAILED)
                .response(failure)
                .completedAt(now)
                .build();
        }

        String transactionId = ledger.append(Transaction.builder()
            .transactionHash(result.getTransactionHash())
            .intentId(claim.getIntentId())
            .fromAddress(claim.getFromAddress())
            .toAddress(payment.getLedgerRecipient())
            .amount(intent.getAmount())
            .currency(currencyOf(intent))
            .paymentType(intent.paymentType())
            .status(result.getStatus())
            .memo(memoOf(intent))
            .railReference(result.getReference())
            .build());
        Optional<Subscription> subscription = openSubscription(claim, payment, result);

        log.info("Intent {} {}: tx={}, hash={}, status={}", claim.getIntentId(), DispatchState.EXECUTED_SUCCESS,
            transactionId, result.getTransactionHash(), result.getStatus());

        PaymentResponse success = baseResponse(claim, payment, now)
            .success(true)
            .transactionId(transactionId)
            .transactionHash(result.getTransactionHash())
            .status(result.getStatus())
            .explorerUrl(explorerLink(result.getTransactionHash()))
            .subscriptionId(subscription.map(Subscription::getId).orElse(null))
            .build();
        return claim.toBuilder()
            .state(DispatchState.EXECUTED_SUCCESS)
            .response(success)
            .completedAt(now)
            .build();
    }

    private List<String> recordSettledLegs(ExecutionRecord claim, PaymentIntent intent, RailResult result) {
        List<String> ids = new ArrayList<>();
        for (RailResult.SettledLeg leg : result.getSettledLegs()) {
            ids.add(ledger.append(Transaction.builder()
                .transactionHash(leg.getTransactionHash())
                .intentId(claim.getIntentId())
                .fromAddress(claim.getFromAddress())
                .toAddress(leg.getToAddress())
                .amount(leg.getAmount())
                .currency(currencyOf(intent))
                .paymentType(intent.paymentType())
                .status(RailResult.PARTIAL_STATUS)
                .memo(memoOf(intent))
                .railReference(leg.getReference())
                .build()));
        }
        return ids;
    }

    private PaymentResponse.PaymentResponseBuilder baseResponse(ExecutionRecord claim, ResolvedPayment payment,
                                                                Instant now) {
        PaymentIntent intent = payment.getIntent();
        return PaymentResponse.builder()
            .intentId(claim.getIntentId())
            .paymentType(intent.paymentType())
            .amount(intent.getAmount())
            .currency(currencyOf(intent))
            .fromAddress(claim.getFromAddress())
            .toAddress(payment.getLedgerRecipient())
            .timestamp(now);
    }

    private RailResult submit(ExecutionRecord claim, ResolvedPayment payment) {
        String intentId = claim.getIntentId();
        String from = claim.getFromAddress();
        return payment.getIntent().accept(new PaymentIntent.Visitor<RailResult>() {
            @Override
            public RailResult visitSingle(SinglePaymentIntent single) {
                return rail.sendPayment(TransferInstruction.builder()
                    .intentId(intentId)
                    .fromAddress(from)
                    .toAddress(payment.getLedgerRecipient())
                    .amount(single.getAmount())
                    .currency(currencyOf(single))
                    .memo(single.getMemo())
                    .build());
            }

            @Override
            public RailResult visitSubscription(SubscriptionPaymentIntent subscription) {
                return rail.createSubscription(SubscriptionInstruction.builder()
                    .intentId(intentId)
                    .fromAddress(from)
                    .toAddress(payment.getLedgerRecipient())
                    .amount(subscription.getAmount())
                    .currency(currencyOf(subscription))
                    .frequency(subscription.getFrequency())
                    .startDate(subscription.getStartDate())
                    .build());
            }

            @Override
            public RailResult visitSplit(SplitPaymentIntent split) {
                return rail.splitPayment(SplitInstruction.builder()
                    .intentId(intentId)
                    .fromAddress(from)
                    .totalAmount(split.getAmount())
                    .currency(currencyOf(split))
                    .memo(split.getMemo())
                    .legs(payment.getLegs())
                    .build());
            }
        });
    }

    private Optional<Subscription> openSubscription(ExecutionRecord claim, ResolvedPayment payment, RailResult result) {
        return payment.getIntent().accept(new PaymentIntent.Visitor<Optional<Subscription>>() {
            @Override
            public Optional<Subscription> visitSingle(SinglePaymentIntent single) {
                return Optional.empty();
            }

            @Override
            public Optional<Subscription> visitSubscription(SubscriptionPaymentIntent subscription) {
                return Optional.of(subscriptionService.create(Subscription.builder()
                    .intentId(claim.getIntentId())
                    .fromAddress(claim.getFromAddress())
                    .toAddress(payment.getLedgerRecipient())
                    .amount(subscription.getAmount())
                    .currency(currencyOf(subscription))
                    .frequency(subscription.getFrequency())
                    .nextPayment(subscription.getStartDate())
                    .transactionHash(result.getTransactionHash())
                    .build()));
            }

            @Override
            public Optional<Subscription> visitSplit(SplitPaymentIntent split) {
                return Optional.empty();
            }
        });
    }

    private static String memoOf(PaymentIntent intent) {
        return intent.accept(new PaymentIntent.Visitor<String>() {
            @Override
            public String visitSingle(SinglePaymentIntent single) {
                return single.getMemo();
            }

            @Override
            public String visitSubscription(SubscriptionPaymentIntent subscription) {
                return null;
            }

            @Override
            public String visitSplit(SplitPaymentIntent split) {
                return split.getMemo();
            }
        });
    }

    private static String currencyOf(PaymentIntent intent) {
        return intent.getCurrency().trim().toUpperCase(Locale.ROOT);
    }

    private String explorerLink(String transactionHash) {
        if (transactionHash == null || explorerUrl == null || explorerUrl.isBlank()) {
            return null;
        }
        return explorerUrl + "/tx/" + transactionHash;
    }

    private DispatchOutcome reject(String intentId, StepResult<?> failure) {
        if (failure.getCode().getCategory() == ErrorCategory.AUTHORIZATION) {
            log.warn("Intent {} {}: {}", intentId, DispatchState.REJECTED, failure.getCode());
        } else {
            log.info("Intent {} {}: {} {}", intentId, DispatchState.REJECTED, failure.getCode(), failure.getMessage());
        }
        return DispatchOutcome.rejected(failure.getCode(), failure.getMessage());
    }
}
