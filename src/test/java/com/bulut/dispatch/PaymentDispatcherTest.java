package com.bulut.dispatch;

import com.bulut.TestWallet;
import com.bulut.alias.AliasRegistry;
import com.bulut.common.exception.AuthorizationException;
import com.bulut.common.exception.ErrorCode;
import com.bulut.common.exception.UpstreamException;
import com.bulut.config.BulutProperties;
import com.bulut.intent.Frequency;
import com.bulut.intent.IntentError;
import com.bulut.intent.PaymentIntent;
import com.bulut.intent.PaymentType;
import com.bulut.intent.SinglePaymentIntent;
import com.bulut.intent.SplitPaymentIntent;
import com.bulut.intent.SubscriptionPaymentIntent;
import com.bulut.ledger.HistoryPage;
import com.bulut.ledger.Transaction;
import com.bulut.ledger.TransactionLedger;
import com.bulut.rail.RailResult;
import com.bulut.rail.SettlementRail;
import com.bulut.rail.SplitInstruction;
import com.bulut.rail.SubscriptionInstruction;
import com.bulut.rail.TransferInstruction;
import com.bulut.signature.SignatureAuthorizer;
import com.bulut.store.InMemoryStoreFactory;
import com.bulut.subscription.Subscription;
import com.bulut.subscription.SubscriptionService;
import com.bulut.subscription.SubscriptionStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PaymentDispatcher.
 *
 * Runs the real registry, ledger, signature checks and in-memory store against
 * a mocked settlement rail so every rail call can be counted.
 */
@ExtendWith(MockitoExtension.class)
class PaymentDispatcherTest {

    @Mock
    private SettlementRail rail;

    private ExecutorService railPool;
    private BulutProperties properties;
    private SignatureAuthorizer signatureAuthorizer;
    private AliasRegistry aliasRegistry;
    private TransactionLedger ledger;
    private SubscriptionService subscriptionService;
    private PaymentDispatcher dispatcher;

    private TestWallet payer;
    private TestWallet alice;
    private TestWallet bob;
    private TestWallet carol;

    @BeforeEach
    void setUp() {
        railPool = Executors.newCachedThreadPool();
        properties = new BulutProperties();
        properties.getDispatch().setRailTimeout(Duration.ofSeconds(5));
        dispatcher = newDispatcher(properties);

        payer = TestWallet.random();
        alice = TestWallet.random();
        bob = TestWallet.random();
        carol = TestWallet.random();
        registerAlias("alice", alice);
        registerAlias("bob", bob);
    }

    @AfterEach
    void tearDown() {
        railPool.shutdownNow();
    }

    private PaymentDispatcher newDispatcher(BulutProperties props) {
        InMemoryStoreFactory storeFactory = new InMemoryStoreFactory();
        Clock clock = Clock.systemUTC();
        signatureAuthorizer = new SignatureAuthorizer(props);
        aliasRegistry = new AliasRegistry(storeFactory, signatureAuthorizer, props, clock);
        ledger = new TransactionLedger(storeFactory, props, clock);
        subscriptionService = new SubscriptionService(storeFactory, clock);
        return new PaymentDispatcher(aliasRegistry, signatureAuthorizer, ledger, subscriptionService,
            rail, railPool, storeFactory, props, clock);
    }

    private void registerAlias(String alias, TestWallet wallet) {
        String proof = wallet.sign(signatureAuthorizer.buildRegistrationMessage(alias, wallet.address()));
        assertTrue(aliasRegistry.register(alias, wallet.address(), proof).isRegistered());
    }

    private SinglePaymentIntent single(String amount, String recipient) {
        return SinglePaymentIntent.builder()
            .amount(new BigDecimal(amount))
            .currency("USDC")
            .confidence(0.95)
            .recipientAlias(recipient)
            .memo("lunch")
            .build();
    }

    private SplitPaymentIntent split(String amount, Object... aliasesAndShares) {
        List<SplitPaymentIntent.Recipient> recipients = new ArrayList<>();
        for (int i = 0; i < aliasesAndShares.length; i += 2) {
            recipients.add(new SplitPaymentIntent.Recipient((String) aliasesAndShares[i],
                new BigDecimal((String) aliasesAndShares[i + 1])));
        }
        return SplitPaymentIntent.builder()
            .amount(new BigDecimal(amount))
            .currency("USDC")
            .confidence(0.9)
            .recipients(recipients)
            .build();
    }

    private String signSingle(TestWallet signer, String intentId, PaymentType type, String to, String amount) {
        return signer.sign(signatureAuthorizer.buildAuthorizationMessage(intentId, type.getWireName(),
            signer.address(), to, new BigDecimal(amount), "USDC"));
    }

    private ExecutePaymentCommand command(String intentId, PaymentIntent intent, String signature) {
        return ExecutePaymentCommand.builder()
            .intentId(intentId)
            .intent(intent)
            .userSignature(signature)
            .userAddress(payer.address())
            .headerAddress(payer.address())
            .headerSignature(signature)
            .build();
    }

    private ExecutePaymentCommand signedSingle(String intentId, String amount) {
        String signature = signSingle(payer, intentId, PaymentType.SINGLE, alice.address(), amount);
        return command(intentId, single(amount, "@alice"), signature);
    }

    @Test
    void testSinglePayment_Success() {
        when(rail.sendPayment(any())).thenReturn(RailResult.succeeded("0xhash1", "pending", "ref-1"));

        DispatchOutcome outcome = dispatcher.dispatch(signedSingle("i1", "50"));

        assertEquals(DispatchState.EXECUTED_SUCCESS, outcome.getState());
        assertFalse(outcome.isReplayed());
        PaymentResponse response = outcome.getResponse();
        assertTrue(response.isSuccess());
        assertEquals("0xhash1", response.getTransactionHash());
        // status is whatever the rail reported
        assertEquals("pending", response.getStatus());
        assertEquals("https://explorer.arc.network/tx/0xhash1", response.getExplorerUrl());
        assertEquals(payer.address(), response.getFromAddress());
        assertEquals(alice.address(), response.getToAddress());

        ArgumentCaptor<TransferInstruction> sent = ArgumentCaptor.forClass(TransferInstruction.class);
        verify(rail).sendPayment(sent.capture());
        assertEquals(alice.address(), sent.getValue().getToAddress());
        assertEquals(0, new BigDecimal("50").compareTo(sent.getValue().getAmount()));

        HistoryPage history = ledger.history(payer.address(), 10, 0);
        assertEquals(1, history.getTotalCount());
        Transaction recorded = history.getTransactions().get(0);
        assertEquals(payer.address(), recorded.getFromAddress());
        assertEquals(alice.address(), recorded.getToAddress());
        assertEquals(0, new BigDecimal("50").compareTo(recorded.getAmount()));
        assertEquals("pending", recorded.getStatus());
        assertEquals("lunch", recorded.getMemo());
        assertEquals(recorded, ledger.getByHash("0xhash1").orElseThrow());
    }

    @Test
    void testResubmission_ReturnsRecordedResultWithoutSecondRailCall() {
        when(rail.sendPayment(any())).thenReturn(RailResult.succeeded("0xonce", "confirmed", "ref"));
        ExecutePaymentCommand command = signedSingle("retry-1", "50");

        DispatchOutcome first = dispatcher.dispatch(command);
        DispatchOutcome second = dispatcher.dispatch(command);

        verify(rail, times(1)).sendPayment(any());
        assertTrue(second.isReplayed());
        assertEquals(first.getResponse(), second.getResponse());
        assertEquals(1, ledger.count());
    }

    @Test
    void testResubmission_WithForeignSignatureRejected() {
        when(rail.sendPayment(any())).thenReturn(RailResult.succeeded("0xonce", "confirmed", "ref"));
        dispatcher.dispatch(signedSingle("taken", "50"));

        // a valid signature for another intent cannot read back this one
        String otherSignature = signSingle(payer, "other", PaymentType.SINGLE, alice.address(), "50");
        DispatchOutcome outcome = dispatcher.dispatch(command("taken", single("50", "@alice"), otherSignature));

        assertTrue(outcome.isRejected());
        assertEquals(ErrorCode.INVALID_SIGNATURE, outcome.getCode());
        verify(rail, times(1)).sendPayment(any());
    }

    @Test
    void testConcurrentDuplicates_SettleOnce() throws Exception {
        CountDownLatch railEntered = new CountDownLatch(1);
        CountDownLatch releaseRail = new CountDownLatch(1);
        when(rail.sendPayment(any())).thenAnswer(invocation -> {
            railEntered.countDown();
            releaseRail.await(5, TimeUnit.SECONDS);
            return RailResult.succeeded("0xdup", "confirmed", "ref");
        });
        ExecutePaymentCommand command = signedSingle("dup-1", "25");

        ExecutorService callers = Executors.newFixedThreadPool(4);
        try {
            List<Future<DispatchOutcome>> futures = new ArrayList<>();
            Callable<DispatchOutcome> submit = () -> dispatcher.dispatch(command);
            futures.add(callers.submit(submit));
            assertTrue(railEntered.await(5, TimeUnit.SECONDS));
            for (int i = 0; i < 3; i++) {
                futures.add(callers.submit(submit));
            }
            List<DispatchOutcome> duplicates = new ArrayList<>();
            for (Future<DispatchOutcome> future : futures.subList(1, futures.size())) {
                duplicates.add(future.get(5, TimeUnit.SECONDS));
            }
            releaseRail.countDown();
            DispatchOutcome winner = futures.get(0).get(5, TimeUnit.SECONDS);

            assertEquals(DispatchState.EXECUTED_SUCCESS, winner.getState());
            for (DispatchOutcome duplicate : duplicates) {
                assertEquals(ErrorCode.INTENT_IN_PROGRESS, duplicate.getCode());
            }
            verify(rail, times(1)).sendPayment(any());
            assertEquals(1, ledger.count());

            // once settled, a retry gets the recorded result
            DispatchOutcome retry = dispatcher.dispatch(command);
            assertEquals(winner.getResponse(), retry.getResponse());
        } finally {
            releaseRail.countDown();
            callers.shutdownNow();
        }
    }

    @Test
    void testReplayAgainstOtherIntentId_Rejected() {
        String signatureForA = signSingle(payer, "A", PaymentType.SINGLE, alice.address(), "50");

        DispatchOutcome outcome = dispatcher.dispatch(command("B", single("50", "@alice"), signatureForA));

        assertTrue(outcome.isRejected());
        assertEquals(ErrorCode.INVALID_SIGNATURE, outcome.getCode());
        assertEquals(AuthorizationException.GENERIC_MESSAGE, outcome.getMessage());
        verifyNoInteractions(rail);
        assertEquals(0, ledger.count());
    }

    @Test
    void testTamperedAmount_Rejected() {
        String signature = signSingle(payer, "t1", PaymentType.SINGLE, alice.address(), "5");

        DispatchOutcome outcome = dispatcher.dispatch(command("t1", single("500", "@alice"), signature));

        assertEquals(ErrorCode.INVALID_SIGNATURE, outcome.getCode());
        verifyNoInteractions(rail);
    }

    @Test
    void testSignatureBoundToResolvedRecipient() {
        // signed for bob's address but the intent names alice
        String signature = signSingle(payer, "r1", PaymentType.SINGLE, bob.address(), "50");

        DispatchOutcome outcome = dispatcher.dispatch(command("r1", single("50", "@alice"), signature));

        assertEquals(ErrorCode.INVALID_SIGNATURE, outcome.getCode());
        verifyNoInteractions(rail);
    }

    @Test
    void testAddressMismatch_RejectedBeforeSignatureCheck() {
        ExecutePaymentCommand command = ExecutePaymentCommand.builder()
            .intentId("m1")
            .intent(single("50", "@alice"))
            .userSignature("0xdeadbeef")
            .userAddress(payer.address())
            .headerAddress(bob.address())
            .headerSignature("0xdeadbeef")
            .build();

        DispatchOutcome outcome = dispatcher.dispatch(command);

        assertEquals(ErrorCode.ADDRESS_MISMATCH, outcome.getCode());
        assertEquals(AuthorizationException.GENERIC_MESSAGE, outcome.getMessage());
        verifyNoInteractions(rail);
    }

    @Test
    void testHeaderSignatureMustMatchBody() {
        ExecutePaymentCommand signed = signedSingle("h1", "50");
        ExecutePaymentCommand command = ExecutePaymentCommand.builder()
            .intentId("h1")
            .intent(signed.getIntent())
            .userSignature(signed.getUserSignature())
            .userAddress(payer.address())
            .headerAddress(payer.address())
            .headerSignature("0x" + "11".repeat(65))
            .build();

        DispatchOutcome outcome = dispatcher.dispatch(command);

        assertEquals(ErrorCode.INVALID_SIGNATURE, outcome.getCode());
        verifyNoInteractions(rail);
    }

    @Test
    void testSplitSharesMustSumToHundred() {
        // neither alias is registered: a resolution attempt would report RECIPIENT_NOT_FOUND instead
        for (String second : List.of("49", "51")) {
            SplitPaymentIntent intent = split("100", "@nobody", "50", "@nobody2", second);

            DispatchOutcome outcome = dispatcher.dispatch(command("s-" + second, intent, "0x00"));

            assertEquals(ErrorCode.INVALID_SPLIT, outcome.getCode(), "sum 50+" + second);
        }
        verifyNoInteractions(rail);
        assertEquals(0, ledger.count());
    }

    @Test
    void testSplitWithinToleranceAccepted() {
        when(rail.splitPayment(any())).thenReturn(RailResult.succeeded("0xsplit", "confirmed", "ref"));
        SplitPaymentIntent intent = split("10", "@alice", "33.33", "@bob", "66.675");
        String to = alice.address() + ":33.33," + bob.address() + ":66.675";
        String signature = signSingle(payer, "tol", PaymentType.SPLIT, to, "10");

        DispatchOutcome outcome = dispatcher.dispatch(command("tol", intent, signature));

        assertEquals(DispatchState.EXECUTED_SUCCESS, outcome.getState());
    }

    @Test
    void testSplitNeedsTwoRecipients() {
        DispatchOutcome outcome = dispatcher.dispatch(command("one", split("10", "@alice", "100"), "0x00"));

        assertEquals(ErrorCode.INVALID_SPLIT, outcome.getCode());
    }

    @Test
    void testSplitWithUnregisteredRecipient_NothingRecorded() {
        SplitPaymentIntent intent = split("120", "@bob", "50", "@carol", "50");

        DispatchOutcome outcome = dispatcher.dispatch(command("split-carol", intent, "0x00"));

        assertTrue(outcome.isRejected());
        assertEquals(ErrorCode.RECIPIENT_NOT_FOUND, outcome.getCode());
        assertTrue(outcome.getMessage().contains("@carol"), outcome.getMessage());
        verifyNoInteractions(rail);
        assertEquals(0, ledger.count());
    }

    @Test
    void testSplitPayment_LegsSumToTotal() {
        registerAlias("carol", carol);
        when(rail.splitPayment(any())).thenReturn(RailResult.succeeded("0xsplit", "confirmed", "ref"));
        SplitPaymentIntent intent = split("10", "@alice", "33.33", "@bob", "33.33", "@carol", "33.34");
        String to = alice.address() + ":33.33," + bob.address() + ":33.33," + carol.address() + ":33.34";
        String signature = signSingle(payer, "split-3", PaymentType.SPLIT, to, "10");

        DispatchOutcome outcome = dispatcher.dispatch(command("split-3", intent, signature));

        assertEquals(DispatchState.EXECUTED_SUCCESS, outcome.getState());
        ArgumentCaptor<SplitInstruction> sent = ArgumentCaptor.forClass(SplitInstruction.class);
        verify(rail).splitPayment(sent.capture());
        List<SplitInstruction.SplitLeg> legs = sent.getValue().getLegs();
        assertEquals(List.of(alice.address(), bob.address(), carol.address()),
            legs.stream().map(SplitInstruction.SplitLeg::getAddress).collect(Collectors.toList()));
        assertEquals(0, new BigDecimal("3.333").compareTo(legs.get(0).getAmount()));
        assertEquals(0, new BigDecimal("3.333").compareTo(legs.get(1).getAmount()));
        assertEquals(0, new BigDecimal("3.334").compareTo(legs.get(2).getAmount()));
        assertEquals(0, new BigDecimal("10").compareTo(
            legs.stream().map(SplitInstruction.SplitLeg::getAmount).reduce(BigDecimal.ZERO, BigDecimal::add)));

        Transaction recorded = ledger.getByHash("0xsplit").orElseThrow();
        assertEquals(Transaction.MULTIPLE_RECIPIENTS, recorded.getToAddress());
        assertEquals(PaymentType.SPLIT, recorded.getPaymentType());
    }

    @Test
    void testLegAmountTruncatesToSixDecimals() {
        assertEquals(new BigDecimal("0.333333"), PaymentDispatcher.legAmount(BigDecimal.ONE, new BigDecimal("33.3333333")));
        assertEquals(new BigDecimal("60.000000"), PaymentDispatcher.legAmount(new BigDecimal("120"), new BigDecimal("50")));
    }

    @Test
    void testSubscription_CreatesActiveRecord() {
        when(rail.createSubscription(any())).thenReturn(RailResult.succeeded("0xsub", "active", "ref"));
        SubscriptionPaymentIntent intent = SubscriptionPaymentIntent.builder()
            .amount(new BigDecimal("15"))
            .currency("usdc")
            .confidence(0.8)
            .recipientAlias("@alice")
            .frequency(Frequency.MONTHLY)
            .startDate(LocalDate.of(2026, 11, 1))
            .build();
        String signature = signSingle(payer, "sub-1", PaymentType.SUBSCRIPTION, alice.address(), "15");

        DispatchOutcome outcome = dispatcher.dispatch(command("sub-1", intent, signature));

        assertEquals(DispatchState.EXECUTED_SUCCESS, outcome.getState());
        assertEquals("active", outcome.getResponse().getStatus());
        assertEquals("USDC", outcome.getResponse().getCurrency());
        verify(rail).createSubscription(any(SubscriptionInstruction.class));

        Subscription subscription = subscriptionService.getSubscription(outcome.getResponse().getSubscriptionId());
        assertEquals(SubscriptionStatus.ACTIVE, subscription.getStatus());
        assertEquals(LocalDate.of(2026, 11, 1), subscription.getNextPayment());
        assertEquals(alice.address(), subscription.getToAddress());
    }

    @Test
    void testSubscriptionWithoutSchedule_Rejected() {
        SubscriptionPaymentIntent intent = SubscriptionPaymentIntent.builder()
            .amount(new BigDecimal("15"))
            .currency("USDC")
            .recipientAlias("@alice")
            .build();

        DispatchOutcome outcome = dispatcher.dispatch(command("sub-2", intent, "0x00"));

        assertEquals(ErrorCode.INVALID_INTENT, outcome.getCode());
    }

    @Test
    void testRailFailure_NoLedgerEntryAndErrorVerbatim() {
        when(rail.sendPayment(any())).thenReturn(RailResult.failed("insufficient token balance in wallet"));
        ExecutePaymentCommand command = signedSingle("fail-1", "50");

        DispatchOutcome outcome = dispatcher.dispatch(command);

        assertEquals(DispatchState.EXECUTED_FAILED, outcome.getState());
        assertFalse(outcome.getResponse().isSuccess());
        assertEquals("insufficient token balance in wallet", outcome.getResponse().getError());
        assertEquals(ErrorCode.RAIL_EXECUTION_FAILED, outcome.getResponse().getCode());
        assertEquals(0, ledger.count());

        // the failure is terminal for this intent id
        DispatchOutcome retry = dispatcher.dispatch(command);
        assertEquals(outcome.getResponse(), retry.getResponse());
        verify(rail, times(1)).sendPayment(any());
    }

    @Test
    void testRailUpstreamException_Recorded() {
        when(rail.sendPayment(any())).thenThrow(
            new UpstreamException(ErrorCode.RAIL_TIMEOUT, "circle", "Circle unavailable: Read timed out"));

        DispatchOutcome outcome = dispatcher.dispatch(signedSingle("up-1", "50"));

        assertEquals(DispatchState.EXECUTED_FAILED, outcome.getState());
        assertEquals(ErrorCode.RAIL_TIMEOUT, outcome.getResponse().getCode());
        assertEquals("Circle unavailable: Read timed out", outcome.getResponse().getError());
        assertEquals(0, ledger.count());
    }

    private PaymentDispatcher withRailTimeout(Duration timeout) {
        properties.getDispatch().setRailTimeout(timeout);
        PaymentDispatcher slow = newDispatcher(properties);
        registerAlias("alice", alice);
        return slow;
    }

    private DispatchOutcome awaitCompletion(PaymentDispatcher target, ExecutePaymentCommand command)
        throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        DispatchOutcome outcome = target.dispatch(command);
        while (outcome.isRejected() && System.nanoTime() < deadline) {
            Thread.sleep(20);
            outcome = target.dispatch(command);
        }
        return outcome;
    }

    @Test
    void testRailTimeout_LateSuccessStillRecorded() throws Exception {
        PaymentDispatcher slow = withRailTimeout(Duration.ofMillis(200));
        CountDownLatch release = new CountDownLatch(1);
        when(rail.sendPayment(any())).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return RailResult.succeeded("0xlate", "confirmed", "ref");
        });
        ExecutePaymentCommand command = signedSingle("slow-1", "50");

        DispatchOutcome outcome = slow.dispatch(command);

        assertEquals(DispatchState.TIMED_OUT, outcome.getState());
        assertFalse(outcome.getResponse().isSuccess());
        assertEquals("pending", outcome.getResponse().getStatus());
        assertEquals(ErrorCode.RAIL_TIMEOUT, outcome.getResponse().getCode());
        assertEquals(0, ledger.count());

        // still waiting on the rail: a retry must not start a second transfer
        assertEquals(ErrorCode.INTENT_IN_PROGRESS, slow.dispatch(command).getCode());

        release.countDown();
        DispatchOutcome completed = awaitCompletion(slow, command);

        assertEquals(DispatchState.EXECUTED_SUCCESS, completed.getState());
        assertTrue(completed.isReplayed());
        assertEquals("0xlate", completed.getResponse().getTransactionHash());
        assertEquals(1, ledger.count());
        assertEquals(payer.address(), ledger.getByHash("0xlate").orElseThrow().getFromAddress());
        verify(rail, times(1)).sendPayment(any());
    }

    @Test
    void testRailTimeout_LateFailureIsTerminal() throws Exception {
        PaymentDispatcher slow = withRailTimeout(Duration.ofMillis(200));
        CountDownLatch release = new CountDownLatch(1);
        when(rail.sendPayment(any())).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            throw new UpstreamException(ErrorCode.RAIL_EXECUTION_FAILED, "circle", "Circle error 400: bad wallet");
        });
        ExecutePaymentCommand command = signedSingle("slow-2", "50");

        assertEquals(DispatchState.TIMED_OUT, slow.dispatch(command).getState());
        release.countDown();
        DispatchOutcome completed = awaitCompletion(slow, command);

        assertEquals(DispatchState.EXECUTED_FAILED, completed.getState());
        assertEquals("Circle error 400: bad wallet", completed.getResponse().getError());
        assertEquals(0, ledger.count());
    }

    @Test
    void testSplitPartialFailure_SettledLegsRecorded() {
        RailResult partial = RailResult.partiallyFailed("Circle split leg 2 of 2 failed after legs [tr-a] were submitted",
            List.of(new RailResult.SettledLeg(alice.address(), new BigDecimal("60.000000"), "0xleg0", "tr-a")));
        when(rail.splitPayment(any())).thenReturn(partial);
        SplitPaymentIntent intent = split("120", "@alice", "50", "@bob", "50");
        String to = alice.address() + ":50," + bob.address() + ":50";
        String signature = signSingle(payer, "part-1", PaymentType.SPLIT, to, "120");

        DispatchOutcome outcome = dispatcher.dispatch(command("part-1", intent, signature));

        assertEquals(DispatchState.EXECUTED_FAILED, outcome.getState());
        PaymentResponse response = outcome.getResponse();
        assertFalse(response.isSuccess());
        assertEquals("partial", response.getStatus());
        assertEquals(ErrorCode.RAIL_EXECUTION_FAILED, response.getCode());
        assertEquals(1, response.getSettledTransactionIds().size());

        assertEquals(1, ledger.count());
        Transaction leg = ledger.getByHash("0xleg0").orElseThrow();
        assertEquals(response.getSettledTransactionIds().get(0), leg.getId());
        assertEquals("partial", leg.getStatus());
        assertEquals(alice.address(), leg.getToAddress());
        assertEquals(0, new BigDecimal("60").compareTo(leg.getAmount()));
        assertEquals(PaymentType.SPLIT, leg.getPaymentType());
        assertEquals("tr-a", leg.getRailReference());
        // bob's leg never settled
        assertEquals(0, ledger.history(bob.address(), 10, 0).getTotalCount());
    }

    @Test
    void testSplitWithEmptyRecipientEntry_Rejected() {
        SplitPaymentIntent intent = SplitPaymentIntent.builder()
            .amount(new BigDecimal("10"))
            .currency("USDC")
            .recipients(Arrays.asList(new SplitPaymentIntent.Recipient("@alice", new BigDecimal("50")), null))
            .build();

        DispatchOutcome outcome = dispatcher.dispatch(command("null-leg", intent, "0x00"));

        assertEquals(ErrorCode.INVALID_SPLIT, outcome.getCode());
        verifyNoInteractions(rail);
    }

    @Test
    void testIntentGating() {
        SinglePaymentIntent unsure = single("50", "@alice");
        unsure.setConfidence(0.2);
        assertEquals(ErrorCode.LOW_CONFIDENCE, dispatcher.dispatch(command("g1", unsure, "0x00")).getCode());

        SinglePaymentIntent broken = single("50", "@alice");
        broken.setError(new IntentError("missing_recipient", "Who should receive the payment?"));
        assertEquals(ErrorCode.INVALID_INTENT, dispatcher.dispatch(command("g2", broken, "0x00")).getCode());

        assertEquals(ErrorCode.INVALID_AMOUNT,
            dispatcher.dispatch(command("g3", single("0", "@alice"), "0x00")).getCode());
        assertEquals(ErrorCode.INVALID_AMOUNT,
            dispatcher.dispatch(command("g4", single("-5", "@alice"), "0x00")).getCode());
        assertEquals(ErrorCode.INVALID_FORMAT,
            dispatcher.dispatch(command("g5", single("5", "@a"), "0x00")).getCode());
        assertEquals(ErrorCode.INVALID_FORMAT,
            dispatcher.dispatch(command("bad id!", single("5", "@alice"), "0x00")).getCode());
        assertEquals(ErrorCode.INVALID_INTENT, dispatcher.dispatch(command("g6", null, "0x00")).getCode());

        verifyNoInteractions(rail);
    }

    @Test
    void testUnknownSingleRecipient() {
        String intentId = "intent-dave";

        DispatchOutcome outcome = dispatcher.dispatch(command(intentId, single("5", "@dave"), "0x00"));

        assertEquals(ErrorCode.RECIPIENT_NOT_FOUND, outcome.getCode());
        assertTrue(outcome.getMessage().contains("@dave"));
    }

    @Test
    void testRejectionConvertsToException() {
        DispatchOutcome outcome = dispatcher.dispatch(command("x1", single("5", "@dave"), "0x00"));

        assertEquals(ErrorCode.RECIPIENT_NOT_FOUND, outcome.toException().getCode());
        assertThrows(IllegalStateException.class, () -> DispatchOutcome.executed(
            ExecutionRecord.builder().state(DispatchState.EXECUTED_SUCCESS).build(), false).toException());
    }
}
