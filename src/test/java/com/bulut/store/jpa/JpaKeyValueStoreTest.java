package com.bulut.store.jpa;

import com.bulut.alias.AliasRecord;
import com.bulut.ledger.Transaction;
import com.bulut.intent.PaymentType;
import com.bulut.store.KeyValueStore;
import com.bulut.store.StoreFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the JPA store binding against H2.
 */
@SpringBootTest(properties = "bulut.store.type=jpa")
@ActiveProfiles("test")
class JpaKeyValueStoreTest {

    @Autowired
    private StoreFactory storeFactory;

    private KeyValueStore<AliasRecord> store;

    @BeforeEach
    void setUp() {
        assertEquals("jpa", storeFactory.getStoreName());
        store = storeFactory.open("test-" + UUID.randomUUID(), AliasRecord.class);
    }

    private AliasRecord record(String alias, String address) {
        Instant now = Instant.parse("2026-05-01T10:15:30.123456Z");
        return AliasRecord.builder().alias(alias).address(address).registeredAt(now).lastUsed(now).build();
    }

    @Test
    void testPutIfAbsent_FirstWriterWins() {
        AliasRecord first = record("alice", "0x1111111111111111111111111111111111111111");
        AliasRecord second = record("alice", "0x2222222222222222222222222222222222222222");

        assertTrue(store.putIfAbsent("alice", first));
        assertFalse(store.putIfAbsent("alice", second));
        assertEquals(first, store.get("alice").orElseThrow());
        assertEquals(1, store.size());
    }

    @Test
    void testCompareAndSet() {
        AliasRecord original = record("bob", "0x1111111111111111111111111111111111111111");
        AliasRecord touched = original.toBuilder().lastUsed(Instant.parse("2026-05-02T00:00:00Z")).build();
        store.put("bob", original);

        assertTrue(store.compareAndSet("bob", original, touched));
        // stale expectation loses
        assertFalse(store.compareAndSet("bob", original, original));
        assertEquals(touched, store.get("bob").orElseThrow());

        // null expectation means "absent"
        assertFalse(store.compareAndSet("bob", null, original));
        assertTrue(store.compareAndSet("carol", null, record("carol", "0x3333333333333333333333333333333333333333")));
    }

    @Test
    void testRemove_OnlyWhenUnchanged() {
        AliasRecord original = record("dave", "0x1111111111111111111111111111111111111111");
        store.put("dave", original);

        assertFalse(store.remove("dave", original.toBuilder().lastUsed(Instant.EPOCH).build()));
        assertTrue(store.remove("dave", original));
        assertTrue(store.get("dave").isEmpty());
        assertFalse(store.remove("dave", original));
    }

    @Test
    void testValues_InsertionOrder() {
        store.put("zed", record("zed", "0x1111111111111111111111111111111111111111"));
        store.put("amy", record("amy", "0x2222222222222222222222222222222222222222"));
        store.put("kim", record("kim", "0x3333333333333333333333333333333333333333"));
        // overwrite keeps position
        store.put("zed", record("zed", "0x4444444444444444444444444444444444444444"));

        List<String> order = store.values().stream().map(AliasRecord::getAlias).collect(Collectors.toList());
        assertEquals(List.of("zed", "amy", "kim"), order);
        assertEquals("0x4444444444444444444444444444444444444444", store.get("zed").orElseThrow().getAddress());
    }

    @Test
    void testNamespacesAreIsolated() {
        KeyValueStore<AliasRecord> other = storeFactory.open("test-" + UUID.randomUUID(), AliasRecord.class);
        store.put("erin", record("erin", "0x1111111111111111111111111111111111111111"));

        assertTrue(other.get("erin").isEmpty());
        assertEquals(0, other.size());
    }

    @Test
    void testImmutableValueRoundTrip() {
        KeyValueStore<Transaction> transactions = storeFactory.open("test-" + UUID.randomUUID(), Transaction.class);
        Transaction transaction = Transaction.builder()
            .id("tx_0123456789abcdef")
            .transactionHash("0xabc")
            .intentId("i1")
            .fromAddress("0x1111111111111111111111111111111111111111")
            .toAddress(Transaction.MULTIPLE_RECIPIENTS)
            .amount(new BigDecimal("120.50"))
            .currency("USDC")
            .paymentType(PaymentType.SPLIT)
            .status("confirmed")
            .timestamp(Instant.parse("2026-05-01T10:15:30Z"))
            .build();

        assertTrue(transactions.putIfAbsent(transaction.getId(), transaction));
        assertEquals(transaction, transactions.get(transaction.getId()).orElseThrow());
    }
}
