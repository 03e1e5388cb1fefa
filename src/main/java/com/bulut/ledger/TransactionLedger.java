package com.bulut.ledger;

import com.bulut.common.AddressCodec;
import com.bulut.config.BulutProperties;
import com.bulut.store.KeyValueStore;
import com.bulut.store.StoreFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Append-only ledger of executed transfers.
 *
 * Every transfer the dispatcher settles is recorded here exactly once. Records
 * are indexed by id and by rail transaction hash; history queries filter by
 * participant address.
 */
@Service
@Slf4j
public class TransactionLedger {

    static final String TRANSACTION_NAMESPACE = "transactions";
    static final String HASH_NAMESPACE = "transaction-by-hash";

    private final KeyValueStore<Transaction> transactions;
    private final KeyValueStore<String> idByHash;
    private final BulutProperties.Ledger config;
    private final Clock clock;

    public TransactionLedger(StoreFactory storeFactory, BulutProperties properties, Clock clock) {
        this.transactions = storeFactory.open(TRANSACTION_NAMESPACE, Transaction.class);
        this.idByHash = storeFactory.open(HASH_NAMESPACE, String.class);
        this.config = properties.getLedger();
        this.clock = clock;
    }

    /**
     * Record a transaction. Id and timestamp are assigned here; any values on
     * the draft for those two fields are ignored.
     *
     * @return the assigned id
     */
    public String append(Transaction draft) {
        Instant timestamp = clock.instant();
        Transaction normalized = draft.toBuilder()
            .fromAddress(AddressCodec.normalize(draft.getFromAddress()))
            .toAddress(Transaction.MULTIPLE_RECIPIENTS.equals(draft.getToAddress())
                ? Transaction.MULTIPLE_RECIPIENTS
                : AddressCodec.normalize(draft.getToAddress()))
            .timestamp(timestamp)
            .build();

        Transaction stored;
        int attempt = 0;
        do {
            String id = deriveId(normalized, attempt++);
            stored = normalized.toBuilder().id(id).build();
        } while (!transactions.putIfAbsent(stored.getId(), stored));

        if (stored.getTransactionHash() != null
            && !idByHash.putIfAbsent(stored.getTransactionHash(), stored.getId())) {
            log.warn("Transaction hash {} already indexed; keeping the first record", stored.getTransactionHash());
        }

        log.info("Recorded {} transaction: id={}, hash={}, from={}, to={}, amount={} {}, status={}",
            stored.getPaymentType(), stored.getId(), stored.getTransactionHash(),
            stored.getFromAddress(), stored.getToAddress(), stored.getAmount(), stored.getCurrency(),
            stored.getStatus());
        return stored.getId();
    }

    public Optional<Transaction> getById(String id) {
        return transactions.get(id);
    }

    public Optional<Transaction> getByHash(String hash) {
        if (hash == null || hash.isBlank()) {
            return Optional.empty();
        }
        return idByHash.get(hash.trim()).flatMap(transactions::get);
    }

    /**
     * Transactions where {@code address} is payer or payee, newest first.
     * {@code limit} is clamped to the configured maximum page size.
     */
    public HistoryPage history(String address, int limit, int offset) {
        String canonical = AddressCodec.normalize(address);
        int pageSize = clampLimit(limit);
        int start = Math.max(0, offset);

        // newest append first, then a stable sort keeps that order for equal timestamps
        List<Transaction> matching = new ArrayList<>();
        for (Transaction transaction : transactions.values()) {
            if (transaction.involves(canonical)) {
                matching.add(transaction);
            }
        }
        Collections.reverse(matching);
        matching.sort(Comparator.comparing(Transaction::getTimestamp).reversed());

        List<Transaction> page = start >= matching.size()
            ? List.of()
            : List.copyOf(matching.subList(start, Math.min(matching.size(), start + pageSize)));

        log.debug("History for {}: total={}, offset={}, limit={}, returned={}",
            canonical, matching.size(), start, pageSize, page.size());

        return HistoryPage.builder()
            .address(canonical)
            .totalCount(matching.size())
            .count(page.size())
            .offset(start)
            .limit(pageSize)
            .transactions(page)
            .build();
    }

    public int count() {
        return transactions.size();
    }

    private int clampLimit(int limit) {
        if (limit <= 0) {
            return config.getDefaultPageSize();
        }
        return Math.min(limit, config.getMaxPageSize());
    }

    private static String deriveId(Transaction transaction, int attempt) {
        String content = String.join("|",
            String.valueOf(transaction.getTransactionHash()),
            String.valueOf(transaction.getIntentId()),
            transaction.getFromAddress(),
            transaction.getToAddress(),
            transaction.getAmount().toPlainString(),
            String.valueOf(transaction.getCurrency()),
            String.valueOf(transaction.getPaymentType()),
            String.valueOf(transaction.getStatus()),
            transaction.getTimestamp().toString(),
            Integer.toString(attempt));
        byte[] digest = Hash.sha256(content.getBytes(StandardCharsets.UTF_8));
        return "tx_" + Numeric.toHexStringNoPrefix(digest).substring(0, 16);
    }
}
