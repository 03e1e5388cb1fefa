package com.bulut.store.jpa;

import com.bulut.common.exception.BulutException;
import com.bulut.common.exception.ErrorCode;
import com.bulut.store.KeyValueStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link KeyValueStore} over {@link StoreEntryRepository}.
 *
 * Values are stored as JSON. Conditional writes read the current row, compare
 * the decoded value, and then update or delete guarded by the row version, so a
 * concurrent writer in between makes the guarded statement hit zero rows.
 * Concurrent inserts of the same key are resolved by the unique constraint.
 */
@Slf4j
class JpaKeyValueStore<V> implements KeyValueStore<V> {

    private final String namespace;
    private final Class<V> type;
    private final StoreEntryRepository repository;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate tx;

    JpaKeyValueStore(String namespace, Class<V> type, StoreEntryRepository repository,
                     ObjectMapper objectMapper, TransactionTemplate tx) {
        this.namespace = namespace;
        this.type = type;
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.tx = tx;
    }

    @Override
    public Optional<V> get(String key) {
        return repository.findByNamespaceAndEntryKey(namespace, key).map(this::decode);
    }

    @Override
    public void put(String key, V value) {
        String payload = encode(Objects.requireNonNull(value, "value"));
        tx.executeWithoutResult(status -> {
            Optional<StoreEntry> existing = repository.findByNamespaceAndEntryKey(namespace, key);
            if (existing.isPresent()) {
                StoreEntry entry = existing.get();
                repository.updateIfVersion(entry.getId(), entry.getVersion(), payload);
            } else {
                repository.saveAndFlush(new StoreEntry(namespace, key, payload));
            }
        });
    }

    @Override
    public boolean putIfAbsent(String key, V value) {
        String payload = encode(Objects.requireNonNull(value, "value"));
        try {
            Boolean inserted = tx.execute(status -> {
                if (repository.findByNamespaceAndEntryKey(namespace, key).isPresent()) {
                    return false;
                }
                repository.saveAndFlush(new StoreEntry(namespace, key, payload));
                return true;
            });
            return Boolean.TRUE.equals(inserted);
        } catch (DataIntegrityViolationException e) {
            log.debug("Concurrent insert lost: namespace={}, key={}", namespace, key);
            return false;
        }
    }

    @Override
    public boolean compareAndSet(String key, V expected, V update) {
        if (expected == null) {
            return putIfAbsent(key, update);
        }
        String payload = encode(Objects.requireNonNull(update, "update"));
        Boolean swapped = tx.execute(status -> {
            Optional<StoreEntry> current = repository.findByNamespaceAndEntryKey(namespace, key);
            if (current.isEmpty() || !expected.equals(decode(current.get()))) {
                return false;
            }
            StoreEntry entry = current.get();
            return repository.updateIfVersion(entry.getId(), entry.getVersion(), payload) == 1;
        });
        return Boolean.TRUE.equals(swapped);
    }

    @Override
    public boolean remove(String key, V expected) {
        Boolean removed = tx.execute(status -> {
            Optional<StoreEntry> current = repository.findByNamespaceAndEntryKey(namespace, key);
            if (current.isEmpty() || !decode(current.get()).equals(expected)) {
                return false;
            }
            StoreEntry entry = current.get();
            return repository.deleteIfVersion(entry.getId(), entry.getVersion()) == 1;
        });
        return Boolean.TRUE.equals(removed);
    }

    @Override
    public List<V> values() {
        return repository.findByNamespaceOrderByIdAsc(namespace).stream()
            .map(this::decode)
            .collect(Collectors.toList());
    }

    @Override
    public int size() {
        return (int) repository.countByNamespace(namespace);
    }

    private String encode(V value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new BulutException(ErrorCode.INTERNAL_ERROR,
                "Cannot encode " + type.getSimpleName() + " for store " + namespace, e);
        }
    }

    private V decode(StoreEntry entry) {
        try {
            return objectMapper.readValue(entry.getPayload(), type);
        } catch (JsonProcessingException e) {
            throw new BulutException(ErrorCode.INTERNAL_ERROR,
                "Corrupt entry " + entry.getEntryKey() + " in store " + namespace, e);
        }
    }
}
