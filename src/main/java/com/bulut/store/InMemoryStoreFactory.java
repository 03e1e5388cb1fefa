package com.bulut.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory store binding for tests and local development.
 *
 * NOT FOR PRODUCTION: state is lost on restart.
 */
@Component
@ConditionalOnProperty(prefix = "bulut.store", name = "type", havingValue = "memory")
@Slf4j
public class InMemoryStoreFactory implements StoreFactory {

    // key: namespace
    private final Map<String, InMemoryKeyValueStore<?>> stores = new ConcurrentHashMap<>();

    @Override
    @SuppressWarnings("unchecked")
    public <V> KeyValueStore<V> open(String namespace, Class<V> type) {
        return (KeyValueStore<V>) stores.computeIfAbsent(namespace, ns -> {
            log.debug("Opening in-memory store namespace={}", ns);
            return new InMemoryKeyValueStore<V>();
        });
    }

    @Override
    public String getStoreName() {
        return "memory";
    }

    static class InMemoryKeyValueStore<V> implements KeyValueStore<V> {

        // insertion ordered; every access holds the monitor
        private final Map<String, V> entries = new LinkedHashMap<>();

        @Override
        public synchronized Optional<V> get(String key) {
            return Optional.ofNullable(entries.get(key));
        }

        @Override
        public synchronized void put(String key, V value) {
            entries.put(key, Objects.requireNonNull(value, "value"));
        }

        @Override
        public synchronized boolean putIfAbsent(String key, V value) {
            if (entries.containsKey(key)) {
                return false;
            }
            entries.put(key, Objects.requireNonNull(value, "value"));
            return true;
        }

        @Override
        public synchronized boolean compareAndSet(String key, V expected, V update) {
            V current = entries.get(key);
            if (!Objects.equals(current, expected)) {
                return false;
            }
            entries.put(key, Objects.requireNonNull(update, "update"));
            return true;
        }

        @Override
        public synchronized boolean remove(String key, V expected) {
            V current = entries.get(key);
            if (current == null || !current.equals(expected)) {
                return false;
            }
            entries.remove(key);
            return true;
        }

        @Override
        public synchronized List<V> values() {
            return new ArrayList<>(entries.values());
        }

        @Override
        public synchronized int size() {
            return entries.size();
        }
    }
}
