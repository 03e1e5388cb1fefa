package com.bulut.store;

import java.util.List;
import java.util.Optional;

/**
 * Minimal keyed store the registry, ledger and dispatcher are written against.
 *
 * Implementations must make {@link #putIfAbsent}, {@link #compareAndSet} and
 * {@link #remove} atomic with respect to concurrent callers on the same key,
 * and must return {@link #values()} in insertion order.
 *
 * @param <V> stored value type; equality is {@link Object#equals}
 */
public interface KeyValueStore<V> {

    Optional<V> get(String key);

    /**
     * Insert or overwrite unconditionally.
     */
    void put(String key, V value);

    /**
     * Insert only if no value is stored under the key.
     *
     * @return true if the value was inserted
     */
    boolean putIfAbsent(String key, V value);

    /**
     * Replace the stored value only if it currently equals {@code expected}.
     *
     * @param expected the value the caller last read; {@code null} means "absent"
     * @return true if the swap happened
     */
    boolean compareAndSet(String key, V expected, V update);

    /**
     * Remove the entry only if it currently equals {@code expected}.
     *
     * @return true if the entry was removed
     */
    boolean remove(String key, V expected);

    List<V> values();

    int size();
}
