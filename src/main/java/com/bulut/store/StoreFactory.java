package com.bulut.store;

/**
 * Hands out namespaced stores. Opening the same namespace twice returns a view
 * over the same data.
 */
public interface StoreFactory {

    <V> KeyValueStore<V> open(String namespace, Class<V> type);

    /**
     * Name of this binding, for logging.
     */
    String getStoreName();
}
