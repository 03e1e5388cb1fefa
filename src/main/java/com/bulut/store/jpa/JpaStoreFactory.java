package com.bulut.store.jpa;

import com.bulut.store.KeyValueStore;
import com.bulut.store.StoreFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Durable store binding on top of a single JPA table.
 */
@Component
@ConditionalOnProperty(prefix = "bulut.store", name = "type", havingValue = "jpa", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class JpaStoreFactory implements StoreFactory {

    private final StoreEntryRepository repository;
    private final ObjectMapper objectMapper;
    private final PlatformTransactionManager transactionManager;

    @Override
    public <V> KeyValueStore<V> open(String namespace, Class<V> type) {
        log.debug("Opening JPA store namespace={} type={}", namespace, type.getSimpleName());
        return new JpaKeyValueStore<>(namespace, type, repository, objectMapper,
            new TransactionTemplate(transactionManager));
    }

    @Override
    public String getStoreName() {
        return "jpa";
    }
}
