package com.bulut.store.jpa;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for store entries.
 */
@Repository
public interface StoreEntryRepository extends JpaRepository<StoreEntry, Long> {

    Optional<StoreEntry> findByNamespaceAndEntryKey(String namespace, String entryKey);

    List<StoreEntry> findByNamespaceOrderByIdAsc(String namespace);

    long countByNamespace(String namespace);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update StoreEntry e set e.payload = :payload, e.version = e.version + 1 "
        + "where e.id = :id and e.version = :version")
    int updateIfVersion(@Param("id") Long id, @Param("version") long version, @Param("payload") String payload);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from StoreEntry e where e.id = :id and e.version = :version")
    int deleteIfVersion(@Param("id") Long id, @Param("version") long version);
}
