package com.bulut.store.jpa;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One persisted key/value pair of a store namespace.
 *
 * The id column doubles as insertion order; the version column is bumped on
 * every conditional update and is what compare-and-set checks against.
 */
@Entity
@Table(name = "store_entries",
    uniqueConstraints = @UniqueConstraint(name = "uk_store_namespace_key", columnNames = {"namespace", "entry_key"}),
    indexes = @Index(name = "idx_store_namespace", columnList = "namespace"))
@Data
@NoArgsConstructor
public class StoreEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String namespace;

    @Column(name = "entry_key", nullable = false, length = 256)
    private String entryKey;

    /**
     * JSON encoded value.
     */
    @Lob
    @Column(nullable = false)
    private String payload;

    @Column(nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public StoreEntry(String namespace, String entryKey, String payload) {
        this.namespace = namespace;
        this.entryKey = entryKey;
        this.payload = payload;
        this.version = 0L;
        this.createdAt = Instant.now();
    }
}
