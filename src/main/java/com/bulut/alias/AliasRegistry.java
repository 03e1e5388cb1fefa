package com.bulut.alias;

import com.bulut.common.AddressCodec;
import com.bulut.config.BulutProperties;
import com.bulut.signature.SignatureAuthorizer;
import com.bulut.signature.StructuredMessage;
import com.bulut.store.KeyValueStore;
import com.bulut.store.StoreFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Bidirectional alias directory.
 *
 * Invariants:
 * - at most one address per alias and one alias per address
 * - both directions are written together or not at all
 * - every alias and address is stored in canonical form ({@link AddressCodec})
 *
 * Writes are serialized on one monitor; each side is additionally inserted with
 * putIfAbsent, and a lost second insert removes the first again.
 */
@Service
@Slf4j
public class AliasRegistry {

    static final String ALIAS_NAMESPACE = "aliases";
    static final String ADDRESS_NAMESPACE = "alias-by-address";

    private final KeyValueStore<AliasRecord> aliases;
    private final KeyValueStore<String> aliasByAddress;
    private final SignatureAuthorizer signatureAuthorizer;
    private final BulutProperties.Alias config;
    private final Clock clock;

    private final Object writeLock = new Object();

    public AliasRegistry(StoreFactory storeFactory, SignatureAuthorizer signatureAuthorizer,
                         BulutProperties properties, Clock clock) {
        this.aliases = storeFactory.open(ALIAS_NAMESPACE, AliasRecord.class);
        this.aliasByAddress = storeFactory.open(ADDRESS_NAMESPACE, String.class);
        this.signatureAuthorizer = signatureAuthorizer;
        this.config = properties.getAlias();
        this.clock = clock;
    }

    /**
     * Bind {@code alias} to {@code address}.
     *
     * @param proofOfOwnership signature by {@code address} over the
     *                         {@code AliasRegistration{alias, address}} message
     */
    public RegistrationResult register(String alias, String address, String proofOfOwnership) {
        String canonicalAlias = AddressCodec.normalizeAlias(alias);
        String canonicalAddress = AddressCodec.normalize(address);

        StructuredMessage proof = signatureAuthorizer.buildRegistrationMessage(canonicalAlias, canonicalAddress);
        if (!signatureAuthorizer.verify(proof, proofOfOwnership, canonicalAddress)) {
            log.warn("Alias registration rejected: ownership proof did not verify for alias={}", canonicalAlias);
            return RegistrationResult.rejected(RegistrationResult.Status.INVALID_SIGNATURE);
        }

        AliasRecord record;
        synchronized (writeLock) {
            if (aliases.get(canonicalAlias).isPresent()) {
                log.info("Alias registration conflict: alias={} already taken", canonicalAlias);
                return RegistrationResult.rejected(RegistrationResult.Status.ALIAS_TAKEN);
            }
            if (aliasByAddress.get(canonicalAddress).isPresent()) {
                log.info("Alias registration conflict: address={} already has an alias", canonicalAddress);
                return RegistrationResult.rejected(RegistrationResult.Status.ADDRESS_ALREADY_ALIASED);
            }

            Instant now = clock.instant();
            record = AliasRecord.builder()
                .alias(canonicalAlias)
                .address(canonicalAddress)
                .registeredAt(now)
                .lastUsed(now)
                .build();

            if (!aliases.putIfAbsent(canonicalAlias, record)) {
                return RegistrationResult.rejected(RegistrationResult.Status.ALIAS_TAKEN);
            }
            if (!aliasByAddress.putIfAbsent(canonicalAddress, canonicalAlias)) {
                aliases.remove(canonicalAlias, record);
                return RegistrationResult.rejected(RegistrationResult.Status.ADDRESS_ALREADY_ALIASED);
            }
        }

        log.info("Registered alias {} -> {}", AddressCodec.display(canonicalAlias), canonicalAddress);
        return RegistrationResult.registered(record);
    }

    /**
     * Address bound to {@code alias}; a hit refreshes the alias' last-used time.
     */
    public Optional<String> resolve(String alias) {
        String canonicalAlias = AddressCodec.normalizeAlias(alias);
        Optional<AliasRecord> record = aliases.get(canonicalAlias);
        if (record.isEmpty()) {
            log.debug("Alias {} not found", canonicalAlias);
            return Optional.empty();
        }
        AliasRecord current = record.get();
        // a concurrent refresh winning the swap is as good as ours
        aliases.compareAndSet(canonicalAlias, current, current.toBuilder().lastUsed(clock.instant()).build());
        return Optional.of(current.getAddress());
    }

    /**
     * Canonical alias bound to {@code address}.
     */
    public Optional<String> reverseResolve(String address) {
        return aliasByAddress.get(AddressCodec.normalize(address));
    }

    public Optional<AliasRecord> lookup(String alias) {
        return aliases.get(AddressCodec.normalizeAlias(alias));
    }

    /**
     * Remove {@code alias} if {@code requestingAddress} owns it. Ownership is
     * checked here regardless of any earlier check by the caller.
     */
    public DeleteOutcome delete(String alias, String requestingAddress) {
        String canonicalAlias = AddressCodec.normalizeAlias(alias);
        String requester = AddressCodec.normalize(requestingAddress);

        synchronized (writeLock) {
            while (true) {
                Optional<AliasRecord> current = aliases.get(canonicalAlias);
                if (current.isEmpty()) {
                    return DeleteOutcome.NOT_FOUND;
                }
                AliasRecord record = current.get();
                if (!record.getAddress().equals(requester)) {
                    log.warn("Alias deletion rejected: {} is not the owner of {}", requester, canonicalAlias);
                    return DeleteOutcome.NOT_OWNER;
                }
                // lastUsed may have been refreshed since the read; retry on a lost swap
                if (aliases.remove(canonicalAlias, record)) {
                    aliasByAddress.remove(record.getAddress(), canonicalAlias);
                    log.info("Deleted alias {} owned by {}", AddressCodec.display(canonicalAlias), requester);
                    return DeleteOutcome.DELETED;
                }
            }
        }
    }

    /**
     * Delete with a signed {@code AliasDeletion{alias, address}} proof.
     */
    public DeleteOutcome delete(String alias, String requestingAddress, String signature) {
        StructuredMessage proof = signatureAuthorizer.buildDeletionMessage(alias, requestingAddress);
        if (!signatureAuthorizer.verify(proof, signature, requestingAddress)) {
            log.warn("Alias deletion rejected: proof did not verify for alias={}",
                AddressCodec.normalizeAlias(alias));
            return DeleteOutcome.NOT_OWNER;
        }
        return delete(alias, requestingAddress);
    }

    /**
     * Aliases starting with {@code prefix}, in registration order.
     */
    public List<AliasRecord> search(String prefix, int limit) {
        String canonicalPrefix = AddressCodec.normalizeAliasPrefix(prefix);
        int bounded = clampLimit(limit);
        return aliases.values().stream()
            .filter(record -> record.getAlias().startsWith(canonicalPrefix))
            .limit(bounded)
            .collect(Collectors.toList());
    }

    public int count() {
        return aliases.size();
    }

    private int clampLimit(int limit) {
        if (limit <= 0) {
            return config.getSearchDefaultLimit();
        }
        return Math.min(limit, config.getSearchMaxLimit());
    }
}
