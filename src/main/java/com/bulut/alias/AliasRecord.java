package com.bulut.alias;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One side of the alias directory: canonical alias (no leading {@code @}) bound
 * to a canonical lower-case address.
 *
 * Only {@code lastUsed} changes after registration.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AliasRecord {

    private String alias;

    private String address;

    private Instant registeredAt;

    private Instant lastUsed;
}
