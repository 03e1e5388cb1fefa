package com.bulut.api.dto;

import com.bulut.alias.AliasRecord;
import com.bulut.common.AddressCodec;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * An alias binding as shown to callers; aliases carry their {@code @}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AliasResponse {

    private String alias;
    private String address;
    private Instant registeredAt;
    private Instant lastUsed;

    public static AliasResponse from(AliasRecord record) {
        return AliasResponse.builder()
            .alias(AddressCodec.display(record.getAlias()))
            .address(record.getAddress())
            .registeredAt(record.getRegisteredAt())
            .lastUsed(record.getLastUsed())
            .build();
    }
}
