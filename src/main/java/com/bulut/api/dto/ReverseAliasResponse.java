package com.bulut.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reverse lookup result; {@code alias} is null when the address has none.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReverseAliasResponse {
    private String address;
    private String alias;
}
