package com.bulut.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * DTO for registering an alias.
 */
@Data
public class RegisterAliasRequest {

    @NotBlank(message = "Alias is required")
    private String alias;

    @NotBlank(message = "Address is required")
    private String address;

    /**
     * Signature by {@code address} over {@code AliasRegistration{alias, address}}.
     */
    @NotBlank(message = "Signature is required")
    private String signature;
}
