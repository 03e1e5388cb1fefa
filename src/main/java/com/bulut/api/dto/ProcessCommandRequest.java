package com.bulut.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * DTO for turning a natural-language command into a payment intent.
 */
@Data
public class ProcessCommandRequest {

    @NotBlank(message = "Text is required")
    @Size(max = 500, message = "Text must be at most 500 characters")
    private String text;

    private String userId;

    private String timezone;
}
