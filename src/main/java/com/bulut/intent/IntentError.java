package com.bulut.intent;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error reported by the intent parser alongside an incomplete intent.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IntentError {
    private String code;
    private String message;
}
