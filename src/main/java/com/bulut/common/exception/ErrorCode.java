package com.bulut.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Stable error codes returned in every {@code {code, message}} error body.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    INVALID_FORMAT(ErrorCategory.VALIDATION),
    INVALID_AMOUNT(ErrorCategory.VALIDATION),
    INVALID_SPLIT(ErrorCategory.VALIDATION),
    INVALID_INTENT(ErrorCategory.VALIDATION),
    LOW_CONFIDENCE(ErrorCategory.VALIDATION),

    ALIAS_TAKEN(ErrorCategory.CONFLICT),
    ADDRESS_ALREADY_ALIASED(ErrorCategory.CONFLICT),
    INTENT_IN_PROGRESS(ErrorCategory.CONFLICT),

    INVALID_SIGNATURE(ErrorCategory.AUTHORIZATION),
    ADDRESS_MISMATCH(ErrorCategory.AUTHORIZATION),
    NOT_OWNER(ErrorCategory.AUTHORIZATION),

    ALIAS_NOT_FOUND(ErrorCategory.NOT_FOUND),
    RECIPIENT_NOT_FOUND(ErrorCategory.NOT_FOUND),
    TRANSACTION_NOT_FOUND(ErrorCategory.NOT_FOUND),
    SUBSCRIPTION_NOT_FOUND(ErrorCategory.NOT_FOUND),

    RAIL_EXECUTION_FAILED(ErrorCategory.RAIL),
    RAIL_TIMEOUT(ErrorCategory.RAIL),
    PARSER_UNAVAILABLE(ErrorCategory.RAIL),

    INTERNAL_ERROR(ErrorCategory.INTERNAL);

    private final ErrorCategory category;
}
