package com.bulut.common.exception;

/**
 * Error taxonomy exposed to callers.
 *
 * Validation, conflict, authorization and not-found failures are caller
 * errors; rail and internal failures are server-side.
 */
public enum ErrorCategory {
    VALIDATION,
    CONFLICT,
    AUTHORIZATION,
    NOT_FOUND,
    RAIL,
    INTERNAL
}
