package com.bulut.common.exception;

/**
 * Thrown when a caller fails a signature, ownership or address check.
 *
 * The message is fixed so callers cannot tell which part of the check failed.
 */
public class AuthorizationException extends BulutException {

    public static final String GENERIC_MESSAGE = "Signature invalid or expired";

    public AuthorizationException(ErrorCode code) {
        super(code, GENERIC_MESSAGE);
    }
}
