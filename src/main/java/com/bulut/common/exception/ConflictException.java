package com.bulut.common.exception;

/**
 * Thrown when an alias or address is already bound.
 */
public class ConflictException extends BulutException {

    public ConflictException(ErrorCode code, String message) {
        super(code, message);
    }
}
