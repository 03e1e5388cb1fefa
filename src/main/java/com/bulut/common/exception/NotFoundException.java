package com.bulut.common.exception;

/**
 * Thrown when an alias, transaction or subscription lookup has no result.
 */
public class NotFoundException extends BulutException {

    public NotFoundException(ErrorCode code, String reference) {
        super(code, "Not found: " + reference);
    }
}
