package com.bulut.common.exception;

/**
 * Thrown when an address, alias or identifier does not have the expected shape.
 */
public class InvalidFormatException extends BulutException {

    public InvalidFormatException(String message) {
        super(ErrorCode.INVALID_FORMAT, message);
    }
}
