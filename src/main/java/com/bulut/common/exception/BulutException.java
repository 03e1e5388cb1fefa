package com.bulut.common.exception;

import lombok.Getter;

/**
 * Base exception for all Bulut failures that reach the API boundary.
 */
@Getter
public class BulutException extends RuntimeException {

    private final ErrorCode code;

    public BulutException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public BulutException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
