package com.bulut.common.exception;

/**
 * Wraps failures of external collaborators (settlement rail, intent parser).
 *
 * The upstream message is kept verbatim so it can be surfaced to the caller.
 */
public class UpstreamException extends BulutException {

    private final String service;

    public UpstreamException(ErrorCode code, String service, String message) {
        super(code, message);
        this.service = service;
    }

    public UpstreamException(ErrorCode code, String service, String message, Throwable cause) {
        super(code, message, cause);
        this.service = service;
    }

    public String getService() {
        return service;
    }
}
