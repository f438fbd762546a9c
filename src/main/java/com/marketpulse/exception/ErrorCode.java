package com.marketpulse.exception;

import org.springframework.http.HttpStatus;

/**
 * Error codes returned in {@code error.code} of the market API's error envelope.
 */
public enum ErrorCode {
    /** Snapshot body or query parameter failed bean validation. */
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    /** Body is not valid JSON or a parameter has the wrong type. */
    BAD_REQUEST(HttpStatus.BAD_REQUEST),
    /** A cycle was started without a snapshot. */
    INVALID_SNAPSHOT(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    METHOD_NOT_ALLOWED(HttpStatus.METHOD_NOT_ALLOWED),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
