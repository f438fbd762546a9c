package com.marketpulse.exception;

import lombok.Getter;

/**
 * Base class for failures raised by the pipeline itself. Carries the {@link ErrorCode}
 * the REST layer reports.
 */
@Getter
public abstract class MarketPulseException extends RuntimeException {

    private final ErrorCode errorCode;

    protected MarketPulseException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
