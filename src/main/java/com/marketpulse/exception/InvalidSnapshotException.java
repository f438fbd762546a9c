package com.marketpulse.exception;

/**
 * Thrown when a cycle is started without a snapshot at all. Missing individual
 * metrics are not an error; they read as neutral values.
 */
public class InvalidSnapshotException extends MarketPulseException {

    public InvalidSnapshotException(String message) {
        super(ErrorCode.INVALID_SNAPSHOT, message);
    }
}
