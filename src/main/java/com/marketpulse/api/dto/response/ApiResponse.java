package com.marketpulse.api.dto.response;

import java.time.Instant;
import lombok.Value;

/**
 * Success envelope of the market API: {@code {success: true, data, timestamp}}.
 */
@Value
public class ApiResponse<T> {

    boolean success = true;

    T data;

    /** Time the response was produced, from the application clock. */
    Instant timestamp;

    public static <T> ApiResponse<T> of(T data, Instant timestamp) {
        return new ApiResponse<>(data, timestamp);
    }
}
