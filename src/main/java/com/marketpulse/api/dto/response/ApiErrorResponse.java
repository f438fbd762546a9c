package com.marketpulse.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.marketpulse.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Error envelope of the market API: {@code {success: false, error: {...}}}.
 *
 * <p>{@code details} maps the offending snapshot field or query parameter name to its
 * violation message and is omitted when there is nothing to point at.
 */
@Value
public class ApiErrorResponse {

    boolean success = false;

    ErrorDetail error;

    public static ApiErrorResponse of(
            ErrorCode errorCode, String message, Map<String, String> details, String path, Instant timestamp) {
        return new ApiErrorResponse(ErrorDetail.builder()
                .code(errorCode)
                .message(message)
                .details(details != null ? Map.copyOf(details) : Map.of())
                .path(path)
                .timestamp(timestamp)
                .build());
    }

    @Value
    @Builder
    public static class ErrorDetail {

        ErrorCode code;

        String message;

        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        Map<String, String> details;

        String path;

        Instant timestamp;
    }
}
