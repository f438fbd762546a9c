package com.marketpulse.exception;

import com.marketpulse.api.dto.response.ApiErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Path;
import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps failures of the market API to {@link ApiErrorResponse}.
 *
 * <ul>
 *   <li>invalid snapshot body fields and out-of-range query parameters: 400 VALIDATION_ERROR,
 *       details keyed by field or parameter name</li>
 *   <li>unparseable body or mistyped parameter: 400 BAD_REQUEST</li>
 *   <li>pipeline exceptions: their own {@link ErrorCode}</li>
 *   <li>unknown path 404, wrong verb 405, anything else 500</li>
 * </ul>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final Clock clock;

    public GlobalExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidSnapshotBody(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        Map<String, String> details = new TreeMap<>();
        ex.getBindingResult()
                .getFieldErrors()
                .forEach(error -> details.putIfAbsent(error.getField(), error.getDefaultMessage()));
        return buildResponse(ErrorCode.VALIDATION_ERROR, "Invalid snapshot", details, request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidParameter(
            ConstraintViolationException ex, HttpServletRequest request) {
        Map<String, String> details = new TreeMap<>();
        for (ConstraintViolation<?> violation : ex.getConstraintViolations()) {
            details.putIfAbsent(leafName(violation.getPropertyPath()), violation.getMessage());
        }
        return buildResponse(ErrorCode.VALIDATION_ERROR, "Invalid request parameter", details, request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String expected = ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "another type";
        return buildResponse(
                ErrorCode.BAD_REQUEST,
                "Invalid request parameter",
                Map.of(ex.getName(), "must be of type " + expected),
                request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        return buildResponse(ErrorCode.BAD_REQUEST, "Snapshot body is not readable JSON", null, request);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleNoResource(NoResourceFoundException ex, HttpServletRequest request) {
        return buildResponse(ErrorCode.NOT_FOUND, "No endpoint " + request.getRequestURI(), null, request);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiErrorResponse> handleMethodNotSupported(
            HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {
        return buildResponse(ErrorCode.METHOD_NOT_ALLOWED, ex.getMessage(), null, request);
    }

    @ExceptionHandler(MarketPulseException.class)
    public ResponseEntity<ApiErrorResponse> handlePipeline(MarketPulseException ex, HttpServletRequest request) {
        log.warn("Rejected {}: {}", request.getRequestURI(), ex.getMessage());
        return buildResponse(ex.getErrorCode(), ex.getMessage(), null, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {}", request.getRequestURI(), ex);
        return buildResponse(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred", null, request);
    }

    /** {@code getNotifications.limit} -> {@code limit}. */
    static String leafName(Path propertyPath) {
        String name = propertyPath.toString();
        for (Path.Node node : propertyPath) {
            if (node.getName() != null) {
                name = node.getName();
            }
        }
        return name;
    }

    private ResponseEntity<ApiErrorResponse> buildResponse(
            ErrorCode errorCode, String message, Map<String, String> details, HttpServletRequest request) {
        ApiErrorResponse response =
                ApiErrorResponse.of(errorCode, message, details, request.getRequestURI(), clock.instant());
        return ResponseEntity.status(errorCode.getStatus()).body(response);
    }
}
