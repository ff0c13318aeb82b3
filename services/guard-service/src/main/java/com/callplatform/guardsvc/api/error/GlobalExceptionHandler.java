package com.callplatform.guardsvc.api.error;

import com.callplatform.guardsvc.infrastructure.store.CounterStoreException;
import com.callplatform.guardsvc.shared.exception.GuardServiceException;
import com.callplatform.guardsvc.shared.exception.InvalidRequestException;
import com.callplatform.guardsvc.shared.exception.RateLimitedException;
import com.callplatform.guardsvc.shared.security.SecurityUtils;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps exceptions to RFC 7807 Problem Detail responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    public static final String PROBLEM_TYPE_BASE = "https://api.call-platform.com/problems/";

    private final SecurityUtils securityUtils;

    public GlobalExceptionHandler(SecurityUtils securityUtils) {
        this.securityUtils = securityUtils;
    }

    @ExceptionHandler(GuardServiceException.class)
    public ResponseEntity<ProblemDetail> handleGuardService(GuardServiceException ex, HttpServletRequest request) {
        String correlationId = securityUtils.getCurrentCorrelationId();

        Map<String, Object> extensions = new LinkedHashMap<>();
        if (ex instanceof InvalidRequestException invalid && invalid.getField() != null) {
            extensions.put("field", invalid.getField());
        }

        ProblemDetail problem = ProblemDetail.of(
                PROBLEM_TYPE_BASE + ex.getErrorCode().toLowerCase(Locale.ROOT).replace("_", "-"),
                toTitle(ex.getErrorCode()),
                ex.getHttpStatus(),
                ex.getMessage(),
                request.getRequestURI(),
                correlationId,
                ex.getErrorCode(),
                extensions
        );

        log.debug("Handled exception: type={}, correlationId={}", ex.getErrorCode(), correlationId);

        return ResponseEntity.status(ex.getHttpStatus()).body(problem);
    }

    @ExceptionHandler(RateLimitedException.class)
    public ResponseEntity<ProblemDetail> handleRateLimited(RateLimitedException ex, HttpServletRequest request) {
        String correlationId = securityUtils.getCurrentCorrelationId();

        ProblemDetail problem = ProblemDetail.of(
                PROBLEM_TYPE_BASE + "rate-limited",
                "Rate Limit Exceeded",
                ex.getHttpStatus(),
                ex.getMessage(),
                request.getRequestURI(),
                correlationId,
                ex.getErrorCode(),
                Map.of("retryAfter", ex.getRetryAfterSeconds())
        );

        log.warn("Rate limit exceeded: path={}, correlationId={}", request.getRequestURI(), correlationId);

        HttpHeaders headers = new HttpHeaders();
        headers.add(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()));
        return ResponseEntity.status(ex.getHttpStatus()).headers(headers).body(problem);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleValidation(MethodArgumentNotValidException ex,
                                                          HttpServletRequest request) {
        String correlationId = securityUtils.getCurrentCorrelationId();

        List<Map<String, String>> errors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> Map.of(
                        "field", error.getField(),
                        "message", error.getDefaultMessage() != null ? error.getDefaultMessage() : "invalid"))
                .toList();

        ProblemDetail problem = ProblemDetail.of(
                PROBLEM_TYPE_BASE + "validation-error",
                "Validation Error",
                400,
                "One or more validation errors occurred",
                request.getRequestURI(),
                correlationId,
                "VALIDATION_ERROR",
                Map.of("errors", errors)
        );

        log.debug("Validation error: correlationId={}, errors={}", correlationId, errors.size());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problem);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetail> handleUnreadable(HttpMessageNotReadableException ex,
                                                          HttpServletRequest request) {
        ProblemDetail problem = ProblemDetail.of(
                PROBLEM_TYPE_BASE + "malformed-request",
                "Malformed Request",
                400,
                "Request body could not be read",
                request.getRequestURI(),
                securityUtils.getCurrentCorrelationId(),
                "MALFORMED_REQUEST"
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problem);
    }

    @ExceptionHandler(CounterStoreException.class)
    public ResponseEntity<ProblemDetail> handleStoreUnavailable(CounterStoreException ex, HttpServletRequest request) {
        String correlationId = securityUtils.getCurrentCorrelationId();

        log.warn("Counter store unavailable: operation={}, correlationId={}, cause={}",
                ex.getOperation(), correlationId, ex.getMessage());

        ProblemDetail problem = ProblemDetail.of(
                PROBLEM_TYPE_BASE + "store-unavailable",
                "Service Unavailable",
                503,
                "Protection state is temporarily unavailable",
                request.getRequestURI(),
                correlationId,
                "STORE_UNAVAILABLE"
        );

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(problem);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGeneric(Exception ex, HttpServletRequest request) {
        String correlationId = securityUtils.getCurrentCorrelationId();

        // framework errors (unknown route, wrong method, missing parameter) keep their own status
        if (ex instanceof ErrorResponse errorResponse) {
            int status = errorResponse.getStatusCode().value();
            ProblemDetail problem = ProblemDetail.of(
                    PROBLEM_TYPE_BASE + "request-error",
                    HttpStatus.valueOf(status).getReasonPhrase(),
                    status,
                    errorResponse.getBody().getDetail(),
                    request.getRequestURI(),
                    correlationId,
                    "REQUEST_ERROR"
            );
            return ResponseEntity.status(status).body(problem);
        }

        log.error("Unexpected error: correlationId={}", correlationId, ex);

        ProblemDetail problem = ProblemDetail.of(
                PROBLEM_TYPE_BASE + "internal-error",
                "Internal Server Error",
                500,
                "An unexpected error occurred",
                request.getRequestURI(),
                correlationId,
                "INTERNAL_ERROR"
        );

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }

    static String toTitle(String errorCode) {
        String words = errorCode.replace("_", " ").toLowerCase(Locale.ROOT);
        return words.substring(0, 1).toUpperCase(Locale.ROOT) + words.substring(1);
    }
}
