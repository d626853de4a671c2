package com.missionguard.interfaces.api.exception;

import com.missionguard.application.exceptions.MissionNotFoundException;
import com.missionguard.application.exceptions.PolicyConfigException;
import com.missionguard.application.exceptions.ReportCancelledException;
import com.missionguard.application.exceptions.TemplateNotEligibleException;
import com.missionguard.application.exceptions.TemplateNotFoundException;
import com.missionguard.application.exceptions.UpstreamUnavailableException;
import com.missionguard.interfaces.api.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API.
 *
 * Guardrail blocks never reach this class; they are ordinary responses. Mapped here:
 * - Missing mission or template: 404
 * - Template not eligible for the mission: 403
 * - Policy configuration errors: 422 (fail closed)
 * - Mission service unreachable: 502
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * Handle validation errors from @Valid annotation.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        List<ErrorResponse.ValidationError> validationErrors = ex.getBindingResult()
            .getAllErrors()
            .stream()
            .map(error -> {
                String fieldName = error instanceof FieldError
                    ? ((FieldError) error).getField()
                    : error.getObjectName();
                return ErrorResponse.ValidationError.builder()
                    .field(fieldName)
                    .message(error.getDefaultMessage())
                    .build();
            })
            .collect(Collectors.toList());

        ErrorResponse errorResponse = body(HttpStatus.BAD_REQUEST, "Validation Failed",
            "Invalid request parameters", request);
        errorResponse.setValidationErrors(validationErrors);

        if (log.isWarnEnabled()) {
            log.warn("Validation error: {} validation failures on {}",
                validationErrors.size(), request.getRequestURI());
        }

        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler({MissionNotFoundException.class, TemplateNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException ex, HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(body(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), request));
    }

    @ExceptionHandler(TemplateNotEligibleException.class)
    public ResponseEntity<ErrorResponse> handleNotEligible(
            TemplateNotEligibleException ex,
            HttpServletRequest request) {

        if (log.isWarnEnabled()) {
            log.warn("Template not eligible: {} on {}", ex.getMessage(), request.getRequestURI());
        }
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
            .body(body(HttpStatus.FORBIDDEN, "Template Not Eligible", ex.getMessage(), request));
    }

    /**
     * Policy configuration problems fail closed.
     */
    @ExceptionHandler(PolicyConfigException.class)
    public ResponseEntity<ErrorResponse> handlePolicyConfig(
            PolicyConfigException ex,
            HttpServletRequest request) {

        if (log.isErrorEnabled()) {
            log.error("Policy configuration error on {}: {}", request.getRequestURI(), ex.getMessage());
        }
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
            .body(body(HttpStatus.UNPROCESSABLE_ENTITY, "Policy Configuration Error", ex.getMessage(), request));
    }

    /**
     * Only reached when the mission itself cannot be loaded; other upstream failures degrade results.
     */
    @ExceptionHandler(UpstreamUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleUpstream(
            UpstreamUnavailableException ex,
            HttpServletRequest request) {

        if (log.isWarnEnabled()) {
            log.warn("Upstream {} unavailable on {}: {}", ex.getSource(), request.getRequestURI(), ex.getMessage());
        }
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
            .body(body(HttpStatus.BAD_GATEWAY, "Upstream Unavailable",
                "Upstream service " + ex.getSource() + " is unavailable", request));
    }

    @ExceptionHandler(ReportCancelledException.class)
    public ResponseEntity<ErrorResponse> handleCancelled(
            ReportCancelledException ex,
            HttpServletRequest request) {

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(body(HttpStatus.SERVICE_UNAVAILABLE, "Report Cancelled", ex.getMessage(), request));
    }

    /**
     * Handle illegal argument exceptions.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex,
            HttpServletRequest request) {

        if (log.isWarnEnabled()) {
            log.warn("Illegal argument: {} on {}", ex.getMessage(), request.getRequestURI());
        }
        return ResponseEntity.badRequest()
            .body(body(HttpStatus.BAD_REQUEST, "Bad Request", "Invalid request: " + ex.getMessage(), request));
    }

    /**
     * Handle all other exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            HttpServletRequest request) {

        if (log.isErrorEnabled()) {
            log.error("Unhandled exception on {}: {}",
                request.getRequestURI(), ex.getMessage(), ex);
        }
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please contact support.", request));
    }

    private static ErrorResponse body(HttpStatus status, String error, String message, HttpServletRequest request) {
        return ErrorResponse.builder()
            .requestId(UUID.randomUUID())
            .timestamp(Instant.now())
            .status(status.value())
            .error(error)
            .message(message)
            .path(request.getRequestURI())
            .build();
    }
}
