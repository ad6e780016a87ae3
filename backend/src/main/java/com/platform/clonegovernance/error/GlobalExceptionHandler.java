package com.platform.clonegovernance.error;

import com.platform.clonegovernance.observability.LoggingConfig;
import com.platform.clonegovernance.observability.MetricsRegistry;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Maps exceptions from the governance API to {@link ErrorResponse} bodies.
 *
 * Operation and access recording never throw to their callers, so these handlers only see
 * policy administration, queries, job triggers and request binding errors.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private final MetricsRegistry metricsRegistry;

    public GlobalExceptionHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    // ==================== Governance Exceptions ====================

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex, HttpServletRequest request) {
        return respond(ex.getErrorCode(), HttpStatus.BAD_REQUEST, ex.getMessage(), request, body -> {
            if (ex.getField() != null) {
                body.fieldErrors(List.of(new ErrorResponse.FieldError(ex.getField(), ex.getMessage(),
                    ex.getRejectedValue())));
            }
        });
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException ex, HttpServletRequest request) {
        return respond(ex.getErrorCode(), HttpStatus.NOT_FOUND, ex.getMessage(), request,
            body -> body.metadata(Map.of("resourceType", ex.getResourceType(), "resourceId", ex.getResourceId())));
    }

    /**
     * Duplicate policy names.
     */
    @ExceptionHandler(ResourceConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(ResourceConflictException ex, HttpServletRequest request) {
        return respond(ex.getErrorCode(), HttpStatus.CONFLICT, ex.getMessage(), request,
            body -> body.metadata(Map.of("resourceType", ex.getResourceType(),
                "conflictingValue", ex.getConflictingValue())));
    }

    @ExceptionHandler(CloneGovernanceException.class)
    public ResponseEntity<ErrorResponse> handleGovernance(CloneGovernanceException ex, HttpServletRequest request) {
        HttpStatus status = ex.isFatal() ? HttpStatus.INTERNAL_SERVER_ERROR : HttpStatus.BAD_REQUEST;
        if (ex.isFatal()) {
            log.error("{} on {}: {}", ex.getErrorCode().getCode(), request.getRequestURI(), ex.getMessage(), ex);
        }
        return respond(ex.getErrorCode(), status, ex.getMessage(), request, body -> { });
    }

    // ==================== Request Binding ====================

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex,
            HttpServletRequest request) {
        List<ErrorResponse.FieldError> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
            .map(fe -> new ErrorResponse.FieldError(fe.getField(), fe.getDefaultMessage(), fe.getRejectedValue()))
            .toList();
        return respond(ErrorCode.VALIDATION_ERROR, HttpStatus.BAD_REQUEST, "Validation failed", request,
            body -> body.fieldErrors(fieldErrors));
    }

    /**
     * Header and query parameter constraints on {@code @Validated} controllers.
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException ex,
            HttpServletRequest request) {
        List<ErrorResponse.FieldError> fieldErrors = ex.getConstraintViolations().stream()
            .map(cv -> new ErrorResponse.FieldError(leafName(cv), cv.getMessage(), cv.getInvalidValue()))
            .toList();
        return respond(ErrorCode.CONSTRAINT_VIOLATION, HttpStatus.BAD_REQUEST, "Constraint violation", request,
            body -> body.fieldErrors(fieldErrors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex,
            HttpServletRequest request) {
        return respond(ErrorCode.INVALID_REQUEST, HttpStatus.BAD_REQUEST, "Invalid request body", request,
            body -> body.detail(ex.getMostSpecificCause().getMessage()));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException ex,
            HttpServletRequest request) {
        return respond(ErrorCode.MISSING_REQUIRED_FIELD, HttpStatus.BAD_REQUEST,
            "Missing required parameter: " + ex.getParameterName(), request, body -> { });
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException ex,
            HttpServletRequest request) {
        return respond(ErrorCode.MISSING_REQUIRED_FIELD, HttpStatus.BAD_REQUEST,
            "Missing required header: " + ex.getHeaderName(), request, body -> { });
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
            HttpServletRequest request) {
        return respond(ErrorCode.INVALID_FIELD_VALUE, HttpStatus.BAD_REQUEST,
            "Invalid value for parameter '" + ex.getName() + "': " + ex.getValue(), request, body -> { });
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleUnknownPath(NoResourceFoundException ex, HttpServletRequest request) {
        return respond(ErrorCode.RESOURCE_NOT_FOUND, HttpStatus.NOT_FOUND,
            "No endpoint " + ex.getHttpMethod() + " " + request.getRequestURI(), request, body -> { });
    }

    // ==================== Storage ====================

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLocking(OptimisticLockingFailureException ex,
            HttpServletRequest request) {
        return respond(ErrorCode.OPTIMISTIC_LOCK_FAILURE, HttpStatus.CONFLICT,
            "Policy was modified by another request, reload and retry", request, body -> { });
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException ex, HttpServletRequest request) {
        log.error("Database error on {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return respond(ErrorCode.DATABASE_ERROR, HttpStatus.INTERNAL_SERVER_ERROR, "Database operation failed",
            request, body -> { });
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return respond(ErrorCode.INTERNAL_ERROR, HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred",
            request, body -> body.detail(ex.getClass().getSimpleName()));
    }

    // ==================== Helpers ====================

    private ResponseEntity<ErrorResponse> respond(ErrorCode code, HttpStatus status, String message,
            HttpServletRequest request, Consumer<ErrorResponse.ErrorResponseBuilder> customizer) {
        String traceId = traceId();
        if (!status.is5xxServerError()) {
            log.warn("[{}] {} {} on {}: {}", traceId, status.value(), code.getCode(), request.getRequestURI(),
                message);
        }
        metricsRegistry.incrementCounter("clonegovernance.errors",
            "code", code.getCode(), "fatal", String.valueOf(code.isFatal()));

        ErrorResponse.ErrorResponseBuilder body = ErrorResponse.builder()
            .code(code.getCode())
            .message(message)
            .fatal(code.isFatal())
            .status(status.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId);
        customizer.accept(body);
        return ResponseEntity.status(status).body(body.build());
    }

    private static String traceId() {
        String traceId = MDC.get(LoggingConfig.TRACE_ID_KEY);
        return traceId != null ? traceId : UUID.randomUUID().toString().substring(0, 8);
    }

    private static String leafName(ConstraintViolation<?> violation) {
        String path = violation.getPropertyPath().toString();
        return path.substring(path.lastIndexOf('.') + 1);
    }
}
