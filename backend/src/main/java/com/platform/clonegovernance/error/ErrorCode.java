package com.platform.clonegovernance.error;

/**
 * Standardized error codes for the clone governance service.
 *
 * Format: CG-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Validation errors
 * - 3xx: Resource errors (not found, conflict)
 * - 4xx: System errors (database)
 * - 9xx: Internal errors (unexpected)
 */
public enum ErrorCode {

    // ==================== Validation Errors (1xx) ====================

    VALIDATION_ERROR("CG-100", "Validation error", ErrorCategory.RECOVERABLE),
    INVALID_REQUEST("CG-101", "Invalid request format", ErrorCategory.RECOVERABLE),
    MISSING_REQUIRED_FIELD("CG-102", "Missing required field", ErrorCategory.RECOVERABLE),
    INVALID_FIELD_VALUE("CG-103", "Invalid field value", ErrorCategory.RECOVERABLE),
    CONSTRAINT_VIOLATION("CG-104", "Constraint violation", ErrorCategory.RECOVERABLE),
    UNKNOWN_POLICY_KIND("CG-110", "Unknown policy kind", ErrorCategory.RECOVERABLE),
    UNKNOWN_SEVERITY("CG-111", "Unknown severity", ErrorCategory.RECOVERABLE),
    INVALID_POLICY_DEFINITION("CG-112", "Policy definition does not match its kind", ErrorCategory.RECOVERABLE),

    // ==================== Resource Errors (3xx) ====================

    RESOURCE_NOT_FOUND("CG-300", "Resource not found", ErrorCategory.RECOVERABLE),
    POLICY_NOT_FOUND("CG-301", "Policy not found", ErrorCategory.RECOVERABLE),
    DUPLICATE_RESOURCE("CG-311", "Duplicate resource", ErrorCategory.RECOVERABLE),
    OPTIMISTIC_LOCK_FAILURE("CG-312", "Concurrent modification", ErrorCategory.RECOVERABLE),

    // ==================== System Errors (4xx) ====================

    DATABASE_ERROR("CG-400", "Database error", ErrorCategory.FATAL),

    // ==================== Internal Errors (9xx) ====================

    INTERNAL_ERROR("CG-900", "Internal server error", ErrorCategory.FATAL);

    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;

    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }

    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        RECOVERABLE,
        FATAL
    }
}
