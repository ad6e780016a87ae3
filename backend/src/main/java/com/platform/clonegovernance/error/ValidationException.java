package com.platform.clonegovernance.error;

/**
 * Exception for synchronous validation failures on policy authoring and
 * administrative requests.
 */
public class ValidationException extends CloneGovernanceException {

    private final String field;
    private final Object rejectedValue;

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
        this.field = null;
        this.rejectedValue = null;
    }

    public ValidationException(String field, String message) {
        this(ErrorCode.INVALID_FIELD_VALUE, field, null, message);
    }

    public ValidationException(String field, Object rejectedValue, String message) {
        this(ErrorCode.INVALID_FIELD_VALUE, field, rejectedValue, message);
    }

    public ValidationException(ErrorCode errorCode, String field, Object rejectedValue, String message) {
        super(errorCode, rejectedValue != null
            ? String.format("Invalid value '%s' for field '%s': %s", rejectedValue, field, message)
            : String.format("Invalid value for field '%s': %s", field, message));
        this.field = field;
        this.rejectedValue = rejectedValue;
    }

    public static ValidationException unknownKind(Object kind, String validValues) {
        return new ValidationException(ErrorCode.UNKNOWN_POLICY_KIND, "kind", kind,
            "Invalid policy kind. Valid kinds: " + validValues);
    }

    public static ValidationException unknownSeverity(Object severity, String validValues) {
        return new ValidationException(ErrorCode.UNKNOWN_SEVERITY, "severity", severity,
            "Invalid severity. Valid values: " + validValues);
    }

    public static ValidationException invalidDefinition(String field, Object rejectedValue, String message) {
        return new ValidationException(ErrorCode.INVALID_POLICY_DEFINITION,
            "definition." + field, rejectedValue, message);
    }

    public String getField() {
        return field;
    }

    public Object getRejectedValue() {
        return rejectedValue;
    }
}
