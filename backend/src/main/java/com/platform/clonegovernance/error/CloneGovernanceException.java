package com.platform.clonegovernance.error;

/**
 * Base exception for the clone governance service.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class CloneGovernanceException extends RuntimeException {

    private final ErrorCode errorCode;

    protected CloneGovernanceException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }

    protected CloneGovernanceException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected CloneGovernanceException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
