package com.platform.clonegovernance.audit;

/**
 * Outcome of a recorded operation.
 */
public enum OperationStatus {
    SUCCESS,
    FAILURE,
    BLOCKED
}
