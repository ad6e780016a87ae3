package com.platform.clonegovernance.violation;

/**
 * Violation lifecycle. RESOLVED is terminal.
 */
public enum ViolationStatus {
    OPEN,
    RESOLVED
}
