package com.platform.clonegovernance.observability;

/**
 * Event types emitted by {@link StructuredLogger}.
 */
public enum LogEventType {
    POLICY_CREATED,
    POLICY_UPDATED,
    POLICY_STATUS_CHANGED,
    POLICY_DELETED,
    POLICY_SKIPPED,
    OPERATION_RECORDED,
    OPERATION_BLOCKED,
    RECORDING_FAILED,
    ACCESS_RECORDED,
    VIOLATION_RESOLVED,
    COMPLIANCE_SCAN_STARTED,
    COMPLIANCE_SCAN_COMPLETED,
    PURGE_STARTED,
    PURGE_COMPLETED
}
