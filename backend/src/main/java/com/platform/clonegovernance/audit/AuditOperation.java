package com.platform.clonegovernance.audit;

/**
 * Operation kinds recorded in the audit log.
 */
public enum AuditOperation {
    CREATE,
    DELETE,
    REFRESH,
    POLICY_CREATE,
    POLICY_UPDATE,
    POLICY_STATUS_CHANGE,
    POLICY_DELETE
}
