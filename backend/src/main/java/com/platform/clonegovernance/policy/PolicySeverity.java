package com.platform.clonegovernance.policy;

/**
 * Policy severity levels, declared in ascending order.
 */
public enum PolicySeverity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    /**
     * Numeric rank used for ordering in storage and queries (higher is more severe).
     */
    public int rank() {
        return ordinal() + 1;
    }
}
