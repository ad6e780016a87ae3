package com.platform.clonegovernance.policy;

/**
 * Action a policy prescribes when it matches.
 */
public enum PolicyAction {
    /**
     * Record the violation only.
     */
    LOG_ONLY,

    /**
     * Record the violation and warn the actor.
     */
    WARN_AND_LOG,

    /**
     * The operation needs sign-off from an approver role.
     */
    REQUIRE_APPROVAL,

    /**
     * The operation must not proceed.
     */
    BLOCK;

    public boolean isBlocking() {
        return this == BLOCK;
    }
}
