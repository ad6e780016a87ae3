package com.platform.clonegovernance.policy;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result document of an administrative policy command.
 *
 * @param status  SUCCESS or NOT_FOUND
 * @param policy  the affected policy, absent when not found or deleted
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PolicyCommandResult(
    CommandStatus status,
    String policyId,
    String policyName,
    String message,
    Policy policy
) {

    public enum CommandStatus {
        SUCCESS,
        NOT_FOUND
    }

    public static PolicyCommandResult success(Policy policy, String message) {
        return new PolicyCommandResult(CommandStatus.SUCCESS, policy.getId(), policy.getName(), message, policy);
    }

    public static PolicyCommandResult deleted(String policyId, String policyName) {
        return new PolicyCommandResult(CommandStatus.SUCCESS, policyId, policyName,
            "Policy " + policyName + " deleted", null);
    }

    public static PolicyCommandResult notFound(String policyId) {
        return new PolicyCommandResult(CommandStatus.NOT_FOUND, policyId, null, "Policy not found", null);
    }

    public boolean isSuccess() {
        return status == CommandStatus.SUCCESS;
    }
}
