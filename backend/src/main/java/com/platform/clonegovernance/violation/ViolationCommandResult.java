package com.platform.clonegovernance.violation;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result document of a violation command.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ViolationCommandResult(
    CommandStatus status,
    String violationId,
    String message,
    Violation violation
) {

    public enum CommandStatus {
        SUCCESS,
        NOT_FOUND,
        ALREADY_RESOLVED
    }

    public static ViolationCommandResult resolved(Violation violation) {
        return new ViolationCommandResult(CommandStatus.SUCCESS, violation.getId(), "Violation resolved", violation);
    }

    public static ViolationCommandResult notFound(String violationId) {
        return new ViolationCommandResult(CommandStatus.NOT_FOUND, violationId, "Violation not found", null);
    }

    public static ViolationCommandResult alreadyResolved(Violation violation) {
        return new ViolationCommandResult(CommandStatus.ALREADY_RESOLVED, violation.getId(),
            "Violation was already resolved by " + violation.getResolvedBy(), violation);
    }

    public boolean isSuccess() {
        return status == CommandStatus.SUCCESS;
    }
}
