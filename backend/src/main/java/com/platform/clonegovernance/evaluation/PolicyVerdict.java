package com.platform.clonegovernance.evaluation;

import java.util.List;

/**
 * Result of evaluating one operation.
 *
 * @param violations      matches ordered by severity descending, then policy name
 * @param block           true when any match must block the operation
 * @param skippedPolicies names of policies that could not be evaluated
 */
public record PolicyVerdict(
    List<ViolationCandidate> violations,
    boolean block,
    List<String> skippedPolicies
) {

    public PolicyVerdict {
        violations = violations == null ? List.of() : List.copyOf(violations);
        skippedPolicies = skippedPolicies == null ? List.of() : List.copyOf(skippedPolicies);
    }

    public static PolicyVerdict empty() {
        return new PolicyVerdict(List.of(), false, List.of());
    }

    public boolean hasViolations() {
        return !violations.isEmpty();
    }
}
