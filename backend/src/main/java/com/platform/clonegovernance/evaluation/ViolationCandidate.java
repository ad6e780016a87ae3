package com.platform.clonegovernance.evaluation;

import com.platform.clonegovernance.policy.Policy;
import com.platform.clonegovernance.policy.PolicyAction;
import com.platform.clonegovernance.policy.PolicyDefinition;
import com.platform.clonegovernance.policy.PolicyKind;
import com.platform.clonegovernance.policy.PolicySeverity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A policy match produced by the evaluator, not yet persisted.
 *
 * @param details always carries {@code message} and {@code action} plus kind-specific keys
 */
public record ViolationCandidate(
    String policyId,
    String policyName,
    PolicyKind policyKind,
    PolicySeverity severity,
    PolicyAction action,
    boolean blocking,
    String message,
    Map<String, Object> details
) {

    public ViolationCandidate {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    /**
     * Builds a candidate from a policy and one of its findings.
     */
    public static ViolationCandidate of(Policy policy, PolicyDefinition.Finding finding) {
        PolicyDefinition definition = policy.getDefinition();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("message", finding.message());
        details.put("action", definition.action().name());
        details.putAll(finding.details());
        return new ViolationCandidate(
            policy.getId(),
            policy.getName(),
            policy.getKind(),
            policy.getSeverity(),
            definition.action(),
            definition.blocks(),
            finding.message(),
            details);
    }
}
