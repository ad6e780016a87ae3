package com.platform.clonegovernance.evaluation;

import com.platform.clonegovernance.observability.MetricsRegistry;
import com.platform.clonegovernance.observability.StructuredLogger;
import com.platform.clonegovernance.policy.ActivePolicySet;
import com.platform.clonegovernance.policy.Policy;
import com.platform.clonegovernance.policy.PolicyDefinition;
import com.platform.clonegovernance.policy.PolicyRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether an operation complies with the active policies of its scope.
 *
 * Holds no mutable state. Policies are read from the store on every call, so an
 * activation toggle is visible to the next evaluation.
 */
@Slf4j
@Component
public class PolicyEvaluator {

    static final Comparator<ViolationCandidate> VIOLATION_ORDER = Comparator
        .comparing(ViolationCandidate::severity).reversed()
        .thenComparing(ViolationCandidate::policyName);

    private final PolicyRepository policyRepository;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;

    public PolicyEvaluator(
            PolicyRepository policyRepository,
            MetricsRegistry metricsRegistry,
            StructuredLogger structuredLogger) {
        this.policyRepository = policyRepository;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
    }

    /**
     * Evaluate the active policies of the context's scope.
     */
    public PolicyVerdict evaluate(EvaluationContext context) {
        ActivePolicySet activePolicies = policyRepository.findActiveForScope(context.scope());
        return evaluate(context, activePolicies.policies(), activePolicies.skippedPolicies());
    }

    /**
     * Evaluate a given set of policies. Inactive and out-of-scope policies are ignored.
     */
    public PolicyVerdict evaluate(EvaluationContext context, Collection<Policy> policies) {
        return evaluate(context, policies, List.of());
    }

    private PolicyVerdict evaluate(EvaluationContext context, Collection<Policy> policies,
            List<String> alreadySkipped) {
        List<ViolationCandidate> violations = new ArrayList<>();
        List<String> skipped = new ArrayList<>(alreadySkipped);
        boolean block = false;

        List<Policy> applicable = policies.stream()
            .filter(Policy::isActive)
            .filter(p -> p.appliesTo(context.scope()))
            .filter(p -> p.getKind() == null || p.getKind().isOperationTime())
            .sorted(Comparator.comparing(Policy::getName))
            .toList();

        for (Policy policy : applicable) {
            Optional<ViolationCandidate> match;
            try {
                match = check(policy, context);
            } catch (RuntimeException e) {
                log.warn("Skipping policy '{}' during evaluation: {}", policy.getName(), e.getMessage());
                structuredLogger.policy().skipped(policy.getId(), policy.getName(), e.getMessage());
                skipped.add(policy.getName());
                continue;
            }

            if (match.isPresent()) {
                ViolationCandidate candidate = match.get();
                log.debug("Policy '{}' matched for clone {}: {}", policy.getName(), context.cloneName(),
                    candidate.message());
                violations.add(candidate);
                block = block || candidate.blocking();
            }
        }

        violations.sort(VIOLATION_ORDER);

        metricsRegistry.incrementCounter(MetricsRegistry.EVALUATIONS, "blocked", String.valueOf(block));
        if (!skipped.isEmpty()) {
            metricsRegistry.incrementCounter(MetricsRegistry.POLICIES_SKIPPED);
        }

        return new PolicyVerdict(violations, block, skipped);
    }

    private Optional<ViolationCandidate> check(Policy policy, EvaluationContext context) {
        PolicyDefinition definition = policy.getDefinition();
        if (definition == null || policy.getKind() == null) {
            throw new PolicyEvaluationException("Policy has no usable definition: " + policy.getName());
        }
        if (!policy.getKind().getDefinitionType().isInstance(definition)) {
            throw new PolicyEvaluationException(String.format(
                "Definition %s does not match kind %s", definition.getClass().getSimpleName(), policy.getKind()));
        }
        return definition.check(context).map(finding -> ViolationCandidate.of(policy, finding));
    }
}
