package com.platform.clonegovernance.policy;

import java.util.List;

/**
 * Active policies for a scope, plus names of stored policies whose definitions could not be decoded.
 */
public record ActivePolicySet(List<Policy> policies, List<String> skippedPolicies) {

    public ActivePolicySet {
        policies = List.copyOf(policies);
        skippedPolicies = List.copyOf(skippedPolicies);
    }
}
