package com.platform.clonegovernance.policy;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

/**
 * Governance policy applied to clone operations.
 */
@Data
@Builder(toBuilder = true)
public class Policy {

    /**
     * Unique policy identifier.
     */
    @Builder.Default
    private String id = UUID.randomUUID().toString();

    /**
     * Unique human-readable policy name.
     */
    private String name;

    private PolicyKind kind;

    /**
     * Environment tag this policy applies to, or null for every environment.
     */
    private String scope;

    /**
     * Typed parameters. Its variant always matches {@link #kind}.
     */
    private PolicyDefinition definition;

    @Builder.Default
    private PolicySeverity severity = PolicySeverity.WARNING;

    /**
     * Inactive policies are kept for history but never evaluated.
     */
    @Builder.Default
    private boolean active = true;

    private String description;

    private String createdBy;

    @Builder.Default
    private Instant createdAt = Instant.now();

    private String updatedBy;

    @Builder.Default
    private Instant updatedAt = Instant.now();

    /**
     * Checks if this policy applies to the given environment.
     */
    public boolean appliesTo(String environment) {
        return scope == null || scope.equals(environment);
    }
}
