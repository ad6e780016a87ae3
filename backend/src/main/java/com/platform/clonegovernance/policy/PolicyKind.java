package com.platform.clonegovernance.policy;

/**
 * Closed set of policy kinds. Each kind has exactly one {@link PolicyDefinition} variant.
 */
public enum PolicyKind {
    MAX_AGE(PolicyDefinition.MaxAge.class),
    ENVIRONMENT_RESTRICTION(PolicyDefinition.EnvironmentRestriction.class),
    USER_QUOTA(PolicyDefinition.UserQuota.class),
    TIME_RESTRICTION(PolicyDefinition.TimeRestriction.class),
    SENSITIVE_DATA(PolicyDefinition.SensitiveData.class),
    RESTRICTED_SOURCE(PolicyDefinition.RestrictedSource.class),
    DATA_CLASSIFICATION(PolicyDefinition.DataClassification.class),
    APPROVAL_REQUIRED(PolicyDefinition.ApprovalRequired.class);

    private final Class<? extends PolicyDefinition> definitionType;

    PolicyKind(Class<? extends PolicyDefinition> definitionType) {
        this.definitionType = definitionType;
    }

    public Class<? extends PolicyDefinition> getDefinitionType() {
        return definitionType;
    }

    /**
     * Whether this kind is checked at operation time. MAX_AGE is only checked by the compliance scan.
     */
    public boolean isOperationTime() {
        return this != MAX_AGE;
    }
}
