package com.platform.clonegovernance.error;

/**
 * Exception for uniqueness conflicts, e.g. a second policy with an existing name.
 */
public class ResourceConflictException extends CloneGovernanceException {

    private final String resourceType;
    private final String conflictingValue;

    public ResourceConflictException(String resourceType, String conflictingValue) {
        super(ErrorCode.DUPLICATE_RESOURCE,
            String.format("%s already exists: %s", resourceType, conflictingValue));
        this.resourceType = resourceType;
        this.conflictingValue = conflictingValue;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getConflictingValue() {
        return conflictingValue;
    }
}
