package com.platform.clonegovernance.error;

/**
 * Exception for read lookups of a single resource that does not exist.
 * Administrative commands report missing targets through their result documents instead.
 */
public class ResourceNotFoundException extends CloneGovernanceException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(ErrorCode errorCode, String resourceType, String resourceId) {
        super(errorCode, String.format("%s not found: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public static ResourceNotFoundException policy(String policyId) {
        return new ResourceNotFoundException(ErrorCode.POLICY_NOT_FOUND, "Policy", policyId);
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
