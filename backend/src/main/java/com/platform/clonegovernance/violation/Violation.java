package com.platform.clonegovernance.violation;

import com.platform.clonegovernance.policy.PolicyKind;
import com.platform.clonegovernance.policy.PolicySeverity;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A detected policy violation.
 */
@Data
@Builder(toBuilder = true)
public class Violation {

    @Builder.Default
    private String id = UUID.randomUUID().toString();

    private Instant detectedAt;

    private String policyId;

    /**
     * Policy name at detection time.
     */
    private String policyName;

    private PolicyKind policyKind;

    private String cloneId;

    private String cloneName;

    /**
     * Actor whose operation, or whose clone, violated the policy.
     */
    private String violatedBy;

    /**
     * Always contains {@code message} and {@code action}.
     */
    private Map<String, Object> details;

    /**
     * Policy severity at detection time. Later policy edits do not change it.
     */
    private PolicySeverity severity;

    @Builder.Default
    private ViolationStatus status = ViolationStatus.OPEN;

    private String resolvedBy;

    private Instant resolvedAt;

    private String resolutionNotes;

    private String auditId;

    public boolean isOpen() {
        return status == ViolationStatus.OPEN;
    }
}
