package com.platform.clonegovernance.persistence.entity;

import com.platform.clonegovernance.policy.PolicyKind;
import com.platform.clonegovernance.policy.PolicySeverity;
import com.platform.clonegovernance.violation.ViolationStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for detected policy violations.
 * Only the resolution columns change after insert.
 */
@Entity
@Table(name = "policy_violations", indexes = {
    @Index(name = "idx_violation_detected_at", columnList = "detected_at"),
    @Index(name = "idx_violation_status", columnList = "status"),
    @Index(name = "idx_violation_policy_clone", columnList = "policy_id, clone_id"),
    @Index(name = "idx_violation_violated_by", columnList = "violated_by")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PolicyViolationEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "detected_at", nullable = false, updatable = false)
    private Instant detectedAt;

    @Column(name = "policy_id", length = 36, nullable = false)
    private String policyId;

    /**
     * Copied at detection so the record survives deletion of the policy.
     */
    @Column(name = "policy_name", nullable = false)
    private String policyName;

    @Enumerated(EnumType.STRING)
    @Column(name = "policy_kind", length = 50)
    private PolicyKind policyKind;

    @Column(name = "clone_id", length = 255)
    private String cloneId;

    @Column(name = "clone_name", length = 500)
    private String cloneName;

    @Column(name = "violated_by", length = 255)
    private String violatedBy;

    @Column(name = "details_json", columnDefinition = "TEXT")
    private String detailsJson;

    @Enumerated(EnumType.STRING)
    @Column(length = 20, nullable = false)
    private PolicySeverity severity;

    @Column(name = "severity_rank", nullable = false)
    private int severityRank;

    @Enumerated(EnumType.STRING)
    @Column(length = 20, nullable = false)
    private ViolationStatus status;

    @Column(name = "resolved_by", length = 255)
    private String resolvedBy;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "resolution_notes", length = 2000)
    private String resolutionNotes;

    /**
     * Audit record written together with this violation, null for scan findings.
     */
    @Column(name = "audit_id", length = 36)
    private String auditId;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (detectedAt == null) {
            detectedAt = Instant.now();
        }
        if (status == null) {
            status = ViolationStatus.OPEN;
        }
        if (severity != null) {
            severityRank = severity.rank();
        }
    }
}
