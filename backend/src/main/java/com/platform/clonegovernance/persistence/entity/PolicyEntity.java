package com.platform.clonegovernance.persistence.entity;

import com.platform.clonegovernance.policy.PolicyKind;
import com.platform.clonegovernance.policy.PolicySeverity;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for clone policies.
 * The kind-specific definition is stored as a JSON document.
 */
@Entity
@Table(name = "clone_policies", indexes = {
    @Index(name = "idx_policy_scope", columnList = "scope"),
    @Index(name = "idx_policy_active", columnList = "active")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PolicyEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, unique = true)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(length = 50, nullable = false)
    private PolicyKind kind;

    /**
     * Environment tag, null for all environments.
     */
    @Column(length = 50)
    private String scope;

    @Column(name = "definition_json", length = 4000, nullable = false)
    private String definitionJson;

    @Enumerated(EnumType.STRING)
    @Column(length = 20, nullable = false)
    private PolicySeverity severity;

    /**
     * Severity rank kept alongside the enum name so queries can order by it.
     */
    @Column(name = "severity_rank", nullable = false)
    private int severityRank;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(length = 2000)
    private String description;

    @Column(name = "created_by", length = 255)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_by", length = 255)
    private String updatedBy;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Optimistic locking version for concurrent update safety.
     */
    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
        syncSeverityRank();
    }

    @PreUpdate
    protected void onUpdate() {
        syncSeverityRank();
    }

    private void syncSeverityRank() {
        if (severity != null) {
            severityRank = severity.rank();
        }
    }
}
