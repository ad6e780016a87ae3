package com.platform.clonegovernance.persistence.entity;

import com.platform.clonegovernance.audit.AuditOperation;
import com.platform.clonegovernance.audit.OperationStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * JPA entity for the clone audit log.
 * Append-only - never updated after insert.
 */
@Entity
@Immutable
@Table(name = "clone_audit_log", indexes = {
    @Index(name = "idx_audit_timestamp", columnList = "event_time"),
    @Index(name = "idx_audit_performed_by", columnList = "performed_by"),
    @Index(name = "idx_audit_operation", columnList = "operation")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditRecordEntity {

    public static final int ERROR_MESSAGE_LENGTH = 2000;

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "event_time", nullable = false, updatable = false)
    private Instant timestamp;

    @Enumerated(EnumType.STRING)
    @Column(length = 50, nullable = false)
    private AuditOperation operation;

    @Column(name = "clone_id", length = 255)
    private String cloneId;

    @Column(name = "clone_name", length = 500)
    private String cloneName;

    @Column(name = "clone_type", length = 50)
    private String cloneType;

    @Column(length = 50)
    private String scope;

    @Column(name = "source_database", length = 255)
    private String sourceDatabase;

    @Column(name = "source_schema", length = 255)
    private String sourceSchema;

    @Column(name = "performed_by", length = 255, nullable = false)
    private String performedBy;

    @Column(name = "performed_by_role", length = 255)
    private String performedByRole;

    @Column(name = "session_id", length = 255)
    private String sessionId;

    @Column(name = "client_ip", length = 64)
    private String clientIp;

    @Enumerated(EnumType.STRING)
    @Column(length = 20, nullable = false)
    private OperationStatus status;

    @Column(name = "error_message", length = ERROR_MESSAGE_LENGTH)
    private String errorMessage;

    @Column(name = "metadata_json", columnDefinition = "TEXT")
    private String metadataJson;

    @Column(name = "violation_ids_json", columnDefinition = "TEXT")
    private String violationIdsJson;

    @PrePersist
    protected void onCreate() {
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
