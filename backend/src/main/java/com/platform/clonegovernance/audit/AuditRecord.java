package com.platform.clonegovernance.audit;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One entry of the append-only audit log.
 */
@Data
@Builder
public class AuditRecord {

    @Builder.Default
    private String id = UUID.randomUUID().toString();

    private Instant timestamp;

    private AuditOperation operation;

    private String cloneId;

    private String cloneName;

    private String cloneType;

    private String scope;

    private String sourceDatabase;

    private String sourceSchema;

    private String performedBy;

    private String performedByRole;

    private String sessionId;

    private String clientIp;

    private OperationStatus status;

    private String errorMessage;

    private Map<String, Object> metadata;

    /**
     * Ids of the violations written together with this record.
     */
    @Builder.Default
    private List<String> violationIds = List.of();
}
