package com.platform.clonegovernance.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.clonegovernance.audit.AccessRecord;
import com.platform.clonegovernance.audit.AuditRecord;
import com.platform.clonegovernance.compliance.LiveClone;
import com.platform.clonegovernance.persistence.entity.AccessLogEntity;
import com.platform.clonegovernance.persistence.entity.AuditRecordEntity;
import com.platform.clonegovernance.persistence.entity.CloneRegistryEntity;
import com.platform.clonegovernance.persistence.entity.PolicyEntity;
import com.platform.clonegovernance.persistence.entity.PolicyViolationEntity;
import com.platform.clonegovernance.policy.Policy;
import com.platform.clonegovernance.policy.PolicyDefinitionCodec;
import com.platform.clonegovernance.violation.Violation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Bidirectional mappers between domain objects and JPA entities.
 */
@Slf4j
@Component
public class EntityMappers {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<String>> LIST_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final PolicyDefinitionCodec definitionCodec;

    public EntityMappers(ObjectMapper objectMapper, PolicyDefinitionCodec definitionCodec) {
        this.objectMapper = objectMapper;
        this.definitionCodec = definitionCodec;
    }

    // ==================== Policy ====================

    public PolicyEntity toEntity(Policy domain) {
        return PolicyEntity.builder()
            .id(domain.getId())
            .name(domain.getName())
            .kind(domain.getKind())
            .scope(domain.getScope())
            .definitionJson(definitionCodec.toJson(domain.getDefinition()))
            .severity(domain.getSeverity())
            .severityRank(domain.getSeverity().rank())
            .active(domain.isActive())
            .description(domain.getDescription())
            .createdBy(domain.getCreatedBy())
            .createdAt(domain.getCreatedAt())
            .updatedBy(domain.getUpdatedBy())
            .updatedAt(domain.getUpdatedAt())
            .build();
    }

    /**
     * Maps a stored policy. Throws {@link com.platform.clonegovernance.error.ValidationException}
     * when the stored definition no longer decodes.
     */
    public Policy toDomain(PolicyEntity entity) {
        return Policy.builder()
            .id(entity.getId())
            .name(entity.getName())
            .kind(entity.getKind())
            .scope(entity.getScope())
            .definition(definitionCodec.fromJson(entity.getKind(), entity.getDefinitionJson()))
            .severity(entity.getSeverity())
            .active(entity.isActive())
            .description(entity.getDescription())
            .createdBy(entity.getCreatedBy())
            .createdAt(entity.getCreatedAt())
            .updatedBy(entity.getUpdatedBy())
            .updatedAt(entity.getUpdatedAt())
            .build();
    }

    /**
     * Copies mutable policy fields onto a managed entity, keeping its version.
     */
    public void updateEntity(PolicyEntity entity, Policy domain) {
        entity.setKind(domain.getKind());
        entity.setScope(domain.getScope());
        entity.setDefinitionJson(definitionCodec.toJson(domain.getDefinition()));
        entity.setSeverity(domain.getSeverity());
        entity.setSeverityRank(domain.getSeverity().rank());
        entity.setActive(domain.isActive());
        entity.setDescription(domain.getDescription());
        entity.setUpdatedBy(domain.getUpdatedBy());
        entity.setUpdatedAt(domain.getUpdatedAt());
    }

    // ==================== Violation ====================

    public PolicyViolationEntity toEntity(Violation domain) {
        return PolicyViolationEntity.builder()
            .id(domain.getId())
            .detectedAt(domain.getDetectedAt())
            .policyId(domain.getPolicyId())
            .policyName(domain.getPolicyName())
            .policyKind(domain.getPolicyKind())
            .cloneId(domain.getCloneId())
            .cloneName(domain.getCloneName())
            .violatedBy(domain.getViolatedBy())
            .detailsJson(writeJson(domain.getDetails()))
            .severity(domain.getSeverity())
            .severityRank(domain.getSeverity().rank())
            .status(domain.getStatus())
            .resolvedBy(domain.getResolvedBy())
            .resolvedAt(domain.getResolvedAt())
            .resolutionNotes(domain.getResolutionNotes())
            .auditId(domain.getAuditId())
            .build();
    }

    public Violation toDomain(PolicyViolationEntity entity) {
        return Violation.builder()
            .id(entity.getId())
            .detectedAt(entity.getDetectedAt())
            .policyId(entity.getPolicyId())
            .policyName(entity.getPolicyName())
            .policyKind(entity.getPolicyKind())
            .cloneId(entity.getCloneId())
            .cloneName(entity.getCloneName())
            .violatedBy(entity.getViolatedBy())
            .details(readMap(entity.getDetailsJson()))
            .severity(entity.getSeverity())
            .status(entity.getStatus())
            .resolvedBy(entity.getResolvedBy())
            .resolvedAt(entity.getResolvedAt())
            .resolutionNotes(entity.getResolutionNotes())
            .auditId(entity.getAuditId())
            .build();
    }

    // ==================== AuditRecord ====================

    public AuditRecordEntity toEntity(AuditRecord domain) {
        return AuditRecordEntity.builder()
            .id(domain.getId())
            .timestamp(domain.getTimestamp())
            .operation(domain.getOperation())
            .cloneId(domain.getCloneId())
            .cloneName(domain.getCloneName())
            .cloneType(domain.getCloneType())
            .scope(domain.getScope())
            .sourceDatabase(domain.getSourceDatabase())
            .sourceSchema(domain.getSourceSchema())
            .performedBy(domain.getPerformedBy())
            .performedByRole(domain.getPerformedByRole())
            .sessionId(domain.getSessionId())
            .clientIp(domain.getClientIp())
            .status(domain.getStatus())
            .errorMessage(domain.getErrorMessage())
            .metadataJson(domain.getMetadata() != null ? writeJson(domain.getMetadata()) : null)
            .violationIdsJson(writeJson(domain.getViolationIds()))
            .build();
    }

    public AuditRecord toDomain(AuditRecordEntity entity) {
        return AuditRecord.builder()
            .id(entity.getId())
            .timestamp(entity.getTimestamp())
            .operation(entity.getOperation())
            .cloneId(entity.getCloneId())
            .cloneName(entity.getCloneName())
            .cloneType(entity.getCloneType())
            .scope(entity.getScope())
            .sourceDatabase(entity.getSourceDatabase())
            .sourceSchema(entity.getSourceSchema())
            .performedBy(entity.getPerformedBy())
            .performedByRole(entity.getPerformedByRole())
            .sessionId(entity.getSessionId())
            .clientIp(entity.getClientIp())
            .status(entity.getStatus())
            .errorMessage(entity.getErrorMessage())
            .metadata(entity.getMetadataJson() != null ? readMap(entity.getMetadataJson()) : null)
            .violationIds(readList(entity.getViolationIdsJson()))
            .build();
    }

    // ==================== AccessRecord ====================

    public AccessLogEntity toEntity(AccessRecord domain) {
        return AccessLogEntity.builder()
            .id(domain.getId())
            .timestamp(domain.getTimestamp())
            .cloneId(domain.getCloneId())
            .cloneName(domain.getCloneName())
            .accessedBy(domain.getAccessedBy())
            .accessType(domain.getAccessType())
            .queryId(domain.getQueryId())
            .rowsAccessed(domain.getRowsAccessed())
            .sessionId(domain.getSessionId())
            .build();
    }

    public AccessRecord toDomain(AccessLogEntity entity) {
        return AccessRecord.builder()
            .id(entity.getId())
            .timestamp(entity.getTimestamp())
            .cloneId(entity.getCloneId())
            .cloneName(entity.getCloneName())
            .accessedBy(entity.getAccessedBy())
            .accessType(entity.getAccessType())
            .queryId(entity.getQueryId())
            .rowsAccessed(entity.getRowsAccessed())
            .sessionId(entity.getSessionId())
            .build();
    }

    // ==================== Clone registry ====================

    public LiveClone toDomain(CloneRegistryEntity entity) {
        return new LiveClone(
            entity.getCloneId(),
            entity.getCloneName(),
            entity.getCloneType(),
            entity.getEnvironment(),
            entity.getCreatedBy(),
            entity.getCreatedAt()
        );
    }

    // ==================== JSON helpers ====================

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize JSON column", e);
        }
    }

    private Map<String, Object> readMap(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize JSON document: {}", json, e);
            return Map.of("raw", json);
        }
    }

    private List<String> readList(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, LIST_TYPE);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize id list: {}", json, e);
            return List.of();
        }
    }
}
