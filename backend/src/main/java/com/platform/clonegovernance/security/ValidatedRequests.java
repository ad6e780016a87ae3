package com.platform.clonegovernance.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.clonegovernance.audit.AccessRecordRequest;
import com.platform.clonegovernance.audit.AuditOperation;
import com.platform.clonegovernance.audit.OperationRecordRequest;
import com.platform.clonegovernance.audit.OperationStatus;
import com.platform.clonegovernance.evaluation.ActorIdentity;
import com.platform.clonegovernance.evaluation.EvaluationContext;
import com.platform.clonegovernance.policy.PolicyDraft;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.time.Instant;
import java.util.Map;

/**
 * Validated request bodies of the governance API.
 */
public class ValidatedRequests {

    /**
     * Identity of the caller, carried in request bodies.
     */
    @Data
    public static class ActorRequest {

        @NotBlank(message = "Actor user is required")
        @SafeString(maxLength = 100, identifier = true)
        private String user;

        @SafeString(maxLength = 100, identifier = true)
        private String role;

        @SafeString(maxLength = 100, identifier = true)
        private String sessionId;

        @SafeString(maxLength = 64, identifier = true)
        private String clientIp;

        public ActorIdentity toIdentity() {
            return new ActorIdentity(user, role, sessionId, clientIp);
        }
    }

    /**
     * Policy create request. The definition document is validated against the kind by the service.
     */
    @Data
    public static class CreatePolicyRequest {

        @NotBlank(message = "Policy name is required")
        @Size(min = 3, max = 100, message = "Name must be 3-100 characters")
        @SafeString(maxLength = 100, identifier = true)
        private String name;

        @NotBlank(message = "Policy kind is required")
        private String kind;

        @SafeString(maxLength = 50, identifier = true)
        private String scope;

        @NotNull(message = "Policy definition is required")
        private JsonNode definition;

        private String severity;

        @SafeString(maxLength = 500, allowNewlines = true)
        private String description;

        private Boolean active;

        public PolicyDraft toDraft() {
            return new PolicyDraft(name, kind, scope, definition, severity, description, active);
        }
    }

    /**
     * Policy update request. Absent fields keep their current value.
     */
    @Data
    public static class UpdatePolicyRequest {

        private String kind;

        @SafeString(maxLength = 50, identifier = true)
        private String scope;

        private JsonNode definition;

        private String severity;

        @SafeString(maxLength = 500, allowNewlines = true)
        private String description;

        private Boolean active;

        public PolicyDraft toDraft() {
            return new PolicyDraft(null, kind, scope, definition, severity, description, active);
        }
    }

    /**
     * Operation attributes shared by pre-checks and recordings.
     */
    @Data
    public static class OperationRequest {

        private AuditOperation operation;

        @SafeString(maxLength = 64, identifier = true)
        private String cloneId;

        @NotBlank(message = "Clone name is required")
        @SafeString(maxLength = 255, identifier = true)
        private String cloneName;

        @SafeString(maxLength = 50, identifier = true)
        private String cloneType;

        @SafeString(maxLength = 50, identifier = true)
        private String scope;

        @SafeString(maxLength = 128, identifier = true)
        private String sourceDatabase;

        @SafeString(maxLength = 128, identifier = true)
        private String sourceSchema;

        @SafeString(maxLength = 50, identifier = true)
        private String dataClassification;

        @Valid
        @NotNull(message = "Actor is required")
        private ActorRequest actor;

        @PositiveOrZero(message = "Live clone count must be non-negative")
        private Long liveCloneCount;

        /**
         * Evaluation time, defaults to now. Lets callers pre-check a scheduled operation.
         */
        private Instant at;

        public EvaluationContext toContext(long liveCount, Instant now) {
            return EvaluationContext.builder()
                .operation(operation != null ? operation : AuditOperation.CREATE)
                .cloneId(cloneId)
                .cloneName(cloneName)
                .cloneType(cloneType)
                .scope(scope)
                .sourceDatabase(sourceDatabase)
                .sourceSchema(sourceSchema)
                .dataClassification(dataClassification)
                .actor(actor.toIdentity())
                .liveCloneCount(liveCount)
                .now(at != null ? at : now)
                .build();
        }
    }

    /**
     * A governed operation to record, with its outcome.
     */
    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class RecordOperationRequest extends OperationRequest {

        @NotNull(message = "Operation status is required")
        private OperationStatus status;

        @SafeString(maxLength = 2000, allowNewlines = true)
        private String errorMessage;

        private Map<String, Object> metadata;

        public OperationRecordRequest toRecordRequest() {
            return OperationRecordRequest.builder()
                .operation(getOperation() != null ? getOperation() : AuditOperation.CREATE)
                .status(status)
                .cloneId(getCloneId())
                .cloneName(getCloneName())
                .cloneType(getCloneType())
                .scope(getScope())
                .sourceDatabase(getSourceDatabase())
                .sourceSchema(getSourceSchema())
                .dataClassification(getDataClassification())
                .actor(getActor().toIdentity())
                .errorMessage(errorMessage)
                .metadata(metadata)
                .liveCloneCount(getLiveCloneCount())
                .build();
        }
    }

    /**
     * A clone access to record.
     */
    @Data
    public static class RecordAccessRequest {

        @SafeString(maxLength = 64, identifier = true)
        private String cloneId;

        @NotBlank(message = "Clone name is required")
        @SafeString(maxLength = 255, identifier = true)
        private String cloneName;

        @Valid
        @NotNull(message = "Actor is required")
        private ActorRequest actor;

        @NotBlank(message = "Access type is required")
        @SafeString(maxLength = 50, identifier = true)
        private String accessType;

        @SafeString(maxLength = 100, identifier = true)
        private String queryId;

        @PositiveOrZero(message = "Rows accessed must be non-negative")
        private Long rowsAccessed;

        public AccessRecordRequest toRecordRequest() {
            return AccessRecordRequest.builder()
                .cloneId(cloneId)
                .cloneName(cloneName)
                .actor(actor.toIdentity())
                .accessType(accessType)
                .queryId(queryId)
                .rowsAccessed(rowsAccessed)
                .build();
        }
    }

    /**
     * Resolution of an OPEN violation.
     */
    @Data
    public static class ResolveViolationRequest {

        @Valid
        @NotNull(message = "Actor is required")
        private ActorRequest actor;

        @SafeString(maxLength = 1000, allowNewlines = true)
        private String notes;
    }
}
