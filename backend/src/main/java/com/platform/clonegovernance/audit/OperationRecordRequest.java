package com.platform.clonegovernance.audit;

import com.platform.clonegovernance.evaluation.ActorIdentity;
import com.platform.clonegovernance.evaluation.PolicyVerdict;
import lombok.Builder;

import java.util.Map;

/**
 * A governed operation to record.
 *
 * @param liveCloneCount actor's live clone count, or null to read it from the clone registry
 * @param verdict        a verdict already computed by the caller; when present it is stored as-is
 *                       and no evaluation runs
 */
@Builder(toBuilder = true)
public record OperationRecordRequest(
    AuditOperation operation,
    OperationStatus status,
    String cloneId,
    String cloneName,
    String cloneType,
    String scope,
    String sourceDatabase,
    String sourceSchema,
    String dataClassification,
    ActorIdentity actor,
    String errorMessage,
    Map<String, Object> metadata,
    Long liveCloneCount,
    PolicyVerdict verdict
) {

    /**
     * Only successful creations are evaluated.
     */
    public boolean requiresEvaluation() {
        return verdict == null && operation == AuditOperation.CREATE && status == OperationStatus.SUCCESS;
    }
}
