package com.platform.clonegovernance.evaluation;

import com.platform.clonegovernance.audit.AuditOperation;
import lombok.Builder;

import java.time.Instant;
import java.util.Objects;

/**
 * Everything a policy check may look at. The evaluator never reads the clock or
 * the current user on its own; both arrive here.
 */
@Builder(toBuilder = true)
public record EvaluationContext(
    AuditOperation operation,
    String cloneId,
    String cloneName,
    String cloneType,
    String scope,
    String sourceDatabase,
    String sourceSchema,
    String dataClassification,
    ActorIdentity actor,
    long liveCloneCount,
    Instant now
) {

    public EvaluationContext {
        Objects.requireNonNull(now, "now");
        if (operation == null) {
            operation = AuditOperation.CREATE;
        }
    }
}
