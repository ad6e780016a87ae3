package com.platform.clonegovernance.audit;

import com.platform.clonegovernance.evaluation.ActorIdentity;
import lombok.Builder;

/**
 * A read or use of a clone to record.
 */
@Builder
public record AccessRecordRequest(
    String cloneId,
    String cloneName,
    ActorIdentity actor,
    String accessType,
    String queryId,
    Long rowsAccessed
) {
}
