package com.platform.clonegovernance.audit;

import lombok.Builder;

import java.time.Instant;

/**
 * Filters for audit and access log reads. Null fields are not filtered on.
 */
@Builder
public record AuditQuery(
    Instant from,
    Instant to,
    AuditOperation operation,
    String actor,
    String scope,
    OperationStatus status,
    String cloneId,
    Integer limit
) {
}
