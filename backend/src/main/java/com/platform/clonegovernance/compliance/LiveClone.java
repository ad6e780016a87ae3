package com.platform.clonegovernance.compliance;

import java.time.Duration;
import java.time.Instant;

/**
 * A clone that currently exists, as reported by the clone registry.
 */
public record LiveClone(
    String cloneId,
    String cloneName,
    String cloneType,
    String scope,
    String owner,
    Instant createdAt
) {

    /**
     * Age in whole days at the given instant.
     */
    public long ageInDays(Instant now) {
        if (createdAt == null || now.isBefore(createdAt)) {
            return 0;
        }
        return Duration.between(createdAt, now).toDays();
    }
}
