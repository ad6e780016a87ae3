package com.platform.clonegovernance.audit;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

/**
 * A read or use of a clone.
 */
@Data
@Builder
public class AccessRecord {

    @Builder.Default
    private String id = UUID.randomUUID().toString();

    private Instant timestamp;

    private String cloneId;

    private String cloneName;

    private String accessedBy;

    private String accessType;

    private String queryId;

    private Long rowsAccessed;

    private String sessionId;
}
