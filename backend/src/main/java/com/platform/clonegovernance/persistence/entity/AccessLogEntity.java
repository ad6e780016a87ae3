package com.platform.clonegovernance.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * JPA entity for clone read/use events.
 */
@Entity
@Immutable
@Table(name = "clone_access_log", indexes = {
    @Index(name = "idx_access_timestamp", columnList = "event_time"),
    @Index(name = "idx_access_clone", columnList = "clone_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccessLogEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "event_time", nullable = false, updatable = false)
    private Instant timestamp;

    @Column(name = "clone_id", length = 255)
    private String cloneId;

    @Column(name = "clone_name", length = 500)
    private String cloneName;

    @Column(name = "accessed_by", length = 255, nullable = false)
    private String accessedBy;

    @Column(name = "access_type", length = 50)
    private String accessType;

    @Column(name = "query_id", length = 255)
    private String queryId;

    @Column(name = "rows_accessed")
    private Long rowsAccessed;

    @Column(name = "session_id", length = 255)
    private String sessionId;

    @PrePersist
    protected void onCreate() {
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
