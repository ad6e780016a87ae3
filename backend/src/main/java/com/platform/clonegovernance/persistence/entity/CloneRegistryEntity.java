package com.platform.clonegovernance.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * Read-only view of the clone registry maintained by the clone management component.
 */
@Entity
@Immutable
@Table(name = "clone_registry")
@Data
@NoArgsConstructor
public class CloneRegistryEntity {

    public static final String STATUS_ACTIVE = "ACTIVE";

    @Id
    @Column(name = "clone_id", length = 255)
    private String cloneId;

    @Column(name = "clone_name", length = 500)
    private String cloneName;

    @Column(name = "clone_type", length = 50)
    private String cloneType;

    @Column(length = 50)
    private String environment;

    @Column(name = "created_by", length = 255)
    private String createdBy;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(length = 20)
    private String status;
}
