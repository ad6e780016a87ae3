package com.platform.clonegovernance.persistence.repository;

import com.platform.clonegovernance.persistence.entity.PolicyViolationEntity;
import com.platform.clonegovernance.policy.PolicySeverity;
import com.platform.clonegovernance.violation.ViolationStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for policy violations.
 */
@Repository
public interface PolicyViolationJpaRepository extends JpaRepository<PolicyViolationEntity, String> {

    /**
     * Violations detected in [from, to) with optional filters, most severe first.
     */
    @Query("SELECT v FROM PolicyViolationEntity v " +
           "WHERE v.detectedAt >= :from AND v.detectedAt <= :to " +
           "AND (:status IS NULL OR v.status = :status) " +
           "AND (:severity IS NULL OR v.severity = :severity) " +
           "AND (:violatedBy IS NULL OR v.violatedBy = :violatedBy) " +
           "AND (:policyName IS NULL OR v.policyName = :policyName) " +
           "ORDER BY v.severityRank DESC, v.detectedAt DESC")
    List<PolicyViolationEntity> findFiltered(
        @Param("from") Instant from,
        @Param("to") Instant to,
        @Param("status") ViolationStatus status,
        @Param("severity") PolicySeverity severity,
        @Param("violatedBy") String violatedBy,
        @Param("policyName") String policyName,
        Pageable pageable
    );

    List<PolicyViolationEntity> findByAuditId(String auditId);

    Optional<PolicyViolationEntity> findFirstByPolicyIdAndCloneIdAndStatus(
        String policyId, String cloneId, ViolationStatus status);

    long countByDetectedAtBeforeAndStatus(Instant cutoff, ViolationStatus status);

    /**
     * Ids of one purge batch.
     */
    @Query("SELECT v.id FROM PolicyViolationEntity v " +
           "WHERE v.detectedAt < :cutoff AND v.status = :status " +
           "ORDER BY v.id")
    List<String> findIdsDetectedBefore(
        @Param("cutoff") Instant cutoff,
        @Param("status") ViolationStatus status,
        Pageable pageable
    );
}
