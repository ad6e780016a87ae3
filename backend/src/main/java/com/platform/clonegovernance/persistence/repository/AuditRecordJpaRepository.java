package com.platform.clonegovernance.persistence.repository;

import com.platform.clonegovernance.audit.AuditOperation;
import com.platform.clonegovernance.audit.OperationStatus;
import com.platform.clonegovernance.persistence.entity.AuditRecordEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Spring Data JPA repository for the clone audit log.
 */
@Repository
public interface AuditRecordJpaRepository extends JpaRepository<AuditRecordEntity, String> {

    /**
     * Audit records in [from, to) with optional filters, most recent first.
     */
    @Query("SELECT a FROM AuditRecordEntity a " +
           "WHERE a.timestamp >= :from AND a.timestamp <= :to " +
           "AND (:operation IS NULL OR a.operation = :operation) " +
           "AND (:performedBy IS NULL OR a.performedBy = :performedBy) " +
           "AND (:scope IS NULL OR a.scope = :scope) " +
           "AND (:status IS NULL OR a.status = :status) " +
           "ORDER BY a.timestamp DESC")
    List<AuditRecordEntity> findFiltered(
        @Param("from") Instant from,
        @Param("to") Instant to,
        @Param("operation") AuditOperation operation,
        @Param("performedBy") String performedBy,
        @Param("scope") String scope,
        @Param("status") OperationStatus status,
        Pageable pageable
    );

    long countByTimestampBefore(Instant cutoff);

    @Query("SELECT a.id FROM AuditRecordEntity a WHERE a.timestamp < :cutoff ORDER BY a.id")
    List<String> findIdsBefore(@Param("cutoff") Instant cutoff, Pageable pageable);
}
