package com.platform.clonegovernance.persistence.repository;

import com.platform.clonegovernance.persistence.entity.AccessLogEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Spring Data JPA repository for clone access events.
 */
@Repository
public interface AccessLogJpaRepository extends JpaRepository<AccessLogEntity, String> {

    @Query("SELECT a FROM AccessLogEntity a " +
           "WHERE a.timestamp >= :from AND a.timestamp <= :to " +
           "AND (:accessedBy IS NULL OR a.accessedBy = :accessedBy) " +
           "AND (:cloneId IS NULL OR a.cloneId = :cloneId) " +
           "ORDER BY a.timestamp DESC")
    List<AccessLogEntity> findFiltered(
        @Param("from") Instant from,
        @Param("to") Instant to,
        @Param("accessedBy") String accessedBy,
        @Param("cloneId") String cloneId,
        Pageable pageable
    );

    long countByTimestampBefore(Instant cutoff);

    @Query("SELECT a.id FROM AccessLogEntity a WHERE a.timestamp < :cutoff ORDER BY a.id")
    List<String> findIdsBefore(@Param("cutoff") Instant cutoff, Pageable pageable);
}
