package com.platform.clonegovernance.persistence.repository;

import com.platform.clonegovernance.persistence.entity.CloneRegistryEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Read-only Spring Data access to the clone registry.
 */
@Repository
public interface CloneRegistryJpaRepository extends JpaRepository<CloneRegistryEntity, String> {

    long countByCreatedByAndStatus(String createdBy, String status);

    @Query("SELECT c FROM CloneRegistryEntity c " +
           "WHERE c.status = :status " +
           "AND (:environment IS NULL OR c.environment = :environment) " +
           "ORDER BY c.cloneId")
    List<CloneRegistryEntity> findByStatusAndEnvironment(
        @Param("status") String status,
        @Param("environment") String environment,
        Pageable pageable
    );
}
