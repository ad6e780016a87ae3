package com.platform.clonegovernance.persistence.repository;

import com.platform.clonegovernance.persistence.entity.PolicyEntity;
import com.platform.clonegovernance.policy.PolicyKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for policies.
 */
@Repository
public interface PolicyJpaRepository extends JpaRepository<PolicyEntity, String> {

    Optional<PolicyEntity> findByName(String name);

    boolean existsByName(String name);

    /**
     * Active policies that apply everywhere or to the given scope.
     * A null scope only matches policies without a scope.
     */
    @Query("SELECT p FROM PolicyEntity p " +
           "WHERE p.active = true " +
           "AND (p.scope IS NULL OR p.scope = :scope) " +
           "ORDER BY p.name ASC")
    List<PolicyEntity> findActiveForScope(@Param("scope") String scope);

    /**
     * Active policies of one kind, regardless of scope.
     */
    List<PolicyEntity> findByKindAndActiveTrueOrderByNameAsc(PolicyKind kind);

    /**
     * Policies with optional filters, most severe first.
     */
    @Query("SELECT p FROM PolicyEntity p " +
           "WHERE (:scope IS NULL OR p.scope = :scope) " +
           "AND (:kind IS NULL OR p.kind = :kind) " +
           "AND (:activeOnly = false OR p.active = true) " +
           "ORDER BY p.severityRank DESC, p.name ASC")
    List<PolicyEntity> findFiltered(
        @Param("scope") String scope,
        @Param("kind") PolicyKind kind,
        @Param("activeOnly") boolean activeOnly
    );
}
