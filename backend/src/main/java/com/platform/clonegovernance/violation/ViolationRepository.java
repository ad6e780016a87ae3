package com.platform.clonegovernance.violation;

import com.platform.clonegovernance.persistence.EntityMappers;
import com.platform.clonegovernance.persistence.entity.PolicyViolationEntity;
import com.platform.clonegovernance.persistence.repository.PolicyViolationJpaRepository;
import com.platform.clonegovernance.policy.PolicySeverity;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Violation store.
 */
@Component
public class ViolationRepository {

    private final PolicyViolationJpaRepository jpaRepository;
    private final EntityMappers entityMappers;

    public ViolationRepository(PolicyViolationJpaRepository jpaRepository, EntityMappers entityMappers) {
        this.jpaRepository = jpaRepository;
        this.entityMappers = entityMappers;
    }

    public List<Violation> saveAll(List<Violation> violations) {
        if (violations.isEmpty()) {
            return List.of();
        }
        List<PolicyViolationEntity> entities = violations.stream()
            .map(entityMappers::toEntity)
            .toList();
        return jpaRepository.saveAll(entities).stream()
            .map(entityMappers::toDomain)
            .toList();
    }

    public Violation save(Violation violation) {
        return entityMappers.toDomain(jpaRepository.save(entityMappers.toEntity(violation)));
    }

    public Optional<Violation> findById(String id) {
        return jpaRepository.findById(id).map(entityMappers::toDomain);
    }

    /**
     * The open violation of a policy on a clone, if one exists.
     */
    public Optional<Violation> findOpen(String policyId, String cloneId) {
        return jpaRepository.findFirstByPolicyIdAndCloneIdAndStatus(policyId, cloneId, ViolationStatus.OPEN)
            .map(entityMappers::toDomain);
    }

    /**
     * Moves a violation to RESOLVED. Only the resolution columns are written.
     */
    public Optional<Violation> markResolved(String id, String resolvedBy, Instant resolvedAt, String notes) {
        return jpaRepository.findById(id).map(entity -> {
            entity.setStatus(ViolationStatus.RESOLVED);
            entity.setResolvedBy(resolvedBy);
            entity.setResolvedAt(resolvedAt);
            entity.setResolutionNotes(notes);
            return entityMappers.toDomain(jpaRepository.save(entity));
        });
    }

    public List<Violation> findByAuditId(String auditId) {
        return jpaRepository.findByAuditId(auditId).stream()
            .map(entityMappers::toDomain)
            .toList();
    }

    public List<Violation> find(Instant from, Instant to, ViolationStatus status, PolicySeverity severity,
            String actor, String policyName, int limit) {
        return jpaRepository.findFiltered(from, to, status, severity, actor, policyName, PageRequest.of(0, limit))
            .stream()
            .map(entityMappers::toDomain)
            .toList();
    }
}
