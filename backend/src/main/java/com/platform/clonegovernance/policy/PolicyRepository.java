package com.platform.clonegovernance.policy;

import com.platform.clonegovernance.persistence.EntityMappers;
import com.platform.clonegovernance.persistence.entity.PolicyEntity;
import com.platform.clonegovernance.persistence.repository.PolicyJpaRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Policy store. Delegates to the JPA repository and returns domain objects.
 */
@Slf4j
@Component
public class PolicyRepository {

    private final PolicyJpaRepository jpaRepository;
    private final EntityMappers entityMappers;

    public PolicyRepository(PolicyJpaRepository jpaRepository, EntityMappers entityMappers) {
        this.jpaRepository = jpaRepository;
        this.entityMappers = entityMappers;
    }

    public Policy insert(Policy policy) {
        PolicyEntity entity = jpaRepository.save(entityMappers.toEntity(policy));
        return entityMappers.toDomain(entity);
    }

    /**
     * Update an existing policy in place, keeping its optimistic lock version.
     */
    public Optional<Policy> update(Policy policy) {
        return jpaRepository.findById(policy.getId()).map(entity -> {
            entityMappers.updateEntity(entity, policy);
            return entityMappers.toDomain(jpaRepository.save(entity));
        });
    }

    public Optional<Policy> findById(String id) {
        return jpaRepository.findById(id)
            .map(entityMappers::toDomain);
    }

    public Optional<Policy> findByName(String name) {
        return jpaRepository.findByName(name)
            .map(entityMappers::toDomain);
    }

    public boolean existsByName(String name) {
        return jpaRepository.existsByName(name);
    }

    /**
     * Policies with optional filters, most severe first, then by name.
     */
    public List<Policy> findFiltered(String scope, PolicyKind kind, boolean activeOnly) {
        return decodeAll(jpaRepository.findFiltered(scope, kind, activeOnly)).policies();
    }

    /**
     * Active policies for a scope. Stored policies whose definition no longer decodes
     * are left out and reported by name.
     */
    public ActivePolicySet findActiveForScope(String scope) {
        return decodeAll(jpaRepository.findActiveForScope(scope));
    }

    /**
     * Active policies of one kind across all scopes.
     */
    public ActivePolicySet findActiveByKind(PolicyKind kind) {
        return decodeAll(jpaRepository.findByKindAndActiveTrueOrderByNameAsc(kind));
    }

    public boolean deleteById(String id) {
        if (jpaRepository.existsById(id)) {
            jpaRepository.deleteById(id);
            return true;
        }
        return false;
    }

    public long count() {
        return jpaRepository.count();
    }

    private ActivePolicySet decodeAll(List<PolicyEntity> entities) {
        List<Policy> policies = new ArrayList<>(entities.size());
        List<String> skipped = new ArrayList<>();
        for (PolicyEntity entity : entities) {
            try {
                policies.add(entityMappers.toDomain(entity));
            } catch (RuntimeException e) {
                log.warn("Stored definition of policy '{}' cannot be decoded: {}", entity.getName(), e.getMessage());
                skipped.add(entity.getName());
            }
        }
        return new ActivePolicySet(policies, skipped);
    }
}
