package com.platform.clonegovernance.compliance;

import com.platform.clonegovernance.persistence.EntityMappers;
import com.platform.clonegovernance.persistence.entity.CloneRegistryEntity;
import com.platform.clonegovernance.persistence.repository.CloneRegistryJpaRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Clone registry backed by the shared {@code clone_registry} table.
 */
@Component
public class JpaCloneRegistry implements CloneRegistry {

    private final CloneRegistryJpaRepository jpaRepository;
    private final EntityMappers entityMappers;

    public JpaCloneRegistry(CloneRegistryJpaRepository jpaRepository, EntityMappers entityMappers) {
        this.jpaRepository = jpaRepository;
        this.entityMappers = entityMappers;
    }

    @Override
    public long countLiveClones(String actor) {
        if (actor == null) {
            return 0;
        }
        return jpaRepository.countByCreatedByAndStatus(actor, CloneRegistryEntity.STATUS_ACTIVE);
    }

    @Override
    public List<LiveClone> findLiveClones(String scope, int page, int size) {
        return jpaRepository.findByStatusAndEnvironment(CloneRegistryEntity.STATUS_ACTIVE, scope,
                PageRequest.of(page, size))
            .stream()
            .map(entityMappers::toDomain)
            .toList();
    }
}
