package com.platform.clonegovernance.audit;

import com.platform.clonegovernance.persistence.EntityMappers;
import com.platform.clonegovernance.persistence.repository.AccessLogJpaRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Clone access log store.
 */
@Component
public class AccessLogRepository {

    private final AccessLogJpaRepository jpaRepository;
    private final EntityMappers entityMappers;

    public AccessLogRepository(AccessLogJpaRepository jpaRepository, EntityMappers entityMappers) {
        this.jpaRepository = jpaRepository;
        this.entityMappers = entityMappers;
    }

    public AccessRecord append(AccessRecord record) {
        return entityMappers.toDomain(jpaRepository.save(entityMappers.toEntity(record)));
    }

    public List<AccessRecord> find(Instant from, Instant to, String actor, String cloneId, int limit) {
        return jpaRepository.findFiltered(from, to, actor, cloneId, PageRequest.of(0, limit))
            .stream()
            .map(entityMappers::toDomain)
            .toList();
    }
}
