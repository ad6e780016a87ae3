package com.platform.clonegovernance.audit;

import com.platform.clonegovernance.persistence.EntityMappers;
import com.platform.clonegovernance.persistence.repository.AuditRecordJpaRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Append-only audit log store.
 */
@Component
public class AuditLogRepository {

    private final AuditRecordJpaRepository jpaRepository;
    private final EntityMappers entityMappers;

    public AuditLogRepository(AuditRecordJpaRepository jpaRepository, EntityMappers entityMappers) {
        this.jpaRepository = jpaRepository;
        this.entityMappers = entityMappers;
    }

    public AuditRecord append(AuditRecord record) {
        return entityMappers.toDomain(jpaRepository.save(entityMappers.toEntity(record)));
    }

    public List<AuditRecord> find(Instant from, Instant to, AuditOperation operation, String actor,
            String scope, OperationStatus status, int limit) {
        return jpaRepository.findFiltered(from, to, operation, actor, scope, status, PageRequest.of(0, limit))
            .stream()
            .map(entityMappers::toDomain)
            .toList();
    }
}
