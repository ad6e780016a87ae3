package com.platform.clonegovernance.audit;

import com.platform.clonegovernance.error.ValidationException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Read queries over the audit and access logs.
 * Defaults to the last 30 days; results are capped at 1000 rows.
 */
@Service
public class AuditQueryService {

    static final int MAX_LIMIT = 1000;

    private final AuditLogRepository auditLogRepository;
    private final AccessLogRepository accessLogRepository;
    private final Clock clock;
    private final int defaultLookbackDays;

    public AuditQueryService(
            AuditLogRepository auditLogRepository,
            AccessLogRepository accessLogRepository,
            Clock clock,
            @Value("${clonegovernance.queries.audit-lookback-days:30}") int defaultLookbackDays) {
        this.auditLogRepository = auditLogRepository;
        this.accessLogRepository = accessLogRepository;
        this.clock = clock;
        this.defaultLookbackDays = defaultLookbackDays;
    }

    public List<AuditRecord> findOperations(AuditQuery query) {
        Instant[] window = window(query);
        return auditLogRepository.find(window[0], window[1], query.operation(), query.actor(), query.scope(),
            query.status(), effectiveLimit(query.limit()));
    }

    public List<AccessRecord> findAccess(AuditQuery query) {
        Instant[] window = window(query);
        return accessLogRepository.find(window[0], window[1], query.actor(), query.cloneId(),
            effectiveLimit(query.limit()));
    }

    private Instant[] window(AuditQuery query) {
        Instant to = query.to() != null ? query.to() : clock.instant();
        Instant from = query.from() != null ? query.from() : to.minus(Duration.ofDays(defaultLookbackDays));
        if (!from.isBefore(to)) {
            throw new ValidationException("from", from, "must be before 'to'");
        }
        return new Instant[] {from, to};
    }

    private static int effectiveLimit(Integer limit) {
        if (limit == null || limit <= 0) {
            return MAX_LIMIT;
        }
        return Math.min(limit, MAX_LIMIT);
    }
}
