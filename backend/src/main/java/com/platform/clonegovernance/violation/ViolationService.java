package com.platform.clonegovernance.violation;

import com.platform.clonegovernance.error.ValidationException;
import com.platform.clonegovernance.evaluation.ActorIdentity;
import com.platform.clonegovernance.observability.StructuredLogger;
import com.platform.clonegovernance.policy.PolicySeverity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Violation lifecycle and read queries.
 */
@Slf4j
@Service
public class ViolationService {

    static final int MAX_LIMIT = 1000;

    private final ViolationRepository violationRepository;
    private final StructuredLogger structuredLogger;
    private final Clock clock;
    private final int defaultLookbackDays;

    public ViolationService(
            ViolationRepository violationRepository,
            StructuredLogger structuredLogger,
            Clock clock,
            @Value("${clonegovernance.queries.violation-lookback-days:90}") int defaultLookbackDays) {
        this.violationRepository = violationRepository;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
        this.defaultLookbackDays = defaultLookbackDays;
    }

    /**
     * Resolve an OPEN violation. RESOLVED is terminal, so a second resolution is refused.
     */
    @Transactional
    public ViolationCommandResult resolveViolation(String violationId, String notes, ActorIdentity actor) {
        Optional<Violation> existing = violationRepository.findById(violationId);
        if (existing.isEmpty()) {
            return ViolationCommandResult.notFound(violationId);
        }
        if (!existing.get().isOpen()) {
            return ViolationCommandResult.alreadyResolved(existing.get());
        }

        Optional<Violation> resolved = violationRepository.markResolved(violationId, actor.user(),
            clock.instant(), notes);
        if (resolved.isEmpty()) {
            return ViolationCommandResult.notFound(violationId);
        }

        log.info("Violation {} of policy '{}' resolved by {}", violationId, resolved.get().getPolicyName(),
            actor.user());
        structuredLogger.audit().violationResolved(violationId, resolved.get().getPolicyName(), actor.user());
        return ViolationCommandResult.resolved(resolved.get());
    }

    /**
     * Violations in a time window, most severe first. Defaults to the last 90 days, at most 1000 rows.
     */
    public List<Violation> findViolations(ViolationQuery query) {
        Instant to = query.to() != null ? query.to() : clock.instant();
        Instant from = query.from() != null ? query.from() : to.minus(Duration.ofDays(defaultLookbackDays));
        if (!from.isBefore(to)) {
            throw new ValidationException("from", from, "must be before 'to'");
        }
        return violationRepository.find(from, to, query.status(), query.severity(), query.actor(),
            query.policyName(), effectiveLimit(query.limit()));
    }

    static int effectiveLimit(Integer limit) {
        if (limit == null || limit <= 0) {
            return MAX_LIMIT;
        }
        return Math.min(limit, MAX_LIMIT);
    }

    /**
     * Filters for {@link #findViolations(ViolationQuery)}. Null fields are not filtered on.
     */
    public record ViolationQuery(
        Instant from,
        Instant to,
        ViolationStatus status,
        PolicySeverity severity,
        String actor,
        String policyName,
        Integer limit
    ) {
    }
}
