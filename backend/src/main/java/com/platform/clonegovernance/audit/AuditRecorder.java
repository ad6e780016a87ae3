package com.platform.clonegovernance.audit;

import com.platform.clonegovernance.compliance.CloneRegistry;
import com.platform.clonegovernance.evaluation.ActorIdentity;
import com.platform.clonegovernance.evaluation.EvaluationContext;
import com.platform.clonegovernance.evaluation.PolicyEvaluator;
import com.platform.clonegovernance.evaluation.PolicyVerdict;
import com.platform.clonegovernance.evaluation.ViolationCandidate;
import com.platform.clonegovernance.observability.LoggingConfig;
import com.platform.clonegovernance.observability.MetricsRegistry;
import com.platform.clonegovernance.observability.StructuredLogger;
import com.platform.clonegovernance.persistence.entity.AuditRecordEntity;
import com.platform.clonegovernance.violation.Violation;
import com.platform.clonegovernance.violation.ViolationRepository;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Records governed operations and clone accesses.
 *
 * A successful CREATE is evaluated first; its violations and the audit record are
 * written in one transaction. Any failure in here is logged, counted and returned as
 * a not-recorded result so it can never fail the operation being recorded.
 */
@Slf4j
@Component
public class AuditRecorder {

    private static final String OPERATION_KEY = "operation";

    private final PolicyEvaluator policyEvaluator;
    private final CloneRegistry cloneRegistry;
    private final AuditLogRepository auditLogRepository;
    private final AccessLogRepository accessLogRepository;
    private final ViolationRepository violationRepository;
    private final TransactionOperations transactionOperations;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    private final Clock clock;

    public AuditRecorder(
            PolicyEvaluator policyEvaluator,
            CloneRegistry cloneRegistry,
            AuditLogRepository auditLogRepository,
            AccessLogRepository accessLogRepository,
            ViolationRepository violationRepository,
            TransactionOperations transactionOperations,
            MetricsRegistry metricsRegistry,
            StructuredLogger structuredLogger,
            Clock clock) {
        this.policyEvaluator = policyEvaluator;
        this.cloneRegistry = cloneRegistry;
        this.auditLogRepository = auditLogRepository;
        this.accessLogRepository = accessLogRepository;
        this.violationRepository = violationRepository;
        this.transactionOperations = transactionOperations;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }

    /**
     * Record one governed operation. Never throws.
     */
    public RecordingResult recordOperation(OperationRecordRequest request) {
        Instant now = clock.instant();
        ActorIdentity actor = request.actor() != null ? request.actor() : ActorIdentity.system();
        String operation = String.valueOf(request.operation());

        MDC.put(OPERATION_KEY, operation);
        MDC.put(LoggingConfig.ACTOR_KEY, actor.user());
        try {
            PolicyVerdict verdict = resolveVerdict(request, actor, now);
            RecordingResult result;
            try {
                result = persist(request, actor, verdict, now);
            } catch (RuntimeException e) {
                return failed(operation, request.cloneName(), actor.user(), verdict, e);
            }
            announce(request, actor, result);
            return result;
        } finally {
            MDC.remove(OPERATION_KEY);
            MDC.remove(LoggingConfig.ACTOR_KEY);
        }
    }

    /**
     * Record a read or use of a clone. No policies are evaluated. Never throws.
     */
    public RecordingResult recordAccess(AccessRecordRequest request) {
        ActorIdentity actor = request.actor() != null ? request.actor() : ActorIdentity.system();
        AccessRecord record;
        try {
            record = AccessRecord.builder()
                .timestamp(clock.instant())
                .cloneId(request.cloneId())
                .cloneName(request.cloneName())
                .accessedBy(actor.user())
                .accessType(request.accessType())
                .queryId(request.queryId())
                .rowsAccessed(request.rowsAccessed())
                .sessionId(actor.sessionId())
                .build();

            accessLogRepository.append(record);
        } catch (RuntimeException e) {
            return failed("ACCESS", request.cloneName(), actor.user(), PolicyVerdict.empty(), e);
        }
        try {
            structuredLogger.audit().accessRecorded(record.getId(), request.cloneName(),
                request.accessType(), actor.user());
        } catch (RuntimeException e) {
            log.warn("Access record {} committed but could not be reported: {}", record.getId(), e.getMessage());
        }
        return RecordingResult.recorded(record.getId(), List.of(), PolicyVerdict.empty());
    }

    private PolicyVerdict resolveVerdict(OperationRecordRequest request, ActorIdentity actor, Instant now) {
        if (request.verdict() != null) {
            return request.verdict();
        }
        if (!request.requiresEvaluation()) {
            return PolicyVerdict.empty();
        }
        try {
            long liveCount = request.liveCloneCount() != null
                ? request.liveCloneCount()
                : cloneRegistry.countLiveClones(actor.user());
            return policyEvaluator.evaluate(toContext(request, actor, liveCount, now));
        } catch (RuntimeException e) {
            log.error("Policy evaluation failed for {} of {}; recording without violations: {}",
                request.operation(), request.cloneName(), e.getMessage(), e);
            return PolicyVerdict.empty();
        }
    }

    private RecordingResult persist(OperationRecordRequest request, ActorIdentity actor, PolicyVerdict verdict,
            Instant now) {
        String auditId = UUID.randomUUID().toString();

        List<Violation> violations = verdict.violations().stream()
            .map(candidate -> toViolation(candidate, request, actor, auditId, now))
            .toList();
        List<String> violationIds = violations.stream().map(Violation::getId).toList();

        AuditRecord record = AuditRecord.builder()
            .id(auditId)
            .timestamp(now)
            .operation(request.operation())
            .cloneId(request.cloneId())
            .cloneName(request.cloneName())
            .cloneType(request.cloneType())
            .scope(request.scope())
            .sourceDatabase(request.sourceDatabase())
            .sourceSchema(request.sourceSchema())
            .performedBy(actor.user())
            .performedByRole(actor.role())
            .sessionId(actor.sessionId())
            .clientIp(actor.clientIp())
            .status(request.status() != null ? request.status() : OperationStatus.SUCCESS)
            .errorMessage(truncate(request.errorMessage(), AuditRecordEntity.ERROR_MESSAGE_LENGTH))
            .metadata(request.metadata())
            .violationIds(violationIds)
            .build();

        transactionOperations.executeWithoutResult(tx -> {
            violationRepository.saveAll(violations);
            auditLogRepository.append(record);
        });
        return RecordingResult.recorded(auditId, violationIds, verdict);
    }

    private void announce(OperationRecordRequest request, ActorIdentity actor, RecordingResult result) {
        try {
            if (!result.violationIds().isEmpty()) {
                metricsRegistry.incrementCounter(MetricsRegistry.VIOLATIONS_DETECTED, "source", "operation");
            }
            structuredLogger.audit().operationRecorded(result.recordId(), String.valueOf(request.operation()),
                request.cloneName(), request.scope(), actor.user(), result.violationIds().size(),
                result.verdict().block());
        } catch (RuntimeException e) {
            log.warn("Audit record {} committed but could not be reported: {}", result.recordId(), e.getMessage());
        }
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength - 3) + "...";
    }

    private RecordingResult failed(String operation, String cloneName, String actor, PolicyVerdict verdict,
            RuntimeException e) {
        log.error("Failed to record {} for clone {}: {}", operation, cloneName, e.getMessage(), e);
        metricsRegistry.incrementCounter(MetricsRegistry.RECORDING_FAILURES, "operation", operation);
        structuredLogger.audit().recordingFailed(operation, cloneName, actor, e.getMessage());
        return RecordingResult.notRecorded(e.getClass().getSimpleName() + ": " + e.getMessage(), verdict);
    }

    private Violation toViolation(ViolationCandidate candidate, OperationRecordRequest request, ActorIdentity actor,
            String auditId, Instant now) {
        return Violation.builder()
            .detectedAt(now)
            .policyId(candidate.policyId())
            .policyName(candidate.policyName())
            .policyKind(candidate.policyKind())
            .cloneId(request.cloneId())
            .cloneName(request.cloneName())
            .violatedBy(actor.user())
            .details(candidate.details())
            .severity(candidate.severity())
            .auditId(auditId)
            .build();
    }

    /**
     * Evaluation context for a recording request.
     */
    public static EvaluationContext toContext(OperationRecordRequest request, ActorIdentity actor, long liveCount,
            Instant now) {
        return EvaluationContext.builder()
            .operation(request.operation())
            .cloneId(request.cloneId())
            .cloneName(request.cloneName())
            .cloneType(request.cloneType())
            .scope(request.scope())
            .sourceDatabase(request.sourceDatabase())
            .sourceSchema(request.sourceSchema())
            .dataClassification(request.dataClassification())
            .actor(actor)
            .liveCloneCount(liveCount)
            .now(now)
            .build();
    }
}
