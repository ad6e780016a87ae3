package com.platform.clonegovernance.audit;

import com.platform.clonegovernance.compliance.CloneRegistry;
import com.platform.clonegovernance.evaluation.ActorIdentity;
import com.platform.clonegovernance.evaluation.EvaluationContext;
import com.platform.clonegovernance.evaluation.PolicyEvaluator;
import com.platform.clonegovernance.evaluation.PolicyVerdict;
import com.platform.clonegovernance.evaluation.ViolationCandidate;
import com.platform.clonegovernance.observability.MetricsRegistry;
import com.platform.clonegovernance.observability.StructuredLogger;
import com.platform.clonegovernance.persistence.entity.AuditRecordEntity;
import com.platform.clonegovernance.policy.PolicyAction;
import com.platform.clonegovernance.policy.PolicyKind;
import com.platform.clonegovernance.policy.PolicySeverity;
import com.platform.clonegovernance.violation.Violation;
import com.platform.clonegovernance.violation.ViolationRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuditRecorderTest {

    private static final Instant NOW = Instant.parse("2024-06-18T10:00:00Z");

    @Mock
    private PolicyEvaluator policyEvaluator;

    @Mock
    private CloneRegistry cloneRegistry;

    @Mock
    private AuditLogRepository auditLogRepository;

    @Mock
    private AccessLogRepository accessLogRepository;

    @Mock
    private ViolationRepository violationRepository;

    private SimpleMeterRegistry meterRegistry;
    private AuditRecorder recorder;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        recorder = new AuditRecorder(policyEvaluator, cloneRegistry, auditLogRepository, accessLogRepository,
            violationRepository, TransactionOperations.withoutTransaction(), new MetricsRegistry(meterRegistry),
            new StructuredLogger(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void successfulCreateIsEvaluatedAndViolationsAreLinkedToTheAuditRecord() {
        when(cloneRegistry.countLiveClones("alice")).thenReturn(10L);
        when(policyEvaluator.evaluate(any(EvaluationContext.class))).thenReturn(quotaVerdict());

        RecordingResult result = recorder.recordOperation(createRequest().build());

        ArgumentCaptor<EvaluationContext> context = ArgumentCaptor.forClass(EvaluationContext.class);
        verify(policyEvaluator).evaluate(context.capture());
        assertThat(context.getValue().liveCloneCount()).isEqualTo(10L);
        assertThat(context.getValue().now()).isEqualTo(NOW);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Violation>> violations = ArgumentCaptor.forClass(List.class);
        verify(violationRepository).saveAll(violations.capture());
        ArgumentCaptor<AuditRecord> record = ArgumentCaptor.forClass(AuditRecord.class);
        verify(auditLogRepository).append(record.capture());

        Violation violation = violations.getValue().get(0);
        assertThat(violation.getAuditId()).isEqualTo(record.getValue().getId());
        assertThat(violation.getViolatedBy()).isEqualTo("alice");
        assertThat(violation.getDetectedAt()).isEqualTo(NOW);
        assertThat(record.getValue().getViolationIds()).containsExactly(violation.getId());
        assertThat(record.getValue().getPerformedBy()).isEqualTo("alice");
        assertThat(record.getValue().getTimestamp()).isEqualTo(NOW);

        assertThat(result.recorded()).isTrue();
        assertThat(result.recordId()).isEqualTo(record.getValue().getId());
        assertThat(result.violationIds()).containsExactly(violation.getId());
        assertThat(result.blocked()).isTrue();
    }

    @Test
    void liveCountFromRequestIsUsedInsteadOfRegistry() {
        when(policyEvaluator.evaluate(any(EvaluationContext.class))).thenReturn(PolicyVerdict.empty());

        recorder.recordOperation(createRequest().liveCloneCount(3L).build());

        ArgumentCaptor<EvaluationContext> context = ArgumentCaptor.forClass(EvaluationContext.class);
        verify(policyEvaluator).evaluate(context.capture());
        assertThat(context.getValue().liveCloneCount()).isEqualTo(3L);
        verify(cloneRegistry, never()).countLiveClones(any());
    }

    @Test
    void nonCreateOperationsAreNotEvaluated() {
        RecordingResult result = recorder.recordOperation(createRequest()
            .operation(AuditOperation.DELETE)
            .build());

        verify(policyEvaluator, never()).evaluate(any(EvaluationContext.class));
        assertThat(result.recorded()).isTrue();
        assertThat(result.violationIds()).isEmpty();
    }

    @Test
    void failedCreateIsNotEvaluated() {
        RecordingResult result = recorder.recordOperation(createRequest()
            .status(OperationStatus.FAILURE)
            .errorMessage("disk full")
            .build());

        verify(policyEvaluator, never()).evaluate(any(EvaluationContext.class));
        ArgumentCaptor<AuditRecord> record = ArgumentCaptor.forClass(AuditRecord.class);
        verify(auditLogRepository).append(record.capture());
        assertThat(record.getValue().getStatus()).isEqualTo(OperationStatus.FAILURE);
        assertThat(record.getValue().getErrorMessage()).isEqualTo("disk full");
        assertThat(result.recorded()).isTrue();
    }

    @Test
    void precomputedVerdictIsStoredWithoutEvaluating() {
        RecordingResult result = recorder.recordOperation(createRequest()
            .status(OperationStatus.BLOCKED)
            .verdict(quotaVerdict())
            .build());

        verify(policyEvaluator, never()).evaluate(any(EvaluationContext.class));
        verify(violationRepository).saveAll(anyList());
        assertThat(result.violationIds()).hasSize(1);
    }

    @Test
    void storageFailureIsReturnedNotThrown() {
        when(policyEvaluator.evaluate(any(EvaluationContext.class))).thenReturn(quotaVerdict());
        when(cloneRegistry.countLiveClones("alice")).thenReturn(10L);
        doThrow(new DataAccessResourceFailureException("connection refused"))
            .when(auditLogRepository).append(any(AuditRecord.class));

        RecordingResult result = recorder.recordOperation(createRequest().build());

        assertThat(result.recorded()).isFalse();
        assertThat(result.recordId()).isNull();
        assertThat(result.failureReason()).contains("connection refused");
        assertThat(result.blocked()).isTrue();
        assertThat(meterRegistry.find(MetricsRegistry.RECORDING_FAILURES).counter().count()).isEqualTo(1.0);
    }

    @Test
    void evaluationFailureStillWritesTheAuditRecord() {
        when(cloneRegistry.countLiveClones("alice")).thenThrow(new DataAccessResourceFailureException("timeout"));

        RecordingResult result = recorder.recordOperation(createRequest().build());

        verify(auditLogRepository).append(any(AuditRecord.class));
        assertThat(result.recorded()).isTrue();
        assertThat(result.verdict()).isEqualTo(PolicyVerdict.empty());
    }

    @Test
    void oversizedErrorMessageIsCutToTheStoredWidth() {
        RecordingResult result = recorder.recordOperation(createRequest()
            .status(OperationStatus.FAILURE)
            .errorMessage("e".repeat(5000))
            .build());

        ArgumentCaptor<AuditRecord> record = ArgumentCaptor.forClass(AuditRecord.class);
        verify(auditLogRepository).append(record.capture());
        assertThat(record.getValue().getErrorMessage())
            .hasSize(AuditRecordEntity.ERROR_MESSAGE_LENGTH)
            .endsWith("...");
        assertThat(result.recorded()).isTrue();
    }

    @Test
    void reportingFailureAfterCommitDoesNotUndoTheRecord() {
        StructuredLogger brokenLogger = mock(StructuredLogger.class);
        when(brokenLogger.audit()).thenThrow(new IllegalStateException("log appender closed"));
        AuditRecorder reportingFails = new AuditRecorder(policyEvaluator, cloneRegistry, auditLogRepository,
            accessLogRepository, violationRepository, TransactionOperations.withoutTransaction(),
            new MetricsRegistry(meterRegistry), brokenLogger, Clock.fixed(NOW, ZoneOffset.UTC));

        RecordingResult operation = reportingFails.recordOperation(createRequest()
            .operation(AuditOperation.DELETE)
            .build());
        RecordingResult access = reportingFails.recordAccess(AccessRecordRequest.builder()
            .cloneName("orders_clone")
            .actor(ActorIdentity.of("bob"))
            .accessType("QUERY")
            .build());

        verify(auditLogRepository).append(any(AuditRecord.class));
        assertThat(operation.recorded()).isTrue();
        assertThat(operation.recordId()).isNotNull();
        assertThat(access.recorded()).isTrue();
        assertThat(meterRegistry.find(MetricsRegistry.RECORDING_FAILURES).counter()).isNull();
    }

    @Test
    void accessIsRecordedWithoutEvaluation() {
        RecordingResult result = recorder.recordAccess(AccessRecordRequest.builder()
            .cloneId("clone-1")
            .cloneName("orders_clone")
            .actor(new ActorIdentity("bob", null, "s-9", null))
            .accessType("QUERY")
            .rowsAccessed(42L)
            .build());

        ArgumentCaptor<AccessRecord> record = ArgumentCaptor.forClass(AccessRecord.class);
        verify(accessLogRepository).append(record.capture());
        assertThat(record.getValue().getAccessedBy()).isEqualTo("bob");
        assertThat(record.getValue().getSessionId()).isEqualTo("s-9");
        assertThat(record.getValue().getTimestamp()).isEqualTo(NOW);
        assertThat(result.recorded()).isTrue();
        verify(policyEvaluator, never()).evaluate(any(EvaluationContext.class));
    }

    @Test
    void accessStorageFailureIsReturnedNotThrown() {
        doThrow(new DataAccessResourceFailureException("read-only"))
            .when(accessLogRepository).append(any(AccessRecord.class));

        RecordingResult result = recorder.recordAccess(AccessRecordRequest.builder()
            .cloneName("orders_clone")
            .actor(ActorIdentity.of("bob"))
            .accessType("QUERY")
            .build());

        assertThat(result.recorded()).isFalse();
        assertThat(meterRegistry.find(MetricsRegistry.RECORDING_FAILURES).counter().count()).isEqualTo(1.0);
    }

    private static OperationRecordRequest.OperationRecordRequestBuilder createRequest() {
        return OperationRecordRequest.builder()
            .operation(AuditOperation.CREATE)
            .status(OperationStatus.SUCCESS)
            .cloneId("clone-1")
            .cloneName("orders_clone")
            .cloneType("FULL")
            .scope("DEV")
            .actor(new ActorIdentity("alice", "developer", "s-1", "10.0.0.1"))
            .metadata(Map.of("ticket", "OPS-1"));
    }

    private static PolicyVerdict quotaVerdict() {
        ViolationCandidate candidate = new ViolationCandidate("policy-1", "MAX_TOTAL_USER_CLONES_10",
            PolicyKind.USER_QUOTA, PolicySeverity.ERROR, PolicyAction.BLOCK, true, "Total clone limit exceeded",
            Map.of("message", "Total clone limit exceeded", "action", "BLOCK"));
        return new PolicyVerdict(List.of(candidate), true, List.of());
    }
}
