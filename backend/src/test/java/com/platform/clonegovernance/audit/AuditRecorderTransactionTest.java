package com.platform.clonegovernance.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.platform.clonegovernance.compliance.CloneRegistry;
import com.platform.clonegovernance.evaluation.ActorIdentity;
import com.platform.clonegovernance.evaluation.EvaluationContext;
import com.platform.clonegovernance.evaluation.PolicyEvaluator;
import com.platform.clonegovernance.evaluation.PolicyVerdict;
import com.platform.clonegovernance.evaluation.ViolationCandidate;
import com.platform.clonegovernance.observability.MetricsRegistry;
import com.platform.clonegovernance.observability.StructuredLogger;
import com.platform.clonegovernance.persistence.EntityMappers;
import com.platform.clonegovernance.persistence.entity.AuditRecordEntity;
import com.platform.clonegovernance.persistence.repository.AuditRecordJpaRepository;
import com.platform.clonegovernance.persistence.repository.PolicyViolationJpaRepository;
import com.platform.clonegovernance.policy.PolicyAction;
import com.platform.clonegovernance.policy.PolicyDefinitionCodec;
import com.platform.clonegovernance.policy.PolicyKind;
import com.platform.clonegovernance.policy.PolicySeverity;
import com.platform.clonegovernance.violation.Violation;
import com.platform.clonegovernance.violation.ViolationRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

/**
 * Violations and their audit record commit together or not at all.
 */
@DataJpaTest
@ActiveProfiles("test")
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({
    AuditRecorder.class,
    AuditLogRepository.class,
    AccessLogRepository.class,
    ViolationRepository.class,
    EntityMappers.class,
    PolicyDefinitionCodec.class,
    MetricsRegistry.class,
    StructuredLogger.class,
    AuditRecorderTransactionTest.TestBeans.class
})
class AuditRecorderTransactionTest {

    private static final Instant NOW = Instant.parse("2024-06-18T10:00:00Z");

    @TestConfiguration
    static class TestBeans {

        @Bean
        ObjectMapper objectMapper() {
            return JsonMapper.builder().findAndAddModules().build();
        }

        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }

        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    private AuditRecorder auditRecorder;

    @Autowired
    private ViolationRepository violationRepository;

    @Autowired
    private AuditRecordJpaRepository auditRecordJpaRepository;

    @Autowired
    private PolicyViolationJpaRepository violationJpaRepository;

    @SpyBean
    private AuditLogRepository auditLogRepository;

    @MockBean
    private PolicyEvaluator policyEvaluator;

    @MockBean
    private CloneRegistry cloneRegistry;

    @AfterEach
    void cleanUp() {
        violationJpaRepository.deleteAll();
        auditRecordJpaRepository.deleteAll();
    }

    @Test
    void violationsAndAuditRecordAreCommittedTogether() {
        when(policyEvaluator.evaluate(any(EvaluationContext.class))).thenReturn(quotaVerdict());

        RecordingResult result = auditRecorder.recordOperation(createRequest());

        assertThat(result.recorded()).isTrue();
        assertThat(auditRecordJpaRepository.findById(result.recordId())).isPresent();
        List<Violation> stored = violationRepository.findByAuditId(result.recordId());
        assertThat(stored).singleElement().satisfies(v -> {
            assertThat(v.getPolicyName()).isEqualTo("MAX_TOTAL_USER_CLONES_10");
            assertThat(v.getDetails()).containsEntry("action", "BLOCK");
            assertThat(v.isOpen()).isTrue();
        });
    }

    @Test
    void failedAuditWriteLeavesNoViolationsBehind() {
        when(policyEvaluator.evaluate(any(EvaluationContext.class))).thenReturn(quotaVerdict());
        doThrow(new DataAccessResourceFailureException("audit table unavailable"))
            .when(auditLogRepository).append(any(AuditRecord.class));

        RecordingResult result = auditRecorder.recordOperation(createRequest());

        assertThat(result.recorded()).isFalse();
        assertThat(violationJpaRepository.count()).isZero();
        assertThat(auditRecordJpaRepository.count()).isZero();
    }

    @Test
    void largeMetadataAndErrorTextAreStoredInFull() {
        String note = "x".repeat(5000);

        RecordingResult result = auditRecorder.recordOperation(OperationRecordRequest.builder()
            .operation(AuditOperation.DELETE)
            .status(OperationStatus.FAILURE)
            .cloneId("clone-1")
            .cloneName("orders_clone")
            .actor(ActorIdentity.of("alice"))
            .errorMessage("drop failed: " + "y".repeat(3000))
            .metadata(Map.of("note", note))
            .build());

        assertThat(result.recorded()).isTrue();
        assertThat(auditRecordJpaRepository.findById(result.recordId())).hasValueSatisfying(row -> {
            assertThat(row.getMetadataJson()).contains(note);
            assertThat(row.getErrorMessage()).hasSize(AuditRecordEntity.ERROR_MESSAGE_LENGTH);
        });
    }

    private static OperationRecordRequest createRequest() {
        return OperationRecordRequest.builder()
            .operation(AuditOperation.CREATE)
            .status(OperationStatus.SUCCESS)
            .cloneId("clone-1")
            .cloneName("orders_clone")
            .cloneType("FULL")
            .scope("DEV")
            .actor(ActorIdentity.of("alice"))
            .liveCloneCount(10L)
            .build();
    }

    private static PolicyVerdict quotaVerdict() {
        ViolationCandidate candidate = new ViolationCandidate("policy-1", "MAX_TOTAL_USER_CLONES_10",
            PolicyKind.USER_QUOTA, PolicySeverity.ERROR, PolicyAction.BLOCK, true, "Total clone limit exceeded",
            Map.of("message", "Total clone limit exceeded", "action", "BLOCK"));
        return new PolicyVerdict(List.of(candidate), true, List.of());
    }
}
