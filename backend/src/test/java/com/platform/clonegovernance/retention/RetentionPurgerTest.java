package com.platform.clonegovernance.retention;

import com.platform.clonegovernance.audit.AuditOperation;
import com.platform.clonegovernance.audit.OperationStatus;
import com.platform.clonegovernance.error.ValidationException;
import com.platform.clonegovernance.observability.MetricsRegistry;
import com.platform.clonegovernance.observability.StructuredLogger;
import com.platform.clonegovernance.persistence.entity.AccessLogEntity;
import com.platform.clonegovernance.persistence.entity.AuditRecordEntity;
import com.platform.clonegovernance.persistence.entity.PolicyViolationEntity;
import com.platform.clonegovernance.persistence.repository.AccessLogJpaRepository;
import com.platform.clonegovernance.persistence.repository.AuditRecordJpaRepository;
import com.platform.clonegovernance.persistence.repository.PolicyViolationJpaRepository;
import com.platform.clonegovernance.policy.PolicySeverity;
import com.platform.clonegovernance.violation.ViolationStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.AdditionalAnswers.delegatesTo;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;

@DataJpaTest
@ActiveProfiles("test")
class RetentionPurgerTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");
    private static final Instant OLD = Instant.parse("2024-06-01T00:00:00Z");
    private static final Instant RECENT = Instant.parse("2024-12-31T00:00:00Z");

    @Autowired
    private AuditRecordJpaRepository auditRepository;

    @Autowired
    private PolicyViolationJpaRepository violationRepository;

    @Autowired
    private AccessLogJpaRepository accessRepository;

    private RetentionPurger purger;

    private String openViolationId;

    @BeforeEach
    void setUp() {
        purger = new RetentionPurger(auditRepository, violationRepository, accessRepository,
            new MetricsRegistry(new SimpleMeterRegistry()), new StructuredLogger(),
            Clock.fixed(NOW, ZoneOffset.UTC), 2);

        auditRepository.save(audit(OLD));
        auditRepository.save(audit(RECENT));
        violationRepository.save(violation(OLD, ViolationStatus.RESOLVED));
        openViolationId = violationRepository.save(violation(OLD, ViolationStatus.OPEN)).getId();
        violationRepository.save(violation(RECENT, ViolationStatus.RESOLVED));
        accessRepository.save(access(OLD));
        accessRepository.save(access(RECENT));
        auditRepository.flush();
        violationRepository.flush();
        accessRepository.flush();
    }

    @Test
    void dryRunCountsWithoutDeleting() {
        PurgeResult result = purger.purge(30, true);

        assertThat(result.status()).isEqualTo(PurgeResult.PurgeStatus.COMPLETED);
        assertThat(result.mode()).isEqualTo(PurgeResult.PurgeMode.DRY_RUN);
        assertThat(result.cutoffTime()).isEqualTo(Instant.parse("2024-12-02T00:00:00Z"));
        assertThat(result.counts()).isEqualTo(new PurgeResult.PurgeCounts(1, 1, 1));
        assertThat(result.message()).isEqualTo("Dry run: 3 records would be deleted");
        assertThat(auditRepository.count()).isEqualTo(2);
        assertThat(violationRepository.count()).isEqualTo(3);
        assertThat(accessRepository.count()).isEqualTo(2);
    }

    @Test
    void executedPurgeDeletesOldRecordsButKeepsOpenViolations() {
        PurgeResult result = purger.purge(30, false);

        assertThat(result.mode()).isEqualTo(PurgeResult.PurgeMode.EXECUTED);
        assertThat(result.counts()).isEqualTo(new PurgeResult.PurgeCounts(1, 1, 1));
        assertThat(result.message()).isEqualTo("Deleted 3 records");
        assertThat(auditRepository.count()).isEqualTo(1);
        assertThat(accessRepository.count()).isEqualTo(1);
        assertThat(violationRepository.count()).isEqualTo(2);
        assertThat(violationRepository.existsById(openViolationId)).isTrue();
    }

    @Test
    void repeatedPurgeDeletesNothingMore() {
        purger.purge(30, false);

        PurgeResult second = purger.purge(30, false);

        assertThat(second.counts().total()).isZero();
        assertThat(purger.isRunning()).isFalse();
    }

    @Test
    void deletesInBatchesUntilNothingIsLeft() {
        for (int i = 0; i < 4; i++) {
            auditRepository.save(audit(OLD.minusSeconds(i)));
        }
        auditRepository.flush();

        PurgeResult result = purger.purge(30, false);

        assertThat(result.counts().auditLog()).isEqualTo(5);
        assertThat(auditRepository.countByTimestampBefore(result.cutoffTime())).isZero();
        assertThat(auditRepository.count()).isEqualTo(1);
    }

    @Test
    void cancellationKeepsCommittedBatchesAndStopsBeforeTheNext() {
        for (int i = 0; i < 4; i++) {
            auditRepository.save(audit(OLD.minusSeconds(i)));
        }
        auditRepository.flush();
        AuditRecordJpaRepository cancellingAudit = mock(AuditRecordJpaRepository.class, delegatesTo(auditRepository));
        doAnswer(inv -> {
            auditRepository.deleteAllByIdInBatch(inv.getArgument(0));
            purger.cancel();
            return null;
        }).when(cancellingAudit).deleteAllByIdInBatch(any());
        purger = new RetentionPurger(cancellingAudit, violationRepository, accessRepository,
            new MetricsRegistry(new SimpleMeterRegistry()), new StructuredLogger(),
            Clock.fixed(NOW, ZoneOffset.UTC), 2);

        PurgeResult result = purger.purge(30, false);

        assertThat(result.status()).isEqualTo(PurgeResult.PurgeStatus.CANCELLED);
        assertThat(result.cancelled()).isTrue();
        assertThat(result.counts()).isEqualTo(new PurgeResult.PurgeCounts(2, 0, 0));
        assertThat(result.message()).isEqualTo("Cancelled after deleting 2 records");
        assertThat(auditRepository.countByTimestampBefore(result.cutoffTime())).isEqualTo(3);
        assertThat(violationRepository.countByDetectedAtBeforeAndStatus(result.cutoffTime(),
            ViolationStatus.RESOLVED)).isEqualTo(1);
        assertThat(accessRepository.countByTimestampBefore(result.cutoffTime())).isEqualTo(1);
        assertThat(purger.isRunning()).isFalse();
    }

    @Test
    void cancelWhileIdleDoesNotAffectTheNextPurge() {
        purger.cancel();

        PurgeResult result = purger.purge(30, false);

        assertThat(result.status()).isEqualTo(PurgeResult.PurgeStatus.COMPLETED);
        assertThat(result.counts().total()).isEqualTo(3);
    }

    @Test
    void defaultsToDryRunOverOneYear() {
        PurgeResult result = purger.purge(null, null);

        assertThat(result.mode()).isEqualTo(PurgeResult.PurgeMode.DRY_RUN);
        assertThat(result.retentionDays()).isEqualTo(RetentionPurger.DEFAULT_RETENTION_DAYS);
        assertThat(result.counts().total()).isZero();
    }

    @Test
    void rejectsNonPositiveRetention() {
        assertThatThrownBy(() -> purger.purge(0, false))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> purger.purge(-5, true))
            .isInstanceOf(ValidationException.class);
        assertThat(auditRepository.count()).isEqualTo(2);
    }

    private static AuditRecordEntity audit(Instant at) {
        return AuditRecordEntity.builder()
            .id(UUID.randomUUID().toString())
            .timestamp(at)
            .operation(AuditOperation.CREATE)
            .cloneName("orders_clone")
            .performedBy("alice")
            .status(OperationStatus.SUCCESS)
            .build();
    }

    private static PolicyViolationEntity violation(Instant at, ViolationStatus status) {
        return PolicyViolationEntity.builder()
            .id(UUID.randomUUID().toString())
            .detectedAt(at)
            .policyId(UUID.randomUUID().toString())
            .policyName("ANY_MAX_CLONE_AGE_30_DAYS")
            .cloneId("c1")
            .severity(PolicySeverity.WARNING)
            .status(status)
            .build();
    }

    private static AccessLogEntity access(Instant at) {
        return AccessLogEntity.builder()
            .id(UUID.randomUUID().toString())
            .timestamp(at)
            .cloneName("orders_clone")
            .accessedBy("bob")
            .accessType("QUERY")
            .build();
    }
}
