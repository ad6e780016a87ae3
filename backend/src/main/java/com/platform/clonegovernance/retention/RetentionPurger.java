package com.platform.clonegovernance.retention;

import com.platform.clonegovernance.error.ValidationException;
import com.platform.clonegovernance.observability.MetricsRegistry;
import com.platform.clonegovernance.observability.StructuredLogger;
import com.platform.clonegovernance.persistence.repository.AccessLogJpaRepository;
import com.platform.clonegovernance.persistence.repository.AuditRecordJpaRepository;
import com.platform.clonegovernance.persistence.repository.PolicyViolationJpaRepository;
import com.platform.clonegovernance.violation.ViolationStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Deletes audit records, access records and RESOLVED violations older than the
 * retention window. OPEN violations are never purged.
 *
 * Deletion runs in batches, each in its own transaction. A cancelled purge keeps
 * every batch that was already committed.
 */
@Slf4j
@Service
public class RetentionPurger {

    public static final int DEFAULT_RETENTION_DAYS = 365;

    private final AuditRecordJpaRepository auditRepository;
    private final PolicyViolationJpaRepository violationRepository;
    private final AccessLogJpaRepository accessRepository;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    private final Clock clock;
    private final int batchSize;

    /** Cancellation flag of the run in progress, null while idle. */
    private final AtomicReference<AtomicBoolean> activeRun = new AtomicReference<>();

    public RetentionPurger(
            AuditRecordJpaRepository auditRepository,
            PolicyViolationJpaRepository violationRepository,
            AccessLogJpaRepository accessRepository,
            MetricsRegistry metricsRegistry,
            StructuredLogger structuredLogger,
            Clock clock,
            @Value("${clonegovernance.retention.batch-size:1000}") int batchSize) {
        this.auditRepository = auditRepository;
        this.violationRepository = violationRepository;
        this.accessRepository = accessRepository;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
        this.batchSize = batchSize > 0 ? batchSize : 1000;
    }

    /**
     * Purge records older than {@code retentionDays}. Null arguments mean 365 days and a dry run.
     *
     * @throws ValidationException if the retention period is not positive
     */
    public PurgeResult purge(Integer retentionDays, Boolean dryRun) {
        int days = retentionDays != null ? retentionDays : DEFAULT_RETENTION_DAYS;
        boolean preview = dryRun == null || dryRun;
        if (days <= 0) {
            throw new ValidationException("retentionDays", days, "must be a positive number of days");
        }

        AtomicBoolean cancelRequested = new AtomicBoolean(false);
        if (!activeRun.compareAndSet(null, cancelRequested)) {
            log.info("Retention purge already running, skipping request");
            return PurgeResult.skipped(days, preview);
        }
        try {
            return preview ? preview(days) : execute(days, cancelRequested);
        } finally {
            activeRun.set(null);
        }
    }

    /**
     * Ask a running purge to stop before its next batch.
     */
    public void cancel() {
        AtomicBoolean cancelRequested = activeRun.get();
        if (cancelRequested != null) {
            log.info("Cancellation requested for running retention purge");
            cancelRequested.set(true);
        }
    }

    public boolean isRunning() {
        return activeRun.get() != null;
    }

    private PurgeResult preview(int days) {
        long startNanos = System.nanoTime();
        Instant cutoff = cutoff(days);
        structuredLogger.jobs().purgeStarted(days, true);

        PurgeResult.PurgeCounts counts = new PurgeResult.PurgeCounts(
            auditRepository.countByTimestampBefore(cutoff),
            violationRepository.countByDetectedAtBeforeAndStatus(cutoff, ViolationStatus.RESOLVED),
            accessRepository.countByTimestampBefore(cutoff));

        finish(PurgeResult.PurgeMode.DRY_RUN, counts, false, startNanos);
        return new PurgeResult(PurgeResult.PurgeStatus.COMPLETED, PurgeResult.PurgeMode.DRY_RUN, days, cutoff,
            counts, false, "Dry run: " + counts.total() + " records would be deleted");
    }

    private PurgeResult execute(int days, AtomicBoolean cancelRequested) {
        long startNanos = System.nanoTime();
        Instant cutoff = cutoff(days);
        structuredLogger.jobs().purgeStarted(days, false);
        log.info("Purging governance records older than {} ({} days)", cutoff, days);

        long audit = deleteInBatches(cancelRequested,
            page -> auditRepository.findIdsBefore(cutoff, page), auditRepository::deleteAllByIdInBatch);
        long violations = deleteInBatches(cancelRequested,
            page -> violationRepository.findIdsDetectedBefore(cutoff, ViolationStatus.RESOLVED, page),
            violationRepository::deleteAllByIdInBatch);
        long access = deleteInBatches(cancelRequested,
            page -> accessRepository.findIdsBefore(cutoff, page), accessRepository::deleteAllByIdInBatch);

        boolean cancelled = cancelRequested.get();
        PurgeResult.PurgeCounts counts = new PurgeResult.PurgeCounts(audit, violations, access);
        finish(PurgeResult.PurgeMode.EXECUTED, counts, cancelled, startNanos);

        return new PurgeResult(
            cancelled ? PurgeResult.PurgeStatus.CANCELLED : PurgeResult.PurgeStatus.COMPLETED,
            PurgeResult.PurgeMode.EXECUTED, days, cutoff, counts, cancelled,
            (cancelled ? "Cancelled after deleting " : "Deleted ") + counts.total() + " records");
    }

    private long deleteInBatches(AtomicBoolean cancelRequested, Function<Pageable, List<String>> nextBatch,
            Consumer<List<String>> delete) {
        long deleted = 0;
        Pageable firstPage = PageRequest.of(0, batchSize);
        while (!cancelRequested.get()) {
            List<String> ids = nextBatch.apply(firstPage);
            if (ids.isEmpty()) {
                break;
            }
            delete.accept(ids);
            deleted += ids.size();
            if (ids.size() < batchSize) {
                break;
            }
        }
        return deleted;
    }

    private void finish(PurgeResult.PurgeMode mode, PurgeResult.PurgeCounts counts, boolean cancelled,
            long startNanos) {
        long durationMs = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
        Map<String, Long> byTable = new LinkedHashMap<>();
        byTable.put("audit_log", counts.auditLog());
        byTable.put("violations", counts.violations());
        byTable.put("access_log", counts.accessLog());

        metricsRegistry.recordDuration("clonegovernance.job.duration", "retention_purge",
            Duration.ofMillis(durationMs));
        if (mode == PurgeResult.PurgeMode.EXECUTED) {
            metricsRegistry.setGauge("clonegovernance.retention.last_purged", counts.total());
        }
        structuredLogger.jobs().purgeCompleted(mode.name(), byTable, cancelled, durationMs);
        log.info("Retention purge {}: auditLog={}, violations={}, accessLog={}, cancelled={}",
            mode, counts.auditLog(), counts.violations(), counts.accessLog(), cancelled);
    }

    private Instant cutoff(int days) {
        return clock.instant().minus(Duration.ofDays(days));
    }
}
