package com.platform.clonegovernance.compliance;

import com.platform.clonegovernance.evaluation.ViolationCandidate;
import com.platform.clonegovernance.observability.MetricsRegistry;
import com.platform.clonegovernance.observability.StructuredLogger;
import com.platform.clonegovernance.policy.ActivePolicySet;
import com.platform.clonegovernance.policy.Policy;
import com.platform.clonegovernance.policy.PolicyDefinition;
import com.platform.clonegovernance.policy.PolicyKind;
import com.platform.clonegovernance.policy.PolicyRepository;
import com.platform.clonegovernance.violation.Violation;
import com.platform.clonegovernance.violation.ViolationRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Retrospective sweep of live clones against MAX_AGE policies.
 *
 * At most one scan runs at a time; a concurrent request gets a SKIPPED result.
 * Cancellation is checked between batches, so violations stored before the
 * cancellation stay committed.
 */
@Slf4j
@Service
public class ComplianceScanner {

    private final PolicyRepository policyRepository;
    private final CloneRegistry cloneRegistry;
    private final ViolationRepository violationRepository;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    private final Clock clock;
    private final int batchSize;

    /** Cancellation flag of the run in progress, null while idle. */
    private final AtomicReference<AtomicBoolean> activeRun = new AtomicReference<>();

    public ComplianceScanner(
            PolicyRepository policyRepository,
            CloneRegistry cloneRegistry,
            ViolationRepository violationRepository,
            MetricsRegistry metricsRegistry,
            StructuredLogger structuredLogger,
            Clock clock,
            @Value("${clonegovernance.compliance.batch-size:500}") int batchSize) {
        this.policyRepository = policyRepository;
        this.cloneRegistry = cloneRegistry;
        this.violationRepository = violationRepository;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
        this.batchSize = batchSize > 0 ? batchSize : 500;
    }

    /**
     * Scan live clones, optionally limited to one scope.
     */
    public ComplianceScanResult scanCompliance(String scope) {
        Instant now = clock.instant();
        AtomicBoolean cancelRequested = new AtomicBoolean(false);
        if (!activeRun.compareAndSet(null, cancelRequested)) {
            log.info("Compliance scan already running, skipping request for scope {}", scope);
            return ComplianceScanResult.skipped(scope, now);
        }
        try {
            return scan(scope, now, cancelRequested);
        } finally {
            activeRun.set(null);
        }
    }

    /**
     * Ask a running scan to stop after its current batch.
     */
    public void cancel() {
        AtomicBoolean cancelRequested = activeRun.get();
        if (cancelRequested != null) {
            log.info("Cancellation requested for running compliance scan");
            cancelRequested.set(true);
        }
    }

    public boolean isRunning() {
        return activeRun.get() != null;
    }

    private ComplianceScanResult scan(String scope, Instant now, AtomicBoolean cancelRequested) {
        long startNanos = System.nanoTime();
        structuredLogger.jobs().scanStarted(scope);

        ActivePolicySet agePolicies = policyRepository.findActiveByKind(PolicyKind.MAX_AGE);
        List<Policy> policies = agePolicies.policies().stream()
            .filter(p -> scope == null || p.appliesTo(scope))
            .toList();

        long compliant = 0;
        long nonCompliant = 0;
        int failed = 0;
        boolean cancelled = false;
        List<Violation> violations = new ArrayList<>();

        int page = 0;
        while (true) {
            if (cancelRequested.get()) {
                cancelled = true;
                break;
            }
            List<LiveClone> batch = cloneRegistry.findLiveClones(scope, page, batchSize);
            for (LiveClone clone : batch) {
                try {
                    List<Violation> found = checkClone(clone, policies, now);
                    if (found.isEmpty()) {
                        compliant++;
                    } else {
                        nonCompliant++;
                        violations.addAll(found);
                    }
                } catch (RuntimeException e) {
                    failed++;
                    log.error("Compliance check failed for clone {}: {}", clone.cloneName(), e.getMessage(), e);
                }
            }
            if (batch.size() < batchSize) {
                break;
            }
            page++;
        }

        long durationMs = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
        metricsRegistry.recordDuration("clonegovernance.job.duration", "compliance_scan", Duration.ofMillis(durationMs));
        metricsRegistry.setGauge("clonegovernance.compliance.non_compliant", nonCompliant);
        structuredLogger.jobs().scanCompleted(scope, compliant, nonCompliant, cancelled, durationMs);
        log.info("Compliance scan finished: scope={}, compliant={}, nonCompliant={}, failed={}, cancelled={}",
            scope, compliant, nonCompliant, failed, cancelled);

        return new ComplianceScanResult(
            cancelled ? ComplianceScanResult.ScanStatus.CANCELLED : ComplianceScanResult.ScanStatus.COMPLETED,
            scope, compliant, nonCompliant, violations, failed, agePolicies.skippedPolicies(), now, cancelled);
    }

    private List<Violation> checkClone(LiveClone clone, List<Policy> policies, Instant now) {
        long ageDays = clone.ageInDays(now);
        List<Violation> found = new ArrayList<>();

        for (Policy policy : policies) {
            if (!policy.appliesTo(clone.scope())
                    || !(policy.getDefinition() instanceof PolicyDefinition.MaxAge maxAge)) {
                continue;
            }
            Optional<PolicyDefinition.Finding> finding = maxAge.checkAge(ageDays);
            if (finding.isEmpty()) {
                continue;
            }

            Optional<Violation> open = violationRepository.findOpen(policy.getId(), clone.cloneId());
            if (open.isPresent()) {
                found.add(open.get());
                continue;
            }

            ViolationCandidate candidate = ViolationCandidate.of(policy, finding.get());
            Violation violation = violationRepository.save(Violation.builder()
                .detectedAt(now)
                .policyId(policy.getId())
                .policyName(policy.getName())
                .policyKind(policy.getKind())
                .cloneId(clone.cloneId())
                .cloneName(clone.cloneName())
                .violatedBy(clone.owner())
                .details(candidate.details())
                .severity(policy.getSeverity())
                .build());
            metricsRegistry.incrementCounter(MetricsRegistry.VIOLATIONS_DETECTED, "source", "compliance_scan");
            found.add(violation);
        }
        return found;
    }
}
