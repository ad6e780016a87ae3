package com.platform.clonegovernance.compliance;

import com.platform.clonegovernance.violation.Violation;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one compliance scan.
 *
 * @param violations OPEN violations found by this scan, including ones that already existed
 * @param failedClones clones whose findings could not be stored
 */
public record ComplianceScanResult(
    ScanStatus status,
    String scope,
    long compliantCount,
    long nonCompliantCount,
    List<Violation> violations,
    int failedClones,
    List<String> skippedPolicies,
    Instant scannedAt,
    boolean cancelled
) {

    public ComplianceScanResult {
        violations = violations == null ? List.of() : List.copyOf(violations);
        skippedPolicies = skippedPolicies == null ? List.of() : List.copyOf(skippedPolicies);
    }

    public enum ScanStatus {
        COMPLETED,
        CANCELLED,
        SKIPPED
    }

    /**
     * Result for a request that arrived while another scan was running.
     */
    public static ComplianceScanResult skipped(String scope, Instant now) {
        return new ComplianceScanResult(ScanStatus.SKIPPED, scope, 0, 0, List.of(), 0, List.of(), now, false);
    }
}
