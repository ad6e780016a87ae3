package com.platform.clonegovernance.retention;

import java.time.Instant;

/**
 * Outcome of a retention purge. In DRY_RUN mode the counts are what would be removed.
 */
public record PurgeResult(
    PurgeStatus status,
    PurgeMode mode,
    int retentionDays,
    Instant cutoffTime,
    PurgeCounts counts,
    boolean cancelled,
    String message
) {

    public enum PurgeStatus {
        COMPLETED,
        CANCELLED,
        SKIPPED
    }

    public enum PurgeMode {
        DRY_RUN,
        EXECUTED
    }

    public record PurgeCounts(long auditLog, long violations, long accessLog) {

        public static final PurgeCounts NONE = new PurgeCounts(0, 0, 0);

        public long total() {
            return auditLog + violations + accessLog;
        }
    }

    static PurgeResult skipped(int retentionDays, boolean dryRun) {
        return new PurgeResult(PurgeStatus.SKIPPED, dryRun ? PurgeMode.DRY_RUN : PurgeMode.EXECUTED,
            retentionDays, null, PurgeCounts.NONE, false, "A purge is already running");
    }
}
