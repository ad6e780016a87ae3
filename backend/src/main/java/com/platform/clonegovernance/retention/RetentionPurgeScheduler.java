package com.platform.clonegovernance.retention;

import com.platform.clonegovernance.observability.LoggingConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic retention purge. Disabled by default, and a dry run unless configured otherwise.
 */
@Slf4j
@Component
public class RetentionPurgeScheduler {

    private final RetentionPurger retentionPurger;

    @Value("${clonegovernance.retention.enabled:false}")
    private boolean enabled;

    @Value("${clonegovernance.retention.days:365}")
    private int retentionDays;

    @Value("${clonegovernance.retention.dry-run:true}")
    private boolean dryRun;

    public RetentionPurgeScheduler(RetentionPurger retentionPurger) {
        this.retentionPurger = retentionPurger;
    }

    @Scheduled(cron = "${clonegovernance.retention.cron:0 30 3 * * SUN}")
    public void scheduledPurge() {
        if (!enabled) {
            return;
        }
        LoggingConfig.setJobContext("retention-purge");
        try {
            PurgeResult result = retentionPurger.purge(retentionDays, dryRun);
            log.info("Scheduled retention purge: status={}, mode={}, total={}",
                result.status(), result.mode(), result.counts().total());
        } catch (RuntimeException e) {
            log.error("Scheduled retention purge failed: {}", e.getMessage(), e);
        } finally {
            LoggingConfig.clearJobContext();
        }
    }
}
