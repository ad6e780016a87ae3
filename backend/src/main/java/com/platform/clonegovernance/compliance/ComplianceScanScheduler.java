package com.platform.clonegovernance.compliance;

import com.platform.clonegovernance.observability.LoggingConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the compliance scan on a cron schedule.
 */
@Slf4j
@Component
public class ComplianceScanScheduler {

    private final ComplianceScanner complianceScanner;

    @Value("${clonegovernance.compliance.enabled:true}")
    private boolean enabled;

    public ComplianceScanScheduler(ComplianceScanner complianceScanner) {
        this.complianceScanner = complianceScanner;
    }

    @Scheduled(cron = "${clonegovernance.compliance.cron:0 0 2 * * *}")
    public void scheduledScan() {
        if (!enabled) {
            return;
        }
        LoggingConfig.setJobContext("compliance-scan");
        try {
            ComplianceScanResult result = complianceScanner.scanCompliance(null);
            log.info("Scheduled compliance scan: status={}, nonCompliant={}",
                result.status(), result.nonCompliantCount());
        } catch (RuntimeException e) {
            log.error("Scheduled compliance scan failed: {}", e.getMessage(), e);
        } finally {
            LoggingConfig.clearJobContext();
        }
    }
}
