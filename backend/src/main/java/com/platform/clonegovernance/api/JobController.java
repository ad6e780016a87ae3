package com.platform.clonegovernance.api;

import com.platform.clonegovernance.compliance.ComplianceScanResult;
import com.platform.clonegovernance.compliance.ComplianceScanner;
import com.platform.clonegovernance.retention.PurgeResult;
import com.platform.clonegovernance.retention.RetentionPurger;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * On-demand runs of the compliance scan and the retention purge.
 */
@Slf4j
@RestController
@AllArgsConstructor
public class JobController {

    private final ComplianceScanner complianceScanner;
    private final RetentionPurger retentionPurger;

    @PostMapping("/api/compliance/scan")
    public ComplianceScanResult scan(@RequestParam(required = false) String scope) {
        log.info("Manual compliance scan requested for scope {}", scope);
        return complianceScanner.scanCompliance(scope == null || scope.isBlank() ? null : scope.trim());
    }

    /**
     * Dry run unless {@code dryRun=false} is passed.
     */
    @PostMapping("/api/retention/purge")
    public PurgeResult purge(
            @RequestParam(required = false) Integer retentionDays,
            @RequestParam(required = false) Boolean dryRun) {
        log.info("Manual retention purge requested: retentionDays={}, dryRun={}", retentionDays, dryRun);
        return retentionPurger.purge(retentionDays, dryRun);
    }
}
