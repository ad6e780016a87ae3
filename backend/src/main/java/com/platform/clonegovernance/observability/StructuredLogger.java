package com.platform.clonegovernance.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured logger for governance events.
 *
 * Usage: {@code structuredLogger.policy().created(...)}.
 * Every event is one JSON line on a {@code structured.*} logger.
 */
@Component
public class StructuredLogger {

    @Value("${spring.application.name:clone-governance}")
    private String serviceName = "clone-governance";

    @Value("${clonegovernance.environment:development}")
    private String environment = "development";

    public PolicyLogger policy() {
        return new PolicyLogger(serviceName, environment);
    }

    public AuditLogger audit() {
        return new AuditLogger(serviceName, environment);
    }

    public JobLogger jobs() {
        return new JobLogger(serviceName, environment);
    }

    // ==================== POLICY LOGGER ====================

    public static class PolicyLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.policy");
        private final String service;
        private final String environment;

        PolicyLogger(String service, String environment) {
            this.service = service;
            this.environment = environment;
        }

        public void created(String policyId, String policyName, String kind, String actor) {
            log.info(event(LogEventType.POLICY_CREATED, policyId, policyName, actor)
                .details(Map.of("kind", kind))
                .build().toJson());
        }

        public void updated(String policyId, String policyName, String actor) {
            log.info(event(LogEventType.POLICY_UPDATED, policyId, policyName, actor).build().toJson());
        }

        public void statusChanged(String policyId, String policyName, boolean active, String actor) {
            log.info(event(LogEventType.POLICY_STATUS_CHANGED, policyId, policyName, actor)
                .details(Map.of("active", active))
                .build().toJson());
        }

        public void deleted(String policyId, String policyName, String actor) {
            log.info(event(LogEventType.POLICY_DELETED, policyId, policyName, actor).build().toJson());
        }

        /**
         * A policy left out of an evaluation because its definition could not be checked.
         */
        public void skipped(String policyId, String policyName, String reason) {
            log.warn(event(LogEventType.POLICY_SKIPPED, policyId, policyName, "system")
                .errorCode("CG-510")
                .error(reason)
                .build().toJson());
        }

        private StructuredLogEvent.StructuredLogEventBuilder event(LogEventType type, String policyId,
                String policyName, String actor) {
            return StructuredLogEvent.of(service, environment, type, actor)
                .policyId(policyId)
                .policyName(policyName);
        }
    }

    // ==================== AUDIT LOGGER ====================

    public static class AuditLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.audit");
        private final String service;
        private final String environment;

        AuditLogger(String service, String environment) {
            this.service = service;
            this.environment = environment;
        }

        public void operationRecorded(String auditId, String operation, String cloneName, String scope,
                String actor, int violationCount, boolean blocked) {
            String json = StructuredLogEvent.of(service, environment,
                    blocked ? LogEventType.OPERATION_BLOCKED : LogEventType.OPERATION_RECORDED, actor)
                .auditId(auditId)
                .operation(operation)
                .cloneName(cloneName)
                .scope(scope)
                .outcome(blocked ? "BLOCKED" : "SUCCESS")
                .details(Map.of("violations", violationCount))
                .build().toJson();
            if (blocked) {
                log.warn(json);
            } else {
                log.info(json);
            }
        }

        public void recordingFailed(String operation, String cloneName, String actor, String errorMessage) {
            log.error(StructuredLogEvent.of(service, environment, LogEventType.RECORDING_FAILED, actor)
                .operation(operation)
                .cloneName(cloneName)
                .outcome("FAILED")
                .errorCode("CG-520")
                .error(errorMessage)
                .build().toJson());
        }

        public void accessRecorded(String accessId, String cloneName, String accessType, String actor) {
            log.info(StructuredLogEvent.of(service, environment, LogEventType.ACCESS_RECORDED, actor)
                .auditId(accessId)
                .cloneName(cloneName)
                .operation(accessType)
                .build().toJson());
        }

        public void violationResolved(String violationId, String policyName, String actor) {
            log.info(StructuredLogEvent.of(service, environment, LogEventType.VIOLATION_RESOLVED, actor)
                .violationId(violationId)
                .policyName(policyName)
                .build().toJson());
        }
    }

    // ==================== JOB LOGGER ====================

    public static class JobLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.jobs");
        private final String service;
        private final String environment;

        JobLogger(String service, String environment) {
            this.service = service;
            this.environment = environment;
        }

        public void scanStarted(String scope) {
            log.info(StructuredLogEvent.of(service, environment, LogEventType.COMPLIANCE_SCAN_STARTED, "system")
                .scope(scope)
                .build().toJson());
        }

        public void scanCompleted(String scope, long compliant, long nonCompliant, boolean cancelled,
                long durationMs) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("compliant", compliant);
            details.put("non_compliant", nonCompliant);
            log.info(StructuredLogEvent.of(service, environment, LogEventType.COMPLIANCE_SCAN_COMPLETED, "system")
                .scope(scope)
                .outcome(cancelled ? "CANCELLED" : "SUCCESS")
                .durationMs(durationMs)
                .details(details)
                .build().toJson());
        }

        public void purgeStarted(int retentionDays, boolean dryRun) {
            log.info(StructuredLogEvent.of(service, environment, LogEventType.PURGE_STARTED, "system")
                .details(Map.of("retention_days", retentionDays, "dry_run", dryRun))
                .build().toJson());
        }

        /**
         * @param counts deleted (or, for a dry run, eligible) rows per table
         */
        public void purgeCompleted(String mode, Map<String, Long> counts, boolean cancelled, long durationMs) {
            Map<String, Object> details = new LinkedHashMap<>(counts);
            details.put("mode", mode);
            log.info(StructuredLogEvent.of(service, environment, LogEventType.PURGE_COMPLETED, "system")
                .outcome(cancelled ? "CANCELLED" : "SUCCESS")
                .durationMs(durationMs)
                .details(details)
                .build().toJson());
        }
    }
}
