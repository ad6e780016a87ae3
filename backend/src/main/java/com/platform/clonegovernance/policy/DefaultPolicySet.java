package com.platform.clonegovernance.policy;

import com.platform.clonegovernance.policy.PolicyDefinition.DataClassification;
import com.platform.clonegovernance.policy.PolicyDefinition.EnvironmentRestriction;
import com.platform.clonegovernance.policy.PolicyDefinition.MaxAge;
import com.platform.clonegovernance.policy.PolicyDefinition.SensitiveData;
import com.platform.clonegovernance.policy.PolicyDefinition.TimeRestriction;
import com.platform.clonegovernance.policy.PolicyDefinition.UserQuota;

import java.time.DayOfWeek;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.List;

/**
 * The baseline policy set installed by {@code setupDefaultPolicies}.
 */
public final class DefaultPolicySet {

    private DefaultPolicySet() {
    }

    public static List<Policy> build() {
        return List.of(
            Policy.builder()
                .name("PRD_MAX_CLONE_AGE_7_DAYS")
                .kind(PolicyKind.MAX_AGE)
                .scope("PRD")
                .definition(new MaxAge(7, PolicyAction.WARN_AND_LOG))
                .severity(PolicySeverity.WARNING)
                .description("Production clones must not exceed 7 days to minimize data exposure risk")
                .build(),

            Policy.builder()
                .name("UAT_MAX_CLONE_AGE_14_DAYS")
                .kind(PolicyKind.MAX_AGE)
                .scope("UAT")
                .definition(new MaxAge(14, PolicyAction.WARN_AND_LOG))
                .severity(PolicySeverity.WARNING)
                .description("UAT clones must not exceed 14 days")
                .build(),

            Policy.builder()
                .name("RESTRICT_PII_SCHEMA_CLONES")
                .kind(PolicyKind.SENSITIVE_DATA)
                .definition(new SensitiveData(
                    List.of("PII", "SENSITIVE", "CONFIDENTIAL", "PHI", "PCI"),
                    List.of("SRS_SECURITY_ADMIN", "SRS_ACCOUNT_ADMIN"),
                    PolicyAction.REQUIRE_APPROVAL))
                .severity(PolicySeverity.CRITICAL)
                .description("Schemas containing PII data require approval before cloning")
                .build(),

            Policy.builder()
                .name("NO_PRD_DATABASE_CLONES")
                .kind(PolicyKind.ENVIRONMENT_RESTRICTION)
                .scope("PRD")
                .definition(new EnvironmentRestriction(List.of("DATABASE"), PolicyAction.BLOCK))
                .severity(PolicySeverity.ERROR)
                .description("Database-level clones are not permitted in production")
                .build(),

            Policy.builder()
                .name("PRD_BUSINESS_HOURS_ONLY")
                .kind(PolicyKind.TIME_RESTRICTION)
                .scope("PRD")
                .definition(new TimeRestriction(8, 18,
                    EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY),
                    ZoneId.of("America/New_York"),
                    PolicyAction.BLOCK))
                .severity(PolicySeverity.ERROR)
                .description("Production clones can only be created during business hours (8 AM - 6 PM)")
                .build(),

            Policy.builder()
                .name("MAX_TOTAL_USER_CLONES_10")
                .kind(PolicyKind.USER_QUOTA)
                .definition(new UserQuota(10, PolicyAction.BLOCK))
                .severity(PolicySeverity.ERROR)
                .description("Users cannot have more than 10 total active clones across all environments")
                .build(),

            Policy.builder()
                .name("AUDIT_RETENTION_365_DAYS")
                .kind(PolicyKind.DATA_CLASSIFICATION)
                .definition(new DataClassification(List.of(), 365, "AUDIT_LOG", PolicyAction.LOG_ONLY))
                .severity(PolicySeverity.INFO)
                .description("Clone audit records must be retained for 365 days for compliance")
                .build()
        );
    }
}
