package com.platform.clonegovernance.policy;

import com.platform.clonegovernance.error.ValidationException;
import com.platform.clonegovernance.evaluation.EvaluationContext;

import java.time.DayOfWeek;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Kind-specific policy parameters.
 *
 * Each {@link PolicyKind} maps to exactly one record below. Records validate their
 * parameters on construction, so a definition that exists is always well formed.
 */
public interface PolicyDefinition {

    /**
     * Action configured for this policy.
     */
    PolicyAction action();

    /**
     * Checks the definition against an operation context.
     *
     * @return a finding when the policy is violated
     */
    Optional<Finding> check(EvaluationContext context);

    /**
     * Whether a match must block the operation.
     */
    default boolean blocks() {
        return action().isBlocking();
    }

    /**
     * Returns a human-readable description of this definition.
     */
    String describe();

    /**
     * One policy match: a message for humans plus kind-specific detail keys.
     */
    record Finding(String message, Map<String, Object> details) {

        public Finding {
            details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        }

        public static Finding of(String message) {
            return new Finding(message, Map.of());
        }
    }

    /**
     * Clone older than a maximum age. Only evaluated by the compliance scan.
     */
    record MaxAge(int maxAgeDays, PolicyAction action) implements PolicyDefinition {

        public MaxAge {
            if (maxAgeDays <= 0) {
                throw ValidationException.invalidDefinition("max_age_days", maxAgeDays, "must be positive");
            }
            action = defaultAction(action);
        }

        @Override
        public Optional<Finding> check(EvaluationContext context) {
            return Optional.empty();
        }

        public Optional<Finding> checkAge(long ageDays) {
            if (ageDays <= maxAgeDays) {
                return Optional.empty();
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("age_days", ageDays);
            details.put("max_age_days", maxAgeDays);
            return Optional.of(new Finding(
                "Clone is " + ageDays + " days old (max: " + maxAgeDays + ")", details));
        }

        @Override
        public boolean blocks() {
            return false;
        }

        @Override
        public String describe() {
            return "Age > " + maxAgeDays + " days";
        }
    }

    /**
     * Clone types that may not be created in the policy's scope.
     */
    record EnvironmentRestriction(List<String> restrictedCloneTypes, PolicyAction action)
            implements PolicyDefinition {

        public EnvironmentRestriction {
            restrictedCloneTypes = requireNonEmpty("restricted_clone_types", restrictedCloneTypes);
            action = defaultAction(action);
        }

        @Override
        public Optional<Finding> check(EvaluationContext context) {
            String cloneType = upper(context.cloneType());
            if (cloneType == null || !restrictedCloneTypes.contains(cloneType)) {
                return Optional.empty();
            }
            String where = context.scope() != null ? context.scope() : "this environment";
            return Optional.of(new Finding(
                cloneType + " clones are not allowed in " + where,
                Map.of("clone_type", cloneType)));
        }

        @Override
        public String describe() {
            return "Clone type in " + restrictedCloneTypes;
        }
    }

    /**
     * Maximum number of live clones per actor.
     */
    record UserQuota(int maxTotalClones, PolicyAction action) implements PolicyDefinition {

        public UserQuota {
            if (maxTotalClones < 0) {
                throw ValidationException.invalidDefinition("max_total_clones", maxTotalClones,
                    "must not be negative");
            }
            action = defaultAction(action);
        }

        @Override
        public Optional<Finding> check(EvaluationContext context) {
            long current = context.liveCloneCount();
            if (current < maxTotalClones) {
                return Optional.empty();
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("current_count", current);
            details.put("max_total_clones", maxTotalClones);
            return Optional.of(new Finding(
                "Total clone limit exceeded. You have " + current + " clones (max: " + maxTotalClones + ")",
                details));
        }

        @Override
        public String describe() {
            return "Live clones >= " + maxTotalClones;
        }
    }

    /**
     * Window of hours and weekdays in which operations are allowed.
     * Hours are a half-open range [start, end) in the policy's time zone.
     */
    record TimeRestriction(
        int allowedHoursStart,
        int allowedHoursEnd,
        Set<DayOfWeek> allowedDays,
        ZoneId timezone,
        PolicyAction action
    ) implements PolicyDefinition {

        public TimeRestriction {
            if (allowedHoursStart < 0 || allowedHoursStart > 23) {
                throw ValidationException.invalidDefinition("allowed_hours_start", allowedHoursStart,
                    "must be between 0 and 23");
            }
            if (allowedHoursEnd < 1 || allowedHoursEnd > 24) {
                throw ValidationException.invalidDefinition("allowed_hours_end", allowedHoursEnd,
                    "must be between 1 and 24");
            }
            if (allowedHoursStart >= allowedHoursEnd) {
                throw ValidationException.invalidDefinition("allowed_hours_end", allowedHoursEnd,
                    "must be after allowed_hours_start");
            }
            if (allowedDays == null || allowedDays.isEmpty()) {
                throw ValidationException.invalidDefinition("allowed_days", allowedDays, "must not be empty");
            }
            allowedDays = Set.copyOf(allowedDays);
            timezone = timezone != null ? timezone : ZoneId.of("UTC");
            action = defaultAction(action);
        }

        @Override
        public Optional<Finding> check(EvaluationContext context) {
            ZonedDateTime local = context.now().atZone(timezone);
            int hour = local.getHour();
            DayOfWeek day = local.getDayOfWeek();

            boolean outsideHours = hour < allowedHoursStart || hour >= allowedHoursEnd;
            boolean wrongDay = !allowedDays.contains(day);
            if (!outsideHours && !wrongDay) {
                return Optional.empty();
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("current_hour", hour);
            details.put("current_day", abbreviate(day));
            details.put("timezone", timezone.getId());
            return Optional.of(new Finding(
                "Clone creation not allowed at this time. Allowed: "
                    + allowedHoursStart + ":00 - " + allowedHoursEnd + ":00", details));
        }

        @Override
        public String describe() {
            return String.format("Hours %d-%d on %s (%s)", allowedHoursStart, allowedHoursEnd,
                allowedDays.stream().sorted().map(PolicyDefinition::abbreviate).collect(Collectors.toList()),
                timezone.getId());
        }
    }

    /**
     * Source schemas whose names mark sensitive data. Matching is a case-insensitive substring test.
     * REQUIRE_APPROVAL blocks the same way BLOCK does.
     */
    record SensitiveData(List<String> restrictedSchemas, List<String> approvers, PolicyAction action)
            implements PolicyDefinition {

        public SensitiveData {
            restrictedSchemas = requireNonEmpty("restricted_schemas", restrictedSchemas);
            approvers = normalize(approvers);
            action = defaultAction(action);
        }

        @Override
        public Optional<Finding> check(EvaluationContext context) {
            String schema = upper(context.sourceSchema());
            if (schema == null) {
                return Optional.empty();
            }
            return restrictedSchemas.stream()
                .filter(schema::contains)
                .findFirst()
                .map(matched -> {
                    Map<String, Object> details = new LinkedHashMap<>();
                    details.put("matched_schema", matched);
                    details.put("approvers", approvers);
                    return new Finding("Schema contains sensitive data and requires approval", details);
                });
        }

        @Override
        public boolean blocks() {
            return action == PolicyAction.BLOCK || action == PolicyAction.REQUIRE_APPROVAL;
        }

        @Override
        public String describe() {
            return "Source schema contains any of " + restrictedSchemas;
        }
    }

    /**
     * Source databases or schemas that may not be cloned. Names are compared case-insensitively.
     */
    record RestrictedSource(List<String> restrictedDatabases, List<String> restrictedSchemas, PolicyAction action)
            implements PolicyDefinition {

        public RestrictedSource {
            restrictedDatabases = normalize(restrictedDatabases);
            restrictedSchemas = normalize(restrictedSchemas);
            if (restrictedDatabases.isEmpty() && restrictedSchemas.isEmpty()) {
                throw ValidationException.invalidDefinition("restricted_databases", null,
                    "restricted_databases or restricted_schemas must not be empty");
            }
            action = defaultAction(action);
        }

        @Override
        public Optional<Finding> check(EvaluationContext context) {
            String database = upper(context.sourceDatabase());
            if (database != null && restrictedDatabases.contains(database)) {
                return Optional.of(new Finding("Cloning from database " + database + " is restricted",
                    Map.of("source_database", database)));
            }
            String schema = upper(context.sourceSchema());
            if (schema != null && restrictedSchemas.contains(schema)) {
                return Optional.of(new Finding("Cloning from schema " + schema + " is restricted",
                    Map.of("source_schema", schema)));
            }
            return Optional.empty();
        }

        @Override
        public String describe() {
            return "Source database in " + restrictedDatabases + " or schema in " + restrictedSchemas;
        }
    }

    /**
     * Data classifications that may not be cloned. Retention parameters are informational
     * and never match on their own.
     */
    record DataClassification(
        List<String> restrictedClassifications,
        Integer retentionDays,
        String appliesTo,
        PolicyAction action
    ) implements PolicyDefinition {

        public DataClassification {
            restrictedClassifications = normalize(restrictedClassifications);
            if (restrictedClassifications.isEmpty() && retentionDays == null) {
                throw ValidationException.invalidDefinition("restricted_classifications", null,
                    "restricted_classifications or retention_days is required");
            }
            if (retentionDays != null && retentionDays <= 0) {
                throw ValidationException.invalidDefinition("retention_days", retentionDays, "must be positive");
            }
            action = defaultAction(action);
        }

        @Override
        public Optional<Finding> check(EvaluationContext context) {
            String classification = upper(context.dataClassification());
            if (classification == null || !restrictedClassifications.contains(classification)) {
                return Optional.empty();
            }
            return Optional.of(new Finding("Data classified " + classification + " may not be cloned",
                Map.of("classification", classification)));
        }

        @Override
        public String describe() {
            return restrictedClassifications.isEmpty()
                ? "Retain " + appliesTo + " for " + retentionDays + " days"
                : "Classification in " + restrictedClassifications;
        }
    }

    /**
     * Clone types that only approver roles may create. An empty type list covers every type.
     */
    record ApprovalRequired(List<String> cloneTypes, List<String> approverRoles, PolicyAction action)
            implements PolicyDefinition {

        public ApprovalRequired {
            cloneTypes = normalize(cloneTypes);
            approverRoles = requireNonEmpty("approver_roles", approverRoles);
            action = defaultAction(action);
        }

        @Override
        public Optional<Finding> check(EvaluationContext context) {
            String cloneType = upper(context.cloneType());
            if (!cloneTypes.isEmpty() && (cloneType == null || !cloneTypes.contains(cloneType))) {
                return Optional.empty();
            }
            String role = context.actor() != null ? upper(context.actor().role()) : null;
            if (role != null && approverRoles.contains(role)) {
                return Optional.empty();
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("actor_role", role);
            details.put("approver_roles", approverRoles);
            return Optional.of(new Finding("Operation requires approval from one of " + approverRoles, details));
        }

        @Override
        public String describe() {
            return "Approval by " + approverRoles + (cloneTypes.isEmpty() ? "" : " for " + cloneTypes);
        }
    }

    // ==================== Helpers ====================

    private static PolicyAction defaultAction(PolicyAction action) {
        return action != null ? action : PolicyAction.LOG_ONLY;
    }

    private static List<String> normalize(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
            .filter(v -> v != null && !v.isBlank())
            .map(v -> v.trim().toUpperCase(Locale.ROOT))
            .distinct()
            .collect(Collectors.toUnmodifiableList());
    }

    private static List<String> requireNonEmpty(String field, List<String> values) {
        List<String> normalized = normalize(values);
        if (normalized.isEmpty()) {
            throw ValidationException.invalidDefinition(field, values, "must not be empty");
        }
        return normalized;
    }

    private static String upper(String value) {
        return value == null || value.isBlank() ? null : value.trim().toUpperCase(Locale.ROOT);
    }

    static String abbreviate(DayOfWeek day) {
        return day.name().substring(0, 3);
    }
}
