package com.platform.clonegovernance.policy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.clonegovernance.error.ValidationException;
import com.platform.clonegovernance.policy.PolicyDefinition.ApprovalRequired;
import com.platform.clonegovernance.policy.PolicyDefinition.DataClassification;
import com.platform.clonegovernance.policy.PolicyDefinition.EnvironmentRestriction;
import com.platform.clonegovernance.policy.PolicyDefinition.MaxAge;
import com.platform.clonegovernance.policy.PolicyDefinition.RestrictedSource;
import com.platform.clonegovernance.policy.PolicyDefinition.SensitiveData;
import com.platform.clonegovernance.policy.PolicyDefinition.TimeRestriction;
import com.platform.clonegovernance.policy.PolicyDefinition.UserQuota;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Converts policy definitions to and from their JSON document form.
 *
 * Keys are snake_case, e.g. {@code {"max_total_clones": 10, "action": "BLOCK"}}.
 * Decoding a document that does not fit its kind raises a {@link ValidationException}.
 */
@Component
public class PolicyDefinitionCodec {

    private final ObjectMapper objectMapper;

    public PolicyDefinitionCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    // ==================== Decode ====================

    public PolicyDefinition decode(PolicyKind kind, JsonNode node) {
        if (kind == null) {
            throw ValidationException.unknownKind(null, validKinds());
        }
        if (node == null || !node.isObject()) {
            throw ValidationException.invalidDefinition("", node, "definition must be a JSON object");
        }
        return switch (kind) {
            case MAX_AGE -> new MaxAge(requiredInt(node, "max_age_days"), action(node));
            case ENVIRONMENT_RESTRICTION -> new EnvironmentRestriction(
                strings(node, "restricted_clone_types"), action(node));
            case USER_QUOTA -> new UserQuota(requiredInt(node, "max_total_clones"), action(node));
            case TIME_RESTRICTION -> new TimeRestriction(
                requiredInt(node, "allowed_hours_start"),
                requiredInt(node, "allowed_hours_end"),
                days(node),
                timezone(node),
                action(node));
            case SENSITIVE_DATA -> new SensitiveData(
                strings(node, "restricted_schemas"), strings(node, "approvers"), action(node));
            case RESTRICTED_SOURCE -> new RestrictedSource(
                strings(node, "restricted_databases"), strings(node, "restricted_schemas"), action(node));
            case DATA_CLASSIFICATION -> new DataClassification(
                strings(node, "restricted_classifications"),
                optionalInt(node, "retention_days"),
                optionalText(node, "applies_to"),
                action(node));
            case APPROVAL_REQUIRED -> new ApprovalRequired(
                strings(node, "clone_types"), strings(node, "approver_roles"), action(node));
        };
    }

    /**
     * Decodes a stored JSON document.
     */
    public PolicyDefinition fromJson(PolicyKind kind, String json) {
        try {
            return decode(kind, objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw ValidationException.invalidDefinition("", json, "definition is not valid JSON");
        }
    }

    // ==================== Encode ====================

    public ObjectNode encode(PolicyDefinition definition) {
        ObjectNode node = objectMapper.createObjectNode();

        if (definition instanceof MaxAge d) {
            node.put("max_age_days", d.maxAgeDays());
        } else if (definition instanceof EnvironmentRestriction d) {
            putStrings(node, "restricted_clone_types", d.restrictedCloneTypes());
        } else if (definition instanceof UserQuota d) {
            node.put("max_total_clones", d.maxTotalClones());
        } else if (definition instanceof TimeRestriction d) {
            node.put("allowed_hours_start", d.allowedHoursStart());
            node.put("allowed_hours_end", d.allowedHoursEnd());
            putStrings(node, "allowed_days", d.allowedDays().stream()
                .sorted()
                .map(PolicyDefinition::abbreviate)
                .collect(Collectors.toList()));
            node.put("timezone", d.timezone().getId());
        } else if (definition instanceof SensitiveData d) {
            putStrings(node, "restricted_schemas", d.restrictedSchemas());
            putStrings(node, "approvers", d.approvers());
        } else if (definition instanceof RestrictedSource d) {
            putStrings(node, "restricted_databases", d.restrictedDatabases());
            putStrings(node, "restricted_schemas", d.restrictedSchemas());
        } else if (definition instanceof DataClassification d) {
            putStrings(node, "restricted_classifications", d.restrictedClassifications());
            if (d.retentionDays() != null) {
                node.put("retention_days", d.retentionDays());
            }
            if (d.appliesTo() != null) {
                node.put("applies_to", d.appliesTo());
            }
        } else if (definition instanceof ApprovalRequired d) {
            putStrings(node, "clone_types", d.cloneTypes());
            putStrings(node, "approver_roles", d.approverRoles());
        } else {
            throw new IllegalArgumentException("Unsupported definition type: " + definition);
        }

        node.put("action", definition.action().name());
        return node;
    }

    public String toJson(PolicyDefinition definition) {
        return encode(definition).toString();
    }

    /**
     * Resolves the kind a definition variant belongs to.
     */
    public PolicyKind kindOf(PolicyDefinition definition) {
        return Arrays.stream(PolicyKind.values())
            .filter(k -> k.getDefinitionType().isInstance(definition))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unsupported definition type: " + definition));
    }

    // ==================== Enum parsing ====================

    public static PolicyKind parseKind(String value) {
        try {
            return PolicyKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw ValidationException.unknownKind(value, validKinds());
        }
    }

    public static PolicySeverity parseSeverity(String value) {
        if (value == null || value.isBlank()) {
            return PolicySeverity.WARNING;
        }
        try {
            return PolicySeverity.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw ValidationException.unknownSeverity(value, Arrays.toString(PolicySeverity.values()));
        }
    }

    private static String validKinds() {
        return Arrays.toString(PolicyKind.values());
    }

    // ==================== Field helpers ====================

    private int requiredInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw ValidationException.invalidDefinition(field, null, "is required");
        }
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw ValidationException.invalidDefinition(field, value.asText(), "must be an integer");
        }
        return value.intValue();
    }

    private Integer optionalInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return requiredInt(node, field);
    }

    private String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private List<String> strings(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isArray()) {
            throw ValidationException.invalidDefinition(field, value.toString(), "must be an array of strings");
        }
        List<String> result = new ArrayList<>();
        for (JsonNode item : value) {
            if (!item.isTextual()) {
                throw ValidationException.invalidDefinition(field, item.toString(), "must contain only strings");
            }
            result.add(item.asText());
        }
        return result;
    }

    private PolicyAction action(JsonNode node) {
        String value = optionalText(node, "action");
        if (value == null) {
            return null;
        }
        try {
            return PolicyAction.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw ValidationException.invalidDefinition("action", value,
                "must be one of " + Arrays.toString(PolicyAction.values()));
        }
    }

    private Set<DayOfWeek> days(JsonNode node) {
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        for (String value : strings(node, "allowed_days")) {
            String prefix = value.trim().toUpperCase(Locale.ROOT);
            DayOfWeek day = prefix.length() < 3 ? null : Arrays.stream(DayOfWeek.values())
                .filter(d -> d.name().startsWith(prefix.substring(0, 3)))
                .findFirst()
                .orElse(null);
            if (day == null) {
                throw ValidationException.invalidDefinition("allowed_days", value, "is not a day of the week");
            }
            days.add(day);
        }
        return days;
    }

    private ZoneId timezone(JsonNode node) {
        String value = optionalText(node, "timezone");
        if (value == null) {
            return null;
        }
        try {
            return ZoneId.of(value);
        } catch (DateTimeException e) {
            throw ValidationException.invalidDefinition("timezone", value, "is not a known time zone");
        }
    }

    private void putStrings(ObjectNode node, String field, List<String> values) {
        ArrayNode array = node.putArray(field);
        values.forEach(array::add);
    }
}
