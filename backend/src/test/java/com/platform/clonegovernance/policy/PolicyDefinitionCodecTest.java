package com.platform.clonegovernance.policy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.clonegovernance.error.ErrorCode;
import com.platform.clonegovernance.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PolicyDefinitionCodecTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final PolicyDefinitionCodec codec = new PolicyDefinitionCodec(objectMapper);

    @Test
    void decodesTimeRestrictionWithDayPrefixes() throws Exception {
        JsonNode node = objectMapper.readTree("""
            {"allowed_hours_start": 8, "allowed_hours_end": 20,
             "allowed_days": ["Monday", "tue", "WED"], "timezone": "Europe/Berlin", "action": "block"}
            """);

        PolicyDefinition definition = codec.decode(PolicyKind.TIME_RESTRICTION, node);

        assertThat(definition).isInstanceOfSatisfying(PolicyDefinition.TimeRestriction.class, d -> {
            assertThat(d.allowedHoursStart()).isEqualTo(8);
            assertThat(d.allowedHoursEnd()).isEqualTo(20);
            assertThat(d.allowedDays()).containsExactlyInAnyOrder(
                DayOfWeek.MONDAY, DayOfWeek.TUESDAY, DayOfWeek.WEDNESDAY);
            assertThat(d.timezone()).isEqualTo(ZoneId.of("Europe/Berlin"));
            assertThat(d.action()).isEqualTo(PolicyAction.BLOCK);
        });
    }

    @Test
    void missingActionDefaultsToLogOnly() throws Exception {
        PolicyDefinition definition = codec.decode(PolicyKind.USER_QUOTA,
            objectMapper.readTree("{\"max_total_clones\": 10}"));

        assertThat(definition.action()).isEqualTo(PolicyAction.LOG_ONLY);
        assertThat(definition.blocks()).isFalse();
    }

    @Test
    void missingRequiredFieldIsRejectedWithFieldName() throws Exception {
        JsonNode node = objectMapper.readTree("{\"action\": \"BLOCK\"}");

        assertThatThrownBy(() -> codec.decode(PolicyKind.USER_QUOTA, node))
            .isInstanceOfSatisfying(ValidationException.class, e -> {
                assertThat(e.getErrorCode()).isEqualTo(ErrorCode.INVALID_POLICY_DEFINITION);
                assertThat(e.getField()).isEqualTo("definition.max_total_clones");
            });
    }

    @Test
    void wrongFieldTypesAreRejected() throws Exception {
        assertThatThrownBy(() -> codec.decode(PolicyKind.MAX_AGE,
                objectMapper.readTree("{\"max_age_days\": \"seven\"}")))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("max_age_days");

        assertThatThrownBy(() -> codec.decode(PolicyKind.SENSITIVE_DATA,
                objectMapper.readTree("{\"restricted_schemas\": \"PII\"}")))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("restricted_schemas");
    }

    @Test
    void invalidValuesAreRejected() throws Exception {
        assertThatThrownBy(() -> codec.decode(PolicyKind.TIME_RESTRICTION, objectMapper.readTree(
                "{\"allowed_hours_start\": 18, \"allowed_hours_end\": 9, \"allowed_days\": [\"MON\"]}")))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("allowed_hours_end");

        assertThatThrownBy(() -> codec.decode(PolicyKind.TIME_RESTRICTION, objectMapper.readTree(
                "{\"allowed_hours_start\": 9, \"allowed_hours_end\": 18, \"allowed_days\": [\"FUNDAY\"]}")))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("FUNDAY");

        assertThatThrownBy(() -> codec.decode(PolicyKind.TIME_RESTRICTION, objectMapper.readTree(
                "{\"allowed_hours_start\": 9, \"allowed_hours_end\": 18, \"allowed_days\": [\"MON\"],"
                    + " \"timezone\": \"Mars/Olympus\"}")))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("timezone");

        assertThatThrownBy(() -> codec.decode(PolicyKind.USER_QUOTA,
                objectMapper.readTree("{\"max_total_clones\": 3, \"action\": \"EXPLODE\"}")))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("action");

        assertThatThrownBy(() -> codec.decode(PolicyKind.MAX_AGE, objectMapper.readTree("[1, 2]")))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void encodeWritesSnakeCaseDocumentThatDecodesToTheSameDefinition() {
        PolicyDefinition.RestrictedSource source = new PolicyDefinition.RestrictedSource(
            List.of("prd_db"), List.of(), PolicyAction.BLOCK);

        ObjectNode node = codec.encode(source);

        assertThat(node.get("restricted_databases").get(0).asText()).isEqualTo("PRD_DB");
        assertThat(node.get("action").asText()).isEqualTo("BLOCK");
        assertThat(codec.decode(PolicyKind.RESTRICTED_SOURCE, node)).isEqualTo(source);
        assertThat(codec.kindOf(source)).isEqualTo(PolicyKind.RESTRICTED_SOURCE);
    }

    @Test
    void parseKindAndSeverity() {
        assertThat(PolicyDefinitionCodec.parseKind(" user_quota ")).isEqualTo(PolicyKind.USER_QUOTA);
        assertThat(PolicyDefinitionCodec.parseSeverity(null)).isEqualTo(PolicySeverity.WARNING);
        assertThat(PolicyDefinitionCodec.parseSeverity("critical")).isEqualTo(PolicySeverity.CRITICAL);

        assertThatThrownBy(() -> PolicyDefinitionCodec.parseKind("MAX_SIZE"))
            .isInstanceOfSatisfying(ValidationException.class,
                e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.UNKNOWN_POLICY_KIND));
        assertThatThrownBy(() -> PolicyDefinitionCodec.parseKind(null))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> PolicyDefinitionCodec.parseSeverity("FATAL"))
            .isInstanceOfSatisfying(ValidationException.class,
                e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.UNKNOWN_SEVERITY));
    }

    @Test
    void defaultPolicySetDefinitionsSurviveEncoding() {
        for (Policy policy : DefaultPolicySet.build()) {
            ObjectNode node = codec.encode(policy.getDefinition());
            assertThat(codec.decode(policy.getKind(), node))
                .as(policy.getName())
                .isEqualTo(policy.getDefinition());
        }
    }
}
