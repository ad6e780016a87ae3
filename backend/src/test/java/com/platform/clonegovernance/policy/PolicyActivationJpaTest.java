package com.platform.clonegovernance.policy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.platform.clonegovernance.audit.AuditOperation;
import com.platform.clonegovernance.audit.AuditRecorder;
import com.platform.clonegovernance.evaluation.ActorIdentity;
import com.platform.clonegovernance.evaluation.EvaluationContext;
import com.platform.clonegovernance.evaluation.PolicyEvaluator;
import com.platform.clonegovernance.evaluation.PolicyVerdict;
import com.platform.clonegovernance.evaluation.ViolationCandidate;
import com.platform.clonegovernance.observability.MetricsRegistry;
import com.platform.clonegovernance.observability.StructuredLogger;
import com.platform.clonegovernance.persistence.EntityMappers;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Activation changes go through the stored policy queries, so the next evaluation
 * sees them without any caching in between.
 */
@DataJpaTest
@ActiveProfiles("test")
@Import({
    PolicyService.class,
    PolicyRepository.class,
    PolicyEvaluator.class,
    PolicyDefinitionCodec.class,
    EntityMappers.class,
    MetricsRegistry.class,
    StructuredLogger.class,
    PolicyActivationJpaTest.TestBeans.class
})
class PolicyActivationJpaTest {

    private static final Instant NOW = Instant.parse("2024-06-18T10:00:00Z");
    private static final ActorIdentity ADMIN = ActorIdentity.of("admin");

    @TestConfiguration
    static class TestBeans {

        @Bean
        ObjectMapper objectMapper() {
            return JsonMapper.builder().findAndAddModules().build();
        }

        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }

        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    private PolicyService policyService;

    @Autowired
    private PolicyEvaluator policyEvaluator;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private AuditRecorder auditRecorder;

    private Policy quota;

    @BeforeEach
    void setUp() throws Exception {
        quota = policyService.createPolicy(new PolicyDraft("MAX_TOTAL_USER_CLONES_10", "USER_QUOTA", null,
            objectMapper.readTree("{\"max_total_clones\": 10, \"action\": \"BLOCK\"}"), "ERROR", null, null),
            ADMIN);
        policyService.createPolicy(new PolicyDraft("PRD_QUOTA_2", "USER_QUOTA", "PRD",
            objectMapper.readTree("{\"max_total_clones\": 2, \"action\": \"WARN_AND_LOG\"}"), "WARNING", null, null),
            ADMIN);
    }

    @Test
    void deactivatedPolicyIsDroppedOnTheNextEvaluationAndReturnsWhenReactivated() {
        assertThat(matchedPolicies("DEV")).containsExactly("MAX_TOTAL_USER_CLONES_10");

        PolicyCommandResult off = policyService.setPolicyActive(quota.getId(), false, ADMIN);
        PolicyVerdict whileOff = policyEvaluator.evaluate(context("DEV"));

        assertThat(off.isSuccess()).isTrue();
        assertThat(whileOff.violations()).isEmpty();
        assertThat(whileOff.block()).isFalse();

        policyService.setPolicyActive(quota.getId(), true, ADMIN);

        PolicyVerdict whileOn = policyEvaluator.evaluate(context("DEV"));
        assertThat(whileOn.violations()).extracting(ViolationCandidate::policyName)
            .containsExactly("MAX_TOTAL_USER_CLONES_10");
        assertThat(whileOn.block()).isTrue();
    }

    @Test
    void scopedPolicyOnlyAppliesToItsScope() {
        assertThat(matchedPolicies("PRD")).containsExactlyInAnyOrder("MAX_TOTAL_USER_CLONES_10", "PRD_QUOTA_2");
        assertThat(matchedPolicies("UAT")).containsExactly("MAX_TOTAL_USER_CLONES_10");
    }

    @Test
    void activeOnlyListingFollowsTheToggle() {
        policyService.setPolicyActive(quota.getId(), false, ADMIN);

        assertThat(policyService.listPolicies(null, null, true))
            .extracting(Policy::getName).containsExactly("PRD_QUOTA_2");
        assertThat(policyService.listPolicies(null, null, false))
            .extracting(Policy::getName).containsExactly("MAX_TOTAL_USER_CLONES_10", "PRD_QUOTA_2");
        assertThat(policyService.listPolicies(null, "user_quota", false)).hasSize(2);
    }

    private List<String> matchedPolicies(String scope) {
        return policyEvaluator.evaluate(context(scope)).violations().stream()
            .map(ViolationCandidate::policyName)
            .toList();
    }

    private static EvaluationContext context(String scope) {
        return EvaluationContext.builder()
            .operation(AuditOperation.CREATE)
            .cloneName("orders_clone")
            .cloneType("FULL")
            .scope(scope)
            .actor(ActorIdentity.of("alice"))
            .liveCloneCount(10)
            .now(NOW)
            .build();
    }
}
