package com.platform.clonegovernance.policy;

import com.platform.clonegovernance.evaluation.ActorIdentity;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;

/**
 * Installs the baseline policy set at startup when
 * {@code clonegovernance.policies.seed-defaults} is true.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
@ConditionalOnProperty(name = "clonegovernance.policies.seed-defaults", havingValue = "true")
public class DefaultPoliciesConfig {

    private final PolicyService policyService;

    @PostConstruct
    public void initializeDefaultPolicies() {
        log.info("Initializing default clone policies...");
        PolicyService.DefaultPoliciesResult result = policyService.setupDefaultPolicies(ActorIdentity.system());
        log.info("Default clone policies ready: created={}, existing={}",
            result.created(), result.alreadyPresent());
    }
}
