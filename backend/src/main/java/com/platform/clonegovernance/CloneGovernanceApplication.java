package com.platform.clonegovernance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Clone Governance Engine
 *
 * Evaluates database clone operations against administrator-defined policies,
 * keeps the audit and access trail, records violations, sweeps live clones for
 * age compliance and purges records past their retention period.
 */
@SpringBootApplication
@EnableScheduling
public class CloneGovernanceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CloneGovernanceApplication.class, args);
    }
}
