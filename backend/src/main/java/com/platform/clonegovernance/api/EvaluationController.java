package com.platform.clonegovernance.api;

import com.platform.clonegovernance.compliance.CloneRegistry;
import com.platform.clonegovernance.evaluation.PolicyEvaluator;
import com.platform.clonegovernance.evaluation.PolicyVerdict;
import com.platform.clonegovernance.security.ValidatedRequests.OperationRequest;
import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

/**
 * Standalone policy pre-check. Nothing is recorded.
 */
@RestController
@RequestMapping("/api/evaluations")
@AllArgsConstructor
public class EvaluationController {

    private final PolicyEvaluator policyEvaluator;
    private final CloneRegistry cloneRegistry;
    private final Clock clock;

    @PostMapping
    public PolicyVerdict evaluate(@Valid @RequestBody OperationRequest request) {
        long liveCount = request.getLiveCloneCount() != null
            ? request.getLiveCloneCount()
            : cloneRegistry.countLiveClones(request.getActor().getUser());
        return policyEvaluator.evaluate(request.toContext(liveCount, clock.instant()));
    }
}
