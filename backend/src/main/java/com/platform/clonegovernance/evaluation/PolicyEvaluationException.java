package com.platform.clonegovernance.evaluation;

/**
 * Raised when a single policy cannot be evaluated. The evaluator skips that policy
 * and continues with the rest.
 */
public class PolicyEvaluationException extends RuntimeException {

    public PolicyEvaluationException(String message) {
        super(message);
    }

    public PolicyEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
