package com.platform.clonegovernance.guard;

import com.platform.clonegovernance.audit.AuditOperation;
import com.platform.clonegovernance.audit.AuditRecorder;
import com.platform.clonegovernance.audit.OperationRecordRequest;
import com.platform.clonegovernance.audit.OperationStatus;
import com.platform.clonegovernance.audit.RecordingResult;
import com.platform.clonegovernance.compliance.CloneRegistry;
import com.platform.clonegovernance.evaluation.ActorIdentity;
import com.platform.clonegovernance.evaluation.PolicyEvaluator;
import com.platform.clonegovernance.evaluation.PolicyVerdict;
import com.platform.clonegovernance.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Runs a clone creation under policy control.
 *
 * For one actor, counting live clones, evaluating, creating and recording happen under
 * a single lock, so two creations by the same actor cannot both slip under a quota.
 * Actors are hashed onto a fixed set of lock stripes; unrelated actors may occasionally
 * wait on each other.
 * The lock is local to this instance; callers that evaluate and record on their own
 * only get a point-in-time quota check.
 */
@Slf4j
@Component
public class GovernedOperationExecutor {

    static final int LOCK_STRIPES = 64;

    private final PolicyEvaluator policyEvaluator;
    private final CloneRegistry cloneRegistry;
    private final AuditRecorder auditRecorder;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;

    private final ReentrantLock[] actorLocks = new ReentrantLock[LOCK_STRIPES];

    public GovernedOperationExecutor(
            PolicyEvaluator policyEvaluator,
            CloneRegistry cloneRegistry,
            AuditRecorder auditRecorder,
            MetricsRegistry metricsRegistry,
            Clock clock) {
        this.policyEvaluator = policyEvaluator;
        this.cloneRegistry = cloneRegistry;
        this.auditRecorder = auditRecorder;
        this.metricsRegistry = metricsRegistry;
        this.clock = clock;
        for (int i = 0; i < actorLocks.length; i++) {
            actorLocks[i] = new ReentrantLock();
        }
    }

    /**
     * Evaluate the request and run {@code creation} unless a blocking policy matched.
     *
     * A blocked request is recorded with status BLOCKED. If the creation callback throws,
     * a FAILURE record is written and the exception is rethrown. Evaluation errors propagate
     * and nothing is created.
     */
    public <T> GovernedOperationResult<T> execute(OperationRecordRequest request, Supplier<T> creation) {
        ActorIdentity actor = request.actor() != null ? request.actor() : ActorIdentity.system();
        OperationRecordRequest base = request.toBuilder()
            .operation(request.operation() != null ? request.operation() : AuditOperation.CREATE)
            .actor(actor)
            .build();

        ReentrantLock lock = lockFor(actor.user());
        lock.lock();
        try {
            long liveCount = base.liveCloneCount() != null
                ? base.liveCloneCount()
                : cloneRegistry.countLiveClones(actor.user());
            PolicyVerdict verdict = policyEvaluator.evaluate(
                AuditRecorder.toContext(base, actor, liveCount, clock.instant()));

            if (verdict.block()) {
                log.warn("Blocked {} of clone {} by {}: {} blocking violation(s)", base.operation(),
                    base.cloneName(), actor.user(), verdict.violations().stream().filter(v -> v.blocking()).count());
                metricsRegistry.incrementCounter("clonegovernance.operations.blocked",
                    "operation", String.valueOf(base.operation()));
                RecordingResult recording = auditRecorder.recordOperation(base.toBuilder()
                    .status(OperationStatus.BLOCKED)
                    .liveCloneCount(liveCount)
                    .verdict(verdict)
                    .build());
                return GovernedOperationResult.blocked(verdict, recording);
            }

            T value;
            try {
                value = creation.get();
            } catch (RuntimeException e) {
                log.error("Creation of clone {} failed for {}: {}", base.cloneName(), actor.user(), e.getMessage());
                auditRecorder.recordOperation(base.toBuilder()
                    .status(OperationStatus.FAILURE)
                    .errorMessage(e.getMessage())
                    .liveCloneCount(liveCount)
                    .verdict(PolicyVerdict.empty())
                    .build());
                throw e;
            }

            RecordingResult recording = auditRecorder.recordOperation(base.toBuilder()
                .status(OperationStatus.SUCCESS)
                .liveCloneCount(liveCount)
                .verdict(verdict)
                .build());
            return GovernedOperationResult.completed(value, verdict, recording);
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock lockFor(String actor) {
        return actorLocks[Math.floorMod(actor.hashCode(), actorLocks.length)];
    }
}
