package com.platform.clonegovernance.policy;

import com.platform.clonegovernance.audit.AuditOperation;
import com.platform.clonegovernance.audit.AuditRecorder;
import com.platform.clonegovernance.audit.OperationRecordRequest;
import com.platform.clonegovernance.audit.OperationStatus;
import com.platform.clonegovernance.error.ResourceConflictException;
import com.platform.clonegovernance.error.ResourceNotFoundException;
import com.platform.clonegovernance.error.ValidationException;
import com.platform.clonegovernance.evaluation.ActorIdentity;
import com.platform.clonegovernance.observability.StructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Policy administration: create, update, toggle, delete and list.
 *
 * Authoring errors surface synchronously as {@link ValidationException}. Commands on a
 * missing policy return a NOT_FOUND result document instead of throwing. Every
 * successful change is written to the audit log.
 */
@Slf4j
@Service
public class PolicyService {

    private final PolicyRepository policyRepository;
    private final PolicyDefinitionCodec definitionCodec;
    private final AuditRecorder auditRecorder;
    private final StructuredLogger structuredLogger;
    private final Clock clock;

    public PolicyService(
            PolicyRepository policyRepository,
            PolicyDefinitionCodec definitionCodec,
            AuditRecorder auditRecorder,
            StructuredLogger structuredLogger,
            Clock clock) {
        this.policyRepository = policyRepository;
        this.definitionCodec = definitionCodec;
        this.auditRecorder = auditRecorder;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }

    /**
     * Create a policy from an administrator draft.
     */
    public Policy createPolicy(PolicyDraft draft, ActorIdentity actor) {
        if (draft.name() == null || draft.name().isBlank()) {
            throw new ValidationException("name", "Policy name is required");
        }
        PolicyKind kind = PolicyDefinitionCodec.parseKind(draft.kind());
        PolicyDefinition definition = definitionCodec.decode(kind, draft.definition());
        PolicySeverity severity = PolicyDefinitionCodec.parseSeverity(draft.severity());

        Instant now = clock.instant();
        Policy policy = Policy.builder()
            .name(draft.name().trim())
            .kind(kind)
            .scope(normalizeScope(draft.scope()))
            .definition(definition)
            .severity(severity)
            .active(draft.active() == null || draft.active())
            .description(draft.description())
            .createdBy(actor.user())
            .createdAt(now)
            .updatedBy(actor.user())
            .updatedAt(now)
            .build();

        return insert(policy, actor);
    }

    /**
     * Update a policy. Null draft fields keep their current value; the name never changes.
     */
    public PolicyCommandResult updatePolicy(String policyId, PolicyDraft draft, ActorIdentity actor) {
        Optional<Policy> existing = policyRepository.findById(policyId);
        if (existing.isEmpty()) {
            return PolicyCommandResult.notFound(policyId);
        }
        Policy current = existing.get();

        PolicyKind kind = draft.kind() != null ? PolicyDefinitionCodec.parseKind(draft.kind()) : current.getKind();
        PolicyDefinition definition;
        if (draft.definition() != null) {
            definition = definitionCodec.decode(kind, draft.definition());
        } else if (kind != current.getKind()) {
            throw ValidationException.invalidDefinition("", null, "a new definition is required when the kind changes");
        } else {
            definition = current.getDefinition();
        }

        Policy updated = current.toBuilder()
            .kind(kind)
            .definition(definition)
            .scope(draft.scope() != null ? normalizeScope(draft.scope()) : current.getScope())
            .severity(draft.severity() != null
                ? PolicyDefinitionCodec.parseSeverity(draft.severity()) : current.getSeverity())
            .description(draft.description() != null ? draft.description() : current.getDescription())
            .active(draft.active() != null ? draft.active() : current.isActive())
            .updatedBy(actor.user())
            .updatedAt(clock.instant())
            .build();

        Optional<Policy> saved = policyRepository.update(updated);
        if (saved.isEmpty()) {
            return PolicyCommandResult.notFound(policyId);
        }

        structuredLogger.policy().updated(policyId, current.getName(), actor.user());
        recordAdministration(AuditOperation.POLICY_UPDATE, saved.get(), actor, Map.of());
        return PolicyCommandResult.success(saved.get(), "Policy " + current.getName() + " updated");
    }

    /**
     * Activate or deactivate a policy. The next evaluation sees the change.
     */
    public PolicyCommandResult setPolicyActive(String policyId, boolean active, ActorIdentity actor) {
        Optional<Policy> existing = policyRepository.findById(policyId);
        if (existing.isEmpty()) {
            return PolicyCommandResult.notFound(policyId);
        }
        Policy current = existing.get();

        Optional<Policy> saved = policyRepository.update(current.toBuilder()
            .active(active)
            .updatedBy(actor.user())
            .updatedAt(clock.instant())
            .build());
        if (saved.isEmpty()) {
            return PolicyCommandResult.notFound(policyId);
        }

        log.info("Policy '{}' {} by {}", current.getName(), active ? "activated" : "deactivated", actor.user());
        structuredLogger.policy().statusChanged(policyId, current.getName(), active, actor.user());
        recordAdministration(AuditOperation.POLICY_STATUS_CHANGE, saved.get(), actor,
            Map.of("active", active, "previous_active", current.isActive()));
        return PolicyCommandResult.success(saved.get(),
            "Policy " + current.getName() + (active ? " activated" : " deactivated"));
    }

    /**
     * Delete a policy. Existing violations keep the denormalized policy name.
     */
    public PolicyCommandResult deletePolicy(String policyId, ActorIdentity actor) {
        Optional<Policy> existing = policyRepository.findById(policyId);
        if (existing.isEmpty() || !policyRepository.deleteById(policyId)) {
            return PolicyCommandResult.notFound(policyId);
        }
        Policy deleted = existing.get();

        log.info("Policy '{}' deleted by {}", deleted.getName(), actor.user());
        structuredLogger.policy().deleted(policyId, deleted.getName(), actor.user());
        recordAdministration(AuditOperation.POLICY_DELETE, deleted, actor, Map.of());
        return PolicyCommandResult.deleted(policyId, deleted.getName());
    }

    public Policy getPolicy(String policyId) {
        return policyRepository.findById(policyId)
            .orElseThrow(() -> ResourceNotFoundException.policy(policyId));
    }

    /**
     * Policies with optional filters, most severe first, then by name.
     */
    public List<Policy> listPolicies(String scope, String kind, boolean activeOnly) {
        PolicyKind parsedKind = kind == null || kind.isBlank() ? null : PolicyDefinitionCodec.parseKind(kind);
        return policyRepository.findFiltered(normalizeScope(scope), parsedKind, activeOnly);
    }

    /**
     * Install the baseline policy set. Policies whose name already exists are left untouched.
     */
    public DefaultPoliciesResult setupDefaultPolicies(ActorIdentity actor) {
        List<String> created = new ArrayList<>();
        List<String> existing = new ArrayList<>();
        Instant now = clock.instant();

        for (Policy template : DefaultPolicySet.build()) {
            if (policyRepository.existsByName(template.getName())) {
                existing.add(template.getName());
                continue;
            }
            Policy policy = template.toBuilder()
                .createdBy(actor.user())
                .createdAt(now)
                .updatedBy(actor.user())
                .updatedAt(now)
                .build();
            insert(policy, actor);
            created.add(policy.getName());
        }

        log.info("Default policies: {} created, {} already present", created.size(), existing.size());
        return new DefaultPoliciesResult(created, existing);
    }

    private Policy insert(Policy policy, ActorIdentity actor) {
        if (policyRepository.existsByName(policy.getName())) {
            throw new ResourceConflictException("Policy", policy.getName());
        }
        Policy saved;
        try {
            saved = policyRepository.insert(policy);
        } catch (DataIntegrityViolationException e) {
            throw new ResourceConflictException("Policy", policy.getName());
        }

        log.info("Policy '{}' ({}) created by {}", saved.getName(), saved.getKind(), actor.user());
        structuredLogger.policy().created(saved.getId(), saved.getName(), saved.getKind().name(), actor.user());
        recordAdministration(AuditOperation.POLICY_CREATE, saved, actor, Map.of());
        return saved;
    }

    private void recordAdministration(AuditOperation operation, Policy policy, ActorIdentity actor,
            Map<String, Object> extra) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("policy_kind", policy.getKind().name());
        metadata.put("severity", policy.getSeverity().name());
        metadata.putAll(extra);

        auditRecorder.recordOperation(OperationRecordRequest.builder()
            .operation(operation)
            .status(OperationStatus.SUCCESS)
            .cloneId(policy.getId())
            .cloneName(policy.getName())
            .cloneType("POLICY")
            .scope(policy.getScope())
            .actor(actor)
            .metadata(metadata)
            .build());
    }

    private static String normalizeScope(String scope) {
        return scope == null || scope.isBlank() ? null : scope.trim();
    }

    /**
     * Outcome of {@link #setupDefaultPolicies(ActorIdentity)}.
     */
    public record DefaultPoliciesResult(List<String> created, List<String> alreadyPresent) {

        public int count() {
            return created.size();
        }
    }
}
