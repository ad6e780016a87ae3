package com.platform.clonegovernance.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.platform.clonegovernance.policy.Policy;
import com.platform.clonegovernance.policy.PolicyCommandResult;
import com.platform.clonegovernance.policy.PolicyDefinitionCodec;
import com.platform.clonegovernance.policy.PolicyKind;
import com.platform.clonegovernance.policy.PolicySeverity;
import com.platform.clonegovernance.policy.PolicyService;
import com.platform.clonegovernance.security.SafeString;
import com.platform.clonegovernance.security.ValidatedRequests.CreatePolicyRequest;
import com.platform.clonegovernance.security.ValidatedRequests.UpdatePolicyRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * REST API for policy administration.
 */
@RestController
@RequestMapping("/api/policies")
@Validated
@AllArgsConstructor
public class PolicyController {

    private final PolicyService policyService;
    private final PolicyDefinitionCodec definitionCodec;

    @PostMapping
    public ResponseEntity<PolicyResponse> createPolicy(
            @RequestHeader(ApiHeaders.ACTOR) @NotBlank @SafeString(maxLength = 100, identifier = true) String actor,
            @RequestHeader(value = ApiHeaders.ACTOR_ROLE, required = false) String role,
            @Valid @RequestBody CreatePolicyRequest request) {
        Policy created = policyService.createPolicy(request.toDraft(), ApiHeaders.actor(actor, role));
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(created));
    }

    /**
     * Policies, most severe first.
     */
    @GetMapping
    public List<PolicyResponse> listPolicies(
            @RequestParam(required = false) String scope,
            @RequestParam(required = false) String kind,
            @RequestParam(defaultValue = "false") boolean activeOnly) {
        return policyService.listPolicies(scope, kind, activeOnly).stream()
            .map(this::toResponse)
            .toList();
    }

    @GetMapping("/{id}")
    public PolicyResponse getPolicy(@PathVariable String id) {
        return toResponse(policyService.getPolicy(id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<PolicyCommandResponse> updatePolicy(
            @PathVariable String id,
            @RequestHeader(ApiHeaders.ACTOR) @NotBlank @SafeString(maxLength = 100, identifier = true) String actor,
            @RequestHeader(value = ApiHeaders.ACTOR_ROLE, required = false) String role,
            @Valid @RequestBody UpdatePolicyRequest request) {
        return toResponse(policyService.updatePolicy(id, request.toDraft(), ApiHeaders.actor(actor, role)));
    }

    @PatchMapping("/{id}/active")
    public ResponseEntity<PolicyCommandResponse> setActive(
            @PathVariable String id,
            @RequestParam boolean active,
            @RequestHeader(ApiHeaders.ACTOR) @NotBlank @SafeString(maxLength = 100, identifier = true) String actor,
            @RequestHeader(value = ApiHeaders.ACTOR_ROLE, required = false) String role) {
        return toResponse(policyService.setPolicyActive(id, active, ApiHeaders.actor(actor, role)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<PolicyCommandResponse> deletePolicy(
            @PathVariable String id,
            @RequestHeader(ApiHeaders.ACTOR) @NotBlank @SafeString(maxLength = 100, identifier = true) String actor,
            @RequestHeader(value = ApiHeaders.ACTOR_ROLE, required = false) String role) {
        return toResponse(policyService.deletePolicy(id, ApiHeaders.actor(actor, role)));
    }

    /**
     * Install the baseline policies. Existing names are left alone.
     */
    @PostMapping("/defaults")
    public PolicyService.DefaultPoliciesResult setupDefaults(
            @RequestHeader(ApiHeaders.ACTOR) @NotBlank @SafeString(maxLength = 100, identifier = true) String actor,
            @RequestHeader(value = ApiHeaders.ACTOR_ROLE, required = false) String role) {
        return policyService.setupDefaultPolicies(ApiHeaders.actor(actor, role));
    }

    private ResponseEntity<PolicyCommandResponse> toResponse(PolicyCommandResult result) {
        PolicyCommandResponse body = new PolicyCommandResponse(
            result.status(),
            result.policyId(),
            result.policyName(),
            result.message(),
            result.policy() != null ? toResponse(result.policy()) : null);
        HttpStatus status = result.isSuccess() ? HttpStatus.OK : HttpStatus.NOT_FOUND;
        return ResponseEntity.status(status).body(body);
    }

    private PolicyResponse toResponse(Policy policy) {
        return new PolicyResponse(
            policy.getId(),
            policy.getName(),
            policy.getKind(),
            policy.getScope(),
            definitionCodec.encode(policy.getDefinition()),
            policy.getDefinition().describe(),
            policy.getSeverity(),
            policy.isActive(),
            policy.getDescription(),
            policy.getCreatedBy(),
            policy.getCreatedAt(),
            policy.getUpdatedBy(),
            policy.getUpdatedAt()
        );
    }

    // DTOs

    public record PolicyResponse(
        String id,
        String name,
        PolicyKind kind,
        String scope,
        JsonNode definition,
        String summary,
        PolicySeverity severity,
        boolean active,
        String description,
        String createdBy,
        Instant createdAt,
        String updatedBy,
        Instant updatedAt
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record PolicyCommandResponse(
        PolicyCommandResult.CommandStatus status,
        String policyId,
        String policyName,
        String message,
        PolicyResponse policy
    ) {}
}
