package com.platform.clonegovernance.api;

import com.platform.clonegovernance.policy.PolicySeverity;
import com.platform.clonegovernance.security.ValidatedRequests.ResolveViolationRequest;
import com.platform.clonegovernance.violation.Violation;
import com.platform.clonegovernance.violation.ViolationCommandResult;
import com.platform.clonegovernance.violation.ViolationService;
import com.platform.clonegovernance.violation.ViolationStatus;
import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * REST API for policy violations.
 */
@RestController
@RequestMapping("/api/violations")
@AllArgsConstructor
public class ViolationController {

    private final ViolationService violationService;

    /**
     * Violations in a time window, most severe first.
     */
    @GetMapping
    public List<Violation> findViolations(
            @RequestParam(required = false) ViolationStatus status,
            @RequestParam(required = false) PolicySeverity severity,
            @RequestParam(required = false) String actor,
            @RequestParam(required = false) String policyName,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(required = false) Integer limit) {
        return violationService.findViolations(
            new ViolationService.ViolationQuery(from, to, status, severity, actor, policyName, limit));
    }

    @PostMapping("/{id}/resolve")
    public ResponseEntity<ViolationCommandResult> resolve(
            @PathVariable String id,
            @Valid @RequestBody ResolveViolationRequest request) {
        ViolationCommandResult result = violationService.resolveViolation(id, request.getNotes(),
            request.getActor().toIdentity());
        HttpStatus status = switch (result.status()) {
            case SUCCESS -> HttpStatus.OK;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ALREADY_RESOLVED -> HttpStatus.CONFLICT;
        };
        return ResponseEntity.status(status).body(result);
    }
}
