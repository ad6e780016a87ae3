package com.platform.clonegovernance.api;

import com.platform.clonegovernance.audit.AccessRecord;
import com.platform.clonegovernance.audit.AuditOperation;
import com.platform.clonegovernance.audit.AuditQuery;
import com.platform.clonegovernance.audit.AuditQueryService;
import com.platform.clonegovernance.audit.AuditRecord;
import com.platform.clonegovernance.audit.AuditRecorder;
import com.platform.clonegovernance.audit.OperationStatus;
import com.platform.clonegovernance.audit.RecordingResult;
import com.platform.clonegovernance.security.ValidatedRequests.RecordAccessRequest;
import com.platform.clonegovernance.security.ValidatedRequests.RecordOperationRequest;
import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * Recording and querying of governed operations and clone accesses.
 *
 * Recording endpoints always answer 200; whether the record was written is in the body.
 */
@RestController
@RequestMapping("/api/audit")
@AllArgsConstructor
public class AuditController {

    private final AuditRecorder auditRecorder;
    private final AuditQueryService auditQueryService;

    @PostMapping("/operations")
    public RecordingResult recordOperation(@Valid @RequestBody RecordOperationRequest request) {
        return auditRecorder.recordOperation(request.toRecordRequest());
    }

    @PostMapping("/access")
    public RecordingResult recordAccess(@Valid @RequestBody RecordAccessRequest request) {
        return auditRecorder.recordAccess(request.toRecordRequest());
    }

    @GetMapping("/operations")
    public List<AuditRecord> findOperations(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(required = false) AuditOperation operation,
            @RequestParam(required = false) String actor,
            @RequestParam(required = false) String scope,
            @RequestParam(required = false) OperationStatus status,
            @RequestParam(required = false) Integer limit) {
        return auditQueryService.findOperations(AuditQuery.builder()
            .from(from)
            .to(to)
            .operation(operation)
            .actor(actor)
            .scope(scope)
            .status(status)
            .limit(limit)
            .build());
    }

    @GetMapping("/access")
    public List<AccessRecord> findAccess(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(required = false) String actor,
            @RequestParam(required = false) String cloneId,
            @RequestParam(required = false) Integer limit) {
        return auditQueryService.findAccess(AuditQuery.builder()
            .from(from)
            .to(to)
            .actor(actor)
            .cloneId(cloneId)
            .limit(limit)
            .build());
    }
}
