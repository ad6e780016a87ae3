package com.platform.clonegovernance.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.platform.clonegovernance.evaluation.PolicyVerdict;

import java.util.List;

/**
 * Best-effort outcome of a recording call. Recording never throws; a failed write
 * comes back with {@code recorded == false} and the reason.
 *
 * @param recordId     audit or access record id, null when not recorded
 * @param violationIds ids of the violations stored with the record
 * @param verdict      verdict that was (or would have been) stored, never null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RecordingResult(
    boolean recorded,
    String recordId,
    List<String> violationIds,
    PolicyVerdict verdict,
    String failureReason
) {

    public RecordingResult {
        violationIds = violationIds == null ? List.of() : List.copyOf(violationIds);
        verdict = verdict == null ? PolicyVerdict.empty() : verdict;
    }

    public static RecordingResult recorded(String recordId, List<String> violationIds, PolicyVerdict verdict) {
        return new RecordingResult(true, recordId, violationIds, verdict, null);
    }

    public static RecordingResult notRecorded(String reason, PolicyVerdict verdict) {
        return new RecordingResult(false, null, List.of(), verdict, reason);
    }

    public boolean blocked() {
        return verdict.block();
    }
}
