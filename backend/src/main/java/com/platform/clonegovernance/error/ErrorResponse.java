package com.platform.clonegovernance.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Body of every error returned by the governance API.
 *
 * @param code    stable {@code CG-xxx} code from {@link ErrorCode}
 * @param fatal   true when retrying the same request cannot succeed
 * @param traceId correlation id, also present in the server log lines for this request
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    String code,
    String message,
    String detail,
    boolean fatal,
    int status,
    Instant timestamp,
    String path,
    String traceId,
    List<FieldError> fieldErrors,
    Map<String, Object> metadata
) {

    @Builder
    public record FieldError(String field, String message, Object rejectedValue) {
    }
}
