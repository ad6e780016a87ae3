package com.platform.clonegovernance.observability;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.Builder;
import lombok.Value;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.Map;

/**
 * One governance event, written as a single snake_case JSON line.
 *
 * {@code ts}, {@code service}, {@code environment}, {@code event} and {@code actor} are
 * always present. The trace id comes from MDC on request threads and is absent on
 * scheduled jobs.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StructuredLogEvent {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .findAndAddModules()
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .build();

    Instant ts;
    String service;
    String environment;
    LogEventType event;
    String actor;
    String traceId;

    String policyId;
    String policyName;
    String cloneName;
    String scope;
    String operation;
    String auditId;
    String violationId;

    /**
     * SUCCESS, BLOCKED, FAILED or CANCELLED, depending on the event.
     */
    String outcome;
    Long durationMs;
    String errorCode;
    String error;
    String message;

    Map<String, Object> details;

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            return "{\"event\":\"" + event + "\",\"error\":\"unserializable event\"}";
        }
    }

    /**
     * Builder pre-filled with the mandatory fields.
     */
    public static StructuredLogEventBuilder of(String service, String environment, LogEventType event,
            String actor) {
        return StructuredLogEvent.builder()
            .ts(Instant.now())
            .service(service)
            .environment(environment)
            .event(event)
            .actor(actor)
            .traceId(MDC.get(LoggingConfig.TRACE_ID_KEY));
    }
}
