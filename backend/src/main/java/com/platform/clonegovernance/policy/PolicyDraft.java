package com.platform.clonegovernance.policy;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raw policy fields as submitted by an administrator. Kind, severity and definition
 * are parsed and validated by {@link PolicyService}.
 *
 * On update, null fields keep their current value.
 */
public record PolicyDraft(
    String name,
    String kind,
    String scope,
    JsonNode definition,
    String severity,
    String description,
    Boolean active
) {
}
