package com.blueprint.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/clarifications.
 */
public record StartClarificationRequest(
    @JsonProperty("idea_id") String ideaId,
    @JsonProperty("idea") String idea
) {}
