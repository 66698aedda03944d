package com.blueprint.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/clarifications/{ideaId}/answers.
 */
public record AnswerRequest(
    @JsonProperty("question_id") String questionId,
    @JsonProperty("answer") String answer
) {}
