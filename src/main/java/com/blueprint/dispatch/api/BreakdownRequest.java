package com.blueprint.dispatch.api;

import com.blueprint.core.model.BreakdownOptions;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/breakdowns.
 *
 * @param ideaId        the idea to break down
 * @param refinedIdea   idea text; nullable, in which case the idea's clarification session supplies it
 * @param userResponses clarification answers keyed by question id; nullable
 * @param options       planning hints; nullable
 */
public record BreakdownRequest(
    @JsonProperty("idea_id") String ideaId,
    @JsonProperty("refined_idea") String refinedIdea,
    @JsonProperty("user_responses") Map<String, String> userResponses,
    @JsonProperty("options") Options options
) {

    public record Options(
        @JsonProperty("complexity") String complexity,
        @JsonProperty("team_size") Integer teamSize,
        @JsonProperty("timeline_weeks") Integer timelineWeeks,
        @JsonProperty("constraints") List<String> constraints
    ) {}

    public BreakdownOptions toOptions() {
        if (options == null) {
            return BreakdownOptions.defaults();
        }
        return new BreakdownOptions(options.complexity(), options.teamSize(),
                options.timelineWeeks(), options.constraints());
    }
}
