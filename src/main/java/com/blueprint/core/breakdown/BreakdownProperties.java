package com.blueprint.core.breakdown;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "blueprint.breakdown")
public class BreakdownProperties {

    /** Team size used when neither the caller nor the generator provides one. */
    private int defaultTeamSize = 1;

    /** Upper bound on the serialized size of the user responses, in characters. */
    private int maxUserResponsesSize = 5000;

    private int maxIdeaIdLength = 100;

    /** Decomposition confidence relative to the analysis confidence. */
    private double taskConfidenceMultiplier = 0.9;

    public int getDefaultTeamSize() {
        return defaultTeamSize;
    }

    public void setDefaultTeamSize(int defaultTeamSize) {
        this.defaultTeamSize = defaultTeamSize;
    }

    public int getMaxUserResponsesSize() {
        return maxUserResponsesSize;
    }

    public void setMaxUserResponsesSize(int maxUserResponsesSize) {
        this.maxUserResponsesSize = maxUserResponsesSize;
    }

    public int getMaxIdeaIdLength() {
        return maxIdeaIdLength;
    }

    public void setMaxIdeaIdLength(int maxIdeaIdLength) {
        this.maxIdeaIdLength = maxIdeaIdLength;
    }

    public double getTaskConfidenceMultiplier() {
        return taskConfidenceMultiplier;
    }

    public void setTaskConfidenceMultiplier(double taskConfidenceMultiplier) {
        this.taskConfidenceMultiplier = taskConfidenceMultiplier;
    }
}
