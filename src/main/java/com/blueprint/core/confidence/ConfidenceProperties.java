package com.blueprint.core.confidence;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Constants of the answered/total confidence formula.
 */
@Component
@ConfigurationProperties(prefix = "blueprint.confidence")
public class ConfidenceProperties {

    /** Returned when a session has no questions at all. */
    private double defaultConfidence = 0.5;
    private double baseConfidence = 0.3;
    /** Added on top of the base when every question is answered. */
    private double incrementPerAnswer = 0.6;
    private double maxConfidence = 0.9;

    public double getDefaultConfidence() {
        return defaultConfidence;
    }

    public void setDefaultConfidence(double defaultConfidence) {
        this.defaultConfidence = defaultConfidence;
    }

    public double getBaseConfidence() {
        return baseConfidence;
    }

    public void setBaseConfidence(double baseConfidence) {
        this.baseConfidence = baseConfidence;
    }

    public double getIncrementPerAnswer() {
        return incrementPerAnswer;
    }

    public void setIncrementPerAnswer(double incrementPerAnswer) {
        this.incrementPerAnswer = incrementPerAnswer;
    }

    public double getMaxConfidence() {
        return maxConfidence;
    }

    public void setMaxConfidence(double maxConfidence) {
        this.maxConfidence = maxConfidence;
    }
}
