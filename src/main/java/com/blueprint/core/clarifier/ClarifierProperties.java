package com.blueprint.core.clarifier;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "blueprint.clarifier")
public class ClarifierProperties {

    /**
     * A session becomes COMPLETE once its confidence reaches this value. With the default
     * confidence constants only a fully answered session gets there.
     */
    private double completionThreshold = 0.9;
    private int minQuestions = 1;
    private int maxQuestions = 10;
    private int maxIdeaIdLength = 100;
    private int minIdeaLength = 10;
    private int maxIdeaLength = 10000;
    private int maxAnswerLength = 5000;

    public double getCompletionThreshold() {
        return completionThreshold;
    }

    public void setCompletionThreshold(double completionThreshold) {
        this.completionThreshold = completionThreshold;
    }

    public int getMinQuestions() {
        return minQuestions;
    }

    public void setMinQuestions(int minQuestions) {
        this.minQuestions = minQuestions;
    }

    public int getMaxQuestions() {
        return maxQuestions;
    }

    public void setMaxQuestions(int maxQuestions) {
        this.maxQuestions = maxQuestions;
    }

    public int getMaxIdeaIdLength() {
        return maxIdeaIdLength;
    }

    public void setMaxIdeaIdLength(int maxIdeaIdLength) {
        this.maxIdeaIdLength = maxIdeaIdLength;
    }

    public int getMinIdeaLength() {
        return minIdeaLength;
    }

    public void setMinIdeaLength(int minIdeaLength) {
        this.minIdeaLength = minIdeaLength;
    }

    public int getMaxIdeaLength() {
        return maxIdeaLength;
    }

    public void setMaxIdeaLength(int maxIdeaLength) {
        this.maxIdeaLength = maxIdeaLength;
    }

    public int getMaxAnswerLength() {
        return maxAnswerLength;
    }

    public void setMaxAnswerLength(int maxAnswerLength) {
        this.maxAnswerLength = maxAnswerLength;
    }
}
