package com.blueprint.core.breakdown;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Scheduling constants for {@link TimelineGenerator}.
 * <p>
 * The end ratios split the total days between the three phases; the task ratios split
 * the tasks, in decomposition order, between the same phases.
 */
@Component
@ConfigurationProperties(prefix = "blueprint.timeline")
public class TimelineProperties {

    private int hoursPerWeek = 40;
    private double planningEndRatio = 0.2;
    private double developmentEndRatio = 0.8;
    private double planningTaskRatio = 0.3;
    private double developmentTaskRatio = 0.8;

    public int getHoursPerWeek() {
        return hoursPerWeek;
    }

    public void setHoursPerWeek(int hoursPerWeek) {
        this.hoursPerWeek = hoursPerWeek;
    }

    public double getPlanningEndRatio() {
        return planningEndRatio;
    }

    public void setPlanningEndRatio(double planningEndRatio) {
        this.planningEndRatio = planningEndRatio;
    }

    public double getDevelopmentEndRatio() {
        return developmentEndRatio;
    }

    public void setDevelopmentEndRatio(double developmentEndRatio) {
        this.developmentEndRatio = developmentEndRatio;
    }

    public double getPlanningTaskRatio() {
        return planningTaskRatio;
    }

    public void setPlanningTaskRatio(double planningTaskRatio) {
        this.planningTaskRatio = planningTaskRatio;
    }

    public double getDevelopmentTaskRatio() {
        return developmentTaskRatio;
    }

    public void setDevelopmentTaskRatio(double developmentTaskRatio) {
        this.developmentTaskRatio = developmentTaskRatio;
    }
}
