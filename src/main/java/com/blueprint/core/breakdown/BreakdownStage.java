package com.blueprint.core.breakdown;

import com.blueprint.core.model.BreakdownStatus;

/**
 * The four sequential stages of a breakdown run, with the status reported while each runs.
 */
public enum BreakdownStage {
    ANALYSIS("analysis", BreakdownStatus.ANALYZING),
    DECOMPOSITION("decomposition", BreakdownStatus.DECOMPOSING),
    DEPENDENCIES("dependencies", BreakdownStatus.SCHEDULING),
    TIMELINE("timeline", BreakdownStatus.SCHEDULING);

    private final String label;
    private final BreakdownStatus status;

    BreakdownStage(String label, BreakdownStatus status) {
        this.label = label;
        this.status = status;
    }

    public String label() {
        return label;
    }

    public BreakdownStatus status() {
        return status;
    }
}
