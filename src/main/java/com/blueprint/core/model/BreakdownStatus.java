package com.blueprint.core.model;

/**
 * Progress of a breakdown run. Stored sessions are always {@link #COMPLETED};
 * the intermediate values are reported through events while the pipeline runs.
 */
public enum BreakdownStatus {
    ANALYZING,
    DECOMPOSING,
    SCHEDULING,
    COMPLETED,
    FAILED
}
