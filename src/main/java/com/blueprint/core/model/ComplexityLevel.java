package com.blueprint.core.model;

/**
 * Coarse complexity classification derived from the numeric complexity score.
 */
public enum ComplexityLevel {
    SIMPLE,
    MEDIUM,
    COMPLEX
}
