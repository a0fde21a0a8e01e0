package com.eainde.forecast.model;

/**
 * Extraction strategies in priority order, each with its confidence ceiling.
 */
public enum ExtractionStrategyType {
    TABLE(0.95, 1),
    STRUCTURED_TEXT(0.75, 2),
    OCR(0.60, 3);

    private final double confidenceCeiling;
    private final int priority;

    ExtractionStrategyType(double confidenceCeiling, int priority) {
        this.confidenceCeiling = confidenceCeiling;
        this.priority = priority;
    }

    public double confidenceCeiling() {
        return confidenceCeiling;
    }

    public int priority() {
        return priority;
    }
}
