package com.eainde.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single numeric metric pulled out of a report by one extraction strategy.
 *
 * @param name             canonical metric name (e.g. {@code total_revenue})
 * @param value            normalised value (crore for money, percent for margins)
 * @param unit             unit of {@code value}
 * @param confidence       [0,1], clamped at construction
 * @param strategy         strategy that produced the value
 * @param sourceDocumentId document the value was read from
 * @param period           reporting period of that document
 * @param label            label as it appeared in the document
 */
public record ExtractedMetric(
        @JsonProperty("name")               String name,
        @JsonProperty("value")              double value,
        @JsonProperty("unit")               String unit,
        @JsonProperty("confidence")         double confidence,
        @JsonProperty("strategy")           ExtractionStrategyType strategy,
        @JsonProperty("source_document_id") String sourceDocumentId,
        @JsonProperty("period")             ReportingPeriod period,
        @JsonProperty("label")              String label
) {

    public ExtractedMetric {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(strategy, "strategy");
        if (sourceDocumentId == null || sourceDocumentId.isBlank()) {
            throw new IllegalArgumentException("metric '" + name + "' has no source document");
        }
        confidence = Confidence.clamp(confidence);
        period = period == null ? ReportingPeriod.UNKNOWN : period;
        label = label == null ? name : label;
    }

    public ExtractedMetric withStrategy(ExtractionStrategyType newStrategy, double newConfidence) {
        return new ExtractedMetric(name, value, unit, newConfidence, newStrategy, sourceDocumentId, period, label);
    }
}
