package com.eainde.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Terminal output of a successful run. Built once by the synthesizer, validated, never mutated.
 */
@JsonPropertyOrder({"run_id", "ticker", "generated_at", "quarters_analyzed", "metrics",
        "qualitative", "confidence_scores", "evidence"})
public record ForecastResult(
        @JsonProperty("run_id")            String runId,
        @JsonProperty("ticker")            String ticker,
        @JsonProperty("generated_at")      Instant generatedAt,
        @JsonProperty("quarters_analyzed") int quartersAnalyzed,
        @JsonProperty("metrics")           Map<String, MetricValue> metrics,
        @JsonProperty("qualitative")       Qualitative qualitative,
        @JsonProperty("confidence_scores") ConfidenceScores confidenceScores,
        @JsonProperty("evidence")          List<Citation> evidence
) {

    public ForecastResult {
        metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        evidence = List.copyOf(evidence);
    }

    public record MetricValue(
            @JsonProperty("value")              double value,
            @JsonProperty("unit")               String unit,
            @JsonProperty("confidence")         double confidence,
            @JsonProperty("period")             String period,
            @JsonProperty("source_document_id") String sourceDocumentId,
            @JsonProperty("strategy")           ExtractionStrategyType strategy
    ) {
        public static MetricValue from(ExtractedMetric metric) {
            return new MetricValue(metric.value(), metric.unit(), metric.confidence(),
                    metric.period().label(), metric.sourceDocumentId(), metric.strategy());
        }
    }

    public record Qualitative(
            @JsonProperty("outlook")       String outlook,
            @JsonProperty("key_themes")    List<String> keyThemes,
            @JsonProperty("sentiment")     SentimentSummary sentiment,
            @JsonProperty("risks")         List<String> risks,
            @JsonProperty("opportunities") List<String> opportunities
    ) {
        public Qualitative {
            keyThemes = List.copyOf(keyThemes);
            risks = List.copyOf(risks);
            opportunities = List.copyOf(opportunities);
        }
    }

    public record SentimentSummary(
            @JsonProperty("score") double score,
            @JsonProperty("label") String label
    ) {
    }

    public record ConfidenceScores(
            @JsonProperty("metrics")  double metrics,
            @JsonProperty("analysis") double analysis
    ) {
    }
}
