package com.eainde.forecast.extraction;

import com.eainde.forecast.model.ExtractedMetric;
import com.eainde.forecast.model.ExtractionStrategyType;
import com.eainde.forecast.model.SourceDocument;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects metrics for one document, keeping the first occurrence of each name.
 */
final class MetricCandidates {

    private final SourceDocument document;
    private final ExtractionStrategyType strategy;
    private final Map<String, ExtractedMetric> byName = new LinkedHashMap<>();

    MetricCandidates(SourceDocument document, ExtractionStrategyType strategy) {
        this.document = document;
        this.strategy = strategy;
    }

    boolean has(MetricDefinition definition) {
        return byName.containsKey(definition.metricName());
    }

    void offer(MetricVocabulary.LabelMatch match, String label, ParsedNumber number) {
        MetricDefinition definition = match.definition();
        if (has(definition)) {
            return;
        }
        double value = definition.kind() == MetricDefinition.Kind.MONEY ? number.inCrore() : number.value();
        double confidence = strategy.confidenceCeiling() * match.quality();
        byName.put(definition.metricName(), new ExtractedMetric(definition.metricName(), value, definition.unit(),
                confidence, strategy, document.id(), document.period(), label.strip()));
    }

    List<ExtractedMetric> toList() {
        return new ArrayList<>(byName.values());
    }

    /**
     * Whether {@code number} can stand for a metric of the given kind.
     *
     * @param strict when true a percentage metric needs an explicit percent sign
     */
    static boolean compatible(MetricDefinition definition, ParsedNumber number, boolean strict) {
        return switch (definition.kind()) {
            case PERCENT -> number.percent() || (!strict && number.scale() == ParsedNumber.Scale.NONE && !number.currency());
            case MONEY -> !number.percent();
            case PER_SHARE, RATIO -> !number.percent() && number.scale() == ParsedNumber.Scale.NONE;
        };
    }
}
