package com.eainde.forecast.synthesis;

import com.eainde.forecast.model.ExtractedMetric;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Picks one value per metric name: latest period, then higher confidence, then the
 * higher-priority strategy, then the lexically smaller document id.
 */
public class MetricReconciler {

    static final Comparator<ExtractedMetric> PREFERENCE = Comparator
            .comparing(ExtractedMetric::period).reversed()
            .thenComparing(Comparator.comparingDouble(ExtractedMetric::confidence).reversed())
            .thenComparingInt(m -> m.strategy().priority())
            .thenComparing(ExtractedMetric::sourceDocumentId);

    /**
     * @return winners keyed and ordered by metric name
     */
    public Map<String, ExtractedMetric> reconcile(List<ExtractedMetric> metrics) {
        Map<String, ExtractedMetric> winners = new TreeMap<>();
        for (ExtractedMetric m : metrics) {
            winners.merge(m.name(), m, (current, candidate) ->
                    PREFERENCE.compare(candidate, current) < 0 ? candidate : current);
        }
        return winners;
    }
}
