package com.eainde.forecast.extraction;

import com.eainde.forecast.model.ExtractedMetric;
import com.eainde.forecast.model.ExtractionStrategyType;

import java.util.List;
import java.util.Optional;

/**
 * Result of running the chain over one document.
 *
 * @param documentId         document processed
 * @param metrics            metrics of the winning strategy, empty when every strategy came up empty
 * @param attempted          strategies tried, in order
 * @param winner             first strategy with a non-empty result
 * @param failures           reasons for strategies that threw, and for an unreadable text layer
 */
public record ExtractionOutcome(
        String documentId,
        List<ExtractedMetric> metrics,
        List<ExtractionStrategyType> attempted,
        Optional<ExtractionStrategyType> winner,
        List<String> failures
) {

    public ExtractionOutcome {
        metrics = List.copyOf(metrics);
        attempted = List.copyOf(attempted);
        failures = List.copyOf(failures);
    }

    public boolean isEmpty() {
        return metrics.isEmpty();
    }

    public String describeFailure() {
        StringBuilder sb = new StringBuilder("no metrics after ").append(attempted);
        if (!failures.isEmpty()) {
            sb.append("; ").append(String.join("; ", failures));
        }
        return sb.toString();
    }
}
