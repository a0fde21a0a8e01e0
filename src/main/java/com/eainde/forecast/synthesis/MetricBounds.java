package com.eainde.forecast.synthesis;

import com.eainde.forecast.extraction.MetricDefinition;
import com.eainde.forecast.model.ExtractedMetric;

import java.util.Optional;

/**
 * Sanity bounds for reconciled metrics. Out-of-bounds values are flagged, never dropped.
 */
public final class MetricBounds {

    static final double MAX_PERCENT = 100.0;
    static final double MAX_EPS = 10_000.0;

    private MetricBounds() {
    }

    /**
     * @return a description of the anomaly, or empty when the value looks sane
     */
    public static Optional<String> check(ExtractedMetric metric) {
        MetricDefinition definition = MetricDefinition.byName(metric.name());
        double v = metric.value();
        if (Double.isNaN(v) || Double.isInfinite(v)) {
            return Optional.of("value is not a finite number");
        }
        if (definition == null) {
            return Optional.empty();
        }
        if (definition.isPercentage() && Math.abs(v) > MAX_PERCENT) {
            return Optional.of("percentage " + v + " outside [-100, 100]");
        }
        return switch (definition) {
            case TOTAL_REVENUE -> v < 0 ? Optional.of("negative revenue " + v) : Optional.empty();
            case DEBT_TO_EQUITY -> v < 0 ? Optional.of("negative debt to equity " + v) : Optional.empty();
            case EPS -> Math.abs(v) > MAX_EPS ? Optional.of("EPS magnitude " + v + " above " + MAX_EPS) : Optional.empty();
            default -> Optional.empty();
        };
    }
}
