package com.eainde.forecast.synthesis;

import com.eainde.forecast.model.ExtractedMetric;
import com.eainde.forecast.model.ExtractionStrategyType;
import com.eainde.forecast.model.ReportingPeriod;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MetricReconcilerTest {

    private final MetricReconciler reconciler = new MetricReconciler();

    private static ExtractedMetric revenue(double value, double confidence, ExtractionStrategyType strategy,
                                           String doc, ReportingPeriod period) {
        return new ExtractedMetric("total_revenue", value, "INR_Cr", confidence, strategy, doc, period, "Revenue");
    }

    @Test
    void reconcile_shouldPreferLatestPeriod_whenConfidenceIsLower() {
        // Arrange
        ExtractedMetric older = revenue(100, 0.95, ExtractionStrategyType.TABLE, "r-q1", ReportingPeriod.of(2025, 1));
        ExtractedMetric newer = revenue(110, 0.60, ExtractionStrategyType.OCR, "r-q2", ReportingPeriod.of(2025, 2));

        // Act
        Map<String, ExtractedMetric> winners = reconciler.reconcile(List.of(older, newer));

        // Assert
        assertThat(winners.get("total_revenue")).isEqualTo(newer);
    }

    @Test
    void reconcile_shouldPreferHigherConfidence_withinSamePeriod() {
        // Arrange
        ReportingPeriod q2 = ReportingPeriod.of(2025, 2);
        ExtractedMetric text = revenue(109, 0.70, ExtractionStrategyType.STRUCTURED_TEXT, "a", q2);
        ExtractedMetric table = revenue(110, 0.95, ExtractionStrategyType.TABLE, "b", q2);

        // Act + Assert
        assertThat(reconciler.reconcile(List.of(text, table)).get("total_revenue")).isEqualTo(table);
    }

    @Test
    void reconcile_shouldBreakTiesByStrategyThenDocumentId() {
        // Arrange
        ReportingPeriod q2 = ReportingPeriod.of(2025, 2);
        ExtractedMetric ocr = revenue(1, 0.6, ExtractionStrategyType.OCR, "a", q2);
        ExtractedMetric textB = revenue(2, 0.6, ExtractionStrategyType.STRUCTURED_TEXT, "b", q2);
        ExtractedMetric textA = revenue(3, 0.6, ExtractionStrategyType.STRUCTURED_TEXT, "a", q2);

        // Act
        ExtractedMetric winner = reconciler.reconcile(List.of(ocr, textB, textA)).get("total_revenue");

        // Assert
        assertThat(winner).isEqualTo(textA);
    }

    @Test
    void reconcile_shouldBeOrderIndependentAndKeyedByName() {
        // Arrange
        ReportingPeriod q2 = ReportingPeriod.of(2025, 2);
        ExtractedMetric a = revenue(1, 0.9, ExtractionStrategyType.TABLE, "a", q2);
        ExtractedMetric b = revenue(2, 0.9, ExtractionStrategyType.TABLE, "b", q2);
        ExtractedMetric eps = new ExtractedMetric("eps", 12.5, "INR", 0.9, ExtractionStrategyType.TABLE, "a", q2, "EPS");

        // Act
        Map<String, ExtractedMetric> forward = reconciler.reconcile(List.of(a, b, eps));
        Map<String, ExtractedMetric> reverse = reconciler.reconcile(List.of(eps, b, a));

        // Assert
        assertThat(forward).isEqualTo(reverse);
        assertThat(forward.keySet()).containsExactly("eps", "total_revenue");
        assertThat(forward.get("total_revenue").sourceDocumentId()).isEqualTo("a");
    }
}
