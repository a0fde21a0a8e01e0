package com.eainde.forecast.synthesis;

import com.eainde.forecast.model.Citation;
import com.eainde.forecast.model.CitationType;
import com.eainde.forecast.model.ExtractedMetric;
import com.eainde.forecast.model.ExtractionGap;
import com.eainde.forecast.model.ExtractionStrategyType;
import com.eainde.forecast.model.ForecastResult;
import com.eainde.forecast.model.QualitativeInsight;
import com.eainde.forecast.model.ReportingPeriod;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

class ForecastSynthesizerTest {

    private static final Instant NOW = Instant.parse("2025-10-01T00:00:00Z");
    private static final ReportingPeriod Q1 = ReportingPeriod.of(2025, 1);
    private static final ReportingPeriod Q2 = ReportingPeriod.of(2025, 2);

    private final ForecastSynthesizer synthesizer = new ForecastSynthesizer();

    private static ForecastNarrative narrative() {
        return new ForecastNarrative("Growth should continue into the next quarter.", List.of("deals"),
                "confident", List.of("attrition"), List.of("large deal pipeline"));
    }

    private static SynthesisInput input(List<ExtractedMetric> metrics, List<QualitativeInsight> insights,
                                        List<ExtractionGap> gaps) {
        return new SynthesisInput("run-1", "TCS", 2, metrics, insights, gaps, narrative(), NOW);
    }

    private static ExtractedMetric metric(String name, double value, double confidence, String doc, ReportingPeriod p) {
        return new ExtractedMetric(name, value, "INR_Cr", confidence, ExtractionStrategyType.TABLE, doc, p, name);
    }

    private static QualitativeInsight insight(String theme, double sentiment, double confidence, String doc) {
        return new QualitativeInsight(theme, sentiment, "quote about " + theme, confidence, 0.8, 2, doc);
    }

    @Test
    void synthesize_shouldUseReconciledMetricsAndCiteEachOne() {
        // Arrange
        List<ExtractedMetric> metrics = List.of(
                metric("total_revenue", 100, 0.95, "r-q1", Q1),
                metric("total_revenue", 110, 0.95, "r-q2", Q2),
                metric("net_profit", 20, 0.75, "r-q2", Q2));

        // Act
        ForecastResult result = synthesizer.synthesize(input(metrics, List.of(), List.of()));

        // Assert
        assertThat(result.metrics()).containsOnlyKeys("net_profit", "total_revenue");
        assertThat(result.metrics().get("total_revenue").value()).isEqualTo(110);
        assertThat(result.metrics().get("total_revenue").period()).isEqualTo("Q2 FY2025");
        assertThat(result.evidence()).filteredOn(c -> c.type() == CitationType.METRIC)
                .extracting(Citation::subject, Citation::sourceDocumentId)
                .containsExactly(tuple("net_profit", "r-q2"),
                        tuple("total_revenue", "r-q2"));
        assertThat(result.confidenceScores().metrics()).isCloseTo(0.85, within(1e-9));
        assertThat(result.quartersAnalyzed()).isEqualTo(2);
        assertThat(result.generatedAt()).isEqualTo(NOW);
    }

    @Test
    void synthesize_shouldRankThemesAndWeightSentimentByConfidence() {
        // Arrange
        List<QualitativeInsight> insights = List.of(
                insight("attrition", -0.5, 0.2, "t-1"),
                insight("deals", 0.8, 0.6, "t-1"),
                insight("deals", 0.4, 0.3, "t-2"));

        // Act
        ForecastResult result = synthesizer.synthesize(input(List.of(), insights, List.of()));

        // Assert
        assertThat(result.qualitative().keyThemes()).containsExactly("deals", "attrition");
        double expected = (0.2 * -0.5 + 0.6 * 0.8 + 0.3 * 0.4) / (0.2 + 0.6 + 0.3);
        assertThat(result.qualitative().sentiment().score()).isCloseTo(expected, within(1e-9));
        assertThat(result.qualitative().sentiment().label()).isEqualTo(SentimentLabel.of(expected));
        assertThat(result.evidence()).filteredOn(c -> c.type() == CitationType.THEME)
                .extracting(Citation::subject, Citation::sourceDocumentId)
                .containsExactly(tuple("deals", "t-1"),
                        tuple("deals", "t-2"),
                        tuple("attrition", "t-1"));
    }

    @Test
    void synthesize_shouldTakeOnlyProseFromTheNarrative() {
        // Act
        ForecastResult result = synthesizer.synthesize(input(List.of(), List.of(), List.of()));

        // Assert
        assertThat(result.qualitative().outlook()).isEqualTo("Growth should continue into the next quarter.");
        assertThat(result.qualitative().risks()).containsExactly("attrition");
        assertThat(result.qualitative().opportunities()).containsExactly("large deal pipeline");
        assertThat(result.qualitative().keyThemes()).isEmpty();
        assertThat(result.qualitative().sentiment().label()).isEqualTo(SentimentLabel.NEUTRAL);
        assertThat(result.confidenceScores().analysis()).isZero();
        assertThat(result.confidenceScores().metrics()).isZero();
    }

    @Test
    void synthesize_shouldFlagOutOfBoundsMetricWithoutDroppingIt() {
        // Arrange
        ExtractedMetric margin = new ExtractedMetric("operating_margin", 240, "%", 0.75,
                ExtractionStrategyType.STRUCTURED_TEXT, "r-q2", Q2, "Operating margin");

        // Act
        ForecastResult result = synthesizer.synthesize(input(List.of(margin), List.of(), List.of()));

        // Assert
        assertThat(result.metrics()).containsKey("operating_margin");
        assertThat(result.evidence()).filteredOn(c -> c.type() == CitationType.ANOMALY)
                .singleElement()
                .satisfies(c -> {
                    assertThat(c.subject()).isEqualTo("operating_margin");
                    assertThat(c.detail()).contains("outside [-100, 100]");
                });
    }

    @Test
    void synthesize_shouldCiteGaps() {
        // Arrange
        ExtractionGap gap = new ExtractionGap(ExtractionGap.Stage.EXTRACTION, "r-q1", "no metrics found");

        // Act
        ForecastResult result = synthesizer.synthesize(input(List.of(), List.of(), List.of(gap)));

        // Assert
        assertThat(result.evidence()).containsExactly(Citation.gap(gap));
    }

    @Test
    void synthesize_shouldBeDeterministic() {
        // Arrange
        SynthesisInput in = input(
                List.of(metric("total_revenue", 110, 0.95, "r-q2", Q2)),
                List.of(insight("deals", 0.5, 0.5, "t-1")),
                List.of());

        // Act + Assert
        assertThat(synthesizer.synthesize(in)).isEqualTo(synthesizer.synthesize(in));
    }

    @Test
    void analysisConfidence_shouldBeCohesionWeightedMean() {
        // Arrange
        List<QualitativeInsight> insights = List.of(
                new QualitativeInsight("a", 0, "q", 0.9, 0.5, 1, "t"),
                new QualitativeInsight("b", 0, "q", 0.3, 1.0, 1, "t"));

        // Act + Assert
        assertThat(ForecastSynthesizer.analysisConfidence(insights))
                .isCloseTo((0.5 * 0.9 + 1.0 * 0.3) / 1.5, within(1e-9));
    }
}
