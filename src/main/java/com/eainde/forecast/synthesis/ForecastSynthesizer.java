package com.eainde.forecast.synthesis;

import com.eainde.forecast.model.Citation;
import com.eainde.forecast.model.CitationType;
import com.eainde.forecast.model.Confidence;
import com.eainde.forecast.model.ExtractedMetric;
import com.eainde.forecast.model.ExtractionGap;
import com.eainde.forecast.model.ForecastResult;
import com.eainde.forecast.model.ForecastResult.ConfidenceScores;
import com.eainde.forecast.model.ForecastResult.MetricValue;
import com.eainde.forecast.model.ForecastResult.Qualitative;
import com.eainde.forecast.model.ForecastResult.SentimentSummary;
import com.eainde.forecast.model.QualitativeInsight;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Merges tool results and the model narrative into a {@link ForecastResult}. Deterministic:
 * the same input always yields the same result.
 *
 * <p>Only the outlook, risks and opportunities come from the model. Metrics, themes,
 * sentiment and confidence are computed from cited tool output.</p>
 */
@Log4j2
@RequiredArgsConstructor
public class ForecastSynthesizer {

    private final MetricReconciler reconciler;

    public ForecastSynthesizer() {
        this(new MetricReconciler());
    }

    public ForecastResult synthesize(SynthesisInput input) {
        Map<String, ExtractedMetric> winners = reconciler.reconcile(input.metrics());

        Map<String, MetricValue> metrics = new LinkedHashMap<>();
        List<Citation> evidence = new ArrayList<>();
        for (ExtractedMetric m : winners.values()) {
            metrics.put(m.name(), MetricValue.from(m));
            evidence.add(Citation.metric(m));
        }

        List<String> keyThemes = keyThemes(input.insights());
        for (String theme : keyThemes) {
            input.insights().stream()
                    .filter(i -> i.theme().equals(theme))
                    .sorted(Comparator.comparingDouble(QualitativeInsight::confidence).reversed()
                            .thenComparing(QualitativeInsight::sourceDocumentId))
                    .forEach(i -> evidence.add(Citation.theme(i)));
        }

        for (ExtractionGap gap : input.gaps()) {
            evidence.add(Citation.gap(gap));
        }

        for (ExtractedMetric m : winners.values()) {
            Optional<String> anomaly = MetricBounds.check(m);
            if (anomaly.isPresent()) {
                log.warn("Run {} metric {} flagged: {}", input.runId(), m.name(), anomaly.get());
                evidence.add(new Citation(CitationType.ANOMALY, m.name(), m.sourceDocumentId(), anomaly.get()));
            }
        }

        double sentimentScore = sentimentScore(input.insights());
        ForecastNarrative narrative = input.narrative();
        Qualitative qualitative = new Qualitative(
                narrative.outlook(),
                keyThemes,
                new SentimentSummary(sentimentScore, SentimentLabel.of(sentimentScore)),
                narrative.risks(),
                narrative.opportunities());

        ConfidenceScores scores = new ConfidenceScores(
                metricsConfidence(winners.values()),
                analysisConfidence(input.insights()));

        return new ForecastResult(input.runId(), input.ticker(), input.generatedAt(), input.quartersAnalyzed(),
                metrics, qualitative, scores, evidence);
    }

    /**
     * Distinct themes, best insight confidence first, then alphabetical.
     */
    static List<String> keyThemes(List<QualitativeInsight> insights) {
        Map<String, Double> best = new LinkedHashMap<>();
        for (QualitativeInsight i : insights) {
            best.merge(i.theme(), i.confidence(), Math::max);
        }
        return best.entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue().reversed()
                        .thenComparing(Map.Entry.<String, Double>comparingByKey()))
                .map(Map.Entry::getKey)
                .toList();
    }

    static double metricsConfidence(Iterable<ExtractedMetric> used) {
        double sum = 0;
        int n = 0;
        for (ExtractedMetric m : used) {
            sum += m.confidence();
            n++;
        }
        return n == 0 ? 0.0 : Confidence.clamp(sum / n);
    }

    static double analysisConfidence(List<QualitativeInsight> insights) {
        double weighted = 0;
        double cohesion = 0;
        for (QualitativeInsight i : insights) {
            weighted += i.cohesion() * i.confidence();
            cohesion += i.cohesion();
        }
        return cohesion == 0 ? 0.0 : Confidence.clamp(weighted / cohesion);
    }

    static double sentimentScore(List<QualitativeInsight> insights) {
        double weighted = 0;
        double total = 0;
        for (QualitativeInsight i : insights) {
            weighted += i.confidence() * i.sentiment();
            total += i.confidence();
        }
        return total == 0 ? 0.0 : Confidence.clampSigned(weighted / total);
    }
}
