package com.eainde.forecast.synthesis;

import com.eainde.forecast.model.ExtractedMetric;
import com.eainde.forecast.model.ExtractionGap;
import com.eainde.forecast.model.QualitativeInsight;

import java.time.Instant;
import java.util.List;

/**
 * Everything the synthesizer needs from a run.
 */
public record SynthesisInput(
        String runId,
        String ticker,
        int quartersAnalyzed,
        List<ExtractedMetric> metrics,
        List<QualitativeInsight> insights,
        List<ExtractionGap> gaps,
        ForecastNarrative narrative,
        Instant generatedAt
) {

    public SynthesisInput {
        metrics = List.copyOf(metrics);
        insights = List.copyOf(insights);
        gaps = List.copyOf(gaps);
    }
}
