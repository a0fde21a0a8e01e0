package com.eainde.forecast.tool;

import com.eainde.forecast.context.RunContext;
import com.eainde.forecast.extraction.ExtractionOutcome;
import com.eainde.forecast.model.ExtractedMetric;
import com.eainde.forecast.model.SourceDocument;

import java.util.List;

/**
 * Pulls numeric metrics out of a report. Only throws when the run's budget runs out; an empty
 * list means nothing usable.
 */
public interface ExtractionTool extends ForecastTool {

    List<ExtractedMetric> extract(RunContext ctx, SourceDocument document);

    ExtractionOutcome extractDetailed(RunContext ctx, SourceDocument document);
}
