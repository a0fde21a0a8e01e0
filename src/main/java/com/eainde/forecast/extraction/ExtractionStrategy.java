package com.eainde.forecast.extraction;

import com.eainde.forecast.context.RunContext;
import com.eainde.forecast.model.ExtractedMetric;
import com.eainde.forecast.model.ExtractionStrategyType;
import com.eainde.forecast.model.SourceDocument;

import java.util.List;

/**
 * One way of pulling metrics out of a report. Implementations are stateless, and deterministic for
 * the same document text.
 */
public interface ExtractionStrategy {

    ExtractionStrategyType type();

    /**
     * @param ctx run the extraction belongs to
     * @return metrics found, at most one per metric name, in order of appearance; empty when none
     */
    List<ExtractedMetric> extract(RunContext ctx, SourceDocument document, DocumentText text);
}
