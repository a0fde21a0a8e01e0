package com.eainde.forecast.tool;

import com.eainde.forecast.context.RunContext;
import com.eainde.forecast.model.QualitativeInsight;
import com.eainde.forecast.model.SourceDocument;

import java.util.List;

/**
 * Finds themes in an earnings-call transcript.
 */
public interface AnalysisTool extends ForecastTool {

    /**
     * @return insights ordered by confidence descending, then theme; empty when the transcript has no text
     */
    List<QualitativeInsight> analyze(RunContext ctx, SourceDocument transcript);
}
