package com.eainde.forecast.graph.nodes;

import com.eainde.forecast.context.RunContext;
import com.eainde.forecast.error.ErrorKind;
import com.eainde.forecast.error.ForecastException;
import com.eainde.forecast.graph.ForecastState;
import com.eainde.forecast.model.DocumentKind;
import com.eainde.forecast.model.ExtractionGap;
import com.eainde.forecast.model.QualitativeInsight;
import com.eainde.forecast.model.RunState;
import com.eainde.forecast.model.SourceDocument;
import com.eainde.forecast.model.TraceEntryType;
import com.eainde.forecast.tool.AnalysisTool;
import lombok.extern.log4j.Log4j2;

import java.util.List;

/**
 * Runs the qualitative pipeline over each transcript. Failures and empty transcripts become
 * ANALYSIS gaps.
 */
@Log4j2
public class AnalyzingNode extends RunNode {

    private final AnalysisTool analysisTool;

    public AnalyzingNode(RunContext ctx, AnalysisTool analysisTool) {
        super(ctx);
        this.analysisTool = analysisTool;
    }

    @Override
    protected String step(ForecastState state) {
        List<SourceDocument> transcripts = ctx.documents().stream()
                .filter(d -> d.kind() == DocumentKind.TRANSCRIPT)
                .toList();
        ctx.transitionTo(RunState.ANALYZING, "extraction finished over " + ctx.metrics().size() + " metric(s)");

        for (SourceDocument transcript : transcripts) {
            ctx.checkBudget();
            List<QualitativeInsight> insights;
            try {
                insights = analysisTool.analyze(ctx, transcript);
            } catch (ForecastException e) {
                if (e.getKind() == ErrorKind.TIMEOUT_EXCEEDED) {
                    throw e;
                }
                log.warn("Analysis of {} gave up: {}", transcript.id(), e.getKind());
                ctx.trace().append(TraceEntryType.TOOL_CALL, analysisTool.toolName(), "FAILED", transcript.id());
                ctx.recordGap(new ExtractionGap(ExtractionGap.Stage.ANALYSIS, transcript.id(),
                        "analysis failed: " + e.getKind()));
                continue;
            } catch (RuntimeException e) {
                log.warn("Analysis of {} failed: {}", transcript.id(), e.getMessage());
                ctx.trace().append(TraceEntryType.TOOL_CALL, analysisTool.toolName(), "FAILED", transcript.id());
                ctx.recordGap(new ExtractionGap(ExtractionGap.Stage.ANALYSIS, transcript.id(),
                        "analysis failed: " + e.getClass().getSimpleName()));
                continue;
            }
            ctx.trace().append(TraceEntryType.TOOL_CALL, analysisTool.toolName(), insights.isEmpty() ? "EMPTY" : "OK",
                    transcript.id() + ": " + insights.size() + " theme(s)");
            if (insights.isEmpty()) {
                ctx.recordGap(new ExtractionGap(ExtractionGap.Stage.ANALYSIS, transcript.id(), "no themes found"));
            } else {
                ctx.addInsights(insights);
            }
        }
        return RunState.SYNTHESIZING.nodeId();
    }
}
