package com.eainde.forecast.graph.nodes;

import com.eainde.forecast.context.RunContext;
import com.eainde.forecast.extraction.ExtractionOutcome;
import com.eainde.forecast.graph.ForecastState;
import com.eainde.forecast.model.DocumentKind;
import com.eainde.forecast.model.ExtractionGap;
import com.eainde.forecast.model.RunState;
import com.eainde.forecast.model.SourceDocument;
import com.eainde.forecast.model.TraceEntryType;
import com.eainde.forecast.tool.ExtractionTool;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs the extraction chain over every report in parallel and joins at a barrier.
 * A report that yields nothing becomes an EXTRACTION gap.
 */
@Log4j2
public class ExtractingNode extends RunNode {

    private final ExtractionTool extractionTool;
    private final Executor executor;

    public ExtractingNode(RunContext ctx, ExtractionTool extractionTool, Executor executor) {
        super(ctx);
        this.extractionTool = extractionTool;
        this.executor = executor;
    }

    @Override
    protected String step(ForecastState state) {
        List<SourceDocument> reports = ctx.documents().stream()
                .filter(d -> d.kind() == DocumentKind.REPORT)
                .toList();
        ctx.transitionTo(RunState.EXTRACTING, reports.size() + " report(s) gathered");
        ctx.checkBudget();

        List<CompletableFuture<ExtractionOutcome>> futures = new ArrayList<>();
        for (SourceDocument report : reports) {
            futures.add(CompletableFuture.supplyAsync(() -> extractionTool.extractDetailed(ctx, report), executor));
        }

        // joined in report order so the metric list is deterministic
        for (ExtractionOutcome outcome : Barrier.await(ctx, futures)) {
            String winner = outcome.winner().map(Enum::name).orElse("EMPTY");
            ctx.trace().append(TraceEntryType.TOOL_CALL, extractionTool.toolName(), winner,
                    outcome.documentId() + ": " + outcome.metrics().size() + " metric(s) after " + outcome.attempted());
            if (outcome.isEmpty()) {
                ctx.recordGap(new ExtractionGap(ExtractionGap.Stage.EXTRACTION, outcome.documentId(), outcome.describeFailure()));
            } else {
                ctx.addMetrics(outcome.metrics());
            }
        }
        log.info("Extracted {} metric(s) from {} report(s)", ctx.metrics().size(), reports.size());
        return RunState.ANALYZING.nodeId();
    }
}
