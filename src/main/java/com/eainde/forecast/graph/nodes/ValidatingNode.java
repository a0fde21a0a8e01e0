package com.eainde.forecast.graph.nodes;

import com.eainde.forecast.context.RunContext;
import com.eainde.forecast.error.ErrorKind;
import com.eainde.forecast.error.ForecastException;
import com.eainde.forecast.graph.ForecastState;
import com.eainde.forecast.model.DocumentKind;
import com.eainde.forecast.model.ForecastResult;
import com.eainde.forecast.model.ReportingPeriod;
import com.eainde.forecast.model.RunState;
import com.eainde.forecast.model.SourceDocument;
import com.eainde.forecast.model.TraceEntryType;
import com.eainde.forecast.synthesis.ForecastSynthesizer;
import com.eainde.forecast.synthesis.ForecastValidator;
import com.eainde.forecast.synthesis.SynthesisInput;
import com.eainde.forecast.synthesis.ValidationReport;
import lombok.extern.log4j.Log4j2;

/**
 * Assembles the forecast and validates it. The first failure goes back to synthesis with the
 * issues as feedback; any further failure ends the run.
 */
@Log4j2
public class ValidatingNode extends RunNode {

    static final String STEP = RunState.VALIDATING.nodeId();

    private final ForecastSynthesizer synthesizer;
    private final ForecastValidator validator;
    private final int maxRevisions;

    public ValidatingNode(RunContext ctx, ForecastSynthesizer synthesizer, ForecastValidator validator, int maxRevisions) {
        super(ctx);
        this.synthesizer = synthesizer;
        this.validator = validator;
        this.maxRevisions = maxRevisions;
    }

    @Override
    protected String step(ForecastState state) {
        ctx.transitionTo(RunState.VALIDATING, "narrative parsed");
        ctx.checkBudget();

        ForecastResult result = synthesizer.synthesize(new SynthesisInput(
                ctx.runId(),
                ctx.request().ticker(),
                quartersAnalyzed(),
                ctx.metrics(),
                ctx.insights(),
                ctx.gaps(),
                ctx.narrative(),
                ctx.clock().instant()));

        ValidationReport report = validator.validate(result, ctx.narrative(), ctx.insights());
        int attempt = ctx.incrementRetry(STEP);
        if (report.isValid()) {
            ctx.trace().append(TraceEntryType.VALIDATION, STEP, attempt, "OK",
                    report.anomalies().isEmpty() ? "no anomalies" : report.anomalies().size() + " anomaly flag(s)");
            ctx.complete(result);
            return RunState.DONE.nodeId();
        }

        ctx.trace().append(TraceEntryType.VALIDATION, STEP, attempt, "INVALID", String.join("; ", report.issues()));
        if (attempt > maxRevisions) {
            throw new ForecastException(ErrorKind.VALIDATION_FAILED, RunState.VALIDATING, attempt,
                    "Forecast failed validation: " + String.join("; ", report.issues()));
        }
        log.warn("Forecast failed validation ({} issue(s)), asking for a revision", report.issues().size());
        ctx.replaceValidationFeedback(report.issues());
        return RunState.SYNTHESIZING.nodeId();
    }

    private int quartersAnalyzed() {
        return (int) ctx.documents().stream()
                .filter(d -> d.kind() == DocumentKind.REPORT)
                .map(SourceDocument::period)
                .filter(ReportingPeriod::isKnown)
                .distinct()
                .count();
    }
}
