package com.eainde.forecast.graph.nodes;

import com.eainde.forecast.context.RunContext;
import com.eainde.forecast.error.ErrorKind;
import com.eainde.forecast.error.ForecastException;
import com.eainde.forecast.graph.ForecastState;
import com.eainde.forecast.llm.ResilientModelClient;
import com.eainde.forecast.model.RunState;
import com.eainde.forecast.model.TraceEntryType;
import com.eainde.forecast.synthesis.ForecastNarrative;
import com.eainde.forecast.synthesis.MalformedNarrativeException;
import com.eainde.forecast.synthesis.SynthesisPromptBuilder;
import com.eainde.forecast.synthesis.SynthesisResponseParser;
import lombok.extern.log4j.Log4j2;

/**
 * Asks the model for the narrative JSON. Unparseable output is sent back with a request to
 * fix the format, at most {@code maxRecoveries} times. Only one synthesis call is in flight
 * per run.
 */
@Log4j2
public class SynthesizingNode extends RunNode {

    static final String STEP = RunState.SYNTHESIZING.nodeId();

    private final ResilientModelClient modelClient;
    private final SynthesisPromptBuilder promptBuilder;
    private final SynthesisResponseParser parser;
    private final int maxRecoveries;

    public SynthesizingNode(RunContext ctx, ResilientModelClient modelClient, SynthesisPromptBuilder promptBuilder,
                            SynthesisResponseParser parser, int maxRecoveries) {
        super(ctx);
        this.modelClient = modelClient;
        this.promptBuilder = promptBuilder;
        this.parser = parser;
        this.maxRecoveries = maxRecoveries;
    }

    @Override
    protected String step(ForecastState state) {
        boolean revision = !ctx.validationFeedback().isEmpty();
        ctx.transitionTo(RunState.SYNTHESIZING, revision
                ? "validation feedback (" + ctx.validationFeedback().size() + " issue(s))"
                : ctx.insights().size() + " insight(s) from analysis");

        if (!ctx.beginSynthesis()) {
            throw new IllegalStateException("Synthesis already in flight for run " + ctx.runId());
        }
        try {
            String prompt = promptBuilder.synthesisPrompt(ctx.request().ticker(), ctx.request().quarterCount(),
                    ctx.metrics(), ctx.insights(), ctx.gaps(), ctx.validationFeedback());
            String raw = modelClient.complete(ctx, STEP, prompt);

            int attempts = maxRecoveries + 1;
            for (int attempt = 1; ; attempt++) {
                try {
                    ForecastNarrative narrative = parser.parse(raw);
                    ctx.trace().append(TraceEntryType.SYNTHESIS_ATTEMPT, STEP, attempt, "OK",
                            narrative.keyThemes().size() + " theme(s) named");
                    ctx.acceptNarrative(narrative, raw);
                    return RunState.VALIDATING.nodeId();
                } catch (MalformedNarrativeException e) {
                    ctx.trace().append(TraceEntryType.SYNTHESIS_ATTEMPT, STEP, attempt, "MALFORMED", e.getMessage());
                    if (attempt >= attempts) {
                        throw new ForecastException(ErrorKind.SYNTHESIS_FAILED, RunState.SYNTHESIZING, attempt,
                                "Model output could not be parsed after " + attempt + " attempt(s)");
                    }
                    log.warn("Synthesis attempt {}/{} unusable: {}", attempt, attempts, e.getMessage());
                    ctx.checkBudget();
                    raw = modelClient.complete(ctx, STEP, promptBuilder.recoveryPrompt(prompt, raw, e.getMessage()));
                }
            }
        } finally {
            ctx.endSynthesis();
        }
    }
}
