package com.eainde.forecast.graph.nodes;

import com.eainde.forecast.context.RunContext;
import com.eainde.forecast.error.ForecastException;
import com.eainde.forecast.graph.ForecastState;
import com.eainde.forecast.model.RunState;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.StateGraph;

@Log4j2
public class FailedNode extends RunNode {

    public FailedNode(RunContext ctx) {
        super(ctx);
    }

    @Override
    protected String step(ForecastState state) {
        ForecastException failure = ctx.failure();
        String reason = failure == null ? "unknown" : failure.getKind() + " in " + failure.getState();
        ctx.transitionTo(RunState.FAILED, reason);
        log.error("Run {} failed: {}", ctx.runId(), failure == null ? reason : failure.getMessage());
        return StateGraph.END;
    }
}
