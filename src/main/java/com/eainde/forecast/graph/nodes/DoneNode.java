package com.eainde.forecast.graph.nodes;

import com.eainde.forecast.context.RunContext;
import com.eainde.forecast.graph.ForecastState;
import com.eainde.forecast.model.RunState;
import org.bsc.langgraph4j.StateGraph;

public class DoneNode extends RunNode {

    public DoneNode(RunContext ctx) {
        super(ctx);
    }

    @Override
    protected String step(ForecastState state) {
        ctx.transitionTo(RunState.DONE, ctx.isDegraded() ? "forecast validated (degraded)" : "forecast validated");
        return StateGraph.END;
    }
}
