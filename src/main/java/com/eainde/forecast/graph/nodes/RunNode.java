package com.eainde.forecast.graph.nodes;

import com.eainde.forecast.context.RunContext;
import com.eainde.forecast.error.ForecastException;
import com.eainde.forecast.graph.ForecastState;
import com.eainde.forecast.model.RunState;
import org.bsc.langgraph4j.action.AsyncNodeAction;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Base of every node of a forecast run. Runs the step on the calling thread, then tells the
 * routing edge where to go next. A {@link ForecastException} is recorded on the context and
 * routes the run to {@code failed}.
 */
public abstract class RunNode implements AsyncNodeAction<ForecastState> {

    public static final String FAILED = "failed";

    protected final RunContext ctx;

    protected RunNode(RunContext ctx) {
        this.ctx = ctx;
    }

    /**
     * @return id of the next node
     */
    protected abstract String step(ForecastState state);

    @Override
    public CompletableFuture<Map<String, Object>> apply(ForecastState state) {
        String next;
        try {
            next = step(state);
        } catch (ForecastException e) {
            RunState where = ctx.state();
            ctx.fail(e.inState(where));
            next = FAILED;
        }
        return CompletableFuture.completedFuture(ForecastState.next(next));
    }
}
