package com.eainde.forecast.graph.edges;

import com.eainde.forecast.graph.ForecastState;
import org.bsc.langgraph4j.action.AsyncEdgeAction;

import java.util.concurrent.CompletableFuture;

/**
 * Routes to whatever node the previous node asked for.
 */
public class RunRoutingEdge implements AsyncEdgeAction<ForecastState> {

    static final String FAILED = "failed";

    @Override
    public CompletableFuture<String> apply(ForecastState state) {
        String next = state.getNext();
        return CompletableFuture.completedFuture(next == null ? FAILED : next);
    }
}
