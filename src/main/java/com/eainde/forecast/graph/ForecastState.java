package com.eainde.forecast.graph;

import org.bsc.langgraph4j.state.AgentState;

import java.util.Map;

/**
 * Graph state of one forecast run. Holds routing keys only; accumulated data lives in the
 * run's {@link com.eainde.forecast.context.RunContext}.
 */
public class ForecastState extends AgentState {

    public static final String RUN_ID = "runId";
    public static final String NEXT = "next";

    public ForecastState(Map<String, Object> initData) {
        super(initData);
    }

    public String getRunId() { return (String) this.data().get(RUN_ID); }
    public String getNext() { return (String) this.data().get(NEXT); }

    public static Map<String, Object> next(String nodeId) {
        return Map.of(NEXT, nodeId);
    }
}
