package com.eainde.forecast.tool;

/**
 * A tool the coordinator can invoke during a run.
 */
public interface ForecastTool {

    /**
     * Name written to {@code TOOL_CALL} trace entries.
     */
    String toolName();
}
