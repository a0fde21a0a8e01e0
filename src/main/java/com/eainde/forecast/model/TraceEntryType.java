package com.eainde.forecast.model;

public enum TraceEntryType {
    STATE_TRANSITION,
    MODEL_CALL,
    TOOL_CALL,
    SYNTHESIS_ATTEMPT,
    VALIDATION,
    GAP,
    /** The run entered degraded mode; recorded once, with the first gap. */
    DEGRADED,
    PERSISTENCE
}
