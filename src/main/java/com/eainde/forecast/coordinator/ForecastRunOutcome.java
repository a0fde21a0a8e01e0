package com.eainde.forecast.coordinator;

import com.eainde.forecast.error.ErrorKind;
import com.eainde.forecast.error.ForecastException;
import com.eainde.forecast.model.ForecastResult;
import com.eainde.forecast.model.RunState;
import com.eainde.forecast.model.TraceEntry;
import com.eainde.forecast.model.TraceEntryType;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a caller gets back from one run: the forecast on success, the failure otherwise,
 * and the full trace either way.
 *
 * @param finalState  {@code DONE}, {@code FAILED}, or {@code IDLE} for a rejected request
 * @param failedState state the failure surfaced in, null on success
 */
public record ForecastRunOutcome(
        String runId,
        RunState finalState,
        RunState failedState,
        ForecastResult result,
        ErrorKind errorKind,
        int attempts,
        String message,
        List<TraceEntry> trace,
        boolean degraded,
        Duration elapsed
) {

    public ForecastRunOutcome {
        trace = List.copyOf(trace);
    }

    static ForecastRunOutcome success(String runId, ForecastResult result, List<TraceEntry> trace,
                                      boolean degraded, Duration elapsed) {
        return new ForecastRunOutcome(runId, RunState.DONE, null, result, null, 0, null, trace, degraded, elapsed);
    }

    static ForecastRunOutcome failure(String runId, ForecastException e, List<TraceEntry> trace,
                                      boolean degraded, Duration elapsed) {
        RunState finalState = e.getKind() == ErrorKind.INPUT_INVALID ? RunState.IDLE : RunState.FAILED;
        return new ForecastRunOutcome(runId, finalState, e.getState(), null, e.getKind(), e.getAttempts(),
                e.getMessage(), trace, degraded, elapsed);
    }

    public boolean isSuccess() {
        return finalState == RunState.DONE && result != null;
    }

    public long count(TraceEntryType type) {
        return trace.stream().filter(e -> e.type() == type).count();
    }

    /**
     * Structured error body {@code {kind, state, attempts, message}}. Empty for a successful run.
     */
    public Map<String, Object> errorBody() {
        Map<String, Object> body = new LinkedHashMap<>();
        if (isSuccess()) {
            return body;
        }
        body.put("kind", errorKind);
        body.put("state", failedState);
        body.put("attempts", attempts);
        body.put("message", message);
        return body;
    }
}
