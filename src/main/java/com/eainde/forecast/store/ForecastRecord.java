package com.eainde.forecast.store;

import com.eainde.forecast.model.ForecastResult;
import com.eainde.forecast.model.RunRequest;
import com.eainde.forecast.model.TraceEntry;

import java.time.Instant;
import java.util.List;

/**
 * A completed run as it is kept for audit: the request, the forecast and the full trace.
 */
public record ForecastRecord(
        String runId,
        RunRequest request,
        ForecastResult result,
        List<TraceEntry> trace,
        boolean degraded,
        Instant startedAt,
        Instant completedAt,
        long durationMs
) {
    public ForecastRecord {
        trace = List.copyOf(trace);
    }
}
