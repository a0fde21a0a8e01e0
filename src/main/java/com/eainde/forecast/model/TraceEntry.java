package com.eainde.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Append-only record of something that happened during a run.
 *
 * @param sequence  position in the trace, starting at 1
 * @param timestamp when the entry was appended
 * @param type      entry category
 * @param step      state or tool the entry belongs to (e.g. {@code synthesizing}, {@code extraction})
 * @param attempt   attempt number for retried operations, 0 otherwise
 * @param outcome   short outcome code (e.g. {@code OK}, {@code RATE_LIMITED})
 * @param detail    free text, never a prompt or credential
 */
public record TraceEntry(
        @JsonProperty("sequence")  long sequence,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("type")      TraceEntryType type,
        @JsonProperty("step")      String step,
        @JsonProperty("attempt")   int attempt,
        @JsonProperty("outcome")   String outcome,
        @JsonProperty("detail")    String detail
) {
}
