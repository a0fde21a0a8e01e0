package com.eainde.forecast.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;

/**
 * Immutable forecast request. Field validation happens in the coordinator before any
 * state transition, so the constructor accepts out-of-range values.
 *
 * @param quarterCount number of most recent quarters to analyse
 * @param sources      ordered, de-duplicated source ids
 * @param ticker       company ticker, defaults to {@value #DEFAULT_TICKER}
 * @param requestId    caller supplied id, generated when absent
 */
public record RunRequest(
        @JsonProperty("quarters")   int quarterCount,
        @JsonProperty("sources")    List<String> sources,
        @JsonProperty("ticker")     String ticker,
        @JsonProperty("request_id") String requestId
) {

    public static final String DEFAULT_TICKER = "TCS";
    public static final int MAX_QUARTERS = 12;

    @JsonCreator
    public RunRequest {
        sources = sources == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(sources)));
        ticker = ticker == null ? DEFAULT_TICKER : ticker;
        requestId = requestId == null || requestId.isBlank() ? UUID.randomUUID().toString() : requestId;
    }

    public static RunRequest of(int quarterCount, List<String> sources) {
        return new RunRequest(quarterCount, sources, null, null);
    }

    public int reportLimit() {
        return quarterCount;
    }

    public int transcriptLimit() {
        return Math.max(1, quarterCount - 1);
    }
}
