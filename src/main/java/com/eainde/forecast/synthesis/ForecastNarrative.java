package com.eainde.forecast.synthesis;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Narrative part of a forecast as written by the model.
 */
public record ForecastNarrative(
        @JsonProperty("outlook")       String outlook,
        @JsonProperty("key_themes")    List<String> keyThemes,
        @JsonProperty("sentiment")     String sentiment,
        @JsonProperty("risks")         List<String> risks,
        @JsonProperty("opportunities") List<String> opportunities
) {

    public ForecastNarrative {
        keyThemes = keyThemes == null ? List.of() : List.copyOf(keyThemes);
        risks = risks == null ? List.of() : List.copyOf(risks);
        opportunities = opportunities == null ? List.of() : List.copyOf(opportunities);
    }
}
