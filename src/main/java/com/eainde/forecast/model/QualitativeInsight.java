package com.eainde.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One theme found in a transcript, backed by a cluster of chunks.
 *
 * @param theme            theme label
 * @param sentiment        [-1,1]
 * @param supportingQuote  most representative chunk of the cluster
 * @param confidence       [0,1], derived from cohesion and chunk count
 * @param cohesion         [0,1], mean similarity of the cluster members to their centroid
 * @param chunkCount       number of chunks backing the theme
 * @param sourceDocumentId transcript the theme was found in
 */
public record QualitativeInsight(
        @JsonProperty("theme")              String theme,
        @JsonProperty("sentiment")          double sentiment,
        @JsonProperty("supporting_quote")   String supportingQuote,
        @JsonProperty("confidence")         double confidence,
        @JsonProperty("cohesion")           double cohesion,
        @JsonProperty("chunk_count")        int chunkCount,
        @JsonProperty("source_document_id") String sourceDocumentId
) {

    public QualitativeInsight {
        if (theme == null || theme.isBlank()) {
            throw new IllegalArgumentException("insight theme must not be blank");
        }
        if (sourceDocumentId == null || sourceDocumentId.isBlank()) {
            throw new IllegalArgumentException("insight '" + theme + "' has no source document");
        }
        sentiment = Confidence.clampSigned(sentiment);
        confidence = Confidence.clamp(confidence);
        cohesion = Confidence.clamp(cohesion);
        supportingQuote = supportingQuote == null ? "" : supportingQuote;
    }
}
