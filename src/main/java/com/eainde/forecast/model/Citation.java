package com.eainde.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of the forecast evidence list.
 *
 * @param type             what is being cited
 * @param subject          metric name, theme label, or gap/anomaly subject
 * @param sourceDocumentId backing document, may be a source id for fetch gaps
 * @param detail           short human readable detail
 */
public record Citation(
        @JsonProperty("type")               CitationType type,
        @JsonProperty("subject")            String subject,
        @JsonProperty("source_document_id") String sourceDocumentId,
        @JsonProperty("detail")             String detail
) {

    public static Citation metric(ExtractedMetric metric) {
        return new Citation(CitationType.METRIC, metric.name(), metric.sourceDocumentId(),
                metric.strategy() + " " + metric.period().label() + " \"" + metric.label() + "\"");
    }

    public static Citation theme(QualitativeInsight insight) {
        return new Citation(CitationType.THEME, insight.theme(), insight.sourceDocumentId(),
                insight.chunkCount() + " chunk(s), cohesion " + String.format("%.2f", insight.cohesion()));
    }

    public static Citation gap(ExtractionGap gap) {
        return new Citation(CitationType.GAP, gap.stage().name(), gap.subject(), gap.reason());
    }
}
