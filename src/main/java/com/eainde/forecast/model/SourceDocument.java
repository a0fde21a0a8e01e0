package com.eainde.forecast.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * A document gathered for one run. Owned by the run for its lifetime and never mutated.
 *
 * @param id       stable identifier, cited by every metric and insight derived from it
 * @param kind     report or transcript
 * @param sourceId the source the document was fetched from (e.g. {@code screener})
 * @param title    human readable name
 * @param period   reporting period the document covers
 * @param format   format hint used to read the text layer
 * @param content  raw bytes
 */
public record SourceDocument(
        String id,
        DocumentKind kind,
        String sourceId,
        String title,
        ReportingPeriod period,
        DocumentFormat format,
        byte[] content
) {

    public SourceDocument {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        if (id.isBlank()) {
            throw new IllegalArgumentException("document id must not be blank");
        }
        period = period == null ? ReportingPeriod.UNKNOWN : period;
        format = format == null ? DocumentFormat.TEXT : format;
        content = content == null ? new byte[0] : content.clone();
        title = title == null ? id : title;
    }

    public static SourceDocument text(String id, DocumentKind kind, String sourceId,
                                      ReportingPeriod period, String text) {
        return new SourceDocument(id, kind, sourceId, id, period, DocumentFormat.TEXT,
                text.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    public int size() {
        return content.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceDocument other)) return false;
        return id.equals(other.id) && kind == other.kind
                && Objects.equals(sourceId, other.sourceId)
                && Objects.equals(title, other.title)
                && period.equals(other.period)
                && format == other.format
                && Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind, sourceId, title, period, format) * 31 + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "SourceDocument[id=" + id + ", kind=" + kind + ", source=" + sourceId
                + ", period=" + period + ", format=" + format + ", bytes=" + content.length + "]";
    }
}
