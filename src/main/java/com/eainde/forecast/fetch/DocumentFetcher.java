package com.eainde.forecast.fetch;

import com.eainde.forecast.model.DocumentKind;
import com.eainde.forecast.model.SourceDocument;

import java.util.List;

/**
 * Supplies the documents of one source. Implementations own their retry and caching policy.
 */
public interface DocumentFetcher {

    /**
     * @param sourceId     source to read from
     * @param kind         reports or transcripts
     * @param maxDocuments upper bound on documents returned, most recent periods first
     * @return at least one document
     * @throws DocumentUnavailableException when the source has nothing of this kind
     */
    List<SourceDocument> fetch(String sourceId, DocumentKind kind, int maxDocuments);
}
