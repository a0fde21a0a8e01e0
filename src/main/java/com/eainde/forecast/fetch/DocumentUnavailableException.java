package com.eainde.forecast.fetch;

import com.eainde.forecast.model.DocumentKind;
import lombok.Getter;

@Getter
public class DocumentUnavailableException extends RuntimeException {

    private final String sourceId;
    private final DocumentKind kind;

    public DocumentUnavailableException(String sourceId, DocumentKind kind, String message) {
        this(sourceId, kind, message, null);
    }

    public DocumentUnavailableException(String sourceId, DocumentKind kind, String message, Throwable cause) {
        super(message, cause);
        this.sourceId = sourceId;
        this.kind = kind;
    }
}
