package com.eainde.forecast.extraction;

import com.eainde.forecast.context.RunContext;
import com.eainde.forecast.model.SourceDocument;

/**
 * Turns an image-based document into text.
 */
@FunctionalInterface
public interface OcrEngine {

    /**
     * @param ctx run the transcription belongs to; model calls are traced on it
     * @throws OcrException when the document cannot be transcribed
     * @throws com.eainde.forecast.error.ForecastException when the model calls fail for good
     */
    String transcribe(RunContext ctx, SourceDocument document);

    /**
     * Engine used when no vision model is configured: every call fails.
     */
    static OcrEngine unavailable() {
        return (ctx, document) -> {
            throw new OcrException("No OCR engine configured for " + document.id());
        };
    }

    class OcrException extends RuntimeException {
        public OcrException(String message) {
            super(message);
        }

        public OcrException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
