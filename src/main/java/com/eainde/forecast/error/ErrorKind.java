package com.eainde.forecast.error;

/**
 * Failure taxonomy of a forecast run. Every kind except {@link #EXTRACTION_GAP} is terminal.
 */
public enum ErrorKind {
    /** Rate limit persisted through every retry attempt. */
    RATE_LIMITED,
    /** Model backend failed for a reason other than rate limiting, or rejected the call outright. */
    MODEL_UNAVAILABLE,
    /** A document yielded nothing usable. Recovered locally. */
    EXTRACTION_GAP,
    /** The model never produced a parseable narrative. */
    SYNTHESIS_FAILED,
    /** The assembled forecast failed schema, bounds or citation checks twice. */
    VALIDATION_FAILED,
    /** The wall-clock budget ran out. */
    TIMEOUT_EXCEEDED,
    /** The request was rejected before any state transition. */
    INPUT_INVALID,
    /** No document could be gathered from any source. */
    DOCUMENTS_UNAVAILABLE;

    public boolean isTerminal() {
        return this != EXTRACTION_GAP;
    }
}
