package com.eainde.forecast.llm;

/**
 * Failure reported by a {@link ModelBackend}.
 */
public class ModelBackendException extends RuntimeException {

    private final Integer statusCode;
    private final boolean rateLimited;
    private final boolean retryable;

    public ModelBackendException(String message, Integer statusCode, boolean rateLimited, boolean retryable,
                                 Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.rateLimited = rateLimited;
        // a rate limit is always worth another attempt
        this.retryable = retryable || rateLimited;
    }

    public static ModelBackendException rateLimited(String message) {
        return new ModelBackendException(message, 429, true, true, null);
    }

    public static ModelBackendException transientFailure(String message) {
        return new ModelBackendException(message, null, false, true, null);
    }

    public static ModelBackendException permanent(String message, Integer statusCode) {
        return new ModelBackendException(message, statusCode, false, false, null);
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    public boolean isRateLimited() {
        return rateLimited;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
