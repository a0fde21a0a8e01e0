package com.eainde.forecast.synthesis;

/**
 * Model output that is not a narrative object. The message is safe to echo back to the model.
 */
public class MalformedNarrativeException extends RuntimeException {

    public MalformedNarrativeException(String message) {
        super(message);
    }

    public MalformedNarrativeException(String message, Throwable cause) {
        super(message, cause);
    }
}
