package com.eainde.forecast.error;

import com.eainde.forecast.model.RunState;
import lombok.Getter;

/**
 * Unchecked failure of a forecast run.
 *
 * <p>Messages are safe to return to callers: they never contain prompts, model output
 * or credentials.</p>
 */
@Getter
public class ForecastException extends RuntimeException {

    private final ErrorKind kind;
    private final RunState state;
    private final int attempts;

    public ForecastException(ErrorKind kind, RunState state, int attempts, String message) {
        this(kind, state, attempts, message, null);
    }

    public ForecastException(ErrorKind kind, RunState state, int attempts, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.state = state;
        this.attempts = attempts;
    }

    public static ForecastException inputInvalid(String message) {
        return new ForecastException(ErrorKind.INPUT_INVALID, RunState.IDLE, 0, message);
    }

    public static ForecastException timeout(RunState state) {
        return new ForecastException(ErrorKind.TIMEOUT_EXCEEDED, state, 0, "Run budget exhausted in state " + state);
    }

    public static ForecastException timeout(RunState state, Throwable cause) {
        return new ForecastException(ErrorKind.TIMEOUT_EXCEEDED, state, 0,
                "Run budget exhausted in state " + state, cause);
    }

    /**
     * Same failure, re-attributed to the state it surfaced in.
     */
    public ForecastException inState(RunState newState) {
        if (newState == state) {
            return this;
        }
        return new ForecastException(kind, newState, attempts, getMessage(), getCause());
    }
}
