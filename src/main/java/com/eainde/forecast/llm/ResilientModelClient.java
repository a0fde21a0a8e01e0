package com.eainde.forecast.llm;

import com.eainde.forecast.context.RunContext;
import com.eainde.forecast.error.ErrorKind;
import com.eainde.forecast.error.ForecastException;
import com.eainde.forecast.model.TraceEntryType;
import lombok.extern.log4j.Log4j2;

import java.time.Duration;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Wraps a {@link ModelBackend} with bounded retry and linear backoff.
 *
 * <p>Attempt {@code n} that fails with a retryable error waits {@code baseDelay * n} before
 * attempt {@code n + 1}. Nothing is waited after the last attempt, so with the defaults an
 * always-rate-limited call makes 3 attempts and waits 5s then 10s.</p>
 *
 * <ul>
 *   <li>rate limit exhausted: {@link ErrorKind#RATE_LIMITED}</li>
 *   <li>other retryable failure exhausted: {@link ErrorKind#MODEL_UNAVAILABLE}</li>
 *   <li>non-retryable failure: {@link ErrorKind#MODEL_UNAVAILABLE} immediately</li>
 *   <li>budget spent before an attempt: {@link ErrorKind#TIMEOUT_EXCEEDED}</li>
 * </ul>
 *
 * <p>Every attempt is appended to the run trace as a {@code MODEL_CALL} entry.</p>
 */
@Log4j2
public class ResilientModelClient {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(5);

    private final ModelBackend backend;
    private final int maxAttempts;
    private final Duration baseDelay;
    private final Sleeper sleeper;

    public ResilientModelClient(ModelBackend backend) {
        this(backend, DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY, Sleeper.system());
    }

    public ResilientModelClient(ModelBackend backend, int maxAttempts, Duration baseDelay, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.backend = backend;
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.sleeper = sleeper;
    }

    public String complete(RunContext ctx, String step, String prompt) {
        return complete(ctx, step, prompt, Set.of());
    }

    public String complete(RunContext ctx, String step, String prompt, Set<String> stopSequences) {
        Set<String> stops = stopSequences == null ? Set.of() : stopSequences;
        return execute(ctx, step, backend.name(), () -> backend.complete(prompt, stops));
    }

    /**
     * Runs any single model call under the same attempt bound, backoff, classification and
     * tracing as {@link #complete}. Used for calls that are not plain text completions, such
     * as OCR page transcription.
     *
     * @param callerName backend name written to trace entries
     * @param call       makes exactly one model call and returns its text
     */
    public String execute(RunContext ctx, String step, String callerName, Supplier<String> call) {
        ModelBackendException last = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            ctx.checkBudget();
            ctx.incrementRetry(step);
            long started = System.nanoTime();
            try {
                String text = call.get();
                long ms = (System.nanoTime() - started) / 1_000_000;
                ctx.trace().append(TraceEntryType.MODEL_CALL, step, attempt, "OK",
                        callerName + " returned " + (text == null ? 0 : text.length()) + " chars in " + ms + "ms");
                return text;
            } catch (ForecastException e) {
                throw e;
            } catch (RuntimeException e) {
                last = ModelErrorClassifier.toBackendException(callerName, e);
            }

            String outcome = last.isRateLimited() ? "RATE_LIMITED" : last.isRetryable() ? "TRANSIENT_ERROR" : "FAILED";
            ctx.trace().append(TraceEntryType.MODEL_CALL, step, attempt, outcome, last.getMessage());

            if (!last.isRetryable()) {
                log.error("Model call for step '{}' failed permanently on attempt {}: {}", step, attempt, last.getMessage());
                throw new ForecastException(ErrorKind.MODEL_UNAVAILABLE, ctx.state(), attempt,
                        "Model backend rejected the call: " + last.getMessage(), last);
            }
            if (attempt < maxAttempts) {
                Duration delay = baseDelay.multipliedBy(attempt);
                log.warn("Model call for step '{}' attempt {}/{} failed ({}), retrying in {}s",
                        step, attempt, maxAttempts, outcome, delay.toSeconds());
                pause(ctx, delay);
            }
        }

        ErrorKind kind = last.isRateLimited() ? ErrorKind.RATE_LIMITED : ErrorKind.MODEL_UNAVAILABLE;
        log.error("Model call for step '{}' exhausted {} attempts: {}", step, maxAttempts, kind);
        throw new ForecastException(kind, ctx.state(), maxAttempts,
                "Model call failed after " + maxAttempts + " attempts: " + last.getMessage(), last);
    }

    private void pause(RunContext ctx, Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ForecastException.timeout(ctx.state(), e);
        }
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public String backendName() {
        return backend.name();
    }
}
