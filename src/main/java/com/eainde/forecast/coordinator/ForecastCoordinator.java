package com.eainde.forecast.coordinator;

import com.eainde.forecast.context.RunContext;
import com.eainde.forecast.error.ForecastException;
import com.eainde.forecast.graph.ForecastState;
import com.eainde.forecast.graph.ForecastWorkflowGraph;
import com.eainde.forecast.graph.RunSettings;
import com.eainde.forecast.model.RunRequest;
import com.eainde.forecast.model.RunState;
import com.eainde.forecast.model.TraceEntryType;
import com.eainde.forecast.store.ForecastRecord;
import com.eainde.forecast.store.ForecastStore;
import com.eainde.forecast.thread.MdcAwareExecutor;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point of a forecast run.
 * <p>
 * Validates the request, gives the run its own {@link RunContext} and compiled graph,
 * bounds it with the wall-clock budget and hands a completed forecast to the
 * {@link ForecastStore}.
 * </p>
 *
 * <h3>Outcome</h3>
 * <ul>
 * <li>{@code DONE}: the validated {@link com.eainde.forecast.model.ForecastResult}, possibly degraded.</li>
 * <li>{@code FAILED}: the terminal {@link com.eainde.forecast.error.ErrorKind}, the state it surfaced in
 * and the attempt count. Partial results are never returned.</li>
 * <li>{@code IDLE}: the request was rejected with {@code INPUT_INVALID} before any transition.</li>
 * </ul>
 */
@Log4j2
@Service
public class ForecastCoordinator {

    static final String MDC_RUN_ID = "runId";

    private final ForecastWorkflowGraph workflowGraph;
    private final ForecastStore store;
    private final MdcAwareExecutor runExecutor;
    private final Clock clock;
    private final RunSettings settings;

    public ForecastCoordinator(ForecastWorkflowGraph workflowGraph,
                               ForecastStore store,
                               @Qualifier("forecastRunExecutor") MdcAwareExecutor runExecutor,
                               Clock clock,
                               RunSettings settings) {
        this.workflowGraph = workflowGraph;
        this.store = store;
        this.runExecutor = runExecutor;
        this.clock = clock;
        this.settings = settings;
    }

    public ForecastRunOutcome run(RunRequest request) {
        String runId = UUID.randomUUID().toString();
        try {
            validate(request);
        } catch (ForecastException e) {
            log.warn("Rejected forecast request: {}", e.getMessage());
            return ForecastRunOutcome.failure(runId, e, List.of(), false, Duration.ZERO);
        }

        String previousRunId = MDC.get(MDC_RUN_ID);
        MDC.put(MDC_RUN_ID, runId);
        try {
            RunContext ctx = new RunContext(runId, request, clock, settings.budget());
            log.info("Starting forecast run {} for {} ({} quarter(s), sources {})",
                    runId, request.ticker(), request.quarterCount(), request.sources());
            execute(ctx);
            return finish(ctx);
        } finally {
            if (previousRunId == null) {
                MDC.remove(MDC_RUN_ID);
            } else {
                MDC.put(MDC_RUN_ID, previousRunId);
            }
        }
    }

    private void execute(RunContext ctx) {
        CompiledGraph<ForecastState> graph;
        try {
            graph = workflowGraph.compileFor(ctx);
        } catch (GraphStateException e) {
            throw new IllegalStateException("Forecast workflow graph is invalid", e);
        }

        RunnableConfig config = RunnableConfig.builder()
                .threadId(ctx.runId())
                .build();
        Map<String, Object> inputs = Map.of(ForecastState.RUN_ID, ctx.runId());

        Future<Optional<ForecastState>> future = runExecutor.submit(() -> graph.invoke(inputs, config));
        try {
            future.get(settings.budget().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abort(ctx, future, e, "run budget of " + settings.budget() + " exhausted");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abort(ctx, future, e, "caller interrupted");
        } catch (ExecutionException e) {
            ForecastException failure = findForecastException(e.getCause());
            if (failure == null) {
                throw new IllegalStateException("Forecast run " + ctx.runId() + " crashed", e.getCause());
            }
            ctx.fail(failure.inState(ctx.state()));
            markFailed(ctx, failure.getKind().name());
        }
    }

    private void abort(RunContext ctx, Future<?> future, Exception cause, String reason) {
        ctx.cancel();
        future.cancel(true);
        ctx.fail(ForecastException.timeout(ctx.state(), cause));
        markFailed(ctx, reason);
    }

    private static void markFailed(RunContext ctx, String reason) {
        if (!ctx.state().isTerminal()) {
            ctx.transitionTo(RunState.FAILED, reason);
        }
    }

    private ForecastRunOutcome finish(RunContext ctx) {
        Instant completedAt = clock.instant();
        Duration elapsed = Duration.between(ctx.startedAt(), completedAt);

        ForecastException failure = ctx.failure();
        if (failure != null) {
            log.warn("Forecast run {} failed with {} in {} after {} ms",
                    ctx.runId(), failure.getKind(), failure.getState(), elapsed.toMillis());
            return ForecastRunOutcome.failure(ctx.runId(), failure, ctx.trace().entries(), ctx.isDegraded(), elapsed);
        }
        if (ctx.result() == null || ctx.state() != RunState.DONE) {
            throw new IllegalStateException("Run " + ctx.runId() + " ended in " + ctx.state() + " without a forecast");
        }

        persist(ctx, completedAt, elapsed);
        log.info("Forecast run {} done in {} ms{}", ctx.runId(), elapsed.toMillis(),
                ctx.isDegraded() ? " (degraded)" : "");
        return ForecastRunOutcome.success(ctx.runId(), ctx.result(), ctx.trace().entries(), ctx.isDegraded(), elapsed);
    }

    private void persist(RunContext ctx, Instant completedAt, Duration elapsed) {
        ForecastRecord record = new ForecastRecord(
                ctx.runId(),
                ctx.request(),
                ctx.result(),
                ctx.trace().entries(),
                ctx.isDegraded(),
                ctx.startedAt(),
                completedAt,
                elapsed.toMillis());
        try {
            store.save(record);
            ctx.trace().append(TraceEntryType.PERSISTENCE, RunState.DONE.nodeId(), "OK", "forecast stored");
        } catch (RuntimeException e) {
            // A completed forecast is still returned to the caller
            log.error("Persisting forecast run {} failed", ctx.runId(), e);
            ctx.trace().append(TraceEntryType.PERSISTENCE, RunState.DONE.nodeId(), "FAILED",
                    e.getClass().getSimpleName());
        }
    }

    static void validate(RunRequest request) {
        if (request == null) {
            throw ForecastException.inputInvalid("request is required");
        }
        if (request.quarterCount() < 1 || request.quarterCount() > RunRequest.MAX_QUARTERS) {
            throw ForecastException.inputInvalid(
                    "quarters must be between 1 and " + RunRequest.MAX_QUARTERS + ", was " + request.quarterCount());
        }
        if (request.sources().isEmpty()) {
            throw ForecastException.inputInvalid("at least one source is required");
        }
        for (String source : request.sources()) {
            if (source == null || source.isBlank()) {
                throw ForecastException.inputInvalid("source ids must not be blank");
            }
        }
        if (request.ticker().isBlank()) {
            throw ForecastException.inputInvalid("ticker must not be blank");
        }
    }

    private static ForecastException findForecastException(Throwable t) {
        Throwable current = t;
        while (current != null) {
            if (current instanceof ForecastException fe) {
                return fe;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return null;
    }
}
