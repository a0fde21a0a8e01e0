package com.eainde.forecast.context;

import com.eainde.forecast.error.ForecastException;
import com.eainde.forecast.model.ExtractedMetric;
import com.eainde.forecast.model.ExtractionGap;
import com.eainde.forecast.model.ForecastResult;
import com.eainde.forecast.model.QualitativeInsight;
import com.eainde.forecast.model.RunRequest;
import com.eainde.forecast.model.RunState;
import com.eainde.forecast.model.SourceDocument;
import com.eainde.forecast.model.TraceEntryType;
import com.eainde.forecast.synthesis.ForecastNarrative;
import lombok.extern.log4j.Log4j2;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mutable accumulator for exactly one forecast run.
 *
 * <p>Created by the coordinator, closed over by the graph nodes of that run and discarded
 * once the outcome has been built. Collections are safe for the parallel fetch and
 * extraction fan-out; everything else is written from the run thread only.</p>
 */
@Log4j2
public class RunContext {

    private final String runId;
    private final RunRequest request;
    private final Clock clock;
    private final Instant startedAt;
    private final Instant deadline;
    private final ConversationTrace trace;

    private final List<SourceDocument> documents = new CopyOnWriteArrayList<>();
    private final List<ExtractedMetric> metrics = new CopyOnWriteArrayList<>();
    private final List<QualitativeInsight> insights = new CopyOnWriteArrayList<>();
    private final List<ExtractionGap> gaps = new CopyOnWriteArrayList<>();
    private final Map<String, AtomicInteger> retryCounters = new ConcurrentHashMap<>();

    private final AtomicBoolean degraded = new AtomicBoolean();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicBoolean synthesisInFlight = new AtomicBoolean();

    private volatile RunState state = RunState.IDLE;
    private volatile ForecastNarrative narrative;
    private volatile String narrativeJson;
    private final List<String> validationFeedback = new CopyOnWriteArrayList<>();
    private volatile ForecastResult result;
    private volatile ForecastException failure;

    public RunContext(String runId, RunRequest request, Clock clock, Duration budget) {
        this.runId = runId;
        this.request = request;
        this.clock = clock;
        this.startedAt = clock.instant();
        this.deadline = startedAt.plus(budget);
        this.trace = new ConversationTrace(clock);
    }

    // =========================================================================
    //  State
    // =========================================================================

    public void transitionTo(RunState next, String trigger) {
        RunState previous = this.state;
        this.state = next;
        trace.append(TraceEntryType.STATE_TRANSITION, next.nodeId(), "OK", previous + " -> " + next + ": " + trigger);
        log.info("Run {} {} -> {} ({})", runId, previous, next, trigger);
    }

    public RunState state() {
        return state;
    }

    /**
     * Throws {@code TIMEOUT_EXCEEDED} when the budget is spent or the run was cancelled.
     */
    public void checkBudget() {
        if (cancelled.get() || Thread.currentThread().isInterrupted()) {
            throw ForecastException.timeout(state);
        }
        if (!clock.instant().isBefore(deadline)) {
            throw ForecastException.timeout(state);
        }
    }

    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    // =========================================================================
    //  Accumulated data
    // =========================================================================

    public void addDocuments(Collection<SourceDocument> docs) {
        documents.addAll(docs);
    }

    public List<SourceDocument> documents() {
        return List.copyOf(documents);
    }

    public void addMetrics(Collection<ExtractedMetric> extracted) {
        metrics.addAll(extracted);
    }

    public List<ExtractedMetric> metrics() {
        return List.copyOf(metrics);
    }

    public void addInsights(Collection<QualitativeInsight> found) {
        insights.addAll(found);
    }

    public List<QualitativeInsight> insights() {
        return List.copyOf(insights);
    }

    /**
     * Records a non-fatal gap and marks the run degraded. The first gap of a run also appends
     * a {@code DEGRADED} entry naming the state the run was in.
     */
    public void recordGap(ExtractionGap gap) {
        gaps.add(gap);
        trace.append(TraceEntryType.GAP, gap.stage().name().toLowerCase(Locale.ROOT), "GAP", gap.subject() + ": " + gap.reason());
        log.warn("Run {} gap at {} for '{}': {}", runId, gap.stage(), gap.subject(), gap.reason());
        if (degraded.compareAndSet(false, true)) {
            trace.append(TraceEntryType.DEGRADED, state.nodeId(), "DEGRADED",
                    state + " -> " + state + " (degraded): " + gap.stage() + " gap for " + gap.subject());
            log.warn("Run {} is now degraded", runId);
        }
    }

    public List<ExtractionGap> gaps() {
        return List.copyOf(gaps);
    }

    public boolean isDegraded() {
        return degraded.get();
    }

    public int incrementRetry(String step) {
        return retryCounters.computeIfAbsent(step, k -> new AtomicInteger()).incrementAndGet();
    }

    public int retryCount(String step) {
        AtomicInteger counter = retryCounters.get(step);
        return counter == null ? 0 : counter.get();
    }

    // =========================================================================
    //  Synthesis
    // =========================================================================

    /**
     * Claims the single synthesis slot of this run. Returns false when a call is already in flight.
     */
    public boolean beginSynthesis() {
        return synthesisInFlight.compareAndSet(false, true);
    }

    public void endSynthesis() {
        synthesisInFlight.set(false);
    }

    public ForecastNarrative narrative() {
        return narrative;
    }

    public String narrativeJson() {
        return narrativeJson;
    }

    public void acceptNarrative(ForecastNarrative narrative, String rawJson) {
        this.narrative = narrative;
        this.narrativeJson = rawJson;
    }

    public List<String> validationFeedback() {
        return new ArrayList<>(validationFeedback);
    }

    public void replaceValidationFeedback(List<String> issues) {
        validationFeedback.clear();
        validationFeedback.addAll(issues);
    }

    public ForecastResult result() {
        return result;
    }

    public void complete(ForecastResult result) {
        this.result = result;
    }

    public ForecastException failure() {
        return failure;
    }

    public void fail(ForecastException failure) {
        if (this.failure == null) {
            this.failure = failure;
        }
    }

    // =========================================================================
    //  Accessors
    // =========================================================================

    public String runId() {
        return runId;
    }

    public RunRequest request() {
        return request;
    }

    public Clock clock() {
        return clock;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant deadline() {
        return deadline;
    }

    public ConversationTrace trace() {
        return trace;
    }
}
