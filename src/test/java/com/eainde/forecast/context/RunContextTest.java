package com.eainde.forecast.context;

import com.eainde.forecast.error.ErrorKind;
import com.eainde.forecast.error.ForecastException;
import com.eainde.forecast.model.ExtractionGap;
import com.eainde.forecast.model.RunRequest;
import com.eainde.forecast.model.RunState;
import com.eainde.forecast.model.TraceEntry;
import com.eainde.forecast.model.TraceEntryType;
import com.eainde.forecast.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunContextTest {

    private MutableClock clock;
    private RunContext ctx;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-10-01T10:00:00Z");
        ctx = new RunContext("run-1", RunRequest.of(2, List.of("screener")), clock, Duration.ofMinutes(5));
    }

    // =========================================================================
    //  State and budget
    // =========================================================================

    @Test
    void transitionTo_shouldTraceEachTransition() {
        // Act
        ctx.transitionTo(RunState.GATHERING, "run started");
        ctx.transitionTo(RunState.EXTRACTING, "documents gathered");

        // Assert
        assertThat(ctx.state()).isEqualTo(RunState.EXTRACTING);
        assertThat(ctx.trace().entries(TraceEntryType.STATE_TRANSITION))
                .extracting(TraceEntry::detail)
                .containsExactly("IDLE -> GATHERING: run started", "GATHERING -> EXTRACTING: documents gathered");
    }

    @Test
    void checkBudget_shouldPass_beforeDeadline() {
        // Arrange
        clock.advance(Duration.ofMinutes(4).plusSeconds(59));

        // Act + Assert
        assertThatCode(ctx::checkBudget).doesNotThrowAnyException();
        assertThat(ctx.remaining()).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void checkBudget_shouldThrowTimeout_atDeadline() {
        // Arrange
        ctx.transitionTo(RunState.ANALYZING, "test");
        clock.advance(Duration.ofMinutes(5));

        // Act + Assert
        assertThatThrownBy(ctx::checkBudget)
                .isInstanceOfSatisfying(ForecastException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.TIMEOUT_EXCEEDED);
                    assertThat(e.getState()).isEqualTo(RunState.ANALYZING);
                });
        assertThat(ctx.remaining()).isEqualTo(Duration.ZERO);
    }

    @Test
    void checkBudget_shouldThrowTimeout_whenCancelled() {
        // Act
        ctx.cancel();

        // Assert
        assertThat(ctx.isCancelled()).isTrue();
        assertThatThrownBy(ctx::checkBudget).isInstanceOf(ForecastException.class);
    }

    // =========================================================================
    //  Accumulated data
    // =========================================================================

    @Test
    void recordGap_shouldMarkDegradedAndTrace() {
        // Act
        ctx.recordGap(new ExtractionGap(ExtractionGap.Stage.EXTRACTION, "r-q1", "no metrics found"));

        // Assert
        assertThat(ctx.isDegraded()).isTrue();
        assertThat(ctx.gaps()).hasSize(1);
        assertThat(ctx.trace().entries(TraceEntryType.GAP)).singleElement()
                .satisfies(e -> {
                    assertThat(e.step()).isEqualTo("extraction");
                    assertThat(e.detail()).isEqualTo("r-q1: no metrics found");
                });
    }

    @Test
    void recordGap_shouldTraceDegradedOnce_atTheFirstGap() {
        // Arrange
        ctx.transitionTo(RunState.GATHERING, "request accepted");
        ctx.transitionTo(RunState.EXTRACTING, "2 report(s) gathered");

        // Act
        ctx.recordGap(new ExtractionGap(ExtractionGap.Stage.EXTRACTION, "r-q1", "no metrics found"));
        ctx.recordGap(new ExtractionGap(ExtractionGap.Stage.EXTRACTION, "r-q2", "no metrics found"));

        // Assert
        assertThat(ctx.trace().entries(TraceEntryType.GAP)).hasSize(2);
        assertThat(ctx.trace().entries(TraceEntryType.DEGRADED)).singleElement()
                .satisfies(e -> {
                    assertThat(e.step()).isEqualTo("extracting");
                    assertThat(e.outcome()).isEqualTo("DEGRADED");
                    assertThat(e.detail()).contains("EXTRACTION gap for r-q1");
                });
        assertThat(ctx.trace().entries(TraceEntryType.STATE_TRANSITION)).extracting(TraceEntry::step)
                .containsExactly("gathering", "extracting");
    }

    @Test
    void incrementRetry_shouldCountPerStep() {
        // Act
        ctx.incrementRetry("synthesizing");
        ctx.incrementRetry("synthesizing");
        ctx.incrementRetry("validating");

        // Assert
        assertThat(ctx.retryCount("synthesizing")).isEqualTo(2);
        assertThat(ctx.retryCount("validating")).isEqualTo(1);
        assertThat(ctx.retryCount("gathering")).isZero();
    }

    @Test
    void beginSynthesis_shouldAllowOneCallInFlight() {
        assertThat(ctx.beginSynthesis()).isTrue();
        assertThat(ctx.beginSynthesis()).isFalse();
        ctx.endSynthesis();
        assertThat(ctx.beginSynthesis()).isTrue();
    }

    @Test
    void fail_shouldKeepFirstFailure() {
        // Arrange
        ForecastException first = ForecastException.timeout(RunState.SYNTHESIZING);
        ForecastException second = ForecastException.inputInvalid("late");

        // Act
        ctx.fail(first);
        ctx.fail(second);

        // Assert
        assertThat(ctx.failure()).isSameAs(first);
    }

    @Test
    void trace_shouldKeepGaplessSequence_underConcurrentAppends() throws Exception {
        // Arrange
        int threads = 8;
        int perThread = 200;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        // Act
        for (int t = 0; t < threads; t++) {
            pool.execute(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < perThread; i++) {
                    ctx.trace().append(TraceEntryType.TOOL_CALL, "extraction", "OK", "doc");
                }
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        // Assert
        List<TraceEntry> entries = ctx.trace().entries();
        assertThat(entries).hasSize(threads * perThread);
        for (int i = 0; i < entries.size(); i++) {
            assertThat(entries.get(i).sequence()).isEqualTo(i + 1L);
        }
    }
}
