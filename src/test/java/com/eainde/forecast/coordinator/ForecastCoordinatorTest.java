package com.eainde.forecast.coordinator;

import com.eainde.forecast.analysis.HashingEmbeddingModel;
import com.eainde.forecast.analysis.QualitativeAnalysisPipeline;
import com.eainde.forecast.error.ErrorKind;
import com.eainde.forecast.extraction.ExtractionStrategyChain;
import com.eainde.forecast.extraction.OcrEngine;
import com.eainde.forecast.extraction.VisionModelOcrEngine;
import com.eainde.forecast.fetch.DocumentFetcher;
import com.eainde.forecast.fetch.DocumentUnavailableException;
import com.eainde.forecast.graph.ForecastWorkflowGraph;
import com.eainde.forecast.graph.RunSettings;
import com.eainde.forecast.llm.ModelBackend;
import com.eainde.forecast.llm.ModelBackendException;
import com.eainde.forecast.llm.ResilientModelClient;
import com.eainde.forecast.model.CitationType;
import com.eainde.forecast.model.DocumentKind;
import com.eainde.forecast.model.ExtractionStrategyType;
import com.eainde.forecast.model.ReportingPeriod;
import com.eainde.forecast.model.RunRequest;
import com.eainde.forecast.model.RunState;
import com.eainde.forecast.model.SourceDocument;
import com.eainde.forecast.model.TraceEntry;
import com.eainde.forecast.model.TraceEntryType;
import com.eainde.forecast.store.ForecastRecord;
import com.eainde.forecast.store.ForecastStore;
import com.eainde.forecast.store.InMemoryForecastStore;
import com.eainde.forecast.support.MutableClock;
import com.eainde.forecast.support.RecordingSleeper;
import com.eainde.forecast.support.ScriptedModelBackend;
import com.eainde.forecast.support.TestDocuments;
import com.eainde.forecast.synthesis.ForecastSynthesizer;
import com.eainde.forecast.synthesis.ForecastValidator;
import com.eainde.forecast.synthesis.SynthesisPromptBuilder;
import com.eainde.forecast.synthesis.SynthesisResponseParser;
import com.eainde.forecast.thread.MdcAwareExecutor;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Drives whole runs through the real graph, tools and validator. Only the document source and
 * the model backend are scripted.
 */
class ForecastCoordinatorTest {

    private static final String VALID = "{\"outlook\": \"Revenue should keep growing on the back of deal wins.\","
            + " \"key_themes\": [\"deals\"], \"sentiment\": \"cautiously optimistic\","
            + " \"risks\": [\"discretionary spending weakness\"], \"opportunities\": [\"AI programmes\"]}";
    private static final String NO_THEMES = "{\"outlook\": \"Metrics point to steady growth.\", \"key_themes\": [],"
            + " \"sentiment\": \"neutral\", \"risks\": [], \"opportunities\": []}";
    private static final String UNBACKED = "{\"outlook\": \"Growth driven by generative AI.\","
            + " \"key_themes\": [\"deals\", \"quantum computing\"], \"sentiment\": \"positive\","
            + " \"risks\": [], \"opportunities\": []}";

    private static final SourceDocument REPORT_Q1 =
            TestDocuments.report("screener/reports/q1", ReportingPeriod.of(2025, 1), TestDocuments.REPORT_Q1);
    private static final SourceDocument REPORT_Q2 =
            TestDocuments.report("screener/reports/q2", ReportingPeriod.of(2025, 2), TestDocuments.REPORT_Q2);
    private static final SourceDocument SCAN_Q3 =
            TestDocuments.scannedReport("screener/reports/q3-scan", ReportingPeriod.of(2025, 3));
    private static final SourceDocument TRANSCRIPT_Q2 =
            TestDocuments.transcript("screener/transcripts/q2", ReportingPeriod.of(2025, 2), TestDocuments.TRANSCRIPT_POSITIVE);
    private static final SourceDocument TRANSCRIPT_Q1 =
            TestDocuments.transcript("screener/transcripts/q1", ReportingPeriod.of(2025, 1), TestDocuments.TRANSCRIPT_CAUTIOUS);

    private MutableClock clock;
    private RecordingSleeper sleeper;
    private ScriptedModelBackend backend;
    private InMemoryForecastStore store;
    private MdcAwareExecutor runExecutor;
    private MdcAwareExecutor workerExecutor;
    private final List<SourceDocument> reports = new ArrayList<>(List.of(REPORT_Q1, REPORT_Q2, SCAN_Q3));
    private final List<SourceDocument> transcripts = new ArrayList<>(List.of(TRANSCRIPT_Q2, TRANSCRIPT_Q1));

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-10-01T10:00:00Z");
        sleeper = new RecordingSleeper(clock);
        backend = new ScriptedModelBackend();
        store = new InMemoryForecastStore();
        runExecutor = MdcAwareExecutor.fixed("test-run", 2);
        workerExecutor = MdcAwareExecutor.fixed("test-worker", 4);
    }

    @AfterEach
    void tearDown() {
        runExecutor.close();
        workerExecutor.close();
        MDC.clear();
    }

    // =========================================================================
    //  Harness
    // =========================================================================

    private DocumentFetcher fetcher() {
        return (sourceId, kind, maxDocuments) -> {
            List<SourceDocument> docs = kind == DocumentKind.REPORT ? reports : transcripts;
            if (docs.isEmpty()) {
                throw new DocumentUnavailableException(sourceId, kind, "No " + kind.directoryName() + " for " + sourceId);
            }
            return docs.subList(0, Math.min(maxDocuments, docs.size()));
        };
    }

    private ForecastCoordinator coordinator(ModelBackend model, Duration baseDelay, ForecastStore forecastStore,
                                            RunSettings settings) {
        OcrEngine ocr = (ctx, document) -> "Revenue from operations\t61,237\nNet profit\t12,105";
        return coordinator(ocr, new ResilientModelClient(model, 3, baseDelay, sleeper), forecastStore, settings);
    }

    private ForecastCoordinator coordinator(OcrEngine ocr, ResilientModelClient modelClient,
                                            ForecastStore forecastStore, RunSettings settings) {
        ForecastWorkflowGraph graph = new ForecastWorkflowGraph(
                fetcher(),
                ExtractionStrategyChain.withDefaults(ocr),
                QualitativeAnalysisPipeline.withDefaults(new HashingEmbeddingModel(), ocr),
                modelClient,
                new SynthesisPromptBuilder(),
                new SynthesisResponseParser(),
                new ForecastSynthesizer(),
                new ForecastValidator(),
                workerExecutor,
                settings);
        return new ForecastCoordinator(graph, forecastStore, runExecutor, clock, settings);
    }

    private ForecastCoordinator coordinator() {
        return coordinator(backend, Duration.ofSeconds(5), store, RunSettings.defaults());
    }

    private static RunRequest request() {
        return RunRequest.of(3, List.of("screener"));
    }

    private static List<String> outcomes(ForecastRunOutcome outcome, TraceEntryType type) {
        return outcome.trace().stream().filter(e -> e.type() == type).map(TraceEntry::outcome).toList();
    }

    private static List<String> states(ForecastRunOutcome outcome) {
        return outcome.trace().stream()
                .filter(e -> e.type() == TraceEntryType.STATE_TRANSITION)
                .map(TraceEntry::step)
                .toList();
    }

    // =========================================================================
    //  Happy path
    // =========================================================================

    @Test
    void run_shouldProduceValidatedForecast_whenEverythingSucceeds() {
        // Arrange
        backend.thenReturn(VALID);

        // Act
        ForecastRunOutcome outcome = coordinator().run(request());

        // Assert
        assertThat(outcome.isSuccess()).as("failure: %s", outcome.message()).isTrue();
        assertThat(outcome.finalState()).isEqualTo(RunState.DONE);
        assertThat(outcome.errorKind()).isNull();
        assertThat(outcome.degraded()).isFalse();
        assertThat(states(outcome)).containsExactly(
                "gathering", "extracting", "analyzing", "synthesizing", "validating", "done");

        assertThat(outcome.result().runId()).isEqualTo(outcome.runId());
        assertThat(outcome.result().quartersAnalyzed()).isEqualTo(3);
        assertThat(outcome.result().metrics().get("total_revenue")).satisfies(m -> {
            assertThat(m.strategy()).isEqualTo(ExtractionStrategyType.OCR);
            assertThat(m.sourceDocumentId()).isEqualTo("screener/reports/q3-scan");
            assertThat(m.confidence()).isLessThanOrEqualTo(0.60 + 1e-9);
        });
        assertThat(outcome.result().qualitative().keyThemes()).contains("deals");
        assertThat(outcome.result().evidence()).anySatisfy(c -> assertThat(c.type()).isEqualTo(CitationType.THEME));
        assertThat(outcome.result().confidenceScores().metrics()).isBetween(0.0, 1.0);

        assertThat(backend.calls()).isEqualTo(1);
        assertThat(outcomes(outcome, TraceEntryType.MODEL_CALL)).containsExactly("OK");
        assertThat(outcomes(outcome, TraceEntryType.PERSISTENCE)).containsExactly("OK");
        assertThat(outcomes(outcome, TraceEntryType.DEGRADED)).isEmpty();
        assertThat(store.findById(outcome.runId())).hasValueSatisfying(r -> {
            assertThat(r.result()).isEqualTo(outcome.result());
            assertThat(r.request().quarterCount()).isEqualTo(3);
            assertThat(r.trace()).isNotEmpty();
        });
    }

    @Test
    void run_shouldGiveTheModelTheExtractedMetricsAndThemes() {
        // Arrange
        backend.thenReturn(VALID);

        // Act
        coordinator().run(request());

        // Assert
        assertThat(backend.prompts()).singleElement().asString()
                .contains("covering the last 3 quarter(s)")
                .containsPattern("- total_revenue: [0-9.]+ INR_Cr \\(Q3 FY2025")
                .contains("- deals |");
    }

    @Test
    void run_shouldClearRunIdFromMdcAfterwards() {
        // Arrange
        backend.thenReturn(VALID);

        // Act
        coordinator().run(request());

        // Assert
        assertThat(MDC.get(ForecastCoordinator.MDC_RUN_ID)).isNull();
    }

    // =========================================================================
    //  Model failures
    // =========================================================================

    @Nested
    @DisplayName("model failures")
    class ModelFailures {

        @Test
        void run_shouldFailRateLimited_whenEveryAttemptIsThrottled() {
            // Arrange
            backend.thenThrow(ModelBackendException.rateLimited("quota exceeded"));

            // Act
            ForecastRunOutcome outcome = coordinator().run(request());

            // Assert
            assertThat(outcome.finalState()).isEqualTo(RunState.FAILED);
            assertThat(outcome.errorKind()).isEqualTo(ErrorKind.RATE_LIMITED);
            assertThat(outcome.failedState()).isEqualTo(RunState.SYNTHESIZING);
            assertThat(outcome.attempts()).isEqualTo(3);
            assertThat(outcome.result()).isNull();
            assertThat(backend.calls()).isEqualTo(3);
            assertThat(sleeper.delays()).containsExactly(Duration.ofSeconds(5), Duration.ofSeconds(10));
            assertThat(outcomes(outcome, TraceEntryType.MODEL_CALL))
                    .containsExactly("RATE_LIMITED", "RATE_LIMITED", "RATE_LIMITED");
            assertThat(states(outcome)).endsWith("failed");
            assertThat(store.findAll()).isEmpty();
        }

        @Test
        void run_shouldRecover_whenRateLimitClearsBeforeLastAttempt() {
            // Arrange
            backend.thenThrow(ModelBackendException.rateLimited("quota exceeded")).thenReturn(VALID);

            // Act
            ForecastRunOutcome outcome = coordinator().run(request());

            // Assert
            assertThat(outcome.isSuccess()).isTrue();
            assertThat(outcomes(outcome, TraceEntryType.MODEL_CALL)).containsExactly("RATE_LIMITED", "OK");
            assertThat(sleeper.delays()).containsExactly(Duration.ofSeconds(5));
        }

        @Test
        void run_shouldRecoverFromMalformedOutput_withinTwoReprompts() {
            // Arrange
            backend.thenReturn("Sure! Here is the outlook you asked for.")
                    .thenReturn("```json\n{\"outlook\": \"cut off")
                    .thenReturn(VALID);

            // Act
            ForecastRunOutcome outcome = coordinator().run(request());

            // Assert
            assertThat(outcome.isSuccess()).isTrue();
            assertThat(outcomes(outcome, TraceEntryType.SYNTHESIS_ATTEMPT)).containsExactly("MALFORMED", "MALFORMED", "OK");
            String original = backend.prompts().get(0).strip();
            assertThat(backend.prompts().get(1)).startsWith(original)
                    .contains("could not be used").contains("Here is the outlook");
            assertThat(backend.prompts().get(2)).startsWith(original)
                    .containsOnlyOnce("Previous response:").contains("cut off");
        }

        @Test
        void run_shouldFailSynthesis_whenOutputNeverParses() {
            // Arrange
            backend.thenReturn("no json here");

            // Act
            ForecastRunOutcome outcome = coordinator().run(request());

            // Assert
            assertThat(outcome.errorKind()).isEqualTo(ErrorKind.SYNTHESIS_FAILED);
            assertThat(outcome.failedState()).isEqualTo(RunState.SYNTHESIZING);
            assertThat(outcome.attempts()).isEqualTo(3);
            assertThat(backend.calls()).isEqualTo(3);
            assertThat(outcome.errorBody()).containsEntry("kind", ErrorKind.SYNTHESIS_FAILED);
        }

        @Test
        void run_shouldFailFast_whenBackendRejectsTheCall() {
            // Arrange
            backend.thenThrow(ModelBackendException.permanent("invalid api key", 401));

            // Act
            ForecastRunOutcome outcome = coordinator().run(request());

            // Assert
            assertThat(outcome.errorKind()).isEqualTo(ErrorKind.MODEL_UNAVAILABLE);
            assertThat(outcome.attempts()).isEqualTo(1);
            assertThat(sleeper.delays()).isEmpty();
        }
    }

    // =========================================================================
    //  Validation
    // =========================================================================

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        void run_shouldReviseOnce_whenModelNamesAnUnbackedTheme() {
            // Arrange
            backend.thenReturn(UNBACKED).thenReturn(VALID);

            // Act
            ForecastRunOutcome outcome = coordinator().run(request());

            // Assert
            assertThat(outcome.isSuccess()).isTrue();
            assertThat(outcomes(outcome, TraceEntryType.VALIDATION)).containsExactly("INVALID", "OK");
            assertThat(states(outcome)).containsExactly("gathering", "extracting", "analyzing",
                    "synthesizing", "validating", "synthesizing", "validating", "done");
            assertThat(backend.prompts().get(1))
                    .contains("previous answer was rejected")
                    .contains("quantum computing");
        }

        @Test
        void run_shouldFailValidation_whenRevisionIsStillInvalid() {
            // Arrange
            backend.thenReturn(UNBACKED);

            // Act
            ForecastRunOutcome outcome = coordinator().run(request());

            // Assert
            assertThat(outcome.errorKind()).isEqualTo(ErrorKind.VALIDATION_FAILED);
            assertThat(outcome.failedState()).isEqualTo(RunState.VALIDATING);
            assertThat(outcome.attempts()).isEqualTo(2);
            assertThat(outcome.message()).contains("quantum computing");
            assertThat(backend.calls()).isEqualTo(2);
        }
    }

    // =========================================================================
    //  Input, documents and budget
    // =========================================================================

    @Test
    void run_shouldRejectInvalidRequest_beforeAnyTransition() {
        // Act
        ForecastRunOutcome outcome = coordinator().run(RunRequest.of(0, List.of("screener")));

        // Assert
        assertThat(outcome.finalState()).isEqualTo(RunState.IDLE);
        assertThat(outcome.errorKind()).isEqualTo(ErrorKind.INPUT_INVALID);
        assertThat(outcome.trace()).isEmpty();
        assertThat(outcome.elapsed()).isEqualTo(Duration.ZERO);
        assertThat(backend.calls()).isZero();
    }

    @Test
    void run_shouldFailDocumentsUnavailable_whenNoSourceHasAnything() {
        // Arrange
        reports.clear();
        transcripts.clear();

        // Act
        ForecastRunOutcome outcome = coordinator().run(request());

        // Assert
        assertThat(outcome.errorKind()).isEqualTo(ErrorKind.DOCUMENTS_UNAVAILABLE);
        assertThat(outcome.failedState()).isEqualTo(RunState.GATHERING);
        assertThat(outcomes(outcome, TraceEntryType.TOOL_CALL)).containsExactly("UNAVAILABLE", "UNAVAILABLE");
        assertThat(backend.calls()).isZero();
    }

    @Test
    void run_shouldCompleteDegraded_whenTranscriptsAreMissing() {
        // Arrange
        transcripts.clear();
        backend.thenReturn(NO_THEMES);

        // Act
        ForecastRunOutcome outcome = coordinator().run(request());

        // Assert
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.degraded()).isTrue();
        assertThat(outcome.result().qualitative().keyThemes()).isEmpty();
        assertThat(outcome.result().confidenceScores().analysis()).isZero();
        assertThat(outcome.result().evidence()).filteredOn(c -> c.type() == CitationType.GAP).isNotEmpty();
        assertThat(outcomes(outcome, TraceEntryType.DEGRADED)).containsExactly("DEGRADED");
        assertThat(backend.prompts()).singleElement().asString().contains("transcripts");
    }

    @Test
    void run_shouldAnalyseImageOnlyTranscript_throughVisionModelOcr() {
        // Arrange
        SourceDocument scannedTranscript = TestDocuments.scannedTranscript("screener/transcripts/q1-scan",
                ReportingPeriod.of(2025, 1));
        reports.set(2, TestDocuments.report("screener/reports/q3", ReportingPeriod.of(2025, 3),
                TestDocuments.REPORT_NARRATIVE));
        transcripts.set(1, scannedTranscript);
        ChatModel visionModel = mock(ChatModel.class);
        when(visionModel.chat(any(ChatRequest.class)))
                .thenThrow(new RateLimitException("slow down"))
                .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from(TestDocuments.TRANSCRIPT_CAUTIOUS)).build());
        ResilientModelClient modelClient = new ResilientModelClient(backend, 3, Duration.ofSeconds(5), sleeper);
        backend.thenReturn(VALID);

        // Act
        ForecastRunOutcome outcome = coordinator(new VisionModelOcrEngine(visionModel, modelClient), modelClient,
                store, RunSettings.defaults()).run(request());

        // Assert
        assertThat(outcome.isSuccess()).as("failure: %s", outcome.message()).isTrue();
        assertThat(outcome.degraded()).isFalse();
        assertThat(states(outcome)).containsExactly(
                "gathering", "extracting", "analyzing", "synthesizing", "validating", "done");
        assertThat(outcome.result().qualitative().keyThemes()).contains("deals");
        assertThat(outcome.trace())
                .filteredOn(e -> e.type() == TraceEntryType.TOOL_CALL && e.step().equals("analysis"))
                .anySatisfy(e -> {
                    assertThat(e.outcome()).isEqualTo("OK");
                    assertThat(e.detail()).startsWith("screener/transcripts/q1-scan:");
                });
        assertThat(outcome.trace())
                .filteredOn(e -> e.type() == TraceEntryType.MODEL_CALL)
                .extracting(TraceEntry::step, TraceEntry::outcome)
                .containsExactly(
                        tuple("ocr:screener/transcripts/q1-scan#1", "RATE_LIMITED"),
                        tuple("ocr:screener/transcripts/q1-scan#1", "OK"),
                        tuple("synthesizing", "OK"));
        assertThat(sleeper.delays()).containsExactly(Duration.ofSeconds(5));
    }

    @Test
    void run_shouldRecordExtractionGap_whenScannedReportCannotBeRead() {
        // Arrange
        reports.set(2, TestDocuments.scannedReport("screener/reports/blank-scan", ReportingPeriod.of(2025, 3)));
        backend.thenReturn(VALID);
        OcrEngine blank = (ctx, document) -> "";
        ForecastWorkflowGraph graph = new ForecastWorkflowGraph(fetcher(), ExtractionStrategyChain.withDefaults(blank),
                QualitativeAnalysisPipeline.withDefaults(new HashingEmbeddingModel(), blank),
                new ResilientModelClient(backend, 3, Duration.ofSeconds(5), sleeper), new SynthesisPromptBuilder(),
                new SynthesisResponseParser(), new ForecastSynthesizer(), new ForecastValidator(), workerExecutor,
                RunSettings.defaults());

        // Act
        ForecastRunOutcome outcome = new ForecastCoordinator(graph, store, runExecutor, clock, RunSettings.defaults())
                .run(request());

        // Assert
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.degraded()).isTrue();
        assertThat(outcome.result().metrics().get("total_revenue").sourceDocumentId()).isEqualTo("screener/reports/q2");
        assertThat(outcome.result().evidence())
                .anySatisfy(c -> {
                    assertThat(c.type()).isEqualTo(CitationType.GAP);
                    assertThat(c.sourceDocumentId()).isEqualTo("screener/reports/blank-scan");
                });
    }

    @Test
    void run_shouldTimeOut_whenRetryDelaysExhaustTheBudget() {
        // Arrange
        backend.thenThrow(ModelBackendException.transientFailure("connection reset"));
        ForecastCoordinator coordinator = coordinator(backend, Duration.ofMinutes(3), store, RunSettings.defaults());

        // Act
        ForecastRunOutcome outcome = coordinator.run(request());

        // Assert
        assertThat(outcome.errorKind()).isEqualTo(ErrorKind.TIMEOUT_EXCEEDED);
        assertThat(outcome.failedState()).isEqualTo(RunState.SYNTHESIZING);
        assertThat(outcome.result()).isNull();
        assertThat(backend.calls()).isEqualTo(2);
        assertThat(sleeper.delays()).containsExactly(Duration.ofMinutes(3), Duration.ofMinutes(6));
    }

    @Test
    void run_shouldAbortStuckRun_whenWallClockBudgetRunsOut() {
        // Arrange
        CountDownLatch never = new CountDownLatch(1);
        ModelBackend stuck = new ModelBackend() {
            @Override
            public String complete(String prompt, Set<String> stopSequences) {
                try {
                    never.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                throw ModelBackendException.transientFailure("interrupted");
            }

            @Override
            public String name() {
                return "stuck";
            }
        };
        ForecastCoordinator coordinator = coordinator(stuck, Duration.ofSeconds(5), store,
                RunSettings.defaults().withBudget(Duration.ofMillis(500)));

        // Act
        ForecastRunOutcome outcome = coordinator.run(request());

        // Assert
        assertThat(outcome.finalState()).isEqualTo(RunState.FAILED);
        assertThat(outcome.errorKind()).isEqualTo(ErrorKind.TIMEOUT_EXCEEDED);
        assertThat(outcome.result()).isNull();
        assertThat(store.findAll()).isEmpty();
    }

    // =========================================================================
    //  Persistence and isolation
    // =========================================================================

    @Test
    void run_shouldStillReturnForecast_whenPersistenceFails() {
        // Arrange
        backend.thenReturn(VALID);
        ForecastStore failing = mock(ForecastStore.class);
        doThrow(new IllegalStateException("disk full")).when(failing).save(any(ForecastRecord.class));

        // Act
        ForecastRunOutcome outcome = coordinator(backend, Duration.ofSeconds(5), failing, RunSettings.defaults())
                .run(request());

        // Assert
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.trace()).filteredOn(e -> e.type() == TraceEntryType.PERSISTENCE)
                .singleElement()
                .satisfies(e -> {
                    assertThat(e.outcome()).isEqualTo("FAILED");
                    assertThat(e.detail()).isEqualTo("IllegalStateException");
                });
    }

    @Test
    void run_shouldNotPersist_whenRunFails() {
        // Arrange
        backend.thenReturn("no json here");
        ForecastStore tracked = mock(ForecastStore.class);

        // Act
        coordinator(backend, Duration.ofSeconds(5), tracked, RunSettings.defaults()).run(request());

        // Assert
        verify(tracked, never()).save(any());
    }

    @Test
    void run_shouldKeepConcurrentRunsIsolated() throws Exception {
        // Arrange
        backend.thenReturn(VALID);
        ForecastCoordinator coordinator = coordinator();
        ExecutorService callers = Executors.newFixedThreadPool(2);

        // Act
        List<ForecastRunOutcome> outcomes = new ArrayList<>();
        try {
            Future<ForecastRunOutcome> first = callers.submit(() -> coordinator.run(request()));
            Future<ForecastRunOutcome> second = callers.submit(() -> coordinator.run(request()));
            outcomes.add(first.get(30, TimeUnit.SECONDS));
            outcomes.add(second.get(30, TimeUnit.SECONDS));
        } finally {
            callers.shutdownNow();
        }

        // Assert
        assertThat(outcomes).allSatisfy(o -> {
            assertThat(o.isSuccess()).isTrue();
            assertThat(o.result().runId()).isEqualTo(o.runId());
            assertThat(o.count(TraceEntryType.STATE_TRANSITION)).isEqualTo(6);
            assertThat(o.count(TraceEntryType.MODEL_CALL)).isEqualTo(1);
            for (int i = 0; i < o.trace().size(); i++) {
                assertThat(o.trace().get(i).sequence()).isEqualTo(i + 1L);
            }
        });
        assertThat(outcomes.get(0).runId()).isNotEqualTo(outcomes.get(1).runId());
        assertThat(store.findAll()).hasSize(2);
    }

    @Test
    void errorBody_shouldDescribeFailure() {
        // Arrange
        backend.thenThrow(ModelBackendException.rateLimited("quota exceeded"));

        // Act
        Map<String, Object> body = coordinator().run(request()).errorBody();

        // Assert
        assertThat(body).containsOnlyKeys("kind", "state", "attempts", "message");
        assertThat(body).containsEntry("kind", ErrorKind.RATE_LIMITED).containsEntry("attempts", 3);
    }
}
