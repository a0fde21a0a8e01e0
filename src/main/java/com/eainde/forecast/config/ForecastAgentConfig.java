package com.eainde.forecast.config;

import com.eainde.forecast.analysis.HashingEmbeddingModel;
import com.eainde.forecast.analysis.LexicalSentimentScorer;
import com.eainde.forecast.analysis.QualitativeAnalysisPipeline;
import com.eainde.forecast.analysis.SentenceWindowChunker;
import com.eainde.forecast.analysis.ThemeClusterer;
import com.eainde.forecast.analysis.ThemeLabeler;
import com.eainde.forecast.extraction.DocumentTextReader;
import com.eainde.forecast.extraction.ExtractionStrategyChain;
import com.eainde.forecast.extraction.OcrEngine;
import com.eainde.forecast.extraction.VisionModelOcrEngine;
import com.eainde.forecast.fetch.DocumentFetcher;
import com.eainde.forecast.fetch.LocalDirectoryDocumentFetcher;
import com.eainde.forecast.graph.RunSettings;
import com.eainde.forecast.llm.ChatModelBackend;
import com.eainde.forecast.llm.JsonSchemaConverter;
import com.eainde.forecast.llm.ModelBackend;
import com.eainde.forecast.llm.ModelCallLoggingListener;
import com.eainde.forecast.llm.ResilientModelClient;
import com.eainde.forecast.llm.Sleeper;
import com.eainde.forecast.store.ForecastStore;
import com.eainde.forecast.store.InMemoryForecastStore;
import com.eainde.forecast.synthesis.ForecastSynthesizer;
import com.eainde.forecast.synthesis.ForecastValidator;
import com.eainde.forecast.synthesis.SynthesisPromptBuilder;
import com.eainde.forecast.synthesis.SynthesisResponseParser;
import com.eainde.forecast.thread.MdcAwareExecutor;
import com.eainde.forecast.tool.AnalysisTool;
import com.eainde.forecast.tool.ExtractionTool;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Wires the model backend, the tools and the run infrastructure.
 *
 * <p>Providers: {@code gemini} (Google AI, needs {@code forecast.model.api-key}) or
 * {@code ollama} (local server at {@code forecast.model.base-url}). Models are built with
 * {@code maxRetries(0)}: retries belong to {@link ResilientModelClient}.</p>
 */
@Log4j2
@Configuration
public class ForecastAgentConfig {

    static final String NARRATIVE_SCHEMA = "schema/forecast-narrative.schema.json";

    @Value("${forecast.model.provider:gemini}")
    private String provider;

    @Value("${forecast.model.name:gemini-2.0-flash}")
    private String modelName;

    @Value("${forecast.model.api-key:}")
    private String apiKey;

    @Value("${forecast.model.base-url:http://localhost:11434}")
    private String baseUrl;

    @Value("${forecast.model.temperature:0.2}")
    private double temperature;

    @Value("${forecast.model.timeout:PT60S}")
    private Duration modelTimeout;

    @Value("${forecast.model.structured-output:true}")
    private boolean structuredOutput;

    @Value("${forecast.retry.max-attempts:3}")
    private int maxAttempts;

    @Value("${forecast.retry.base-delay:PT5S}")
    private Duration baseDelay;

    @Value("${forecast.run.budget:PT5M}")
    private Duration runBudget;

    @Value("${forecast.synthesis.max-recoveries:2}")
    private int maxSynthesisRecoveries;

    @Value("${forecast.validation.max-revisions:1}")
    private int maxValidationRevisions;

    @Value("${forecast.embedding.provider:hashing}")
    private String embeddingProvider;

    @Value("${forecast.embedding.model:nomic-embed-text}")
    private String embeddingModelName;

    @Value("${forecast.chunking.max-chars:600}")
    private int chunkMaxChars;

    @Value("${forecast.chunking.overlap-sentences:1}")
    private int chunkOverlap;

    @Value("${forecast.clustering.threshold:0.55}")
    private double clusterThreshold;

    // auto: on for providers whose default models accept images
    @Value("${forecast.ocr.enabled:auto}")
    private String ocrSetting;

    @Value("${forecast.ocr.max-pages:5}")
    private int ocrMaxPages;

    @Value("${forecast.ocr.dpi:200}")
    private float ocrDpi;

    @Value("${forecast.fetch.root:./data}")
    private String fetchRoot;

    @Value("${forecast.executor.run-threads:4}")
    private int runThreads;

    @Value("${forecast.executor.worker-threads:8}")
    private int workerThreads;

    // =========================================================================
    //  Model
    // =========================================================================

    @Bean
    public ChatModelListener modelCallLoggingListener() {
        return new ModelCallLoggingListener();
    }

    @Bean
    public ChatModel forecastChatModel(List<ChatModelListener> listeners) {
        switch (provider.toLowerCase(Locale.ROOT)) {
            case "gemini":
                if (apiKey == null || apiKey.isBlank()) {
                    throw new IllegalStateException("forecast.model.api-key is required for the gemini provider");
                }
                return GoogleAiGeminiChatModel.builder()
                        .apiKey(apiKey)
                        .modelName(modelName)
                        .temperature(temperature)
                        .timeout(modelTimeout)
                        .maxRetries(0)
                        .listeners(listeners)
                        .build();
            case "ollama":
                return OllamaChatModel.builder()
                        .baseUrl(baseUrl)
                        .modelName(modelName)
                        .temperature(temperature)
                        .timeout(modelTimeout)
                        .maxRetries(0)
                        .listeners(listeners)
                        .build();
            default:
                throw new IllegalStateException("Unknown forecast.model.provider: " + provider);
        }
    }

    @Bean
    public ModelBackend modelBackend(ChatModel forecastChatModel) {
        String name = provider + ":" + modelName;
        if (structuredOutput) {
            return new ChatModelBackend(forecastChatModel, name,
                    JsonSchemaConverter.fromClasspath("ForecastNarrative", NARRATIVE_SCHEMA));
        }
        return new ChatModelBackend(forecastChatModel, name);
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.system();
    }

    @Bean
    public ResilientModelClient resilientModelClient(ModelBackend modelBackend, Sleeper sleeper) {
        log.info("Model backend {} with {} attempt(s), base delay {}", modelBackend.name(), maxAttempts, baseDelay);
        return new ResilientModelClient(modelBackend, maxAttempts, baseDelay, sleeper);
    }

    @Bean
    public EmbeddingModel embeddingModel() {
        if ("ollama".equalsIgnoreCase(embeddingProvider)) {
            return OllamaEmbeddingModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(embeddingModelName)
                    .timeout(modelTimeout)
                    .build();
        }
        return new HashingEmbeddingModel();
    }

    @Bean
    public OcrEngine ocrEngine(ChatModel forecastChatModel, ResilientModelClient resilientModelClient) {
        if (!ocrEnabled(ocrSetting, provider)) {
            log.info("OCR disabled for provider {}, image-based documents will be recorded as extraction gaps",
                    provider);
            return OcrEngine.unavailable();
        }
        log.info("OCR through {} ({} page(s) max at {} dpi)", resilientModelClient.backendName(), ocrMaxPages, ocrDpi);
        return new VisionModelOcrEngine(forecastChatModel, resilientModelClient, ocrMaxPages, ocrDpi);
    }

    /**
     * {@code true}/{@code false} force the setting. {@code auto} enables OCR for Gemini, whose
     * models all accept images; Ollama needs an explicit opt-in with a vision model such as llava.
     */
    static boolean ocrEnabled(String setting, String provider) {
        String value = setting == null ? "auto" : setting.strip().toLowerCase(Locale.ROOT);
        return switch (value) {
            case "true" -> true;
            case "false" -> false;
            case "auto" -> "gemini".equalsIgnoreCase(provider);
            default -> throw new IllegalStateException("forecast.ocr.enabled must be true, false or auto: " + setting);
        };
    }

    // =========================================================================
    //  Tools
    // =========================================================================

    @Bean
    public ExtractionTool extractionTool(OcrEngine ocrEngine) {
        return ExtractionStrategyChain.withDefaults(ocrEngine);
    }

    @Bean
    public AnalysisTool analysisTool(EmbeddingModel embeddingModel, OcrEngine ocrEngine) {
        SentenceWindowChunker chunker = SentenceWindowChunker.builder()
                .maxChars(chunkMaxChars)
                .overlapSentences(chunkOverlap)
                .build();
        return new QualitativeAnalysisPipeline(new DocumentTextReader(), ocrEngine, chunker, embeddingModel,
                new ThemeClusterer(clusterThreshold), new LexicalSentimentScorer(), new ThemeLabeler());
    }

    @Bean
    public SynthesisPromptBuilder synthesisPromptBuilder() {
        return new SynthesisPromptBuilder();
    }

    @Bean
    public SynthesisResponseParser synthesisResponseParser() {
        return new SynthesisResponseParser();
    }

    @Bean
    public ForecastSynthesizer forecastSynthesizer() {
        return new ForecastSynthesizer();
    }

    @Bean
    public ForecastValidator forecastValidator() {
        return new ForecastValidator();
    }

    // =========================================================================
    //  Collaborators and run infrastructure
    // =========================================================================

    @Bean
    public DocumentFetcher documentFetcher() {
        return new LocalDirectoryDocumentFetcher(Path.of(fetchRoot));
    }

    @Bean
    public ForecastStore forecastStore() {
        return new InMemoryForecastStore();
    }

    @Bean(destroyMethod = "close")
    public MdcAwareExecutor forecastRunExecutor() {
        return MdcAwareExecutor.fixed("forecast-run", runThreads);
    }

    @Bean(destroyMethod = "close")
    public MdcAwareExecutor forecastWorkerExecutor() {
        return MdcAwareExecutor.fixed("forecast-worker", workerThreads);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RunSettings runSettings() {
        return new RunSettings(runBudget, maxSynthesisRecoveries, maxValidationRevisions);
    }
}
