package com.eainde.forecast.extraction;

import com.eainde.forecast.context.RunContext;
import com.eainde.forecast.error.ErrorKind;
import com.eainde.forecast.error.ForecastException;
import com.eainde.forecast.model.ExtractedMetric;
import com.eainde.forecast.model.ExtractionStrategyType;
import com.eainde.forecast.model.SourceDocument;
import com.eainde.forecast.tool.ExtractionTool;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Runs extraction strategies in priority order and stops at the first non-empty result.
 *
 * <pre>
 *   TABLE (0.95) -> STRUCTURED_TEXT (0.75) -> OCR (0.60, image-based documents only)
 * </pre>
 *
 * <p>A strategy that throws is logged and skipped. The chain only throws when the run's
 * budget runs out.</p>
 */
@Log4j2
public class ExtractionStrategyChain implements ExtractionTool {

    private final DocumentTextReader textReader;
    private final List<ExtractionStrategy> strategies;

    public ExtractionStrategyChain(DocumentTextReader textReader, List<ExtractionStrategy> strategies) {
        this.textReader = textReader;
        List<ExtractionStrategy> ordered = new ArrayList<>(strategies);
        ordered.sort(Comparator.comparingInt(s -> s.type().priority()));
        this.strategies = List.copyOf(ordered);
    }

    /**
     * Default chain: table, structured text, OCR through {@code ocrEngine}.
     */
    public static ExtractionStrategyChain withDefaults(OcrEngine ocrEngine) {
        TableExtractionStrategy table = new TableExtractionStrategy();
        StructuredTextStrategy text = new StructuredTextStrategy();
        return new ExtractionStrategyChain(new DocumentTextReader(),
                List.of(table, text, new OcrFallbackStrategy(ocrEngine, table, text)));
    }

    @Override
    public String toolName() {
        return "extraction";
    }

    @Override
    public List<ExtractedMetric> extract(RunContext ctx, SourceDocument document) {
        return extractDetailed(ctx, document).metrics();
    }

    @Override
    public ExtractionOutcome extractDetailed(RunContext ctx, SourceDocument document) {
        List<ExtractionStrategyType> attempted = new ArrayList<>();
        List<String> failures = new ArrayList<>();

        DocumentText text;
        try {
            text = textReader.read(document);
        } catch (IOException | RuntimeException e) {
            log.warn("Unreadable text layer in {}: {}", document.id(), e.getMessage());
            failures.add("text layer unreadable: " + e.getClass().getSimpleName());
            text = DocumentText.of("");
        }

        for (ExtractionStrategy strategy : strategies) {
            attempted.add(strategy.type());
            List<ExtractedMetric> metrics;
            try {
                metrics = strategy.extract(ctx, document, text);
            } catch (ForecastException e) {
                if (e.getKind() == ErrorKind.TIMEOUT_EXCEEDED) {
                    throw e;
                }
                log.warn("{} extraction gave up on {}: {}", strategy.type(), document.id(), e.getKind());
                failures.add(strategy.type() + " failed: " + e.getKind() + " after " + e.getAttempts() + " attempt(s)");
                continue;
            } catch (RuntimeException e) {
                log.warn("{} extraction failed for {}: {}", strategy.type(), document.id(), e.getMessage());
                failures.add(strategy.type() + " failed: " + e.getMessage());
                continue;
            }
            if (!metrics.isEmpty()) {
                log.info("{} extracted {} metric(s) from {}", strategy.type(), metrics.size(), document.id());
                return new ExtractionOutcome(document.id(), metrics, attempted, Optional.of(strategy.type()), failures);
            }
            log.debug("{} found nothing in {}", strategy.type(), document.id());
        }

        log.warn("No strategy extracted metrics from {}", document.id());
        return new ExtractionOutcome(document.id(), List.of(), attempted, Optional.empty(), failures);
    }
}
