package com.eainde.forecast.extraction;

import com.eainde.forecast.context.RunContext;
import com.eainde.forecast.model.ExtractedMetric;
import com.eainde.forecast.model.ExtractionStrategyType;
import com.eainde.forecast.model.SourceDocument;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.List;

/**
 * Last resort for image-based documents: OCR the pages, then run table and structured-text
 * parsing on the transcript. Confidence is rescaled to {@code 0.6 * inner / 0.95} so an OCR
 * value never outranks a value read from a text layer.
 */
@Log4j2
public class OcrFallbackStrategy implements ExtractionStrategy {

    private final OcrEngine ocrEngine;
    private final TableExtractionStrategy table;
    private final StructuredTextStrategy structuredText;

    public OcrFallbackStrategy(OcrEngine ocrEngine, TableExtractionStrategy table, StructuredTextStrategy structuredText) {
        this.ocrEngine = ocrEngine;
        this.table = table;
        this.structuredText = structuredText;
    }

    @Override
    public ExtractionStrategyType type() {
        return ExtractionStrategyType.OCR;
    }

    @Override
    public List<ExtractedMetric> extract(RunContext ctx, SourceDocument document, DocumentText text) {
        if (!text.imageBased()) {
            return List.of();
        }
        String transcript = ocrEngine.transcribe(ctx, document);
        if (transcript == null || transcript.isBlank()) {
            log.debug("OCR produced no text for {}", document.id());
            return List.of();
        }

        List<ExtractedMetric> inner = table.extract(document, transcript, ExtractionStrategyType.TABLE);
        if (inner.isEmpty()) {
            inner = structuredText.extract(document, transcript, ExtractionStrategyType.STRUCTURED_TEXT);
        }

        double ceiling = type().confidenceCeiling();
        double innerMax = ExtractionStrategyType.TABLE.confidenceCeiling();
        List<ExtractedMetric> rescaled = new ArrayList<>(inner.size());
        for (ExtractedMetric m : inner) {
            rescaled.add(m.withStrategy(type(), ceiling * m.confidence() / innerMax));
        }
        return rescaled;
    }
}
