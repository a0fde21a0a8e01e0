package com.eainde.forecast.extraction;

import com.eainde.forecast.context.RunContext;
import com.eainde.forecast.error.ErrorKind;
import com.eainde.forecast.error.ForecastException;
import com.eainde.forecast.model.ExtractedMetric;
import com.eainde.forecast.model.ExtractionStrategyType;
import com.eainde.forecast.model.ReportingPeriod;
import com.eainde.forecast.model.RunState;
import com.eainde.forecast.model.SourceDocument;
import com.eainde.forecast.support.TestDocuments;
import com.eainde.forecast.support.TestRuns;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class ExtractionStrategyChainTest {

    private final RunContext run = TestRuns.context();

    @Test
    void extractDetailed_shouldStopAtFirstStrategyWithResults() {
        // Arrange
        ExtractionStrategyChain chain = ExtractionStrategyChain.withDefaults(OcrEngine.unavailable());
        SourceDocument doc = TestDocuments.report("r-q2", ReportingPeriod.of(2025, 2), TestDocuments.REPORT_Q2);

        // Act
        ExtractionOutcome outcome = chain.extractDetailed(run, doc);

        // Assert
        assertThat(outcome.winner()).contains(ExtractionStrategyType.TABLE);
        assertThat(outcome.attempted()).containsExactly(ExtractionStrategyType.TABLE);
        assertThat(outcome.metrics()).isNotEmpty();
    }

    @Test
    void extractDetailed_shouldFallThroughToStructuredText_whenNoTableRows() {
        // Arrange
        ExtractionStrategyChain chain = ExtractionStrategyChain.withDefaults(OcrEngine.unavailable());
        SourceDocument doc = TestDocuments.report("r", ReportingPeriod.of(2024, 4), TestDocuments.REPORT_NARRATIVE);

        // Act
        ExtractionOutcome outcome = chain.extractDetailed(run, doc);

        // Assert
        assertThat(outcome.attempted())
                .containsExactly(ExtractionStrategyType.TABLE, ExtractionStrategyType.STRUCTURED_TEXT);
        assertThat(outcome.winner()).contains(ExtractionStrategyType.STRUCTURED_TEXT);
    }

    @Test
    void extractDetailed_shouldUseOcr_whenDocumentIsImageBased() {
        // Arrange
        OcrEngine ocr = (ctx, document) -> "Revenue from operations\t61,237\nNet profit\t12,105";
        ExtractionStrategyChain chain = ExtractionStrategyChain.withDefaults(ocr);
        SourceDocument scanned = TestDocuments.scannedReport("scan-q3", ReportingPeriod.of(2025, 3));

        // Act
        ExtractionOutcome outcome = chain.extractDetailed(run, scanned);

        // Assert
        assertThat(outcome.winner()).contains(ExtractionStrategyType.OCR);
        assertThat(outcome.metrics()).extracting(ExtractedMetric::name)
                .containsExactly("total_revenue", "net_profit");
        assertThat(outcome.metrics()).allSatisfy(m -> assertThat(m.confidence()).isLessThanOrEqualTo(0.60 + 1e-9));
    }

    @Test
    void extractDetailed_shouldRecordFailuresAndNeverThrow_whenEveryStrategyFails() {
        // Arrange
        ExtractionStrategyChain chain = ExtractionStrategyChain.withDefaults(OcrEngine.unavailable());
        SourceDocument scanned = TestDocuments.scannedReport("scan", ReportingPeriod.of(2025, 3));

        // Act
        ExtractionOutcome outcome = chain.extractDetailed(run, scanned);

        // Assert
        assertThat(outcome.isEmpty()).isTrue();
        assertThat(outcome.winner()).isEmpty();
        assertThat(outcome.attempted()).containsExactly(
                ExtractionStrategyType.TABLE, ExtractionStrategyType.STRUCTURED_TEXT, ExtractionStrategyType.OCR);
        assertThat(outcome.failures()).singleElement().asString().startsWith("OCR failed");
        assertThat(outcome.describeFailure()).contains("OCR failed");
    }

    @Test
    void extract_shouldBeDeterministic_forTheSameDocument() {
        // Arrange
        ExtractionStrategyChain chain = ExtractionStrategyChain.withDefaults(OcrEngine.unavailable());
        SourceDocument doc = TestDocuments.report("r-q1", ReportingPeriod.of(2025, 1), TestDocuments.REPORT_Q1);

        // Act
        List<ExtractedMetric> first = chain.extract(run, doc);
        List<ExtractedMetric> second = chain.extract(run, doc);

        // Assert
        assertThat(second).isEqualTo(first);
    }

    @Test
    void constructor_shouldOrderStrategiesByPriority() {
        // Arrange
        ExtractionStrategy text = new StructuredTextStrategy();
        ExtractionStrategy table = new TableExtractionStrategy();
        ExtractionStrategyChain chain = new ExtractionStrategyChain(new DocumentTextReader(), List.of(text, table));
        SourceDocument doc = TestDocuments.report("r-q1", ReportingPeriod.of(2025, 1), TestDocuments.REPORT_Q1);

        // Act
        ExtractionOutcome outcome = chain.extractDetailed(run, doc);

        // Assert
        assertThat(outcome.winner()).contains(ExtractionStrategyType.TABLE);
    }

    @Test
    void extractDetailed_shouldReadPositionedPdfTable_withTableStrategy() {
        // Arrange
        ExtractionStrategyChain chain = ExtractionStrategyChain.withDefaults(OcrEngine.unavailable());
        SourceDocument pdf = TestDocuments.pdfTableReport("r-q2.pdf", ReportingPeriod.of(2025, 2),
                new String[]{"Particulars", "Q2 FY2025", "Q2 FY2024"},
                new String[]{"Revenue from operations", "64,259", "59,692"},
                new String[]{"Net profit", "11,909", "11,342"});

        // Act
        ExtractionOutcome outcome = chain.extractDetailed(run, pdf);

        // Assert
        assertThat(outcome.winner()).contains(ExtractionStrategyType.TABLE);
        assertThat(outcome.metrics()).extracting(ExtractedMetric::name, ExtractedMetric::value)
                .containsExactly(tuple("total_revenue", 64259.0), tuple("net_profit", 11909.0));
        assertThat(outcome.metrics()).allSatisfy(m -> assertThat(m.confidence()).isGreaterThan(0.75));
    }

    @Test
    void extractDetailed_shouldRecordGap_whenOcrModelStaysRateLimited() {
        // Arrange
        OcrEngine rateLimited = (ctx, document) -> {
            throw new ForecastException(ErrorKind.RATE_LIMITED, RunState.EXTRACTING, 3, "Model call failed after 3 attempts");
        };
        ExtractionStrategyChain chain = ExtractionStrategyChain.withDefaults(rateLimited);
        SourceDocument scanned = TestDocuments.scannedReport("scan", ReportingPeriod.of(2025, 3));

        // Act
        ExtractionOutcome outcome = chain.extractDetailed(run, scanned);

        // Assert
        assertThat(outcome.isEmpty()).isTrue();
        assertThat(outcome.failures()).containsExactly("OCR failed: RATE_LIMITED after 3 attempt(s)");
    }

    @Test
    void extractDetailed_shouldPropagateTimeout_fromOcr() {
        // Arrange
        OcrEngine stuck = (ctx, document) -> {
            throw ForecastException.timeout(RunState.EXTRACTING);
        };
        ExtractionStrategyChain chain = ExtractionStrategyChain.withDefaults(stuck);
        SourceDocument scanned = TestDocuments.scannedReport("scan", ReportingPeriod.of(2025, 3));

        // Act + Assert
        assertThatThrownBy(() -> chain.extractDetailed(run, scanned))
                .isInstanceOfSatisfying(ForecastException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.TIMEOUT_EXCEEDED));
    }
}
