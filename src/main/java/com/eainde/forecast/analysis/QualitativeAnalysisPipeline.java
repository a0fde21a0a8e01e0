package com.eainde.forecast.analysis;

import com.eainde.forecast.context.RunContext;
import com.eainde.forecast.extraction.DocumentText;
import com.eainde.forecast.extraction.DocumentTextReader;
import com.eainde.forecast.extraction.OcrEngine;
import com.eainde.forecast.model.Confidence;
import com.eainde.forecast.model.QualitativeInsight;
import com.eainde.forecast.model.SourceDocument;
import com.eainde.forecast.tool.AnalysisTool;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Transcript to themes: chunk, embed, cluster, score.
 *
 * <p>Clusters that end up with the same label are merged before scoring, so a transcript
 * yields at most one insight per theme.</p>
 */
@Log4j2
public class QualitativeAnalysisPipeline implements AnalysisTool {

    static final int MAX_QUOTE = 300;

    private final DocumentTextReader textReader;
    private final OcrEngine ocrEngine;
    private final SentenceWindowChunker chunker;
    private final EmbeddingModel embeddingModel;
    private final ThemeClusterer clusterer;
    private final SentimentScorer sentimentScorer;
    private final ThemeLabeler labeler;

    public QualitativeAnalysisPipeline(DocumentTextReader textReader,
                                       OcrEngine ocrEngine,
                                       SentenceWindowChunker chunker,
                                       EmbeddingModel embeddingModel,
                                       ThemeClusterer clusterer,
                                       SentimentScorer sentimentScorer,
                                       ThemeLabeler labeler) {
        this.textReader = textReader;
        this.ocrEngine = ocrEngine;
        this.chunker = chunker;
        this.embeddingModel = embeddingModel;
        this.clusterer = clusterer;
        this.sentimentScorer = sentimentScorer;
        this.labeler = labeler;
    }

    /**
     * Default pipeline over the given embedding model.
     */
    public static QualitativeAnalysisPipeline withDefaults(EmbeddingModel embeddingModel, OcrEngine ocrEngine) {
        return new QualitativeAnalysisPipeline(new DocumentTextReader(), ocrEngine,
                SentenceWindowChunker.withDefaults(), embeddingModel, new ThemeClusterer(),
                new LexicalSentimentScorer(), new ThemeLabeler());
    }

    @Override
    public String toolName() {
        return "analysis";
    }

    @Override
    public List<QualitativeInsight> analyze(RunContext ctx, SourceDocument transcript) {
        String text = text(ctx, transcript);
        List<TranscriptChunk> chunks = chunker.chunk(text);
        if (chunks.isEmpty()) {
            log.info("Transcript {} has no text to analyse", transcript.id());
            return List.of();
        }

        List<TextSegment> segments = chunks.stream().map(c -> TextSegment.from(c.text())).toList();
        List<Embedding> embeddings = embeddingModel.embedAll(segments).content();

        Map<String, ThemeCluster> byLabel = new LinkedHashMap<>();
        for (ThemeCluster cluster : clusterer.cluster(chunks, embeddings)) {
            String label = labeler.label(cluster.chunks());
            ThemeCluster existing = byLabel.get(label);
            if (existing == null) {
                byLabel.put(label, cluster);
            } else {
                existing.absorb(cluster);
            }
        }

        List<QualitativeInsight> insights = new ArrayList<>();
        for (Map.Entry<String, ThemeCluster> e : byLabel.entrySet()) {
            insights.add(score(e.getKey(), e.getValue(), transcript.id()));
        }
        insights.sort(Comparator.comparingDouble(QualitativeInsight::confidence).reversed()
                .thenComparing(QualitativeInsight::theme));

        log.info("Transcript {}: {} chunk(s), {} theme(s)", transcript.id(), chunks.size(), insights.size());
        return insights;
    }

    private QualitativeInsight score(String label, ThemeCluster cluster, String documentId) {
        double sentiment = 0;
        for (TranscriptChunk c : cluster.chunks()) {
            sentiment += sentimentScorer.score(c.text());
        }
        sentiment /= cluster.size();

        double cohesion = cluster.cohesion();
        int n = cluster.size();
        double confidence = Confidence.clamp(cohesion * n / (n + 2.0));

        return new QualitativeInsight(label, sentiment, quote(cluster.representative().text()), confidence,
                cohesion, n, documentId);
    }

    private String text(RunContext ctx, SourceDocument transcript) {
        DocumentText text;
        try {
            text = textReader.read(transcript);
        } catch (IOException e) {
            throw new UncheckedIOException("Unreadable transcript " + transcript.id(), e);
        }
        if (text.imageBased()) {
            log.info("Transcript {} is image-based, using OCR", transcript.id());
            return ocrEngine.transcribe(ctx, transcript);
        }
        return text.text();
    }

    static String quote(String text) {
        if (text.length() <= MAX_QUOTE) {
            return text;
        }
        int cut = text.lastIndexOf(' ', MAX_QUOTE - 3);
        return text.substring(0, cut > 0 ? cut : MAX_QUOTE - 3) + "...";
    }
}
