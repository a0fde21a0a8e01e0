package com.eainde.forecast.extraction;

import com.eainde.forecast.context.RunContext;
import com.eainde.forecast.model.ExtractedMetric;
import com.eainde.forecast.model.ExtractionStrategyType;
import com.eainde.forecast.model.SourceDocument;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds {@code <label> ... <number>} pairs in running text. The number must follow the label
 * within {@value #MAX_DISTANCE} characters and inside the same line and sentence.
 */
public class StructuredTextStrategy implements ExtractionStrategy {

    static final int MAX_DISTANCE = 120;

    // "Rs. 500" and "No. 3" do not end a sentence
    private static final Pattern SENTENCE_END = Pattern.compile("(?<!\\bRs)(?<!\\bNo)[.!?;](?=\\s|$)");

    @Override
    public ExtractionStrategyType type() {
        return ExtractionStrategyType.STRUCTURED_TEXT;
    }

    @Override
    public List<ExtractedMetric> extract(RunContext ctx, SourceDocument document, DocumentText text) {
        return extract(document, text.text(), type());
    }

    List<ExtractedMetric> extract(SourceDocument document, String text, ExtractionStrategyType as) {
        MetricCandidates found = new MetricCandidates(document, as);
        if (text == null || text.isBlank()) {
            return found.toList();
        }

        for (String line : text.split("\\R|\\f")) {
            List<MetricVocabulary.PhraseHit> hits = MetricVocabulary.findAll(line);
            for (int i = 0; i < hits.size(); i++) {
                MetricVocabulary.PhraseHit hit = hits.get(i);
                MetricDefinition definition = hit.match().definition();
                if (found.has(definition)) {
                    continue;
                }
                int limit = windowEnd(line, hit.end(), i + 1 < hits.size() ? hits.get(i + 1).start() : line.length());
                String window = line.substring(hit.end(), limit);
                for (ParsedNumber n : FinancialNumberParser.findAll(window)) {
                    if (MetricCandidates.compatible(definition, n, true)) {
                        found.offer(hit.match(), hit.label(), n);
                        break;
                    }
                }
            }
        }
        return found.toList();
    }

    /**
     * End of the search window: the next label, the sentence end, or the distance cap.
     */
    private static int windowEnd(String line, int from, int nextLabel) {
        int limit = Math.min(Math.min(line.length(), from + MAX_DISTANCE), nextLabel);
        Matcher end = SENTENCE_END.matcher(line);
        end.region(from, limit);
        return end.find() ? end.start() : limit;
    }
}
