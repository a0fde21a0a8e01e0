package com.eainde.forecast.extraction;

import com.eainde.forecast.context.RunContext;
import com.eainde.forecast.model.ExtractedMetric;
import com.eainde.forecast.model.ExtractionStrategyType;
import com.eainde.forecast.model.SourceDocument;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Reads tabular rows: a label cell followed by numeric cells, separated by tabs, pipes or
 * runs of two or more spaces. The first numeric cell of a row is taken as the current value.
 */
public class TableExtractionStrategy implements ExtractionStrategy {

    private static final Pattern CELL_SEPARATOR = Pattern.compile("\\t+|\\s*\\|\\s*| {2,}");

    @Override
    public ExtractionStrategyType type() {
        return ExtractionStrategyType.TABLE;
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
            List<String> cells = cells(line);
            if (cells.size() < 2) {
                continue;
            }
            String label = cells.get(0);
            Optional<MetricVocabulary.LabelMatch> match = MetricVocabulary.match(label);
            if (match.isEmpty() || found.has(match.get().definition())) {
                continue;
            }
            ParsedNumber.Scale labelScale = FinancialNumberParser.scaleIn(label);
            for (String cell : cells.subList(1, cells.size())) {
                Optional<ParsedNumber> number = FinancialNumberParser.parseCell(cell);
                if (number.isEmpty()) {
                    continue;
                }
                ParsedNumber n = number.get();
                if (n.scale() == ParsedNumber.Scale.NONE && labelScale != ParsedNumber.Scale.NONE) {
                    n = n.withScale(labelScale);
                }
                if (MetricCandidates.compatible(match.get().definition(), n, false)) {
                    found.offer(match.get(), label, n);
                }
                break;
            }
        }
        return found.toList();
    }

    private static List<String> cells(String line) {
        List<String> cells = new ArrayList<>();
        for (String raw : CELL_SEPARATOR.split(line.strip())) {
            String cell = raw.strip();
            if (!cell.isEmpty()) {
                cells.add(cell);
            }
        }
        return cells;
    }
}
