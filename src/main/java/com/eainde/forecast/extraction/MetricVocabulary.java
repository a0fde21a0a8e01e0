package com.eainde.forecast.extraction;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Maps free-form labels onto {@link MetricDefinition}s.
 *
 * <p>Canonical labels match with quality 1.0, aliases with 0.9. Unit and currency words
 * (crore, INR, %, ...) are ignored when comparing a table label.</p>
 */
public final class MetricVocabulary {

    public static final double CANONICAL_QUALITY = 1.0;
    public static final double ALIAS_QUALITY = 0.9;

    private static final Set<String> UNIT_WORDS = Set.of(
            "rs", "inr", "cr", "crore", "crores", "lakh", "lakhs", "lac", "lacs", "million", "mn",
            "billion", "bn", "in", "percent", "per", "cent", "x", "times", "consolidated", "standalone");

    private static final Map<String, LabelMatch> LABELS = new LinkedHashMap<>();
    private static final Pattern PHRASES;

    static {
        for (MetricDefinition d : MetricDefinition.values()) {
            LABELS.putIfAbsent(d.canonicalLabel(), new LabelMatch(d, CANONICAL_QUALITY));
            LABELS.putIfAbsent(normalize(d.metricName()), new LabelMatch(d, CANONICAL_QUALITY));
        }
        for (MetricDefinition d : MetricDefinition.values()) {
            for (String alias : d.aliases()) {
                LABELS.putIfAbsent(alias, new LabelMatch(d, ALIAS_QUALITY));
            }
        }
        // longest first so "net profit margin" wins over "net profit"
        String alternation = LABELS.keySet().stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(label -> List.of(label.split(" ")).stream()
                        .map(Pattern::quote)
                        .collect(Collectors.joining("[\\s\\-/]+")))
                .collect(Collectors.joining("|"));
        PHRASES = Pattern.compile("(?i)(?<![a-z0-9])(?:" + alternation + ")(?![a-z0-9])");
    }

    private MetricVocabulary() {
    }

    /**
     * @param definition matched metric
     * @param quality    1.0 for a canonical label, 0.9 for an alias
     */
    public record LabelMatch(MetricDefinition definition, double quality) {
    }

    /**
     * A vocabulary phrase found in running text.
     */
    public record PhraseHit(LabelMatch match, String label, int start, int end) {
    }

    /**
     * Matches a whole label, such as the first cell of a table row.
     */
    public static Optional<LabelMatch> match(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String normalized = stripUnits(normalize(label));
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(LABELS.get(normalized));
    }

    /**
     * Finds every vocabulary phrase in {@code text}, in order of appearance.
     */
    public static List<PhraseHit> findAll(String text) {
        List<PhraseHit> hits = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return hits;
        }
        Matcher m = PHRASES.matcher(text);
        while (m.find()) {
            LabelMatch match = LABELS.get(normalize(m.group()));
            if (match != null) {
                hits.add(new PhraseHit(match, m.group(), m.start(), m.end()));
            }
        }
        return hits;
    }

    static String normalize(String label) {
        return label.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9%]+", " ")
                .replace("%", " ")
                .trim()
                .replaceAll("\\s+", " ");
    }

    private static String stripUnits(String normalized) {
        return List.of(normalized.split(" ")).stream()
                .filter(token -> !UNIT_WORDS.contains(token))
                .collect(Collectors.joining(" "))
                .trim();
    }
}
