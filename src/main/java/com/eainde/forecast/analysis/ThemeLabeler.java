package com.eainde.forecast.analysis;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Names a cluster. Known earnings-call themes are tried first; otherwise the most frequent
 * content word (ties alphabetical) is used.
 */
public class ThemeLabeler {

    public static final String FALLBACK_LABEL = "general";

    private static final Map<String, Pattern> THEMES = new LinkedHashMap<>();

    static {
        theme("demand", "demand", "pipeline", "spending", "spend", "consumption", "client budgets?", "discretionary");
        theme("attrition", "attrition", "headcount", "hiring", "talent", "employees?", "workforce", "utili[sz]ation", "freshers?");
        theme("guidance", "guidance", "outlook", "forecast", "expect(?:s|ed|ation|ations)?", "target", "aspiration");
        theme("margins", "margins?", "profitability", "operating leverage", "costs?", "ebit", "wage hikes?");
        theme("deals", "deals?", "tcv", "contracts?", "order book", "bookings?", "deal wins?", "mega deals?");
        theme("pricing", "pricing", "prices?", "rate cards?", "discounts?");
        theme("macro", "macro(?:economic)?", "inflation", "recession", "geopolitic(?:s|al)", "currency", "interest rates?", "tariffs?");
    }

    private static void theme(String label, String... keywords) {
        THEMES.put(label, Pattern.compile("(?i)(?<![a-z])(?:" + String.join("|", keywords) + ")(?![a-z])"));
    }

    public String label(List<TranscriptChunk> chunks) {
        StringBuilder sb = new StringBuilder();
        for (TranscriptChunk c : chunks) {
            sb.append(c.text()).append('\n');
        }
        String text = sb.toString();

        String best = null;
        int bestHits = 0;
        for (Map.Entry<String, Pattern> e : THEMES.entrySet()) {
            int hits = count(e.getValue().matcher(text));
            if (hits > bestHits) {
                bestHits = hits;
                best = e.getKey();
            }
        }
        if (best != null) {
            return best;
        }
        return mostFrequentWord(text);
    }

    private static int count(Matcher m) {
        int n = 0;
        while (m.find()) {
            n++;
        }
        return n;
    }

    private static String mostFrequentWord(String text) {
        Map<String, Integer> counts = new TreeMap<>();
        for (String w : HashingEmbeddingModel.contentWords(text)) {
            if (w.length() >= 4) {
                counts.merge(w.toLowerCase(Locale.ROOT), 1, Integer::sum);
            }
        }
        String best = FALLBACK_LABEL;
        int bestCount = 0;
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            if (e.getValue() > bestCount) {
                bestCount = e.getValue();
                best = e.getKey();
            }
        }
        return best;
    }
}
