package com.eainde.forecast.analysis;

import java.util.Locale;
import java.util.Set;

/**
 * Lexicon polarity tuned for earnings calls: {@code (pos - neg) / (pos + neg)}.
 *
 * <p>A polar word preceded within three tokens by a negator ("not", "no", "never", "n't",
 * "without", "hardly") counts for the opposite side.</p>
 */
public class LexicalSentimentScorer implements SentimentScorer {

    private static final int NEGATION_WINDOW = 3;

    private static final Set<String> POSITIVE = Set.of(
            "strong", "stronger", "strongest", "robust", "growth", "grow", "grew", "growing", "improve",
            "improved", "improvement", "improving", "record", "healthy", "resilient", "confident", "confidence",
            "optimistic", "positive", "gain", "gains", "expand", "expanded", "expansion", "momentum", "win", "wins",
            "won", "accelerate", "accelerated", "acceleration", "solid", "best", "beat", "exceeded", "upbeat",
            "opportunity", "opportunities", "recovery", "recovering", "stable", "steady", "good", "great",
            "excellent", "encouraging", "increase", "increased", "higher", "outperform", "profitable");

    private static final Set<String> NEGATIVE = Set.of(
            "weak", "weaker", "weakness", "decline", "declined", "declining", "slowdown", "slow", "slower",
            "pressure", "pressures", "headwind", "headwinds", "uncertain", "uncertainty", "cautious", "caution",
            "concern", "concerns", "risk", "risks", "challenging", "challenge", "challenges", "soft", "softness",
            "delay", "delays", "delayed", "cut", "cuts", "loss", "losses", "lower", "decrease", "decreased", "drop",
            "dropped", "volatile", "volatility", "attrition", "deferral", "deferred", "muted", "negative",
            "disappointing", "miss", "missed", "downturn", "recession", "inflation", "layoffs");

    private static final Set<String> NEGATORS = Set.of(
            "not", "no", "never", "without", "hardly", "barely", "neither", "nor", "dont", "didnt", "doesnt",
            "isnt", "wasnt", "arent", "werent", "cannot", "cant", "wont");

    @Override
    public double score(String text) {
        if (text == null || text.isBlank()) {
            return 0.0;
        }
        String[] tokens = text.toLowerCase(Locale.ROOT).replace("n't", " not").split("[^a-z']+");
        int pos = 0;
        int neg = 0;
        for (int i = 0; i < tokens.length; i++) {
            String token = tokens[i].replace("'", "");
            boolean positive = POSITIVE.contains(token);
            boolean negative = NEGATIVE.contains(token);
            if (!positive && !negative) {
                continue;
            }
            if (negated(tokens, i)) {
                positive = !positive;
            }
            if (positive) {
                pos++;
            } else {
                neg++;
            }
        }
        if (pos + neg == 0) {
            return 0.0;
        }
        return (double) (pos - neg) / (pos + neg);
    }

    private static boolean negated(String[] tokens, int index) {
        for (int j = Math.max(0, index - NEGATION_WINDOW); j < index; j++) {
            if (NEGATORS.contains(tokens[j].replace("'", ""))) {
                return true;
            }
        }
        return false;
    }
}
