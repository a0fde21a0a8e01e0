package com.eainde.forecast.synthesis;

/**
 * Buckets a sentiment score in [-1,1].
 */
public final class SentimentLabel {

    public static final String POSITIVE = "positive";
    public static final String CAUTIOUSLY_OPTIMISTIC = "cautiously optimistic";
    public static final String NEUTRAL = "neutral";
    public static final String CAUTIOUS = "cautious";
    public static final String NEGATIVE = "negative";

    private SentimentLabel() {
    }

    public static String of(double score) {
        if (score > 0.6) return POSITIVE;
        if (score > 0.1) return CAUTIOUSLY_OPTIMISTIC;
        if (score >= -0.1) return NEUTRAL;
        if (score >= -0.6) return CAUTIOUS;
        return NEGATIVE;
    }
}
