package com.eainde.forecast.analysis;

/**
 * Scores the polarity of a piece of text.
 */
@FunctionalInterface
public interface SentimentScorer {

    /**
     * @return polarity in [-1,1], 0 when the text carries no polar terms
     */
    double score(String text);
}
