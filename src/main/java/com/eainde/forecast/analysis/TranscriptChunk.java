package com.eainde.forecast.analysis;

/**
 * A window of whole sentences cut from a transcript.
 *
 * <pre>
 *   Chunk 0: sentences [0..5)   overlapSentences = 0
 *   Chunk 1: sentences [4..9)   overlapSentences = 1 (sentence 4 repeats)
 * </pre>
 *
 * @param chunkIndex       zero-based index
 * @param sentenceStart    index of the first sentence, inclusive
 * @param sentenceEnd      index of the last sentence, exclusive
 * @param overlapSentences leading sentences shared with the previous chunk
 * @param text             chunk text
 */
public record TranscriptChunk(
        int chunkIndex,
        int sentenceStart,
        int sentenceEnd,
        int overlapSentences,
        String text
) {

    public boolean isFirstChunk() {
        return chunkIndex == 0;
    }

    public int sentenceCount() {
        return sentenceEnd - sentenceStart;
    }

    @Override
    public String toString() {
        return String.format("Chunk[%d, sentences %d-%d, overlap %d, %d chars]",
                chunkIndex, sentenceStart, sentenceEnd, overlapSentences, text.length());
    }
}
