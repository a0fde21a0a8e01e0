package com.eainde.forecast.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits a transcript into bounded windows of whole sentences, with adjacent windows
 * sharing a configurable number of sentences.
 *
 * <h3>Why overlap?</h3>
 * <p>Management often states a theme in one sentence and qualifies it in the next
 * ("Demand is strong. That said, BFSI clients remain cautious."). Overlap keeps such pairs
 * together in at least one window.</p>
 *
 * <h3>Usage:</h3>
 * <pre>
 * SentenceWindowChunker chunker = SentenceWindowChunker.builder()
 *         .maxChars(600)
 *         .overlapSentences(1)
 *         .build();
 * List&lt;TranscriptChunk&gt; chunks = chunker.chunk(transcriptText);
 * </pre>
 *
 * <p>A sentence is only ever split when it alone exceeds {@code maxChars}; it is then cut
 * on whitespace.</p>
 */
public class SentenceWindowChunker {

    private static final Logger log = LoggerFactory.getLogger(SentenceWindowChunker.class);

    // abbreviations such as "Mr." and "Rs." do not end a sentence
    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile(
            "(?<!\\b(?:Mr|Ms|Mrs|Dr|Rs|No|vs|Inc|Ltd|Co)\\.)(?<=[.!?][\"')\\]]?)\\s+|\\R\\s*\\R");

    private final int maxChars;
    private final int overlapSentences;

    private SentenceWindowChunker(Builder builder) {
        this.maxChars = builder.maxChars;
        this.overlapSentences = builder.overlapSentences;
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * @param text transcript text
     * @return chunks in document order; empty for blank text
     */
    public List<TranscriptChunk> chunk(String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptyList();
        }

        List<String> sentences = sentences(text);
        List<TranscriptChunk> chunks = new ArrayList<>();

        int start = 0;
        int length = 0;
        int overlap = 0;
        for (int i = 0; i < sentences.size(); i++) {
            int added = sentences.get(i).length() + (i > start ? 1 : 0);
            if (i > start && length + added > maxChars) {
                chunks.add(window(chunks.size(), sentences, start, i, overlap));

                int next = Math.max(start + 1, i - overlapSentences);
                int carried = joinedLength(sentences, next, i);
                if (carried + 1 + sentences.get(i).length() > maxChars) {
                    next = i;
                }
                overlap = i - next;
                start = next;
                length = joinedLength(sentences, start, i);
                added = sentences.get(i).length() + (i > start ? 1 : 0);
            }
            length += added;
        }
        chunks.add(window(chunks.size(), sentences, start, sentences.size(), overlap));

        log.debug("Split {} sentence(s) into {} chunk(s) (maxChars={}, overlap={})",
                sentences.size(), chunks.size(), maxChars, overlapSentences);
        return Collections.unmodifiableList(chunks);
    }

    /**
     * Sentences of {@code text}, with any sentence longer than {@code maxChars} cut into pieces.
     */
    List<String> sentences(String text) {
        List<String> out = new ArrayList<>();
        for (String raw : SENTENCE_BOUNDARY.split(text.strip())) {
            String sentence = raw.strip().replaceAll("\\s+", " ");
            if (sentence.isEmpty()) {
                continue;
            }
            if (sentence.length() <= maxChars) {
                out.add(sentence);
            } else {
                out.addAll(splitLong(sentence));
            }
        }
        return out;
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private List<String> splitLong(String sentence) {
        List<String> pieces = new ArrayList<>();
        int from = 0;
        while (from < sentence.length()) {
            int to = Math.min(sentence.length(), from + maxChars);
            if (to < sentence.length()) {
                int space = sentence.lastIndexOf(' ', to);
                if (space > from) {
                    to = space;
                }
            }
            String piece = sentence.substring(from, to).strip();
            if (!piece.isEmpty()) {
                pieces.add(piece);
            }
            from = to;
        }
        return pieces;
    }

    private static TranscriptChunk window(int index, List<String> sentences, int start, int end, int overlap) {
        return new TranscriptChunk(index, start, end, overlap, String.join(" ", sentences.subList(start, end)));
    }

    private static int joinedLength(List<String> sentences, int start, int end) {
        int length = 0;
        for (int i = start; i < end; i++) {
            length += sentences.get(i).length() + (i > start ? 1 : 0);
        }
        return length;
    }

    // =========================================================================
    //  Builder
    // =========================================================================

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 600 characters per window, one sentence of overlap.
     */
    public static SentenceWindowChunker withDefaults() {
        return builder().build();
    }

    public static class Builder {
        private int maxChars = 600;
        private int overlapSentences = 1;

        public Builder maxChars(int maxChars) {
            if (maxChars < 20) throw new IllegalArgumentException("maxChars must be >= 20");
            this.maxChars = maxChars;
            return this;
        }

        public Builder overlapSentences(int overlapSentences) {
            if (overlapSentences < 0) throw new IllegalArgumentException("overlapSentences must be >= 0");
            this.overlapSentences = overlapSentences;
            return this;
        }

        public SentenceWindowChunker build() {
            return new SentenceWindowChunker(this);
        }
    }
}
