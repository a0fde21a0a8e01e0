package com.eainde.forecast.analysis;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.zip.CRC32;

/**
 * Deterministic bag-of-words embedding: each content word (and each adjacent word pair)
 * is hashed into a signed bucket, and the vector is L2-normalised.
 *
 * <p>Used when no embedding server is configured and in tests. Texts sharing vocabulary
 * land close together, which is all threshold clustering needs.</p>
 */
public class HashingEmbeddingModel implements EmbeddingModel {

    public static final int DEFAULT_DIMENSION = 384;

    static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "and", "or", "but", "of", "to", "in", "on", "for", "with", "at", "by", "from",
            "as", "is", "are", "was", "were", "be", "been", "being", "it", "its", "this", "that", "these",
            "those", "we", "our", "us", "you", "your", "they", "their", "he", "she", "i", "me", "my", "so",
            "have", "has", "had", "do", "does", "did", "will", "would", "can", "could", "should", "also",
            "very", "there", "here", "than", "then", "which", "what", "who", "about", "into", "over", "more",
            "some", "all", "any", "just", "like", "well", "see", "think", "quarter", "year");

    private final int dimension;

    public HashingEmbeddingModel() {
        this(DEFAULT_DIMENSION);
    }

    public HashingEmbeddingModel(int dimension) {
        if (dimension < 8) {
            throw new IllegalArgumentException("dimension must be >= 8");
        }
        this.dimension = dimension;
    }

    @Override
    public Response<List<Embedding>> embedAll(List<TextSegment> textSegments) {
        List<Embedding> embeddings = new ArrayList<>(textSegments.size());
        for (TextSegment segment : textSegments) {
            embeddings.add(Embedding.from(vector(segment.text())));
        }
        return Response.from(embeddings);
    }

    @Override
    public int dimension() {
        return dimension;
    }

    float[] vector(String text) {
        float[] v = new float[dimension];
        List<String> words = contentWords(text);
        for (int i = 0; i < words.size(); i++) {
            add(v, words.get(i), 1.0f);
            if (i + 1 < words.size()) {
                add(v, words.get(i) + " " + words.get(i + 1), 0.5f);
            }
        }
        double norm = 0;
        for (float x : v) {
            norm += x * x;
        }
        if (norm > 0) {
            float scale = (float) (1.0 / Math.sqrt(norm));
            for (int i = 0; i < v.length; i++) {
                v[i] *= scale;
            }
        }
        return v;
    }

    static List<String> contentWords(String text) {
        List<String> words = new ArrayList<>();
        if (text == null) {
            return words;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z0-9']+")) {
            String word = stem(token.replace("'", ""));
            if (word.length() > 2 && !STOP_WORDS.contains(word) && !word.chars().allMatch(Character::isDigit)) {
                words.add(word);
            }
        }
        return words;
    }

    // plural folding only
    private static String stem(String word) {
        if (word.length() > 4 && word.endsWith("ies")) {
            return word.substring(0, word.length() - 3) + "y";
        }
        if (word.length() > 3 && word.endsWith("s") && !word.endsWith("ss")) {
            return word.substring(0, word.length() - 1);
        }
        return word;
    }

    private void add(float[] v, String feature, float weight) {
        CRC32 crc = new CRC32();
        crc.update(feature.getBytes(StandardCharsets.UTF_8));
        long h = crc.getValue();
        int bucket = (int) (h % dimension);
        float sign = ((h >>> 16) & 1L) == 0 ? 1f : -1f;
        v[bucket] += sign * weight;
    }
}
