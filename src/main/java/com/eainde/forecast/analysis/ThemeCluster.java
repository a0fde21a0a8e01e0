package com.eainde.forecast.analysis;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.store.embedding.CosineSimilarity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Chunks grouped around a running centroid.
 */
public class ThemeCluster {

    private final List<TranscriptChunk> chunks = new ArrayList<>();
    private final List<Embedding> embeddings = new ArrayList<>();
    private float[] sum;

    ThemeCluster(TranscriptChunk chunk, Embedding embedding) {
        this.sum = new float[embedding.dimension()];
        add(chunk, embedding);
    }

    void add(TranscriptChunk chunk, Embedding embedding) {
        chunks.add(chunk);
        embeddings.add(embedding);
        float[] v = embedding.vector();
        for (int i = 0; i < sum.length; i++) {
            sum[i] += v[i];
        }
    }

    void absorb(ThemeCluster other) {
        for (int i = 0; i < other.chunks.size(); i++) {
            add(other.chunks.get(i), other.embeddings.get(i));
        }
    }

    public Embedding centroid() {
        float[] c = new float[sum.length];
        for (int i = 0; i < c.length; i++) {
            c[i] = sum[i] / chunks.size();
        }
        return Embedding.from(c);
    }

    /**
     * Mean cosine similarity of the members to the centroid, clamped to [0,1].
     */
    public double cohesion() {
        Embedding centroid = centroid();
        double total = 0;
        for (Embedding e : embeddings) {
            total += similarity(e, centroid);
        }
        return Math.max(0.0, Math.min(1.0, total / embeddings.size()));
    }

    /**
     * Member closest to the centroid. Ties go to the earlier chunk.
     */
    public TranscriptChunk representative() {
        Embedding centroid = centroid();
        int best = 0;
        double bestSim = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < embeddings.size(); i++) {
            double sim = similarity(embeddings.get(i), centroid);
            if (sim > bestSim) {
                bestSim = sim;
                best = i;
            }
        }
        return chunks.get(best);
    }

    public List<TranscriptChunk> chunks() {
        return Collections.unmodifiableList(chunks);
    }

    public int size() {
        return chunks.size();
    }

    static double similarity(Embedding a, Embedding b) {
        if (isZero(a) || isZero(b)) {
            return 0.0;
        }
        return CosineSimilarity.between(a, b);
    }

    private static boolean isZero(Embedding e) {
        for (float x : e.vector()) {
            if (x != 0f) {
                return false;
            }
        }
        return true;
    }
}
