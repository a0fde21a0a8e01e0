package com.eainde.forecast.analysis;

import dev.langchain4j.data.embedding.Embedding;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.List;

/**
 * Single-pass threshold clustering. Each chunk joins the cluster whose centroid is most
 * similar, if that similarity reaches the threshold, and otherwise opens a new cluster.
 * The number of clusters is not fixed in advance.
 */
@Log4j2
public class ThemeClusterer {

    public static final double DEFAULT_THRESHOLD = 0.55;

    private final double threshold;

    public ThemeClusterer() {
        this(DEFAULT_THRESHOLD);
    }

    public ThemeClusterer(double threshold) {
        if (threshold < -1.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be within [-1,1]: " + threshold);
        }
        this.threshold = threshold;
    }

    public List<ThemeCluster> cluster(List<TranscriptChunk> chunks, List<Embedding> embeddings) {
        if (chunks.size() != embeddings.size()) {
            throw new IllegalArgumentException("chunk/embedding count mismatch: "
                    + chunks.size() + " vs " + embeddings.size());
        }
        List<ThemeCluster> clusters = new ArrayList<>();
        for (int i = 0; i < chunks.size(); i++) {
            Embedding e = embeddings.get(i);
            ThemeCluster best = null;
            double bestSim = Double.NEGATIVE_INFINITY;
            for (ThemeCluster c : clusters) {
                double sim = ThemeCluster.similarity(e, c.centroid());
                if (sim > bestSim) {
                    bestSim = sim;
                    best = c;
                }
            }
            if (best != null && bestSim >= threshold) {
                best.add(chunks.get(i), e);
            } else {
                clusters.add(new ThemeCluster(chunks.get(i), e));
            }
        }
        log.debug("Clustered {} chunk(s) into {} cluster(s) at threshold {}", chunks.size(), clusters.size(), threshold);
        return clusters;
    }

    public double threshold() {
        return threshold;
    }
}
