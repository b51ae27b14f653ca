package com.paperradar.common.scoring;

import com.paperradar.common.model.ArtifactMetrics;
import com.paperradar.common.similarity.InMemorySimilarityIndex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.paperradar.common.support.Artifacts.aged;
import static org.junit.jupiter.api.Assertions.*;

class NoveltyEstimatorTest {

    private final NoveltyPolicy policy = NoveltyPolicy.defaults();

    private static ArtifactMetrics titled(String id, String title) {
        return aged(id, "cs.LG", 5).title(title).build();
    }

    private static List<ArtifactMetrics> corpus() {
        List<ArtifactMetrics> corpus = new ArrayList<>();
        for (int i = 0; i < 9; i++) corpus.add(titled("c" + i, "efficient transformers for summarization"));
        corpus.add(titled("rare", "topological persistence homology"));
        return corpus;
    }

    @Test
    @DisplayName("keyword-only novelty is discounted and flagged")
    void keywordOnlyDiscounted() {
        List<ArtifactMetrics> corpus = corpus();
        NoveltyEstimator estimator = NoveltyEstimator.build(corpus, null, policy);

        NoveltyScore rare = estimator.novelty(corpus.get(9));
        assertTrue(rare.discounted());
        assertEquals(policy.fallbackDiscount(), rare.value(), 1e-12);
    }

    @Test
    @DisplayName("terms shared with many recent papers are less novel")
    void commonTermsLessNovel() {
        List<ArtifactMetrics> corpus = corpus();
        NoveltyEstimator estimator = NoveltyEstimator.build(corpus, null, policy);

        double common = estimator.novelty(corpus.get(0)).value();
        double rare = estimator.novelty(corpus.get(9)).value();
        assertTrue(rare > common, "rare=" + rare + " common=" + common);
        assertEquals(policy.fallbackDiscount() * (1.0 - 8.0 / 9.0), common, 1e-12);
    }

    @Test
    @DisplayName("no text and no vector means no evidence of novelty")
    void noEvidence() {
        NoveltyEstimator estimator = NoveltyEstimator.build(corpus(), null, policy);
        NoveltyScore score = estimator.novelty(aged("blank", "cs.LG", 5).build());
        assertEquals(0.0, score.value());
        assertTrue(score.discounted());
    }

    @Test
    @DisplayName("with embeddings, near-duplicates of their neighbours score lower")
    void semanticBlend() {
        InMemorySimilarityIndex index = new InMemorySimilarityIndex(2);
        index.upsert("c0", new float[]{1f, 0f});
        index.upsert("c1", new float[]{0.99f, 0.1f});
        index.upsert("c2", new float[]{1f, 0.05f});
        index.upsert("rare", new float[]{0f, 1f});

        List<ArtifactMetrics> corpus = corpus();
        NoveltyEstimator estimator = NoveltyEstimator.build(corpus, index, new NoveltyPolicy(1.0, 0.0, 0.8, 2));

        NoveltyScore duplicate = estimator.novelty(corpus.get(0));
        NoveltyScore outlier = estimator.novelty(corpus.get(9));
        assertFalse(duplicate.discounted());
        assertTrue(duplicate.value() < 0.05, "duplicate=" + duplicate.value());
        assertTrue(outlier.value() > 0.8, "outlier=" + outlier.value());
    }

    @Test
    @DisplayName("policy weights must sum to one")
    void policyValidation() {
        assertThrows(IllegalArgumentException.class, () -> new NoveltyPolicy(0.5, 0.4, 0.8, 10));
        assertThrows(IllegalArgumentException.class, () -> new NoveltyPolicy(0.6, 0.4, 1.2, 10));
    }
}
