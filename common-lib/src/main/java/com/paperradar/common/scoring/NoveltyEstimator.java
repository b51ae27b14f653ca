package com.paperradar.common.scoring;

import com.paperradar.common.model.ArtifactMetrics;
import com.paperradar.common.similarity.Neighbor;
import com.paperradar.common.similarity.SimilarityIndex;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Novelty of an artifact relative to the recent population.
 *
 * <p>Two signals, blended by {@link NoveltyPolicy}:
 * <ul>
 *   <li><b>Semantic</b>: {@code 1 - mean cosine similarity} of the k nearest neighbours of
 *       the artifact's embedding. Needs an index that holds the artifact's vector.</li>
 *   <li><b>Keyword</b>: mean rarity of the artifact's terms across the other documents of
 *       the population, where rarity is {@code 1 - documentFrequency / documents}.</li>
 * </ul>
 * Without a usable vector the keyword signal alone is used, multiplied by the fallback
 * discount and flagged. No text and no vector yields 0.
 *
 * <p>Document frequencies are frozen when the estimator is built, so one estimator gives
 * the same answer for the same artifact for the whole cycle.
 */
public final class NoveltyEstimator {

    private final NoveltyPolicy policy;
    private final SimilarityIndex index;
    private final Map<String, Integer> documentFrequency;
    private final Set<String> corpusIds;
    private final int corpusSize;

    private NoveltyEstimator(NoveltyPolicy policy, SimilarityIndex index,
                             Map<String, Integer> documentFrequency, Set<String> corpusIds) {
        this.policy = policy;
        this.index = index;
        this.documentFrequency = documentFrequency;
        this.corpusIds = corpusIds;
        this.corpusSize = corpusIds.size();
    }

    /**
     * @param recent population the keyword statistics are drawn from
     * @param index  similarity index, or {@code null} for keyword-only novelty
     */
    public static NoveltyEstimator build(Collection<ArtifactMetrics> recent, SimilarityIndex index,
                                         NoveltyPolicy policy) {
        Map<String, Integer> df = new HashMap<>();
        Set<String> ids = new HashSet<>();
        for (ArtifactMetrics a : recent) {
            if (a == null || a.id() == null || !ids.add(a.id())) continue;
            for (String term : KeywordExtractor.terms(a.title(), a.abstractText())) {
                df.merge(term, 1, Integer::sum);
            }
        }
        return new NoveltyEstimator(policy, index, Map.copyOf(df), Set.copyOf(ids));
    }

    public NoveltyScore novelty(ArtifactMetrics artifact) {
        Optional<Double> semantic = semanticNovelty(artifact);
        Optional<Double> keyword = keywordNovelty(artifact);

        if (semantic.isPresent() && keyword.isPresent()) {
            double blended = policy.semanticWeight() * semantic.get() + policy.keywordWeight() * keyword.get();
            return new NoveltyScore(clamp(blended), false);
        }
        if (semantic.isPresent()) return new NoveltyScore(clamp(semantic.get()), false);
        if (keyword.isPresent()) return new NoveltyScore(clamp(keyword.get() * policy.fallbackDiscount()), true);
        return new NoveltyScore(0.0, true);
    }

    Optional<Double> semanticNovelty(ArtifactMetrics artifact) {
        if (index == null || artifact.id() == null) return Optional.empty();
        Optional<float[]> vector = index.vectorOf(artifact.id());
        if (vector.isEmpty()) return Optional.empty();
        List<Neighbor> neighbours = index.nearest(vector.get(), policy.neighbours(), artifact.id());
        if (neighbours.isEmpty()) return Optional.empty();
        double meanSimilarity = neighbours.stream().mapToDouble(Neighbor::similarity).average().orElse(0.0);
        return Optional.of(1.0 - meanSimilarity);
    }

    Optional<Double> keywordNovelty(ArtifactMetrics artifact) {
        Set<String> terms = KeywordExtractor.terms(artifact.title(), artifact.abstractText());
        if (terms.isEmpty()) return Optional.empty();
        boolean self = artifact.id() != null && corpusIds.contains(artifact.id());
        int others = Math.max(1, corpusSize - (self ? 1 : 0));
        double rarity = 0.0;
        for (String term : terms) {
            int df = documentFrequency.getOrDefault(term, 0) - (self ? 1 : 0);
            rarity += 1.0 - Math.min(1.0, Math.max(0, df) / (double) others);
        }
        return Optional.of(rarity / terms.size());
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
