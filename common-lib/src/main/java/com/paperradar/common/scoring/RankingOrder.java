package com.paperradar.common.scoring;

import com.paperradar.common.model.ArtifactMetrics;
import com.paperradar.common.model.RankedEntry;
import com.paperradar.common.model.RankedList;
import com.paperradar.common.model.ScoreBreakdown;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Leaderboard ordering: total descending, then the more recent publication first, then
 * artifact id ascending. Total order, so equal scores never reshuffle between cycles.
 */
public final class RankingOrder {

    private RankingOrder() {}

    public static Comparator<ScoreBreakdown> comparator(Map<String, ArtifactMetrics> artifacts) {
        Comparator<ScoreBreakdown> byTotal = Comparator.comparingDouble(ScoreBreakdown::total).reversed();
        Comparator<ScoreBreakdown> byRecent = Comparator.comparing(
            (ScoreBreakdown s) -> artifacts.get(s.artifactId()).publishedAt(), Comparator.reverseOrder());
        return byTotal.thenComparing(byRecent).thenComparing(ScoreBreakdown::artifactId);
    }

    /**
     * @param artifacts by id; every scored id must be present
     * @param include   filter applied before ranking
     * @param limit     maximum entries kept
     */
    public static RankedList rank(String cycleId, Instant computedAt, List<ScoreBreakdown> scores,
                                  Map<String, ArtifactMetrics> artifacts,
                                  Predicate<ScoreBreakdown> include, int limit) {
        List<ScoreBreakdown> sorted = scores.stream()
            .filter(include)
            .sorted(comparator(artifacts))
            .limit(limit)
            .toList();
        List<RankedEntry> entries = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            ScoreBreakdown s = sorted.get(i);
            ArtifactMetrics a = artifacts.get(s.artifactId());
            entries.add(new RankedEntry(i + 1, s.artifactId(), a.category(), a.publishedAt(), s.total()));
        }
        return new RankedList(cycleId, computedAt, entries);
    }
}
