package com.paperradar.common.baseline;

import com.paperradar.common.exception.MalformedArtifactException;
import com.paperradar.common.model.ArtifactMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes per-category reference distributions over a rolling population.
 *
 * <p>Steps:
 * <ol>
 *   <li>Keep well-formed artifacts published within {@code windowDays} before {@code asOf}.
 *       Artifacts that fail {@link ArtifactMetrics#validate} contribute nothing here; the
 *       scorer rejects them too.</li>
 *   <li>Compute global statistics over everything kept.</li>
 *   <li>Per category: own statistics when the sample reaches {@code minSampleSize},
 *       otherwise the global statistics flagged insufficient.</li>
 * </ol>
 *
 * <p>Output depends only on the population contents, the window and {@code asOf}: input
 * order does not matter.
 */
public final class BaselineEstimator {

    private static final Logger log = LoggerFactory.getLogger(BaselineEstimator.class);

    /** Category label of the population-wide baseline. */
    public static final String GLOBAL_CATEGORY = "*";

    private final BaselinePolicy policy;

    public BaselineEstimator(BaselinePolicy policy) {
        this.policy = policy;
    }

    public BaselinePolicy policy() {
        return policy;
    }

    public BaselineSnapshot computeBaselines(Collection<ArtifactMetrics> population, Instant asOf) {
        return computeBaselines(population, policy.windowDays(), asOf);
    }

    public BaselineSnapshot computeBaselines(Collection<ArtifactMetrics> population, int windowDays, Instant asOf) {
        Instant cutoff = asOf.minus(Duration.ofDays(windowDays));

        List<ArtifactMetrics> inWindow = new ArrayList<>();
        Map<String, List<ArtifactMetrics>> byCategory = new TreeMap<>();
        int malformed = 0;
        for (ArtifactMetrics a : population) {
            if (a == null) continue;
            if (!isWellFormed(a, asOf)) {
                malformed++;
                continue;
            }
            if (a.publishedAt().isBefore(cutoff)) continue;
            inWindow.add(a);
            byCategory.computeIfAbsent(a.category(), k -> new ArrayList<>()).add(a);
        }

        FieldBaseline global = new FieldBaseline(GLOBAL_CATEGORY, statistics(inWindow), inWindow.size(),
            asOf, BaselineSource.GLOBAL, inWindow.size() < policy.minSampleSize());

        Map<String, FieldBaseline> baselines = new LinkedHashMap<>();
        List<String> fallbacks = new ArrayList<>();
        byCategory.forEach((category, members) -> {
            if (members.size() >= policy.minSampleSize()) {
                baselines.put(category, new FieldBaseline(category, statistics(members), members.size(),
                    asOf, BaselineSource.CATEGORY, false));
            } else {
                baselines.put(category, global.substituteFor(category, members.size()));
                fallbacks.add(category + "(" + members.size() + ")");
            }
        });

        log.info("BASELINES_COMPUTED window={}d inWindow={} malformedExcluded={} categories={} fallbacks={}",
            windowDays, inWindow.size(), malformed, baselines.size(), fallbacks);
        return new BaselineSnapshot(baselines, global, asOf, windowDays);
    }

    private static boolean isWellFormed(ArtifactMetrics artifact, Instant asOf) {
        try {
            artifact.validate(asOf);
            return true;
        } catch (MalformedArtifactException e) {
            log.debug("BASELINE_SAMPLE_EXCLUDED artifactId={} reason={}", artifact.id(), e.getMessage());
            return false;
        }
    }

    private static Map<RawMetric, Percentiles> statistics(List<ArtifactMetrics> sample) {
        Map<RawMetric, Percentiles> stats = new EnumMap<>(RawMetric.class);
        for (RawMetric metric : RawMetric.values()) {
            double[] values = sample.stream()
                .map(metric::rawValue)
                .filter(v -> v != null)
                .mapToDouble(v -> metric.transform(v))
                .toArray();
            stats.put(metric, Percentiles.of(values));
        }
        return stats;
    }
}
