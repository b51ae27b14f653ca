package com.paperradar.common.scoring;

import com.paperradar.common.baseline.FieldBaseline;
import com.paperradar.common.baseline.Percentiles;
import com.paperradar.common.baseline.RawMetric;
import com.paperradar.common.model.ArtifactMetrics;
import com.paperradar.common.model.ScoreBreakdown;

import java.time.Duration;

/**
 * Field-normalized multi-factor score of one artifact.
 *
 * <p>An instance is bound to an immutable {@link ScoringPolicy} and {@link ScoringContext},
 * so {@link #score} is a pure function of its arguments: same metrics and baseline give an
 * equal breakdown.
 *
 * <p><b>Saturation.</b> Count signals are normalized against the field's p90 in log space
 * and pushed through {@code s(x) = 1 - exp(-ln5 * x)}, so a field-typical p90 artifact reads
 * 0.8 and no signal ever exceeds 1:
 * <pre>
 *   citationMomentum      = 0.6 * s(log1p(recentVelocity) / p90) + 0.4 * growth
 *   implementationQuality = hasCode ? credit + (1 - credit) * s(log1p(stars) / p90) : 0
 *   authorCredibility     = signal == null ? neutral : s(signal / p90)
 *   novelty               = NoveltyEstimator
 *   reproducibility       = 0.5 code + 0.25 dataset + 0.25 experiments
 *   communityEngagement   = s(log1p(social) / p90)
 *   recency               = exp(-ln2 * ageDays / halfLifeDays)
 * </pre>
 *
 * <p><b>Growth</b> compares recent to prior citation velocity. A ratio of
 * {@value #EXPONENTIAL_GROWTH_RATIO} or more is exponential growth and scores at least
 * {@value #EXPONENTIAL_GROWTH_FLOOR}. With no prior velocity the recent velocity is
 * saturated on its own.
 *
 * <p><b>Total</b> = clamp(sum of weighted components * freshnessBoost, 0, 1).
 */
public final class ScoreCalculator {

    static final double SATURATION = Math.log(5.0);
    static final double MIN_LOG_SCALE = Math.log1p(1.0);

    static final double VELOCITY_SHARE = 0.6;
    static final double GROWTH_SHARE   = 0.4;
    static final double EXPONENTIAL_GROWTH_RATIO = 1.5;
    static final double EXPONENTIAL_GROWTH_FLOOR = 0.75;
    static final double NO_HISTORY_GROWTH_SCALE  = 10.0;

    static final double DEFAULT_AUTHOR_SCALE = 20.0;

    static final double CODE_INCREMENT        = 0.5;
    static final double DATASET_INCREMENT     = 0.25;
    static final double EXPERIMENTS_INCREMENT = 0.25;

    static final double CITATION_RANK_SHARE = 0.4;
    static final double VELOCITY_RANK_SHARE = 0.6;

    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final ScoringPolicy policy;
    private final ScoringContext context;

    public ScoreCalculator(ScoringPolicy policy, ScoringContext context) {
        this.policy = policy;
        this.context = context;
    }

    public ScoringContext context() {
        return context;
    }

    /**
     * @throws com.paperradar.common.exception.MalformedArtifactException when the metrics
     *         fail {@link ArtifactMetrics#validate}
     */
    public ScoreBreakdown score(ArtifactMetrics artifact, FieldBaseline baseline) {
        artifact.validate(context.asOf());

        double ageDays = ageDays(artifact);
        double momentum = citationMomentum(artifact, baseline);
        double implementation = implementationQuality(artifact, baseline);
        double author = authorCredibility(artifact, baseline);
        NoveltyScore novelty = context.novelty().novelty(artifact);
        double reproducibility = reproducibility(artifact);
        double community = communityEngagement(artifact, baseline);
        double recency = recency(ageDays);
        double boost = freshnessBoost(artifact, ageDays);

        ScoreWeights w = policy.weights();
        double weighted = w.citationMomentum() * momentum
            + w.implementationQuality() * implementation
            + w.authorCredibility() * author
            + w.novelty() * novelty.value()
            + w.reproducibility() * reproducibility
            + w.communityEngagement() * community
            + w.recency() * recency;

        return new ScoreBreakdown(
            artifact.id(),
            momentum,
            implementation,
            author,
            novelty.value(),
            reproducibility,
            community,
            recency,
            boost,
            clamp(weighted * boost),
            fieldPercentile(artifact, baseline),
            baseline.insufficient() || novelty.discounted(),
            context.asOf());
    }

    // ── components ──────────────────────────────────────────────────────────

    double citationMomentum(ArtifactMetrics a, FieldBaseline baseline) {
        double velocityScore = saturate(Math.log1p(a.recentVelocity())
            / logScale(baseline.stats(RawMetric.CITATION_VELOCITY)));
        return clamp(VELOCITY_SHARE * velocityScore + GROWTH_SHARE * growth(a));
    }

    static double growth(ArtifactMetrics a) {
        long recent = a.recentVelocity();
        long prior = a.priorVelocity();
        if (prior <= 0) return saturate(recent / NO_HISTORY_GROWTH_SCALE);
        double ratio = (double) recent / prior;
        double growth = saturate(Math.max(0.0, ratio - 1.0) / 2.0);
        return ratio >= EXPONENTIAL_GROWTH_RATIO ? Math.max(growth, EXPONENTIAL_GROWTH_FLOOR) : growth;
    }

    double implementationQuality(ArtifactMetrics a, FieldBaseline baseline) {
        if (!a.hasCode()) return 0.0;
        double credit = policy.codePresenceCredit();
        double stars = saturate(Math.log1p(a.repoStars()) / logScale(baseline.stats(RawMetric.REPO_STARS)));
        return clamp(credit + (1.0 - credit) * stars);
    }

    double authorCredibility(ArtifactMetrics a, FieldBaseline baseline) {
        Double signal = a.authorSignal();
        if (signal == null) return policy.neutralAuthorCredibility();
        Percentiles stats = baseline.stats(RawMetric.AUTHOR_SIGNAL);
        double scale = !stats.isEmpty() && stats.p90() > 0.0 ? stats.p90() : DEFAULT_AUTHOR_SCALE;
        return saturate(signal / scale);
    }

    static double reproducibility(ArtifactMetrics a) {
        double score = 0.0;
        if (a.hasCode()) score += CODE_INCREMENT;
        if (a.hasDataset()) score += DATASET_INCREMENT;
        if (a.hasExperiments()) score += EXPERIMENTS_INCREMENT;
        return Math.min(1.0, score);
    }

    double communityEngagement(ArtifactMetrics a, FieldBaseline baseline) {
        return saturate(Math.log1p(a.socialSignal()) / logScale(baseline.stats(RawMetric.SOCIAL_SIGNAL)));
    }

    double recency(double ageDays) {
        double halfLifeDays = policy.recencyHalfLife().toMillis() / MILLIS_PER_DAY;
        return clamp(Math.exp(-Math.log(2.0) * ageDays / halfLifeDays));
    }

    double freshnessBoost(ArtifactMetrics a, double ageDays) {
        FreshnessPolicy freshness = policy.freshness();
        double thresholdDays = freshness.ageThreshold().toMillis() / MILLIS_PER_DAY;
        if (ageDays >= thresholdDays || a.traction() < freshness.tractionFloor()) return 1.0;
        return 1.0 + (freshness.maxMultiplier() - 1.0) * (1.0 - ageDays / thresholdDays);
    }

    /** Combined citation and velocity rank of the artifact inside its field. */
    static double fieldPercentile(ArtifactMetrics a, FieldBaseline baseline) {
        double citationRank = percentileRank(Math.log1p(a.citationCount()), baseline.stats(RawMetric.CITATIONS));
        double velocityRank = percentileRank(Math.log1p(a.recentVelocity()),
            baseline.stats(RawMetric.CITATION_VELOCITY));
        return clamp(CITATION_RANK_SHARE * citationRank + VELOCITY_RANK_SHARE * velocityRank);
    }

    // ── helpers ─────────────────────────────────────────────────────────────

    /**
     * Piecewise-linear rank through (0, 0), (median, 0.5), (p90, 0.9), (p99, 0.99); above
     * p99 reads 1. An empty distribution ranks everything at 0.5.
     */
    static double percentileRank(double value, Percentiles p) {
        if (p.isEmpty()) return 0.5;
        if (value <= 0.0) return 0.0;
        double[] xs = {0.0, p.median(), p.p90(), p.p99()};
        double[] ys = {0.0, 0.5, 0.9, 0.99};
        for (int i = 1; i < xs.length; i++) {
            if (value <= xs[i]) {
                double span = xs[i] - xs[i - 1];
                if (span <= 0.0) return ys[i];
                return ys[i - 1] + (ys[i] - ys[i - 1]) * (value - xs[i - 1]) / span;
            }
        }
        return 1.0;
    }

    private double ageDays(ArtifactMetrics a) {
        long millis = Duration.between(a.publishedAt(), context.asOf()).toMillis();
        return Math.max(0.0, millis / MILLIS_PER_DAY);
    }

    private static double logScale(Percentiles p) {
        return Math.max(p.p90(), MIN_LOG_SCALE);
    }

    static double saturate(double x) {
        if (!(x > 0.0)) return 0.0;
        return clamp(1.0 - Math.exp(-SATURATION * x));
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
