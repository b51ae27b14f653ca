package com.paperradar.common.scoring;

import com.paperradar.common.baseline.BaselineEstimator;
import com.paperradar.common.baseline.BaselinePolicy;
import com.paperradar.common.baseline.BaselineSnapshot;
import com.paperradar.common.baseline.FieldBaseline;
import com.paperradar.common.exception.MalformedArtifactException;
import com.paperradar.common.model.ArtifactMetrics;
import com.paperradar.common.model.ScoreBreakdown;
import com.paperradar.common.support.Artifacts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.paperradar.common.support.Artifacts.AS_OF;
import static com.paperradar.common.support.Artifacts.aged;
import static org.junit.jupiter.api.Assertions.*;

class ScoreCalculatorTest {

    private static final String FIELD = "cs.LG";

    private final ScoringPolicy policy = ScoringPolicy.defaults();
    private List<ArtifactMetrics> population;
    private BaselineSnapshot baselines;
    private ScoreCalculator calculator;

    @BeforeEach
    void setUp() {
        population = Artifacts.population(FIELD, 300, 42);
        baselines = new BaselineEstimator(BaselinePolicy.defaults()).computeBaselines(population, AS_OF);
        NoveltyEstimator novelty = NoveltyEstimator.build(population, null, policy.novelty());
        calculator = new ScoreCalculator(policy, new ScoringContext(AS_OF, novelty));
    }

    private FieldBaseline field() {
        return baselines.forCategory(FIELD);
    }

    // ── whole-score properties ────────────────────────────────────────────

    @Nested
    @DisplayName("score()")
    class Score {

        @Test
        @DisplayName("every component and the total stay within [0, 1]")
        void componentsInRange() {
            for (ArtifactMetrics a : population) {
                ScoreBreakdown s = calculator.score(a, field());
                double[] values = {s.citationMomentum(), s.implementationQuality(), s.authorCredibility(),
                    s.novelty(), s.reproducibility(), s.communityEngagement(), s.recency(), s.total(),
                    s.fieldPercentile()};
                for (double v : values) assertTrue(v >= 0.0 && v <= 1.0, a.id() + " -> " + s);
                assertTrue(s.freshnessBoost() >= 1.0);
            }
        }

        @Test
        @DisplayName("same inputs give an equal breakdown")
        void pure() {
            ArtifactMetrics a = population.get(17);
            assertEquals(calculator.score(a, field()), calculator.score(a, field()));
        }

        @Test
        @DisplayName("2-day-old artifact with no signals scores recency alone, without boost")
        void zeroSignalScenario() {
            ArtifactMetrics a = aged("fresh", FIELD, 2).authorSignal(0.0).build();
            ScoreBreakdown s = calculator.score(a, field());

            assertEquals(1.0, s.freshnessBoost());
            assertEquals(0.0, s.implementationQuality());
            assertEquals(0.0, s.citationMomentum());
            assertEquals(0.0, s.novelty());
            assertEquals(Math.exp(-Math.log(2) * 2 / 23.0), s.recency(), 1e-12);
            assertEquals(policy.weights().recency() * s.recency(), s.total(), 1e-12);
        }

        @Test
        @DisplayName("2-day-old titled artifact with no signals and no author data: neutral author, discounted keyword novelty")
        void zeroSignalScenarioWithoutAuthorData() {
            ArtifactMetrics a = aged("fresh-titled", FIELD, 2).title("lattice quantum gravity").build();
            ScoreBreakdown s = calculator.score(a, field());

            assertEquals(1.0, s.freshnessBoost());
            assertEquals(0.0, s.citationMomentum());
            assertEquals(0.0, s.implementationQuality());
            assertEquals(0.0, s.reproducibility());
            assertEquals(0.0, s.communityEngagement());
            assertEquals(policy.neutralAuthorCredibility(), s.authorCredibility(), 1e-12);
            // every term is absent from the population, discounted for lack of a vector
            assertEquals(policy.novelty().fallbackDiscount(), s.novelty(), 1e-12);

            double recency = Math.exp(-Math.log(2) * 2 / 23.0);
            ScoreWeights w = policy.weights();
            double expected = w.recency() * recency
                + w.authorCredibility() * policy.neutralAuthorCredibility()
                + w.novelty() * policy.novelty().fallbackDiscount();
            assertEquals(expected, s.total(), 1e-12);
        }

        @Test
        @DisplayName("an insufficient baseline marks the score low-confidence")
        void insufficientBaselineIsLowConfidence() {
            ArtifactMetrics a = aged("x", "math.AG", 10).title("motivic cohomology").build();
            assertTrue(calculator.score(a, baselines.forCategory("math.AG")).lowConfidence());
        }

        @Test
        @DisplayName("malformed metrics are rejected")
        void malformed() {
            assertThrows(MalformedArtifactException.class,
                () -> calculator.score(aged("future", FIELD, -3).build(), field()));
            assertThrows(MalformedArtifactException.class,
                () -> calculator.score(aged("neg", FIELD, 3).citations(-1, 0, 0).build(), field()));
            assertThrows(MalformedArtifactException.class,
                () -> calculator.score(ArtifactMetrics.builder("nocat").publishedAt(AS_OF).build(), field()));
        }

        @Test
        @DisplayName("publication up to a day ahead is tolerated as clock skew")
        void slightFutureTolerated() {
            ScoreBreakdown s = calculator.score(aged("skew", FIELD, -0.5).build(), field());
            assertEquals(1.0, s.recency());
        }
    }

    // ── components ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("components")
    class Components {

        @Test
        @DisplayName("momentum never decreases as recent velocity grows")
        void momentumMonotone() {
            double previous = -1.0;
            for (long recent = 0; recent <= 400; recent += 5) {
                ArtifactMetrics a = aged("m", FIELD, 20).citations(100 + recent, 100, 90).build();
                double momentum = calculator.citationMomentum(a, field());
                assertTrue(momentum >= previous, "recent=" + recent + " momentum=" + momentum);
                previous = momentum;
            }
        }

        @Test
        @DisplayName("recent velocity 1.5x the prior counts as exponential growth")
        void exponentialGrowthFloor() {
            ArtifactMetrics growing = aged("g", FIELD, 20).citations(35, 20, 10).build();
            assertEquals(ScoreCalculator.EXPONENTIAL_GROWTH_FLOOR, ScoreCalculator.growth(growing), 1e-12);

            ArtifactMetrics steady = aged("s", FIELD, 20).citations(30, 20, 10).build();
            assertEquals(0.0, ScoreCalculator.growth(steady), 1e-12);
        }

        @Test
        @DisplayName("implementation quality is zero without code, credit plus stars with it")
        void implementationQuality() {
            ArtifactMetrics noCode = aged("n", FIELD, 20).repoStars(5000).build();
            assertEquals(0.0, calculator.implementationQuality(noCode, field()));

            ArtifactMetrics bare = aged("b", FIELD, 20).hasCode(true).build();
            assertEquals(policy.codePresenceCredit(), calculator.implementationQuality(bare, field()), 1e-12);

            ArtifactMetrics popular = aged("p", FIELD, 20).hasCode(true).repoStars(5000).build();
            assertTrue(calculator.implementationQuality(popular, field()) > 0.8);
        }

        @Test
        @DisplayName("missing author signal reads neutral")
        void neutralAuthor() {
            ArtifactMetrics a = aged("a", FIELD, 20).build();
            assertEquals(0.5, calculator.authorCredibility(a, field()));
        }

        @Test
        @DisplayName("reproducibility adds code, dataset and experiments")
        void reproducibility() {
            assertEquals(0.75, ScoreCalculator.reproducibility(
                aged("r", FIELD, 1).hasCode(true).hasExperiments(true).build()), 1e-12);
            assertEquals(1.0, ScoreCalculator.reproducibility(
                aged("r", FIELD, 1).hasCode(true).hasDataset(true).hasExperiments(true).build()), 1e-12);
        }

        @Test
        @DisplayName("recency halves every half-life")
        void recencyHalfLife() {
            assertEquals(0.5, calculator.recency(23.0), 1e-12);
            assertEquals(0.25, calculator.recency(46.0), 1e-12);
        }
    }

    // ── freshness gate ────────────────────────────────────────────────────

    @Nested
    @DisplayName("freshness boost")
    class Freshness {

        private final double thresholdDays = policy.freshness().ageThreshold().toDays();

        @Test
        @DisplayName("a day short of the threshold with zero traction gets no boost")
        void noTractionNoBoost() {
            ArtifactMetrics a = aged("f", FIELD, thresholdDays - 1).build();
            assertEquals(1.0, calculator.score(a, field()).freshnessBoost());
        }

        @Test
        @DisplayName("young artifacts with traction are boosted, decaying linearly to the threshold")
        void boostDecays() {
            ArtifactMetrics day0 = aged("f0", FIELD, 0).socialSignal(1).build();
            ArtifactMetrics day15 = aged("f15", FIELD, 15).socialSignal(1).build();
            assertEquals(1.5, calculator.freshnessBoost(day0, 0.0), 1e-12);
            assertEquals(1.25, calculator.freshnessBoost(day15, 15.0), 1e-12);
        }

        @Test
        @DisplayName("at or past the threshold there is no boost")
        void pastThreshold() {
            ArtifactMetrics a = aged("old", FIELD, thresholdDays).citations(50, 10, 0).build();
            assertEquals(1.0, calculator.score(a, field()).freshnessBoost());
        }
    }

    // ── configuration ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("ScoreWeights")
    class Weights {

        @Test
        @DisplayName("weights must sum to one")
        void sumToOne() {
            assertThrows(IllegalArgumentException.class,
                () -> new ScoreWeights(0.25, 0.20, 0.15, 0.15, 0.10, 0.10, 0.10));
        }

        @Test
        @DisplayName("weights must be non-negative")
        void nonNegative() {
            assertThrows(IllegalArgumentException.class,
                () -> new ScoreWeights(0.35, 0.20, 0.15, 0.15, 0.10, 0.10, -0.05));
        }

        @Test
        @DisplayName("the defaults are valid")
        void defaultsValid() {
            assertDoesNotThrow(ScoreWeights::defaults);
            assertDoesNotThrow(() -> new FreshnessPolicy(Duration.ofDays(14), 2.0, 5));
        }
    }
}
