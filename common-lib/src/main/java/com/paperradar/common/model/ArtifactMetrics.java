package com.paperradar.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.paperradar.common.exception.MalformedArtifactException;

import java.time.Duration;
import java.time.Instant;

/**
 * Raw signals for one research artifact as supplied by the enrichment collaborator.
 *
 * <p>Replaced wholesale each enrichment cycle, never patched. Citation velocity is derived
 * from the two earlier sample points:
 * <ul>
 *   <li>{@code citationCount - citationsPriorSample} is the recent velocity</li>
 *   <li>{@code citationsPriorSample - citationsEarlierSample} is the prior velocity</li>
 * </ul>
 * {@code authorSignal} is nullable (no author data); the text fields may be null or blank.
 */
public record ArtifactMetrics(
    @JsonProperty("id")                      String  id,
    @JsonProperty("publishedAt")             Instant publishedAt,
    @JsonProperty("citationCount")           long    citationCount,
    @JsonProperty("citationsPriorSample")    long    citationsPriorSample,
    @JsonProperty("citationsEarlierSample")  long    citationsEarlierSample,
    @JsonProperty("repoStars")               long    repoStars,
    @JsonProperty("hasCode")                 boolean hasCode,
    @JsonProperty("socialSignal")            long    socialSignal,
    @JsonProperty("category")                String  category,
    @JsonProperty("authorSignal")            Double  authorSignal,
    @JsonProperty("hasDataset")              boolean hasDataset,
    @JsonProperty("hasExperiments")          boolean hasExperiments,
    @JsonProperty("title")                   String  title,
    @JsonProperty("abstractText")            String  abstractText
) {

    /** Publication times this far past the reference time are treated as clock skew. */
    static final Duration FUTURE_TOLERANCE = Duration.ofDays(1);

    /** Citations gained since the prior sample, floored at zero (providers do retract). */
    @JsonIgnore
    public long recentVelocity() {
        return Math.max(0L, citationCount - citationsPriorSample);
    }

    @JsonIgnore
    public long priorVelocity() {
        return Math.max(0L, citationsPriorSample - citationsEarlierSample);
    }

    /** Citations plus social mentions; gates the freshness boost. */
    @JsonIgnore
    public long traction() {
        return citationCount + socialSignal;
    }

    /**
     * Rejects metrics the scorer cannot interpret.
     *
     * @param asOf the cycle's reference time
     * @throws MalformedArtifactException on missing identity fields, negative counts,
     *         a non-finite author signal or a publication time in the future
     */
    public void validate(Instant asOf) {
        if (id == null || id.isBlank()) throw new MalformedArtifactException(id, "missing id");
        if (category == null || category.isBlank()) throw new MalformedArtifactException(id, "missing category");
        if (publishedAt == null) throw new MalformedArtifactException(id, "missing publishedAt");
        if (citationCount < 0 || citationsPriorSample < 0 || citationsEarlierSample < 0
                || repoStars < 0 || socialSignal < 0) {
            throw new MalformedArtifactException(id, "negative count");
        }
        if (authorSignal != null && (authorSignal.isNaN() || authorSignal.isInfinite() || authorSignal < 0)) {
            throw new MalformedArtifactException(id, "authorSignal out of range: " + authorSignal);
        }
        if (publishedAt.isAfter(asOf.plus(FUTURE_TOLERANCE))) {
            throw new MalformedArtifactException(id, "publishedAt " + publishedAt + " is after " + asOf);
        }
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    /** Mutable builder used by collaborators that assemble metrics field by field. */
    public static final class Builder {
        private final String id;
        private Instant publishedAt;
        private long citationCount;
        private long citationsPriorSample;
        private long citationsEarlierSample;
        private long repoStars;
        private boolean hasCode;
        private long socialSignal;
        private String category;
        private Double authorSignal;
        private boolean hasDataset;
        private boolean hasExperiments;
        private String title;
        private String abstractText;

        private Builder(String id) {
            this.id = id;
        }

        public Builder publishedAt(Instant publishedAt) { this.publishedAt = publishedAt; return this; }

        /** Current count followed by the two earlier sample points. */
        public Builder citations(long current, long prior, long earlier) {
            this.citationCount = current;
            this.citationsPriorSample = prior;
            this.citationsEarlierSample = earlier;
            return this;
        }

        public Builder repoStars(long repoStars) { this.repoStars = repoStars; return this; }
        public Builder hasCode(boolean hasCode) { this.hasCode = hasCode; return this; }
        public Builder socialSignal(long socialSignal) { this.socialSignal = socialSignal; return this; }
        public Builder category(String category) { this.category = category; return this; }
        public Builder authorSignal(Double authorSignal) { this.authorSignal = authorSignal; return this; }
        public Builder hasDataset(boolean hasDataset) { this.hasDataset = hasDataset; return this; }
        public Builder hasExperiments(boolean hasExperiments) { this.hasExperiments = hasExperiments; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder abstractText(String abstractText) { this.abstractText = abstractText; return this; }

        public ArtifactMetrics build() {
            return new ArtifactMetrics(id, publishedAt, citationCount, citationsPriorSample,
                citationsEarlierSample, repoStars, hasCode, socialSignal, category, authorSignal,
                hasDataset, hasExperiments, title, abstractText);
        }
    }
}
