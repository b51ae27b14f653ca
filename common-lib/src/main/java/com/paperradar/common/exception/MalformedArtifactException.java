package com.paperradar.common.exception;

/** An artifact's metrics cannot be scored. Counted per cycle, never fatal to the cycle. */
public class MalformedArtifactException extends RankingException {
    private final String artifactId;

    public MalformedArtifactException(String artifactId, String message) {
        super("artifact", (artifactId == null ? "<no id>" : artifactId) + ": " + message);
        this.artifactId = artifactId;
    }

    public String getArtifactId() {
        return artifactId;
    }
}
