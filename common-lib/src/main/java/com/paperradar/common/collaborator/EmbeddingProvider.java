package com.paperradar.common.collaborator;

import com.paperradar.common.model.ArtifactMetrics;
import com.paperradar.common.time.Deadline;
import reactor.core.publisher.Mono;

/** Optional source of embedding vectors. Completes empty when the artifact has none. */
public interface EmbeddingProvider {

    Mono<float[]> embeddingFor(ArtifactMetrics artifact, Deadline deadline);
}
