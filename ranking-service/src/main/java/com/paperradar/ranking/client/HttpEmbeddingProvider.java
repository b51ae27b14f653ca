package com.paperradar.ranking.client;

import com.paperradar.common.collaborator.EmbeddingProvider;
import com.paperradar.common.model.ArtifactMetrics;
import com.paperradar.common.ratelimit.Priority;
import com.paperradar.common.time.Deadline;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Looks up an artifact's embedding. Runs at LOW priority so it never starves the population
 * fetch or score writes. A 404 completes empty; the artifact then gets keyword-only novelty.
 */
public class HttpEmbeddingProvider implements EmbeddingProvider {

    public static final String PROVIDER = "embeddings";

    private final WebClient embeddingsClient;
    private final ProviderGateway gateway;

    public HttpEmbeddingProvider(WebClient embeddingsClient, ProviderGateway gateway) {
        this.embeddingsClient = embeddingsClient;
        this.gateway = gateway;
    }

    @Override
    public Mono<float[]> embeddingFor(ArtifactMetrics artifact, Deadline deadline) {
        return gateway.call(PROVIDER, Priority.LOW, deadline, () -> embeddingsClient.get()
                .uri("/api/v1/embeddings/{id}", artifact.id())
                .<ResponseEntity<EmbeddingResponse>>exchangeToMono(response -> {
                    if (response.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
                        return response.releaseBody().then(Mono.just(ResponseEntity.notFound().<EmbeddingResponse>build()));
                    }
                    if (response.statusCode().isError()) {
                        return response.createError();
                    }
                    return response.toEntity(EmbeddingResponse.class);
                }))
            .filter(body -> body.vector() != null && body.vector().length > 0)
            .map(EmbeddingResponse::vector);
    }
}
