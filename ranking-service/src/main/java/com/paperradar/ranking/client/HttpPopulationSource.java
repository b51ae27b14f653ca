package com.paperradar.ranking.client;

import com.paperradar.common.collaborator.PopulationSource;
import com.paperradar.common.exception.PopulationUnavailableException;
import com.paperradar.common.model.ArtifactMetrics;
import com.paperradar.common.ratelimit.Priority;
import com.paperradar.common.time.Deadline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Pulls the in-window artifact population from the catalog service.
 *
 * <p>Unlike most provider reads this one is not absorbed: without a population there is
 * no cycle, so any failure surfaces as {@link PopulationUnavailableException}.
 */
public class HttpPopulationSource implements PopulationSource {

    private static final Logger log = LoggerFactory.getLogger(HttpPopulationSource.class);

    public static final String PROVIDER = "catalog";

    private final WebClient catalogClient;
    private final ProviderGateway gateway;
    private final int windowDays;

    public HttpPopulationSource(WebClient catalogClient, ProviderGateway gateway, int windowDays) {
        this.catalogClient = catalogClient;
        this.gateway = gateway;
        this.windowDays = windowDays;
    }

    @Override
    public Mono<List<ArtifactMetrics>> fetchPopulation(Deadline deadline) {
        return gateway.call(PROVIDER, Priority.HIGH, deadline, () -> catalogClient.get()
                .uri(uriBuilder -> uriBuilder
                    .path("/api/v1/artifacts")
                    .queryParam("windowDays", windowDays)
                    .build())
                .retrieve()
                .toEntityList(ArtifactMetrics.class))
            .defaultIfEmpty(List.of())
            .doOnNext(population -> log.info("POPULATION_FETCHED size={} windowDays={}", population.size(), windowDays))
            .onErrorMap(e -> !(e instanceof PopulationUnavailableException),
                e -> new PopulationUnavailableException(PROVIDER, e));
    }
}
