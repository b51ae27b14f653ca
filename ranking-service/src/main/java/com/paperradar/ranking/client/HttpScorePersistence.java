package com.paperradar.ranking.client;

import com.paperradar.common.collaborator.ScorePersistence;
import com.paperradar.common.model.ScoreBreakdown;
import com.paperradar.common.ratelimit.Priority;
import com.paperradar.common.time.Deadline;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/** Writes breakdowns to the score store. Errors propagate; the cycle counts them. */
public class HttpScorePersistence implements ScorePersistence {

    public static final String PROVIDER = "scores";

    private final WebClient scoresClient;
    private final ProviderGateway gateway;

    public HttpScorePersistence(WebClient scoresClient, ProviderGateway gateway) {
        this.scoresClient = scoresClient;
        this.gateway = gateway;
    }

    @Override
    public Mono<Void> save(ScoreBreakdown breakdown) {
        return gateway.call(PROVIDER, Priority.NORMAL, Deadline.unbounded(), () -> scoresClient.post()
                .uri("/api/v1/scores")
                .bodyValue(breakdown)
                .retrieve()
                .toBodilessEntity())
            .then();
    }
}
