package com.paperradar.ranking.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.util.concurrent.TimeUnit;

/**
 * One WebClient per collaborating service. No retry filter here: retries belong to
 * {@link com.paperradar.ranking.client.ProviderGateway}, which has to see every 429.
 */
@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    private final RankingProperties.Services services;

    public WebClientConfig(RankingProperties properties) {
        this.services = properties.getServices();
    }

    @Bean
    public WebClient catalogWebClient(WebClient.Builder builder) {
        return build(builder, services.getCatalogBaseUrl());
    }

    @Bean
    public WebClient scoresWebClient(WebClient.Builder builder) {
        return build(builder, services.getScoresBaseUrl());
    }

    @Bean
    public WebClient embeddingsWebClient(WebClient.Builder builder) {
        return build(builder, services.getEmbeddingsBaseUrl());
    }

    private WebClient build(WebClient.Builder builder, String baseUrl) {
        long readTimeoutMs = services.getResponseTimeout().toMillis();
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) services.getConnectTimeout().toMillis())
            .responseTimeout(services.getResponseTimeout())
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(readTimeoutMs, TimeUnit.MILLISECONDS))
            );

        return builder
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(loggingFilter())
            .build();
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
