package com.paperradar.ranking.client;

import com.paperradar.common.exception.CycleDeadlineExceededException;
import com.paperradar.common.exception.ProviderQuotaExceededException;
import com.paperradar.common.exception.ProviderTerminalException;
import com.paperradar.common.exception.RankingException;
import com.paperradar.common.ratelimit.Acquisition;
import com.paperradar.common.ratelimit.Priority;
import com.paperradar.common.ratelimit.QuotaHeaderParser;
import com.paperradar.common.ratelimit.QuotaUpdate;
import com.paperradar.common.ratelimit.RateLimiter;
import com.paperradar.common.ratelimit.StandardQuotaHeaderParser;
import com.paperradar.common.time.Deadline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Puts every outbound provider call behind the {@link RateLimiter}.
 *
 * <p>Per call:
 * <ol>
 *   <li>admission: GRANTED proceeds, WAIT sleeps and asks again, REJECTED fails with
 *       {@link ProviderQuotaExceededException}; a wait longer than the deadline fails with
 *       {@link CycleDeadlineExceededException}</li>
 *   <li>success: quota headers are applied and the success is recorded</li>
 *   <li>HTTP 429: recorded as a rate-limit failure and retried up to the provider's
 *       {@code maxRetries}, each retry passing admission again</li>
 *   <li>anything else: recorded as a plain failure and surfaced as
 *       {@link ProviderTerminalException}</li>
 * </ol>
 */
public class ProviderGateway {

    private static final Logger log = LoggerFactory.getLogger(ProviderGateway.class);

    static final int MAX_ADMISSION_ATTEMPTS = 8;

    private final RateLimiter rateLimiter;
    private final Clock clock;
    private final QuotaHeaderParser retryAfterParser = new StandardQuotaHeaderParser();

    public ProviderGateway(RateLimiter rateLimiter, Clock clock) {
        this.rateLimiter = rateLimiter;
        this.clock = clock;
    }

    public <T> Mono<T> call(String provider, Priority priority, Deadline deadline,
                            Supplier<Mono<ResponseEntity<T>>> request) {
        int maxRetries = rateLimiter.policy().forProvider(provider).maxRetries();

        Mono<T> attempt = admit(provider, priority, deadline, 1)
            .then(Mono.defer(request))
            .flatMap(response -> {
                rateLimiter.updateFromHeaders(provider, response.getHeaders().toSingleValueMap());
                rateLimiter.recordSuccess(provider);
                return Mono.justOrEmpty(response.getBody());
            })
            .onErrorMap(WebClientResponseException.class, e -> classify(provider, e))
            .onErrorMap(e -> !(e instanceof RankingException), e -> {
                rateLimiter.recordFailure(provider, false);
                return new ProviderTerminalException(provider, 0, String.valueOf(e.getMessage()), e);
            });

        Mono<T> retried = attempt.retryWhen(Retry.max(maxRetries)
            .filter(RateLimitedResponse.class::isInstance)
            .doBeforeRetry(signal -> log.info("PROVIDER_RETRY provider={} retry={}/{}",
                provider, signal.totalRetries() + 1, maxRetries))
            .onRetryExhaustedThrow((spec, signal) -> signal.failure()));

        if (!deadline.isBounded()) return retried;
        return Mono.defer(() -> retried.timeout(deadline.remaining(clock),
            Mono.error(() -> new CycleDeadlineExceededException(provider, "call did not finish before the cycle deadline"))));
    }

    // ── admission ───────────────────────────────────────────────────────────

    private Mono<Void> admit(String provider, Priority priority, Deadline deadline, int attempt) {
        return Mono.defer(() -> {
            Acquisition acquisition = rateLimiter.acquire(provider, priority);
            if (acquisition.isGranted()) return Mono.empty();
            if (acquisition.decision() == Acquisition.Decision.REJECTED) {
                return Mono.error(new ProviderQuotaExceededException(provider, acquisition.waitFor(),
                    "admission rejected (" + acquisition.reason() + ")"));
            }
            Duration wait = acquisition.waitFor();
            if (deadline.isBounded() && wait.compareTo(deadline.remaining(clock)) > 0) {
                return Mono.error(new CycleDeadlineExceededException(provider, wait));
            }
            if (attempt >= MAX_ADMISSION_ATTEMPTS) {
                return Mono.error(new ProviderQuotaExceededException(provider, wait,
                    "still waiting for admission after " + attempt + " attempts"));
            }
            log.debug("PROVIDER_WAIT provider={} priority={} reason={} waitMs={}",
                provider, priority, acquisition.reason(), wait.toMillis());
            return Mono.delay(wait).then(admit(provider, priority, deadline, attempt + 1));
        });
    }

    private RankingException classify(String provider, WebClientResponseException e) {
        int status = e.getStatusCode().value();
        if (status == 429) {
            Map<String, String> headers = e.getHeaders().toSingleValueMap();
            rateLimiter.recordFailure(provider, true);
            rateLimiter.updateFromHeaders(provider, headers);
            Duration retryAfter = retryAfterParser.parse(headers, clock.instant())
                .map(QuotaUpdate::retryAfter)
                .orElse(null);
            return new RateLimitedResponse(provider, retryAfter);
        }
        rateLimiter.recordFailure(provider, false);
        return new ProviderTerminalException(provider, status, "HTTP " + status, e);
    }

    /** A 429 from the provider itself, as opposed to a local admission refusal. */
    static final class RateLimitedResponse extends ProviderQuotaExceededException {
        RateLimitedResponse(String provider, Duration retryAfter) {
            super(provider, retryAfter, "provider answered 429");
        }
    }
}
