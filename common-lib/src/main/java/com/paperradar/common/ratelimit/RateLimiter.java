package com.paperradar.common.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Per-provider admission control: a fixed-window quota bucket plus an adaptive backoff window.
 *
 * <p><b>Admission order</b> inside {@link #acquire}:
 * <ol>
 *   <li>A provider-reported quota window (remaining = 0 until reset) blocks every priority.</li>
 *   <li>An active backoff window blocks LOW and NORMAL. HIGH passes while the window's
 *       override budget lasts.</li>
 *   <li>The bucket must hold one token; LOW must also leave the reserve untouched.</li>
 * </ol>
 * The bucket holds {@code requestsPerWindow} tokens and is refilled in full only when its
 * window ends, so sustained load never gets more than the quota out of one window.
 * A blocked caller gets {@code WAIT(d)} when {@code d <= maxWait}, otherwise
 * {@code REJECTED}. The limiter itself never sleeps.
 *
 * <p><b>Backoff.</b> A rate-limit failure opens a window of the current backoff, jittered by
 * ±{@code jitterRatio}, then doubles the backoff up to the provider's cap. A success closes
 * the window and halves the backoff down to the floor.
 *
 * <p>State is kept per provider and guarded by that provider's monitor, so two providers
 * never contend. {@link #reset} is the only way back to the configured initial state.
 */
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    static final double BACKOFF_GROWTH = 2.0;
    static final double BACKOFF_RECOVERY = 0.5;

    private final RateLimitPolicy policy;
    private final Clock clock;
    private final DoubleSupplier jitterSource;
    private final QuotaHeaderParser headerParser;
    private final ConcurrentHashMap<String, LimiterState> states = new ConcurrentHashMap<>();

    public RateLimiter(RateLimitPolicy policy, Clock clock) {
        this(policy, clock, () -> ThreadLocalRandom.current().nextDouble(), new StandardQuotaHeaderParser());
    }

    /**
     * @param jitterSource uniform values in [0, 1); tests pin it
     */
    public RateLimiter(RateLimitPolicy policy, Clock clock, DoubleSupplier jitterSource,
                       QuotaHeaderParser headerParser) {
        this.policy = policy;
        this.clock = clock;
        this.jitterSource = jitterSource;
        this.headerParser = headerParser;
    }

    public RateLimitPolicy policy() {
        return policy;
    }

    public Acquisition acquire(String provider, Priority priority) {
        LimiterState st = state(provider);
        synchronized (st) {
            Instant now = clock.instant();
            st.refill(now);

            if (st.quotaResetAt != null) {
                if (now.isBefore(st.quotaResetAt)) {
                    return waitOrReject(st, priority, Duration.between(now, st.quotaResetAt), "quota-exhausted");
                }
                st.quotaResetAt = null;
                st.reportedRemaining = null;
            }

            boolean overriding = false;
            if (st.backoffUntil != null) {
                if (now.isBefore(st.backoffUntil)) {
                    if (priority == Priority.HIGH && st.overridesUsed < policy.highPriorityOverrideBudget()) {
                        overriding = true;
                    } else {
                        return waitOrReject(st, priority, Duration.between(now, st.backoffUntil), "backoff");
                    }
                } else {
                    st.backoffUntil = null;
                    st.overridesUsed = 0;
                }
            }

            double required = requiredTokens(st, priority);
            if (st.tokens >= required) {
                st.tokens -= 1.0;
                if (overriding) {
                    st.overridesUsed++;
                    log.info("LIMITER_OVERRIDE provider={} overridesUsed={}/{} backoffUntil={}",
                        st.provider, st.overridesUsed, policy.highPriorityOverrideBudget(), st.backoffUntil);
                    return Acquisition.granted("high-priority-override");
                }
                return Acquisition.granted("token");
            }
            String reason = priority == Priority.LOW && st.tokens >= 1.0 ? "low-priority-reserve" : "bucket-empty";
            return waitOrReject(st, priority, st.timeUntil(required, now), reason);
        }
    }

    public void recordSuccess(String provider) {
        LimiterState st = state(provider);
        synchronized (st) {
            Instant now = clock.instant();
            boolean wasBackingOff = st.backoffUntil != null;
            st.consecutiveFailures = 0;
            st.backoffUntil = null;
            st.overridesUsed = 0;
            st.lastSuccess = now;
            Duration halved = scale(st.currentBackoff, BACKOFF_RECOVERY);
            st.currentBackoff = max(halved, st.config.backoffFloor());
            if (wasBackingOff) {
                log.info("LIMITER_RECOVERED provider={} nextBackoffMs={}", st.provider, st.currentBackoff.toMillis());
            }
        }
    }

    /**
     * @param isRateLimit true for quota refusals (HTTP 429); other failures are counted and
     *                    logged but leave the backoff untouched
     */
    public void recordFailure(String provider, boolean isRateLimit) {
        LimiterState st = state(provider);
        synchronized (st) {
            st.totalFailures++;
            st.consecutiveFailures++;
            if (!isRateLimit) {
                log.warn("PROVIDER_FAILURE provider={} consecutive={} total={}",
                    st.provider, st.consecutiveFailures, st.totalFailures);
                return;
            }
            Instant now = clock.instant();
            Duration window = jitter(st.currentBackoff);
            Instant until = now.plus(window);
            if (st.backoffUntil == null || until.isAfter(st.backoffUntil)) {
                st.backoffUntil = until;
            }
            st.currentBackoff = min(scale(st.currentBackoff, BACKOFF_GROWTH), st.config.backoffCap());
            log.warn("PROVIDER_RATE_LIMITED provider={} windowMs={} backoffUntil={} nextBackoffMs={} consecutive={}",
                st.provider, window.toMillis(), st.backoffUntil, st.currentBackoff.toMillis(), st.consecutiveFailures);
        }
    }

    /**
     * Applies quota headers from a provider response. The advertised limit replaces the
     * configured one, the bucket never holds more than the reported remaining quota, and
     * remaining = 0 with a reset hint blocks the provider until the reset.
     */
    public void updateFromHeaders(String provider, Map<String, String> headers) {
        Instant now = clock.instant();
        Optional<QuotaUpdate> parsed = headerParser.parse(headers, now);
        if (parsed.isEmpty()) return;
        QuotaUpdate update = parsed.get();
        LimiterState st = state(provider);
        synchronized (st) {
            st.refill(now);
            if (update.limit() != null && update.limit() > 0 && update.limit() != (int) st.capacity) {
                st.capacity = update.limit();
                st.refillPerSecond = update.limit() / (st.config.window().toMillis() / 1000.0);
                st.tokens = Math.min(st.tokens, st.capacity);
                log.info("LIMITER_QUOTA_ADOPTED provider={} limit={} refillPerSecond={}",
                    st.provider, update.limit(), st.refillPerSecond);
            }
            if (update.remaining() != null) {
                st.reportedRemaining = update.remaining();
                st.tokens = Math.min(st.tokens, update.remaining());
                if (update.remaining() == 0 && update.resetAfter() != null) {
                    st.quotaResetAt = now.plus(update.resetAfter());
                    log.info("LIMITER_QUOTA_EXHAUSTED provider={} resetAt={}", st.provider, st.quotaResetAt);
                }
            }
            if (update.retryAfter() != null) {
                Instant until = now.plus(update.retryAfter());
                if (st.quotaResetAt == null || until.isAfter(st.quotaResetAt)) st.quotaResetAt = until;
            }
        }
    }

    /** Restores {@code provider} to its configured initial state. Operator action. */
    public void reset(String provider) {
        LimiterState removed = states.remove(provider);
        log.info("LIMITER_RESET provider={} hadState={}", provider, removed != null);
    }

    public LimiterSnapshot snapshot(String provider) {
        LimiterState st = state(provider);
        synchronized (st) {
            st.refill(clock.instant());
            return st.snapshot();
        }
    }

    /** Snapshots of every provider seen so far, by name. */
    public Map<String, LimiterSnapshot> snapshots() {
        Map<String, LimiterSnapshot> out = new TreeMap<>();
        states.keySet().forEach(p -> out.put(p, snapshot(p)));
        return out;
    }

    // ── internals ───────────────────────────────────────────────────────────

    private LimiterState state(String provider) {
        return states.computeIfAbsent(provider,
            p -> new LimiterState(p, policy.forProvider(p), clock.instant()));
    }

    private double requiredTokens(LimiterState st, Priority priority) {
        if (priority != Priority.LOW) return 1.0;
        double withReserve = 1.0 + st.capacity * policy.lowPriorityReserveRatio();
        return Math.max(1.0, Math.min(st.capacity, withReserve));
    }

    private Acquisition waitOrReject(LimiterState st, Priority priority, Duration wait, String reason) {
        if (wait.compareTo(policy.maxWait()) <= 0) {
            return Acquisition.waitFor(wait, reason);
        }
        log.debug("LIMITER_REJECTED provider={} priority={} reason={} waitMs={}",
            st.provider, priority, reason, wait.toMillis());
        return Acquisition.rejected(wait, reason);
    }

    private Duration jitter(Duration base) {
        double u = jitterSource.getAsDouble();
        double factor = 1.0 + policy.jitterRatio() * (2.0 * u - 1.0);
        return scale(base, factor);
    }

    private static Duration scale(Duration d, double factor) {
        return Duration.ofNanos((long) (d.toNanos() * factor));
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private static Duration max(Duration a, Duration b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
