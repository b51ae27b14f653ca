package com.paperradar.ranking.job;

import com.paperradar.common.cache.VolatilityCache;
import com.paperradar.ranking.config.RankingProperties;
import com.paperradar.ranking.engine.RankingCaches;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.time.Duration;

/** Periodically drops entries that expired longer ago than the purge grace. */
@Component
public class CacheSweeper {

    private static final Logger log = LoggerFactory.getLogger(CacheSweeper.class);

    private final RankingCaches caches;
    private final Duration interval;
    private Disposable sweeping;

    public CacheSweeper(RankingCaches caches, RankingProperties properties) {
        this.caches = caches;
        this.interval = properties.getCache().getSweepInterval();
    }

    @PostConstruct
    public void start() {
        sweeping = Flux.interval(interval, interval)
            .subscribe(tick -> sweep(), err -> log.error("CACHE_SWEEP_STOPPED error={}", err.getMessage(), err));
    }

    @PreDestroy
    public void stop() {
        if (sweeping != null) sweeping.dispose();
    }

    int sweep() {
        int purged = 0;
        for (VolatilityCache<?> cache : caches.all()) {
            int removed = cache.purgeExpired();
            if (removed > 0) log.debug("CACHE_PURGED cache={} removed={} size={}", cache.name(), removed, cache.size());
            purged += removed;
        }
        return purged;
    }
}
