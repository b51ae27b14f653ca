package com.paperradar.common.collaborator;

import com.paperradar.common.model.ScoreBreakdown;
import reactor.core.publisher.Mono;

/** Durable store for computed breakdowns. Failures are counted per cycle, not escalated. */
public interface ScorePersistence {

    Mono<Void> save(ScoreBreakdown breakdown);
}
