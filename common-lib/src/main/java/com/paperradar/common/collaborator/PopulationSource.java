package com.paperradar.common.collaborator;

import com.paperradar.common.model.ArtifactMetrics;
import com.paperradar.common.time.Deadline;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Supplies the in-window artifact population for one ranking cycle.
 *
 * <p>Implementations signal {@link com.paperradar.common.exception.PopulationUnavailableException}
 * when the population cannot be produced at all; the cycle escalates that error.
 */
public interface PopulationSource {

    Mono<List<ArtifactMetrics>> fetchPopulation(Deadline deadline);
}
