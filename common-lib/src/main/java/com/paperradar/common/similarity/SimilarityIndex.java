package com.paperradar.common.similarity;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Nearest-neighbour lookup over fixed-length embedding vectors. Optional capability:
 * scoring degrades to keyword novelty when no index is configured.
 */
public interface SimilarityIndex {

    int dimension();

    /**
     * Adds or replaces the vector for {@code id}.
     *
     * @throws IllegalArgumentException if {@code vector.length != dimension()}
     */
    void upsert(String id, float[] vector);

    Optional<float[]> vectorOf(String id);

    /** @return whether {@code id} was present */
    boolean remove(String id);

    /** Snapshot of the ids currently indexed. */
    Set<String> ids();

    /**
     * Drops every vector whose id is not in {@code keep}, so neighbours only come from the
     * current population.
     *
     * @return how many vectors were dropped
     */
    default int retainOnly(Collection<String> keep) {
        int removed = 0;
        for (String id : ids()) {
            if (!keep.contains(id) && remove(id)) removed++;
        }
        return removed;
    }

    /**
     * Up to {@code k} most similar vectors, most similar first, never including
     * {@code excludeId}.
     */
    List<Neighbor> nearest(float[] vector, int k, String excludeId);

    int size();
}
