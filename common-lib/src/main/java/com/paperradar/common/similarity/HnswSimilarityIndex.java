package com.paperradar.common.similarity;

import com.github.jelmerk.knn.DistanceFunctions;
import com.github.jelmerk.knn.Item;
import com.github.jelmerk.knn.SearchResult;
import com.github.jelmerk.knn.hnsw.HnswIndex;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Approximate cosine search over an HNSW graph, for windows too large to scan.
 *
 * <p>Embeddings live in the EMBEDDINGS cache class and change only when the model does,
 * so an id already in the graph is not re-inserted: {@link #upsert} keeps the first vector.
 * Removal is enabled so the graph can be pruned to the current window; freed slots are
 * reused by later inserts, which keeps the graph within {@code maxItems}.
 */
public class HnswSimilarityIndex implements SimilarityIndex {

    static final int M = 32;
    static final int EF = 200;
    static final int EF_CONSTRUCTION = 200;
    /** Items keep hnswlib's default version, so a remove at this version always applies. */
    static final long ITEM_VERSION = 0L;

    private final int dimension;
    private final HnswIndex<String, float[], VectorItem, Float> index;

    public HnswSimilarityIndex(int dimension, int maxItems) {
        if (dimension <= 0) throw new IllegalArgumentException("dimension must be > 0, was " + dimension);
        if (maxItems <= 0) throw new IllegalArgumentException("maxItems must be > 0, was " + maxItems);
        this.dimension = dimension;
        this.index = HnswIndex
            .newBuilder(dimension, DistanceFunctions.FLOAT_COSINE_DISTANCE, maxItems)
            .withM(M)
            .withEf(EF)
            .withEfConstruction(EF_CONSTRUCTION)
            .withRemoveEnabled()
            .build();
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public void upsert(String id, float[] vector) {
        VectorMath.requireDimension(vector, dimension);
        if (index.get(id).isPresent()) return;
        index.add(new VectorItem(id, vector.clone()));
    }

    @Override
    public Optional<float[]> vectorOf(String id) {
        return index.get(id).map(item -> item.vector().clone());
    }

    @Override
    public boolean remove(String id) {
        return index.remove(id, ITEM_VERSION);
    }

    @Override
    public Set<String> ids() {
        return index.items().stream().map(VectorItem::id).collect(Collectors.toSet());
    }

    @Override
    public List<Neighbor> nearest(float[] vector, int k, String excludeId) {
        VectorMath.requireDimension(vector, dimension);
        if (k <= 0) return List.of();
        List<SearchResult<VectorItem, Float>> results = index.findNearest(vector, k + 1);
        return results.stream()
            .filter(r -> !r.item().id().equals(excludeId))
            .limit(k)
            .map(r -> new Neighbor(r.item().id(), 1.0 - r.distance()))
            .toList();
    }

    @Override
    public int size() {
        return index.size();
    }

    record VectorItem(String id, float[] vector) implements Item<String, float[]> {
        @Override public int dimensions() { return vector.length; }
    }
}
