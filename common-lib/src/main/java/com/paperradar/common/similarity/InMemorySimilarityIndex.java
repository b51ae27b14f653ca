package com.paperradar.common.similarity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Exact cosine search by full scan. Fine for the few thousand artifacts of a 90-day window;
 * ties are broken by id so results are reproducible.
 */
public class InMemorySimilarityIndex implements SimilarityIndex {

    private final int dimension;
    private final Map<String, float[]> raw = new HashMap<>();
    private final Map<String, float[]> normalized = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public InMemorySimilarityIndex(int dimension) {
        if (dimension <= 0) throw new IllegalArgumentException("dimension must be > 0, was " + dimension);
        this.dimension = dimension;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public void upsert(String id, float[] vector) {
        VectorMath.requireDimension(vector, dimension);
        float[] copy = vector.clone();
        float[] unit = VectorMath.normalize(copy);
        lock.writeLock().lock();
        try {
            raw.put(id, copy);
            normalized.put(id, unit);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<float[]> vectorOf(String id) {
        lock.readLock().lock();
        try {
            float[] v = raw.get(id);
            return v == null ? Optional.empty() : Optional.of(v.clone());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean remove(String id) {
        lock.writeLock().lock();
        try {
            normalized.remove(id);
            return raw.remove(id) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Set<String> ids() {
        lock.readLock().lock();
        try {
            return Set.copyOf(raw.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Neighbor> nearest(float[] vector, int k, String excludeId) {
        VectorMath.requireDimension(vector, dimension);
        if (k <= 0) return List.of();
        float[] query = VectorMath.normalize(vector);
        List<Neighbor> hits = new ArrayList<>();
        lock.readLock().lock();
        try {
            normalized.forEach((id, unit) -> {
                if (!id.equals(excludeId)) hits.add(new Neighbor(id, VectorMath.dot(query, unit)));
            });
        } finally {
            lock.readLock().unlock();
        }
        hits.sort(Comparator.comparingDouble(Neighbor::similarity).reversed()
            .thenComparing(Neighbor::id));
        return hits.size() <= k ? hits : List.copyOf(hits.subList(0, k));
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return raw.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
