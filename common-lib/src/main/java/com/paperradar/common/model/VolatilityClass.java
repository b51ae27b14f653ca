package com.paperradar.common.model;

/**
 * How fast a class of cached data goes stale. Declared in increasing order of TTL;
 * {@link com.paperradar.common.cache.TtlTable} rejects tables that break the order.
 */
public enum VolatilityClass {
    /** Trending lists and live social counts. Minutes. */
    TRENDING,
    /** Scores and ranked lists recomputed each cycle. Hours. */
    DERIVED_METRICS,
    /** Titles, authors, links. Days. */
    METADATA,
    /** Embedding vectors. Weeks. */
    EMBEDDINGS
}
