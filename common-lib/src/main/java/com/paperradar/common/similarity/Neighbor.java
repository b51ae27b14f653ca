package com.paperradar.common.similarity;

/** One search hit; {@code similarity} is cosine similarity in [-1, 1]. */
public record Neighbor(String id, double similarity) {}
