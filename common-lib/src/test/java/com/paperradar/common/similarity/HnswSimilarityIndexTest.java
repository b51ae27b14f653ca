package com.paperradar.common.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class HnswSimilarityIndexTest {

    @Test
    @DisplayName("finds the closest vector and excludes the query id")
    void nearest() {
        HnswSimilarityIndex index = new HnswSimilarityIndex(3, 100);
        index.upsert("self", new float[]{1, 0, 0});
        index.upsert("close", new float[]{0.9f, 0.1f, 0});
        index.upsert("far", new float[]{0, 0, 1});

        List<Neighbor> hits = index.nearest(new float[]{1, 0, 0}, 1, "self");

        assertEquals(1, hits.size());
        assertEquals("close", hits.get(0).id());
        assertTrue(hits.get(0).similarity() > 0.9);
        assertEquals(3, index.size());
    }

    @Test
    @DisplayName("the first vector stored for an id is kept")
    void firstVectorKept() {
        HnswSimilarityIndex index = new HnswSimilarityIndex(2, 10);
        index.upsert("a", new float[]{1, 0});
        index.upsert("a", new float[]{0, 1});
        assertEquals(1, index.size());
        assertArrayEquals(new float[]{1, 0}, index.vectorOf("a").orElseThrow());
    }

    @Test
    @DisplayName("vectors of the wrong length are rejected")
    void dimensionChecked() {
        HnswSimilarityIndex index = new HnswSimilarityIndex(2, 10);
        assertThrows(IllegalArgumentException.class, () -> index.upsert("a", new float[]{1}));
    }

    @Test
    @DisplayName("retainOnly drops vectors outside the kept ids and they stop showing up as neighbours")
    void retainOnlyPrunes() {
        HnswSimilarityIndex index = new HnswSimilarityIndex(3, 100);
        index.upsert("recent", new float[]{1, 0, 0});
        index.upsert("also-recent", new float[]{0, 1, 0});
        index.upsert("old", new float[]{0.95f, 0.05f, 0});

        assertEquals(1, index.retainOnly(Set.of("recent", "also-recent")));

        assertEquals(Set.of("recent", "also-recent"), index.ids());
        assertTrue(index.vectorOf("old").isEmpty());
        List<Neighbor> hits = index.nearest(new float[]{1, 0, 0}, 5, "recent");
        assertEquals(List.of("also-recent"), hits.stream().map(Neighbor::id).toList());
    }

    @Test
    @DisplayName("slots freed by removal take new vectors once the graph is full")
    void removalFreesCapacity() {
        HnswSimilarityIndex index = new HnswSimilarityIndex(2, 2);
        index.upsert("a", new float[]{1, 0});
        index.upsert("b", new float[]{0, 1});

        assertTrue(index.remove("a"));
        index.upsert("c", new float[]{1, 1});

        assertEquals(Set.of("b", "c"), index.ids());
        assertEquals(2, index.size());
    }
}
