package com.paperradar.common.baseline;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * All field baselines of one cycle. Immutable, so scoring workers share it without locking.
 */
public record BaselineSnapshot(
    Map<String, FieldBaseline> byCategory,
    FieldBaseline global,
    Instant computedAt,
    int windowDays
) {

    public BaselineSnapshot {
        byCategory = Collections.unmodifiableMap(new TreeMap<>(byCategory));
    }

    /**
     * Baseline for {@code category}. A category the window never saw gets the global
     * statistics flagged insufficient with a sample size of zero.
     */
    public FieldBaseline forCategory(String category) {
        if (category == null) return global.substituteFor(null, 0);
        FieldBaseline baseline = byCategory.get(category);
        return baseline != null ? baseline : global.substituteFor(category, 0);
    }

    /** Categories that fell back to the global baseline, in name order. */
    public List<String> insufficientCategories() {
        return byCategory.values().stream()
            .filter(FieldBaseline::insufficient)
            .map(FieldBaseline::category)
            .toList();
    }
}
