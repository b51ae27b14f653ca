package com.paperradar.common.baseline;

/**
 * @param windowDays    rolling window of publication dates the population is drawn from
 * @param minSampleSize categories with fewer in-window artifacts borrow the global baseline
 */
public record BaselinePolicy(int windowDays, int minSampleSize) {

    public static final int DEFAULT_WINDOW_DAYS = 90;
    public static final int DEFAULT_MIN_SAMPLE_SIZE = 30;

    public BaselinePolicy {
        if (windowDays <= 0) throw new IllegalArgumentException("windowDays must be > 0, was " + windowDays);
        if (minSampleSize <= 0) throw new IllegalArgumentException("minSampleSize must be > 0, was " + minSampleSize);
    }

    public static BaselinePolicy defaults() {
        return new BaselinePolicy(DEFAULT_WINDOW_DAYS, DEFAULT_MIN_SAMPLE_SIZE);
    }
}
