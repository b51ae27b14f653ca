package com.paperradar.common.ratelimit;

/**
 * Admission priority. {@code LOW} is throttled first and never drains the reserve;
 * {@code HIGH} may pass a backoff window within a small per-window budget.
 */
public enum Priority {
    LOW,
    NORMAL,
    HIGH
}
