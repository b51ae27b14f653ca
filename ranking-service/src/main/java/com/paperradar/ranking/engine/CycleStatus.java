package com.paperradar.ranking.engine;

public enum CycleStatus {
    /** Every artifact was attempted and failures stayed under the threshold. */
    COMPLETED,
    /** Every artifact was attempted but too many failed. */
    DEGRADED,
    /** The deadline stopped scoring early; entries already written are kept. */
    PARTIAL
}
