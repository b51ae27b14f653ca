package com.paperradar.common.baseline;

public enum BaselineSource {
    /** Statistics computed from the category's own sample. */
    CATEGORY,
    /** Statistics borrowed from the whole in-window population. */
    GLOBAL
}
