package com.paperradar.common.exception;

/**
 * A single-flight computation failed, timed out or produced no value. Delivered to every
 * caller waiting on the same key; the key stays uncached.
 */
public class CacheComputeException extends RankingException {
    private final String key;

    public CacheComputeException(String key, String message) {
        super("cache", key + ": " + message);
        this.key = key;
    }

    public CacheComputeException(String key, Throwable cause) {
        super("cache", key + ": " + cause.getMessage(), cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
