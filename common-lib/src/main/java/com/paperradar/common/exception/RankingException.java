package com.paperradar.common.exception;

/**
 * Root of the ranking core's unchecked error taxonomy. The message is prefixed with the
 * component that raised it so log lines read {@code [rate-limiter] ...}.
 */
public class RankingException extends RuntimeException {
    private final String component;

    public RankingException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public RankingException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
