package com.paperradar.common.exception;

/** Non-retryable provider failure: any error status other than 429, or a transport error. */
public class ProviderTerminalException extends RankingException {
    private final String provider;
    private final int status;

    public ProviderTerminalException(String provider, int status, String message, Throwable cause) {
        super("provider:" + provider, message, cause);
        this.provider = provider;
        this.status = status;
    }

    public String getProvider() {
        return provider;
    }

    /** HTTP status, or {@code 0} when the call never produced a response. */
    public int getStatus() {
        return status;
    }
}
