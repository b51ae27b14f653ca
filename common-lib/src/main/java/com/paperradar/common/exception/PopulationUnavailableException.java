package com.paperradar.common.exception;

/** The population for a cycle could not be fetched. Systemic: escalates out of the cycle. */
public class PopulationUnavailableException extends RankingException {

    public PopulationUnavailableException(String source, Throwable cause) {
        super("population:" + source, "population unavailable: " + cause.getMessage(), cause);
    }
}
