package com.paperradar.common.exception;

public class CycleAlreadyRunningException extends RankingException {

    public CycleAlreadyRunningException(String runningCycleId) {
        super("cycle-supervisor", "cycle " + runningCycleId + " is still running");
    }
}
