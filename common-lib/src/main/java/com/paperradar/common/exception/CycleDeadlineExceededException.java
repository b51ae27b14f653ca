package com.paperradar.common.exception;

import java.time.Duration;

public class CycleDeadlineExceededException extends RankingException {

    public CycleDeadlineExceededException(String component, Duration needed) {
        super(component, "deadline cannot accommodate wait of " + needed.toMillis() + "ms");
    }

    public CycleDeadlineExceededException(String component, String message) {
        super(component, message);
    }
}
