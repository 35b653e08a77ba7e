package com.gillianbc.planner.exception;

import java.time.Duration;

/**
 * A generational (legacy) request did not finish within its time limit.
 */
public class SimulationTimeoutException extends RuntimeException {

    public SimulationTimeoutException(String requestId, Duration timeout) {
        super("Legacy simulation " + requestId + " timed out after " + timeout.toMillis() + "ms");
    }
}
