package com.gillianbc.planner.exception;

/**
 * Unexpected failure while a simulation or analysis was running.
 */
public class ComputationException extends RuntimeException {

    public ComputationException(String message) {
        super(message);
    }

    public ComputationException(String message, Throwable cause) {
        super(message, cause);
    }
}
