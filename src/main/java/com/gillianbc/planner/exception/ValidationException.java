package com.gillianbc.planner.exception;

import lombok.Getter;

/**
 * Raised before any simulation starts when an input is missing or out of range.
 * The offending input is available from {@link #getField()}.
 */
@Getter
public class ValidationException extends IllegalArgumentException {

    private final String field;

    public ValidationException(String field, String message) {
        super(field + " " + message);
        this.field = field;
    }
}
