package com.gillianbc.planner.model;

/**
 * How annual market returns are produced for a path.
 */
public enum ReturnMode {
    /** Every year earns the expected return. */
    FIXED,
    /** Replays the S&amp;P 500 series in order from a chosen start year. */
    HISTORICAL,
    /** Bootstraps years from the S&amp;P 500 series with a reproducible seed. */
    SEEDED_RANDOM,
    /** Bootstraps years with a fresh seed for every batch. */
    UNSEEDED_RANDOM;

    public boolean isRandom() {
        return this == SEEDED_RANDOM || this == UNSEEDED_RANDOM;
    }
}
