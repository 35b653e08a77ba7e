package com.gillianbc.planner.model;

/**
 * Whether sampled market returns are used as-is or deflated by the inflation assumption.
 */
public enum WalkSeries {
    NOMINAL,
    REAL
}
