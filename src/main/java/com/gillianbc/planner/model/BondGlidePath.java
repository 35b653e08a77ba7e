package com.gillianbc.planner.model;

import lombok.Builder;
import lombok.Value;

/**
 * Schedule of the bond share of the portfolio by age.
 */
@Value
@Builder
public class BondGlidePath {

    public enum Strategy {
        /** All equities. */
        AGGRESSIVE,
        /** 10% bonds before 40, rising linearly to 60% at 60. */
        AGE_BASED,
        /** Moves from startPct at startAge to endPct at endAge following the shape. */
        CUSTOM
    }

    public enum Shape {
        LINEAR,
        // moves faster early on
        ACCELERATED,
        // moves faster late
        DECELERATED
    }

    @Builder.Default
    Strategy strategy = Strategy.CUSTOM;
    @Builder.Default
    double startPct = 10;
    @Builder.Default
    double endPct = 60;
    @Builder.Default
    int startAge = 30;
    @Builder.Default
    int endAge = 75;
    @Builder.Default
    Shape shape = Shape.LINEAR;
}
