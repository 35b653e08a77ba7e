package com.gillianbc.planner.model;

import lombok.Value;

@Value
public class ProgressEvent {

    public enum Phase {
        SIMULATING,
        LEGACY,
        ANALYZING,
        DONE
    }

    Phase phase;
    // 0..100
    int percent;
    String message;
}
