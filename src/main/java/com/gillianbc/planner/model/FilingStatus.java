package com.gillianbc.planner.model;

public enum FilingStatus {
    SINGLE,
    MARRIED;

    public boolean isMarried() {
        return this == MARRIED;
    }
}
