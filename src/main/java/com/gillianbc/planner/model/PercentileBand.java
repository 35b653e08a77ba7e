package com.gillianbc.planner.model;

import lombok.Value;

@Value
public class PercentileBand {
    double p10;
    double p25;
    double p50;
    double p75;
    double p90;

    public boolean isMonotonic() {
        return p10 <= p25 && p25 <= p50 && p50 <= p75 && p75 <= p90;
    }
}
