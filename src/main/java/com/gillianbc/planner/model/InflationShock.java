package com.gillianbc.planner.model;

import lombok.Value;

/**
 * Temporary inflation rate that replaces the base assumption for a number of years,
 * starting in the retirement year.
 */
@Value
public class InflationShock {
    double ratePct;
    int durationYears;
}
