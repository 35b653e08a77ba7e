package com.gillianbc.planner.model;

import lombok.Value;

/**
 * Converts pre-tax money to Roth each retirement year before RMDs start, filling income up to
 * the top of the bracket taxed at targetBracketRate (for example 0.24).
 */
@Value
public class RothConversionPolicy {
    double targetBracketRate;
}
