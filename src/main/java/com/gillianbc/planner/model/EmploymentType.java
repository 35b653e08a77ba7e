package com.gillianbc.planner.model;

public enum EmploymentType {
    W2,
    SELF_EMPLOYED,
    // income split evenly between wages and self-employment
    BOTH,
    RETIRED,
    OTHER
}
