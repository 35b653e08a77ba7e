package com.gillianbc.planner.model;

import lombok.Value;

/**
 * A group of beneficiaries of the same age.
 * generation is 0 for named beneficiaries and counts synthetic descendant generations otherwise.
 */
@Value
public class BeneficiaryCohort {
    int age;
    double size;
    int generation;
}
