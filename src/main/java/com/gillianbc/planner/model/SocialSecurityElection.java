package com.gillianbc.planner.model;

import lombok.Value;

/**
 * One person's Social Security election.
 * averageCareerIncome is the indexed average annual earnings used to derive the benefit.
 */
@Value
public class SocialSecurityElection {

    public static final SocialSecurityElection NONE = new SocialSecurityElection(false, 0, 67);

    boolean enabled;
    double averageCareerIncome;
    int claimAge;

    public static SocialSecurityElection claimingAt(int claimAge, double averageCareerIncome) {
        return new SocialSecurityElection(true, averageCareerIncome, claimAge);
    }
}
