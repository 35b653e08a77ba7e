package com.gillianbc.planner.service;

import com.gillianbc.planner.model.FilingStatus;
import com.gillianbc.planner.model.HealthcareAssumptions;
import org.apache.commons.math3.random.RandomGenerator;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Medicare premiums with IRMAA surcharges, pre-Medicare premiums and long-term-care costs.
 * <p>
 * Costs are annual and nominal: the caller passes the medical inflation factor accumulated so far.
 * The only random element, whether and when long-term care starts, is drawn from a generator
 * supplied by the caller so a seeded path stays reproducible.
 */
@Service
public class HealthcareCostModel {

    // annual individual premiums before Medicare, by age band
    private static final double PRE_MEDICARE_UNDER_30 = 4_800;
    private static final double PRE_MEDICARE_30S = 6_000;
    private static final double PRE_MEDICARE_40S = 8_400;
    private static final double PRE_MEDICARE_50_TO_54 = 10_800;
    private static final double PRE_MEDICARE_55_TO_59 = 13_200;
    private static final double PRE_MEDICARE_60_TO_64 = 15_600;

    /**
     * Monthly IRMAA surcharge for one person, looked up against modified AGI.
     */
    public double irmaaMonthlySurcharge(double magi, FilingStatus status) {
        return TaxTables.irmaaSurcharge(TaxTables.schedule(status).irmaaTier(magi));
    }

    /**
     * Annual Medicare cost for everyone aged 65 or over.
     *
     * @param coveredPeople      number of household members on Medicare this year
     * @param priorYearMagi      modified AGI of the previous simulated year
     * @param medicalInflation   cumulative medical inflation factor since today
     */
    public double medicareCost(HealthcareAssumptions assumptions, int coveredPeople, double priorYearMagi,
                               FilingStatus status, double medicalInflation) {
        Objects.requireNonNull(assumptions, "assumptions must not be null");
        if (!assumptions.isIncludeMedicare() || coveredPeople <= 0) {
            return 0;
        }
        double monthly = assumptions.getMedicarePremium() + irmaaMonthlySurcharge(priorYearMagi, status);
        return coveredPeople * monthly * 12.0 * medicalInflation;
    }

    /**
     * Individual health premium for someone not yet on Medicare, zero from 65.
     */
    public double preMedicareCost(int age, double medicalInflation) {
        double base;
        if (age >= TaxTables.MEDICARE_AGE) {
            return 0;
        } else if (age < 30) {
            base = PRE_MEDICARE_UNDER_30;
        } else if (age < 40) {
            base = PRE_MEDICARE_30S;
        } else if (age < 50) {
            base = PRE_MEDICARE_40S;
        } else if (age < 55) {
            base = PRE_MEDICARE_50_TO_54;
        } else if (age < 60) {
            base = PRE_MEDICARE_55_TO_59;
        } else {
            base = PRE_MEDICARE_60_TO_64;
        }
        return base * medicalInflation;
    }

    /**
     * Decides for one path whether long-term care is needed and, if so, at what age it starts.
     * Consumes exactly two draws from the generator whether or not care is needed.
     *
     * @return the onset age, or empty when the path never needs care
     */
    public OptionalInt drawLongTermCareOnset(HealthcareAssumptions assumptions, RandomGenerator random) {
        double trigger = random.nextDouble() * 100.0;
        int span = Math.max(0, assumptions.getLtcOnsetEndAge() - assumptions.getLtcOnsetStartAge());
        int onset = assumptions.getLtcOnsetStartAge() + random.nextInt(span + 1);
        if (!assumptions.isIncludeLongTermCare() || trigger >= assumptions.getLtcProbabilityPct()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(onset);
    }

    /**
     * Long-term-care cost for the year the person is at the given age. A fractional duration
     * charges a partial final year.
     */
    public double longTermCareCost(HealthcareAssumptions assumptions, OptionalInt onsetAge, int age,
                                   double medicalInflation) {
        if (!assumptions.isIncludeLongTermCare() || onsetAge.isEmpty()) {
            return 0;
        }
        int yearsInCare = age - onsetAge.getAsInt();
        if (yearsInCare < 0 || yearsInCare >= assumptions.getLtcDurationYears()) {
            return 0;
        }
        double share = Math.min(1.0, assumptions.getLtcDurationYears() - yearsInCare);
        return assumptions.getLtcAnnualCost() * share * medicalInflation;
    }
}
