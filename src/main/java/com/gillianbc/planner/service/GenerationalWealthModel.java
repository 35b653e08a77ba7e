package com.gillianbc.planner.service;

import com.gillianbc.planner.config.PlannerProperties;
import com.gillianbc.planner.exception.ValidationException;
import com.gillianbc.planner.model.BatchSummary;
import com.gillianbc.planner.model.BeneficiaryCohort;
import com.gillianbc.planner.model.CalculationOptions;
import com.gillianbc.planner.model.GenerationSnapshot;
import com.gillianbc.planner.model.GenerationalPayout;
import com.gillianbc.planner.model.GenerationalRequest;
import com.gillianbc.planner.model.LegacyOutcome;
import com.gillianbc.planner.model.LegacyPlan;
import com.gillianbc.planner.model.LegacyRequest;
import com.gillianbc.planner.model.RunOutcome;
import com.gillianbc.planner.model.SimulationInputs;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns an end-of-life estate into a dynasty of beneficiaries and works out how long a fixed real
 * payout to each living adult can be kept up.
 * <p>
 * Beneficiaries are tracked as cohorts of equal age. Cohorts inside the fertility window have
 * children every year until they reach the fertility rate, and die at the death age. The fund
 * grows at a constant real rate and pays every cohort from the minimum distribution age.
 */
@Slf4j
@Service
public class GenerationalWealthModel {

    // a fund is treated as perpetual when it distributes less than this share of its sustainable rate
    private static final double PERPETUITY_HEADROOM = 0.95;
    // replacement-level fertility
    private static final double REPLACEMENT_RATE = 2.0;
    private static final int CHUNK_YEARS = 10;
    private static final int EARLY_CHECK_YEAR = 1000;
    private static final int REFERENCE_YEAR = 100;
    // real growth past the early check year that counts as perpetual
    private static final double RUNAWAY_GROWTH = 0.03;
    // only the full-length horizon may short-circuit to perpetual
    private static final int UNBOUNDED_CAP = 10_000;
    private static final int MAX_SNAPSHOTS = 10;

    private final TaxModel taxModel;
    private final PlannerProperties.Legacy settings;

    public GenerationalWealthModel(TaxModel taxModel, PlannerProperties properties) {
        this.taxModel = taxModel;
        this.settings = properties.legacy();
    }

    /**
     * Replaces each beneficiary too old to have more children with the descendant generation that
     * still can, stepping down by the generation length and multiplying by the fertility rate.
     *
     * @param beneficiaries total beneficiaries, shared equally between the listed ages
     * @return one cohort per listed age; an age is left as it is when generationLength is not positive
     */
    public List<BeneficiaryCohort> backfill(List<Integer> ages, double beneficiaries, int fertilityWindowEnd,
                                            int generationLength, double fertilityRate, int maxGenerations) {
        Objects.requireNonNull(ages, "ages must not be null");
        if (ages.isEmpty()) {
            return Collections.emptyList();
        }
        double share = beneficiaries / ages.size();
        List<BeneficiaryCohort> cohorts = new ArrayList<>(ages.size());
        for (int age : ages) {
            int currentAge = age;
            double size = share;
            int generation = 0;
            if (generationLength <= 0 && currentAge > fertilityWindowEnd) {
                log.warn("Generation length {} is not positive, beneficiary aged {} is not backfilled", generationLength, age);
            } else {
                while (currentAge > fertilityWindowEnd && generation < maxGenerations) {
                    currentAge -= generationLength;
                    size *= fertilityRate;
                    generation++;
                }
            }
            cohorts.add(new BeneficiaryCohort(Math.max(0, currentAge), size, generation));
        }
        log.debug("Backfilled {} beneficiaries into {}", beneficiaries, cohorts);
        return cohorts;
    }

    /**
     * Runs the fund year by year until it cannot pay, the beneficiaries die out, perpetuity is
     * established, or the cap is reached.
     */
    public LegacyOutcome simulatePayout(LegacyRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        if (request.getCapYears() < 0) {
            throw new ValidationException("capYears", "must be >= 0");
        }
        double fund = request.getFundReal();
        double realReturn = request.getRealReturn();
        double startBeneficiaries = request.startingBeneficiaries();
        if (fund <= 0) {
            return LegacyOutcome.builder().years(0).perpetual(false).fundLeftReal(0)
                    .livingBeneficiaries(startBeneficiaries).build();
        }

        double populationGrowth = populationGrowth(request.getFertilityRate(), request.getGenerationLength());
        double distributionRate = request.getPerBeneficiaryPayout() * startBeneficiaries / fund;
        if (request.getCapYears() >= UNBOUNDED_CAP
                && distributionRate < PERPETUITY_HEADROOM * (realReturn - populationGrowth)) {
            log.debug("Distribution rate {} is sustainable at real return {}, perpetual", distributionRate, realReturn);
            return LegacyOutcome.builder().years(0).perpetual(true).fundLeftReal(fund)
                    .livingBeneficiaries(startBeneficiaries).build();
        }

        int windowYears = request.getFertilityWindowEnd() - request.getFertilityWindowStart();
        double birthsPerYear = windowYears > 0 ? request.getFertilityRate() / windowYears : 0;
        List<Cohort> cohorts = new ArrayList<>();
        for (BeneficiaryCohort cohort : request.getCohorts()) {
            cohorts.add(new Cohort(cohort.getAge(), cohort.getSize(), cohort.getAge() <= request.getFertilityWindowEnd()));
        }

        LegacyOutcome.LegacyOutcomeBuilder outcome = LegacyOutcome.builder();
        int snapshots = 0;
        int nextCheckpoint = request.getGenerationLength();
        int years = 0;
        double fundAtReference = 0;
        double fundAtEarlyCheck = 0;

        while (years < request.getCapYears()) {
            int chunk = Math.min(CHUNK_YEARS, request.getCapYears() - years);
            for (int i = 0; i < chunk; i++) {
                cohorts.removeIf(c -> c.age >= request.getDeathAge());
                double living = living(cohorts);
                if (living <= 0) {
                    return outcome.years(years).perpetual(false).fundLeftReal(0).livingBeneficiaries(0).build();
                }
                fund *= 1 + realReturn;
                double eligible = 0;
                for (Cohort cohort : cohorts) {
                    if (cohort.age >= request.getMinDistributionAge()) {
                        eligible += cohort.size;
                    }
                }
                fund -= request.getPerBeneficiaryPayout() * eligible;
                if (fund < 0) {
                    log.debug("Legacy fund depleted after {} years", years);
                    return outcome.years(years).perpetual(false).fundLeftReal(0).livingBeneficiaries(living).build();
                }
                years++;
                ageAndReproduce(cohorts, request, birthsPerYear);
            }

            if (years >= nextCheckpoint && snapshots < MAX_SNAPSHOTS) {
                snapshots++;
                outcome.generation(snapshot(request, snapshots, years, fund, living(cohorts)));
                nextCheckpoint += request.getGenerationLength() > 0 ? request.getGenerationLength() : request.getCapYears();
            }

            if (years == REFERENCE_YEAR) {
                fundAtReference = fund;
            }
            if (years == EARLY_CHECK_YEAR) {
                fundAtEarlyCheck = fund;
            }
            if (years > EARLY_CHECK_YEAR && request.getCapYears() >= UNBOUNDED_CAP
                    && fundAtReference > 0 && fundAtEarlyCheck > 0 && fund > fundAtEarlyCheck) {
                double growth = Math.pow(fund / fundAtEarlyCheck, 1.0 / (years - EARLY_CHECK_YEAR)) - 1;
                if (growth > RUNAWAY_GROWTH) {
                    log.debug("Legacy fund growing {} a year after {} years, perpetual", growth, years);
                    return outcome.years(years).perpetual(true).fundLeftReal(fund).livingBeneficiaries(living(cohorts)).build();
                }
            }
        }
        return outcome.years(years).perpetual(fund > 0).fundLeftReal(fund).livingBeneficiaries(living(cohorts)).build();
    }

    /**
     * Prepares the p10, p50 and p90 legacy runs for a finished batch.
     *
     * @return empty when there is nothing to distribute or nobody to distribute it to
     */
    public Optional<LegacyPlan> plan(SimulationInputs inputs, BatchSummary batch, GenerationalRequest request,
                                     CalculationOptions options) {
        Objects.requireNonNull(inputs, "inputs must not be null");
        Objects.requireNonNull(batch, "batch must not be null");
        Objects.requireNonNull(options, "options must not be null");
        if (request == null) {
            return Optional.empty();
        }
        List<Integer> ages = new ArrayList<>();
        for (Integer age : request.getBeneficiaryAges()) {
            if (age != null && age >= 0 && age < request.getDeathAge()) {
                ages.add(age);
            }
        }
        double count = request.getBeneficiaryCount() > 0 ? request.getBeneficiaryCount() : ages.size();
        if (ages.isEmpty() || count <= 0 || request.getPerBeneficiaryPayout() <= 0) {
            log.info("Skipping generational projection: {} beneficiary ages, payout {}", ages.size(),
                    request.getPerBeneficiaryPayout());
            return Optional.empty();
        }

        int yearsToEstate = inputs.horizon() - 1;
        double medianNet = netEstateReal(batch.getTerminalReal().getP50(), inputs, options, yearsToEstate);
        if (medianNet <= 0) {
            log.info("Skipping generational projection: no median estate left");
            return Optional.empty();
        }

        List<BeneficiaryCohort> cohorts = backfill(ages, count, request.getFertilityWindowEnd(),
                request.getGenerationLength(), request.getFertilityRate(), settings.maxBackfillGenerations());

        LegacyRequest template = LegacyRequest.builder()
                .perBeneficiaryPayout(request.getPerBeneficiaryPayout())
                .cohorts(cohorts)
                .fertilityRate(request.getFertilityRate())
                .generationLength(request.getGenerationLength())
                .deathAge(Math.max(1, request.getDeathAge()))
                .minDistributionAge(Math.max(0, request.getMinDistributionAge()))
                .fertilityWindowStart(request.getFertilityWindowStart())
                .fertilityWindowEnd(request.getFertilityWindowEnd())
                .capYears(settings.capYears())
                .inflationPct(inputs.getInflationPct())
                .yearsUntilStart(yearsToEstate)
                .startYear(options.getCurrentYear() + yearsToEstate)
                .filingStatus(inputs.getFilingStatus())
                .estateExemptionSunset(options.isEstateExemptionSunset())
                .build();

        double probability = probabilityOfPerpetuity(batch.getAllRuns(), inputs, options, yearsToEstate,
                request.getPerBeneficiaryPayout() * Math.max(1, count), populationGrowth(request.getFertilityRate(), request.getGenerationLength()));

        return Optional.of(LegacyPlan.builder()
                .p10(variantRequest(template, batch.getTerminalReal().getP10(), inputs, options, yearsToEstate))
                .p50(variantRequest(template, batch.getTerminalReal().getP50(), inputs, options, yearsToEstate))
                .p90(variantRequest(template, batch.getTerminalReal().getP90(), inputs, options, yearsToEstate))
                .cohorts(cohorts)
                .beneficiaryCount(count)
                .perBeneficiaryPayout(request.getPerBeneficiaryPayout())
                .probabilityOfPerpetuity(probability)
                .build());
    }

    public GenerationalPayout assemble(LegacyPlan plan, LegacyOutcome p10, LegacyOutcome p50, LegacyOutcome p90) {
        return GenerationalPayout.builder()
                .perBeneficiaryPayout(plan.getPerBeneficiaryPayout())
                .years(p50.getYears())
                .perpetual(p50.isPerpetual())
                .remainingFund(p50.getFundLeftReal())
                .beneficiaryCount(plan.getBeneficiaryCount())
                .livingBeneficiaries(p50.getLivingBeneficiaries())
                .cohorts(plan.getCohorts())
                .generations(p50.getGenerations())
                .p10(variant(10, plan.getP10(), p10))
                .p50(variant(50, plan.getP50(), p50))
                .p90(variant(90, plan.getP90(), p90))
                .probabilityOfPerpetuity(plan.getProbabilityOfPerpetuity())
                .build();
    }

    /**
     * Plans and runs the three legacy simulations on the calling thread.
     */
    public Optional<GenerationalPayout> project(SimulationInputs inputs, BatchSummary batch,
                                                GenerationalRequest request, CalculationOptions options) {
        return plan(inputs, batch, request, options)
                .map(plan -> assemble(plan,
                        simulatePayout(plan.getP10()),
                        simulatePayout(plan.getP50()),
                        simulatePayout(plan.getP90())));
    }

    /**
     * Constant real growth rate that turns the starting portfolio into the given terminal value
     * over the whole horizon, or the expected real return when that cannot be back-solved.
     */
    double impliedRealReturn(double terminalReal, SimulationInputs inputs) {
        double start = inputs.startingPortfolio();
        int years = inputs.horizon() - 1;
        if (start <= 0 || terminalReal <= 0 || years <= 0) {
            return expectedRealReturn(inputs);
        }
        return Math.pow(terminalReal / start, 1.0 / years) - 1;
    }

    private LegacyRequest variantRequest(LegacyRequest template, double terminalReal, SimulationInputs inputs,
                                         CalculationOptions options, int yearsToEstate) {
        return template.toBuilder()
                .fundReal(Math.max(0, netEstateReal(terminalReal, inputs, options, yearsToEstate)))
                .realReturn(impliedRealReturn(terminalReal, inputs))
                .build();
    }

    private double probabilityOfPerpetuity(List<RunOutcome> runs, SimulationInputs inputs, CalculationOptions options,
                                           int yearsToEstate, double totalDistribution, double populationGrowth) {
        if (runs.isEmpty()) {
            return 0;
        }
        double sustainableRate = expectedRealReturn(inputs) - populationGrowth;
        if (sustainableRate <= 0) {
            return 0;
        }
        double minEstate = totalDistribution / sustainableRate * (1 + settings.perpetuitySafetyMargin());
        int lasting = 0;
        for (RunOutcome run : runs) {
            if (netEstateReal(run.getTerminalReal(), inputs, options, yearsToEstate) >= minEstate) {
                lasting++;
            }
        }
        log.debug("{} of {} estates exceed the perpetual minimum of {}", lasting, runs.size(),
                String.format("%,.2f", minEstate));
        return (double) lasting / runs.size();
    }

    private double netEstateReal(double terminalReal, SimulationInputs inputs, CalculationOptions options, int yearsToEstate) {
        double inflation = Math.pow(1 + inputs.getInflationPct() / 100.0, yearsToEstate);
        double nominal = terminalReal * inflation;
        double tax = taxModel.estateTax(nominal, inputs.getFilingStatus(),
                options.getCurrentYear() + yearsToEstate, options.isEstateExemptionSunset());
        return (nominal - tax) / inflation;
    }

    private GenerationSnapshot snapshot(LegacyRequest request, int generation, int years, double fund, double living) {
        double nominal = fund * Math.pow(1 + request.getInflationPct() / 100.0, request.getYearsUntilStart() + years);
        double tax = taxModel.estateTax(nominal, request.getFilingStatus(), request.getStartYear() + years,
                request.isEstateExemptionSunset());
        return GenerationSnapshot.builder()
                .generation(generation)
                .year(years)
                .nominalEstate(nominal)
                .estateTax(tax)
                .netToHeirs(nominal - tax)
                .realFund(fund)
                .livingBeneficiaries(living)
                .build();
    }

    private static GenerationalPayout.Variant variant(int percentile, LegacyRequest request, LegacyOutcome outcome) {
        return GenerationalPayout.Variant.builder()
                .percentile(percentile)
                .netEstateReal(request.getFundReal())
                .impliedRealReturn(request.getRealReturn())
                .years(outcome.getYears())
                .perpetual(outcome.isPerpetual())
                .fundLeftReal(outcome.getFundLeftReal())
                .generations(outcome.getGenerations())
                .build();
    }

    private static void ageAndReproduce(List<Cohort> cohorts, LegacyRequest request, double birthsPerYear) {
        double newborns = 0;
        for (Cohort cohort : cohorts) {
            cohort.age++;
            if (cohort.canReproduce
                    && cohort.age >= request.getFertilityWindowStart()
                    && cohort.age <= request.getFertilityWindowEnd()
                    && cohort.cumulativeBirths < request.getFertilityRate()) {
                double rate = Math.min(birthsPerYear, request.getFertilityRate() - cohort.cumulativeBirths);
                newborns += cohort.size * rate;
                cohort.cumulativeBirths += rate;
            }
        }
        if (newborns > 0) {
            cohorts.add(new Cohort(0, newborns, true));
        }
    }

    private static double living(List<Cohort> cohorts) {
        double total = 0;
        for (Cohort cohort : cohorts) {
            total += cohort.size;
        }
        return total;
    }

    private static double populationGrowth(double fertilityRate, int generationLength) {
        return generationLength > 0 ? (fertilityRate - REPLACEMENT_RATE) / generationLength : 0;
    }

    private static double expectedRealReturn(SimulationInputs inputs) {
        return (1 + inputs.getExpectedReturnPct() / 100.0) / (1 + inputs.getInflationPct() / 100.0) - 1;
    }

    private static final class Cohort {
        int age;
        final double size;
        final boolean canReproduce;
        double cumulativeBirths;

        Cohort(int age, double size, boolean canReproduce) {
            this.age = age;
            this.size = size;
            this.canReproduce = canReproduce;
        }
    }
}
