package com.gillianbc.planner.service;

import com.gillianbc.planner.model.FilingStatus;
import com.gillianbc.planner.model.HealthcareAssumptions;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HealthcareCostModelTest {

    private static final double DELTA = 0.01;

    private final HealthcareCostModel model = new HealthcareCostModel();

    @Test
    @DisplayName("IRMAA surcharge starts above the first income threshold")
    void irmaaMonthlySurcharge_byTier() {
        assertEquals(0.0, model.irmaaMonthlySurcharge(100_000, FilingStatus.SINGLE), DELTA);
        assertEquals(81.20, model.irmaaMonthlySurcharge(120_000, FilingStatus.SINGLE), DELTA);
        assertEquals(0.0, model.irmaaMonthlySurcharge(120_000, FilingStatus.MARRIED), DELTA);
        assertEquals(487.00, model.irmaaMonthlySurcharge(1_000_000, FilingStatus.MARRIED), DELTA);
    }

    @Test
    @DisplayName("Medicare is charged per covered person and only when enabled")
    void medicareCost_perPerson() {
        HealthcareAssumptions on = HealthcareAssumptions.builder().includeMedicare(true).build();
        assertEquals(9_600.00, model.medicareCost(on, 2, 0, FilingStatus.MARRIED, 1.0), DELTA);
        assertEquals(4_800.00 * 1.5, model.medicareCost(on, 1, 0, FilingStatus.SINGLE, 1.5), DELTA);
        assertEquals(0.0, model.medicareCost(HealthcareAssumptions.none(), 2, 0, FilingStatus.MARRIED, 1.0), DELTA);
    }

    @Test
    @DisplayName("Pre-Medicare premiums follow age bands and stop at 65")
    void preMedicareCost_ageBands() {
        assertEquals(8_400.00, model.preMedicareCost(45, 1.0), DELTA);
        assertEquals(15_600.00, model.preMedicareCost(64, 1.0), DELTA);
        assertEquals(0.0, model.preMedicareCost(65, 1.0), DELTA);
    }

    @Test
    @DisplayName("Long-term-care onset is drawn inside the window, or never when the probability is zero")
    void drawLongTermCareOnset_respectsProbabilityAndWindow() {
        HealthcareAssumptions certain = HealthcareAssumptions.builder()
                .includeLongTermCare(true).ltcProbabilityPct(100).build();
        HealthcareAssumptions never = HealthcareAssumptions.builder()
                .includeLongTermCare(true).ltcProbabilityPct(0).build();
        Well19937c random = new Well19937c(7L);
        for (int i = 0; i < 50; i++) {
            OptionalInt onset = model.drawLongTermCareOnset(certain, random);
            assertTrue(onset.isPresent());
            assertTrue(onset.getAsInt() >= 75 && onset.getAsInt() <= 90);
            assertTrue(model.drawLongTermCareOnset(never, random).isEmpty());
        }
    }

    @Test
    @DisplayName("Long-term care is charged for the duration with a partial final year")
    void longTermCareCost_partialFinalYear() {
        HealthcareAssumptions ltc = HealthcareAssumptions.builder().includeLongTermCare(true).build();
        OptionalInt onset = OptionalInt.of(80);
        assertEquals(0.0, model.longTermCareCost(ltc, onset, 79, 1.0), DELTA);
        assertEquals(80_000.00, model.longTermCareCost(ltc, onset, 80, 1.0), DELTA);
        assertEquals(80_000.00, model.longTermCareCost(ltc, onset, 81, 1.0), DELTA);
        assertEquals(40_000.00, model.longTermCareCost(ltc, onset, 82, 1.0), DELTA);
        assertEquals(0.0, model.longTermCareCost(ltc, onset, 83, 1.0), DELTA);
        assertEquals(0.0, model.longTermCareCost(ltc, OptionalInt.empty(), 80, 1.0), DELTA);
    }
}
