package com.gillianbc.planner;

import com.gillianbc.planner.config.PlannerProperties;
import com.gillianbc.planner.service.RetirementCalculator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

@SpringBootTest
class PlannerApplicationTests {

    @Autowired
    private RetirementCalculator calculator;

    @Autowired
    private PlannerProperties properties;

    @Test
    void contextLoads() {
        assertNotNull(calculator);
        assertEquals(1000, properties.simulation().paths());
        assertEquals(0.025, properties.simulation().trimFraction(), 1e-9);
        assertEquals(Duration.ofSeconds(60), properties.dispatcher().legacyTimeout());
        assertEquals(20, properties.legacy().maxBackfillGenerations());
    }
}
