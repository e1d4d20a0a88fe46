package com.medica.factory.engine;

import com.medica.factory.domain.Strategy;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DemandModuleTest {

    private final DemandModule demand = new DemandModule();
    private final Strategy strategy = Strategy.defaults();

    @Test
    void phaseBoundaries() {
        assertThat(demand.demandPhase(172)).isEqualTo(1);
        assertThat(demand.demandPhase(173)).isEqualTo(2);
        assertThat(demand.demandPhase(218)).isEqualTo(2);
        assertThat(demand.demandPhase(219)).isEqualTo(3);
        assertThat(demand.demandPhase(400)).isEqualTo(3);
        assertThat(demand.demandPhase(401)).isEqualTo(4);
    }

    @Test
    void customMeanRampsBetweenPhasesAndRunsOff() {
        assertThat(demand.customDemandMean(100, strategy)).isEqualTo(12);
        assertThat(demand.customDemandMean(195, strategy)).isCloseTo(15, within(1e-9));
        assertThat(demand.customDemandMean(300, strategy)).isEqualTo(18);
        assertThat(demand.customDemandMean(450, strategy)).isCloseTo(9, within(1e-9));
    }

    @Test
    void standardDemandIsLinearAndNeverNegative() {
        assertThat(demand.standardDemand(225, strategy)).isEqualTo(375);
        assertThat(demand.standardDemand(400, strategy)).isZero();
    }

    @Test
    void sampledOrdersAreNonNegativeAndSeeded() {
        Random a = new Random(3);
        Random b = new Random(3);
        for (int day = 51; day < 415; day++) {
            int first = demand.sampleCustomOrders(day, strategy, a);
            assertThat(first).isNotNegative();
            assertThat(demand.sampleCustomOrders(day, strategy, b)).isEqualTo(first);
        }
    }
}
