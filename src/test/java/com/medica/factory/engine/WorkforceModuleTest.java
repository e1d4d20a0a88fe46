package com.medica.factory.engine;

import com.medica.factory.FactoryFixtures;
import com.medica.factory.domain.SimulationState;
import com.medica.factory.domain.Strategy;
import com.medica.factory.domain.Workforce;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class WorkforceModuleTest {

    private final WorkforceModule workforce = new WorkforceModule();

    @Test
    void arcpCapacityCountsRookiesAtFortyPercentAndOvertime() {
        SimulationState state = FactoryFixtures.emptyPlant(1, 1, 1, 2);
        workforce.hireRookies(state, 1);

        assertThat(workforce.arcpCapacity(state.getWorkforce(), 0)).isCloseTo(7.2, within(1e-9));
        assertThat(workforce.arcpCapacity(state.getWorkforce(), 4)).isCloseTo(10.8, within(1e-9));
    }

    @Test
    void payrollAndOvertime() {
        Workforce crew = Workforce.builder().experts(2).build();

        assertThat(workforce.dailyPayroll(crew)).isEqualTo(300);
        assertThat(workforce.overtimeCost(crew, 2)).isCloseTo(2 * 1.5 * 300 / 8.0, within(1e-9));
        assertThat(workforce.overtimeCost(crew, 0)).isZero();
    }

    @Test
    void rookiesArePromotedAfterTraining() {
        SimulationState state = FactoryFixtures.emptyPlant(1, 1, 1, 1);
        workforce.hireRookies(state, 2);

        int promoted = 0;
        for (int day = 0; day < 14; day++) {
            promoted += workforce.advanceTraining(state);
        }
        assertThat(promoted).isZero();

        assertThat(workforce.advanceTraining(state)).isEqualTo(2);
        assertThat(state.getWorkforce().getExperts()).isEqualTo(3);
        assertThat(state.getWorkforce().getRookies()).isZero();
    }

    @Test
    void quitRiskStartsOnlyAfterTriggerDays() {
        SimulationState state = FactoryFixtures.emptyPlant(1, 1, 1, 4);
        Strategy strategy = Strategy.defaults().toBuilder()
                .dailyOvertimeHours(2).overtimeTriggerDays(2).dailyQuitProbability(1.0).build();
        Random random = new Random(1);

        assertThat(workforce.applyOvertimeAndQuitRisk(state, strategy, random)).isZero();
        assertThat(workforce.applyOvertimeAndQuitRisk(state, strategy, random)).isZero();
        assertThat(workforce.applyOvertimeAndQuitRisk(state, strategy, random)).isEqualTo(4);
        assertThat(state.getWorkforce().getExperts()).isZero();
    }

    @Test
    void dayWithoutOvertimeResetsTheStreak() {
        SimulationState state = FactoryFixtures.emptyPlant(1, 1, 1, 4);
        Strategy overtime = Strategy.defaults().toBuilder().dailyOvertimeHours(2).build();
        Random random = new Random(1);
        workforce.applyOvertimeAndQuitRisk(state, overtime, random);
        workforce.applyOvertimeAndQuitRisk(state, overtime, random);

        workforce.applyOvertimeAndQuitRisk(state, Strategy.defaults(), random);

        assertThat(state.getWorkforce().getConsecutiveOvertimeDays()).isZero();
    }
}
