package com.medica.factory.engine;

import com.medica.factory.FactoryFixtures;
import com.medica.factory.domain.DailyMetric;
import com.medica.factory.domain.FactoryConstants;
import com.medica.factory.domain.HistoryMetric;
import com.medica.factory.domain.InitialScenario;
import com.medica.factory.domain.MachineType;
import com.medica.factory.domain.ProductLine;
import com.medica.factory.domain.SimulationResult;
import com.medica.factory.domain.SimulationState;
import com.medica.factory.domain.Strategy;
import com.medica.factory.domain.StrategyAction;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SimulationEngineTest {

    private final SimulationEngine engine = SimulationEngine.standalone(42L);

    @Test
    void historicalRunKeepsHardInvariantsEveryDay() {
        SimulationResult result = engine.runSimulation(Strategy.defaults(), FactoryConstants.SIMULATION_END_DAY,
                InitialStates.historical());

        assertThat(result.getHistory().days())
                .isEqualTo(FactoryConstants.SIMULATION_END_DAY - FactoryConstants.SIMULATION_START_DAY + 1);
        assertThat(values(result, HistoryMetric.CASH)).allMatch(v -> v >= 0);
        assertThat(values(result, HistoryMetric.DEBT)).allMatch(v -> v >= 0);
        assertThat(values(result, HistoryMetric.RAW_MATERIAL_INVENTORY)).allMatch(v -> v >= 0);
        assertThat(values(result, HistoryMetric.CUSTOM_WIP)).allMatch(v -> v <= FactoryConstants.MAX_CUSTOM_WIP);
        assertThat(result.getMetrics().getFinalDay()).isEqualTo(FactoryConstants.SIMULATION_END_DAY);
    }

    @Test
    void sameSeedGivesIdenticalRuns() {
        SimulationResult first = engine.runSimulation(Strategy.defaults(), 150, InitialStates.businessCase(), 7L);
        SimulationResult second = engine.runSimulation(Strategy.defaults(), 150, InitialStates.businessCase(), 7L);

        assertThat(second.getMetrics()).isEqualTo(first.getMetrics());
        assertThat(values(second, HistoryMetric.CASH)).isEqualTo(values(first, HistoryMetric.CASH));
    }

    @Test
    void inputsAreNotModified() {
        SimulationState initial = InitialStates.historical();
        double cash = initial.getCash();
        int wip = initial.getCustomWip();
        Strategy strategy = Strategy.defaults().toBuilder()
                .timedActions(new ArrayList<>(List.of(StrategyAction.adjustPrice(60, ProductLine.STANDARD, 250))))
                .build();

        SimulationResult result = engine.runSimulation(strategy, 120, initial);

        assertThat(initial.getCurrentDay()).isEqualTo(FactoryConstants.SIMULATION_START_DAY);
        assertThat(initial.getCash()).isEqualTo(cash);
        assertThat(initial.getCustomWip()).isEqualTo(wip);
        assertThat(initial.getHistory().days()).isZero();
        assertThat(strategy.getStandardPrice()).isEqualTo(225);
        assertThat(result.getStrategy().getStandardPrice()).isEqualTo(250);
    }

    @Test
    void materialIsConservedAcrossProduction() {
        SimulationState plant = FactoryFixtures.emptyPlant(1, 1, 1, 3);

        SimulationResult result = engine.runSimulation(Strategy.defaults(), 130, plant);
        SimulationState end = result.getFinalState();

        assertThat(end.getTotalStandardCompleted() + end.getTotalCustomCompleted()).isPositive();
        assertThat(end.getTotalRawMaterialConsumed())
                .isGreaterThanOrEqualTo(2 * end.getTotalStandardCompleted() + end.getTotalCustomCompleted());
    }

    @ParameterizedTest
    @EnumSource(InitialScenario.class)
    void seededWorkInProcessIsCoveredByMaterial(InitialScenario scenario) {
        SimulationState initial = InitialStates.create(scenario);

        SimulationResult result = engine.runSimulation(Strategy.defaults(), FactoryConstants.SIMULATION_END_DAY, initial);
        SimulationState end = result.getFinalState();

        assertThat(end.getTotalStandardCompleted()).isPositive();
        assertThat(end.getTotalRawMaterialConsumed())
                .isGreaterThanOrEqualTo(2 * end.getTotalStandardCompleted() + end.getTotalCustomCompleted());
    }

    @Test
    void timedActionRunsOnItsDay() {
        Strategy strategy = Strategy.defaults().toBuilder()
                .timedActions(new ArrayList<>(List.of(StrategyAction.buyMachine(60, MachineType.MCE, 1))))
                .build();

        SimulationResult result = engine.runSimulation(strategy, 80, InitialStates.historical());

        assertThat(result.getActionsPerformed())
                .anyMatch(a -> a.getDay() == 60 && a.getMachineType() == MachineType.MCE);
        assertThat(result.getFinalState().getMachineCount(MachineType.MCE)).isEqualTo(2);
    }

    @Test
    void dynamicPoliciesLeaveAnAuditTrail() {
        Strategy strategy = Strategy.defaults().toBuilder().dynamicPolicies(true).build();

        SimulationResult result = engine.runSimulation(strategy, 200, InitialStates.historical());

        assertThat(result.getPolicyChanges()).isNotEmpty();
        assertThat(result.getPolicyChanges()).allMatch(c -> c.getNewValue() != c.getOldValue());
    }

    private static List<Double> values(SimulationResult result, HistoryMetric metric) {
        List<Double> values = new ArrayList<>();
        for (DailyMetric point : result.getHistory().series(metric)) {
            values.add(point.getValue());
        }
        return values;
    }
}
