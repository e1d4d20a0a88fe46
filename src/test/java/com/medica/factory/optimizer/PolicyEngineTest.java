package com.medica.factory.optimizer;

import com.medica.factory.FactoryFixtures;
import com.medica.factory.domain.ActionType;
import com.medica.factory.domain.FactoryConstants;
import com.medica.factory.domain.SimulationState;
import com.medica.factory.domain.Strategy;
import com.medica.factory.domain.StrategyAction;
import com.medica.factory.engine.DemandModule;
import com.medica.factory.engine.InitialStates;
import com.medica.factory.engine.WorkforceModule;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PolicyEngineTest {

    private final PolicyEngine policyEngine = new PolicyEngine(new WorkforceModule(),
            new PhaseBatchPlanner(new DemandModule()));

    @Test
    void allocationReactsToQueuesAndIsClamped() {
        assertThat(policyEngine.adjustAllocation(0.78, 320, 10, 10)).isCloseTo(0.73, within(1e-9));
        assertThat(policyEngine.adjustAllocation(0.78, 320, 100, 200)).isEqualTo(0.8);
        assertThat(policyEngine.adjustAllocation(0.35, 0, 0, 0)).isEqualTo(0.3);
        assertThat(policyEngine.adjustAllocation(0.5, 260, 100, 200)).isCloseTo(0.53, within(1e-9));
    }

    @Test
    void scheduleIsSortedWithOneAllocationPerDay() {
        SimulationState initial = InitialStates.historical();

        List<StrategyAction> actions = policyEngine.generateAllActions(PolicyParameters.defaults(), initial, 120);

        assertThat(actions).isSortedAccordingTo((a, b) -> Integer.compare(a.getDay(), b.getDay()));
        Map<Integer, Long> allocationsPerDay = actions.stream()
                .filter(a -> a.getType() == ActionType.ADJUST_MCE_ALLOCATION)
                .collect(Collectors.groupingBy(StrategyAction::getDay, Collectors.counting()));
        assertThat(allocationsPerDay).hasSize(120 - FactoryConstants.SIMULATION_START_DAY + 1);
        assertThat(allocationsPerDay.values()).containsOnly(1L);
    }

    @Test
    void priceIsSetOnceOnTheFirstDay() {
        List<StrategyAction> actions = policyEngine.generateAllActions(PolicyParameters.defaults(),
                InitialStates.historical(), 150);

        List<StrategyAction> prices = actions.stream().filter(a -> a.getType() == ActionType.ADJUST_PRICE).toList();
        assertThat(prices).hasSize(1);
        assertThat(prices.get(0).getDay()).isEqualTo(FactoryConstants.SIMULATION_START_DAY);
        assertThat(prices.get(0).getValue()).isEqualTo(225);
    }

    @Test
    void materialOrdersRespectMinimumSpacing() {
        List<StrategyAction> orders = policyEngine.generateAllActions(PolicyParameters.defaults(),
                        InitialStates.historical()).stream()
                .filter(a -> a.getType() == ActionType.ORDER_MATERIALS)
                .toList();

        assertThat(orders).isNotEmpty();
        for (int i = 1; i < orders.size(); i++) {
            assertThat(orders.get(i).getDay() - orders.get(i - 1).getDay()).isGreaterThanOrEqualTo(5);
        }
    }

    @Test
    void generationDoesNotTouchTheStartingState() {
        SimulationState initial = InitialStates.businessCase();
        double cash = initial.getCash();

        policyEngine.generateAllActions(PolicyParameters.defaults(), initial, 200);

        assertThat(initial.getCash()).isEqualTo(cash);
        assertThat(initial.getWorkforce().getRookies()).isZero();
    }

    @Test
    void effectiveParametersFollowBusinessLevels() {
        SimulationState state = FactoryFixtures.emptyPlant(1, 1, 1, 1);
        state.setCash(50000);            // low cash
        state.setRawMaterialInventory(300);  // medium inventory
        state.setDebt(0);                // low debt

        PolicyParameters effective = policyEngine.effectiveParameters(PolicyParameters.defaults(), state);

        assertThat(effective.getTargetExperts()).isEqualTo(8);
        assertThat(effective.getStandardBatchSize()).isEqualTo(88);
        assertThat(effective.getReorderPoint()).isEqualTo(400);
        assertThat(effective.getMceCustomAllocation()).isCloseTo(0.385, within(1e-9));
    }

    @Test
    void strategyCarriesStaticPolicyFields() {
        SimulationState initial = InitialStates.historical();
        PolicyParameters policy = PolicyParameters.defaults();

        Strategy strategy = policyEngine.toStrategy(policy, initial);

        assertThat(strategy.getReorderPoint()).isEqualTo(400);
        assertThat(strategy.getMinCashReserveDays()).isEqualTo(5);
        assertThat(strategy.getEmergencyLoanBuffer()).isEqualTo(25000);
        assertThat(strategy.getTimedActions()).isNotEmpty();
        // one MCE feeds 30 units against a 36-unit target crew: below the 0.85 threshold
        assertThat(strategy.getDailyOvertimeHours()).isZero();
    }

    @Test
    void overtimeWhenTheCrewCannotKeepUp() {
        PolicyParameters smallCrew = PolicyParameters.defaults().toBuilder().targetExperts(5).build();

        Strategy strategy = policyEngine.toStrategy(smallCrew, InitialStates.historical());

        assertThat(strategy.getDailyOvertimeHours()).isEqualTo(2);
    }

    @Test
    void batchSizeFollowsTheDemandPhase() {
        List<StrategyAction> batches = policyEngine.generateAllActions(PolicyParameters.defaults(),
                        InitialStates.historical(), 230).stream()
                .filter(a -> a.getType() == ActionType.ADJUST_BATCH_SIZE)
                .toList();

        // no debt yet: 80 x 1.1, phase one unscaled
        assertThat(batches.get(0).getDay()).isEqualTo(FactoryConstants.SIMULATION_START_DAY);
        assertThat(batches.get(0).getValue()).isEqualTo(88.0);
        assertThat(batches).anyMatch(a -> a.getDay() == 173);
        StrategyAction peak = batches.stream().filter(a -> a.getDay() == 219).findFirst().orElseThrow();
        assertThat(peak.getValue()).isLessThan(batches.get(0).getValue());
    }

    @Test
    void weeklyPolicyChangesPriceWhenItsWeekStarts() {
        PolicyParameters dearer = PolicyParameters.defaults().toBuilder().standardPriceMultiplier(1.1).build();
        WeeklyPolicy policy = new WeeklyPolicy(List.of(PolicyParameters.defaults(), dearer));

        List<StrategyAction> prices = policyEngine.generateAllActions(policy, InitialStates.historical(), 120,
                        Strategy.defaults()).stream()
                .filter(a -> a.getType() == ActionType.ADJUST_PRICE)
                .toList();

        assertThat(prices).extracting(StrategyAction::getDay).containsExactly(51, 58);
        assertThat(prices).extracting(StrategyAction::getValue).containsExactly(225.0, 248.0);
    }

    @Test
    void weeklyStrategyTakesStaticFieldsFromTheFirstWeek() {
        PolicyParameters first = PolicyParameters.defaults().toBuilder().reorderPoint(300).build();
        PolicyParameters second = PolicyParameters.defaults().toBuilder().reorderPoint(550).build();

        Strategy strategy = policyEngine.toStrategy(new WeeklyPolicy(List.of(first, second)),
                InitialStates.historical());

        assertThat(strategy.getReorderPoint()).isEqualTo(300);
        assertThat(strategy.getTimedActions()).isNotEmpty();
    }
}
