package com.medica.factory.engine;

import com.medica.factory.FactoryFixtures;
import com.medica.factory.domain.ActionType;
import com.medica.factory.domain.MachineType;
import com.medica.factory.domain.PolicyTrigger;
import com.medica.factory.domain.ProductLine;
import com.medica.factory.domain.SimulationState;
import com.medica.factory.domain.Strategy;
import com.medica.factory.domain.StrategyAction;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ActionExecutorTest {

    private final FinanceModule finance = new FinanceModule();
    private final ActionExecutor executor = new ActionExecutor(finance, new InventoryModule(finance), new WorkforceModule());

    @Test
    void everyActionTypeHasAHandler() {
        Map<ActionType, StrategyAction> samples = new EnumMap<>(ActionType.class);
        samples.put(ActionType.ORDER_MATERIALS, StrategyAction.orderMaterials(51, 100));
        samples.put(ActionType.ADJUST_BATCH_SIZE, StrategyAction.adjustBatchSize(51, 60));
        samples.put(ActionType.ADJUST_MCE_ALLOCATION, StrategyAction.adjustMceAllocation(51, 0.6));
        samples.put(ActionType.HIRE_ROOKIE, StrategyAction.hireRookie(51, 2));
        samples.put(ActionType.HIRE_EXPERT, StrategyAction.hireExpert(51, 1));
        samples.put(ActionType.TAKE_LOAN, StrategyAction.takeLoan(51, 10000));
        samples.put(ActionType.PAY_DEBT, StrategyAction.payDebt(51, 5000));
        samples.put(ActionType.BUY_MACHINE, StrategyAction.buyMachine(51, MachineType.WMA, 1));
        samples.put(ActionType.SELL_MACHINE, StrategyAction.sellMachine(51, MachineType.PUC, 1));
        samples.put(ActionType.ADJUST_PRICE, StrategyAction.adjustPrice(51, ProductLine.STANDARD, 230));
        samples.put(ActionType.SET_REORDER_POINT, StrategyAction.setReorderPoint(51, 300));
        samples.put(ActionType.SET_ORDER_QUANTITY, StrategyAction.setOrderQuantity(51, 700));
        assertThat(samples.keySet()).containsExactlyInAnyOrder(ActionType.values());

        SimulationState state = FactoryFixtures.emptyPlant(2, 2, 2, 2);
        Strategy strategy = Strategy.defaults();
        for (StrategyAction action : samples.values()) {
            assertThat(executor.execute(state, strategy, action)).as(action.getType().name()).isTrue();
        }

        assertThat(state.getSkippedActions()).isZero();
        assertThat(strategy.getStandardBatchSize()).isEqualTo(60);
        assertThat(strategy.getMceAllocationCustom()).isEqualTo(0.6);
        assertThat(strategy.getStandardPrice()).isEqualTo(230);
        assertThat(strategy.getReorderPoint()).isEqualTo(300);
        assertThat(strategy.getOrderQuantity()).isEqualTo(700);
        assertThat(state.getWorkforce().getRookies()).isEqualTo(2);
        assertThat(state.getWorkforce().getExperts()).isEqualTo(3);
        assertThat(state.getMachineCount(MachineType.WMA)).isEqualTo(3);
        assertThat(state.getMachineCount(MachineType.PUC)).isEqualTo(1);
    }

    @Test
    void plannedLoanCarriesTwoPercentCommission() {
        SimulationState state = FactoryFixtures.emptyPlant(1, 1, 1, 1);

        executor.execute(state, Strategy.defaults(), StrategyAction.takeLoan(51, 10000));

        assertThat(state.getCash()).isEqualTo(210000);
        assertThat(state.getDebt()).isCloseTo(10200, within(1e-6));
    }

    @Test
    void unaffordableMachineIsSkippedAndCounted() {
        SimulationState state = FactoryFixtures.emptyPlant(1, 1, 1, 1);
        state.setCash(10000);

        boolean executed = executor.execute(state, Strategy.defaults(), StrategyAction.buyMachine(51, MachineType.MCE, 1));

        assertThat(executed).isFalse();
        assertThat(state.getMachineCount(MachineType.MCE)).isEqualTo(1);
        assertThat(state.getCash()).isEqualTo(10000);
        assertThat(state.getSkippedActions()).isEqualTo(1);
    }

    @Test
    void sellingIsCappedAtMachinesOwnedAndIsNotRevenue() {
        SimulationState state = FactoryFixtures.emptyPlant(1, 2, 1, 1);

        executor.execute(state, Strategy.defaults(), StrategyAction.sellMachine(51, MachineType.WMA, 5));

        assertThat(state.getMachineCount(MachineType.WMA)).isZero();
        assertThat(state.getCash()).isEqualTo(200000 + 2 * 7500);
        assertThat(state.getTotalRevenue()).isZero();
    }

    @Test
    void customPriceActionTargetsCustomLine() {
        Strategy strategy = Strategy.defaults();

        executor.execute(FactoryFixtures.emptyPlant(1, 1, 1, 1), strategy,
                StrategyAction.adjustPrice(51, ProductLine.CUSTOM, 112));

        assertThat(strategy.getCustomBasePrice()).isEqualTo(112);
        assertThat(strategy.getStandardPrice()).isEqualTo(225);
    }

    @Test
    void allocationIsClampedToUnitInterval() {
        Strategy strategy = Strategy.defaults();

        executor.execute(FactoryFixtures.emptyPlant(1, 1, 1, 1), strategy, StrategyAction.adjustMceAllocation(51, 1.4));

        assertThat(strategy.getMceAllocationCustom()).isEqualTo(1.0);
    }

    @Test
    void machineAndStaffActionsImplyPolicyTriggers() {
        assertThat(ActionExecutor.triggerFor(ActionType.BUY_MACHINE)).contains(PolicyTrigger.MACHINE_PURCHASED);
        assertThat(ActionExecutor.triggerFor(ActionType.HIRE_ROOKIE)).contains(PolicyTrigger.EMPLOYEE_HIRED);
        assertThat(ActionExecutor.triggerFor(ActionType.TAKE_LOAN)).isEmpty();
    }
}
