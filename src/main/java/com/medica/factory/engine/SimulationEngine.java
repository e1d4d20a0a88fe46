package com.medica.factory.engine;

import com.medica.factory.config.FactoryProperties;
import com.medica.factory.domain.HistoryMetric;
import com.medica.factory.domain.PolicyTrigger;
import com.medica.factory.domain.SimulationHistory;
import com.medica.factory.domain.SimulationMetrics;
import com.medica.factory.domain.SimulationResult;
import com.medica.factory.domain.SimulationState;
import com.medica.factory.domain.Strategy;
import com.medica.factory.domain.StrategyAction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * Runs the plant one day at a time. The engine itself is stateless: every run works on
 * its own copy of the starting state and strategy, so runs may execute in parallel.
 */
@Slf4j
@Component
public class SimulationEngine {

    private final ProductionModule production;
    private final InventoryModule inventory;
    private final FinanceModule finance;
    private final DebtManager debtManager;
    private final PricingModule pricing;
    private final WorkforceModule workforce;
    private final DemandModule demand;
    private final ActionExecutor executor;
    private final long defaultSeed;

    public SimulationEngine(ProductionModule production, InventoryModule inventory, FinanceModule finance,
                            DebtManager debtManager, PricingModule pricing, WorkforceModule workforce,
                            DemandModule demand, ActionExecutor executor, FactoryProperties properties) {
        this.production = production;
        this.inventory = inventory;
        this.finance = finance;
        this.debtManager = debtManager;
        this.pricing = pricing;
        this.workforce = workforce;
        this.demand = demand;
        this.executor = executor;
        this.defaultSeed = properties.getSimulation().getRandomSeed();
    }

    /** Wires an engine without a Spring context. */
    public static SimulationEngine standalone(long seed) {
        FinanceModule finance = new FinanceModule();
        InventoryModule inventory = new InventoryModule(finance);
        WorkforceModule workforce = new WorkforceModule();
        FactoryProperties properties = new FactoryProperties();
        properties.getSimulation().setRandomSeed(seed);
        return new SimulationEngine(
                new ProductionModule(inventory, finance),
                inventory,
                finance,
                new DebtManager(finance, workforce),
                new PricingModule(finance),
                workforce,
                new DemandModule(),
                new ActionExecutor(finance, inventory, workforce),
                properties);
    }

    public long getDefaultSeed() {
        return defaultSeed;
    }

    public DemandModule getDemand() {
        return demand;
    }

    public WorkforceModule getWorkforce() {
        return workforce;
    }

    public SimulationResult runSimulation(Strategy strategy, int endDay, SimulationState initialState) {
        return runSimulation(strategy, endDay, initialState, defaultSeed);
    }

    /**
     * Simulates from the state's current day through {@code endDay} inclusive.
     * Inputs are not modified. Identical inputs and seed give identical results.
     */
    public SimulationResult runSimulation(Strategy strategy, int endDay, SimulationState initialState, long seed) {
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(initialState, "initialState");

        SimulationState state = initialState.copy();
        Strategy active = strategy.copy();
        Random random = new Random(seed);
        RulesEngine rules = new RulesEngine(active.getRules());
        DynamicPolicyCalculator policies = active.isDynamicPolicies()
                ? new DynamicPolicyCalculator(demand, workforce)
                : null;

        if (policies != null) {
            state.getHistory().getPolicyChanges()
                    .addAll(policies.recalculatePolicies(state, active, PolicyTrigger.INITIAL_CALCULATION));
        }

        int firstDay = state.getCurrentDay();
        for (int day = firstDay; day <= endDay; day++) {
            state.setCurrentDay(day);
            simulateDay(state, active, rules, policies, random);
        }

        return SimulationResult.builder()
                .finalState(state)
                .metrics(summarize(state))
                .strategy(active)
                .actionsPerformed(List.copyOf(state.getHistory().getActionsPerformed()))
                .policyChanges(List.copyOf(state.getHistory().getPolicyChanges()))
                .build();
    }

    private void simulateDay(SimulationState state, Strategy strategy, RulesEngine rules,
                             DynamicPolicyCalculator policies, Random random) {
        int day = state.getCurrentDay();
        SimulationHistory history = state.getHistory();
        Set<PolicyTrigger> triggers = new LinkedHashSet<>();

        // 1. Scheduled decisions, then reactive rules
        List<StrategyAction> todays = new ArrayList<>();
        for (StrategyAction action : strategy.getTimedActions()) {
            if (action.getDay() == day) {
                todays.add(action);
            }
        }
        todays.addAll(rules.evaluate(state));
        for (StrategyAction action : todays) {
            if (executor.execute(state, strategy, action)) {
                history.getActionsPerformed().add(action);
                ActionExecutor.triggerFor(action.getType()).ifPresent(triggers::add);
            }
        }

        // 2. Materials and people
        inventory.receiveArrivals(state);
        if (workforce.advanceTraining(state) > 0) {
            triggers.add(PolicyTrigger.EMPLOYEE_PROMOTED);
        }
        if (workforce.applyOvertimeAndQuitRisk(state, strategy, random) > 0) {
            triggers.add(PolicyTrigger.EMPLOYEE_QUIT);
        }

        // 3. Payroll and interest
        double payroll = workforce.dailyPayroll(state.getWorkforce())
                + workforce.overtimeCost(state.getWorkforce(), strategy.getDailyOvertimeHours());
        double costsBefore = state.getTotalCosts();
        finance.processPayment(state, payroll, PaymentKind.WAGE);
        double interest = finance.applyDailyInterest(state);

        // 4. Replenishment and policy upkeep
        inventory.checkAndReorder(state, strategy);
        if (demand.demandPhase(day) != demand.demandPhase(day - 1)) {
            triggers.add(PolicyTrigger.DEMAND_PHASE_CHANGE);
        }
        if (policies != null && !triggers.isEmpty()) {
            history.getPolicyChanges().addAll(
                    policies.recalculatePolicies(state, strategy, triggers.iterator().next()));
        }

        // 5. Production
        int incoming = demand.sampleCustomOrders(day, strategy, random);
        double arcpCapacity = workforce.arcpCapacity(state.getWorkforce(), strategy.getDailyOvertimeHours());
        ProductionModule.ProductionReport report = production.runDay(state, strategy, incoming, arcpCapacity);

        // 6. Sales and finance
        double deliveryDays = report.getCustomCompleted() > 0
                ? report.averageDeliveryDays()
                : state.getAverageDeliveryDays();
        PricingModule.DailySales sales = pricing.sellFinishedGoods(state, strategy, deliveryDays);
        debtManager.manageDebt(state, strategy);

        if (report.getMaterialShortfall() > 0) {
            state.setStockoutDays(state.getStockoutDays() + 1);
            state.setConsecutiveStockoutDays(state.getConsecutiveStockoutDays() + 1);
            state.setMaxConsecutiveStockoutDays(Math.max(state.getMaxConsecutiveStockoutDays(),
                    state.getConsecutiveStockoutDays()));
        } else {
            state.setConsecutiveStockoutDays(0);
        }
        if (report.getRejectedOrders() > 0) {
            state.setCustomWipOverflowDays(state.getCustomWipOverflowDays() + 1);
        }

        // 7. History
        history.record(HistoryMetric.CASH, day, state.getCash());
        history.record(HistoryMetric.DEBT, day, state.getDebt());
        history.record(HistoryMetric.NET_WORTH, day, state.getNetWorth());
        history.record(HistoryMetric.RAW_MATERIAL_INVENTORY, day, state.getRawMaterialInventory());
        history.record(HistoryMetric.STANDARD_WIP, day, state.getStandardLineWip().totalUnits());
        history.record(HistoryMetric.CUSTOM_WIP, day, state.getCustomWip());
        history.record(HistoryMetric.STANDARD_PRODUCTION, day, sales.getStandardUnits());
        history.record(HistoryMetric.CUSTOM_PRODUCTION, day, sales.getCustomUnits());
        history.record(HistoryMetric.STANDARD_PRICE, day, sales.getStandardPrice());
        history.record(HistoryMetric.CUSTOM_PRICE, day, sales.getCustomPrice());
        history.record(HistoryMetric.DAILY_REVENUE, day, sales.getRevenue());
        history.record(HistoryMetric.DAILY_COSTS, day, state.getTotalCosts() - costsBefore);
        history.record(HistoryMetric.INTEREST_PAID, day, interest);
        history.record(HistoryMetric.MCE_UTILIZATION, day, report.mceUtilization());
        history.record(HistoryMetric.CUSTOM_DELIVERY_TIME, day, report.averageDeliveryDays());
        history.record(HistoryMetric.EXPERTS, day, state.getWorkforce().getExperts());
        history.record(HistoryMetric.ROOKIES, day, state.getWorkforce().getRookies());
        history.record(HistoryMetric.REJECTED_ORDERS, day, report.getRejectedOrders());
        history.record(HistoryMetric.STOCKOUT, day, report.getMaterialShortfall() > 0 ? 1 : 0);
    }

    private SimulationMetrics summarize(SimulationState state) {
        SimulationHistory history = state.getHistory();
        int delivered = state.getDeliveredCustomOrders();
        double serviceLevel = delivered == 0 ? 1.0 : 1.0 - (double) state.getLateDeliveries() / delivered;
        return SimulationMetrics.builder()
                .finalDay(state.getCurrentDay())
                .finalCash(state.getCash())
                .finalDebt(state.getDebt())
                .finalNetWorth(state.getNetWorth())
                .totalRevenue(state.getTotalRevenue())
                .totalCosts(state.getTotalCosts())
                .totalInterestPaid(state.getTotalInterestPaid())
                .averageDeliveryDays(state.getAverageDeliveryDays())
                .maxDeliveryDays(state.getMaxDeliveryDays())
                .deliveredCustomOrders(delivered)
                .lateDeliveries(state.getLateDeliveries())
                .serviceLevel(serviceLevel)
                .stockoutDays(state.getStockoutDays())
                .maxConsecutiveStockoutDays(state.getMaxConsecutiveStockoutDays())
                .rejectedCustomOrders(state.getRejectedCustomOrders())
                .customWipOverflowDays(state.getCustomWipOverflowDays())
                .debtThresholdBreachDays(state.getDebtThresholdBreachDays())
                .averageMceUtilization(history.average(HistoryMetric.MCE_UTILIZATION))
                .averageRawInventory(history.average(HistoryMetric.RAW_MATERIAL_INVENTORY))
                .totalStandardProduced(state.getTotalStandardCompleted())
                .totalCustomProduced(state.getTotalCustomCompleted())
                .build();
    }
}
