package com.medica.factory.optimizer;

import com.medica.factory.domain.FactoryConstants;
import com.medica.factory.domain.MachineType;
import com.medica.factory.domain.ProductLine;
import com.medica.factory.domain.SimulationState;
import com.medica.factory.domain.Strategy;
import com.medica.factory.domain.StrategyAction;
import com.medica.factory.domain.Workforce;
import com.medica.factory.engine.InventoryModule;
import com.medica.factory.engine.WorkforceModule;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Expands {@link PolicyParameters}, or a {@link WeeklyPolicy} with one set per week, into a concrete
 * action schedule by walking the horizon over a rough projection of the plant. The projection only
 * tracks cash, debt, the material position, training and the MCE split; the simulation remains the
 * authority on what really happens.
 * <p>
 * WIP is never moved in the projection, so {@link #adjustAllocation} sees the starting custom and
 * standard queues on every day of the horizon.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PolicyEngine {

    static final double MARKET_STANDARD_PRICE = 225;
    static final int MIN_DAYS_BETWEEN_ORDERS = 5;
    static final int MAX_HIRES_PER_DAY = 5;
    static final double MAX_DEBT_FOR_LOANS = 200000;
    static final double MIN_REPAYMENT = 1000;
    static final double MIN_ALLOCATION = 0.3;
    static final double MAX_ALLOCATION = 0.8;

    private final WorkforceModule workforce;
    private final PhaseBatchPlanner batchPlanner;

    /** Coarse business condition with the multiplier each policy family applies to it. */
    @Getter
    @RequiredArgsConstructor
    public enum Level {
        LOW(0.7, 1.3, 1.1),
        MEDIUM(1.0, 1.0, 1.0),
        HIGH(1.2, 0.7, 0.8);

        private final double cashMultiplier;
        private final double inventoryMultiplier;
        private final double debtMultiplier;

        static Level of(double value, double low, double high) {
            if (value < low) {
                return LOW;
            }
            return value >= high ? HIGH : MEDIUM;
        }

        public static Level cash(double cash) {
            return of(cash, 80000, 200000);
        }

        public static Level inventory(double units) {
            return of(units, 200, 500);
        }

        public static Level debt(double debt) {
            return of(debt, 50000, 150000);
        }
    }

    // ---------------------------------------------------------
    // Parameter adjustment
    // ---------------------------------------------------------

    /** Base parameters adjusted for the cash, inventory and debt levels of {@code state}. */
    public PolicyParameters effectiveParameters(PolicyParameters base, SimulationState state) {
        double cash = Level.cash(state.getCash()).getCashMultiplier();
        double inventory = Level.inventory(state.getRawMaterialInventory()).getInventoryMultiplier();
        double debt = Level.debt(state.getDebt()).getDebtMultiplier();

        return base.toBuilder()
                .reorderPoint((int) Math.round(base.getReorderPoint() * inventory))
                .orderQuantity((int) Math.round(base.getOrderQuantity() * inventory * cash))
                .safetyStock((int) Math.round(base.getSafetyStock() * inventory))
                .mceCustomAllocation(Math.max(0.2, Math.min(0.8, base.getMceCustomAllocation() * cash)))
                .standardBatchSize((int) Math.round(base.getStandardBatchSize() * debt))
                .targetExperts((int) Math.round(base.getTargetExperts() * cash))
                .maxOvertimeHours(base.getMaxOvertimeHours() * cash * debt)
                .cashReserveTarget((int) Math.round(base.getCashReserveTarget() * debt))
                .loanAmount((int) Math.round(base.getLoanAmount() / debt))
                .repayThreshold((int) Math.round(base.getRepayThreshold() * debt))
                .build();
    }

    // ---------------------------------------------------------
    // Action generation
    // ---------------------------------------------------------

    public List<StrategyAction> generateAllActions(PolicyParameters params, SimulationState initialState) {
        return generateAllActions(params, initialState, FactoryConstants.SIMULATION_END_DAY);
    }

    public List<StrategyAction> generateAllActions(PolicyParameters params, SimulationState initialState,
                                                   int endDay) {
        return generateAllActions(WeeklyPolicy.single(params), initialState, endDay, Strategy.defaults());
    }

    /**
     * One pass from the state's day through {@code endDay}; actions come back sorted by day.
     * {@code market} supplies the demand curves used for phase-aware batch sizing.
     */
    public List<StrategyAction> generateAllActions(WeeklyPolicy policy, SimulationState initialState, int endDay,
                                                   Strategy market) {
        Walk walk = new Walk(policy, initialState.copy(), initialState.getCurrentDay(), market);
        List<StrategyAction> actions = new ArrayList<>();
        for (int day = initialState.getCurrentDay(); day <= endDay; day++) {
            walk.projection.setCurrentDay(day);
            List<StrategyAction> todays = walk.plan(day);
            walk.project(todays);
            actions.addAll(todays);
        }
        actions.sort(Comparator.comparingInt(StrategyAction::getDay));
        log.debug("Policy ({} week(s)) expanded into {} actions", policy.weekCount(), actions.size());
        return actions;
    }

    /** MCE share after reacting to queue pressure on both lines. */
    public double adjustAllocation(double allocation, int customWip, int finishedStandard, int standardWip) {
        if (customWip > 300) {
            allocation += 0.05;
        } else if (customWip > 250) {
            allocation += 0.03;
        }
        if (finishedStandard < 50 && standardWip < 100) {
            allocation -= 0.10;
        }
        return Math.max(MIN_ALLOCATION, Math.min(MAX_ALLOCATION, allocation));
    }

    /**
     * Full strategy: static fields from the policy, everything else from {@code base},
     * with the generated schedule as its timed actions.
     */
    public Strategy toStrategy(PolicyParameters params, SimulationState initialState, Strategy base) {
        return toStrategy(WeeklyPolicy.single(params), initialState, base);
    }

    public Strategy toStrategy(PolicyParameters params, SimulationState initialState) {
        return toStrategy(params, initialState, Strategy.defaults());
    }

    /** Static fields come from the first week; later weeks act through the schedule. */
    public Strategy toStrategy(WeeklyPolicy policy, SimulationState initialState, Strategy base) {
        WeeklyPolicy clamped = policy.clamp();
        PolicyParameters p = clamped.representative();
        return base.toBuilder()
                .reorderPoint(p.getReorderPoint())
                .orderQuantity(p.getOrderQuantity())
                .standardBatchSize(p.getStandardBatchSize())
                .mceAllocationCustom(p.getMceCustomAllocation())
                .standardPrice(Math.round(MARKET_STANDARD_PRICE * p.getStandardPriceMultiplier()))
                .customBasePrice(p.getCustomBasePrice())
                .dailyOvertimeHours(overtimeHours(p, initialState))
                .autoDebtPaydown(true)
                .minCashReserveDays(Math.round(p.getCashReserveTarget() / 5000.0))
                .debtPaydownAggressiveness(0.8)
                .preemptiveWageLoanDays(4)
                .emergencyLoanBuffer(p.getCashReserveTarget())
                .timedActions(generateAllActions(clamped, initialState, FactoryConstants.SIMULATION_END_DAY, base))
                .rules(new ArrayList<>(base.getRules()))
                .build();
    }

    public Strategy toStrategy(WeeklyPolicy policy, SimulationState initialState) {
        return toStrategy(policy, initialState, Strategy.defaults());
    }

    /**
     * Overtime is only scheduled when the MCE can feed more ARCP work than the target crew
     * handles within the threshold share of its shift.
     */
    double overtimeHours(PolicyParameters params, SimulationState state) {
        double load = state.getMachineCount(MachineType.MCE) * FactoryConstants.MCE_UNITS_PER_MACHINE;
        double crew = workforce.baseProductivity(Math.max(params.getTargetExperts(), 1), 0);
        return load / crew > params.getOvertimeThreshold() ? params.getMaxOvertimeHours() : 0;
    }

    /** Mutable planner state for one expansion. */
    private final class Walk {
        private final WeeklyPolicy policy;
        private final SimulationState projection;
        private final int startDay;
        private final Strategy market;
        private int lastOrderDay = Integer.MIN_VALUE / 2;
        private int lastBatchDay = Integer.MIN_VALUE / 2;
        private int lastPhase = -1;
        private int lastWeek = -1;
        private double lastStandardPrice = Double.NaN;
        private double allocation;

        private Walk(WeeklyPolicy policy, SimulationState projection, int startDay, Strategy market) {
            this.policy = policy;
            this.projection = projection;
            this.startDay = startDay;
            this.market = market;
            this.allocation = policy.representative().getMceCustomAllocation();
        }

        private List<StrategyAction> plan(int day) {
            List<StrategyAction> actions = new ArrayList<>();
            int week = policy.weekIndex(day, startDay);
            boolean newWeek = week != lastWeek;
            lastWeek = week;
            PolicyParameters effective = effectiveParameters(policy.forDay(day, startDay), projection);

            // Inventory
            if (projection.getRawMaterialInventory() <= effective.getReorderPoint()
                    && day - lastOrderDay >= MIN_DAYS_BETWEEN_ORDERS) {
                actions.add(StrategyAction.orderMaterials(day, effective.getOrderQuantity()));
                lastOrderDay = day;
            }

            // Batching: on the interval, and whenever the demand phase turns
            int phase = batchPlanner.demandPhase(day);
            if (day - lastBatchDay >= effective.getBatchInterval() || phase != lastPhase) {
                actions.add(StrategyAction.adjustBatchSize(day, phaseBatchSize(day, effective)));
                lastBatchDay = day;
                lastPhase = phase;
            }

            // MCE allocation, every day
            actions.add(StrategyAction.adjustMceAllocation(day, adjustAllocation(
                    effective.getMceCustomAllocation(),
                    projection.getCustomWip(),
                    projection.getFinishedStandard(),
                    projection.getStandardLineWip().totalUnits())));

            // Workforce
            Workforce crew = projection.getWorkforce();
            int futureExperts = crew.getExperts() + crew.getRookies();
            if (futureExperts < effective.getTargetExperts() * effective.getHireThreshold()) {
                int hires = (int) Math.ceil(effective.getTargetExperts() - futureExperts);
                if (hires > 0 && hires <= MAX_HIRES_PER_DAY) {
                    actions.add(StrategyAction.hireRookie(day, hires));
                }
            }

            // Financing
            if (projection.getCash() < effective.getCashReserveTarget() && projection.getDebt() < MAX_DEBT_FOR_LOANS) {
                actions.add(StrategyAction.takeLoan(day, effective.getLoanAmount()));
            }
            if (projection.getCash() > effective.getRepayThreshold() && projection.getDebt() > 0) {
                double repay = Math.min(projection.getCash() - effective.getCashReserveTarget(), projection.getDebt());
                if (repay > MIN_REPAYMENT) {
                    actions.add(StrategyAction.payDebt(day, Math.floor(repay)));
                }
            }

            // Pricing: first day, then only when a new week changes it
            if (newWeek) {
                double price = Math.round(MARKET_STANDARD_PRICE * effective.getStandardPriceMultiplier());
                if (day == startDay || price != lastStandardPrice) {
                    actions.add(StrategyAction.adjustPrice(day, ProductLine.STANDARD, price));
                    lastStandardPrice = price;
                }
            }
            return actions;
        }

        /** The policy's batch, scaled by how the demand phase has moved the EPQ since the start. */
        private int phaseBatchSize(int day, PolicyParameters effective) {
            double price = MARKET_STANDARD_PRICE * effective.getStandardPriceMultiplier();
            double scale = batchPlanner.phaseScale(day, startDay, projection.getMachineCount(MachineType.MCE),
                    price, market);
            return Math.max(1, (int) Math.round(effective.getStandardBatchSize() * scale));
        }

        private void project(List<StrategyAction> actions) {
            for (StrategyAction action : actions) {
                switch (action.getType()) {
                    case TAKE_LOAN -> {
                        projection.setCash(projection.getCash() + action.getAmount());
                        projection.setDebt(projection.getDebt() + action.getAmount());
                    }
                    case PAY_DEBT -> {
                        projection.setCash(projection.getCash() - action.getAmount());
                        projection.setDebt(projection.getDebt() - action.getAmount());
                    }
                    case HIRE_ROOKIE -> workforce.hireRookies(projection, action.getCount());
                    case ORDER_MATERIALS -> {
                        // on-order stock counts toward the inventory position
                        projection.setCash(projection.getCash() - InventoryModule.orderCost(action.getCount()));
                        projection.setRawMaterialInventory(projection.getRawMaterialInventory() + action.getCount());
                    }
                    case ADJUST_MCE_ALLOCATION -> allocation = action.getValue();
                    default -> {
                        // no effect on the projected quantities
                    }
                }
            }
            projection.setRawMaterialInventory(Math.max(0,
                    projection.getRawMaterialInventory() - (int) Math.round(dailyMaterialUse())));
            workforce.advanceTraining(projection);
        }

        /** Material the MCE would draw at full load with the current split. */
        private double dailyMaterialUse() {
            double capacity = projection.getMachineCount(MachineType.MCE) * FactoryConstants.MCE_UNITS_PER_MACHINE;
            return capacity * (allocation * FactoryConstants.CUSTOM_MATERIAL_PER_UNIT
                    + (1 - allocation) * FactoryConstants.STANDARD_MATERIAL_PER_UNIT);
        }
    }
}
