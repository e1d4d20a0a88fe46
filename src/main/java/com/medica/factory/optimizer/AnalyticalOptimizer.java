package com.medica.factory.optimizer;

import com.medica.factory.domain.FactoryConstants;
import com.medica.factory.domain.MachineType;
import com.medica.factory.domain.ProductLine;
import com.medica.factory.domain.SimulationState;
import com.medica.factory.domain.Strategy;
import com.medica.factory.domain.StrategyAction;
import com.medica.factory.engine.DemandModule;
import com.medica.factory.engine.InventoryFormulas;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Builds complete strategies from closed-form operations research formulas, without search.
 * {@link #generateStrategy} lets {@link StrategyGenes} scale each formula's output.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalyticalOptimizer {

    static final double HOLDING_COST_ANNUAL = FactoryConstants.RAW_MATERIAL_UNIT_COST * 0.000365 * 365;
    static final double FINISHED_HOLDING_COST = 2 * FactoryConstants.RAW_MATERIAL_UNIT_COST * 0.2;
    static final double DEMAND_CV = 0.2;
    static final double SAFETY_Z = 1.96;
    static final double BASELINE_SERVICE_LEVEL = 0.95;
    static final double UNIT_REVENUE = 800;
    static final double UNIT_VARIABLE_COST = 200;
    static final double MIN_STANDARD_PRICE = 200;
    static final double CUSTOM_REFERENCE_PRICE = 106.56;
    static final int LAST_INVESTMENT_DAY = 380;
    static final int INVESTMENT_SPACING_DAYS = 30;
    static final int HIRING_INTERVAL_DAYS = 30;
    static final int SHUTDOWN_BUFFER_DAYS = 30;
    static final double PHASE_TWO_GROWTH = 1.17;
    static final double PHASE_THREE_GROWTH = 1.33;

    private final DemandModule demand;

    /** Daily demand estimate the formulas are fed with. */
    @Value
    @Builder
    public static class DemandForecast {
        double standardUnits;
        double customOrders;
        double customStdDev;
        double materialUnits;     // raw material per day
        double unitsMean;         // all finished units per day
        double unitsStdDev;
    }

    // ---------------------------------------------------------
    // Formulas
    // ---------------------------------------------------------

    public double calculateEOQ(double annualDemand, double orderingCost, double holdingCostPerUnit) {
        return InventoryFormulas.economicOrderQuantity(annualDemand, orderingCost, holdingCostPerUnit);
    }

    public double calculateROP(double dailyDemand, double leadTimeDays, double dailyStdDev, double serviceLevel) {
        return InventoryFormulas.reorderPoint(dailyDemand, leadTimeDays, dailyStdDev, serviceLevel);
    }

    public double calculateEPQ(double annualDemand, double setupCost, double holdingCostPerUnit,
                               double productionRate, double demandRate) {
        return InventoryFormulas.economicProductionQuantity(annualDemand, setupCost, holdingCostPerUnit,
                productionRate, demandRate);
    }

    public double calculateNewsvendorQuantity(double mean, double stdDev, double unitPrice, double unitCost) {
        return InventoryFormulas.newsvendorQuantity(mean, stdDev, unitPrice, unitCost);
    }

    /**
     * Revenue-maximizing price, raised to the market-clearing price when capacity cannot serve
     * the unconstrained demand.
     */
    public double calculateOptimalPrice(double intercept, double slope, double capacity) {
        double price = InventoryFormulas.optimalPrice(intercept, slope);
        double unconstrainedDemand = intercept + slope * price;
        if (capacity > 0 && unconstrainedDemand > capacity) {
            price = (capacity - intercept) / slope;
        }
        return price;
    }

    public DemandForecast forecastDemand(Strategy base, SimulationState state) {
        int day = state.getCurrentDay();
        double standardCapacity = state.getMachineCount(MachineType.MCE) * FactoryConstants.MCE_UNITS_PER_MACHINE
                * (1 - base.getMceAllocationCustom());
        double standard = Math.min(demand.standardDemand(base.getStandardPrice(), base), standardCapacity);
        double custom = demand.customDemandMean(day, base);
        double customStd = demand.customDemandStdDev(day, base);
        double standardStd = DEMAND_CV * standard;
        return DemandForecast.builder()
                .standardUnits(standard)
                .customOrders(custom)
                .customStdDev(customStd)
                .materialUnits(standard * FactoryConstants.STANDARD_MATERIAL_PER_UNIT
                        + custom * FactoryConstants.CUSTOM_MATERIAL_PER_UNIT)
                .unitsMean(standard + custom)
                .unitsStdDev(Math.sqrt(customStd * customStd + standardStd * standardStd))
                .build();
    }

    // ---------------------------------------------------------
    // Baseline
    // ---------------------------------------------------------

    /**
     * Baseline strategy from {@link Strategy#defaults()} with EOQ, ROP, EPQ and pricing worked out
     * for the given plant. Buys nothing and hires nobody.
     */
    public Strategy generateAnalyticalStrategy(SimulationState initialState) {
        Strategy base = Strategy.defaults();
        DemandForecast forecast = forecastDemand(base, initialState);
        double material = forecast.getMaterialUnits();

        int eoq = (int) Math.round(calculateEOQ(material * 365, FactoryConstants.RAW_MATERIAL_ORDER_FEE,
                DEMAND_CV * FactoryConstants.RAW_MATERIAL_UNIT_COST));
        int rop = (int) Math.round(calculateROP(material, FactoryConstants.RAW_MATERIAL_LEAD_TIME,
                0.25 * material, BASELINE_SERVICE_LEVEL));
        double standardCapacity = initialState.getMachineCount(MachineType.MCE) * FactoryConstants.MCE_UNITS_PER_MACHINE
                * (1 - base.getMceAllocationCustom());
        double price = Math.max(MIN_STANDARD_PRICE, calculateOptimalPrice(base.getStandardDemandIntercept(),
                base.getStandardDemandSlope(), standardCapacity));

        int day = initialState.getCurrentDay();
        List<StrategyAction> actions = new ArrayList<>();
        actions.add(StrategyAction.setOrderQuantity(day, eoq));
        actions.add(StrategyAction.setReorderPoint(day, rop));
        actions.add(StrategyAction.adjustPrice(day, ProductLine.STANDARD, Math.round(price)));

        return base.toBuilder()
                .orderQuantity(eoq)
                .reorderPoint(rop)
                .standardBatchSize(batchSize(forecast.getStandardUnits(), standardCapacity, base.getStandardBatchSize()))
                .standardPrice(Math.round(price))
                .timedActions(actions)
                .build();
    }

    // ---------------------------------------------------------
    // Gene expansion
    // ---------------------------------------------------------

    public Strategy generateStrategy(StrategyGenes genes, SimulationState initialState) {
        return generateStrategy(genes, initialState, Strategy.defaults());
    }

    /**
     * Expands genes into a full strategy: inventory policy, machine plan, hiring plan and prices,
     * each scaled by its gene, converted into timed actions on top of {@code base}.
     */
    public Strategy generateStrategy(StrategyGenes genes, SimulationState initialState, Strategy base) {
        StrategyGenes g = genes.clamp();
        Strategy shaped = base.toBuilder().mceAllocationCustom(g.getMceAllocationCustom()).build();
        DemandForecast forecast = forecastDemand(shaped, initialState);
        int startDay = initialState.getCurrentDay();

        // 1. Inventory: EOQ plus safety stock over the lead time
        double material = Math.max(1, forecast.getMaterialUnits());
        int orderQuantity = (int) Math.round(calculateEOQ(material * 365,
                FactoryConstants.RAW_MATERIAL_ORDER_FEE, HOLDING_COST_ANNUAL));
        double safetyStock = SAFETY_Z * DEMAND_CV * material
                * Math.sqrt(FactoryConstants.RAW_MATERIAL_LEAD_TIME) * g.getSafetyStockMultiplier();
        int reorderPoint = (int) Math.round(material * FactoryConstants.RAW_MATERIAL_LEAD_TIME + safetyStock);

        // 2. Capacity: newsvendor target, machines sized from station rates
        double unitTarget = calculateNewsvendorQuantity(forecast.getUnitsMean(), forecast.getUnitsStdDev(),
                UNIT_REVENUE, UNIT_VARIABLE_COST) * g.getTargetCapacityMultiplier();
        double customTarget = calculateNewsvendorQuantity(forecast.getCustomOrders(), forecast.getCustomStdDev(),
                UNIT_REVENUE, UNIT_VARIABLE_COST) * g.getTargetCapacityMultiplier();
        Map<MachineType, Integer> targetMachines = new EnumMap<>(MachineType.class);
        targetMachines.put(MachineType.MCE, Math.max(1,
                (int) Math.ceil(unitTarget / FactoryConstants.MCE_UNITS_PER_MACHINE)));
        targetMachines.put(MachineType.WMA, Math.max(1,
                (int) Math.ceil(2 * customTarget / FactoryConstants.CUSTOM_UNITS_PER_MACHINE)));
        targetMachines.put(MachineType.PUC, Math.max(1,
                (int) Math.ceil(customTarget / FactoryConstants.CUSTOM_UNITS_PER_MACHINE)));

        // 3. Pricing on the capacity the plan will have
        double standardCapacity = targetMachines.get(MachineType.MCE) * FactoryConstants.MCE_UNITS_PER_MACHINE
                * (1 - g.getMceAllocationCustom());
        double standardPrice = Math.max(MIN_STANDARD_PRICE, calculateOptimalPrice(base.getStandardDemandIntercept(),
                base.getStandardDemandSlope(), standardCapacity) * g.getPriceAggressiveness());
        double customBasePrice = CUSTOM_REFERENCE_PRICE * g.getCustomPriceMultiplier();

        List<StrategyAction> actions = new ArrayList<>();
        actions.add(StrategyAction.setOrderQuantity(startDay, orderQuantity));
        actions.add(StrategyAction.setReorderPoint(startDay, reorderPoint));
        addMachineActions(actions, targetMachines, initialState, startDay);
        addHiringActions(actions, unitTarget, g.getWorkforceAggressiveness(), initialState, startDay);
        actions.add(StrategyAction.adjustPrice(startDay, ProductLine.STANDARD, Math.round(standardPrice)));
        actions.sort(Comparator.comparingInt(StrategyAction::getDay));

        return shaped.toBuilder()
                .orderQuantity(orderQuantity)
                .reorderPoint(reorderPoint)
                .standardBatchSize(batchSize(Math.min(forecast.getStandardUnits(), standardCapacity),
                        standardCapacity, base.getStandardBatchSize()))
                .standardPrice(Math.round(standardPrice))
                .customBasePrice(customBasePrice)
                .debtPaydownAggressiveness(g.getDebtPaydownAggressiveness())
                .minCashReserveDays(g.getMinCashReserveDays())
                .timedActions(actions)
                .build();
    }

    private void addMachineActions(List<StrategyAction> actions, Map<MachineType, Integer> target,
                                   SimulationState state, int startDay) {
        target.forEach((type, wanted) -> {
            int delta = wanted - state.getMachineCount(type);
            if (delta > 0) {
                for (int i = 0; i < delta; i++) {
                    int day = startDay + i * INVESTMENT_SPACING_DAYS;
                    if (day < LAST_INVESTMENT_DAY) {
                        actions.add(StrategyAction.buyMachine(day, type, 1));
                    }
                }
            } else if (delta < 0) {
                actions.add(StrategyAction.sellMachine(startDay + INVESTMENT_SPACING_DAYS, type, -delta));
            }
        });
    }

    /**
     * Hires rookies every 30 days so trained headcount keeps up with the ARCP load the
     * demand phases will bring. Stops once trainees would finish too close to shutdown.
     */
    private void addHiringActions(List<StrategyAction> actions, double unitTarget, double aggressiveness,
                                  SimulationState state, int startDay) {
        int staffed = state.getWorkforce().headcount();
        for (int day = startDay; day < LAST_INVESTMENT_DAY; day += HIRING_INTERVAL_DAYS) {
            int readyDay = day + FactoryConstants.ROOKIE_TRAINING_DAYS;
            if (readyDay > FactoryConstants.SIMULATION_END_DAY - SHUTDOWN_BUFFER_DAYS) {
                break;
            }
            double load = unitTarget * growthFactor(readyDay);
            int needed = (int) Math.ceil(load * aggressiveness / FactoryConstants.EXPERT_PRODUCTIVITY);
            int gap = needed - staffed;
            if (gap > 0) {
                actions.add(StrategyAction.hireRookie(day, gap));
                staffed += gap;
            }
        }
    }

    private double growthFactor(int day) {
        return switch (demand.demandPhase(day)) {
            case 1 -> 1.0;
            case 2 -> PHASE_TWO_GROWTH;
            default -> PHASE_THREE_GROWTH;
        };
    }

    /** EPQ batch for the standard line; daily capacity when production cannot outrun demand. */
    private int batchSize(double standardDemand, double standardCapacity, int fallback) {
        if (standardDemand <= 0 || standardCapacity <= 0) {
            return fallback;
        }
        if (standardCapacity <= standardDemand) {
            return Math.max(1, (int) Math.floor(standardCapacity));
        }
        return (int) Math.round(calculateEPQ(standardDemand * 365, FactoryConstants.STANDARD_ORDER_FEE,
                FINISHED_HOLDING_COST, standardCapacity, standardDemand));
    }
}
