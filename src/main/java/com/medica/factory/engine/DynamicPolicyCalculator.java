package com.medica.factory.engine;

import com.medica.factory.domain.FactoryConstants;
import com.medica.factory.domain.MachineType;
import com.medica.factory.domain.PolicyChange;
import com.medica.factory.domain.PolicyTrigger;
import com.medica.factory.domain.SimulationState;
import com.medica.factory.domain.Strategy;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recomputes EOQ, ROP and EPQ when the plant or the market changes, and keeps an audit trail.
 * One instance belongs to one run: it remembers the previous snapshot.
 */
@Slf4j
public class DynamicPolicyCalculator {

    static final double ANNUAL_HOLDING_RATE = 0.2;
    static final double MATERIAL_HOLDING_COST = FactoryConstants.RAW_MATERIAL_UNIT_COST * ANNUAL_HOLDING_RATE;
    static final double FINISHED_HOLDING_COST = 2 * FactoryConstants.RAW_MATERIAL_UNIT_COST * ANNUAL_HOLDING_RATE;
    static final double DEMAND_CHANGE_THRESHOLD = 0.10;
    static final double REORDER_SERVICE_LEVEL = 0.95;
    static final double DEMAND_VARIABILITY = 0.25;
    static final int CONSTRAINED_UTILIZATION_PCT = 90;

    static final int MIN_ORDER_QUANTITY_DELTA = 50;
    static final int MIN_REORDER_POINT_DELTA = 20;
    static final int MIN_BATCH_SIZE_DELTA = 5;

    public enum ChangeType {
        PRODUCTION_RATE,
        WORKFORCE,
        DEMAND,
        DEMAND_PHASE
    }

    @Value
    @Builder
    public static class FormulaSnapshot {
        int day;
        double mceCapacity;
        double wmaCapacity;
        double pucCapacity;
        double arcpCapacity;
        int experts;
        int rookies;
        double standardDemand;       // units per day the standard line can sell and build
        double customDemand;         // orders per day
        double materialDemand;       // raw material units per day
        int demandPhase;
    }

    @Value
    @Builder
    public static class BottleneckAnalysis {
        String station;
        double capacity;
        double demand;
        double utilization;
        boolean constrained;
        Map<String, Double> stationCapacities;
    }

    private final DemandModule demand;
    private final WorkforceModule workforce;
    private final List<PolicyChange> auditLog = new ArrayList<>();
    private FormulaSnapshot previous;

    public DynamicPolicyCalculator(DemandModule demand, WorkforceModule workforce) {
        this.demand = demand;
        this.workforce = workforce;
    }

    public FormulaSnapshot captureSnapshot(SimulationState state, Strategy strategy) {
        int day = state.getCurrentDay();
        double mce = state.getMachineCount(MachineType.MCE) * FactoryConstants.MCE_UNITS_PER_MACHINE;
        double standardCapacity = Math.floor(mce * (1 - strategy.getMceAllocationCustom()) + 1e-9);
        double standardDemand = Math.min(demand.standardDemand(strategy.getStandardPrice(), strategy), standardCapacity);
        double customDemand = demand.customDemandMean(day, strategy);
        return FormulaSnapshot.builder()
                .day(day)
                .mceCapacity(mce)
                .wmaCapacity(state.getMachineCount(MachineType.WMA) * FactoryConstants.CUSTOM_UNITS_PER_MACHINE)
                .pucCapacity(state.getMachineCount(MachineType.PUC) * FactoryConstants.CUSTOM_UNITS_PER_MACHINE)
                .arcpCapacity(workforce.arcpCapacity(state.getWorkforce(), strategy.getDailyOvertimeHours()))
                .experts(state.getWorkforce().getExperts())
                .rookies(state.getWorkforce().getRookies())
                .standardDemand(standardDemand)
                .customDemand(customDemand)
                .materialDemand(standardDemand * FactoryConstants.STANDARD_MATERIAL_PER_UNIT
                        + customDemand * FactoryConstants.CUSTOM_MATERIAL_PER_UNIT)
                .demandPhase(demand.demandPhase(day))
                .build();
    }

    public Set<ChangeType> detectChanges(FormulaSnapshot before, FormulaSnapshot now) {
        if (before == null) {
            return EnumSet.allOf(ChangeType.class);
        }
        Set<ChangeType> changes = EnumSet.noneOf(ChangeType.class);
        if (before.getMceCapacity() != now.getMceCapacity() || before.getArcpCapacity() != now.getArcpCapacity()) {
            changes.add(ChangeType.PRODUCTION_RATE);
        }
        if (before.getExperts() != now.getExperts() || before.getRookies() != now.getRookies()) {
            changes.add(ChangeType.WORKFORCE);
        }
        if (before.getDemandPhase() != now.getDemandPhase()) {
            changes.add(ChangeType.DEMAND_PHASE);
        }
        double base = Math.max(1e-9, before.getMaterialDemand());
        if (Math.abs(now.getMaterialDemand() - before.getMaterialDemand()) / base > DEMAND_CHANGE_THRESHOLD) {
            changes.add(ChangeType.DEMAND);
        }
        return changes;
    }

    /**
     * Recomputes the affected policies and writes them into {@code strategy} when the change is
     * larger than the per-field minimum delta.
     *
     * @return changes applied on this call
     */
    public List<PolicyChange> recalculatePolicies(SimulationState state, Strategy strategy, PolicyTrigger trigger) {
        FormulaSnapshot now = captureSnapshot(state, strategy);
        Set<ChangeType> changes = (trigger == PolicyTrigger.INITIAL_CALCULATION || trigger == PolicyTrigger.MANUAL_RECALC)
                ? EnumSet.allOf(ChangeType.class)
                : detectChanges(previous, now);
        previous = now;

        List<PolicyChange> applied = new ArrayList<>();
        if (changes.isEmpty()) {
            return applied;
        }

        boolean demandMoved = changes.contains(ChangeType.DEMAND) || changes.contains(ChangeType.DEMAND_PHASE);
        if (demandMoved && now.getMaterialDemand() > 0) {
            double eoq = InventoryFormulas.economicOrderQuantity(now.getMaterialDemand() * 365,
                    FactoryConstants.RAW_MATERIAL_ORDER_FEE, MATERIAL_HOLDING_COST);
            apply(state, strategy, "orderQuantity", strategy.getOrderQuantity(), Math.round(eoq),
                    MIN_ORDER_QUANTITY_DELTA, "EOQ for " + changes, now, trigger, applied);

            double rop = InventoryFormulas.reorderPoint(now.getMaterialDemand(), FactoryConstants.RAW_MATERIAL_LEAD_TIME,
                    DEMAND_VARIABILITY * now.getMaterialDemand(), REORDER_SERVICE_LEVEL);
            apply(state, strategy, "reorderPoint", strategy.getReorderPoint(), Math.round(rop),
                    MIN_REORDER_POINT_DELTA, "ROP for " + changes, now, trigger, applied);
        }

        if (!Collections.disjoint(changes, EnumSet.of(ChangeType.PRODUCTION_RATE, ChangeType.DEMAND,
                ChangeType.WORKFORCE, ChangeType.DEMAND_PHASE)) && now.getStandardDemand() > 0) {
            double productionRate = Math.floor(now.getMceCapacity() * (1 - strategy.getMceAllocationCustom()) + 1e-9);
            double demandRate = now.getStandardDemand();
            long batch;
            if (productionRate <= demandRate) {
                // no idle time to build stock; run in daily batches
                batch = (long) Math.floor(productionRate);
            } else {
                batch = Math.round(InventoryFormulas.economicProductionQuantity(demandRate * 365,
                        FactoryConstants.STANDARD_ORDER_FEE, FINISHED_HOLDING_COST, productionRate, demandRate));
            }
            if (batch > 0) {
                apply(state, strategy, "standardBatchSize", strategy.getStandardBatchSize(), batch,
                        MIN_BATCH_SIZE_DELTA, "EPQ for " + changes, now, trigger, applied);
            }
        }
        return applied;
    }

    private void apply(SimulationState state, Strategy strategy, String policy, long oldValue, long newValue,
                       int minDelta, String reason, FormulaSnapshot inputs, PolicyTrigger trigger,
                       List<PolicyChange> applied) {
        if (Math.abs(newValue - oldValue) <= minDelta) {
            return;
        }
        switch (policy) {
            case "orderQuantity" -> strategy.setOrderQuantity((int) newValue);
            case "reorderPoint" -> strategy.setReorderPoint((int) newValue);
            case "standardBatchSize" -> strategy.setStandardBatchSize((int) newValue);
            default -> throw new IllegalArgumentException("Unknown policy " + policy);
        }
        PolicyChange change = PolicyChange.builder()
                .day(state.getCurrentDay())
                .policyName(policy)
                .oldValue(oldValue)
                .newValue(newValue)
                .reason(reason)
                .formulaInputs(inputsOf(inputs))
                .trigger(trigger)
                .build();
        auditLog.add(change);
        applied.add(change);
        log.debug("Day {}: {} {} -> {} ({})", state.getCurrentDay(), policy, oldValue, newValue, trigger);
    }

    private Map<String, Double> inputsOf(FormulaSnapshot snapshot) {
        Map<String, Double> inputs = new LinkedHashMap<>();
        inputs.put("mceCapacity", snapshot.getMceCapacity());
        inputs.put("arcpCapacity", snapshot.getArcpCapacity());
        inputs.put("experts", (double) snapshot.getExperts());
        inputs.put("rookies", (double) snapshot.getRookies());
        inputs.put("standardDemand", snapshot.getStandardDemand());
        inputs.put("customDemand", snapshot.getCustomDemand());
        inputs.put("materialDemand", snapshot.getMaterialDemand());
        inputs.put("demandPhase", (double) snapshot.getDemandPhase());
        return Collections.unmodifiableMap(inputs);
    }

    /**
     * Per-station daily capacity against estimated daily load; the smallest capacity is the constraint.
     * Pure function of its arguments.
     */
    public BottleneckAnalysis identifyBottleneck(SimulationState state, Strategy strategy) {
        int day = state.getCurrentDay();
        double standardLoad = demand.standardDemand(strategy.getStandardPrice(), strategy);
        double customLoad = demand.customDemandMean(day, strategy);
        double load = standardLoad + customLoad;

        Map<String, Double> capacities = new LinkedHashMap<>();
        capacities.put("MCE", (double) state.getMachineCount(MachineType.MCE) * FactoryConstants.MCE_UNITS_PER_MACHINE);
        capacities.put("WMA", (double) state.getMachineCount(MachineType.WMA) * FactoryConstants.CUSTOM_UNITS_PER_MACHINE);
        capacities.put("PUC", (double) state.getMachineCount(MachineType.PUC) * FactoryConstants.CUSTOM_UNITS_PER_MACHINE);
        capacities.put("ARCP", workforce.arcpCapacity(state.getWorkforce(), strategy.getDailyOvertimeHours()));

        Map.Entry<String, Double> min = capacities.entrySet().stream()
                .min(Map.Entry.comparingByValue())
                .orElseThrow();
        double capacity = min.getValue();
        double utilization = capacity <= 0 ? Double.POSITIVE_INFINITY : load / capacity;
        return BottleneckAnalysis.builder()
                .station(min.getKey())
                .capacity(capacity)
                .demand(load)
                .utilization(utilization)
                .constrained(load * 100 > capacity * CONSTRAINED_UTILIZATION_PCT)
                .stationCapacities(Collections.unmodifiableMap(capacities))
                .build();
    }

    public List<PolicyChange> getAuditLog() {
        return Collections.unmodifiableList(auditLog);
    }
}
