package com.medica.factory.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Mutable state of one simulation run. Never share an instance between runs;
 * use {@link #copy()} to hand a starting point to another evaluation.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SimulationState {
    private int currentDay;
    private double cash;
    private double debt;
    private int rawMaterialInventory;

    @Builder.Default
    private StandardLineWip standardLineWip = new StandardLineWip();
    @Builder.Default
    private List<CustomOrder> customOrders = new ArrayList<>();
    private int finishedStandard;
    private int finishedCustom;

    @Builder.Default
    private Workforce workforce = new Workforce();
    @Builder.Default
    private Map<MachineType, Integer> machines = new EnumMap<>(MachineType.class);
    @Builder.Default
    private List<RawMaterialOrder> pendingOrders = new ArrayList<>();

    // Counters
    private int rejectedCustomOrders;
    private int stockoutDays;
    private int consecutiveStockoutDays;
    private int maxConsecutiveStockoutDays;
    private int customWipOverflowDays;
    private int debtThresholdBreachDays;
    private int skippedActions;
    private int deliveredCustomOrders;
    private int lateDeliveries;
    private long totalDeliveryDays;
    private int maxDeliveryDays;
    private int nextOrderSequence;

    // Cumulative flows
    private long totalRawMaterialConsumed;
    private long totalStandardCompleted;
    private long totalCustomCompleted;
    private double totalRevenue;
    private double totalCosts;
    private double totalInterestPaid;

    @Builder.Default
    private SimulationHistory history = new SimulationHistory();

    public int getMachineCount(MachineType type) {
        return machines.getOrDefault(type, 0);
    }

    public void setMachineCount(MachineType type, int count) {
        machines.put(type, count);
    }

    public double getNetWorth() {
        return cash - debt;
    }

    public int getCustomWip() {
        return customOrders.size();
    }

    public String nextOrderId() {
        nextOrderSequence++;
        return "C-" + nextOrderSequence;
    }

    public double getAverageDeliveryDays() {
        return deliveredCustomOrders == 0 ? 0 : (double) totalDeliveryDays / deliveredCustomOrders;
    }

    /**
     * Deep copy. The copy shares no mutable structure with this state.
     */
    public SimulationState copy() {
        return toBuilder()
                .standardLineWip(standardLineWip.copy())
                .customOrders(customOrders.stream().map(CustomOrder::copy)
                        .collect(Collectors.toCollection(ArrayList::new)))
                .workforce(workforce.copy())
                .machines(new EnumMap<>(machines.isEmpty() ? new EnumMap<>(MachineType.class) : machines))
                .pendingOrders(pendingOrders.stream().map(RawMaterialOrder::copy)
                        .collect(Collectors.toCollection(ArrayList::new)))
                .history(history.copy())
                .build();
    }
}
