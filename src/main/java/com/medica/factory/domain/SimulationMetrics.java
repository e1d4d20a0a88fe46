package com.medica.factory.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SimulationMetrics {
    private int finalDay;
    private double finalCash;
    private double finalDebt;
    private double finalNetWorth;
    private double totalRevenue;
    private double totalCosts;
    private double totalInterestPaid;
    private double averageDeliveryDays;
    private int maxDeliveryDays;
    private int deliveredCustomOrders;
    private int lateDeliveries;
    private double serviceLevel;             // 1 - late / delivered
    private int stockoutDays;
    private int maxConsecutiveStockoutDays;
    private int rejectedCustomOrders;
    private int customWipOverflowDays;
    private int debtThresholdBreachDays;
    private double averageMceUtilization;
    private double averageRawInventory;
    private long totalStandardProduced;
    private long totalCustomProduced;
}
