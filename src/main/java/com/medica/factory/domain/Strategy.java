package com.medica.factory.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Full policy for one run: static policy fields plus the timed action schedule.
 * Defaults are resolved once in {@link #defaults()}; variants are derived with {@code toBuilder()}.
 * The engine works on a {@link #copy()} so ADJUST_* actions never leak into the caller's instance.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Strategy {
    // Inventory and production
    private int reorderPoint;
    private int orderQuantity;
    private int standardBatchSize;
    private double mceAllocationCustom;      // 0.0 - 1.0, share of MCE given to custom orders

    // Pricing
    private double standardPrice;
    private double customBasePrice;
    private double customPenaltyPerDay;
    private double customTargetDeliveryDays;

    // Workforce
    private double dailyOvertimeHours;
    private int overtimeTriggerDays;         // consecutive overtime days before quit risk starts
    private double dailyQuitProbability;

    // Demand model
    private double customDemandMean1;
    private double customDemandStdDev1;
    private double customDemandMean2;
    private double customDemandStdDev2;
    private double standardDemandIntercept;
    private double standardDemandSlope;

    // Debt management
    private boolean autoDebtPaydown;
    private double minCashReserveDays;
    private double debtPaydownAggressiveness;
    private int preemptiveWageLoanDays;
    private double maxDebtThreshold;
    private double emergencyLoanBuffer;
    private double maxDebtToAssetRatio;
    private double minInterestCoverageRatio;
    private double maxDebtToRevenueRatio;

    // Recompute EOQ / ROP / EPQ when the plant changes
    private boolean dynamicPolicies;

    @Builder.Default
    private List<StrategyAction> timedActions = new ArrayList<>();
    @Builder.Default
    private List<Rule> rules = new ArrayList<>();

    public static Strategy defaults() {
        return Strategy.builder()
                .reorderPoint(400)
                .orderQuantity(500)
                .standardBatchSize(80)
                .mceAllocationCustom(0.5)
                .standardPrice(225)
                .customBasePrice(110)
                .customPenaltyPerDay(0.27)
                .customTargetDeliveryDays(5)
                .dailyOvertimeHours(0)
                .overtimeTriggerDays(5)
                .dailyQuitProbability(0.10)
                .customDemandMean1(12).customDemandStdDev1(3)
                .customDemandMean2(18).customDemandStdDev2(4.5)
                .standardDemandIntercept(1500)
                .standardDemandSlope(-5.0)
                .autoDebtPaydown(true)
                .minCashReserveDays(5)
                .debtPaydownAggressiveness(0.8)
                .preemptiveWageLoanDays(4)
                .maxDebtThreshold(200000)
                .emergencyLoanBuffer(25000)
                .maxDebtToAssetRatio(0.70)
                .minInterestCoverageRatio(3.0)
                .maxDebtToRevenueRatio(2.0)
                .dynamicPolicies(false)
                .build();
    }

    public Strategy copy() {
        // actions and rules are treated as values; only the containers are copied
        return toBuilder()
                .timedActions(new ArrayList<>(timedActions))
                .rules(new ArrayList<>(rules))
                .build();
    }
}
