package com.medica.factory.optimizer;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Random;

/**
 * Fifteen business rules of thumb that {@link PolicyEngine} turns into a day-by-day action schedule.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PolicyParameters {
    // Inventory
    private int reorderPoint;
    private int orderQuantity;
    private int safetyStock;

    // Production
    private double mceCustomAllocation;
    private int standardBatchSize;
    private int batchInterval;              // days between batch-size resets

    // Workforce
    private int targetExperts;
    private double hireThreshold;           // hire below this fraction of target
    private double maxOvertimeHours;
    private double overtimeThreshold;       // ARCP load share that justifies overtime

    // Financial
    private int cashReserveTarget;
    private int loanAmount;
    private int repayThreshold;

    // Pricing
    private double standardPriceMultiplier; // vs the 225 market price
    private double customBasePrice;

    public static PolicyParameters defaults() {
        PolicyParameters policy = new PolicyParameters();
        for (PolicyParameter parameter : PolicyParameter.values()) {
            policy.set(parameter, parameter.getDefaultValue());
        }
        return policy;
    }

    public static PolicyParameters random(Random random) {
        PolicyParameters policy = new PolicyParameters();
        for (PolicyParameter parameter : PolicyParameter.values()) {
            policy.set(parameter, parameter.sample(random));
        }
        return policy;
    }

    public double get(PolicyParameter parameter) {
        return switch (parameter) {
            case REORDER_POINT -> reorderPoint;
            case ORDER_QUANTITY -> orderQuantity;
            case SAFETY_STOCK -> safetyStock;
            case MCE_CUSTOM_ALLOCATION -> mceCustomAllocation;
            case STANDARD_BATCH_SIZE -> standardBatchSize;
            case BATCH_INTERVAL -> batchInterval;
            case TARGET_EXPERTS -> targetExperts;
            case HIRE_THRESHOLD -> hireThreshold;
            case MAX_OVERTIME_HOURS -> maxOvertimeHours;
            case OVERTIME_THRESHOLD -> overtimeThreshold;
            case CASH_RESERVE_TARGET -> cashReserveTarget;
            case LOAN_AMOUNT -> loanAmount;
            case REPAY_THRESHOLD -> repayThreshold;
            case STANDARD_PRICE_MULTIPLIER -> standardPriceMultiplier;
            case CUSTOM_BASE_PRICE -> customBasePrice;
        };
    }

    /** Sets a parameter; integer parameters are rounded. No clamping happens here. */
    public void set(PolicyParameter parameter, double value) {
        int rounded = (int) Math.round(value);
        switch (parameter) {
            case REORDER_POINT -> reorderPoint = rounded;
            case ORDER_QUANTITY -> orderQuantity = rounded;
            case SAFETY_STOCK -> safetyStock = rounded;
            case MCE_CUSTOM_ALLOCATION -> mceCustomAllocation = value;
            case STANDARD_BATCH_SIZE -> standardBatchSize = rounded;
            case BATCH_INTERVAL -> batchInterval = rounded;
            case TARGET_EXPERTS -> targetExperts = rounded;
            case HIRE_THRESHOLD -> hireThreshold = value;
            case MAX_OVERTIME_HOURS -> maxOvertimeHours = value;
            case OVERTIME_THRESHOLD -> overtimeThreshold = value;
            case CASH_RESERVE_TARGET -> cashReserveTarget = rounded;
            case LOAN_AMOUNT -> loanAmount = rounded;
            case REPAY_THRESHOLD -> repayThreshold = rounded;
            case STANDARD_PRICE_MULTIPLIER -> standardPriceMultiplier = value;
            case CUSTOM_BASE_PRICE -> customBasePrice = value;
        }
    }

    public PolicyParameters copy() {
        return toBuilder().build();
    }

    public PolicyParameters clamp() {
        PolicyParameters clamped = copy();
        for (PolicyParameter parameter : PolicyParameter.values()) {
            clamped.set(parameter, parameter.clamp(get(parameter)));
        }
        return clamped;
    }

    public double[] toArray() {
        double[] values = new double[PolicyParameter.values().length];
        for (PolicyParameter parameter : PolicyParameter.values()) {
            values[parameter.ordinal()] = get(parameter);
        }
        return values;
    }

    public static PolicyParameters fromArray(double[] values) {
        if (values.length != PolicyParameter.values().length) {
            throw new IllegalArgumentException(
                    "Expected " + PolicyParameter.values().length + " parameters, got " + values.length);
        }
        PolicyParameters policy = new PolicyParameters();
        for (PolicyParameter parameter : PolicyParameter.values()) {
            policy.set(parameter, values[parameter.ordinal()]);
        }
        return policy;
    }
}
