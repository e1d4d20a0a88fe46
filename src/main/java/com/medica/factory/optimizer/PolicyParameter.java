package com.medica.factory.optimizer;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Random;

/**
 * Search space of the policy optimizer: bounds, default and kind of each parameter.
 */
@Getter
@RequiredArgsConstructor
public enum PolicyParameter {
    // Inventory
    REORDER_POINT(200, 600, 400, true),
    ORDER_QUANTITY(300, 800, 500, true),
    SAFETY_STOCK(100, 300, 200, true),

    // Allocation
    MCE_CUSTOM_ALLOCATION(0.4, 0.7, 0.55, false),

    // Batching
    STANDARD_BATCH_SIZE(50, 120, 80, true),
    BATCH_INTERVAL(6, 12, 8, true),

    // Workforce
    TARGET_EXPERTS(1, 50, 12, true),
    HIRE_THRESHOLD(0.3, 1.0, 0.8, false),
    MAX_OVERTIME_HOURS(0, 12, 2, false),
    OVERTIME_THRESHOLD(0.5, 1.0, 0.85, false),

    // Financial
    CASH_RESERVE_TARGET(15000, 35000, 25000, true),
    LOAN_AMOUNT(20000, 50000, 30000, true),
    REPAY_THRESHOLD(70000, 120000, 90000, true),

    // Pricing
    STANDARD_PRICE_MULTIPLIER(0.9, 1.1, 1.0, false),
    CUSTOM_BASE_PRICE(105, 115, 110, false);

    private final double min;
    private final double max;
    private final double defaultValue;
    private final boolean integer;

    public double clamp(double value) {
        double clamped = Math.max(min, Math.min(max, value));
        return integer ? Math.round(clamped) : clamped;
    }

    public double span() {
        return max - min;
    }

    /** Uniform draw inside the bounds; integer parameters are floored. */
    public double sample(Random random) {
        double value = min + random.nextDouble() * span();
        return integer ? Math.min(max, Math.floor(value)) : value;
    }
}
