package com.medica.factory.optimizer;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Tunable multipliers applied to the analytical baseline, with their bounds.
 */
@Getter
@RequiredArgsConstructor
public enum Gene {
    SAFETY_STOCK_MULTIPLIER(0.8, 1.5, 1.2, false),
    TARGET_CAPACITY_MULTIPLIER(1.0, 1.5, 1.2, false),
    WORKFORCE_AGGRESSIVENESS(0.8, 1.2, 1.0, false),
    PRICE_AGGRESSIVENESS(0.9, 1.1, 1.0, false),
    CUSTOM_PRICE_MULTIPLIER(0.95, 1.05, 1.0, false),
    MCE_ALLOCATION_CUSTOM(0.3, 0.7, 0.5, false),
    DEBT_PAYDOWN_AGGRESSIVENESS(0.5, 1.0, 0.8, false),
    MIN_CASH_RESERVE_DAYS(5, 15, 7, true);

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
}
