package com.medica.factory.engine;

import java.util.Map;
import java.util.TreeMap;

/**
 * Closed-form inventory and production formulas.
 * Invalid parameters mean a broken scenario and fail fast.
 */
public final class InventoryFormulas {

    private static final TreeMap<Double, Double> Z_SCORES = new TreeMap<>(Map.of(
            0.50, 0.0,
            0.75, 0.67,
            0.90, 1.28,
            0.95, 1.65,
            0.975, 1.96,
            0.99, 2.33));

    private InventoryFormulas() {
    }

    /** EOQ = sqrt(2DK / h). */
    public static double economicOrderQuantity(double annualDemand, double orderingCost, double holdingCostPerUnit) {
        if (holdingCostPerUnit <= 0) {
            throw new IllegalArgumentException("holdingCostPerUnit must be positive, was " + holdingCostPerUnit);
        }
        if (annualDemand < 0 || orderingCost < 0) {
            throw new IllegalArgumentException("annualDemand and orderingCost must not be negative");
        }
        return Math.sqrt(2 * annualDemand * orderingCost / holdingCostPerUnit);
    }

    /** ROP = d L + z sqrt(L) sigma. */
    public static double reorderPoint(double dailyDemand, double leadTimeDays, double dailyDemandStdDev, double serviceLevel) {
        if (leadTimeDays < 0) {
            throw new IllegalArgumentException("leadTimeDays must not be negative, was " + leadTimeDays);
        }
        return dailyDemand * leadTimeDays + zScore(serviceLevel) * Math.sqrt(leadTimeDays) * dailyDemandStdDev;
    }

    /** EPQ = sqrt(2DK / (h (1 - d/p))). Requires p greater than d. */
    public static double economicProductionQuantity(double annualDemand, double setupCost, double holdingCostPerUnit,
                                                    double productionRate, double demandRate) {
        if (holdingCostPerUnit <= 0) {
            throw new IllegalArgumentException("holdingCostPerUnit must be positive, was " + holdingCostPerUnit);
        }
        if (productionRate <= demandRate) {
            throw new IllegalArgumentException("productionRate (" + productionRate
                    + ") must exceed demandRate (" + demandRate + ")");
        }
        return Math.sqrt(2 * annualDemand * setupCost / (holdingCostPerUnit * (1 - demandRate / productionRate)));
    }

    /** Order-up-to quantity mean + z sigma for the critical ratio (price - cost) / price. */
    public static double newsvendorQuantity(double mean, double stdDev, double unitPrice, double unitCost) {
        if (unitPrice <= 0 || unitCost < 0 || unitCost >= unitPrice) {
            throw new IllegalArgumentException("unitPrice must exceed a non-negative unitCost");
        }
        double criticalRatio = (unitPrice - unitCost) / unitPrice;
        return mean + zScore(criticalRatio) * stdDev;
    }

    /** Revenue-maximizing price for the curve Q = intercept + slope P (slope negative). */
    public static double optimalPrice(double intercept, double slope) {
        if (slope >= 0) {
            throw new IllegalArgumentException("demand slope must be negative, was " + slope);
        }
        return -intercept / (2 * slope);
    }

    /** Standard normal quantile from the table; the nearest tabulated level at or below is used. */
    public static double zScore(double serviceLevel) {
        if (serviceLevel <= 0 || serviceLevel >= 1) {
            throw new IllegalArgumentException("serviceLevel must be in (0, 1), was " + serviceLevel);
        }
        Map.Entry<Double, Double> entry = Z_SCORES.floorEntry(serviceLevel + 1e-9);
        return entry == null ? 0.0 : entry.getValue();
    }
}
