package com.medica.factory.optimizer;

import com.medica.factory.domain.FactoryConstants;
import com.medica.factory.domain.MachineType;
import com.medica.factory.domain.SimulationMetrics;
import com.medica.factory.domain.SimulationResult;
import com.medica.factory.domain.SimulationState;
import com.medica.factory.engine.AssetValuation;
import lombok.Builder;
import lombok.Value;
import org.springframework.stereotype.Component;

/**
 * Scores a finished run: terminal wealth plus small throughput and service bonuses,
 * minus penalties large enough to rule out catastrophic strategies.
 */
@Component
public class ObjectiveFunction {

    static final double REVENUE_WEIGHT = 0.01;
    static final double SERVICE_BONUS = 50000;
    static final int SHUTDOWN_WINDOW_DAYS = 30;
    static final double UNSOLD_ASSET_SHARE = 0.5;

    static final double ZERO_MCE_PENALTY = 1_000_000;
    static final double BANKRUPTCY_CASH = -50000;
    static final double BANKRUPTCY_PENALTY = 500_000;
    static final double OVERFLOW_DAY_PENALTY = 100_000;
    static final double LATE_DELIVERY_PENALTY = 10_000;
    static final double STOCKOUT_DAY_PENALTY = 1_000;

    @Value
    @Builder
    public static class ObjectiveBreakdown {
        double terminalWealth;
        double revenueBonus;
        double serviceLevel;
        double serviceBonus;
        double assetPenalty;
        double zeroMachinesPenalty;
        double bankruptcyPenalty;
        double queueOverflowPenalty;
        double lateDeliveryPenalty;
        double stockoutPenalty;
        double score;

        public double totalViolations() {
            return zeroMachinesPenalty + bankruptcyPenalty + queueOverflowPenalty
                    + lateDeliveryPenalty + stockoutPenalty;
        }
    }

    public ObjectiveBreakdown evaluate(SimulationResult result) {
        SimulationState state = result.getFinalState();
        SimulationMetrics metrics = result.getMetrics();

        double wealth = state.getCash() - state.getDebt();
        double revenueBonus = REVENUE_WEIGHT * metrics.getTotalRevenue();
        double serviceLevel = Math.max(0, metrics.getServiceLevel());
        double serviceBonus = SERVICE_BONUS * serviceLevel;

        // assets still on the books close to shutdown will not be turned into cash
        int daysFromShutdown = Math.max(0, FactoryConstants.SIMULATION_END_DAY - state.getCurrentDay());
        double assetPenalty = daysFromShutdown < SHUTDOWN_WINDOW_DAYS
                ? AssetValuation.total(state) * UNSOLD_ASSET_SHARE
                : 0;

        double zeroMachines = state.getMachineCount(MachineType.MCE) < 1 ? ZERO_MCE_PENALTY : 0;
        double bankruptcy = state.getCash() < BANKRUPTCY_CASH ? BANKRUPTCY_PENALTY : 0;
        double overflow = metrics.getCustomWipOverflowDays() * OVERFLOW_DAY_PENALTY;
        double late = metrics.getLateDeliveries() * LATE_DELIVERY_PENALTY;
        double stockouts = metrics.getStockoutDays() * STOCKOUT_DAY_PENALTY;

        double score = wealth + revenueBonus + serviceBonus - assetPenalty
                - (zeroMachines + bankruptcy + overflow + late + stockouts);

        return ObjectiveBreakdown.builder()
                .terminalWealth(wealth)
                .revenueBonus(revenueBonus)
                .serviceLevel(serviceLevel)
                .serviceBonus(serviceBonus)
                .assetPenalty(assetPenalty)
                .zeroMachinesPenalty(zeroMachines)
                .bankruptcyPenalty(bankruptcy)
                .queueOverflowPenalty(overflow)
                .lateDeliveryPenalty(late)
                .stockoutPenalty(stockouts)
                .score(score)
                .build();
    }

    public double calculateFitness(SimulationResult result) {
        return evaluate(result).getScore();
    }
}
