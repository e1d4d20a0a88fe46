package com.medica.factory.engine;

import com.medica.factory.domain.Strategy;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * Market demand. Custom orders follow a four-phase schedule; standard demand is a linear price curve.
 */
@Component
public class DemandModule {

    static final int PHASE_ONE_END = 172;
    static final int TRANSITION_END = 218;
    static final int RUNOFF_START = 400;
    static final int RUNOFF_LENGTH = 100;

    /** 1 = stable, 2 = ramp-up, 3 = peak, 4 = runoff. */
    public int demandPhase(int day) {
        if (day <= PHASE_ONE_END) {
            return 1;
        }
        if (day <= TRANSITION_END) {
            return 2;
        }
        if (day <= RUNOFF_START) {
            return 3;
        }
        return 4;
    }

    public double customDemandMean(int day, Strategy strategy) {
        return switch (demandPhase(day)) {
            case 1 -> strategy.getCustomDemandMean1();
            case 2 -> interpolate(day, strategy.getCustomDemandMean1(), strategy.getCustomDemandMean2());
            case 3 -> strategy.getCustomDemandMean2();
            default -> strategy.getCustomDemandMean2() * runoffFactor(day);
        };
    }

    public double customDemandStdDev(int day, Strategy strategy) {
        return switch (demandPhase(day)) {
            case 1 -> strategy.getCustomDemandStdDev1();
            case 2 -> interpolate(day, strategy.getCustomDemandStdDev1(), strategy.getCustomDemandStdDev2());
            case 3 -> strategy.getCustomDemandStdDev2();
            default -> strategy.getCustomDemandStdDev2() * runoffFactor(day);
        };
    }

    public int sampleCustomOrders(int day, Strategy strategy, Random random) {
        double draw = customDemandMean(day, strategy) + customDemandStdDev(day, strategy) * random.nextGaussian();
        return (int) Math.max(0, Math.round(draw));
    }

    public double standardDemand(double price, Strategy strategy) {
        return Math.max(0, strategy.getStandardDemandIntercept() + strategy.getStandardDemandSlope() * price);
    }

    private double interpolate(int day, double from, double to) {
        double progress = (double) (day - PHASE_ONE_END) / (TRANSITION_END - PHASE_ONE_END);
        return from + (to - from) * progress;
    }

    private double runoffFactor(int day) {
        return Math.max(0, 1 - (double) (day - RUNOFF_START) / RUNOFF_LENGTH);
    }
}
