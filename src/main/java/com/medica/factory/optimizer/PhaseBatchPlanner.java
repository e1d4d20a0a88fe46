package com.medica.factory.optimizer;

import com.medica.factory.domain.FactoryConstants;
import com.medica.factory.domain.Strategy;
import com.medica.factory.engine.DemandModule;
import com.medica.factory.engine.InventoryFormulas;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Standard batch sizing per custom demand phase. Custom orders take one MCE slot each,
 * so the standard line's production rate shrinks as custom demand peaks and grows in the runoff.
 * The batch is the EPQ for that rate against the standard demand curve.
 */
@Component
@RequiredArgsConstructor
public class PhaseBatchPlanner {

    static final double FINISHED_HOLDING_COST = 2 * FactoryConstants.RAW_MATERIAL_UNIT_COST * 0.2;

    private final DemandModule demand;

    public int demandPhase(int day) {
        return demand.demandPhase(day);
    }

    /** Standard units per day the MCE has left once the expected custom orders are served. */
    public double standardRate(int day, int mceMachines, Strategy market) {
        double capacity = Math.max(0, mceMachines) * FactoryConstants.MCE_UNITS_PER_MACHINE;
        return Math.max(0, capacity - demand.customDemandMean(day, market));
    }

    /**
     * EPQ batch for {@code day}; a line that cannot outrun demand runs one day's output per batch.
     *
     * @return 0 when the standard line has no capacity or no demand
     */
    public long batchSize(int day, int mceMachines, double standardPrice, Strategy market) {
        double rate = standardRate(day, mceMachines, market);
        double demandRate = demand.standardDemand(standardPrice, market);
        if (rate <= 0 || demandRate <= 0) {
            return 0;
        }
        if (rate <= demandRate) {
            return (long) Math.floor(rate);
        }
        return Math.round(InventoryFormulas.economicProductionQuantity(demandRate * 365,
                FactoryConstants.STANDARD_ORDER_FEE, FINISHED_HOLDING_COST, rate, demandRate));
    }

    /**
     * Ratio of the batch on {@code day} to the batch on {@code referenceDay}; 1 when either is undefined.
     */
    public double phaseScale(int day, int referenceDay, int mceMachines, double standardPrice, Strategy market) {
        long reference = batchSize(referenceDay, mceMachines, standardPrice, market);
        long current = batchSize(day, mceMachines, standardPrice, market);
        if (reference <= 0 || current <= 0) {
            return 1.0;
        }
        return (double) current / reference;
    }
}
