package com.medica.factory.engine;

import com.medica.factory.domain.SimulationState;
import com.medica.factory.domain.Strategy;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PricingModule {

    private final FinanceModule finance;

    @Value
    public static class DailySales {
        int standardUnits;
        int customUnits;
        double standardPrice;
        double customPrice;
        double revenue;
    }

    /** Linear decay past the target delivery time, floored at half the base price. */
    public double customPrice(Strategy strategy, double averageDeliveryDays) {
        double base = strategy.getCustomBasePrice();
        double lateDays = Math.max(0, averageDeliveryDays - strategy.getCustomTargetDeliveryDays());
        return Math.max(0.5 * base, base - strategy.getCustomPenaltyPerDay() * lateDays);
    }

    /**
     * Sells all finished goods at today's prices. Finished stock is not carried over.
     */
    public DailySales sellFinishedGoods(SimulationState state, Strategy strategy, double averageDeliveryDays) {
        double standardPrice = strategy.getStandardPrice();
        double customPrice = customPrice(strategy, averageDeliveryDays);
        int standardUnits = state.getFinishedStandard();
        int customUnits = state.getFinishedCustom();
        double revenue = standardUnits * standardPrice + customUnits * customPrice;

        finance.receive(state, revenue);
        state.setFinishedStandard(0);
        state.setFinishedCustom(0);
        return new DailySales(standardUnits, customUnits, standardPrice, customPrice, revenue);
    }
}
