package com.medica.factory.engine;

import com.medica.factory.domain.FactoryConstants;
import com.medica.factory.domain.RawMaterialOrder;
import com.medica.factory.domain.SimulationState;
import com.medica.factory.domain.Strategy;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Iterator;

@Slf4j
@Component
@RequiredArgsConstructor
public class InventoryModule {

    private final FinanceModule finance;

    @Value
    public static class Consumption {
        int consumed;
        int shortfall;
    }

    public static double orderCost(int quantity) {
        return quantity * FactoryConstants.RAW_MATERIAL_UNIT_COST + FactoryConstants.RAW_MATERIAL_ORDER_FEE;
    }

    /**
     * Places an order unconditionally; an unaffordable order is financed by an automatic loan.
     */
    public RawMaterialOrder placeOrder(SimulationState state, int quantity) {
        double cost = orderCost(quantity);
        finance.processPayment(state, cost, PaymentKind.PLANNED);
        RawMaterialOrder order = RawMaterialOrder.builder()
                .orderDay(state.getCurrentDay())
                .quantity(quantity)
                .arrivalDay(state.getCurrentDay() + FactoryConstants.RAW_MATERIAL_LEAD_TIME)
                .cost(cost)
                .build();
        state.getPendingOrders().add(order);
        return order;
    }

    /**
     * Reorders a full quantity when stock is at or below the reorder point and cash covers the bill.
     * Never places a partial order.
     *
     * @return true if an order was placed
     */
    public boolean checkAndReorder(SimulationState state, Strategy strategy) {
        if (state.getRawMaterialInventory() > strategy.getReorderPoint() || strategy.getOrderQuantity() <= 0) {
            return false;
        }
        if (state.getCash() < orderCost(strategy.getOrderQuantity())) {
            log.debug("Day {}: reorder skipped, cash {} below cost {}", state.getCurrentDay(),
                    Math.round(state.getCash()), orderCost(strategy.getOrderQuantity()));
            return false;
        }
        placeOrder(state, strategy.getOrderQuantity());
        return true;
    }

    public int receiveArrivals(SimulationState state) {
        int received = 0;
        Iterator<RawMaterialOrder> it = state.getPendingOrders().iterator();
        while (it.hasNext()) {
            RawMaterialOrder order = it.next();
            if (order.getArrivalDay() <= state.getCurrentDay()) {
                received += order.getQuantity();
                it.remove();
            }
        }
        state.setRawMaterialInventory(state.getRawMaterialInventory() + received);
        return received;
    }

    /**
     * Draws up to {@code requested} units from stock. Stock never goes negative.
     */
    public Consumption consume(SimulationState state, int requested) {
        int consumed = Math.max(0, Math.min(requested, state.getRawMaterialInventory()));
        state.setRawMaterialInventory(state.getRawMaterialInventory() - consumed);
        state.setTotalRawMaterialConsumed(state.getTotalRawMaterialConsumed() + consumed);
        return new Consumption(consumed, Math.max(0, requested - consumed));
    }
}
