package com.medica.factory.engine;

import com.medica.factory.FactoryFixtures;
import com.medica.factory.domain.RawMaterialOrder;
import com.medica.factory.domain.SimulationState;
import com.medica.factory.domain.Strategy;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InventoryModuleTest {

    private final InventoryModule inventory = new InventoryModule(new FinanceModule());

    @Test
    void reordersFullQuantityAtReorderPoint() {
        SimulationState state = FactoryFixtures.emptyPlant(1, 1, 1, 1);
        Strategy strategy = Strategy.defaults().toBuilder().reorderPoint(500).orderQuantity(100).build();

        assertThat(inventory.checkAndReorder(state, strategy)).isTrue();

        assertThat(state.getPendingOrders()).hasSize(1);
        RawMaterialOrder order = state.getPendingOrders().get(0);
        assertThat(order.getQuantity()).isEqualTo(100);
        assertThat(order.getArrivalDay()).isEqualTo(state.getCurrentDay() + 4);
        assertThat(state.getCash()).isEqualTo(200000 - 6000);
        assertThat(state.getDebt()).isZero();
    }

    @Test
    void skipsReorderWhenCashDoesNotCoverTheBill() {
        SimulationState state = FactoryFixtures.emptyPlant(1, 1, 1, 1);
        state.setCash(5000);
        Strategy strategy = Strategy.defaults().toBuilder().reorderPoint(500).orderQuantity(100).build();

        assertThat(inventory.checkAndReorder(state, strategy)).isFalse();
        assertThat(state.getPendingOrders()).isEmpty();
        assertThat(state.getCash()).isEqualTo(5000);
    }

    @Test
    void noReorderAboveReorderPoint() {
        SimulationState state = FactoryFixtures.emptyPlant(1, 1, 1, 1);

        assertThat(inventory.checkAndReorder(state, Strategy.defaults())).isFalse();
    }

    @Test
    void ordersArriveAfterLeadTime() {
        SimulationState state = FactoryFixtures.emptyPlant(1, 1, 1, 1);
        inventory.placeOrder(state, 300);

        state.setCurrentDay(state.getCurrentDay() + 3);
        assertThat(inventory.receiveArrivals(state)).isZero();

        state.setCurrentDay(state.getCurrentDay() + 1);
        assertThat(inventory.receiveArrivals(state)).isEqualTo(300);
        assertThat(state.getRawMaterialInventory()).isEqualTo(800);
        assertThat(state.getPendingOrders()).isEmpty();
    }

    @Test
    void consumptionNeverDrivesStockNegative() {
        SimulationState state = FactoryFixtures.emptyPlant(1, 1, 1, 1);
        state.setRawMaterialInventory(40);

        InventoryModule.Consumption consumption = inventory.consume(state, 100);

        assertThat(consumption.getConsumed()).isEqualTo(40);
        assertThat(consumption.getShortfall()).isEqualTo(60);
        assertThat(state.getRawMaterialInventory()).isZero();
        assertThat(state.getTotalRawMaterialConsumed()).isEqualTo(40);
    }
}
