package com.medica.factory.engine;

import com.medica.factory.domain.CustomOrder;
import com.medica.factory.domain.CustomStation;
import com.medica.factory.domain.FactoryConstants;
import com.medica.factory.domain.InitialScenario;
import com.medica.factory.domain.MachineType;
import com.medica.factory.domain.SimulationState;
import com.medica.factory.domain.StandardLineWip;
import com.medica.factory.domain.WipBatch;
import com.medica.factory.domain.Workforce;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Starting points for a run. Every call builds a fresh state.
 */
public final class InitialStates {

    private InitialStates() {
    }

    public static SimulationState create(InitialScenario scenario) {
        return switch (scenario) {
            case HISTORICAL -> historical();
            case BUSINESS_CASE -> businessCase();
        };
    }

    public static SimulationState historical() {
        SimulationState state = SimulationState.builder()
                .currentDay(FactoryConstants.SIMULATION_START_DAY)
                .cash(383919.70)
                .debt(0)
                .rawMaterialInventory(164)
                .workforce(Workforce.builder().experts(1).build())
                .machines(machines(1, 2, 2))
                .standardLineWip(standardWip(414, 50, 48, 47, 2))
                .build();

        List<CustomOrder> orders = new ArrayList<>();
        for (int i = 0; i < 264; i++) {
            orders.add(order(state, 50 - i / 30, CustomStation.WAITING, 0));
        }
        for (int i = 0; i < 12; i++) {
            orders.add(order(state, 48, CustomStation.WMA_PASS1, 2));
        }
        for (int i = 0; i < 12; i++) {
            orders.add(order(state, 46, CustomStation.PUC, 4));
        }
        for (int i = 0; i < 12; i++) {
            orders.add(order(state, 45, CustomStation.WMA_PASS2, 5));
        }
        state.setCustomOrders(orders);
        state.setTotalRawMaterialConsumed(materialInProcess(state));
        return state;
    }

    public static SimulationState businessCase() {
        SimulationState state = SimulationState.builder()
                .currentDay(FactoryConstants.SIMULATION_START_DAY)
                .cash(8206.12)
                .debt(70000.0)
                .rawMaterialInventory(0)
                .workforce(Workforce.builder().experts(1).build())
                .machines(machines(1, 1, 1))
                .standardLineWip(standardWip(120, 50, 48, 47, 2))
                .build();

        List<CustomOrder> orders = new ArrayList<>();
        for (int i = 0; i < 295; i++) {
            orders.add(order(state, 50 - i / 30, CustomStation.WAITING, 0));
        }
        state.setCustomOrders(orders);
        state.setTotalRawMaterialConsumed(materialInProcess(state));
        return state;
    }

    /**
     * Material already drawn for the work in process: every released standard unit and every
     * custom order past WAITING. Seeding the consumed counter with it keeps completions covered.
     */
    public static long materialInProcess(SimulationState state) {
        long standard = (long) state.getStandardLineWip().totalUnits() * FactoryConstants.STANDARD_MATERIAL_PER_UNIT;
        long custom = state.getCustomOrders().stream()
                .filter(o -> o.getStation() != CustomStation.WAITING && o.getStation() != CustomStation.COMPLETE)
                .count() * FactoryConstants.CUSTOM_MATERIAL_PER_UNIT;
        return standard + custom;
    }

    private static Map<MachineType, Integer> machines(int mce, int wma, int puc) {
        Map<MachineType, Integer> machines = new EnumMap<>(MachineType.class);
        machines.put(MachineType.MCE, mce);
        machines.put(MachineType.WMA, wma);
        machines.put(MachineType.PUC, puc);
        return machines;
    }

    /** Splits units evenly over the MCE, WMA and PUC stages; the remainder goes to PUC. */
    private static StandardLineWip standardWip(int units, int mceStart, int wmaStart, int pucStart, int wmaRemaining) {
        int perStation = units / 3;
        int last = units - 2 * perStation;
        StandardLineWip wip = new StandardLineWip();
        wip.getStation1().add(WipBatch.builder().units(perStation).startDay(mceStart).daysRemaining(0).build());
        wip.getStation2().add(WipBatch.builder().units(perStation).startDay(wmaStart).daysRemaining(wmaRemaining).build());
        wip.getStation3().add(WipBatch.builder().units(last).startDay(pucStart).daysRemaining(0).build());
        return wip;
    }

    private static CustomOrder order(SimulationState state, int startDay, CustomStation station, int daysInProduction) {
        return CustomOrder.builder()
                .orderId(state.nextOrderId())
                .startDay(startDay)
                .station(station)
                .daysAtStation(1)
                .daysInProduction(daysInProduction)
                .build();
    }
}
