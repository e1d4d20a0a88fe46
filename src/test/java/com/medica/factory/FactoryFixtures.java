package com.medica.factory;

import com.medica.factory.domain.FactoryConstants;
import com.medica.factory.domain.MachineType;
import com.medica.factory.domain.SimulationState;
import com.medica.factory.domain.Workforce;

/**
 * Small hand-built plants for tests.
 */
public final class FactoryFixtures {

    private FactoryFixtures() {
    }

    /** A plant with machines, staff and stock but nothing in process. */
    public static SimulationState emptyPlant(int mce, int wma, int puc, int experts) {
        SimulationState state = SimulationState.builder()
                .currentDay(FactoryConstants.SIMULATION_START_DAY)
                .cash(200000)
                .rawMaterialInventory(500)
                .workforce(Workforce.builder().experts(experts).build())
                .build();
        state.setMachineCount(MachineType.MCE, mce);
        state.setMachineCount(MachineType.WMA, wma);
        state.setMachineCount(MachineType.PUC, puc);
        return state;
    }
}
