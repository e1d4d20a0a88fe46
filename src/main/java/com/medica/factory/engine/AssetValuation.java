package com.medica.factory.engine;

import com.medica.factory.domain.MachineType;
import com.medica.factory.domain.SimulationState;

/**
 * Book value of everything the plant owns besides cash.
 */
public final class AssetValuation {

    public static final double RAW_MATERIAL_VALUE = 50;
    public static final double STANDARD_WIP_VALUE = 100;
    public static final double CUSTOM_WIP_VALUE = 50;
    public static final double STANDARD_FINISHED_VALUE = 200;
    public static final double CUSTOM_FINISHED_VALUE = 400;

    private AssetValuation() {
    }

    public static double materials(SimulationState state) {
        return state.getRawMaterialInventory() * RAW_MATERIAL_VALUE;
    }

    public static double workInProcess(SimulationState state) {
        return state.getStandardLineWip().totalUnits() * STANDARD_WIP_VALUE
                + state.getCustomWip() * CUSTOM_WIP_VALUE;
    }

    public static double finishedGoods(SimulationState state) {
        return state.getFinishedStandard() * STANDARD_FINISHED_VALUE
                + state.getFinishedCustom() * CUSTOM_FINISHED_VALUE;
    }

    public static double machines(SimulationState state) {
        double total = 0;
        for (MachineType type : MachineType.values()) {
            total += state.getMachineCount(type) * type.getBookValue();
        }
        return total;
    }

    /** Non-cash assets. */
    public static double total(SimulationState state) {
        return materials(state) + workInProcess(state) + finishedGoods(state) + machines(state);
    }
}
