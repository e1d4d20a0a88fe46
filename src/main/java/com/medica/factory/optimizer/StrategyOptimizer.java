package com.medica.factory.optimizer;

import com.medica.factory.domain.SimulationState;

/**
 * A search that treats the simulator as a black box and returns the best strategy it found.
 */
public interface StrategyOptimizer {

    OptimizationResult optimize(SimulationState initialState, ProgressListener listener, CancellationToken token);

    default OptimizationResult optimize(SimulationState initialState) {
        return optimize(initialState, ProgressListener.NONE, CancellationToken.none());
    }
}
