package com.medica.factory.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimulationResult {
    private SimulationState finalState;
    private SimulationMetrics metrics;
    private Strategy strategy;                  // strategy as it stood at the end of the run
    private List<StrategyAction> actionsPerformed;
    private List<PolicyChange> policyChanges;

    public SimulationHistory getHistory() {
        return finalState.getHistory();
    }
}
