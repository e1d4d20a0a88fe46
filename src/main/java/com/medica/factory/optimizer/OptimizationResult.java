package com.medica.factory.optimizer;

import com.medica.factory.domain.ActionType;
import com.medica.factory.domain.SimulationResult;
import com.medica.factory.domain.Strategy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of any search: the winning strategy with its score, plus how the search got there.
 * Only the representation the algorithm searched over is filled in ({@code bestGenes} or {@code bestPolicy}).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class OptimizationResult {
    private String algorithm;
    private Strategy bestStrategy;
    private double bestFitness;
    private double bestNetWorth;
    private StrategyGenes bestGenes;
    private PolicyParameters bestPolicy;
    private WeeklyPolicy bestWeeklyPolicy;        // weekly searches only; bestPolicy is its first week
    private SimulationResult finalSimulation;
    private int evaluations;
    private long computationTimeMs;
    private boolean converged;

    @Builder.Default
    private List<Double> convergenceHistory = new ArrayList<>();   // best fitness per generation/iteration
    @Builder.Default
    private List<GenerationStats> generationStats = new ArrayList<>();
    @Builder.Default
    private Map<ActionType, Integer> actionSummary = new EnumMap<>(ActionType.class);

    /** Executed actions of {@code result} counted by type. */
    public static Map<ActionType, Integer> summarizeActions(SimulationResult result) {
        Map<ActionType, Integer> summary = new EnumMap<>(ActionType.class);
        if (result != null) {
            result.getActionsPerformed().forEach(a -> summary.merge(a.getType(), 1, Integer::sum));
        }
        return summary;
    }
}
