package com.medica.factory.optimizer;

import com.medica.factory.config.FactoryProperties;
import com.medica.factory.domain.SimulationState;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Repeats the genetic search with independent seeds and keeps the best outcome,
 * reporting how much the result depends on the seed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MultiRunOptimizer {

    private final GeneticAlgorithm geneticAlgorithm;
    private final FactoryProperties properties;

    @Value
    @Builder
    public static class MultiRunResult {
        OptimizationResult best;
        int bestRunIndex;
        List<OptimizationResult> runs;
        RunStatistics fitness;

        public double improvementPercent() {
            return fitness.improvementPercent();
        }
    }

    @Value
    public static class ConfigComparison {
        String name;
        MultiRunResult result;
    }

    public MultiRunResult optimize(SimulationState initialState, ProgressListener listener, CancellationToken token) {
        return optimize(initialState, GeneticAlgorithm.GAParams.from(properties),
                properties.getMultiRun().getNumRuns(), listener, token);
    }

    /**
     * Runs {@code numRuns} searches. Run {@code i} uses GA seed {@code base + i}, or an unseeded
     * generator when the base seed is 0. Failed runs are logged and left out.
     *
     * @throws IllegalStateException when no run produced a result
     */
    public MultiRunResult optimize(SimulationState initialState, GeneticAlgorithm.GAParams params, int numRuns,
                                   ProgressListener listener, CancellationToken token) {
        if (numRuns < 1) {
            throw new IllegalArgumentException("numRuns must be positive");
        }
        List<OptimizationResult> runs = new ArrayList<>(numRuns);
        int bestIndex = -1;
        for (int i = 0; i < numRuns; i++) {
            if (token.isCancelled()) {
                log.info("Multi-run cancelled after {} runs", i);
                break;
            }
            GeneticAlgorithm.GAParams runParams = params.copy();
            runParams.randomSeed = params.randomSeed == 0L ? 0L : params.randomSeed + i;
            OptimizationResult run;
            try {
                run = geneticAlgorithm.optimize(initialState, runParams, Map.of(), listener, token);
            } catch (OptimizationCancelledException e) {
                log.info("Run {} cancelled", i + 1);
                run = e.getBestSoFar();
            } catch (RuntimeException e) {
                log.warn("Run {}/{} failed: {}", i + 1, numRuns, e.getMessage());
                continue;
            }
            if (run == null || !Double.isFinite(run.getBestFitness())) {
                continue;
            }
            runs.add(run);
            if (bestIndex < 0 || run.getBestFitness() > runs.get(bestIndex).getBestFitness()) {
                bestIndex = runs.size() - 1;
            }
            log.info("Run {}/{}: fitness {}", i + 1, numRuns, String.format("%.0f", run.getBestFitness()));
        }
        if (runs.isEmpty()) {
            throw new IllegalStateException("No valid strategy: every optimization run failed");
        }

        RunStatistics stats = RunStatistics.of(runs.stream().map(OptimizationResult::getBestFitness).toList());
        log.info("Multi-run summary: mean={}, stdDev={}, min={}, max={}, improvement={}%",
                Math.round(stats.getMean()), Math.round(stats.getStdDev()), Math.round(stats.getMin()),
                Math.round(stats.getMax()), String.format("%.1f", stats.improvementPercent()));
        return MultiRunResult.builder()
                .best(runs.get(bestIndex))
                .bestRunIndex(bestIndex)
                .runs(List.copyOf(runs))
                .fitness(stats)
                .build();
    }

    /** Runs every named configuration and ranks them by mean fitness, best first. */
    public List<ConfigComparison> compareConfigs(SimulationState initialState,
                                                 Map<String, GeneticAlgorithm.GAParams> configs, int runsPerConfig) {
        List<ConfigComparison> ranking = new ArrayList<>();
        configs.forEach((name, params) -> {
            log.info("Evaluating configuration '{}'", name);
            ranking.add(new ConfigComparison(name, optimize(initialState, params, runsPerConfig,
                    ProgressListener.NONE, CancellationToken.none())));
        });
        ranking.sort(Comparator.comparingDouble((ConfigComparison c) -> c.getResult().getFitness().getMean()).reversed());
        return ranking;
    }
}
