package com.medica.factory.optimizer;

import com.medica.factory.config.FactoryProperties;
import com.medica.factory.engine.DemandModule;
import com.medica.factory.engine.InitialStates;
import com.medica.factory.engine.SimulationEngine;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MultiRunOptimizerTest {

    private final FactoryProperties properties = new FactoryProperties();
    private final MultiRunOptimizer multiRun = new MultiRunOptimizer(new GeneticAlgorithm(
            SimulationEngine.standalone(42L), new AnalyticalOptimizer(new DemandModule()), new ObjectiveFunction(),
            properties), properties);

    @Test
    void keepsTheBestOfSeveralRuns() {
        MultiRunOptimizer.MultiRunResult result = multiRun.optimize(InitialStates.historical(),
                GeneticAlgorithmTest.smallRun(), 2, ProgressListener.NONE, CancellationToken.none());

        assertThat(result.getRuns()).hasSize(2);
        assertThat(result.getBest()).isSameAs(result.getRuns().get(result.getBestRunIndex()));
        assertThat(result.getBest().getBestFitness()).isEqualTo(result.getFitness().getMax());
        assertThat(result.improvementPercent()).isGreaterThanOrEqualTo(0);
    }

    @Test
    void configurationsAreRankedByMeanFitness() {
        GeneticAlgorithm.GAParams fewMutations = GeneticAlgorithmTest.smallRun();
        fewMutations.mutationRate = 0.01;
        Map<String, GeneticAlgorithm.GAParams> configs = new LinkedHashMap<>();
        configs.put("baseline", GeneticAlgorithmTest.smallRun());
        configs.put("few-mutations", fewMutations);

        List<MultiRunOptimizer.ConfigComparison> ranking =
                multiRun.compareConfigs(InitialStates.historical(), configs, 1);

        assertThat(ranking).hasSize(2);
        assertThat(ranking.get(0).getResult().getFitness().getMean())
                .isGreaterThanOrEqualTo(ranking.get(1).getResult().getFitness().getMean());
    }

    @Test
    void atLeastOneRunIsRequired() {
        assertThatThrownBy(() -> multiRun.optimize(InitialStates.historical(), GeneticAlgorithmTest.smallRun(), 0,
                ProgressListener.NONE, CancellationToken.none()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
