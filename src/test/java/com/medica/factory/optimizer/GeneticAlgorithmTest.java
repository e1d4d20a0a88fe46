package com.medica.factory.optimizer;

import com.medica.factory.config.FactoryProperties;
import com.medica.factory.domain.SimulationState;
import com.medica.factory.engine.DemandModule;
import com.medica.factory.engine.InitialStates;
import com.medica.factory.engine.SimulationEngine;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GeneticAlgorithmTest {

    private final GeneticAlgorithm ga = new GeneticAlgorithm(SimulationEngine.standalone(42L),
            new AnalyticalOptimizer(new DemandModule()), new ObjectiveFunction(), new FactoryProperties());

    static GeneticAlgorithm.GAParams smallRun() {
        GeneticAlgorithm.GAParams params = new GeneticAlgorithm.GAParams();
        params.populationSize = 6;
        params.generations = 3;
        params.eliteCount = 1;
        params.tournamentSize = 2;
        params.mutationRate = 0.3;
        params.parallelEvaluation = false;
        params.randomSeed = 11L;
        params.endDay = 120;
        return params;
    }

    @Test
    void smallSeededRunProducesAScoredStrategy() {
        List<ProgressEvent> events = new ArrayList<>();

        OptimizationResult result = ga.optimize(InitialStates.historical(), smallRun(), Collections.emptyMap(),
                events::add, CancellationToken.none());

        assertThat(result.getAlgorithm()).isEqualTo("GENETIC");
        assertThat(result.getBestStrategy()).isNotNull();
        assertThat(result.getBestGenes()).isNotNull();
        assertThat(result.getBestFitness()).isFinite();
        assertThat(result.getEvaluations()).isEqualTo(6 * 4);
        assertThat(result.getGenerationStats()).hasSize(4);
        assertThat(result.getConvergenceHistory()).isSortedAccordingTo(Double::compare);
        assertThat(events).hasSize(3);
        assertThat(result.getFinalSimulation().getMetrics().getFinalDay()).isEqualTo(120);
    }

    @Test
    void sameSeedSameAnswer() {
        SimulationState initial = InitialStates.historical();

        OptimizationResult first = ga.optimize(initial, smallRun());
        OptimizationResult second = ga.optimize(initial, smallRun());

        assertThat(second.getBestFitness()).isEqualTo(first.getBestFitness());
        assertThat(second.getBestGenes()).isEqualTo(first.getBestGenes());
    }

    @Test
    void pinnedGenesSurviveEvolution() {
        OptimizationResult result = ga.optimize(InitialStates.historical(), smallRun(),
                Map.of(Gene.MCE_ALLOCATION_CUSTOM, 0.6), ProgressListener.NONE, CancellationToken.none());

        assertThat(result.getBestGenes().getMceAllocationCustom()).isEqualTo(0.6);
    }

    @Test
    void cancellationReturnsBestSoFar() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThatThrownBy(() -> ga.optimize(InitialStates.historical(), smallRun(), Collections.emptyMap(),
                ProgressListener.NONE, token))
                .isInstanceOfSatisfying(OptimizationCancelledException.class, e -> {
                    assertThat(e.getBestSoFar()).isNotNull();
                    assertThat(e.getBestSoFar().getEvaluations()).isEqualTo(6);
                });
    }

    @Test
    void everyEvaluationFailingMeansNoValidStrategy() {
        GeneticAlgorithm broken = new GeneticAlgorithm(SimulationEngine.standalone(42L),
                new AnalyticalOptimizer(new DemandModule()), new ObjectiveFunction(), new FactoryProperties()) {
            @Override
            protected Evaluation evaluate(StrategyGenes genes, SimulationState initialState, GAParams params) {
                throw new IllegalStateException("simulated failure");
            }
        };

        assertThatThrownBy(() -> broken.optimize(InitialStates.historical(), smallRun()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("No valid strategy");
    }

    @Test
    void occasionalFailuresDoNotAbortTheSearch() {
        AtomicInteger calls = new AtomicInteger();
        GeneticAlgorithm flaky = new GeneticAlgorithm(SimulationEngine.standalone(42L),
                new AnalyticalOptimizer(new DemandModule()), new ObjectiveFunction(), new FactoryProperties()) {
            @Override
            protected Evaluation evaluate(StrategyGenes genes, SimulationState initialState, GAParams params) {
                if (calls.incrementAndGet() % 2 == 0) {
                    throw new IllegalStateException("simulated failure");
                }
                return super.evaluate(genes, initialState, params);
            }
        };

        OptimizationResult result = flaky.optimize(InitialStates.historical(), smallRun());

        assertThat(result.getBestFitness()).isFinite();
        assertThat(result.getFinalSimulation()).isNotNull();
        assertThat(result.getGenerationStats()).allSatisfy(s -> assertThat(s.getBestFitness()).isFinite());
    }

    @Test
    void invalidPopulationSettingsAreRejected() {
        GeneticAlgorithm.GAParams tiny = smallRun();
        tiny.populationSize = 1;
        GeneticAlgorithm.GAParams allElite = smallRun();
        allElite.eliteCount = 6;

        assertThatThrownBy(() -> ga.optimize(InitialStates.historical(), tiny))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ga.optimize(InitialStates.historical(), allElite))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
