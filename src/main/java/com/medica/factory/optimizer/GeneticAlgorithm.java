package com.medica.factory.optimizer;

import com.medica.factory.config.FactoryProperties;
import com.medica.factory.domain.SimulationResult;
import com.medica.factory.domain.SimulationState;
import com.medica.factory.domain.Strategy;
import com.medica.factory.engine.SimulationEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Genetic search over {@link StrategyGenes}:
 * - genome = 8 gene values, expanded to a strategy by {@link AnalyticalOptimizer}
 * - fitness = {@link ObjectiveFunction} score of a full simulation run
 * - selection = tournament
 * - crossover = uniform, per gene
 * - mutation = bounded relative step per gene
 * - elitism = best {@code eliteCount} genomes survive unchanged
 */
@Slf4j
@Component
public class GeneticAlgorithm implements StrategyOptimizer {

    public static class GAParams {
        public int populationSize = 100;
        public int generations = 500;
        public double crossoverRate = 0.7;
        public double mutationRate = 0.05;     // per gene
        public int tournamentSize = 3;
        public int eliteCount = 20;
        public double convergenceThreshold = 0.001;
        public int convergenceWindow = 50;
        public boolean parallelEvaluation = true;
        public long randomSeed = 0L;           // 0 = ThreadLocalRandom
        public long simulationSeed = 42L;      // demand draws, shared by every evaluation of one run
        public int endDay = 415;

        public static GAParams from(FactoryProperties properties) {
            FactoryProperties.Genetic genetic = properties.getGenetic();
            GAParams params = new GAParams();
            params.populationSize = genetic.getPopulationSize();
            params.generations = genetic.getGenerations();
            params.crossoverRate = genetic.getCrossoverRate();
            params.mutationRate = genetic.getMutationRate();
            params.tournamentSize = genetic.getTournamentSize();
            params.eliteCount = genetic.getEliteCount();
            params.convergenceThreshold = genetic.getConvergenceThreshold();
            params.convergenceWindow = genetic.getConvergenceWindow();
            params.parallelEvaluation = genetic.isParallelEvaluation();
            params.randomSeed = genetic.getRandomSeed();
            params.simulationSeed = properties.getSimulation().getRandomSeed();
            params.endDay = properties.getSimulation().getEndDay();
            return params;
        }

        public GAParams copy() {
            GAParams c = new GAParams();
            c.populationSize = populationSize;
            c.generations = generations;
            c.crossoverRate = crossoverRate;
            c.mutationRate = mutationRate;
            c.tournamentSize = tournamentSize;
            c.eliteCount = eliteCount;
            c.convergenceThreshold = convergenceThreshold;
            c.convergenceWindow = convergenceWindow;
            c.parallelEvaluation = parallelEvaluation;
            c.randomSeed = randomSeed;
            c.simulationSeed = simulationSeed;
            c.endDay = endDay;
            return c;
        }
    }

    private final SimulationEngine engine;
    private final AnalyticalOptimizer analytical;
    private final ObjectiveFunction objective;
    private final FactoryProperties properties;

    public GeneticAlgorithm(SimulationEngine engine, AnalyticalOptimizer analytical, ObjectiveFunction objective,
                            FactoryProperties properties) {
        this.engine = Objects.requireNonNull(engine);
        this.analytical = Objects.requireNonNull(analytical);
        this.objective = Objects.requireNonNull(objective);
        this.properties = Objects.requireNonNull(properties);
    }

    @Override
    public OptimizationResult optimize(SimulationState initialState, ProgressListener listener, CancellationToken token) {
        return optimize(initialState, GAParams.from(properties), Collections.emptyMap(), listener, token);
    }

    public OptimizationResult optimize(SimulationState initialState, GAParams params) {
        return optimize(initialState, params, Collections.emptyMap(), ProgressListener.NONE, CancellationToken.none());
    }

    /**
     * Evolves gene vectors; genes listed in {@code overrides} are pinned in every genome.
     *
     * @throws OptimizationCancelledException when {@code token} is cancelled between generations
     * @throws IllegalStateException when no genome could be evaluated
     */
    public OptimizationResult optimize(SimulationState initialState, GAParams params, Map<Gene, Double> overrides,
                                       ProgressListener listener, CancellationToken token) {
        Objects.requireNonNull(initialState, "initialState");
        Objects.requireNonNull(params, "params");
        if (params.populationSize < 2) {
            throw new IllegalArgumentException("Population size must be at least 2");
        }
        if (params.eliteCount >= params.populationSize) {
            throw new IllegalArgumentException("Elite count must be smaller than the population");
        }

        long started = System.currentTimeMillis();
        Run run = new Run(params, initialState);
        log.info("GA start: population={}, generations={}, seed={}", params.populationSize, params.generations,
                params.randomSeed);

        // Initial population, seeded with the default genes
        List<Genome> population = new ArrayList<>(params.populationSize);
        population.add(new Genome(StrategyGenes.defaults().withOverrides(overrides)));
        while (population.size() < params.populationSize) {
            population.add(new Genome(StrategyGenes.random(run.random()).withOverrides(overrides)));
        }
        run.evaluatePopulation(population);
        population.sort(BY_FITNESS);
        Genome globalBest = population.get(population.size() - 1).copy();
        run.record(0, population, globalBest);

        int noImprove = 0;
        boolean converged = false;
        for (int gen = 1; gen <= params.generations; gen++) {
            if (token.isCancelled()) {
                log.info("GA cancelled at generation {}", gen);
                throw new OptimizationCancelledException("Genetic search cancelled at generation " + gen,
                        run.result(globalBest, false, started));
            }

            List<Genome> next = new ArrayList<>(params.populationSize);

            int elites = Math.min(params.eliteCount, population.size());
            for (int i = population.size() - elites; i < population.size(); i++) {
                next.add(population.get(i).copy());
            }

            while (next.size() < params.populationSize) {
                Genome p1 = run.tournamentSelect(population);
                Genome p2 = run.tournamentSelect(population);

                StrategyGenes c1 = p1.genes;
                StrategyGenes c2 = p2.genes;
                if (run.random().nextDouble() < params.crossoverRate) {
                    c1 = p1.genes.crossover(p2.genes, run.random());
                    c2 = p2.genes.crossover(p1.genes, run.random());
                }
                next.add(new Genome(c1.mutate(params.mutationRate, run.random()).withOverrides(overrides)));
                if (next.size() < params.populationSize) {
                    next.add(new Genome(c2.mutate(params.mutationRate, run.random()).withOverrides(overrides)));
                }
            }

            run.evaluatePopulation(next);
            next.sort(BY_FITNESS);

            Genome best = next.get(next.size() - 1);
            if (best.fitness > globalBest.fitness) {
                globalBest = best.copy();
                noImprove = 0;
            } else {
                noImprove++;
            }
            population = next;
            run.record(gen, population, globalBest);
            listener.onProgress(new ProgressEvent(gen, params.generations, "generation", globalBest.fitness));

            if (run.hasConverged(params)) {
                log.info("GA converged at generation {} ({} generations without improvement)", gen, noImprove);
                converged = true;
                break;
            }
        }

        if (globalBest.result == null) {
            throw new IllegalStateException("No valid strategy: every evaluation failed");
        }
        OptimizationResult result = run.result(globalBest, converged, started);
        log.info("GA done: best fitness {} after {} evaluations in {} ms", String.format("%.0f", result.getBestFitness()),
                result.getEvaluations(), result.getComputationTimeMs());
        return result;
    }

    /**
     * Expands and simulates one genome. Runs on a worker thread when evaluation is parallel.
     */
    protected Evaluation evaluate(StrategyGenes genes, SimulationState initialState, GAParams params) {
        Strategy strategy = analytical.generateStrategy(genes, initialState);
        SimulationResult result = engine.runSimulation(strategy, params.endDay, initialState, params.simulationSeed);
        return new Evaluation(strategy, result, objective.calculateFitness(result));
    }

    protected static final class Evaluation {
        final Strategy strategy;
        final SimulationResult result;
        final double fitness;

        public Evaluation(Strategy strategy, SimulationResult result, double fitness) {
            this.strategy = strategy;
            this.result = result;
            this.fitness = fitness;
        }
    }

    // ============ Genome ============

    private static final Comparator<Genome> BY_FITNESS = Comparator.comparingDouble(g -> g.fitness);

    private static final class Genome {
        final StrategyGenes genes;
        Strategy strategy;
        SimulationResult result;
        double fitness = Double.NEGATIVE_INFINITY;

        Genome(StrategyGenes genes) {
            this.genes = genes;
        }

        Genome copy() {
            Genome g = new Genome(genes.copy());
            g.strategy = strategy;
            g.result = result;
            g.fitness = fitness;
            return g;
        }
    }

    /** Per-call search state, so one component instance can serve concurrent searches. */
    private final class Run {
        private final GAParams params;
        private final SimulationState initialState;
        private final Random rnd;
        private final List<Double> convergenceHistory = new ArrayList<>();
        private final List<GenerationStats> stats = new ArrayList<>();
        private int evaluations;

        Run(GAParams params, SimulationState initialState) {
            this.params = params;
            this.initialState = initialState;
            this.rnd = params.randomSeed == 0L ? null : new Random(params.randomSeed);
        }

        Random random() {
            return rnd != null ? rnd : ThreadLocalRandom.current();
        }

        void evaluatePopulation(List<Genome> population) {
            if (params.parallelEvaluation) {
                population.parallelStream().forEach(this::evaluateGenome);
            } else {
                population.forEach(this::evaluateGenome);
            }
            evaluations += population.size();
        }

        private void evaluateGenome(Genome genome) {
            if (genome.result != null) {
                return;     // elite carried over with its score
            }
            try {
                Evaluation evaluation = evaluate(genome.genes, initialState, params);
                genome.strategy = evaluation.strategy;
                genome.result = evaluation.result;
                genome.fitness = evaluation.fitness;
            } catch (RuntimeException e) {
                log.warn("Evaluation failed, scoring genome as -infinity: {}", e.getMessage());
                genome.fitness = Double.NEGATIVE_INFINITY;
            }
        }

        Genome tournamentSelect(List<Genome> population) {
            Genome best = null;
            for (int i = 0; i < params.tournamentSize; i++) {
                Genome g = population.get(random().nextInt(population.size()));
                if (best == null || g.fitness > best.fitness) {
                    best = g;
                }
            }
            return best;
        }

        void record(int generation, List<Genome> population, Genome globalBest) {
            double sum = 0;
            int finite = 0;
            double worst = Double.POSITIVE_INFINITY;
            for (Genome g : population) {
                if (Double.isFinite(g.fitness)) {
                    sum += g.fitness;
                    finite++;
                    worst = Math.min(worst, g.fitness);
                }
            }
            double average = finite == 0 ? Double.NEGATIVE_INFINITY : sum / finite;
            if (finite == 0) {
                worst = Double.NEGATIVE_INFINITY;
            }
            List<StrategyGenes> genes = population.stream().map(g -> g.genes).toList();
            stats.add(new GenerationStats(generation, globalBest.fitness, average, worst,
                    StrategyGenes.diversity(genes)));
            convergenceHistory.add(globalBest.fitness);
            log.debug("Generation {}: best={}, avg={}", generation, globalBest.fitness, average);
        }

        /** Relative gain of the best score over the last {@code convergenceWindow} generations. */
        boolean hasConverged(GAParams p) {
            int n = convergenceHistory.size();
            if (p.convergenceWindow <= 0 || n <= p.convergenceWindow) {
                return false;
            }
            double then = convergenceHistory.get(n - 1 - p.convergenceWindow);
            double now = convergenceHistory.get(n - 1);
            if (!Double.isFinite(then) || !Double.isFinite(now)) {
                return false;
            }
            return (now - then) / Math.max(1.0, Math.abs(then)) < p.convergenceThreshold;
        }

        OptimizationResult result(Genome best, boolean converged, long started) {
            SimulationResult simulation = best.result;
            return OptimizationResult.builder()
                    .algorithm("GENETIC")
                    .bestStrategy(best.strategy)
                    .bestFitness(best.fitness)
                    .bestNetWorth(simulation == null ? Double.NaN : simulation.getMetrics().getFinalNetWorth())
                    .bestGenes(best.genes.copy())
                    .finalSimulation(simulation)
                    .evaluations(evaluations)
                    .computationTimeMs(System.currentTimeMillis() - started)
                    .converged(converged)
                    .convergenceHistory(new ArrayList<>(convergenceHistory))
                    .generationStats(new ArrayList<>(stats))
                    .actionSummary(OptimizationResult.summarizeActions(simulation))
                    .build();
        }
    }
}
