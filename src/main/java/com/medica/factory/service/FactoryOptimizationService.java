package com.medica.factory.service;

import com.medica.factory.config.FactoryProperties;
import com.medica.factory.domain.InitialScenario;
import com.medica.factory.domain.SimulationResult;
import com.medica.factory.domain.SimulationState;
import com.medica.factory.domain.Strategy;
import com.medica.factory.engine.BusinessRulesValidator;
import com.medica.factory.engine.InitialStates;
import com.medica.factory.engine.SimulationEngine;
import com.medica.factory.optimizer.AnalyticalOptimizer;
import com.medica.factory.optimizer.BayesianOptimizer;
import com.medica.factory.optimizer.CancellationToken;
import com.medica.factory.optimizer.GeneticAlgorithm;
import com.medica.factory.optimizer.MultiRunOptimizer;
import com.medica.factory.optimizer.ObjectiveFunction;
import com.medica.factory.optimizer.OptimizationResult;
import com.medica.factory.optimizer.ProgressListener;
import com.medica.factory.optimizer.StrategyOptimizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for callers: run one strategy, or search for a good one with a named algorithm.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FactoryOptimizationService {

    private final SimulationEngine engine;
    private final BusinessRulesValidator rulesValidator;
    private final AnalyticalOptimizer analyticalOptimizer;
    private final GeneticAlgorithm geneticAlgorithm;
    private final BayesianOptimizer bayesianOptimizer;
    private final MultiRunOptimizer multiRunOptimizer;
    private final ObjectiveFunction objective;
    private final FactoryProperties properties;

    public SimulationReport simulate(Strategy strategy, InitialScenario scenario) {
        return simulate(strategy, scenario, properties.getSimulation().getEndDay());
    }

    public SimulationReport simulate(Strategy strategy, InitialScenario scenario, int endDay) {
        if (strategy == null) {
            throw new IllegalArgumentException("Strategy cannot be null");
        }
        if (scenario == null) {
            scenario = properties.getSimulation().getInitialScenario();
        }
        SimulationState initialState = InitialStates.create(scenario);
        if (endDay < initialState.getCurrentDay()) {
            throw new IllegalArgumentException("End day " + endDay + " is before the start day "
                    + initialState.getCurrentDay());
        }

        long started = System.currentTimeMillis();
        try {
            SimulationResult result = engine.runSimulation(strategy, endDay, initialState);
            return SimulationReport.builder()
                    .success(true)
                    .result(result)
                    .businessRules(rulesValidator.validate(result))
                    .executionTimeMs(System.currentTimeMillis() - started)
                    .build();
        } catch (RuntimeException e) {
            log.error("Simulation failed for scenario {}", scenario, e);
            return SimulationReport.builder()
                    .success(false)
                    .executionTimeMs(System.currentTimeMillis() - started)
                    .errorMessage(e.getMessage())
                    .build();
        }
    }

    public OptimizationResult optimize(String algorithm, InitialScenario scenario) {
        return optimize(algorithm, scenario, ProgressListener.NONE, CancellationToken.none());
    }

    /**
     * Runs {@code algorithm}: ANALYTICAL, GENETIC, BAYESIAN or MULTI_RUN.
     */
    public OptimizationResult optimize(String algorithm, InitialScenario scenario, ProgressListener listener,
                                       CancellationToken token) {
        if (algorithm == null || algorithm.isBlank()) {
            throw new IllegalArgumentException("Algorithm cannot be empty");
        }
        if (scenario == null) {
            scenario = properties.getSimulation().getInitialScenario();
        }
        SimulationState initialState = InitialStates.create(scenario);
        log.info("Optimizing with {} from the {} scenario", algorithm.toUpperCase(), scenario);

        // Algorithm Selection
        StrategyOptimizer optimizer;
        switch (algorithm.toUpperCase()) {
            case "ANALYTICAL" -> {
                return runAnalytical(initialState);
            }
            case "MULTI_RUN" -> {
                return multiRunOptimizer.optimize(initialState, listener, token).getBest();
            }
            case "GENETIC" -> optimizer = geneticAlgorithm;
            case "BAYESIAN" -> optimizer = bayesianOptimizer;
            default -> throw new IllegalArgumentException("Unknown algorithm: " + algorithm);
        }
        return optimizer.optimize(initialState, listener, token);
    }

    private OptimizationResult runAnalytical(SimulationState initialState) {
        long started = System.currentTimeMillis();
        Strategy strategy = analyticalOptimizer.generateAnalyticalStrategy(initialState);
        SimulationResult result = engine.runSimulation(strategy, properties.getSimulation().getEndDay(), initialState);
        double fitness = objective.calculateFitness(result);
        return OptimizationResult.builder()
                .algorithm("ANALYTICAL")
                .bestStrategy(strategy)
                .bestFitness(fitness)
                .bestNetWorth(result.getMetrics().getFinalNetWorth())
                .finalSimulation(result)
                .evaluations(1)
                .computationTimeMs(System.currentTimeMillis() - started)
                .actionSummary(OptimizationResult.summarizeActions(result))
                .build();
    }
}
