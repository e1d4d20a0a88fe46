package com.medica.factory.optimizer;

import com.medica.factory.config.FactoryProperties;
import com.medica.factory.domain.SimulationMetrics;
import com.medica.factory.domain.SimulationResult;
import com.medica.factory.domain.SimulationState;
import com.medica.factory.domain.Strategy;
import com.medica.factory.engine.SimulationEngine;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Sample-efficient search over {@link PolicyParameters}.
 * A random exploration phase maps the space, then a guided phase proposes policies near
 * the best ones found so far: mostly local Gaussian steps, some crossover, a little noise.
 * In weekly mode every candidate is a {@link WeeklyPolicy} and each week's parameters move independently.
 */
@Slf4j
@Component
public class BayesianOptimizer implements StrategyOptimizer {

    static final double LOCAL_SHARE = 0.65;
    static final double CROSSOVER_SHARE = 0.25;
    static final double PARAMETER_MUTATION_CHANCE = 0.4;
    static final double BASE_INTENSITY = 0.15;
    static final double STALLED_INTENSITY = 0.25;
    static final int STALL_ITERATIONS = 50;
    static final int NEGATIVE_RESTART_ITERATIONS = 20;
    static final int MAX_WARM_START = 10;

    public static class BayesianParams {
        public int totalIterations = 150;
        public int randomExploration = 30;
        public long randomSeed = 0L;           // 0 = ThreadLocalRandom
        public long simulationSeed = 42L;
        public int endDay = 415;
        public boolean weeklyPolicies = false;
        public int weeks = WeeklyPolicy.WEEKS_PER_YEAR;
        public List<PolicyParameters> warmStartPolicies = new ArrayList<>();

        int weekCount() {
            return weeklyPolicies ? Math.max(1, weeks) : 1;
        }

        public static BayesianParams from(FactoryProperties properties) {
            BayesianParams params = new BayesianParams();
            params.totalIterations = properties.getBayesian().getTotalIterations();
            params.randomExploration = properties.getBayesian().getRandomExploration();
            params.randomSeed = properties.getBayesian().getRandomSeed();
            params.weeklyPolicies = properties.getBayesian().isWeeklyPolicies();
            params.simulationSeed = properties.getSimulation().getRandomSeed();
            params.endDay = properties.getSimulation().getEndDay();
            return params;
        }
    }

    private final SimulationEngine engine;
    private final PolicyEngine policyEngine;
    private final FactoryProperties properties;

    public BayesianOptimizer(SimulationEngine engine, PolicyEngine policyEngine, FactoryProperties properties) {
        this.engine = Objects.requireNonNull(engine);
        this.policyEngine = Objects.requireNonNull(policyEngine);
        this.properties = Objects.requireNonNull(properties);
    }

    @Override
    public OptimizationResult optimize(SimulationState initialState, ProgressListener listener, CancellationToken token) {
        return optimize(initialState, BayesianParams.from(properties), listener, token);
    }

    /**
     * @throws OptimizationCancelledException when {@code token} is cancelled between iterations
     */
    public OptimizationResult optimize(SimulationState initialState, BayesianParams params,
                                       ProgressListener listener, CancellationToken token) {
        Objects.requireNonNull(initialState, "initialState");
        long started = System.currentTimeMillis();
        Search search = new Search(params, initialState);

        int warmStart = Math.min(MAX_WARM_START, params.warmStartPolicies.size());
        int randomPhase = warmStart > 0
                ? Math.max(10, params.randomExploration / 3)
                : params.randomExploration;
        log.info("Bayesian search start: iterations={}, weeks={}, warmStart={}, random={}, guided={}",
                params.totalIterations, params.weekCount(), warmStart, randomPhase,
                Math.max(0, params.totalIterations - warmStart - randomPhase));

        int iteration = 0;
        for (int i = 0; i < warmStart && iteration < params.totalIterations; i++) {
            search.checkCancelled(token, iteration, started);
            search.evaluate(WeeklyPolicy.uniform(params.warmStartPolicies.get(i).clamp(), params.weekCount()),
                    ++iteration, "warm-start", listener);
        }
        for (int i = 0; i < randomPhase && iteration < params.totalIterations; i++) {
            search.checkCancelled(token, iteration, started);
            search.evaluate(search.randomPolicy(), ++iteration, "random", listener);
        }
        while (iteration < params.totalIterations) {
            search.checkCancelled(token, iteration, started);
            search.evaluate(search.proposeNext(), ++iteration, "guided", listener);
        }

        OptimizationResult result = search.result(started);
        log.info("Bayesian search done: best net worth {} (fitness {})",
                String.format("%.0f", result.getBestNetWorth()), String.format("%.0f", result.getBestFitness()));
        return result;
    }

    /**
     * Fitness used to rank policies. Milder than {@link ObjectiveFunction}, so the search can
     * wander through imperfect regions on its way to good ones.
     */
    public double policyFitness(SimulationResult result) {
        SimulationState state = result.getFinalState();
        SimulationMetrics metrics = result.getMetrics();
        double netWorth = state.getNetWorth();
        if (state.getCash() < 0) {
            return -1_000_000;
        }
        double fitness = netWorth;
        if (metrics.getAverageDeliveryDays() > 10) {
            fitness -= (metrics.getAverageDeliveryDays() - 10) * 5000;
        }
        fitness -= metrics.getRejectedCustomOrders() * 2500;
        fitness -= metrics.getStockoutDays() * 500;
        if (metrics.getAverageRawInventory() > 400) {
            fitness -= (metrics.getAverageRawInventory() - 400) * 50;
        }
        fitness -= metrics.getTotalInterestPaid() * 0.5;
        if (netWorth > 0) {
            fitness += netWorth * 0.1;
        }
        return Math.round(fitness);
    }

    /** Re-runs a policy under {@code runs} different demand seeds and summarizes terminal net worth. */
    public RunStatistics validate(PolicyParameters policy, SimulationState initialState, int runs) {
        return validate(WeeklyPolicy.single(policy), initialState, runs);
    }

    public RunStatistics validate(WeeklyPolicy policy, SimulationState initialState, int runs) {
        if (runs < 1) {
            throw new IllegalArgumentException("runs must be positive");
        }
        Strategy strategy = policyEngine.toStrategy(policy, initialState);
        long baseSeed = properties.getSimulation().getRandomSeed();
        int endDay = properties.getSimulation().getEndDay();
        List<Double> netWorths = new ArrayList<>(runs);
        for (int i = 0; i < runs; i++) {
            SimulationResult result = engine.runSimulation(strategy, endDay, initialState, baseSeed + i);
            netWorths.add(result.getMetrics().getFinalNetWorth());
        }
        RunStatistics stats = RunStatistics.of(netWorths);
        log.info("Validation over {} runs: mean={}, stdDev={}, min={}, max={}", runs,
                Math.round(stats.getMean()), Math.round(stats.getStdDev()),
                Math.round(stats.getMin()), Math.round(stats.getMax()));
        return stats;
    }

    @Value
    private static class Evaluated {
        WeeklyPolicy policy;
        Strategy strategy;
        SimulationResult result;
        double fitness;
        double netWorth;
        int iteration;
    }

    /** Per-call search state. */
    private final class Search {
        private final BayesianParams params;
        private final SimulationState initialState;
        private final Random rnd;
        private final List<Evaluated> evaluations = new ArrayList<>();
        private final List<Double> convergenceHistory = new ArrayList<>();
        private Evaluated best;
        private int sinceImprovement;
        private double intensity = BASE_INTENSITY;

        Search(BayesianParams params, SimulationState initialState) {
            this.params = params;
            this.initialState = initialState;
            this.rnd = params.randomSeed == 0L ? null : new Random(params.randomSeed);
        }

        Random random() {
            return rnd != null ? rnd : ThreadLocalRandom.current();
        }

        void checkCancelled(CancellationToken token, int iteration, long started) {
            if (token.isCancelled()) {
                log.info("Bayesian search cancelled after {} iterations", iteration);
                throw new OptimizationCancelledException("Bayesian search cancelled after " + iteration
                        + " iterations", hasValidBest() ? result(started) : null);
            }
        }

        WeeklyPolicy randomPolicy() {
            return WeeklyPolicy.random(params.weekCount(), random());
        }

        void evaluate(WeeklyPolicy policy, int iteration, String phase, ProgressListener listener) {
            Evaluated evaluated;
            try {
                Strategy strategy = policyEngine.toStrategy(policy, initialState);
                SimulationResult result = engine.runSimulation(strategy, params.endDay, initialState,
                        params.simulationSeed);
                evaluated = new Evaluated(policy, strategy, result, policyFitness(result),
                        result.getMetrics().getFinalNetWorth(), iteration);
            } catch (RuntimeException e) {
                log.warn("Iteration {} failed, scoring policy as -infinity: {}", iteration, e.getMessage());
                evaluated = new Evaluated(policy, null, null, Double.NEGATIVE_INFINITY,
                        Double.NEGATIVE_INFINITY, iteration);
            }
            evaluations.add(evaluated);

            if (best == null || evaluated.getFitness() > best.getFitness()) {
                best = evaluated;
                sinceImprovement = 0;
                intensity = BASE_INTENSITY;
                log.debug("New best at iteration {} ({}): net worth {}", iteration, phase, evaluated.getNetWorth());
            } else {
                sinceImprovement++;
            }
            convergenceHistory.add(best.getFitness());
            listener.onProgress(new ProgressEvent(iteration, params.totalIterations, phase, best.getFitness()));
        }

        WeeklyPolicy proposeNext() {
            if (sinceImprovement >= STALL_ITERATIONS) {
                intensity = STALLED_INTENSITY;
            }
            List<Evaluated> top10 = topN(10);
            boolean allNegative = top10.stream().allMatch(e -> e.getNetWorth() < 0);
            if (top10.isEmpty() || (allNegative && sinceImprovement >= NEGATIVE_RESTART_ITERATIONS)) {
                return randomPolicy();
            }

            double pick = random().nextDouble();
            if (pick < LOCAL_SHARE) {
                return localSearch();
            } else if (pick < LOCAL_SHARE + CROSSOVER_SHARE) {
                return crossover();
            }
            return randomPolicy();
        }

        /** Gaussian step around one of the top three policies, week by week. */
        private WeeklyPolicy localSearch() {
            List<Evaluated> top = topN(3);
            WeeklyPolicy parent = top.get(random().nextInt(top.size())).getPolicy();
            List<PolicyParameters> weeks = new ArrayList<>(parent.weekCount());
            for (PolicyParameters week : parent.weeks()) {
                PolicyParameters child = week.copy();
                for (PolicyParameter parameter : PolicyParameter.values()) {
                    if (random().nextDouble() < PARAMETER_MUTATION_CHANCE) {
                        double step = random().nextGaussian() * intensity * parameter.span();
                        child.set(parameter, parameter.clamp(week.get(parameter) + step));
                    }
                }
                weeks.add(child);
            }
            return new WeeklyPolicy(weeks);
        }

        /** Uniform mix of two of the top five policies, per week and parameter. */
        private WeeklyPolicy crossover() {
            List<Evaluated> top = topN(5);
            WeeklyPolicy a = top.get(random().nextInt(top.size())).getPolicy();
            WeeklyPolicy b = top.get(random().nextInt(top.size())).getPolicy();
            List<PolicyParameters> weeks = new ArrayList<>(a.weekCount());
            for (int w = 0; w < a.weekCount(); w++) {
                PolicyParameters child = new PolicyParameters();
                for (PolicyParameter parameter : PolicyParameter.values()) {
                    PolicyParameters donor = random().nextBoolean() ? a.week(w) : b.week(w);
                    child.set(parameter, donor.get(parameter));
                }
                weeks.add(child);
            }
            return new WeeklyPolicy(weeks);
        }

        private List<Evaluated> topN(int n) {
            return evaluations.stream()
                    .sorted(Comparator.comparingDouble(Evaluated::getFitness).reversed())
                    .limit(n)
                    .toList();
        }

        boolean hasValidBest() {
            return best != null && best.getResult() != null;
        }

        OptimizationResult result(long started) {
            if (!hasValidBest()) {
                throw new IllegalStateException("No valid strategy: every evaluation failed");
            }
            return OptimizationResult.builder()
                    .algorithm("BAYESIAN")
                    .bestStrategy(best.getStrategy())
                    .bestFitness(best.getFitness())
                    .bestNetWorth(best.getNetWorth())
                    .bestPolicy(best.getPolicy().representative().copy())
                    .bestWeeklyPolicy(params.weeklyPolicies ? best.getPolicy().copy() : null)
                    .finalSimulation(best.getResult())
                    .evaluations(evaluations.size())
                    .computationTimeMs(System.currentTimeMillis() - started)
                    .convergenceHistory(new ArrayList<>(convergenceHistory))
                    .actionSummary(OptimizationResult.summarizeActions(best.getResult()))
                    .build();
        }
    }
}
