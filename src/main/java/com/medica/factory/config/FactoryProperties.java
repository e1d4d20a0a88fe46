package com.medica.factory.config;

import com.medica.factory.domain.FactoryConstants;
import com.medica.factory.domain.InitialScenario;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under {@code factory.*} in application.yml.
 */
@Data
@ConfigurationProperties(prefix = "factory")
public class FactoryProperties {

    private Simulation simulation = new Simulation();
    private Genetic genetic = new Genetic();
    private Bayesian bayesian = new Bayesian();
    private MultiRun multiRun = new MultiRun();
    private Demo demo = new Demo();

    @Data
    public static class Simulation {
        private long randomSeed = 42L;
        private int endDay = FactoryConstants.SIMULATION_END_DAY;
        private InitialScenario initialScenario = InitialScenario.HISTORICAL;
    }

    @Data
    public static class Genetic {
        private int populationSize = 100;
        private int generations = 500;
        private double crossoverRate = 0.7;
        private double mutationRate = 0.05;
        private int eliteCount = 20;
        private int tournamentSize = 3;
        private double convergenceThreshold = 0.001;
        private int convergenceWindow = 50;
        private boolean parallelEvaluation = true;
        private long randomSeed = 0L;     // 0 = unseeded
    }

    @Data
    public static class Bayesian {
        private int totalIterations = 150;
        private int randomExploration = 30;
        private long randomSeed = 0L;     // 0 = unseeded
        private boolean weeklyPolicies = false;
    }

    @Data
    public static class MultiRun {
        private int numRuns = 5;
    }

    @Data
    public static class Demo {
        private boolean enabled = true;
        private String algorithm = "ANALYTICAL";
    }
}
