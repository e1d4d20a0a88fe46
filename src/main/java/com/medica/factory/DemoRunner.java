package com.medica.factory;

import com.medica.factory.config.FactoryProperties;
import com.medica.factory.domain.BusinessRulesReport;
import com.medica.factory.domain.InitialScenario;
import com.medica.factory.domain.SimulationMetrics;
import com.medica.factory.domain.Strategy;
import com.medica.factory.optimizer.OptimizationResult;
import com.medica.factory.service.FactoryOptimizationService;
import com.medica.factory.service.SimulationReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@ConditionalOnProperty(prefix = "factory.demo", name = "enabled", havingValue = "true")
public class DemoRunner implements CommandLineRunner {

    private final FactoryOptimizationService service;
    private final FactoryProperties properties;

    public DemoRunner(FactoryOptimizationService service, FactoryProperties properties) {
        this.service = service;
        this.properties = properties;
    }

    @Override
    public void run(String... args) {
        InitialScenario scenario = properties.getSimulation().getInitialScenario();
        String algorithm = args.length > 0 ? args[0] : properties.getDemo().getAlgorithm();
        System.out.println("=== FACTORY SIMULATION DEMO (" + scenario + ") ===");

        // 1. Baseline run with default settings
        SimulationReport baseline = service.simulate(Strategy.defaults(), scenario);
        if (!baseline.isSuccess()) {
            System.out.println("Baseline simulation failed: " + baseline.getErrorMessage());
            return;
        }
        System.out.println("\n--- BASELINE (default strategy) ---");
        printMetrics(baseline.getResult().getMetrics());
        printRules(baseline.getBusinessRules());

        // 2. Optimization
        try {
            OptimizationResult result = service.optimize(algorithm, scenario);

            System.out.printf("\n--- OPTIMIZED (%s) ---\n", result.getAlgorithm());
            System.out.printf("Fitness:      %,.0f\n", result.getBestFitness());
            System.out.printf("Evaluations:  %d in %d ms\n", result.getEvaluations(), result.getComputationTimeMs());
            if (result.getFinalSimulation() != null) {
                printMetrics(result.getFinalSimulation().getMetrics());
            }
            System.out.println("\n--- ACTIONS EXECUTED ---");
            result.getActionSummary().forEach((type, count) -> System.out.printf("%-22s %d\n", type, count));
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.error("Optimization with {} failed", algorithm, e);
        }
    }

    private static void printMetrics(SimulationMetrics m) {
        System.out.printf("Net worth:    %,.2f (cash %,.2f, debt %,.2f)\n", m.getFinalNetWorth(), m.getFinalCash(),
                m.getFinalDebt());
        System.out.printf("Revenue:      %,.2f  Interest: %,.2f\n", m.getTotalRevenue(), m.getTotalInterestPaid());
        System.out.printf("Produced:     %d standard, %d custom\n", m.getTotalStandardProduced(),
                m.getTotalCustomProduced());
        System.out.printf("Delivery:     avg %.2f days, service level %.1f%%\n", m.getAverageDeliveryDays(),
                m.getServiceLevel() * 100);
        System.out.printf("Stockouts:    %d days  Rejected orders: %d\n", m.getStockoutDays(),
                m.getRejectedCustomOrders());
    }

    private static void printRules(BusinessRulesReport report) {
        System.out.printf("Business rules: %s (%d violation(s))\n", report.isValid() ? "VALID" : "INVALID",
                report.getViolations().size());
        report.getViolations().forEach(v -> System.out.printf("  [%s] %s\n", v.getSeverity(), v.getMessage()));
    }
}
