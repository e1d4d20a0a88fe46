package com.medica.factory.service;

import com.medica.factory.domain.InitialScenario;
import com.medica.factory.domain.Strategy;
import com.medica.factory.optimizer.OptimizationResult;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class FactoryOptimizationServiceTest {

    @Autowired
    private FactoryOptimizationService service;

    @Test
    void simulatesTheConfiguredHorizon() {
        SimulationReport report = service.simulate(Strategy.defaults(), InitialScenario.HISTORICAL);

        assertThat(report.isSuccess()).isTrue();
        assertThat(report.getResult().getMetrics().getFinalDay()).isEqualTo(150);
        assertThat(report.getBusinessRules()).isNotNull();
    }

    @Test
    void missingScenarioFallsBackToConfiguredOne() {
        SimulationReport report = service.simulate(Strategy.defaults(), null);

        assertThat(report.isSuccess()).isTrue();
        assertThat(report.getResult().getFinalState().getCustomWip()).isPositive();
    }

    @Test
    void nullStrategyIsRejected() {
        assertThatThrownBy(() -> service.simulate(null, InitialScenario.HISTORICAL))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void endDayBeforeStartIsRejected() {
        assertThatThrownBy(() -> service.simulate(Strategy.defaults(), InitialScenario.HISTORICAL, 40))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("40");
    }

    @Test
    void shorterHorizonOnRequest() {
        SimulationReport report = service.simulate(Strategy.defaults(), InitialScenario.BUSINESS_CASE, 80);

        assertThat(report.getResult().getHistory().days()).isEqualTo(30);
    }

    @Test
    void analyticalOptimizationIsOneEvaluation() {
        OptimizationResult result = service.optimize("analytical", InitialScenario.BUSINESS_CASE);

        assertThat(result.getAlgorithm()).isEqualTo("ANALYTICAL");
        assertThat(result.getEvaluations()).isEqualTo(1);
        assertThat(result.getBestStrategy().getTimedActions()).isNotEmpty();
    }

    @Test
    void geneticOptimizationUsesConfiguredSettings() {
        OptimizationResult result = service.optimize("GENETIC", InitialScenario.HISTORICAL);

        assertThat(result.getAlgorithm()).isEqualTo("GENETIC");
        assertThat(result.getEvaluations()).isEqualTo(6 * 4);
    }

    @Test
    void bayesianOptimizationUsesConfiguredSettings() {
        OptimizationResult result = service.optimize("BAYESIAN", InitialScenario.HISTORICAL);

        assertThat(result.getEvaluations()).isEqualTo(6);
        assertThat(result.getBestPolicy()).isNotNull();
    }

    @Test
    void multiRunReturnsTheBestRun() {
        OptimizationResult result = service.optimize("multi_run", InitialScenario.HISTORICAL);

        assertThat(result.getAlgorithm()).isEqualTo("GENETIC");
    }

    @Test
    void unknownAlgorithmIsRejected() {
        assertThatThrownBy(() -> service.optimize("SIMULATED_ANNEALING", InitialScenario.HISTORICAL))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("SIMULATED_ANNEALING");
        assertThatThrownBy(() -> service.optimize(" ", InitialScenario.HISTORICAL))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
