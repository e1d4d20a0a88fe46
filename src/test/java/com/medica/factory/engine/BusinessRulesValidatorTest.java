package com.medica.factory.engine;

import com.medica.factory.FactoryFixtures;
import com.medica.factory.domain.BusinessRulesReport;
import com.medica.factory.domain.HistoryMetric;
import com.medica.factory.domain.RuleViolation;
import com.medica.factory.domain.Severity;
import com.medica.factory.domain.SimulationMetrics;
import com.medica.factory.domain.SimulationResult;
import com.medica.factory.domain.SimulationState;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BusinessRulesValidatorTest {

    private final BusinessRulesValidator validator = new BusinessRulesValidator();

    @Test
    void healthyRunIsValid() {
        BusinessRulesReport report = validator.validate(result(healthy().build(), FactoryFixtures.emptyPlant(1, 1, 1, 1)));

        assertThat(report.isValid()).isTrue();
        assertThat(report.getViolations()).isEmpty();
    }

    @Test
    void slowDeliveryIsCritical() {
        SimulationMetrics metrics = healthy().averageDeliveryDays(8).build();

        BusinessRulesReport report = validator.validate(result(metrics, FactoryFixtures.emptyPlant(1, 1, 1, 1)));

        assertThat(report.isValid()).isFalse();
        assertThat(report.getViolations()).extracting(RuleViolation::getRule).contains("MAX_DELIVERY_TIME");
    }

    @Test
    void cashBelowBankruptcyLineIsCritical() {
        SimulationState state = FactoryFixtures.emptyPlant(1, 1, 1, 1);
        state.getHistory().record(HistoryMetric.CASH, 51, -60000);

        BusinessRulesReport report = validator.validate(result(healthy().build(), state));

        assertThat(report.count(Severity.CRITICAL)).isEqualTo(1);
    }

    @Test
    void idleMceIsOnlyAWarning() {
        SimulationMetrics metrics = healthy().averageMceUtilization(0.2).build();

        BusinessRulesReport report = validator.validate(result(metrics, FactoryFixtures.emptyPlant(1, 1, 1, 1)));

        assertThat(report.isValid()).isTrue();
        assertThat(report.count(Severity.WARNING)).isEqualTo(1);
    }

    private static SimulationMetrics.SimulationMetricsBuilder healthy() {
        return SimulationMetrics.builder()
                .averageDeliveryDays(4)
                .averageMceUtilization(0.9)
                .totalStandardProduced(700)
                .totalCustomProduced(300);
    }

    private static SimulationResult result(SimulationMetrics metrics, SimulationState state) {
        return SimulationResult.builder().metrics(metrics).finalState(state).build();
    }
}
