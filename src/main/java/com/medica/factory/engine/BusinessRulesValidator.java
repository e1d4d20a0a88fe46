package com.medica.factory.engine;

import com.medica.factory.domain.BusinessRulesReport;
import com.medica.factory.domain.DailyMetric;
import com.medica.factory.domain.FactoryConstants;
import com.medica.factory.domain.HistoryMetric;
import com.medica.factory.domain.RuleViolation;
import com.medica.factory.domain.Severity;
import com.medica.factory.domain.SimulationMetrics;
import com.medica.factory.domain.SimulationResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Post-run check of operating rules. Only CRITICAL findings make a run invalid.
 */
@Component
public class BusinessRulesValidator {

    static final double TARGET_DELIVERY_DAYS = 5;
    static final double MIN_SERVICE_LEVEL = 0.90;
    static final int MAX_CONSECUTIVE_STOCKOUT_DAYS = 2;
    static final double MAX_STOCKOUTS_PER_100_DAYS = 5;
    static final double MIN_MCE_UTILIZATION = 0.50;
    static final double BANKRUPTCY_CASH = -50000;
    static final double MAX_REJECTIONS_PER_100_DAYS = 10;
    static final double MIN_CUSTOM_SHARE = 0.15;

    public BusinessRulesReport validate(SimulationResult result) {
        SimulationMetrics m = result.getMetrics();
        List<RuleViolation> violations = new ArrayList<>();
        int days = Math.max(1, result.getHistory().days());

        if (m.getAverageDeliveryDays() > FactoryConstants.LATE_DELIVERY_DAYS) {
            violations.add(new RuleViolation("MAX_DELIVERY_TIME", Severity.CRITICAL,
                    "Average custom delivery time exceeds " + FactoryConstants.LATE_DELIVERY_DAYS + " days",
                    m.getAverageDeliveryDays(), FactoryConstants.LATE_DELIVERY_DAYS));
        }

        double onTarget = onTargetShare(result.getHistory().series(HistoryMetric.CUSTOM_DELIVERY_TIME));
        if (onTarget < MIN_SERVICE_LEVEL) {
            violations.add(new RuleViolation("SERVICE_LEVEL", Severity.MAJOR,
                    "Less than 90% of delivery days meet the " + (int) TARGET_DELIVERY_DAYS + "-day target",
                    onTarget, MIN_SERVICE_LEVEL));
        }

        if (m.getMaxConsecutiveStockoutDays() > MAX_CONSECUTIVE_STOCKOUT_DAYS) {
            violations.add(new RuleViolation("CONSECUTIVE_STOCKOUTS", Severity.MAJOR,
                    "Material ran short on consecutive days",
                    m.getMaxConsecutiveStockoutDays(), MAX_CONSECUTIVE_STOCKOUT_DAYS));
        }

        double stockoutRate = m.getStockoutDays() * 100.0 / days;
        if (stockoutRate > MAX_STOCKOUTS_PER_100_DAYS) {
            violations.add(new RuleViolation("STOCKOUT_FREQUENCY", Severity.WARNING,
                    "Too many stockout days per 100", stockoutRate, MAX_STOCKOUTS_PER_100_DAYS));
        }

        if (m.getAverageMceUtilization() < MIN_MCE_UTILIZATION) {
            violations.add(new RuleViolation("MCE_UTILIZATION", Severity.WARNING,
                    "MCE is mostly idle", m.getAverageMceUtilization(), MIN_MCE_UTILIZATION));
        }

        double lowestCash = result.getHistory().series(HistoryMetric.CASH).stream()
                .mapToDouble(DailyMetric::getValue).min().orElse(m.getFinalCash());
        if (lowestCash < BANKRUPTCY_CASH) {
            violations.add(new RuleViolation("BANKRUPTCY", Severity.CRITICAL,
                    "Cash fell below the bankruptcy line", lowestCash, BANKRUPTCY_CASH));
        }

        double rejectionRate = m.getRejectedCustomOrders() * 100.0 / days;
        if (rejectionRate > MAX_REJECTIONS_PER_100_DAYS) {
            violations.add(new RuleViolation("ORDER_REJECTIONS", Severity.MAJOR,
                    "Too many custom orders rejected per 100 days", rejectionRate, MAX_REJECTIONS_PER_100_DAYS));
        }

        long produced = m.getTotalStandardProduced() + m.getTotalCustomProduced();
        if (produced > 0) {
            double customShare = (double) m.getTotalCustomProduced() / produced;
            if (customShare < MIN_CUSTOM_SHARE) {
                violations.add(new RuleViolation("CUSTOM_MIX", Severity.WARNING,
                        "Custom products are a small share of output", customShare, MIN_CUSTOM_SHARE));
            }
        }

        return BusinessRulesReport.builder().violations(violations).build();
    }

    private double onTargetShare(List<DailyMetric> deliveryTimes) {
        long measured = deliveryTimes.stream().filter(d -> d.getValue() > 0).count();
        if (measured == 0) {
            return 1.0;
        }
        long onTarget = deliveryTimes.stream()
                .filter(d -> d.getValue() > 0 && d.getValue() <= TARGET_DELIVERY_DAYS)
                .count();
        return (double) onTarget / measured;
    }
}
