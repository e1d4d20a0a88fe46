package com.medica.factory.engine;

import com.medica.factory.domain.DailyMetric;
import com.medica.factory.domain.FactoryConstants;
import com.medica.factory.domain.HistoryMetric;
import com.medica.factory.domain.SimulationState;
import com.medica.factory.domain.Strategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Automated debt policy: preemptive 2% loans ahead of payroll, paydown of excess cash,
 * and a debt ceiling that is reported but not enforced.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DebtManager {

    static final int TRAILING_REVENUE_DAYS = 30;

    private final FinanceModule finance;
    private final WorkforceModule workforce;

    /**
     * Cash to keep on hand: amortized daily operating expense times the reserve-day setting.
     */
    public double calculateMinCashReserve(SimulationState state, Strategy strategy) {
        double salaries = workforce.dailyPayroll(state.getWorkforce());
        double overtime = workforce.overtimeCost(state.getWorkforce(), strategy.getDailyOvertimeHours());
        double materials = InventoryModule.orderCost(strategy.getOrderQuantity()) / FactoryConstants.PAYROLL_CYCLE_DAYS;
        return (salaries + overtime + materials) * strategy.getMinCashReserveDays();
    }

    /**
     * Borrows at the planned rate shortly before payroll if cash would not cover a week of wages
     * plus the emergency buffer. The loan is capped by the debt ratio limits.
     *
     * @return amount borrowed
     */
    public double preventWageAdvance(SimulationState state, Strategy strategy) {
        int daysUntilPayroll = FactoryConstants.PAYROLL_CYCLE_DAYS - state.getCurrentDay() % FactoryConstants.PAYROLL_CYCLE_DAYS;
        if (daysUntilPayroll > strategy.getPreemptiveWageLoanDays()) {
            return 0;
        }
        double required = workforce.dailyPayroll(state.getWorkforce()) * FactoryConstants.PAYROLL_CYCLE_DAYS
                + strategy.getEmergencyLoanBuffer();
        if (state.getCash() >= required) {
            return 0;
        }
        double loan = Math.min(required - state.getCash(), maxAdditionalDebt(state, strategy));
        if (loan <= 0) {
            return 0;
        }
        finance.takeLoan(state, loan, FactoryConstants.PLANNED_LOAN_COMMISSION);
        log.debug("Day {}: preemptive loan {} ahead of payroll in {} day(s)", state.getCurrentDay(),
                Math.round(loan), daysUntilPayroll);
        return loan;
    }

    /**
     * Largest extra borrowing allowed by all three ratio ceilings at once.
     * Revenue-based ceilings are skipped until there is revenue history to measure.
     */
    public double maxAdditionalDebt(SimulationState state, Strategy strategy) {
        double debt = state.getDebt();
        double assets = state.getCash() + AssetValuation.total(state);
        double limit = Double.MAX_VALUE;

        double assetRatio = strategy.getMaxDebtToAssetRatio();
        if (assetRatio > 0 && assetRatio < 1) {
            // (debt + x) / (assets + x) <= r
            limit = Math.min(limit, (assetRatio * assets - debt) / (1 - assetRatio));
        }

        double dailyRevenue = trailingDailyRevenue(state);
        if (dailyRevenue > 0) {
            double annualRevenue = dailyRevenue * 365;
            if (strategy.getMaxDebtToRevenueRatio() > 0) {
                limit = Math.min(limit, strategy.getMaxDebtToRevenueRatio() * annualRevenue - debt);
            }
            if (strategy.getMinInterestCoverageRatio() > 0) {
                double maxDailyInterest = dailyRevenue / strategy.getMinInterestCoverageRatio();
                limit = Math.min(limit, maxDailyInterest / FactoryConstants.DAILY_DEBT_INTEREST_RATE - debt);
            }
        }
        return Math.max(0, limit);
    }

    /**
     * Applies {@code aggressiveness x (cash - reserve)} to outstanding debt.
     *
     * @return amount repaid
     */
    public double executeDebtPaydown(SimulationState state, Strategy strategy) {
        if (state.getDebt() <= 0) {
            return 0;
        }
        double excess = state.getCash() - calculateMinCashReserve(state, strategy);
        if (excess <= 0) {
            return 0;
        }
        double target = Math.min(excess * strategy.getDebtPaydownAggressiveness(), state.getDebt());
        return finance.payDebt(state, target);
    }

    /**
     * Flags debt above the configured threshold. Observational only.
     */
    public boolean checkDebtThreshold(SimulationState state, Strategy strategy) {
        if (strategy.getMaxDebtThreshold() <= 0 || state.getDebt() <= strategy.getMaxDebtThreshold()) {
            return false;
        }
        state.setDebtThresholdBreachDays(state.getDebtThresholdBreachDays() + 1);
        if (state.getDebtThresholdBreachDays() == 1) {
            log.warn("Day {}: debt {} exceeds threshold {}", state.getCurrentDay(),
                    Math.round(state.getDebt()), Math.round(strategy.getMaxDebtThreshold()));
        }
        return true;
    }

    /** End-of-day debt routine. */
    public void manageDebt(SimulationState state, Strategy strategy) {
        if (strategy.isAutoDebtPaydown()) {
            preventWageAdvance(state, strategy);
            executeDebtPaydown(state, strategy);
        }
        checkDebtThreshold(state, strategy);
    }

    private double trailingDailyRevenue(SimulationState state) {
        List<DailyMetric> revenue = state.getHistory().series(HistoryMetric.DAILY_REVENUE);
        if (revenue.isEmpty()) {
            return 0;
        }
        int from = Math.max(0, revenue.size() - TRAILING_REVENUE_DAYS);
        return revenue.subList(from, revenue.size()).stream().mapToDouble(DailyMetric::getValue).average().orElse(0);
    }
}
