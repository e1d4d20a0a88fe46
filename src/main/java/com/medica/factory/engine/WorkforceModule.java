package com.medica.factory.engine;

import com.medica.factory.domain.FactoryConstants;
import com.medica.factory.domain.RookieInTraining;
import com.medica.factory.domain.SimulationState;
import com.medica.factory.domain.Strategy;
import com.medica.factory.domain.Workforce;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Random;

/**
 * Payroll, ARCP labor capacity, rookie training and overtime quit risk.
 */
@Slf4j
@Component
public class WorkforceModule {

    public double dailyPayroll(Workforce workforce) {
        return workforce.getExperts() * FactoryConstants.EXPERT_SALARY
                + workforce.getRookies() * FactoryConstants.ROOKIE_SALARY;
    }

    public double overtimeCost(Workforce workforce, double hours) {
        if (hours <= 0) {
            return 0;
        }
        double hourlyWages = workforce.getExperts() * FactoryConstants.EXPERT_SALARY / FactoryConstants.HOURS_PER_SHIFT
                + workforce.getRookies() * FactoryConstants.ROOKIE_SALARY / FactoryConstants.HOURS_PER_SHIFT;
        return hours * FactoryConstants.OVERTIME_MULTIPLIER * hourlyWages;
    }

    public double baseProductivity(int experts, int rookies) {
        return experts * FactoryConstants.EXPERT_PRODUCTIVITY + rookies * FactoryConstants.rookieProductivity();
    }

    /** ARCP units per day, including the overtime boost. */
    public double arcpCapacity(Workforce workforce, double overtimeHours) {
        double base = baseProductivity(workforce.getExperts(), workforce.getRookies());
        if (overtimeHours > 0) {
            base *= 1 + overtimeHours / FactoryConstants.HOURS_PER_SHIFT;
        }
        return base;
    }

    public void hireRookies(SimulationState state, int count) {
        for (int i = 0; i < count; i++) {
            state.getWorkforce().getRookiesInTraining()
                    .add(new RookieInTraining(state.getCurrentDay(), FactoryConstants.ROOKIE_TRAINING_DAYS));
        }
    }

    public void hireExperts(SimulationState state, int count) {
        if (count > 0) {
            state.getWorkforce().setExperts(state.getWorkforce().getExperts() + count);
        }
    }

    /**
     * Counts down training; rookies who finish become experts.
     *
     * @return number promoted today
     */
    public int advanceTraining(SimulationState state) {
        Workforce workforce = state.getWorkforce();
        int promoted = 0;
        Iterator<RookieInTraining> it = workforce.getRookiesInTraining().iterator();
        while (it.hasNext()) {
            RookieInTraining rookie = it.next();
            rookie.setDaysRemaining(rookie.getDaysRemaining() - 1);
            if (rookie.getDaysRemaining() <= 0) {
                it.remove();
                promoted++;
            }
        }
        workforce.setExperts(workforce.getExperts() + promoted);
        return promoted;
    }

    /**
     * Tracks consecutive overtime days; once past the trigger, every worker may quit.
     *
     * @return number of workers who quit today
     */
    public int applyOvertimeAndQuitRisk(SimulationState state, Strategy strategy, Random random) {
        Workforce workforce = state.getWorkforce();
        if (strategy.getDailyOvertimeHours() <= 0) {
            workforce.setConsecutiveOvertimeDays(0);
            return 0;
        }
        workforce.setConsecutiveOvertimeDays(workforce.getConsecutiveOvertimeDays() + 1);
        if (workforce.getConsecutiveOvertimeDays() <= strategy.getOvertimeTriggerDays()) {
            return 0;
        }

        int expertQuits = 0;
        for (int i = 0; i < workforce.getExperts(); i++) {
            if (random.nextDouble() < strategy.getDailyQuitProbability()) {
                expertQuits++;
            }
        }
        int rookieQuits = 0;
        for (int i = 0; i < workforce.getRookies(); i++) {
            if (random.nextDouble() < strategy.getDailyQuitProbability()) {
                rookieQuits++;
            }
        }
        workforce.setExperts(workforce.getExperts() - expertQuits);
        for (int i = 0; i < rookieQuits; i++) {
            // most recent hires leave first
            workforce.getRookiesInTraining().remove(workforce.getRookiesInTraining().size() - 1);
        }
        int quits = expertQuits + rookieQuits;
        if (quits > 0) {
            log.debug("Day {}: {} worker(s) quit after {} overtime days", state.getCurrentDay(), quits,
                    workforce.getConsecutiveOvertimeDays());
        }
        return quits;
    }
}
