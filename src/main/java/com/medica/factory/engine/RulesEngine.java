package com.medica.factory.engine;

import com.medica.factory.domain.ConditionType;
import com.medica.factory.domain.Rule;
import com.medica.factory.domain.RuleCondition;
import com.medica.factory.domain.SimulationState;
import com.medica.factory.domain.StrategyAction;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates condition-action rules against the state. Rules are checked in descending
 * priority and every satisfied rule fires. Holds per-run execution state.
 */
@Slf4j
public class RulesEngine {

    @Data
    @AllArgsConstructor
    public static class RuleExecutionState {
        private String ruleId;
        private int lastTriggeredDay;
        private int triggerCount;
    }

    private final List<Rule> rules = new ArrayList<>();
    private final Map<String, RuleExecutionState> executionState = new LinkedHashMap<>();

    public RulesEngine() {
    }

    public RulesEngine(List<Rule> initialRules) {
        initialRules.forEach(this::addRule);
    }

    public void addRule(Rule rule) {
        if (rule.getId() == null || rule.getAction() == null) {
            throw new IllegalArgumentException("Rule needs an id and an action");
        }
        removeRule(rule.getId());
        rules.add(rule);
        rules.sort(Comparator.comparingInt(Rule::getPriority).reversed());
        executionState.put(rule.getId(), new RuleExecutionState(rule.getId(), -1, 0));
    }

    public boolean removeRule(String ruleId) {
        executionState.remove(ruleId);
        return rules.removeIf(r -> r.getId().equals(ruleId));
    }

    public List<Rule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * Returns the actions of all rules that fire today, stamped with the current day.
     */
    public List<StrategyAction> evaluate(SimulationState state) {
        List<StrategyAction> fired = new ArrayList<>();
        int day = state.getCurrentDay();
        for (Rule rule : rules) {
            if (!rule.isEnabled()) {
                continue;
            }
            RuleExecutionState exec = executionState.get(rule.getId());
            if (rule.getMaxTriggers() > 0 && exec.getTriggerCount() >= rule.getMaxTriggers()) {
                continue;
            }
            if (exec.getLastTriggeredDay() >= 0 && day - exec.getLastTriggeredDay() < rule.getCooldownDays()) {
                continue;
            }
            if (!rule.getConditions().stream().allMatch(c -> matches(c, state))) {
                continue;
            }
            exec.setLastTriggeredDay(day);
            exec.setTriggerCount(exec.getTriggerCount() + 1);
            fired.add(rule.getAction().atDay(day));
            log.debug("Day {}: rule '{}' fired ({} time(s))", day, rule.getName(), exec.getTriggerCount());
        }
        return fired;
    }

    public boolean matches(RuleCondition condition, SimulationState state) {
        return switch (condition.getType()) {
            case CASH_BELOW -> state.getCash() < condition.getThreshold();
            case CASH_ABOVE -> state.getCash() > condition.getThreshold();
            case INVENTORY_BELOW -> state.getRawMaterialInventory() < condition.getThreshold();
            case INVENTORY_ABOVE -> state.getRawMaterialInventory() > condition.getThreshold();
            case BACKLOG_BELOW -> state.getCustomWip() < condition.getThreshold();
            case BACKLOG_ABOVE -> state.getCustomWip() > condition.getThreshold();
            case DEBT_ABOVE -> state.getDebt() > condition.getThreshold();
            case NET_WORTH_BELOW -> state.getNetWorth() < condition.getThreshold();
            case DAY_RANGE -> state.getCurrentDay() >= condition.getMinDay() && state.getCurrentDay() <= condition.getMaxDay();
        };
    }

    public Map<String, RuleExecutionState> getExecutionStats() {
        Map<String, RuleExecutionState> copy = new LinkedHashMap<>();
        executionState.forEach((id, s) -> copy.put(id, new RuleExecutionState(s.getRuleId(), s.getLastTriggeredDay(), s.getTriggerCount())));
        return copy;
    }

    public void resetExecutionState() {
        executionState.replaceAll((id, s) -> new RuleExecutionState(id, -1, 0));
    }

    /** A starter set of backpressure rules. */
    public static List<Rule> exampleRules() {
        List<Rule> examples = new ArrayList<>();
        examples.add(Rule.builder()
                .id("emergency-materials")
                .name("Emergency material order")
                .conditions(List.of(RuleCondition.of(ConditionType.INVENTORY_BELOW, 50),
                        RuleCondition.of(ConditionType.CASH_ABOVE, 30000)))
                .action(StrategyAction.orderMaterials(0, 400))
                .cooldownDays(5)
                .priority(100)
                .build());
        examples.add(Rule.builder()
                .id("emergency-loan")
                .name("Emergency loan")
                .conditions(List.of(RuleCondition.of(ConditionType.CASH_BELOW, 5000)))
                .action(StrategyAction.takeLoan(0, 20000))
                .cooldownDays(7)
                .maxTriggers(10)
                .priority(90)
                .build());
        examples.add(Rule.builder()
                .id("backlog-hiring")
                .name("Hire when backlog builds")
                .conditions(List.of(RuleCondition.of(ConditionType.BACKLOG_ABOVE, 300),
                        RuleCondition.dayRange(51, 380)))
                .action(StrategyAction.hireRookie(0, 1))
                .cooldownDays(15)
                .maxTriggers(5)
                .priority(50)
                .build());
        examples.add(Rule.builder()
                .id("debt-reduction")
                .name("Pay down debt with surplus cash")
                .conditions(List.of(RuleCondition.of(ConditionType.CASH_ABOVE, 150000),
                        RuleCondition.of(ConditionType.DEBT_ABOVE, 0)))
                .action(StrategyAction.payDebt(0, 50000))
                .cooldownDays(10)
                .priority(10)
                .build());
        return examples;
    }
}
