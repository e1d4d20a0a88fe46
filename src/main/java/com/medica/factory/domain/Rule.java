package com.medica.factory.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Condition-to-action trigger. All conditions must hold (AND).
 * The action's day is ignored; it is restamped with the day the rule fires.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Rule {
    private String id;
    private String name;
    @Builder.Default
    private List<RuleCondition> conditions = new ArrayList<>();
    private StrategyAction action;
    private int cooldownDays;        // 0 = may fire every day
    private int maxTriggers;         // 0 = unlimited
    private int priority;            // higher evaluates first
    @Builder.Default
    private boolean enabled = true;
}
