package com.medica.factory.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RuleCondition {
    private ConditionType type;
    private double threshold;   // unused by DAY_RANGE
    private int minDay;         // DAY_RANGE only
    private int maxDay;         // DAY_RANGE only

    public static RuleCondition of(ConditionType type, double threshold) {
        return RuleCondition.builder().type(type).threshold(threshold).build();
    }

    public static RuleCondition dayRange(int minDay, int maxDay) {
        return RuleCondition.builder().type(ConditionType.DAY_RANGE).minDay(minDay).maxDay(maxDay).build();
    }
}
