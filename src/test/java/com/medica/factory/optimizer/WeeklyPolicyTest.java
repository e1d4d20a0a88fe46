package com.medica.factory.optimizer;

import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WeeklyPolicyTest {

    @Test
    void daysMapToWeeksFromTheStartDay() {
        WeeklyPolicy policy = WeeklyPolicy.random(WeeklyPolicy.WEEKS_PER_YEAR, new Random(3));

        assertThat(policy.weekIndex(51, 51)).isZero();
        assertThat(policy.weekIndex(57, 51)).isZero();
        assertThat(policy.weekIndex(58, 51)).isEqualTo(1);
        assertThat(policy.weekIndex(415, 51)).isEqualTo(51);
        assertThat(policy.forDay(64, 51)).isEqualTo(policy.week(1));
    }

    @Test
    void singlePolicyCoversTheWholeHorizon() {
        PolicyParameters defaults = PolicyParameters.defaults();
        WeeklyPolicy policy = WeeklyPolicy.single(defaults);

        assertThat(policy.isWeekly()).isFalse();
        assertThat(policy.forDay(400, 51)).isEqualTo(defaults);
        assertThat(policy.representative()).isEqualTo(defaults);
    }

    @Test
    void weeksAreCopiedOnConstruction() {
        PolicyParameters week = PolicyParameters.defaults();
        WeeklyPolicy policy = WeeklyPolicy.uniform(week, 3);

        week.setReorderPoint(999);

        assertThat(policy.weeks()).hasSize(3).allMatch(w -> w.getReorderPoint() == 400);
    }

    @Test
    void clampAppliesToEveryWeek() {
        PolicyParameters wild = PolicyParameters.defaults().toBuilder().reorderPoint(5000).build();
        WeeklyPolicy policy = new WeeklyPolicy(List.of(PolicyParameters.defaults(), wild));

        WeeklyPolicy clamped = policy.clamp();

        assertThat(clamped.week(1).getReorderPoint()).isEqualTo(600);
        assertThat(policy.week(1).getReorderPoint()).isEqualTo(5000);
    }

    @Test
    void emptyPolicyIsRejected() {
        assertThatThrownBy(() -> new WeeklyPolicy(Collections.emptyList()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
