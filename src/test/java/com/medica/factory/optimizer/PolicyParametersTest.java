package com.medica.factory.optimizer;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PolicyParametersTest {

    @Test
    void defaultsMatchParameterTable() {
        PolicyParameters defaults = PolicyParameters.defaults();

        assertThat(defaults.getReorderPoint()).isEqualTo(400);
        assertThat(defaults.getTargetExperts()).isEqualTo(12);
        assertThat(defaults.getMceCustomAllocation()).isEqualTo(0.55);
        assertThat(defaults.getCustomBasePrice()).isEqualTo(110);
    }

    @Test
    void randomPoliciesRespectBounds() {
        Random random = new Random(9);
        for (int i = 0; i < 200; i++) {
            PolicyParameters policy = PolicyParameters.random(random);
            for (PolicyParameter parameter : PolicyParameter.values()) {
                double value = policy.get(parameter);
                assertThat(value).as(parameter.name()).isBetween(parameter.getMin(), parameter.getMax());
                if (parameter.isInteger()) {
                    assertThat(value).isEqualTo(Math.rint(value));
                }
            }
        }
    }

    @Test
    void clampPullsValuesBackInRange() {
        PolicyParameters wild = PolicyParameters.defaults().toBuilder()
                .reorderPoint(5000)
                .hireThreshold(-1)
                .build();

        PolicyParameters clamped = wild.clamp();

        assertThat(clamped.getReorderPoint()).isEqualTo(600);
        assertThat(clamped.getHireThreshold()).isEqualTo(0.3);
        assertThat(wild.getReorderPoint()).isEqualTo(5000);
    }

    @Test
    void integerFieldsRoundOnSet() {
        PolicyParameters policy = PolicyParameters.defaults();

        policy.set(PolicyParameter.BATCH_INTERVAL, 7.6);

        assertThat(policy.getBatchInterval()).isEqualTo(8);
    }

    @Test
    void arrayLengthIsChecked() {
        PolicyParameters policy = PolicyParameters.defaults();

        assertThat(PolicyParameters.fromArray(policy.toArray())).isEqualTo(policy);
        assertThatThrownBy(() -> PolicyParameters.fromArray(new double[14]))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
