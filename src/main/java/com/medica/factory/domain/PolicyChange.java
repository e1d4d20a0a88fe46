package com.medica.factory.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Audit entry for a recomputed policy value.
 */
@Value
@Builder
public class PolicyChange {
    int day;
    String policyName;
    double oldValue;
    double newValue;
    String reason;
    Map<String, Double> formulaInputs;
    PolicyTrigger trigger;
}
