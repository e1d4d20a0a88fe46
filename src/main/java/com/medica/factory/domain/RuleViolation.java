package com.medica.factory.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RuleViolation {
    private String rule;
    private Severity severity;
    private String message;
    private double actual;
    private double limit;
}
