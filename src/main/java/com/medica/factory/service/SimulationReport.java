package com.medica.factory.service;

import com.medica.factory.domain.BusinessRulesReport;
import com.medica.factory.domain.SimulationResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimulationReport {
    private boolean success;
    private SimulationResult result;
    private BusinessRulesReport businessRules;
    private long executionTimeMs;
    private String errorMessage;    // set when success is false
}
