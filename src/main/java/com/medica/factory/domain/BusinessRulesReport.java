package com.medica.factory.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BusinessRulesReport {
    @Builder.Default
    private List<RuleViolation> violations = new ArrayList<>();

    /** A run is valid when nothing CRITICAL was found. */
    public boolean isValid() {
        return violations.stream().noneMatch(v -> v.getSeverity() == Severity.CRITICAL);
    }

    public long count(Severity severity) {
        return violations.stream().filter(v -> v.getSeverity() == severity).count();
    }
}
