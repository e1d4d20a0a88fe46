package com.medica.factory.domain;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only daily time series owned by a single run.
 */
public class SimulationHistory {

    private final Map<HistoryMetric, List<DailyMetric>> series = new EnumMap<>(HistoryMetric.class);
    @Getter
    private final List<StrategyAction> actionsPerformed = new ArrayList<>();
    @Getter
    private final List<PolicyChange> policyChanges = new ArrayList<>();

    public SimulationHistory() {
        for (HistoryMetric metric : HistoryMetric.values()) {
            series.put(metric, new ArrayList<>());
        }
    }

    public void record(HistoryMetric metric, int day, double value) {
        series.get(metric).add(new DailyMetric(day, value));
    }

    public List<DailyMetric> series(HistoryMetric metric) {
        return Collections.unmodifiableList(series.get(metric));
    }

    public double last(HistoryMetric metric, double fallback) {
        List<DailyMetric> values = series.get(metric);
        return values.isEmpty() ? fallback : values.get(values.size() - 1).getValue();
    }

    public double average(HistoryMetric metric) {
        return series.get(metric).stream().mapToDouble(DailyMetric::getValue).average().orElse(0);
    }

    public double sum(HistoryMetric metric) {
        return series.get(metric).stream().mapToDouble(DailyMetric::getValue).sum();
    }

    public int days() {
        return series.get(HistoryMetric.CASH).size();
    }

    public SimulationHistory copy() {
        SimulationHistory copy = new SimulationHistory();
        series.forEach((metric, values) -> values.forEach(v -> copy.record(metric, v.getDay(), v.getValue())));
        copy.actionsPerformed.addAll(actionsPerformed);
        copy.policyChanges.addAll(policyChanges);
        return copy;
    }
}
