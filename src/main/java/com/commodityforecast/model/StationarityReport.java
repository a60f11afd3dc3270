package com.commodityforecast.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class StationarityReport {
    double significanceLevel;
    List<VariableStationarity> variables;

    public VariableStationarity variable(String name) {
        return variables.stream()
            .filter(v -> v.getVariable().equals(name))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("No stationarity result for " + name));
    }

    public boolean allStationary() {
        return variables.stream().allMatch(VariableStationarity::isStationary);
    }

    public boolean noneStationary() {
        return variables.stream().noneMatch(VariableStationarity::isStationary);
    }

    @Value
    @Builder
    public static class VariableStationarity {
        String variable;
        double adfStatistic;
        double pValue;
        int lagsUsed;
        int observations;
        CriticalValues criticalValues;
        boolean stationary;
        /** 0 when stationary in levels, otherwise 1 or 2. */
        int differencingOrder;
    }
}
