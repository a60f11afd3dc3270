package com.commodityforecast.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Johansen rank test outcome. {@code vectors.get(i)} is the i-th cointegrating vector, ordered by
 * descending eigenvalue and scaled so its first element is 1; {@code constants.get(i)} is the
 * intercept of that relation, {@code beta_i' y + constants_i} being stationary.
 */
@Value
@Builder
public class CointegrationResult {
    List<String> variables;
    int rank;
    int lagOrder;
    double significanceLevel;
    List<Double> eigenvalues;
    List<List<Double>> vectors;
    List<Double> constants;
    List<Double> traceStatistics;
    List<Double> traceCriticalValues;
    List<Double> maxEigenStatistics;
    List<Double> maxEigenCriticalValues;

    public int dimension() {
        return variables.size();
    }

    /**
     * Mean model implied by the rank: no relation means differences, full rank means the
     * levels are already stationary.
     */
    public ModelVariant recommendedVariant() {
        if (rank == 0) {
            return ModelVariant.VAR_DIFFERENCED;
        }
        return rank < dimension() ? ModelVariant.VECM : ModelVariant.VAR_LEVELS;
    }
}
