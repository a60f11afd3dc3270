package com.commodityforecast.model;

import com.commodityforecast.config.ResidualDistribution;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class VolatilityPath {
    String modelId;
    String variable;
    /** Per-period conditional variances for steps 1..horizon. */
    List<Double> conditionalVariances;
    double oneStepVariance;
    double unconditionalVariance;
    ResidualDistribution distribution;
    double degreesOfFreedom;
    double periodsPerYear;

    public int horizon() {
        return conditionalVariances.size();
    }

    public double cumulativeVariance() {
        return conditionalVariances.stream().mapToDouble(Double::doubleValue).sum();
    }

    /** Annualized from the mean per-period variance over the path; the one-step variance for horizon 0. */
    public double annualizedVolatility() {
        double meanVariance = conditionalVariances.isEmpty()
            ? oneStepVariance
            : cumulativeVariance() / conditionalVariances.size();
        return Math.sqrt(meanVariance * periodsPerYear);
    }
}
