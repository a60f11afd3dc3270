package com.commodityforecast.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * How strongly each market variable moves with the target price level, by correlation and by a
 * linear regression of the target on the standardized factors.
 */
@Value
@Builder
public class FactorImpact {
    String target;
    int observations;
    /** Absent when the sample is too short for the regression or the factors are collinear. */
    Double rSquared;
    /** Descending by absolute correlation. */
    List<Factor> factors;
    List<String> topFactors;

    @Value
    @Builder
    public static class Factor {
        String variable;
        double correlation;
        ImpactStrength strength;
        Direction direction;
        /** Target units per one standard deviation of the factor; absent without a regression. */
        Double coefficient;
        /** {@link #coefficient} as a percentage of the mean target level. */
        Double percentageImpact;
    }

    public enum Direction {
        POSITIVE,
        NEGATIVE
    }
}
