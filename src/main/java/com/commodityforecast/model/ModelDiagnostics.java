package com.commodityforecast.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Goodness-of-fit figures attached at fit time. Informational only; nothing rejects a model
 * because of them.
 */
@Value
@Builder
public class ModelDiagnostics {
    double logLikelihood;
    double aic;
    double bic;
    int observations;
    List<ResidualTest> ljungBox;
    List<ResidualTest> jarqueBera;
    /** Largest companion-root modulus, NaN for volatility models. */
    double maxRootModulus;

    public record ResidualTest(String variable, double statistic, double pValue, int degreesOfFreedom) {
    }
}
