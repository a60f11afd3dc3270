package com.commodityforecast.config;

public enum InformationCriterion {
    AIC,
    BIC;

    /**
     * Penalised log-determinant criterion for a system with {@code parameters} free coefficients.
     */
    public double evaluate(double logDetSigma, int parameters, int observations) {
        double penalty = this == AIC ? 2.0 : Math.log(observations);
        return logDetSigma + penalty * parameters / observations;
    }
}
