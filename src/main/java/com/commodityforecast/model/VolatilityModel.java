package com.commodityforecast.model;

import com.commodityforecast.config.ResidualDistribution;

public sealed interface VolatilityModel extends FittedModel permits GarchModel {

    String variable();

    ResidualDistribution distribution();

    double degreesOfFreedom();

    double periodsPerYear();

    double unconditionalVariance();

    /** Conditional variances for steps 1..horizon. */
    double[] varianceForecast(int horizon);
}
