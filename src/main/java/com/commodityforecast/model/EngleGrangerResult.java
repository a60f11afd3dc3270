package com.commodityforecast.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class EngleGrangerResult {
    String target;
    String other;
    double intercept;
    /** Slope of the target on the other variable in the first-step regression. */
    double hedgeCoefficient;
    double adfStatistic;
    double pValue;
    int lagsUsed;
    boolean cointegrated;
}
