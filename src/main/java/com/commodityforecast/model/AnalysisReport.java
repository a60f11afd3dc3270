package com.commodityforecast.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AnalysisReport {
    StationarityReport stationarity;
    /** Absent when the mean model was chosen without a rank test. */
    CointegrationResult cointegration;
    List<EngleGrangerResult> pairwiseCointegration;
    /** Absent for a single-variable run. */
    CausalityResult causality;
    List<String> drivers;
    MeanForecastModel meanModel;
    GarchModel volatilityModel;
    Forecast forecast;
    ImpulseResponse impulseResponse;
    VolatilityPath volatility;
    RiskAssessment risk;
    ProcurementPlan plan;
    /** Absent for a single-variable run. */
    FactorImpact factorImpact;
}
