package com.commodityforecast.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class RiskAssessment {
    String forecastId;
    String volatilityModelId;
    String variable;
    double confidenceLevel;
    double exposure;
    double referencePrice;
    double perUnitValueAtRisk;
    double valueAtRisk;
    double expectedShortfall;
    /** Scenario name to monetary impact on the exposure, in scenario order. */
    Map<String, Double> stressDeltas;
    HedgeRecommendation hedge;
    double annualizedVolatility;
    RiskLevel riskLevel;
}
