package com.commodityforecast.dto;

import com.commodityforecast.config.ResidualDistribution;
import com.commodityforecast.model.CausalityResult;
import com.commodityforecast.model.CointegrationResult;
import com.commodityforecast.model.EngleGrangerResult;
import com.commodityforecast.model.FactorImpact;
import com.commodityforecast.model.Forecast;
import com.commodityforecast.model.ImpulseResponse;
import com.commodityforecast.model.ModelDiagnostics;
import com.commodityforecast.model.ModelVariant;
import com.commodityforecast.model.ProcurementPlan;
import com.commodityforecast.model.RiskAssessment;
import com.commodityforecast.model.StationarityReport;
import com.commodityforecast.model.VolatilityPath;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisResponse {
    String target;
    int horizon;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant generatedAt;

    StationarityReport stationarity;
    CointegrationResult cointegration;
    List<EngleGrangerResult> pairwiseCointegration;
    CausalityResult causality;
    List<String> drivers;

    MeanModelSummary meanModel;
    VolatilityModelSummary volatilityModel;

    Forecast forecast;
    ImpulseResponse impulseResponse;
    VolatilityPath volatility;
    RiskAssessment risk;
    ProcurementPlan plan;
    FactorImpact factorImpact;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class MeanModelSummary {
        String modelId;
        ModelVariant variant;
        List<String> variables;
        int lagOrder;
        /** Cointegration rank, only for error-correction models. */
        Integer rank;
        LocalDate lastObservationDate;
        ModelDiagnostics diagnostics;
    }

    @Value
    @Builder
    public static class VolatilityModelSummary {
        String modelId;
        String variable;
        int p;
        int q;
        double mean;
        double omega;
        List<Double> alpha;
        List<Double> beta;
        double persistence;
        double unconditionalVariance;
        ResidualDistribution distribution;
        double degreesOfFreedom;
        ModelDiagnostics diagnostics;
    }
}
