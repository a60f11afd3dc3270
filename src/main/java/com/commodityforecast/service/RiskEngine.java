package com.commodityforecast.service;

import com.commodityforecast.config.AnalysisConfig;
import com.commodityforecast.config.ResidualDistribution;
import com.commodityforecast.config.RiskThresholds;
import com.commodityforecast.exception.InvalidInputException;
import com.commodityforecast.model.Forecast;
import com.commodityforecast.model.HedgeRecommendation;
import com.commodityforecast.model.HedgeStrategy;
import com.commodityforecast.model.RiskAssessment;
import com.commodityforecast.model.RiskLevel;
import com.commodityforecast.model.VolatilityPath;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.TDistribution;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns a price forecast and a volatility path into VaR, stress and hedging figures for an
 * exposure measured in commodity units.
 */
@Slf4j
@Service
public class RiskEngine {

    static final String STAGE = "risk";

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution();

    /**
     * Parametric VaR of one unit over the whole path: {@code P_ref * q * sqrt(sum sigma2_h)}.
     */
    public double computeVaR(Forecast forecast, VolatilityPath path, double confidenceLevel) {
        requireConfidence(confidenceLevel);
        return referencePrice(forecast, path.getVariable()) * quantile(path, confidenceLevel)
            * Math.sqrt(path.cumulativeVariance());
    }

    /**
     * Expected loss of one unit beyond the VaR at the same level.
     */
    public double expectedShortfall(Forecast forecast, VolatilityPath path, double confidenceLevel) {
        requireConfidence(confidenceLevel);
        return referencePrice(forecast, path.getVariable()) * tailExpectation(path, confidenceLevel)
            * Math.sqrt(path.cumulativeVariance());
    }

    /**
     * Each shock is applied on its own to the reference price of the forecast's primary variable.
     */
    public Map<String, Double> stressTest(Forecast forecast, Map<String, Double> scenarios, double exposure) {
        requireExposure(exposure);
        double reference = referencePrice(forecast, forecast.primary().getVariable());
        Map<String, Double> deltas = new LinkedHashMap<>();
        scenarios.forEach((name, shock) -> deltas.put(name, exposure * shock * reference));
        return Collections.unmodifiableMap(deltas);
    }

    public HedgeRecommendation recommendHedge(VolatilityPath path, double exposure, double referencePrice,
                                              AnalysisConfig config) {
        requireExposure(exposure);
        double ratio = clamp(path.annualizedVolatility() / config.getRiskTolerance(), 0.0, 1.0);
        double quantity = ratio * exposure;
        return HedgeRecommendation.builder()
            .ratio(ratio)
            .quantity(quantity)
            .strategy(HedgeStrategy.forRatio(ratio))
            .estimatedCost(config.getHedgeCostRate() * quantity * referencePrice)
            .build();
    }

    public RiskLevel classify(double annualizedVolatility, RiskThresholds thresholds) {
        if (annualizedVolatility < thresholds.lowUpper()) {
            return RiskLevel.LOW;
        }
        return annualizedVolatility < thresholds.mediumUpper() ? RiskLevel.MEDIUM : RiskLevel.HIGH;
    }

    public RiskAssessment assess(Forecast forecast, VolatilityPath path, double exposure, AnalysisConfig config) {
        requireExposure(exposure);
        double confidence = config.getConfidenceLevel();
        double reference = referencePrice(forecast, path.getVariable());
        double perUnitVaR = computeVaR(forecast, path, confidence);
        double perUnitShortfall = expectedShortfall(forecast, path, confidence);
        double annualized = path.annualizedVolatility();
        RiskLevel level = classify(annualized, config.getRiskThresholds());
        HedgeRecommendation hedge = recommendHedge(path, exposure, reference, config);

        log.info("Risk for {} x {}: VaR={} ES={} annualVol={} level={} hedge={}", exposure, path.getVariable(),
            perUnitVaR * exposure, perUnitShortfall * exposure, annualized, level, hedge.getStrategy());
        return RiskAssessment.builder()
            .forecastId(forecast.getForecastId())
            .volatilityModelId(path.getModelId())
            .variable(path.getVariable())
            .confidenceLevel(confidence)
            .exposure(exposure)
            .referencePrice(reference)
            .perUnitValueAtRisk(perUnitVaR)
            .valueAtRisk(perUnitVaR * exposure)
            .expectedShortfall(perUnitShortfall * exposure)
            .stressDeltas(stressTest(forecast, config.getStressScenarios(), exposure))
            .hedge(hedge)
            .annualizedVolatility(annualized)
            .riskLevel(level)
            .build();
    }

    /** Point forecast one step ahead, or the last observation for a horizon-0 forecast. */
    private double referencePrice(Forecast forecast, String variable) {
        boolean known = forecast.getVariables().stream().anyMatch(v -> v.getVariable().equals(variable));
        if (!known) {
            throw new InvalidInputException(STAGE, "Forecast has no path for [" + variable + "]",
                Map.of("variable", variable, "forecastId", forecast.getForecastId()));
        }
        Forecast.VariableForecast path = forecast.variable(variable);
        return path.at(Math.min(1, forecast.getHorizon())).point();
    }

    private double quantile(VolatilityPath path, double confidenceLevel) {
        if (path.getDistribution() == ResidualDistribution.STUDENT_T) {
            double nu = path.getDegreesOfFreedom();
            return new TDistribution(nu).inverseCumulativeProbability(confidenceLevel) * Math.sqrt((nu - 2.0) / nu);
        }
        return STANDARD_NORMAL.inverseCumulativeProbability(confidenceLevel);
    }

    private double tailExpectation(VolatilityPath path, double confidenceLevel) {
        double tail = 1.0 - confidenceLevel;
        if (path.getDistribution() == ResidualDistribution.STUDENT_T) {
            double nu = path.getDegreesOfFreedom();
            TDistribution t = new TDistribution(nu);
            double x = t.inverseCumulativeProbability(confidenceLevel);
            return t.density(x) / tail * (nu + x * x) / (nu - 1.0) * Math.sqrt((nu - 2.0) / nu);
        }
        double z = STANDARD_NORMAL.inverseCumulativeProbability(confidenceLevel);
        return STANDARD_NORMAL.density(z) / tail;
    }

    private static void requireConfidence(double confidenceLevel) {
        if (!(confidenceLevel > 0.0 && confidenceLevel < 1.0)) {
            throw new InvalidInputException(STAGE, "Confidence level must be in (0, 1)",
                Map.of("confidenceLevel", confidenceLevel));
        }
    }

    private static void requireExposure(double exposure) {
        if (!(exposure >= 0.0) || Double.isInfinite(exposure)) {
            throw new InvalidInputException(STAGE, "Exposure must be a finite non-negative quantity",
                Map.of("exposure", exposure));
        }
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
