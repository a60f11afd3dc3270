package com.commodityforecast.config;

import com.commodityforecast.exception.InvalidInputException;
import com.commodityforecast.model.GapPolicy;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Every tunable the engines read. Passed explicitly into each fit/optimize call; there are no
 * process-wide defaults besides the ones {@link AnalysisProperties} seeds a request with.
 */
@Value
@Builder(toBuilder = true)
public class AnalysisConfig {

    private static final String STAGE = "configuration";

    @Builder.Default
    int maxLagOrder = 8;

    @Builder.Default
    InformationCriterion informationCriterion = InformationCriterion.AIC;

    @Builder.Default
    double confidenceLevel = 0.95;

    @Builder.Default
    GarchOrder garchOrder = GarchOrder.of(1, 1);

    @Builder.Default
    int minObservations = 30;

    @Builder.Default
    RiskThresholds riskThresholds = new RiskThresholds(0.15, 0.30);

    /** Holding cost per period as a fraction of unit value. */
    @Builder.Default
    double holdingCostRate = 0.0007;

    @Builder.Default
    double orderingCost = 25_000.0;

    @Builder.Default
    double significanceLevel = 0.05;

    /** One of 0.10, 0.05, 0.01. */
    @Builder.Default
    double cointegrationSignificance = 0.05;

    @Builder.Default
    CausalityCorrection causalityCorrection = CausalityCorrection.BONFERRONI;

    @Builder.Default
    ResidualDistribution residualDistribution = ResidualDistribution.NORMAL;

    @Builder.Default
    double studentTDegreesOfFreedom = 6.0;

    @Builder.Default
    GapPolicy gapPolicy = GapPolicy.FORWARD_FILL;

    @Builder.Default
    int maxIterations = 5_000;

    @Builder.Default
    Duration fitTimeout = Duration.ofSeconds(30);

    @Builder.Default
    double periodsPerYear = 252.0;

    /** Annualized volatility at which the full exposure is hedged. */
    @Builder.Default
    double riskTolerance = 0.40;

    @Builder.Default
    double hedgeCostRate = 0.025;

    @Builder.Default
    double minOrderQuantity = 0.0;

    /** Storage or contract capacity; {@code null} means unconstrained. */
    Double maxOrderQuantity;

    @Builder.Default
    int quantityGridSize = 50;

    /** Annual cost of capital used to value supplier payment terms. */
    @Builder.Default
    double workingCapitalRate = 0.12;

    @Builder.Default
    double reliabilityPenaltyRate = 0.10;

    @Builder.Default
    double qualityPenaltyRate = 0.05;

    @Builder.Default
    Map<String, Double> stressScenarios = defaultScenarios();

    public static AnalysisConfig defaults() {
        return AnalysisConfig.builder().build();
    }

    private static Map<String, Double> defaultScenarios() {
        Map<String, Double> scenarios = new LinkedHashMap<>();
        scenarios.put("supply_disruption", 0.20);
        scenarios.put("currency_depreciation", 0.10);
        scenarios.put("demand_collapse", -0.15);
        return scenarios;
    }

    public AnalysisConfig validate() {
        require(maxLagOrder >= 1, "maxLagOrder must be >= 1", "maxLagOrder", maxLagOrder);
        require(confidenceLevel > 0.5 && confidenceLevel < 1.0,
            "confidenceLevel must be in (0.5, 1)", "confidenceLevel", confidenceLevel);
        require(garchOrder != null && garchOrder.p() >= 1 && garchOrder.q() >= 1,
            "garchOrder needs p >= 1 and q >= 1", "garchOrder", String.valueOf(garchOrder));
        require(minObservations > maxLagOrder + 2,
            "minObservations must exceed maxLagOrder + 2", "minObservations", minObservations);
        require(riskThresholds != null && riskThresholds.lowUpper() > 0
                && riskThresholds.lowUpper() < riskThresholds.mediumUpper(),
            "riskThresholds must satisfy 0 < lowUpper < mediumUpper", "riskThresholds", String.valueOf(riskThresholds));
        require(holdingCostRate >= 0, "holdingCostRate must be >= 0", "holdingCostRate", holdingCostRate);
        require(orderingCost >= 0, "orderingCost must be >= 0", "orderingCost", orderingCost);
        require(significanceLevel > 0 && significanceLevel < 0.5,
            "significanceLevel must be in (0, 0.5)", "significanceLevel", significanceLevel);
        require(cointegrationSignificance == 0.10 || cointegrationSignificance == 0.05
                || cointegrationSignificance == 0.01,
            "cointegrationSignificance must be one of 0.10, 0.05, 0.01",
            "cointegrationSignificance", cointegrationSignificance);
        require(studentTDegreesOfFreedom > 2.0,
            "studentTDegreesOfFreedom must be > 2", "studentTDegreesOfFreedom", studentTDegreesOfFreedom);
        require(maxIterations >= 100, "maxIterations must be >= 100", "maxIterations", maxIterations);
        require(fitTimeout != null && !fitTimeout.isNegative() && !fitTimeout.isZero(),
            "fitTimeout must be positive", "fitTimeout", String.valueOf(fitTimeout));
        require(periodsPerYear > 0, "periodsPerYear must be > 0", "periodsPerYear", periodsPerYear);
        require(riskTolerance > 0, "riskTolerance must be > 0", "riskTolerance", riskTolerance);
        require(minOrderQuantity >= 0, "minOrderQuantity must be >= 0", "minOrderQuantity", minOrderQuantity);
        require(maxOrderQuantity == null || maxOrderQuantity > 0,
            "maxOrderQuantity must be > 0 when set", "maxOrderQuantity", String.valueOf(maxOrderQuantity));
        require(quantityGridSize >= 2, "quantityGridSize must be >= 2", "quantityGridSize", quantityGridSize);
        require(hedgeCostRate >= 0, "hedgeCostRate must be >= 0", "hedgeCostRate", hedgeCostRate);
        require(workingCapitalRate >= 0, "workingCapitalRate must be >= 0", "workingCapitalRate", workingCapitalRate);
        require(reliabilityPenaltyRate >= 0,
            "reliabilityPenaltyRate must be >= 0", "reliabilityPenaltyRate", reliabilityPenaltyRate);
        require(qualityPenaltyRate >= 0, "qualityPenaltyRate must be >= 0", "qualityPenaltyRate", qualityPenaltyRate);
        require(stressScenarios != null, "stressScenarios must be set", "stressScenarios", "null");
        stressScenarios.forEach((name, shock) -> require(shock != null && Double.isFinite(shock),
            "stress scenario shocks must be finite numbers", "stressScenario", String.valueOf(name)));
        return this;
    }

    private static void require(boolean condition, String message, String parameter, Object value) {
        if (!condition) {
            throw new InvalidInputException(STAGE, message, Map.of(parameter, value));
        }
    }
}
