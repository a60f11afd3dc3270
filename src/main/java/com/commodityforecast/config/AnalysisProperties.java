package com.commodityforecast.config;

import com.commodityforecast.model.GapPolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Service-wide defaults bound from {@code analysis.*}. Requests start from {@link #toConfig()} and
 * may override individual values; nothing reads these properties after that.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "analysis")
public class AnalysisProperties {

    private int maxLagOrder = 8;
    private InformationCriterion informationCriterion = InformationCriterion.AIC;
    private double confidenceLevel = 0.95;
    private int garchP = 1;
    private int garchQ = 1;
    private int minObservations = 30;
    private double riskLowUpper = 0.15;
    private double riskMediumUpper = 0.30;
    private double holdingCostRate = 0.0007;
    private double orderingCost = 25_000.0;
    private double significanceLevel = 0.05;
    private double cointegrationSignificance = 0.05;
    private CausalityCorrection causalityCorrection = CausalityCorrection.BONFERRONI;
    private ResidualDistribution residualDistribution = ResidualDistribution.NORMAL;
    private double studentTDegreesOfFreedom = 6.0;
    private GapPolicy gapPolicy = GapPolicy.FORWARD_FILL;
    private int maxIterations = 5_000;
    private Duration fitTimeout = Duration.ofSeconds(30);
    private double periodsPerYear = 252.0;
    private double riskTolerance = 0.40;
    private double hedgeCostRate = 0.025;
    private double minOrderQuantity = 0.0;
    private Double maxOrderQuantity;
    private int quantityGridSize = 50;
    private double workingCapitalRate = 0.12;
    private double reliabilityPenaltyRate = 0.10;
    private double qualityPenaltyRate = 0.05;
    private Map<String, Double> stressScenarios = new LinkedHashMap<>();

    public AnalysisConfig toConfig() {
        AnalysisConfig.AnalysisConfigBuilder builder = AnalysisConfig.builder()
            .maxLagOrder(maxLagOrder)
            .informationCriterion(informationCriterion)
            .confidenceLevel(confidenceLevel)
            .garchOrder(GarchOrder.of(garchP, garchQ))
            .minObservations(minObservations)
            .riskThresholds(new RiskThresholds(riskLowUpper, riskMediumUpper))
            .holdingCostRate(holdingCostRate)
            .orderingCost(orderingCost)
            .significanceLevel(significanceLevel)
            .cointegrationSignificance(cointegrationSignificance)
            .causalityCorrection(causalityCorrection)
            .residualDistribution(residualDistribution)
            .studentTDegreesOfFreedom(studentTDegreesOfFreedom)
            .gapPolicy(gapPolicy)
            .maxIterations(maxIterations)
            .fitTimeout(fitTimeout)
            .periodsPerYear(periodsPerYear)
            .riskTolerance(riskTolerance)
            .hedgeCostRate(hedgeCostRate)
            .minOrderQuantity(minOrderQuantity)
            .maxOrderQuantity(maxOrderQuantity)
            .quantityGridSize(quantityGridSize)
            .workingCapitalRate(workingCapitalRate)
            .reliabilityPenaltyRate(reliabilityPenaltyRate)
            .qualityPenaltyRate(qualityPenaltyRate);
        if (!stressScenarios.isEmpty()) {
            builder.stressScenarios(Collections.unmodifiableMap(new LinkedHashMap<>(stressScenarios)));
        }
        return builder.build().validate();
    }
}
