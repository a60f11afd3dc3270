package com.commodityforecast.dto;

import com.commodityforecast.config.AnalysisConfig;
import com.commodityforecast.config.CausalityCorrection;
import com.commodityforecast.config.GarchOrder;
import com.commodityforecast.config.InformationCriterion;
import com.commodityforecast.config.ResidualDistribution;
import com.commodityforecast.config.RiskThresholds;
import com.commodityforecast.model.GapPolicy;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-request changes to the service defaults. Only non-null fields are applied.
 */
@Value
@Builder
@Jacksonized
public class AnalysisOverrides {

    @Min(value = 1, message = "maxLagOrder must be >= 1")
    @Max(value = 24, message = "maxLagOrder must be <= 24")
    Integer maxLagOrder;

    InformationCriterion informationCriterion;

    @DecimalMin(value = "0.5", inclusive = false, message = "confidenceLevel must be > 0.5")
    @DecimalMax(value = "1.0", inclusive = false, message = "confidenceLevel must be < 1")
    Double confidenceLevel;

    @Min(value = 1, message = "garchP must be >= 1")
    @Max(value = 3, message = "garchP must be <= 3")
    Integer garchP;

    @Min(value = 1, message = "garchQ must be >= 1")
    @Max(value = 3, message = "garchQ must be <= 3")
    Integer garchQ;

    @Min(value = 10, message = "minObservations must be >= 10")
    Integer minObservations;

    @Positive(message = "riskLowUpper must be > 0")
    Double riskLowUpper;

    @Positive(message = "riskMediumUpper must be > 0")
    Double riskMediumUpper;

    @PositiveOrZero(message = "holdingCostRate must be >= 0")
    Double holdingCostRate;

    @PositiveOrZero(message = "orderingCost must be >= 0")
    Double orderingCost;

    Double significanceLevel;
    Double cointegrationSignificance;
    CausalityCorrection causalityCorrection;
    ResidualDistribution residualDistribution;
    Double studentTDegreesOfFreedom;
    GapPolicy gapPolicy;
    Integer maxIterations;

    @Positive(message = "fitTimeoutSeconds must be > 0")
    Long fitTimeoutSeconds;

    Double periodsPerYear;
    Double riskTolerance;

    @PositiveOrZero(message = "hedgeCostRate must be >= 0")
    Double hedgeCostRate;

    Double minOrderQuantity;
    Double maxOrderQuantity;
    Integer quantityGridSize;

    @PositiveOrZero(message = "workingCapitalRate must be >= 0")
    Double workingCapitalRate;

    @PositiveOrZero(message = "reliabilityPenaltyRate must be >= 0")
    Double reliabilityPenaltyRate;

    @PositiveOrZero(message = "qualityPenaltyRate must be >= 0")
    Double qualityPenaltyRate;

    Map<String, @NotNull(message = "stress scenario shock is required") Double> stressScenarios;

    public AnalysisConfig applyTo(AnalysisConfig base) {
        AnalysisConfig.AnalysisConfigBuilder b = base.toBuilder();
        if (maxLagOrder != null) b.maxLagOrder(maxLagOrder);
        if (informationCriterion != null) b.informationCriterion(informationCriterion);
        if (confidenceLevel != null) b.confidenceLevel(confidenceLevel);
        if (garchP != null || garchQ != null) {
            GarchOrder current = base.getGarchOrder();
            b.garchOrder(GarchOrder.of(garchP != null ? garchP : current.p(), garchQ != null ? garchQ : current.q()));
        }
        if (minObservations != null) b.minObservations(minObservations);
        if (riskLowUpper != null || riskMediumUpper != null) {
            RiskThresholds current = base.getRiskThresholds();
            b.riskThresholds(new RiskThresholds(
                riskLowUpper != null ? riskLowUpper : current.lowUpper(),
                riskMediumUpper != null ? riskMediumUpper : current.mediumUpper()));
        }
        if (holdingCostRate != null) b.holdingCostRate(holdingCostRate);
        if (orderingCost != null) b.orderingCost(orderingCost);
        if (significanceLevel != null) b.significanceLevel(significanceLevel);
        if (cointegrationSignificance != null) b.cointegrationSignificance(cointegrationSignificance);
        if (causalityCorrection != null) b.causalityCorrection(causalityCorrection);
        if (residualDistribution != null) b.residualDistribution(residualDistribution);
        if (studentTDegreesOfFreedom != null) b.studentTDegreesOfFreedom(studentTDegreesOfFreedom);
        if (gapPolicy != null) b.gapPolicy(gapPolicy);
        if (maxIterations != null) b.maxIterations(maxIterations);
        if (fitTimeoutSeconds != null) b.fitTimeout(Duration.ofSeconds(fitTimeoutSeconds));
        if (periodsPerYear != null) b.periodsPerYear(periodsPerYear);
        if (riskTolerance != null) b.riskTolerance(riskTolerance);
        if (hedgeCostRate != null) b.hedgeCostRate(hedgeCostRate);
        if (minOrderQuantity != null) b.minOrderQuantity(minOrderQuantity);
        if (maxOrderQuantity != null) b.maxOrderQuantity(maxOrderQuantity);
        if (quantityGridSize != null) b.quantityGridSize(quantityGridSize);
        if (workingCapitalRate != null) b.workingCapitalRate(workingCapitalRate);
        if (reliabilityPenaltyRate != null) b.reliabilityPenaltyRate(reliabilityPenaltyRate);
        if (qualityPenaltyRate != null) b.qualityPenaltyRate(qualityPenaltyRate);
        if (stressScenarios != null && !stressScenarios.isEmpty()) {
            b.stressScenarios(Collections.unmodifiableMap(new LinkedHashMap<>(stressScenarios)));
        }
        return b.build().validate();
    }
}
