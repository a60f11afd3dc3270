package com.commodityforecast.model;

import com.commodityforecast.config.InformationCriterion;
import org.apache.commons.math3.linear.RealMatrix;

import java.time.LocalDate;
import java.util.List;

/**
 * Vector autoregression on levels or on first differences. {@code estimatedSystem} holds the
 * coefficients on the scale they were estimated; {@code levelsSystem} is the equivalent levels form.
 */
public record VarModel(
    String modelId,
    ModelVariant variant,
    List<String> variables,
    int lagOrder,
    InformationCriterion criterion,
    LinearSystem estimatedSystem,
    LinearSystem levelsSystem,
    RealMatrix residualCovariance,
    List<double[]> recentLevels,
    LocalDate lastObservationDate,
    int observations,
    ModelDiagnostics diagnostics
) implements MeanForecastModel {

    public VarModel {
        variables = List.copyOf(variables);
        residualCovariance = residualCovariance.copy();
        recentLevels = recentLevels.stream().map(double[]::clone).toList();
    }

    @Override
    public RealMatrix residualCovariance() {
        return residualCovariance.copy();
    }

    public boolean differenced() {
        return variant == ModelVariant.VAR_DIFFERENCED;
    }
}
