package com.commodityforecast.model;

import org.apache.commons.math3.linear.RealMatrix;

import java.time.LocalDate;
import java.util.List;

/**
 * {@code dY_t = c + alpha beta' Y_{t-1} + sum Gamma_i dY_{t-i} + u_t}. {@code lagOrder} is the
 * order of the equivalent levels VAR, so {@code shortRun} holds {@code lagOrder - 1} matrices.
 */
public record VecmModel(
    String modelId,
    List<String> variables,
    int lagOrder,
    int rank,
    double[] intercept,
    RealMatrix alpha,
    RealMatrix beta,
    List<RealMatrix> shortRun,
    LinearSystem levelsSystem,
    RealMatrix residualCovariance,
    List<double[]> recentLevels,
    LocalDate lastObservationDate,
    int observations,
    ModelDiagnostics diagnostics
) implements MeanForecastModel {

    public VecmModel {
        variables = List.copyOf(variables);
        intercept = intercept.clone();
        alpha = alpha.copy();
        beta = beta.copy();
        shortRun = shortRun.stream().map(RealMatrix::copy).toList();
        residualCovariance = residualCovariance.copy();
        recentLevels = recentLevels.stream().map(double[]::clone).toList();
    }

    @Override
    public ModelVariant variant() {
        return ModelVariant.VECM;
    }

    @Override
    public RealMatrix residualCovariance() {
        return residualCovariance.copy();
    }

    public RealMatrix alpha() {
        return alpha.copy();
    }

    public RealMatrix beta() {
        return beta.copy();
    }

    /** Long-run impact matrix {@code alpha beta'}. */
    public RealMatrix longRun() {
        return alpha.multiply(beta.transpose());
    }
}
