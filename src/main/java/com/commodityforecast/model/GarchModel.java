package com.commodityforecast.model;

import com.commodityforecast.config.GarchOrder;
import com.commodityforecast.config.ResidualDistribution;

/**
 * {@code sigma2_t = omega + sum alpha_i e2_{t-i} + sum beta_j sigma2_{t-j}} fitted on demeaned returns.
 * {@code recentShocks} and {@code recentVariances} are chronological and seed the recursion.
 */
public record GarchModel(
    String modelId,
    String variable,
    GarchOrder order,
    double mean,
    double omega,
    double[] alpha,
    double[] beta,
    ResidualDistribution distribution,
    double degreesOfFreedom,
    double periodsPerYear,
    double[] recentShocks,
    double[] recentVariances,
    int observations,
    ModelDiagnostics diagnostics
) implements VolatilityModel {

    public GarchModel {
        alpha = alpha.clone();
        beta = beta.clone();
        recentShocks = recentShocks.clone();
        recentVariances = recentVariances.clone();
    }

    @Override
    public ModelVariant variant() {
        return ModelVariant.GARCH;
    }

    @Override
    public int lagOrder() {
        return Math.max(order.p(), order.q());
    }

    @Override
    public double[] alpha() {
        return alpha.clone();
    }

    @Override
    public double[] beta() {
        return beta.clone();
    }

    public double persistence() {
        double sum = 0.0;
        for (double a : alpha) {
            sum += a;
        }
        for (double b : beta) {
            sum += b;
        }
        return sum;
    }

    @Override
    public double unconditionalVariance() {
        return omega / (1.0 - persistence());
    }

    /**
     * Iterates the variance recursion, replacing unknown future squared shocks by their
     * conditional expectation.
     */
    @Override
    public double[] varianceForecast(int horizon) {
        int p = alpha.length;
        int q = beta.length;
        double[] shocks = new double[p + horizon];
        double[] variances = new double[q + horizon];
        System.arraycopy(recentShocks, 0, shocks, 0, p);
        for (int i = 0; i < p; i++) {
            shocks[i] = shocks[i] * shocks[i];
        }
        System.arraycopy(recentVariances, 0, variances, 0, q);

        double[] path = new double[horizon];
        for (int h = 0; h < horizon; h++) {
            double next = omega;
            for (int i = 1; i <= p; i++) {
                next += alpha[i - 1] * shocks[p + h - i];
            }
            for (int j = 1; j <= q; j++) {
                next += beta[j - 1] * variances[q + h - j];
            }
            path[h] = next;
            shocks[p + h] = next;
            variances[q + h] = next;
        }
        return path;
    }
}
