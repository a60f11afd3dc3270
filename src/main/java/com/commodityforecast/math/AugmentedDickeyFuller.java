package com.commodityforecast.math;

import com.commodityforecast.model.CriticalValues;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;

/**
 * Augmented Dickey-Fuller regression with a constant,
 * {@code dy_t = a + gamma y_{t-1} + sum phi_i dy_{t-i} + e_t}, with the lag count chosen by AIC.
 * P-values use MacKinnon's (1994) response surfaces and critical values his 2010 tables.
 * {@code regressors} is 1 for a plain unit-root test and 2 for Engle-Granger residuals.
 */
public final class AugmentedDickeyFuller {

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution();

    private static final double[] TAU_MAX = {2.74, 0.92};
    private static final double[] TAU_MIN = {-18.83, -18.86};
    private static final double[] TAU_STAR = {-1.61, -2.62};
    private static final double[][] TAU_SMALL_P = {
        {2.1659, 1.4412, 0.038269},
        {2.92, 1.5012, 0.039796}
    };
    private static final double[][] TAU_LARGE_P = {
        {1.7339, 0.93202, -0.12745, -0.010368},
        {2.1945, 0.64695, -0.29198, -0.042377}
    };
    // rows: 1%, 5%, 10%; columns: beta_inf, beta_1 / T, beta_2 / T^2, beta_3 / T^3
    private static final double[][][] TAU_2010 = {
        {
            {-3.43035, -6.5393, -16.786, -79.433},
            {-2.86154, -2.8903, -4.234, -40.040},
            {-2.56677, -1.5384, -2.809, 0.0}
        },
        {
            {-3.89644, -10.9519, -33.527, 0.0},
            {-3.33613, -6.1101, -6.823, 0.0},
            {-3.04445, -4.2412, -2.720, 0.0}
        }
    };

    private AugmentedDickeyFuller() {
    }

    /**
     * @throws org.apache.commons.math3.linear.SingularMatrixException for degenerate input
     */
    public static Outcome test(double[] y, int maxLag, int regressors) {
        int bestLag = 0;
        double bestAic = Double.POSITIVE_INFINITY;
        // common sample so the criteria are comparable
        for (int lag = 0; lag <= maxLag; lag++) {
            Regression r = regress(y, lag, maxLag + 1);
            double aic = r.observations() * Math.log(r.rss() / r.observations()) + 2.0 * (lag + 2);
            if (aic < bestAic - 1e-12) {
                bestAic = aic;
                bestLag = lag;
            }
        }
        Regression full = regress(y, bestLag, bestLag + 1);
        double statistic = full.tStatistic();
        return new Outcome(statistic, pValue(statistic, regressors), bestLag, full.observations(),
            criticalValues(full.observations(), regressors));
    }

    public static double pValue(double statistic, int regressors) {
        int n = regressors - 1;
        if (statistic > TAU_MAX[n]) {
            return 1.0;
        }
        if (statistic < TAU_MIN[n]) {
            return 0.0;
        }
        double[] coefficients = statistic <= TAU_STAR[n] ? TAU_SMALL_P[n] : TAU_LARGE_P[n];
        return STANDARD_NORMAL.cumulativeProbability(polynomial(coefficients, statistic));
    }

    public static CriticalValues criticalValues(int observations, int regressors) {
        double[][] table = TAU_2010[regressors - 1];
        double inverse = 1.0 / observations;
        return new CriticalValues(
            polynomial(table[0], inverse),
            polynomial(table[1], inverse),
            polynomial(table[2], inverse));
    }

    private static double polynomial(double[] coefficients, double x) {
        double value = 0.0;
        for (int i = coefficients.length - 1; i >= 0; i--) {
            value = value * x + coefficients[i];
        }
        return value;
    }

    private static Regression regress(double[] y, int lags, int start) {
        int n = y.length - start;
        double[] dy = new double[n];
        double[][] x = new double[n][1 + lags];
        for (int t = start; t < y.length; t++) {
            int row = t - start;
            dy[row] = y[t] - y[t - 1];
            x[row][0] = y[t - 1];
            for (int i = 1; i <= lags; i++) {
                x[row][i] = y[t - i] - y[t - i - 1];
            }
        }
        OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression();
        ols.newSampleData(dy, x);
        double[] beta = ols.estimateRegressionParameters();
        double[] stderr = ols.estimateRegressionParametersStandardErrors();
        // index 0 is the intercept
        return new Regression(beta[1] / stderr[1], ols.calculateResidualSumOfSquares(), n);
    }

    private record Regression(double tStatistic, double rss, int observations) {
    }

    public record Outcome(double statistic, double pValue, int lagsUsed, int observations,
                          CriticalValues criticalValues) {
    }
}
