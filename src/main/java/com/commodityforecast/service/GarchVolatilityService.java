package com.commodityforecast.service;

import com.commodityforecast.config.AnalysisConfig;
import com.commodityforecast.config.GarchOrder;
import com.commodityforecast.config.ResidualDistribution;
import com.commodityforecast.exception.InsufficientDataException;
import com.commodityforecast.exception.InvalidInputException;
import com.commodityforecast.exception.NonConvergentFitException;
import com.commodityforecast.math.BoundedOptimizer;
import com.commodityforecast.math.OptimizationBudget;
import com.commodityforecast.math.ResidualTests;
import com.commodityforecast.model.GarchModel;
import com.commodityforecast.model.ModelDiagnostics;
import com.commodityforecast.model.SeriesKind;
import com.commodityforecast.model.TimeSeries;
import com.commodityforecast.model.VolatilityModel;
import com.commodityforecast.model.VolatilityPath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.special.Gamma;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * GARCH(p,q) by maximum likelihood on demeaned returns. The intercept is searched as a fraction
 * of the sample variance so all parameters share the unit box.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GarchVolatilityService {

    static final String STAGE = "volatility";

    /** Parameter sets at or above this persistence are treated as non-stationary. */
    static final double STATIONARITY_BOUND = 0.9999;

    private static final double PENALTY = 1e10;
    private static final double MIN_OMEGA_FRACTION = 1e-6;

    private final BoundedOptimizer optimizer;

    public GarchModel fit(TimeSeries returns, AnalysisConfig config) {
        GarchOrder order = config.getGarchOrder();
        return fit(returns, order.p(), order.q(), config);
    }

    public GarchModel fit(TimeSeries returns, int p, int q, AnalysisConfig config) {
        if (returns.getKind() != SeriesKind.RETURN) {
            throw new InvalidInputException(STAGE,
                "GARCH needs a returns series, [" + returns.getName() + "] holds " + returns.getKind(),
                Map.of("variable", returns.getName(), "kind", returns.getKind().name()));
        }
        if (p < 1 || q < 1) {
            throw new InvalidInputException(STAGE, "GARCH order needs p >= 1 and q >= 1",
                Map.of("p", p, "q", q));
        }
        if (returns.size() < config.getMinObservations()) {
            throw new InsufficientDataException(STAGE,
                "GARCH needs " + config.getMinObservations() + " returns, got " + returns.size(),
                Map.of("variable", returns.getName(), "observations", returns.size(),
                    "required", config.getMinObservations()));
        }

        double[] values = returns.getValues();
        double mean = Arrays.stream(values).average().orElseThrow();
        double[] shocks = Arrays.stream(values).map(v -> v - mean).toArray();
        double sampleVariance = Arrays.stream(shocks).map(e -> e * e).average().orElseThrow();
        if (sampleVariance <= 0.0) {
            throw new InvalidInputException(STAGE, "Returns of [" + returns.getName() + "] are constant",
                Map.of("variable", returns.getName()));
        }

        ResidualDistribution distribution = config.getResidualDistribution();
        double nu = config.getStudentTDegreesOfFreedom();
        Likelihood likelihood = new Likelihood(shocks, sampleVariance, p, q, distribution, nu);

        int dimension = 1 + p + q;
        double[] start = new double[dimension];
        double[] lower = new double[dimension];
        double[] upper = new double[dimension];
        Arrays.fill(upper, 1.0);
        start[0] = 0.1;
        lower[0] = MIN_OMEGA_FRACTION;
        Arrays.fill(start, 1, 1 + p, 0.1 / p);
        Arrays.fill(start, 1 + p, dimension, 0.8 / q);

        BoundedOptimizer.Result result = optimizer.minimize(
            point -> likelihood.penalised(point), start, lower, upper,
            new OptimizationBudget(STAGE, config.getMaxIterations(), config.getFitTimeout()));

        double[] point = result.point();
        double omega = point[0] * sampleVariance;
        double[] alpha = Arrays.copyOfRange(point, 1, 1 + p);
        double[] beta = Arrays.copyOfRange(point, 1 + p, dimension);
        double persistence = Arrays.stream(alpha).sum() + Arrays.stream(beta).sum();
        if (persistence >= STATIONARITY_BOUND) {
            throw new NonConvergentFitException(STAGE,
                "Optimizer stopped at a non-stationary parameter set, persistence " + persistence,
                Map.of("variable", returns.getName(), "persistence", persistence, "order", GarchOrder.of(p, q).toString()));
        }

        double[] variances = likelihood.variances(omega, alpha, beta);
        double logLikelihood = likelihood.logLikelihood(variances);
        int n = shocks.length;
        int parameters = dimension + 1;
        double[] standardized = new double[n];
        for (int t = 0; t < n; t++) {
            standardized[t] = shocks[t] / Math.sqrt(variances[t]);
        }
        ModelDiagnostics diagnostics = ModelDiagnostics.builder()
            .logLikelihood(logLikelihood)
            .aic(-2.0 * logLikelihood + 2.0 * parameters)
            .bic(-2.0 * logLikelihood + Math.log(n) * parameters)
            .observations(n)
            .ljungBox(List.of(ResidualTests.ljungBox(returns.getName(), standardized,
                ResidualTests.defaultLags(n), 0)))
            .jarqueBera(List.of(ResidualTests.jarqueBera(returns.getName(), standardized)))
            .maxRootModulus(Double.NaN)
            .build();

        GarchModel model = new GarchModel(
            "garch-" + UUID.randomUUID(),
            returns.getName(),
            GarchOrder.of(p, q),
            mean,
            omega,
            alpha,
            beta,
            distribution,
            distribution == ResidualDistribution.STUDENT_T ? nu : Double.NaN,
            config.getPeriodsPerYear(),
            Arrays.copyOfRange(shocks, n - p, n),
            Arrays.copyOfRange(variances, n - q, n),
            n,
            diagnostics);
        log.info("{} fitted on {}: omega={}, persistence={}, logLik={} after {} evaluations",
            model.order(), returns.getName(), omega, persistence, logLikelihood, result.evaluations());
        return model;
    }

    public VolatilityPath forecastVolatility(VolatilityModel model, int horizon) {
        if (horizon < 0) {
            throw new InvalidInputException(STAGE, "Volatility horizon must be >= 0", Map.of("horizon", horizon));
        }
        double[] path = model.varianceForecast(Math.max(horizon, 1));
        List<Double> variances = new ArrayList<>(horizon);
        for (int h = 0; h < horizon; h++) {
            variances.add(path[h]);
        }
        return VolatilityPath.builder()
            .modelId(model.modelId())
            .variable(model.variable())
            .conditionalVariances(List.copyOf(variances))
            .oneStepVariance(path[0])
            .unconditionalVariance(model.unconditionalVariance())
            .distribution(model.distribution())
            .degreesOfFreedom(model.degreesOfFreedom())
            .periodsPerYear(model.periodsPerYear())
            .build();
    }

    /**
     * Negative log-likelihood of the variance recursion. Pre-sample squared shocks and variances
     * are set to the sample variance.
     */
    private static final class Likelihood {
        private final double[] shocks;
        private final double sampleVariance;
        private final int p;
        private final int q;
        private final ResidualDistribution distribution;
        private final double nu;
        private final double studentConstant;

        private Likelihood(double[] shocks, double sampleVariance, int p, int q,
                           ResidualDistribution distribution, double nu) {
            this.shocks = shocks;
            this.sampleVariance = sampleVariance;
            this.p = p;
            this.q = q;
            this.distribution = distribution;
            this.nu = nu;
            this.studentConstant = Gamma.logGamma((nu + 1.0) / 2.0) - Gamma.logGamma(nu / 2.0)
                - 0.5 * Math.log(Math.PI * (nu - 2.0));
        }

        private double penalised(double[] point) {
            double persistence = 0.0;
            for (int i = 1; i < point.length; i++) {
                persistence += point[i];
            }
            if (persistence >= STATIONARITY_BOUND) {
                return PENALTY * (1.0 + persistence);
            }
            double[] variances = variances(point[0] * sampleVariance,
                Arrays.copyOfRange(point, 1, 1 + p), Arrays.copyOfRange(point, 1 + p, 1 + p + q));
            double ll = logLikelihood(variances);
            return Double.isFinite(ll) ? -ll : PENALTY;
        }

        private double[] variances(double omega, double[] alpha, double[] beta) {
            int n = shocks.length;
            double[] variances = new double[n];
            for (int t = 0; t < n; t++) {
                double v = omega;
                for (int i = 1; i <= p; i++) {
                    double e2 = t - i >= 0 ? shocks[t - i] * shocks[t - i] : sampleVariance;
                    v += alpha[i - 1] * e2;
                }
                for (int j = 1; j <= q; j++) {
                    v += beta[j - 1] * (t - j >= 0 ? variances[t - j] : sampleVariance);
                }
                variances[t] = v;
            }
            return variances;
        }

        private double logLikelihood(double[] variances) {
            double ll = 0.0;
            for (int t = 0; t < shocks.length; t++) {
                double v = variances[t];
                if (!(v > 0.0)) {
                    return Double.NEGATIVE_INFINITY;
                }
                double e2 = shocks[t] * shocks[t];
                if (distribution == ResidualDistribution.STUDENT_T) {
                    ll += studentConstant - 0.5 * Math.log(v)
                        - (nu + 1.0) / 2.0 * Math.log(1.0 + e2 / (v * (nu - 2.0)));
                } else {
                    ll += -0.5 * (Math.log(2.0 * Math.PI) + Math.log(v) + e2 / v);
                }
            }
            return ll;
        }
    }
}
