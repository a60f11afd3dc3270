package com.commodityforecast.service;

import com.commodityforecast.config.InformationCriterion;
import com.commodityforecast.exception.InsufficientDataException;
import com.commodityforecast.exception.InvalidInputException;
import com.commodityforecast.exception.ModelNotApplicableException;
import com.commodityforecast.exception.UnstableModelException;
import com.commodityforecast.math.LeastSquares;
import com.commodityforecast.math.Matrices;
import com.commodityforecast.math.ResidualTests;
import com.commodityforecast.model.CointegrationResult;
import com.commodityforecast.model.Forecast;
import com.commodityforecast.model.ImpulseResponse;
import com.commodityforecast.model.LinearSystem;
import com.commodityforecast.model.MeanForecastModel;
import com.commodityforecast.model.ModelDiagnostics;
import com.commodityforecast.model.ModelVariant;
import com.commodityforecast.model.MultivariateSeries;
import com.commodityforecast.model.VarModel;
import com.commodityforecast.model.VecmModel;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Fits VAR and VECM mean models by least squares and produces iterated forecasts with
 * MSE-based confidence bands.
 */
@Slf4j
@Service
public class VectorAutoregressionService {

    static final String STAGE = "forecast-model";

    private static final double ROOT_TOLERANCE = 1e-6;

    /**
     * VAR on levels with the lag order minimising {@code criterion} over {@code 1..maxLag}.
     */
    public VarModel fit(MultivariateSeries series, int maxLag, InformationCriterion criterion) {
        double[][] levels = series.matrix();
        Estimation estimation = estimate(levels, series.getVariables(), maxLag, criterion);
        VarModel model = new VarModel(
            "var-" + UUID.randomUUID(),
            ModelVariant.VAR_LEVELS,
            series.getVariables(),
            estimation.lagOrder(),
            criterion,
            estimation.system(),
            estimation.system(),
            estimation.residualCovariance(),
            Matrices.lastRows(levels, estimation.lagOrder()),
            series.getDates().get(series.size() - 1),
            estimation.observations(),
            estimation.diagnostics());
        log.info("VAR fitted on levels of {}: lag={} by {}, maxRoot={}", series.getVariables(),
            model.lagOrder(), criterion, model.diagnostics().getMaxRootModulus());
        return model;
    }

    /**
     * VAR on first differences. Forecasts are produced through the integrated levels form, so
     * they and their bands are in levels.
     */
    public VarModel fitDifferenced(MultivariateSeries series, int maxLag, InformationCriterion criterion) {
        double[][] levels = series.matrix();
        if (levels.length < 3) {
            throw new InsufficientDataException(STAGE, "Differenced VAR needs at least 3 observations",
                Map.of("observations", levels.length));
        }
        Estimation estimation = estimate(Matrices.difference(levels), series.getVariables(), maxLag, criterion);
        LinearSystem levelsSystem = estimation.system().integrate();
        VarModel model = new VarModel(
            "var-diff-" + UUID.randomUUID(),
            ModelVariant.VAR_DIFFERENCED,
            series.getVariables(),
            estimation.lagOrder(),
            criterion,
            estimation.system(),
            levelsSystem,
            estimation.residualCovariance(),
            Matrices.lastRows(levels, levelsSystem.order()),
            series.getDates().get(series.size() - 1),
            estimation.observations(),
            estimation.diagnostics());
        log.info("VAR fitted on differences of {}: lag={} by {}, maxRoot={}", series.getVariables(),
            model.lagOrder(), criterion, model.diagnostics().getMaxRootModulus());
        return model;
    }

    /**
     * Error-correction regression with the cointegrating vectors held fixed. The levels-VAR lag
     * order is the one the cointegration test was run with.
     */
    public VecmModel fitVecm(MultivariateSeries series, CointegrationResult cointegration) {
        int k = series.dimension();
        int rank = cointegration.getRank();
        if (!cointegration.getVariables().equals(series.getVariables())) {
            throw new InvalidInputException(STAGE, "Cointegration result was computed for other variables",
                Map.of("series", series.getVariables(), "cointegration", cointegration.getVariables()));
        }
        if (rank <= 0 || rank >= k) {
            throw new ModelNotApplicableException(STAGE,
                "VECM needs a cointegration rank strictly between 0 and " + k + ", got " + rank,
                Map.of("rank", rank, "variables", k));
        }
        int lagOrder = Math.max(1, cointegration.getLagOrder());
        int kArDiff = lagOrder - 1;
        double[][] levels = series.matrix();
        double[][] diffs = Matrices.difference(levels);
        int n = diffs.length - kArDiff;
        int regressors = 1 + rank + k * kArDiff;
        if (n <= regressors + k) {
            throw new InsufficientDataException(STAGE,
                "VECM needs more than " + (regressors + k) + " usable observations, got " + n,
                Map.of("observations", n, "lagOrder", lagOrder, "rank", rank));
        }

        RealMatrix beta = Matrices.fromNested(cointegration.getVectors().subList(0, rank), k);
        double[][] design = new double[n][regressors];
        double[][] response = new double[n][];
        for (int row = 0; row < n; row++) {
            int t = row + kArDiff;
            response[row] = diffs[t].clone();
            design[row][0] = 1.0;
            double[] errorCorrection = beta.preMultiply(levels[t]);
            System.arraycopy(errorCorrection, 0, design[row], 1, rank);
            for (int lag = 1; lag <= kArDiff; lag++) {
                System.arraycopy(diffs[t - lag], 0, design[row], 1 + rank + (lag - 1) * k, k);
            }
        }

        LeastSquares.Fit fit = leastSquares(design, response, series.getVariables());
        RealMatrix coefficients = fit.coefficients();
        double[] intercept = coefficients.getRow(0);
        RealMatrix alpha = coefficients.getSubMatrix(1, rank, 0, k - 1).transpose();
        List<RealMatrix> shortRun = new ArrayList<>();
        for (int lag = 1; lag <= kArDiff; lag++) {
            int from = 1 + rank + (lag - 1) * k;
            shortRun.add(coefficients.getSubMatrix(from, from + k - 1, 0, k - 1).transpose());
        }

        RealMatrix identity = MatrixUtils.createRealIdentityMatrix(k);
        RealMatrix longRun = alpha.multiply(beta.transpose());
        List<RealMatrix> levelCoefficients = new ArrayList<>();
        for (int i = 1; i <= lagOrder; i++) {
            RealMatrix a = i == 1 ? identity.add(longRun) : MatrixUtils.createRealMatrix(k, k);
            if (i <= kArDiff) {
                a = a.add(shortRun.get(i - 1));
            }
            if (i >= 2) {
                a = a.subtract(shortRun.get(i - 2));
            }
            levelCoefficients.add(a);
        }
        LinearSystem levelsSystem = new LinearSystem(intercept, levelCoefficients);
        double maxRoot = requireStable(levelsSystem, lagOrder);

        RealMatrix sigmaMl = fit.residualCovariance(n);
        RealMatrix sigma = fit.residualCovariance(n - regressors);
        ModelDiagnostics diagnostics = diagnostics(fit, sigmaMl, series.getVariables(), k * regressors,
            kArDiff, maxRoot);

        VecmModel model = new VecmModel(
            "vecm-" + UUID.randomUUID(),
            series.getVariables(),
            lagOrder,
            rank,
            intercept,
            alpha,
            beta,
            shortRun,
            levelsSystem,
            sigma,
            Matrices.lastRows(levels, lagOrder),
            series.getDates().get(series.size() - 1),
            n,
            diagnostics);
        log.info("VECM fitted on {}: rank={}, lag={}, maxRoot={}", series.getVariables(), rank, lagOrder, maxRoot);
        return model;
    }

    /**
     * Iterated one-step forecasts. Step 0 repeats the last observation with a zero-width band;
     * step {@code h} has MSE {@code sum_{i<h} Psi_i Sigma Psi_i'}.
     */
    public Forecast forecast(MeanForecastModel model, int horizon, double confidenceLevel) {
        if (horizon < 0) {
            throw new InvalidInputException(STAGE, "Forecast horizon must be >= 0", Map.of("horizon", horizon));
        }
        if (!(confidenceLevel > 0.0 && confidenceLevel < 1.0)) {
            throw new InvalidInputException(STAGE, "Confidence level must be in (0, 1)",
                Map.of("confidenceLevel", confidenceLevel));
        }
        LinearSystem system = model.levelsSystem();
        List<String> variables = model.variables();
        int k = variables.size();
        double z = new NormalDistribution().inverseCumulativeProbability((1.0 + confidenceLevel) / 2.0);

        List<double[]> history = new ArrayList<>(model.recentLevels());
        double[][] points = new double[horizon + 1][];
        points[0] = history.get(history.size() - 1).clone();
        for (int h = 1; h <= horizon; h++) {
            points[h] = system.predict(history);
            history.add(points[h]);
        }

        RealMatrix sigma = model.residualCovariance();
        List<RealMatrix> psi = system.movingAverage(horizon);
        double[][] mse = new double[horizon + 1][k];
        RealMatrix cumulative = MatrixUtils.createRealMatrix(k, k);
        for (int h = 1; h <= horizon; h++) {
            RealMatrix p = psi.get(h - 1);
            cumulative = cumulative.add(p.multiply(sigma).multiply(p.transpose()));
            for (int i = 0; i < k; i++) {
                mse[h][i] = Math.max(0.0, cumulative.getEntry(i, i));
            }
        }

        List<Forecast.VariableForecast> perVariable = new ArrayList<>(k);
        for (int i = 0; i < k; i++) {
            List<Forecast.ForecastPoint> path = new ArrayList<>(horizon + 1);
            for (int h = 0; h <= horizon; h++) {
                double half = z * Math.sqrt(mse[h][i]);
                path.add(new Forecast.ForecastPoint(h, points[h][i], points[h][i] - half, points[h][i] + half));
            }
            perVariable.add(Forecast.VariableForecast.builder()
                .variable(variables.get(i))
                .points(List.copyOf(path))
                .build());
        }

        log.info("Forecast {} steps ahead from model {} at {} confidence", horizon, model.modelId(), confidenceLevel);
        return Forecast.builder()
            .forecastId("fc-" + UUID.randomUUID())
            .modelId(model.modelId())
            .modelVariant(model.variant())
            .confidenceLevel(confidenceLevel)
            .horizon(horizon)
            .variables(List.copyOf(perVariable))
            .build();
    }

    /**
     * Responses in levels to a unit shock, or to a one standard deviation orthogonal shock
     * (Cholesky factor of the residual covariance) when {@code orthogonalized}.
     */
    public ImpulseResponse impulseResponse(MeanForecastModel model, int steps, boolean orthogonalized) {
        if (steps < 0) {
            throw new InvalidInputException(STAGE, "Impulse response steps must be >= 0", Map.of("steps", steps));
        }
        List<RealMatrix> psi = model.levelsSystem().movingAverage(steps + 1);
        RealMatrix impact = null;
        if (orthogonalized) {
            try {
                impact = new CholeskyDecomposition(Matrices.symmetrize(model.residualCovariance())).getL();
            } catch (MathIllegalArgumentException ex) {
                throw new ModelNotApplicableException(STAGE, "Residual covariance is not positive definite",
                    Map.of("modelId", model.modelId()), ex);
            }
        }
        List<List<List<Double>>> responses = new ArrayList<>(steps + 1);
        for (RealMatrix p : psi) {
            responses.add(Matrices.toNested(impact == null ? p : p.multiply(impact)));
        }
        return ImpulseResponse.builder()
            .modelId(model.modelId())
            .variables(model.variables())
            .steps(steps)
            .orthogonalized(orthogonalized)
            .responses(List.copyOf(responses))
            .build();
    }

    /**
     * Lag order of a levels VAR minimising {@code criterion} over {@code 1..maxLag}, without the
     * stability check a full fit applies.
     */
    public int selectLagOrder(MultivariateSeries series, int maxLag, InformationCriterion criterion) {
        int lag = selectLag(series.matrix(), series.getVariables(), maxLag, criterion);
        log.info("Lag order {} selected by {} for {}", lag, criterion, series.getVariables());
        return lag;
    }

    private int selectLag(double[][] rows, List<String> variables, int maxLag, InformationCriterion criterion) {
        int k = variables.size();
        if (maxLag < 1) {
            throw new InvalidInputException(STAGE, "maxLag must be >= 1", Map.of("maxLag", maxLag));
        }
        int common = rows.length - maxLag;
        int required = k * maxLag + 1 + k;
        if (common <= required) {
            throw new InsufficientDataException(STAGE,
                "Lag search up to " + maxLag + " needs more than " + (required + maxLag) + " observations, got "
                    + rows.length,
                Map.of("observations", rows.length, "maxLag", maxLag, "variables", variables));
        }

        // common sample so every candidate is scored on the same observations
        double[][] commonResponse = Matrices.tail(rows, maxLag);
        int bestLag = 1;
        double bestScore = Double.POSITIVE_INFINITY;
        for (int p = 1; p <= maxLag; p++) {
            LeastSquares.Fit fit = leastSquares(Matrices.laggedDesign(rows, p, maxLag, true), commonResponse, variables);
            double score = criterion.evaluate(logDet(fit.residualCovariance(common), variables),
                k * k * p + k, common);
            log.debug("Lag {} scored {} = {}", p, criterion, score);
            if (score < bestScore - 1e-12) {
                bestScore = score;
                bestLag = p;
            }
        }
        return bestLag;
    }

    private Estimation estimate(double[][] rows, List<String> variables, int maxLag, InformationCriterion criterion) {
        int k = variables.size();
        int bestLag = selectLag(rows, variables, maxLag, criterion);
        int n = rows.length - bestLag;
        LeastSquares.Fit fit = leastSquares(Matrices.laggedDesign(rows, bestLag, bestLag, true),
            Matrices.tail(rows, bestLag), variables);
        RealMatrix coefficients = fit.coefficients();
        List<RealMatrix> lagMatrices = new ArrayList<>(bestLag);
        for (int lag = 1; lag <= bestLag; lag++) {
            int from = 1 + (lag - 1) * k;
            lagMatrices.add(coefficients.getSubMatrix(from, from + k - 1, 0, k - 1).transpose());
        }
        LinearSystem system = new LinearSystem(coefficients.getRow(0), lagMatrices);
        double maxRoot = requireStable(system, bestLag);

        int regressors = 1 + k * bestLag;
        RealMatrix sigmaMl = fit.residualCovariance(n);
        ModelDiagnostics diagnostics = diagnostics(fit, sigmaMl, variables, k * regressors, bestLag, maxRoot);
        return new Estimation(bestLag, system, fit.residualCovariance(n - regressors), n, diagnostics);
    }

    private double requireStable(LinearSystem system, int lagOrder) {
        double maxRoot = system.maxRootModulus();
        if (maxRoot > 1.0 + ROOT_TOLERANCE) {
            throw new UnstableModelException(STAGE,
                "Fitted system is explosive: largest companion root has modulus " + maxRoot,
                Map.of("maxRootModulus", maxRoot, "lagOrder", lagOrder));
        }
        return maxRoot;
    }

    private ModelDiagnostics diagnostics(LeastSquares.Fit fit, RealMatrix sigmaMl, List<String> variables,
                                         int parameters, int fittedLags, double maxRoot) {
        int n = fit.observations();
        int k = variables.size();
        double logDet = logDet(sigmaMl, variables);
        double logLikelihood = -0.5 * n * (k * Math.log(2.0 * Math.PI) + logDet + k);
        int lbLags = ResidualTests.defaultLags(n);
        List<ModelDiagnostics.ResidualTest> ljungBox = new ArrayList<>(k);
        List<ModelDiagnostics.ResidualTest> jarqueBera = new ArrayList<>(k);
        for (int i = 0; i < k; i++) {
            double[] residuals = fit.residuals().getColumn(i);
            ljungBox.add(ResidualTests.ljungBox(variables.get(i), residuals, lbLags, fittedLags));
            jarqueBera.add(ResidualTests.jarqueBera(variables.get(i), residuals));
        }
        return ModelDiagnostics.builder()
            .logLikelihood(logLikelihood)
            .aic(InformationCriterion.AIC.evaluate(logDet, parameters, n))
            .bic(InformationCriterion.BIC.evaluate(logDet, parameters, n))
            .observations(n)
            .ljungBox(List.copyOf(ljungBox))
            .jarqueBera(List.copyOf(jarqueBera))
            .maxRootModulus(maxRoot)
            .build();
    }

    private static LeastSquares.Fit leastSquares(double[][] design, double[][] response, List<String> variables) {
        try {
            return LeastSquares.fit(design, response);
        } catch (MathIllegalArgumentException ex) {
            throw new ModelNotApplicableException(STAGE, "Design matrix is singular for " + variables,
                Map.of("variables", variables, "observations", design.length), ex);
        }
    }

    private static double logDet(RealMatrix covariance, List<String> variables) {
        try {
            return Matrices.logDet(covariance);
        } catch (MathIllegalArgumentException ex) {
            throw new ModelNotApplicableException(STAGE, "Residual covariance is singular for " + variables,
                Map.of("variables", variables), ex);
        }
    }

    private record Estimation(int lagOrder, LinearSystem system, RealMatrix residualCovariance,
                              int observations, ModelDiagnostics diagnostics) {
    }
}
