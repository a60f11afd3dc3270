package com.commodityforecast.service;

import com.commodityforecast.config.AnalysisConfig;
import com.commodityforecast.exception.InsufficientDataException;
import com.commodityforecast.exception.InvalidInputException;
import com.commodityforecast.exception.ModelNotApplicableException;
import com.commodityforecast.math.AugmentedDickeyFuller;
import com.commodityforecast.math.JohansenProcedure;
import com.commodityforecast.model.CointegrationResult;
import com.commodityforecast.model.EngleGrangerResult;
import com.commodityforecast.model.GapPolicy;
import com.commodityforecast.model.MultivariateSeries;
import com.commodityforecast.model.StationarityReport;
import com.commodityforecast.model.TimeSeries;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Unit-root testing per variable, Johansen rank testing for the system and Engle-Granger
 * testing per pair.
 */
@Slf4j
@Service
public class StationarityAnalyzer {

    static final String STAGE = "stationarity";
    static final String COINTEGRATION_STAGE = "cointegration";

    static final int MAX_JOHANSEN_VARIABLES = 6;

    // Osterwald-Lenum (1992) table 1*, constant restricted to the relations; row = k - r - 1,
    // columns 90%, 95%, 99%
    private static final double[][] TRACE_CRITICAL = {
        {7.52, 9.24, 12.97},
        {17.85, 19.96, 24.60},
        {32.00, 34.91, 41.07},
        {49.65, 53.12, 60.16},
        {71.86, 76.07, 84.45},
        {97.18, 102.14, 111.01}
    };
    private static final double[][] MAX_EIGEN_CRITICAL = {
        {7.52, 9.24, 12.97},
        {13.75, 15.67, 20.20},
        {19.77, 22.00, 26.81},
        {25.56, 28.14, 33.24},
        {31.66, 34.40, 39.79},
        {37.45, 40.30, 46.82}
    };

    public StationarityReport analyze(MultivariateSeries series, AnalysisConfig config) {
        List<StationarityReport.VariableStationarity> results = new ArrayList<>();
        for (String variable : series.getVariables()) {
            results.add(analyzeVariable(variable, series.column(variable), config));
        }
        long stationary = results.stream().filter(StationarityReport.VariableStationarity::isStationary).count();
        log.info("Stationarity analysed: {} of {} variables stationary in levels", stationary, results.size());
        return StationarityReport.builder()
            .significanceLevel(config.getSignificanceLevel())
            .variables(List.copyOf(results))
            .build();
    }

    private StationarityReport.VariableStationarity analyzeVariable(String variable, double[] values,
                                                                    AnalysisConfig config) {
        int required = Math.max(config.getMinObservations(), config.getMaxLagOrder() + 3);
        if (values.length < required) {
            throw new InsufficientDataException(STAGE,
                "Variable [" + variable + "] has " + values.length + " observations, " + required + " required",
                Map.of("variable", variable, "observations", values.length, "required", required));
        }
        if (isConstant(values)) {
            throw new InvalidInputException(STAGE, "Variable [" + variable + "] is constant",
                Map.of("variable", variable));
        }

        AugmentedDickeyFuller.Outcome levels = adf(variable, values, config.getMaxLagOrder(), 1);
        boolean stationary = levels.pValue() < config.getSignificanceLevel();
        int order = stationary ? 0 : differencingOrder(variable, values, config);
        log.debug("ADF {}: stat={} p={} lags={} order={}", variable, levels.statistic(), levels.pValue(),
            levels.lagsUsed(), order);

        return StationarityReport.VariableStationarity.builder()
            .variable(variable)
            .adfStatistic(levels.statistic())
            .pValue(levels.pValue())
            .lagsUsed(levels.lagsUsed())
            .observations(levels.observations())
            .criticalValues(levels.criticalValues())
            .stationary(stationary)
            .differencingOrder(order)
            .build();
    }

    private int differencingOrder(String variable, double[] values, AnalysisConfig config) {
        double[] diff = new double[values.length - 1];
        for (int i = 1; i < values.length; i++) {
            diff[i - 1] = values[i] - values[i - 1];
        }
        if (isConstant(diff)) {
            return 1;
        }
        AugmentedDickeyFuller.Outcome first = adf(variable, diff, config.getMaxLagOrder(), 1);
        return first.pValue() < config.getSignificanceLevel() ? 1 : 2;
    }

    /**
     * Johansen trace test with the constant restricted to the cointegrating relations, the case
     * for price levels without a linear trend. {@code lagOrder} is the order of the levels VAR;
     * the auxiliary regressions use {@code lagOrder - 1} lagged differences.
     */
    public CointegrationResult testCointegration(MultivariateSeries series, int lagOrder, AnalysisConfig config) {
        int k = series.dimension();
        if (k < 2) {
            throw new ModelNotApplicableException(COINTEGRATION_STAGE,
                "Cointegration needs at least two variables, got " + k, Map.of("variables", k));
        }
        if (k > MAX_JOHANSEN_VARIABLES) {
            throw new ModelNotApplicableException(COINTEGRATION_STAGE,
                "Critical values are tabulated for at most " + MAX_JOHANSEN_VARIABLES + " variables, got " + k,
                Map.of("variables", k, "maximum", MAX_JOHANSEN_VARIABLES));
        }
        int kArDiff = Math.max(lagOrder - 1, 0);
        int required = Math.max(config.getMinObservations(), k * kArDiff + k + 3);
        if (series.size() < required) {
            throw new InsufficientDataException(COINTEGRATION_STAGE,
                "Cointegration test needs " + required + " observations, got " + series.size(),
                Map.of("observations", series.size(), "required", required, "lagOrder", lagOrder));
        }

        JohansenProcedure.Estimate estimate;
        try {
            estimate = JohansenProcedure.estimate(series.matrix(), kArDiff);
        } catch (MathIllegalArgumentException ex) {
            throw new ModelNotApplicableException(COINTEGRATION_STAGE,
                "Johansen moment matrices are singular: " + ex.getMessage(),
                Map.of("variables", series.getVariables(), "lagOrder", lagOrder), ex);
        }

        int column = significanceColumn(config.getCointegrationSignificance());
        List<Double> trace = new ArrayList<>();
        List<Double> traceCritical = new ArrayList<>();
        List<Double> maxEigen = new ArrayList<>();
        List<Double> maxEigenCritical = new ArrayList<>();
        int rank = k;
        for (int r = 0; r < k; r++) {
            double statistic = estimate.trace(r);
            double critical = TRACE_CRITICAL[k - r - 1][column];
            trace.add(statistic);
            traceCritical.add(critical);
            maxEigen.add(estimate.maxEigen(r));
            maxEigenCritical.add(MAX_EIGEN_CRITICAL[k - r - 1][column]);
            if (rank == k && statistic < critical) {
                rank = r;
            }
        }

        List<Double> eigenvalues = new ArrayList<>();
        for (double lambda : estimate.eigenvalues()) {
            eigenvalues.add(lambda);
        }
        List<List<Double>> vectors = new ArrayList<>();
        for (int c = 0; c < k; c++) {
            List<Double> vector = new ArrayList<>();
            for (double v : estimate.vectors().getColumn(c)) {
                vector.add(v);
            }
            vectors.add(List.copyOf(vector));
        }
        List<Double> constants = new ArrayList<>();
        for (double c : estimate.constants()) {
            constants.add(c);
        }

        log.info("Johansen test on {}: rank={} at {} (lagOrder={}, n={})", series.getVariables(), rank,
            config.getCointegrationSignificance(), lagOrder, estimate.observations());
        return CointegrationResult.builder()
            .variables(series.getVariables())
            .rank(rank)
            .lagOrder(lagOrder)
            .significanceLevel(config.getCointegrationSignificance())
            .eigenvalues(List.copyOf(eigenvalues))
            .vectors(List.copyOf(vectors))
            .constants(List.copyOf(constants))
            .traceStatistics(List.copyOf(trace))
            .traceCriticalValues(List.copyOf(traceCritical))
            .maxEigenStatistics(List.copyOf(maxEigen))
            .maxEigenCriticalValues(List.copyOf(maxEigenCritical))
            .build();
    }

    /**
     * Two-step test: regress {@code target} on {@code other} with a constant, then test the
     * residuals for a unit root against the two-variable MacKinnon distribution.
     */
    public EngleGrangerResult engleGranger(TimeSeries target, TimeSeries other, AnalysisConfig config) {
        MultivariateSeries pair = MultivariateSeries.align(List.of(target, other), GapPolicy.INNER_JOIN);
        double[] y = pair.column(target.getName());
        double[] x = pair.column(other.getName());
        int required = Math.max(config.getMinObservations(), config.getMaxLagOrder() + 3);
        if (y.length < required) {
            throw new InsufficientDataException(COINTEGRATION_STAGE,
                "Pair [" + target.getName() + ", " + other.getName() + "] shares " + y.length
                    + " observations, " + required + " required",
                Map.of("target", target.getName(), "other", other.getName(),
                    "observations", y.length, "required", required));
        }
        if (isConstant(x) || isConstant(y)) {
            throw new InvalidInputException(COINTEGRATION_STAGE, "Engle-Granger needs non-constant series",
                Map.of("target", target.getName(), "other", other.getName()));
        }

        double[][] regressors = new double[x.length][1];
        for (int i = 0; i < x.length; i++) {
            regressors[i][0] = x[i];
        }
        OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression();
        ols.newSampleData(y, regressors);
        double[] beta = ols.estimateRegressionParameters();
        double[] residuals = ols.estimateResiduals();

        AugmentedDickeyFuller.Outcome outcome = adf(target.getName(), residuals, config.getMaxLagOrder(), 2);
        boolean cointegrated = outcome.pValue() < config.getSignificanceLevel();
        log.debug("Engle-Granger {} ~ {}: stat={} p={}", target.getName(), other.getName(),
            outcome.statistic(), outcome.pValue());
        return EngleGrangerResult.builder()
            .target(target.getName())
            .other(other.getName())
            .intercept(beta[0])
            .hedgeCoefficient(beta[1])
            .adfStatistic(outcome.statistic())
            .pValue(outcome.pValue())
            .lagsUsed(outcome.lagsUsed())
            .cointegrated(cointegrated)
            .build();
    }

    private AugmentedDickeyFuller.Outcome adf(String variable, double[] values, int maxLag, int regressors) {
        // the lag search needs more observations than regressors on its common sample
        int usable = Math.min(maxLag, Math.max(0, (values.length - 4) / 2));
        try {
            return AugmentedDickeyFuller.test(values, usable, regressors);
        } catch (MathIllegalArgumentException ex) {
            throw new InsufficientDataException(STAGE,
                "ADF regression for [" + variable + "] could not be estimated: " + ex.getMessage(),
                Map.of("variable", variable, "observations", values.length, "maxLagOrder", maxLag), ex);
        }
    }

    private static int significanceColumn(double significance) {
        if (significance <= 0.01) {
            return 2;
        }
        return significance <= 0.05 ? 1 : 0;
    }

    private static boolean isConstant(double[] values) {
        for (double v : values) {
            if (Math.abs(v - values[0]) > 1e-12 * Math.max(1.0, Math.abs(values[0]))) {
                return false;
            }
        }
        return true;
    }
}
