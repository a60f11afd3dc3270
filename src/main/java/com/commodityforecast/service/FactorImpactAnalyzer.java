package com.commodityforecast.service;

import com.commodityforecast.config.AnalysisConfig;
import com.commodityforecast.exception.InsufficientDataException;
import com.commodityforecast.exception.InvalidInputException;
import com.commodityforecast.model.FactorImpact;
import com.commodityforecast.model.ImpactStrength;
import com.commodityforecast.model.MultivariateSeries;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Ranks the market variables by their association with the target price level. A regression on
 * standardized factors is added once the sample reaches {@link #MIN_REGRESSION_OBSERVATIONS}.
 */
@Slf4j
@Service
public class FactorImpactAnalyzer {

    static final String STAGE = "factor-impact";

    static final int MIN_REGRESSION_OBSERVATIONS = 100;

    public static final int DEFAULT_TOP_FACTORS = 5;

    public FactorImpact analyze(MultivariateSeries series, String target, int topFactors, AnalysisConfig config) {
        if (target == null || !series.contains(target)) {
            throw new InvalidInputException(STAGE, "Target [" + target + "] is not one of the series",
                Map.of("target", String.valueOf(target), "available", series.getVariables()));
        }
        if (series.dimension() < 2) {
            throw new InvalidInputException(STAGE, "Factor impact needs at least one series besides the target",
                Map.of("variables", series.getVariables()));
        }
        if (topFactors < 1) {
            throw new InvalidInputException(STAGE, "At least one top factor must be requested",
                Map.of("topFactors", topFactors));
        }
        int n = series.size();
        if (n < config.getMinObservations()) {
            throw new InsufficientDataException(STAGE,
                "Factor impact needs " + config.getMinObservations() + " observations, got " + n,
                Map.of("observations", n, "required", config.getMinObservations()));
        }
        double[] y = series.column(target);
        if (StatUtils.variance(y) <= 0.0) {
            throw new InvalidInputException(STAGE, "Target [" + target + "] is constant", Map.of("target", target));
        }

        List<String> factors = new ArrayList<>();
        List<Double> correlations = new ArrayList<>();
        PearsonsCorrelation pearson = new PearsonsCorrelation();
        for (String variable : series.getVariables()) {
            if (variable.equals(target)) {
                continue;
            }
            double[] x = series.column(variable);
            if (StatUtils.variance(x) <= 0.0) {
                log.warn("Factor {} skipped: constant over the sample", variable);
                continue;
            }
            factors.add(variable);
            correlations.add(pearson.correlation(y, x));
        }
        if (factors.isEmpty()) {
            throw new InvalidInputException(STAGE, "Every factor is constant over the sample",
                Map.of("variables", series.getVariables()));
        }

        Regression regression = regress(series, y, factors);
        double meanLevel = StatUtils.mean(y);
        List<FactorImpact.Factor> effects = new ArrayList<>();
        for (int i = 0; i < factors.size(); i++) {
            double correlation = correlations.get(i);
            Double coefficient = regression != null ? regression.coefficients()[i] : null;
            Double percentage = coefficient != null && meanLevel != 0.0 ? coefficient / meanLevel * 100.0 : null;
            effects.add(FactorImpact.Factor.builder()
                .variable(factors.get(i))
                .correlation(correlation)
                .strength(ImpactStrength.of(correlation))
                .direction(correlation >= 0.0 ? FactorImpact.Direction.POSITIVE : FactorImpact.Direction.NEGATIVE)
                .coefficient(coefficient)
                .percentageImpact(percentage)
                .build());
        }
        effects.sort(Comparator.comparingDouble((FactorImpact.Factor f) -> -Math.abs(f.getCorrelation()))
            .thenComparing(FactorImpact.Factor::getVariable));
        List<String> top = effects.stream()
            .limit(topFactors)
            .map(FactorImpact.Factor::getVariable)
            .toList();

        log.info("Factor impact for {}: top={} r2={}", target, top, regression != null ? regression.rSquared() : "n/a");
        return FactorImpact.builder()
            .target(target)
            .observations(n)
            .rSquared(regression != null ? regression.rSquared() : null)
            .factors(List.copyOf(effects))
            .topFactors(top)
            .build();
    }

    private Regression regress(MultivariateSeries series, double[] y, List<String> factors) {
        int n = y.length;
        if (n < MIN_REGRESSION_OBSERVATIONS || n <= factors.size() + 1) {
            log.debug("Regression skipped: {} observations for {} factors", n, factors.size());
            return null;
        }
        double[][] design = new double[n][factors.size()];
        for (int j = 0; j < factors.size(); j++) {
            double[] x = series.column(factors.get(j));
            double mean = StatUtils.mean(x);
            double sd = Math.sqrt(StatUtils.variance(x));
            for (int t = 0; t < n; t++) {
                design[t][j] = (x[t] - mean) / sd;
            }
        }
        OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression();
        ols.newSampleData(y, design);
        try {
            double[] beta = ols.estimateRegressionParameters();
            double[] slopes = new double[factors.size()];
            System.arraycopy(beta, 1, slopes, 0, slopes.length);
            return new Regression(slopes, ols.calculateRSquared());
        } catch (SingularMatrixException ex) {
            log.warn("Regression omitted: factors {} are collinear ({})", factors, ex.getMessage());
            return null;
        }
    }

    private record Regression(double[] coefficients, double rSquared) {
    }
}
