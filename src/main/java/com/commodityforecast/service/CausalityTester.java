package com.commodityforecast.service;

import com.commodityforecast.config.AnalysisConfig;
import com.commodityforecast.exception.InsufficientDataException;
import com.commodityforecast.exception.InvalidInputException;
import com.commodityforecast.exception.ModelNotApplicableException;
import com.commodityforecast.math.LeastSquares;
import com.commodityforecast.model.CausalityResult;
import com.commodityforecast.model.MultivariateSeries;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.FDistribution;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Pairwise Granger causality F-tests. Each pair is scanned over the candidate lags and the best
 * raw p-value is corrected for the number of lags tried.
 */
@Slf4j
@Service
public class CausalityTester {

    static final String STAGE = "causality";

    public CausalityResult test(MultivariateSeries series, List<Integer> candidateLags, AnalysisConfig config) {
        if (candidateLags == null || candidateLags.isEmpty() || candidateLags.stream().anyMatch(l -> l == null || l < 1)) {
            throw new InvalidInputException(STAGE, "Candidate lags must be a non-empty list of positive integers",
                Map.of("candidateLags", String.valueOf(candidateLags)));
        }
        int maxLag = candidateLags.stream().mapToInt(Integer::intValue).max().orElseThrow();
        int required = Math.max(config.getMinObservations(), 3 * maxLag + 2);
        if (series.size() < required) {
            throw new InsufficientDataException(STAGE,
                "Causality tests need " + required + " observations, got " + series.size(),
                Map.of("observations", series.size(), "required", required, "maxLag", maxLag));
        }

        List<String> variables = series.getVariables();
        List<CausalityResult.PairCausality> pairs = new ArrayList<>();
        for (String cause : variables) {
            for (String effect : variables) {
                if (!cause.equals(effect)) {
                    pairs.add(testPair(series.column(cause), series.column(effect), cause, effect,
                        candidateLags, config));
                }
            }
        }

        long significant = pairs.stream().filter(CausalityResult.PairCausality::isSignificant).count();
        log.info("Granger causality: {} of {} directed pairs significant after {} correction",
            significant, pairs.size(), config.getCausalityCorrection());
        return CausalityResult.builder()
            .variables(variables)
            .candidateLags(List.copyOf(candidateLags))
            .correction(config.getCausalityCorrection())
            .significanceLevel(config.getSignificanceLevel())
            .pairs(List.copyOf(pairs))
            .build();
    }

    /**
     * The target followed by every variable that significantly Granger-causes it, in series order.
     */
    public List<String> selectDrivers(CausalityResult result, String target) {
        if (!result.getVariables().contains(target)) {
            throw new InvalidInputException(STAGE, "Unknown target [" + target + "]",
                Map.of("target", target, "available", result.getVariables()));
        }
        List<String> selected = new ArrayList<>();
        selected.add(target);
        for (String candidate : result.getVariables()) {
            if (!candidate.equals(target) && result.pair(candidate, target)
                .map(CausalityResult.PairCausality::isSignificant)
                .orElse(false)) {
                selected.add(candidate);
            }
        }
        log.info("Drivers selected for {}: {}", target, selected.subList(1, selected.size()));
        return List.copyOf(selected);
    }

    private CausalityResult.PairCausality testPair(double[] x, double[] y, String cause, String effect,
                                                   List<Integer> lags, AnalysisConfig config) {
        double bestP = Double.POSITIVE_INFINITY;
        double bestF = Double.NaN;
        int bestLag = lags.get(0);
        for (int lag : lags) {
            FTest test = fTest(x, y, lag, cause, effect);
            if (test.pValue() < bestP) {
                bestP = test.pValue();
                bestF = test.statistic();
                bestLag = lag;
            }
        }
        double corrected = config.getCausalityCorrection().adjust(bestP, lags.size());
        return CausalityResult.PairCausality.builder()
            .cause(cause)
            .effect(effect)
            .bestLag(bestLag)
            .fStatistic(bestF)
            .rawPValue(bestP)
            .correctedPValue(corrected)
            .significant(corrected < config.getSignificanceLevel())
            .build();
    }

    private FTest fTest(double[] x, double[] y, int lag, String cause, String effect) {
        int n = y.length - lag;
        int denominatorDf = n - 2 * lag - 1;
        double[][] restricted = new double[n][1 + lag];
        double[][] unrestricted = new double[n][1 + 2 * lag];
        double[][] response = new double[n][1];
        for (int t = lag; t < y.length; t++) {
            int row = t - lag;
            response[row][0] = y[t];
            restricted[row][0] = 1.0;
            unrestricted[row][0] = 1.0;
            for (int i = 1; i <= lag; i++) {
                restricted[row][i] = y[t - i];
                unrestricted[row][i] = y[t - i];
                unrestricted[row][lag + i] = x[t - i];
            }
        }
        double rssRestricted;
        double rssUnrestricted;
        try {
            rssRestricted = LeastSquares.fit(restricted, response).rss(0);
            rssUnrestricted = LeastSquares.fit(unrestricted, response).rss(0);
        } catch (SingularMatrixException ex) {
            throw new ModelNotApplicableException(STAGE,
                "Granger regression of " + effect + " on " + cause + " is singular at lag " + lag,
                Map.of("cause", cause, "effect", effect, "lag", lag), ex);
        }
        if (rssUnrestricted <= 0.0) {
            return new FTest(Double.POSITIVE_INFINITY, 0.0);
        }
        double f = Math.max(0.0, (rssRestricted - rssUnrestricted) / lag) / (rssUnrestricted / denominatorDf);
        double p = 1.0 - new FDistribution(lag, denominatorDf).cumulativeProbability(f);
        return new FTest(f, p);
    }

    private record FTest(double statistic, double pValue) {
    }
}
