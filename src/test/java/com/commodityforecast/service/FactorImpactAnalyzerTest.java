package com.commodityforecast.service;

import com.commodityforecast.SyntheticSeries;
import com.commodityforecast.config.AnalysisConfig;
import com.commodityforecast.exception.InsufficientDataException;
import com.commodityforecast.exception.InvalidInputException;
import com.commodityforecast.model.FactorImpact;
import com.commodityforecast.model.ImpactStrength;
import com.commodityforecast.model.MultivariateSeries;
import org.apache.commons.math3.stat.StatUtils;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FactorImpactAnalyzerTest {

    private final FactorImpactAnalyzer analyzer = new FactorImpactAnalyzer();
    private final AnalysisConfig config = AnalysisConfig.defaults();

    /** palm = 500 + 3 cpo - 1.5 crude + noise, with fx unrelated. */
    private static MultivariateSeries market(long seed, int n) {
        Random random = new Random(seed);
        double[] cpo = SyntheticSeries.whiteNoise(random, n, 0.0, 2.0);
        double[] crude = SyntheticSeries.whiteNoise(random, n, 0.0, 2.0);
        double[] fx = SyntheticSeries.whiteNoise(random, n, 0.0, 1.0);
        double[] noise = SyntheticSeries.whiteNoise(random, n, 0.0, 0.5);
        double[] palm = new double[n];
        for (int t = 0; t < n; t++) {
            palm[t] = 500.0 + 3.0 * cpo[t] - 1.5 * crude[t] + noise[t];
        }
        return MultivariateSeries.ofMatrix(List.of("palm", "cpo", "crude", "fx"), SyntheticSeries.dates(n),
            SyntheticSeries.columns(palm, cpo, crude, fx));
    }

    private static FactorImpact.Factor factor(FactorImpact impact, String variable) {
        return impact.getFactors().stream().filter(f -> f.getVariable().equals(variable)).findFirst().orElseThrow();
    }

    @Test
    void analyze_ranksFactorsByCorrelationWithTarget() {
        FactorImpact impact = analyzer.analyze(market(7L, 300), "palm", 2, config);

        assertThat(impact.getTopFactors()).containsExactly("cpo", "crude");
        assertThat(impact.getFactors()).extracting(FactorImpact.Factor::getVariable)
            .containsExactly("cpo", "crude", "fx");
        FactorImpact.Factor cpo = factor(impact, "cpo");
        assertThat(cpo.getStrength()).isEqualTo(ImpactStrength.VERY_STRONG);
        assertThat(cpo.getDirection()).isEqualTo(FactorImpact.Direction.POSITIVE);
        assertThat(factor(impact, "crude").getDirection()).isEqualTo(FactorImpact.Direction.NEGATIVE);
        assertThat(factor(impact, "fx").getStrength()).isEqualTo(ImpactStrength.WEAK);
    }

    @Test
    void analyze_regressesOnStandardizedFactors() {
        MultivariateSeries market = market(11L, 300);

        FactorImpact impact = analyzer.analyze(market, "palm", 5, config);

        assertThat(impact.getRSquared()).isGreaterThan(0.98);
        double cpoSd = Math.sqrt(StatUtils.variance(market.column("cpo")));
        FactorImpact.Factor cpo = factor(impact, "cpo");
        assertThat(cpo.getCoefficient() / cpoSd).isCloseTo(3.0, within(0.05));
        assertThat(cpo.getPercentageImpact())
            .isCloseTo(cpo.getCoefficient() / StatUtils.mean(market.column("palm")) * 100.0, within(1e-9));
        assertThat(factor(impact, "crude").getCoefficient()).isNegative();
    }

    @Test
    void analyze_omitsRegressionOnShortSamples() {
        FactorImpact impact = analyzer.analyze(market(3L, 60), "palm", 5, config);

        assertThat(impact.getRSquared()).isNull();
        assertThat(impact.getFactors()).allSatisfy(f -> {
            assertThat(f.getCoefficient()).isNull();
            assertThat(f.getPercentageImpact()).isNull();
        });
        assertThat(impact.getTopFactors()).hasSize(3);
    }

    @Test
    void analyze_skipsConstantFactors() {
        Random random = new Random(5L);
        int n = 120;
        double[] flat = new double[n];
        Arrays.fill(flat, 42.0);
        MultivariateSeries series = MultivariateSeries.ofMatrix(List.of("palm", "cpo", "tariff"),
            SyntheticSeries.dates(n), SyntheticSeries.columns(SyntheticSeries.randomWalk(random, n, 100.0, 1.0),
                SyntheticSeries.randomWalk(random, n, 80.0, 1.0), flat));

        FactorImpact impact = analyzer.analyze(series, "palm", 5, config);

        assertThat(impact.getFactors()).extracting(FactorImpact.Factor::getVariable).containsExactly("cpo");
    }

    @Test
    void analyze_rejectsUnknownTargetAndLoneSeries() {
        MultivariateSeries market = market(1L, 120);

        assertThatThrownBy(() -> analyzer.analyze(market, "soybean", 5, config))
            .isInstanceOf(InvalidInputException.class)
            .hasMessageContaining("soybean");
        assertThatThrownBy(() -> analyzer.analyze(market.select(List.of("palm")), "palm", 5, config))
            .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void analyze_rejectsSamplesBelowMinimum() {
        assertThatThrownBy(() -> analyzer.analyze(market(1L, 20), "palm", 5, config))
            .isInstanceOf(InsufficientDataException.class)
            .satisfies(ex -> assertThat(((InsufficientDataException) ex).getStage())
                .isEqualTo(FactorImpactAnalyzer.STAGE));
    }
}
