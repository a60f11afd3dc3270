package com.commodityforecast.service;

import com.commodityforecast.SyntheticSeries;
import com.commodityforecast.config.AnalysisConfig;
import com.commodityforecast.config.CausalityCorrection;
import com.commodityforecast.exception.InsufficientDataException;
import com.commodityforecast.exception.InvalidInputException;
import com.commodityforecast.model.CausalityResult;
import com.commodityforecast.model.MultivariateSeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CausalityTesterTest {

    private final CausalityTester tester = new CausalityTester();
    private final AnalysisConfig config = AnalysisConfig.defaults();

    private MultivariateSeries series;

    /** brent leads cpo by one step; cpo has no effect on brent. */
    @BeforeEach
    void setUp() {
        Random random = new Random(2024);
        int n = 400;
        double[] brent = SyntheticSeries.whiteNoise(random, n, 0.0, 1.0);
        double[] cpo = new double[n];
        for (int t = 1; t < n; t++) {
            cpo[t] = 0.8 * brent[t - 1] + 0.5 * random.nextGaussian();
        }
        series = MultivariateSeries.ofMatrix(List.of("cpo", "brent"), SyntheticSeries.dates(n),
            SyntheticSeries.columns(cpo, brent));
    }

    @Test
    void test_detectsLeadingVariable() {
        CausalityResult result = tester.test(series, List.of(1, 2, 3), config);

        CausalityResult.PairCausality brentToCpo = result.pair("brent", "cpo").orElseThrow();
        assertThat(brentToCpo.isSignificant()).isTrue();
        assertThat(brentToCpo.getBestLag()).isEqualTo(1);
        assertThat(brentToCpo.getCorrectedPValue()).isGreaterThanOrEqualTo(brentToCpo.getRawPValue());
        assertThat(result.getPairs()).hasSize(2);
    }

    @Test
    void selectDrivers_putsTargetFirst() {
        CausalityResult result = tester.test(series, List.of(1, 2), config);

        assertThat(tester.selectDrivers(result, "cpo")).containsExactly("cpo", "brent");
        assertThat(tester.selectDrivers(result, "brent")).containsExactly("brent");
    }

    @Test
    void sidakCorrection_isNoStricterThanBonferroni() {
        CausalityResult bonferroni = tester.test(series, List.of(1, 2, 3, 4), config);
        CausalityResult sidak = tester.test(series, List.of(1, 2, 3, 4),
            config.toBuilder().causalityCorrection(CausalityCorrection.SIDAK).build());

        double b = bonferroni.pair("cpo", "brent").orElseThrow().getCorrectedPValue();
        double s = sidak.pair("cpo", "brent").orElseThrow().getCorrectedPValue();
        assertThat(s).isLessThanOrEqualTo(b);
        assertThat(sidak.getCorrection()).isEqualTo(CausalityCorrection.SIDAK);
    }

    @Test
    void test_rejectsInvalidLags() {
        assertThatThrownBy(() -> tester.test(series, List.of(0, 2), config))
            .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> tester.test(series, List.of(), config))
            .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void test_needsEnoughObservationsForLongestLag() {
        MultivariateSeries shortSeries = MultivariateSeries.ofMatrix(List.of("a", "b"), SyntheticSeries.dates(40),
            SyntheticSeries.columns(
                SyntheticSeries.whiteNoise(new Random(1), 40, 0, 1),
                SyntheticSeries.whiteNoise(new Random(2), 40, 0, 1)));

        assertThatThrownBy(() -> tester.test(shortSeries, List.of(20), config))
            .isInstanceOf(InsufficientDataException.class);
    }
}
