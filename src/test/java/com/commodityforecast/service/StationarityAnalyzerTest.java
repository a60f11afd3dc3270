package com.commodityforecast.service;

import com.commodityforecast.SyntheticSeries;
import com.commodityforecast.config.AnalysisConfig;
import com.commodityforecast.exception.InsufficientDataException;
import com.commodityforecast.exception.InvalidInputException;
import com.commodityforecast.exception.ModelNotApplicableException;
import com.commodityforecast.model.CointegrationResult;
import com.commodityforecast.model.EngleGrangerResult;
import com.commodityforecast.model.ModelVariant;
import com.commodityforecast.model.MultivariateSeries;
import com.commodityforecast.model.StationarityReport;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class StationarityAnalyzerTest {

    private final StationarityAnalyzer analyzer = new StationarityAnalyzer();
    private final AnalysisConfig config = AnalysisConfig.defaults();

    @Test
    void analyze_flagsRandomWalkAsIntegratedOfOrderOne() {
        double[] walk = SyntheticSeries.randomWalk(new Random(42), 400, 100.0, 1.0);
        MultivariateSeries series = MultivariateSeries.ofMatrix(List.of("cpo"), SyntheticSeries.dates(400),
            SyntheticSeries.columns(walk));

        StationarityReport.VariableStationarity result = analyzer.analyze(series, config).variable("cpo");

        assertThat(result.isStationary()).isFalse();
        assertThat(result.getDifferencingOrder()).isEqualTo(1);
        assertThat(result.getPValue()).isGreaterThan(config.getSignificanceLevel());
        assertThat(result.getCriticalValues().onePercent()).isLessThan(result.getCriticalValues().fivePercent());
    }

    @Test
    void analyze_acceptsWhiteNoiseAsStationary() {
        double[] noise = SyntheticSeries.whiteNoise(new Random(7), 300, 5.0, 1.0);
        MultivariateSeries series = MultivariateSeries.ofMatrix(List.of("spread"), SyntheticSeries.dates(300),
            SyntheticSeries.columns(noise));

        StationarityReport report = analyzer.analyze(series, config);

        assertThat(report.allStationary()).isTrue();
        assertThat(report.variable("spread").getDifferencingOrder()).isZero();
        assertThat(report.variable("spread").getPValue()).isLessThan(0.01);
    }

    @Test
    void analyze_rejectsShortSeries() {
        double[] walk = SyntheticSeries.randomWalk(new Random(1), 20, 100.0, 1.0);
        MultivariateSeries series = MultivariateSeries.ofMatrix(List.of("cpo"), SyntheticSeries.dates(20),
            SyntheticSeries.columns(walk));

        assertThatThrownBy(() -> analyzer.analyze(series, config))
            .isInstanceOf(InsufficientDataException.class)
            .satisfies(ex -> {
                InsufficientDataException e = (InsufficientDataException) ex;
                assertThat(e.getStage()).isEqualTo(StationarityAnalyzer.STAGE);
                assertThat(e.getParameters()).containsEntry("observations", 20);
            });
    }

    @Test
    void analyze_rejectsConstantSeries() {
        double[] flat = new double[60];
        Arrays.fill(flat, 42.0);
        MultivariateSeries series = MultivariateSeries.ofMatrix(List.of("flat"), SyntheticSeries.dates(60),
            SyntheticSeries.columns(flat));

        assertThatThrownBy(() -> analyzer.analyze(series, config)).isInstanceOf(InvalidInputException.class);
    }

    @Test
    void testCointegration_needsTwoVariables() {
        double[] walk = SyntheticSeries.randomWalk(new Random(3), 200, 100.0, 1.0);
        MultivariateSeries series = MultivariateSeries.ofMatrix(List.of("cpo"), SyntheticSeries.dates(200),
            SyntheticSeries.columns(walk));

        assertThatThrownBy(() -> analyzer.testCointegration(series, 2, config))
            .isInstanceOf(ModelNotApplicableException.class);
    }

    @Test
    void testCointegration_findsSingleRelationInCointegratedPair() {
        VectorAutoregressionService var = new VectorAutoregressionService();
        int singleRelation = 0;
        for (long seed = 1; seed <= 10; seed++) {
            MultivariateSeries pair = SyntheticSeries.cointegratedPair(seed, 500);
            int lag = var.selectLagOrder(pair, config.getMaxLagOrder(), config.getInformationCriterion());

            CointegrationResult result = analyzer.testCointegration(pair, lag, config);

            assertThat(result.getRank()).as("seed %d", seed).isPositive();
            assertThat(result.getTraceStatistics().get(0)).isGreaterThan(result.getTraceCriticalValues().get(0));
            assertThat(result.getVectors().get(0).get(0)).isEqualTo(1.0);
            assertThat(result.getVectors().get(0).get(1)).as("seed %d", seed).isCloseTo(-1.05, within(0.05));
            assertThat(result.getConstants()).hasSize(2);
            if (result.getRank() == 1) {
                assertThat(result.recommendedVariant()).isEqualTo(ModelVariant.VECM);
                singleRelation++;
            }
        }
        assertThat(singleRelation).isGreaterThanOrEqualTo(7);
    }

    @Test
    void testCointegration_usesRestrictedConstantCriticalValues() {
        MultivariateSeries pair = SyntheticSeries.cointegratedPair(11L, 500);

        CointegrationResult result = analyzer.testCointegration(pair, 2, config);

        assertThat(result.getTraceCriticalValues()).containsExactly(19.96, 9.24);
        assertThat(result.getMaxEigenCriticalValues()).containsExactly(15.67, 9.24);
        assertThat(result.getSignificanceLevel()).isEqualTo(0.05);
    }

    @Test
    void testCointegration_findsNoRelationBetweenIndependentWalks() {
        int noRelation = 0;
        for (long seed = 1; seed <= 10; seed++) {
            Random random = new Random(seed);
            double[] cpo = SyntheticSeries.randomWalk(random, 400, 100.0, 1.0);
            double[] brent = SyntheticSeries.randomWalk(random, 400, 80.0, 1.0);
            MultivariateSeries walks = MultivariateSeries.ofMatrix(List.of("cpo", "brent"),
                SyntheticSeries.dates(400), SyntheticSeries.columns(cpo, brent));

            if (analyzer.testCointegration(walks, 1, config).getRank() == 0) {
                noRelation++;
            }
        }
        assertThat(noRelation).isGreaterThanOrEqualTo(7);
    }

    @Test
    void engleGranger_recoversHedgeCoefficient() {
        MultivariateSeries pair = SyntheticSeries.cointegratedPair(5L, 400);

        EngleGrangerResult result = analyzer.engleGranger(pair.series("palm"), pair.series("cpo"), config);

        assertThat(result.isCointegrated()).isTrue();
        assertThat(result.getHedgeCoefficient()).isCloseTo(1.05, within(0.05));
        assertThat(result.getPValue()).isLessThan(0.05);
    }
}
