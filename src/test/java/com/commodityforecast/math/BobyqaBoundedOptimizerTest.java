package com.commodityforecast.math;

import com.commodityforecast.exception.NonConvergentFitException;
import org.apache.commons.math3.analysis.MultivariateFunction;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class BobyqaBoundedOptimizerTest {

    private final BoundedOptimizer optimizer = new BobyqaBoundedOptimizer();

    private final MultivariateFunction bowl = point ->
        Math.pow(point[0] - 0.3, 2) + Math.pow(point[1] - 0.6, 2) + Math.pow(point[2] - 0.1, 2);

    private final double[] start = {0.5, 0.5, 0.5};
    private final double[] lower = {0.0, 0.0, 0.0};
    private final double[] upper = {1.0, 1.0, 1.0};

    @Test
    void minimize_findsInteriorOptimum() {
        BoundedOptimizer.Result result = optimizer.minimize(bowl, start, lower, upper,
            new OptimizationBudget("test", 2_000, Duration.ofSeconds(5)));

        assertThat(result.point()[0]).isCloseTo(0.3, within(1e-4));
        assertThat(result.point()[1]).isCloseTo(0.6, within(1e-4));
        assertThat(result.point()[2]).isCloseTo(0.1, within(1e-4));
        assertThat(result.evaluations()).isPositive().isLessThanOrEqualTo(2_000);
    }

    @Test
    void minimize_staysInsideBounds() {
        MultivariateFunction outside = point -> Math.pow(point[0] + 1.0, 2) + Math.pow(point[1] - 2.0, 2)
            + point[2] * point[2];

        BoundedOptimizer.Result result = optimizer.minimize(outside, start, lower, upper,
            new OptimizationBudget("test", 2_000, Duration.ofSeconds(5)));

        assertThat(result.point()[0]).isCloseTo(0.0, within(1e-4));
        assertThat(result.point()[1]).isCloseTo(1.0, within(1e-4));
    }

    @Test
    void minimize_reportsExhaustedEvaluationBudget() {
        assertThatThrownBy(() -> optimizer.minimize(bowl, start, lower, upper,
            new OptimizationBudget("volatility", 10, Duration.ofSeconds(5))))
            .isInstanceOf(NonConvergentFitException.class)
            .satisfies(ex -> {
                NonConvergentFitException e = (NonConvergentFitException) ex;
                assertThat(e.getStage()).isEqualTo("volatility");
                assertThat(e.getParameters()).containsEntry("maxIterations", 10);
            });
    }

    @Test
    void minimize_reportsExceededTimeBudget() {
        MultivariateFunction slow = point -> {
            try {
                Thread.sleep(20);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return bowl.value(point);
        };

        assertThatThrownBy(() -> optimizer.minimize(slow, start, lower, upper,
            new OptimizationBudget("volatility", 100_000, Duration.ofMillis(50))))
            .isInstanceOf(NonConvergentFitException.class)
            .hasMessageContaining("time budget");
    }
}
