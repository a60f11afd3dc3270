package com.commodityforecast.math;

import org.apache.commons.math3.analysis.MultivariateFunction;

/**
 * Box-constrained minimizer. Implementations stop at the evaluation and time limits of the
 * budget and report that, or any optimizer failure, as a
 * {@link com.commodityforecast.exception.NonConvergentFitException}.
 */
public interface BoundedOptimizer {

    Result minimize(MultivariateFunction objective, double[] start, double[] lower, double[] upper,
                    OptimizationBudget budget);

    record Result(double[] point, double value, int evaluations) {
    }
}
