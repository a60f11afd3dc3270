package com.commodityforecast.math;

import com.commodityforecast.exception.NonConvergentFitException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleBounds;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.BOBYQAOptimizer;
import org.springframework.stereotype.Component;

import java.util.Map;

@Slf4j
@Component
public class BobyqaBoundedOptimizer implements BoundedOptimizer {

    private static final double STOPPING_RADIUS = 1e-8;

    @Override
    public Result minimize(MultivariateFunction objective, double[] start, double[] lower, double[] upper,
                           OptimizationBudget budget) {
        int dimension = start.length;
        double narrowest = Double.POSITIVE_INFINITY;
        for (int i = 0; i < dimension; i++) {
            narrowest = Math.min(narrowest, upper[i] - lower[i]);
        }
        // BOBYQA needs every bound range to be at least twice the initial trust region
        double initialRadius = Math.max(narrowest / 4.0, 10 * STOPPING_RADIUS);
        BOBYQAOptimizer optimizer = new BOBYQAOptimizer(2 * dimension + 1, initialRadius, STOPPING_RADIUS);

        long deadline = System.nanoTime() + budget.timeout().toNanos();
        MultivariateFunction guarded = point -> {
            if (System.nanoTime() > deadline || Thread.currentThread().isInterrupted()) {
                throw new DeadlineExceeded();
            }
            return objective.value(point);
        };

        try {
            PointValuePair optimum = optimizer.optimize(
                new MaxEval(budget.maxEvaluations()),
                new ObjectiveFunction(guarded),
                GoalType.MINIMIZE,
                new InitialGuess(start),
                new SimpleBounds(lower, upper));
            log.debug("BOBYQA converged for stage {} after {} evaluations", budget.stage(), optimizer.getEvaluations());
            return new Result(optimum.getPoint(), optimum.getValue(), optimizer.getEvaluations());
        } catch (TooManyEvaluationsException ex) {
            throw new NonConvergentFitException(budget.stage(),
                "Optimizer exhausted its budget of " + budget.maxEvaluations() + " evaluations",
                Map.of("maxIterations", budget.maxEvaluations()), ex);
        } catch (DeadlineExceeded ex) {
            throw new NonConvergentFitException(budget.stage(),
                "Optimizer exceeded its time budget of " + budget.timeout(),
                Map.of("fitTimeout", budget.timeout().toString()), ex);
        } catch (MathIllegalStateException ex) {
            throw new NonConvergentFitException(budget.stage(), "Optimizer failed: " + ex.getMessage(),
                Map.of("optimizer", "BOBYQA"), ex);
        }
    }

    private static final class DeadlineExceeded extends RuntimeException {
        private DeadlineExceeded() {
            super("deadline exceeded", null, false, false);
        }
    }
}
