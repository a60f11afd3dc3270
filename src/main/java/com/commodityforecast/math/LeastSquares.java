package com.commodityforecast.math;

import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularMatrixException;

/**
 * Multi-equation least squares through a QR decomposition of the shared design matrix.
 */
public final class LeastSquares {

    private static final double RANK_THRESHOLD = 1e-10;

    private LeastSquares() {
    }

    /**
     * Regresses every column of {@code y} on {@code x}.
     *
     * @throws SingularMatrixException when the design matrix is rank deficient
     */
    public static Fit fit(double[][] x, double[][] y) {
        RealMatrix design = MatrixUtils.createRealMatrix(x);
        RealMatrix response = MatrixUtils.createRealMatrix(y);
        DecompositionSolver solver = new QRDecomposition(design, RANK_THRESHOLD).getSolver();
        if (!solver.isNonSingular()) {
            throw new SingularMatrixException();
        }
        RealMatrix coefficients = solver.solve(response);
        RealMatrix residuals = response.subtract(design.multiply(coefficients));
        return new Fit(coefficients, residuals);
    }

    /**
     * @param coefficients one column per equation, one row per regressor
     * @param residuals    one column per equation, one row per observation
     */
    public record Fit(RealMatrix coefficients, RealMatrix residuals) {

        public int observations() {
            return residuals.getRowDimension();
        }

        public int regressors() {
            return coefficients.getRowDimension();
        }

        public double rss(int equation) {
            double[] e = residuals.getColumn(equation);
            double sum = 0.0;
            for (double v : e) {
                sum += v * v;
            }
            return sum;
        }

        /** Residual covariance {@code E'E / divisor}. */
        public RealMatrix residualCovariance(double divisor) {
            return residuals.transpose().multiply(residuals).scalarMultiply(1.0 / divisor);
        }
    }
}
