package com.commodityforecast.math;

import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Reduced-rank regression behind Johansen's cointegration test, with the constant restricted to the
 * cointegrating relations. {@code dY_t} and {@code [Y_{t-1}, 1]} are both regressed on
 * {@code [dY_{t-1}, ..., dY_{t-kArDiff}]}; the eigenproblem {@code |lambda S11 - S10 S00^-1 S01| = 0}
 * is made symmetric through the Cholesky factor of {@code S11}. Only the {@code k} leading roots of
 * the {@code k + 1} dimensional problem are kept.
 */
public final class JohansenProcedure {

    private JohansenProcedure() {
    }

    /**
     * @param levels  row-major observations in levels
     * @param kArDiff number of lagged differences
     * @throws org.apache.commons.math3.linear.SingularMatrixException            for collinear input
     * @throws org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException for degenerate moments
     */
    public static Estimate estimate(double[][] levels, int kArDiff) {
        double[][] diffs = Matrices.difference(levels);
        int k = levels[0].length;
        int start = kArDiff;
        int n = diffs.length - start;

        double[][] dy = Matrices.tail(diffs, start);
        double[][] lagged = new double[n][k + 1];
        for (int t = 0; t < n; t++) {
            // diffs[start + t] is Y_{start+t+1} - Y_{start+t}
            System.arraycopy(levels[start + t], 0, lagged[t], 0, k);
            lagged[t][k] = 1.0;
        }
        RealMatrix r0;
        RealMatrix r1;
        if (kArDiff == 0) {
            r0 = MatrixUtils.createRealMatrix(dy);
            r1 = MatrixUtils.createRealMatrix(lagged);
        } else {
            double[][] z = Matrices.laggedDesign(diffs, kArDiff, start, false);
            r0 = LeastSquares.fit(z, dy).residuals();
            r1 = LeastSquares.fit(z, lagged).residuals();
        }

        RealMatrix s00 = r0.transpose().multiply(r0).scalarMultiply(1.0 / n);
        RealMatrix s11 = r1.transpose().multiply(r1).scalarMultiply(1.0 / n);
        RealMatrix s01 = r0.transpose().multiply(r1).scalarMultiply(1.0 / n);
        RealMatrix s10 = s01.transpose();

        RealMatrix lower = new CholeskyDecomposition(Matrices.symmetrize(s11)).getL();
        RealMatrix lowerInverse = MatrixUtils.inverse(lower);
        RealMatrix s00Inverse = MatrixUtils.inverse(Matrices.symmetrize(s00));
        RealMatrix m = Matrices.symmetrize(
            lowerInverse.multiply(s10).multiply(s00Inverse).multiply(s01).multiply(lowerInverse.transpose()));

        EigenDecomposition eigen = new EigenDecomposition(m);
        double[] values = eigen.getRealEigenvalues();
        Integer[] order = IntStream.range(0, k + 1).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> values[i]).reversed());

        double[] sorted = new double[k];
        double[] constants = new double[k];
        RealMatrix vectors = MatrixUtils.createRealMatrix(k, k);
        RealMatrix back = lowerInverse.transpose();
        for (int c = 0; c < k; c++) {
            int source = order[c];
            sorted[c] = Math.min(Math.max(values[source], 0.0), 1.0 - 1e-12);
            double[] beta = back.operate(eigen.getEigenvector(source).toArray());
            double scale = Math.abs(beta[0]) > 1e-12 ? beta[0] : 1.0;
            for (int i = 0; i < k; i++) {
                vectors.setEntry(i, c, beta[i] / scale);
            }
            constants[c] = beta[k] / scale;
        }
        return new Estimate(sorted, vectors, constants, n);
    }

    /**
     * @param eigenvalues  descending
     * @param vectors      column {@code c} is the vector of {@code eigenvalues[c]}, first element 1
     * @param constants    restricted constant of each relation, on the same scale as its vector
     * @param observations effective sample size
     */
    public record Estimate(double[] eigenvalues, RealMatrix vectors, double[] constants, int observations) {

        public double trace(int rank) {
            double sum = 0.0;
            for (int i = rank; i < eigenvalues.length; i++) {
                sum += Math.log(1.0 - eigenvalues[i]);
            }
            return -observations * sum;
        }

        public double maxEigen(int rank) {
            return -observations * Math.log(1.0 - eigenvalues[rank]);
        }
    }
}
