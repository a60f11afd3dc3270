package com.commodityforecast.model;

import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code y_t = c + A_1 y_{t-1} + ... + A_p y_{t-p} + u_t}. Every mean model is reduced to this
 * form in levels, so forecasting and impulse responses work the same for all of them.
 */
public record LinearSystem(double[] intercept, List<RealMatrix> coefficients) {

    public LinearSystem {
        intercept = intercept.clone();
        coefficients = coefficients.stream().map(RealMatrix::copy).toList();
    }

    @Override
    public double[] intercept() {
        return intercept.clone();
    }

    public int dimension() {
        return intercept.length;
    }

    public int order() {
        return coefficients.size();
    }

    public RealMatrix coefficient(int lag) {
        return coefficients.get(lag - 1).copy();
    }

    /**
     * One-step prediction from chronologically ordered history; the last row is {@code y_{t-1}}.
     */
    public double[] predict(List<double[]> history) {
        double[] next = intercept.clone();
        int last = history.size() - 1;
        for (int lag = 1; lag <= order(); lag++) {
            double[] contribution = coefficients.get(lag - 1).operate(history.get(last - lag + 1));
            for (int i = 0; i < next.length; i++) {
                next[i] += contribution[i];
            }
        }
        return next;
    }

    /**
     * Moving-average coefficients {@code Phi_0 = I, Phi_i = sum_j A_j Phi_{i-j}}.
     */
    public List<RealMatrix> movingAverage(int count) {
        List<RealMatrix> phi = new ArrayList<>(count);
        if (count == 0) {
            return phi;
        }
        phi.add(MatrixUtils.createRealIdentityMatrix(dimension()));
        for (int i = 1; i < count; i++) {
            RealMatrix next = MatrixUtils.createRealMatrix(dimension(), dimension());
            for (int j = 1; j <= Math.min(i, order()); j++) {
                next = next.add(coefficients.get(j - 1).multiply(phi.get(i - j)));
            }
            phi.add(next);
        }
        return phi;
    }

    public RealMatrix companion() {
        int k = dimension();
        int p = Math.max(1, order());
        RealMatrix companion = MatrixUtils.createRealMatrix(k * p, k * p);
        for (int lag = 0; lag < order(); lag++) {
            companion.setSubMatrix(coefficients.get(lag).getData(), 0, lag * k);
        }
        for (int i = k; i < k * p; i++) {
            companion.setEntry(i, i - k, 1.0);
        }
        return companion;
    }

    public double maxRootModulus() {
        EigenDecomposition eigen = new EigenDecomposition(companion());
        double[] re = eigen.getRealEigenvalues();
        double[] im = eigen.getImagEigenvalues();
        double max = 0.0;
        for (int i = 0; i < re.length; i++) {
            max = Math.max(max, Math.hypot(re[i], im[i]));
        }
        return max;
    }

    /**
     * Levels form of a system estimated on first differences:
     * {@code A_1 = I + B_1, A_i = B_i - B_{i-1}, A_{p+1} = -B_p}.
     */
    public LinearSystem integrate() {
        int k = dimension();
        List<RealMatrix> levels = new ArrayList<>(order() + 1);
        RealMatrix identity = MatrixUtils.createRealIdentityMatrix(k);
        for (int i = 0; i <= order(); i++) {
            RealMatrix current = i < order() ? coefficients.get(i) : MatrixUtils.createRealMatrix(k, k);
            RealMatrix previous = i == 0 ? identity.scalarMultiply(-1.0) : coefficients.get(i - 1);
            levels.add(current.subtract(previous));
        }
        return new LinearSystem(intercept, levels);
    }
}
