package com.commodityforecast.math;

import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.ArrayList;
import java.util.List;

public final class Matrices {

    private Matrices() {
    }

    /**
     * Log-determinant of a symmetric positive definite matrix.
     *
     * @throws NonPositiveDefiniteMatrixException when the matrix is singular or indefinite
     */
    public static double logDet(RealMatrix spd) {
        RealMatrix lower = new CholeskyDecomposition(symmetrize(spd)).getL();
        double sum = 0.0;
        for (int i = 0; i < lower.getRowDimension(); i++) {
            sum += Math.log(lower.getEntry(i, i));
        }
        return 2.0 * sum;
    }

    public static RealMatrix symmetrize(RealMatrix m) {
        return m.add(m.transpose()).scalarMultiply(0.5);
    }

    /** Row {@code t} of the result is {@code rows[t] - rows[t-1]}. */
    public static double[][] difference(double[][] rows) {
        double[][] diff = new double[rows.length - 1][];
        for (int t = 1; t < rows.length; t++) {
            diff[t - 1] = new double[rows[t].length];
            for (int j = 0; j < rows[t].length; j++) {
                diff[t - 1][j] = rows[t][j] - rows[t - 1][j];
            }
        }
        return diff;
    }

    /**
     * Design matrix {@code [1, x_{t-1}, ..., x_{t-lags}]} for {@code t = start..n-1}.
     */
    public static double[][] laggedDesign(double[][] rows, int lags, int start, boolean constant) {
        int k = rows[0].length;
        int offset = constant ? 1 : 0;
        double[][] design = new double[rows.length - start][offset + k * lags];
        for (int t = start; t < rows.length; t++) {
            double[] line = design[t - start];
            if (constant) {
                line[0] = 1.0;
            }
            for (int lag = 1; lag <= lags; lag++) {
                System.arraycopy(rows[t - lag], 0, line, offset + (lag - 1) * k, k);
            }
        }
        return design;
    }

    public static double[][] tail(double[][] rows, int start) {
        double[][] tail = new double[rows.length - start][];
        for (int t = start; t < rows.length; t++) {
            tail[t - start] = rows[t].clone();
        }
        return tail;
    }

    public static RealMatrix fromNested(List<List<Double>> columns, int rows) {
        RealMatrix m = MatrixUtils.createRealMatrix(rows, columns.size());
        for (int j = 0; j < columns.size(); j++) {
            for (int i = 0; i < rows; i++) {
                m.setEntry(i, j, columns.get(j).get(i));
            }
        }
        return m;
    }

    public static List<List<Double>> toNested(RealMatrix m) {
        List<List<Double>> rows = new ArrayList<>(m.getRowDimension());
        for (int i = 0; i < m.getRowDimension(); i++) {
            List<Double> row = new ArrayList<>(m.getColumnDimension());
            for (double v : m.getRow(i)) {
                row.add(v);
            }
            rows.add(List.copyOf(row));
        }
        return List.copyOf(rows);
    }

    public static List<double[]> lastRows(double[][] rows, int count) {
        List<double[]> last = new ArrayList<>(count);
        for (int t = rows.length - count; t < rows.length; t++) {
            last.add(rows[t].clone());
        }
        return last;
    }
}
