package io.nosqlbench.reconcile.linalg;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;

/// Small matrix helpers shared by weight estimation and variance propagation.
public final class MatrixOps {

    private MatrixOps() {
        // Utility class
    }

    /// Scales a covariance matrix into a correlation matrix.
    ///
    /// `r_ij = w_ij / sqrt(w_ii w_jj)`, with an exact unit diagonal.
    ///
    /// @param covariance a square matrix with a positive diagonal
    /// @return the correlation matrix
    public static RealMatrix cov2cor(RealMatrix covariance) {
        int n = covariance.getRowDimension();
        double[] sd = new double[n];
        for (int i = 0; i < n; i++) {
            double v = covariance.getEntry(i, i);
            if (!(v > 0)) {
                throw new IllegalArgumentException("Covariance diagonal must be positive, entry " + i + " is " + v);
            }
            sd[i] = Math.sqrt(v);
        }
        double[][] r = new double[n][n];
        for (int i = 0; i < n; i++) {
            r[i][i] = 1.0;
            for (int j = i + 1; j < n; j++) {
                double c = covariance.getEntry(i, j) / (sd[i] * sd[j]);
                r[i][j] = c;
                r[j][i] = c;
            }
        }
        return new Array2DRowRealMatrix(r, false);
    }

    public static double[] diagonalOf(RealMatrix m) {
        int n = Math.min(m.getRowDimension(), m.getColumnDimension());
        double[] d = new double[n];
        for (int i = 0; i < n; i++) {
            d[i] = m.getEntry(i, i);
        }
        return d;
    }

    /// Smallest eigenvalue of a symmetric matrix.
    public static double minEigenvalue(RealMatrix symmetric) {
        double[] eigenvalues = new EigenDecomposition(symmetric).getRealEigenvalues();
        double min = Double.POSITIVE_INFINITY;
        for (double e : eigenvalues) {
            min = Math.min(min, e);
        }
        return min;
    }

    /// Largest absolute entrywise difference of two matrices of the same shape.
    public static double maxAbsDifference(RealMatrix a, RealMatrix b) {
        if (a.getRowDimension() != b.getRowDimension() || a.getColumnDimension() != b.getColumnDimension()) {
            throw new IllegalArgumentException("Matrices must have same dimensions");
        }
        double max = 0;
        for (int i = 0; i < a.getRowDimension(); i++) {
            for (int j = 0; j < a.getColumnDimension(); j++) {
                max = Math.max(max, Math.abs(a.getEntry(i, j) - b.getEntry(i, j)));
            }
        }
        return max;
    }
}
