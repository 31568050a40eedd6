package io.nosqlbench.reconcile.weights;

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

import io.nosqlbench.reconcile.hierarchy.HierarchyStructureException;
import io.nosqlbench.reconcile.hierarchy.KeyStructure;
import io.nosqlbench.reconcile.linalg.MatrixOps;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// Estimates the weight matrix W from aligned one-step residuals.
///
/// Residuals are given as a timestamps × series matrix, columns in key table
/// order. Second moments are taken about zero, `(Rᵗ R) / n`, without centering.
///
/// Every estimate is checked for positive definiteness before it is returned:
/// all eigenvalues must reach [#MIN_EIGENVALUE].
public final class WeightEstimator {

    private static final Logger logger = LogManager.getLogger(WeightEstimator.class);

    public static final double MIN_EIGENVALUE = 1e-8;

    private final WeightMethod method;

    public WeightEstimator(WeightMethod method) {
        if (method == null) {
            throw new IllegalArgumentException("Weight method cannot be null");
        }
        this.method = method;
    }

    /// Creates an estimator from a method name, failing before any computation.
    ///
    /// @throws UnsupportedMethodException if the name is unknown
    public static WeightEstimator forMethod(String name) {
        return new WeightEstimator(WeightMethod.fromName(name));
    }

    public WeightMethod method() {
        return method;
    }

    /// Estimates and validates W.
    ///
    /// @param residuals timestamps × series residual matrix; may have zero rows for methods that
    ///     do not use residuals
    /// @param structure the key structure the residual columns follow
    /// @return a symmetric positive definite series × series matrix
    /// @throws PositiveDefiniteException if the estimate is not positive definite
    public RealMatrix estimate(double[][] residuals, KeyStructure structure) {
        int series = structure.seriesCount();
        if (method.usesResiduals()) {
            requireResiduals(residuals, series);
        }
        RealMatrix weights = switch (method) {
            case OLS -> MatrixUtils.createRealIdentityMatrix(series);
            case WLS_VAR -> diagonal(MatrixOps.diagonalOf(secondMoments(residuals)));
            case WLS_STRUCT -> diagonal(leafCounts(structure));
            case MINT_COV -> secondMoments(residuals);
            case MINT_SHRINK -> shrinkage(residuals).weights();
        };
        requirePositiveDefinite(weights);
        return weights;
    }

    /// Computes the shrinkage estimate toward the diagonal target.
    ///
    /// With residuals standardized by their root second moments, `xs`, the intensity is
    /// `λ = Σ v_ij / Σ (r_ij − t_ij)²` over off-diagonal pairs, where
    /// `v_ij = (Σ xs_i² xs_j² − (Σ xs_i xs_j)² / n) / (n (n − 1))` estimates the variance
    /// of each sample correlation `r_ij` and `t` is the correlation of the target, the
    /// identity. λ is clipped to [0, 1]. When the sample correlations are already
    /// diagonal the denominator is zero and λ is 1.
    ///
    /// @param residuals timestamps × series residual matrix with at least two rows
    /// @return the estimate, with λ, target and sample
    /// @throws HierarchyStructureException if fewer than two residual rows remain after alignment
    public static ShrinkageEstimate shrinkage(double[][] residuals) {
        if (residuals.length < 2) {
            throw new HierarchyStructureException("Shrinkage needs at least two aligned residual rows, got "
                + residuals.length);
        }
        int n = residuals.length;
        RealMatrix sample = secondMoments(residuals);
        double[] moments = MatrixOps.diagonalOf(sample);
        int p = moments.length;
        for (int j = 0; j < p; j++) {
            if (!(moments[j] > 0)) {
                throw new PositiveDefiniteException(WeightMethod.MINT_SHRINK.methodName(), moments[j]);
            }
        }
        RealMatrix target = diagonal(moments);

        double[] scale = new double[p];
        for (int j = 0; j < p; j++) {
            scale[j] = Math.sqrt(moments[j]);
        }
        double[][] cross = new double[p][p];
        double[][] crossSquared = new double[p][p];
        for (double[] row : residuals) {
            for (int i = 0; i < p; i++) {
                double xi = row[i] / scale[i];
                for (int j = 0; j < p; j++) {
                    double xj = row[j] / scale[j];
                    cross[i][j] += xi * xj;
                    crossSquared[i][j] += xi * xi * xj * xj;
                }
            }
        }

        RealMatrix correlation = MatrixOps.cov2cor(sample);
        double varianceSum = 0;
        double distanceSum = 0;
        for (int i = 0; i < p; i++) {
            for (int j = 0; j < p; j++) {
                if (i == j) {
                    continue;
                }
                varianceSum += (crossSquared[i][j] - cross[i][j] * cross[i][j] / n) / ((double) n * (n - 1));
                double r = correlation.getEntry(i, j);
                distanceSum += r * r;
            }
        }
        double lambda = distanceSum > 0 ? varianceSum / distanceSum : 1.0;
        lambda = Math.max(Math.min(lambda, 1.0), 0.0);
        logger.debug("Shrinkage intensity {} over {} series and {} residual rows", lambda, p, n);
        return new ShrinkageEstimate(lambda, target, sample);
    }

    /// Second-moment matrix `(Rᵗ R) / n`, symmetric by construction.
    public static RealMatrix secondMoments(double[][] residuals) {
        int n = residuals.length;
        int p = residuals[0].length;
        double[][] m = new double[p][p];
        for (double[] row : residuals) {
            for (int i = 0; i < p; i++) {
                for (int j = i; j < p; j++) {
                    m[i][j] += row[i] * row[j];
                }
            }
        }
        for (int i = 0; i < p; i++) {
            for (int j = i; j < p; j++) {
                m[i][j] /= n;
                m[j][i] = m[i][j];
            }
        }
        return new Array2DRowRealMatrix(m, false);
    }

    /// Number of leaves summed into each series, in key table order.
    public static double[] leafCounts(KeyStructure structure) {
        double[] counts = new double[structure.seriesCount()];
        for (int i = 0; i < counts.length; i++) {
            counts[i] = structure.aggregationSize(i);
        }
        return counts;
    }

    private void requirePositiveDefinite(RealMatrix weights) {
        double min = MatrixOps.minEigenvalue(weights);
        if (Double.isNaN(min) || min < MIN_EIGENVALUE) {
            throw new PositiveDefiniteException(method.methodName(), min);
        }
    }

    private static void requireResiduals(double[][] residuals, int series) {
        if (residuals == null || residuals.length == 0) {
            throw new IllegalArgumentException("Residual matrix cannot be null or empty");
        }
        for (double[] row : residuals) {
            if (row.length != series) {
                throw new IllegalArgumentException("Residual rows must have " + series
                    + " columns, one per series; found " + row.length);
            }
        }
    }

    private static RealMatrix diagonal(double[] values) {
        double[][] d = new double[values.length][values.length];
        for (int i = 0; i < values.length; i++) {
            d[i][i] = values[i];
        }
        return new Array2DRowRealMatrix(d, false);
    }
}
