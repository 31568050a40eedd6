package io.nosqlbench.reconcile.projection;

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

import io.nosqlbench.reconcile.linalg.MatrixOps;
import org.apache.commons.math3.linear.RealMatrix;

/// Propagates Gaussian base forecast variances through a projector.
///
/// The correlation structure R1 is taken from the weight matrix once. At each
/// step it is rescaled by that step's base standard deviations,
/// `W_h = diag(sd) R1 diag(sd)`, and the reconciled variances are the diagonal
/// of `S P W_h Pᵗ Sᵗ`.
public final class VariancePropagator {

    private final RealMatrix mapping;
    private final RealMatrix correlation;

    public VariancePropagator(Projector projector, RealMatrix weights) {
        this.mapping = projector.mapping();
        this.correlation = MatrixOps.cov2cor(weights);
    }

    /// @return R1, the correlation matrix derived from the weights
    public RealMatrix correlation() {
        return correlation;
    }

    /// @param baseVariances base variances at one step, one per series
    /// @return reconciled variances at that step, one per series
    public double[] variances(double[] baseVariances) {
        int n = baseVariances.length;
        if (n != correlation.getRowDimension()) {
            throw new IllegalArgumentException("Expected " + correlation.getRowDimension()
                + " variances, got " + n);
        }
        double[] sd = new double[n];
        for (int j = 0; j < n; j++) {
            sd[j] = Math.sqrt(baseVariances[j]);
        }
        double[][] wh = new double[n][n];
        for (int j = 0; j < n; j++) {
            for (int k = 0; k < n; k++) {
                wh[j][k] = sd[j] * correlation.getEntry(j, k) * sd[k];
            }
        }
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            double[] row = mapping.getRow(i);
            double total = 0;
            for (int j = 0; j < n; j++) {
                if (row[j] == 0) {
                    continue;
                }
                double inner = 0;
                for (int k = 0; k < n; k++) {
                    inner += wh[j][k] * row[k];
                }
                total += row[j] * inner;
            }
            out[i] = total;
        }
        return out;
    }
}
