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

/// A summing matrix S paired with a projection P onto the coherent subspace.
///
/// Reconciled values are `S P y` for base values `y`. The pair satisfies
/// `S P S = S`, so values that are already coherent pass through unchanged.
public final class Projector {

    private final String backend;
    private final RealMatrix summing;
    private final RealMatrix projection;
    private final RealMatrix mapping;

    public Projector(String backend, RealMatrix summing, RealMatrix projection) {
        if (summing.getColumnDimension() != projection.getRowDimension()
            || summing.getRowDimension() != projection.getColumnDimension()) {
            throw new IllegalArgumentException("Projection must be " + summing.getColumnDimension() + "x"
                + summing.getRowDimension() + " for a " + summing.getRowDimension() + "x"
                + summing.getColumnDimension() + " summing matrix, got " + projection.getRowDimension() + "x"
                + projection.getColumnDimension());
        }
        this.backend = backend;
        this.summing = summing;
        this.projection = projection;
        this.mapping = summing.multiply(projection);
    }

    /// @return name of the backend that computed P
    public String backend() {
        return backend;
    }

    /// @return S, series × leaves
    public RealMatrix summing() {
        return summing;
    }

    /// @return P, leaves × series
    public RealMatrix projection() {
        return projection;
    }

    /// @return S·P, series × series
    public RealMatrix mapping() {
        return mapping;
    }

    public int seriesCount() {
        return summing.getRowDimension();
    }

    /// @param base base values, one per series
    /// @return coherent values `S P base`
    public double[] reconcile(double[] base) {
        return mapping.operate(base);
    }

    /// @return the largest entry of `|S P S − S|`
    public double coherenceError() {
        return MatrixOps.maxAbsDifference(mapping.multiply(summing), summing);
    }
}
