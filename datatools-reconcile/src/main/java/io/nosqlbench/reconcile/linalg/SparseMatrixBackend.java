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

import io.nosqlbench.reconcile.hierarchy.KeyStructure;
import io.nosqlbench.reconcile.hierarchy.SummingMatrixBuilder;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.OpenMapRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;

/// Constraint-based projection over sparse matrices.
///
/// ## Formulation
///
/// - `J` (leaves × series) picks each leaf's own row out of a series vector.
/// - `U` (aggregates × series) holds one constraint per aggregate series:
///   `+1` at the aggregate and `−1` at each leaf summed into it, so `U S = 0`.
///
/// The projector is `P = J − J W Uᵗ (U W Uᵗ)⁻¹ U`. Only the aggregates × aggregates
/// system `U W Uᵗ` is factorized, and it is solved against `U` directly instead
/// of being inverted.
public final class SparseMatrixBackend implements MatrixBackend {

    @Override
    public String name() {
        return "sparse";
    }

    @Override
    public RealMatrix summingMatrix(KeyStructure structure) {
        return SummingMatrixBuilder.sparse(structure);
    }

    @Override
    public RealMatrix projection(KeyStructure structure, RealMatrix summing, RealMatrix weights) {
        OpenMapRealMatrix j = selection(structure);
        if (structure.aggregateCount() == 0) {
            return j;
        }
        OpenMapRealMatrix u = constraints(structure);

        // W is symmetric, so W Uᵗ = (U W)ᵗ and the sparse operand stays on the left
        RealMatrix wut = u.multiply(weights).transpose();
        RealMatrix uwut = u.multiply(wut);
        RealMatrix solved = new LUDecomposition(uwut).getSolver().solve(u);
        RealMatrix correction = j.multiply(wut).multiply(solved);
        return correction.scalarMultiply(-1.0).add(j);
    }

    /// Leaf selection matrix J: entry (leaf column, leaf series row) is 1.
    static OpenMapRealMatrix selection(KeyStructure structure) {
        int[] leaves = structure.leafSeries();
        OpenMapRealMatrix j = new OpenMapRealMatrix(structure.leafCount(), structure.seriesCount());
        for (int col = 0; col < leaves.length; col++) {
            j.setEntry(col, leaves[col], 1.0);
        }
        return j;
    }

    /// Aggregation constraint matrix U, the block `[I | −S_agg]` laid out in key table order.
    static OpenMapRealMatrix constraints(KeyStructure structure) {
        int[] aggregates = structure.aggregateSeries();
        int[] leaves = structure.leafSeries();
        OpenMapRealMatrix u = new OpenMapRealMatrix(aggregates.length, structure.seriesCount());
        for (int q = 0; q < aggregates.length; q++) {
            u.setEntry(q, aggregates[q], 1.0);
            for (int col : structure.aggregation(aggregates[q])) {
                u.setEntry(q, leaves[col], -1.0);
            }
        }
        return u;
    }
}
