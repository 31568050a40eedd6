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
import org.apache.commons.math3.linear.RealMatrix;

/// Linear algebra strategy for reconciliation.
///
/// A backend is chosen once per reconciliation call and passed to every
/// computation of that call. It decides how the summing matrix is stored and
/// how the projection is solved.
///
/// | Backend | Summing matrix | Projection | Dominant cost |
/// |---------|----------------|------------|---------------|
/// | [DenseMatrixBackend] | dense | `(Sᵗ W⁻¹ S)⁻¹ Sᵗ W⁻¹` | O(n_series³) |
/// | [SparseMatrixBackend] | sparse | `J − J W Uᵗ (U W Uᵗ)⁻¹ U` | O(n_aggregate³ + nnz) |
public interface MatrixBackend {

    /// @return a short name for logs, `dense` or `sparse`
    String name();

    /// @return the summing matrix S of `structure`, series × leaves
    RealMatrix summingMatrix(KeyStructure structure);

    /// Computes the projector P (leaves × series) onto the coherent subspace.
    ///
    /// @param structure the resolved key structure
    /// @param summing the summing matrix built by this backend
    /// @param weights the weight matrix, series × series, symmetric positive definite
    /// @return P such that S·P·S = S
    RealMatrix projection(KeyStructure structure, RealMatrix summing, RealMatrix weights);

    /// Returns the backend for a sparse mode, resolving [SparseMode#AUTO] at this point.
    static MatrixBackend forMode(SparseMode mode) {
        return mode.resolve() ? new SparseMatrixBackend() : new DenseMatrixBackend();
    }
}
