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
import org.apache.commons.math3.linear.RealMatrix;

/// Dense generalized least squares projection.
///
/// With `R = Sᵗ W⁻¹`, the projector is `P = (R S)⁻¹ R`. The inverse of W is
/// formed explicitly, so the cost is cubic in the number of series.
public final class DenseMatrixBackend implements MatrixBackend {

    @Override
    public String name() {
        return "dense";
    }

    @Override
    public RealMatrix summingMatrix(KeyStructure structure) {
        return SummingMatrixBuilder.dense(structure);
    }

    @Override
    public RealMatrix projection(KeyStructure structure, RealMatrix summing, RealMatrix weights) {
        RealMatrix weightsInverse = new LUDecomposition(weights).getSolver().getInverse();
        RealMatrix r = summing.transpose().multiply(weightsInverse);
        return new LUDecomposition(r.multiply(summing)).getSolver().solve(r);
    }
}
