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

import io.nosqlbench.reconcile.hierarchy.KeyStructure;
import io.nosqlbench.reconcile.linalg.MatrixBackend;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// Computes the min-trace projector of a hierarchy for a given weight matrix.
///
/// The backend is fixed at construction; every projector built by this instance
/// uses it for both the summing matrix and the solve.
public final class ReconciliationProjector {

    private static final Logger logger = LogManager.getLogger(ReconciliationProjector.class);

    private final MatrixBackend backend;

    public ReconciliationProjector(MatrixBackend backend) {
        if (backend == null) {
            throw new IllegalArgumentException("Matrix backend cannot be null");
        }
        this.backend = backend;
    }

    public MatrixBackend backend() {
        return backend;
    }

    /// @param structure the key structure
    /// @param weights series × series weight matrix, symmetric positive definite
    /// @return the projector, S·P oblique onto the coherent subspace in the W metric
    public Projector project(KeyStructure structure, RealMatrix weights) {
        int n = structure.seriesCount();
        if (weights.getRowDimension() != n || weights.getColumnDimension() != n) {
            throw new IllegalArgumentException("Weight matrix must be " + n + "x" + n + ", got "
                + weights.getRowDimension() + "x" + weights.getColumnDimension());
        }
        RealMatrix summing = backend.summingMatrix(structure);
        RealMatrix projection = backend.projection(structure, summing, weights);
        logger.debug("Computed {} projection for {} series over {} leaves", backend.name(), n,
            structure.leafCount());
        return new Projector(backend.name(), summing, projection);
    }
}
