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

import io.nosqlbench.reconcile.ReconciliationException;

/// Thrown when an estimated weight matrix is not positive definite.
public class PositiveDefiniteException extends ReconciliationException {

    private final double minEigenvalue;

    public PositiveDefiniteException(String method, double minEigenvalue) {
        super(String.format(
            "min_trace needs covariance matrix to be positive definite (method %s, smallest eigenvalue %.3e)",
            method, minEigenvalue));
        this.minEigenvalue = minEigenvalue;
    }

    /// @return the smallest eigenvalue found in the rejected matrix
    public double getMinEigenvalue() {
        return minEigenvalue;
    }
}
