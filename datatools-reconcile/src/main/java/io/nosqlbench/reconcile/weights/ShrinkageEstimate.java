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

import org.apache.commons.math3.linear.RealMatrix;

/// Result of a shrinkage covariance estimate.
///
/// @param lambda the shrinkage intensity, in [0, 1]
/// @param target the diagonal target
/// @param sample the full sample second-moment matrix
public record ShrinkageEstimate(double lambda, RealMatrix target, RealMatrix sample) {

    public ShrinkageEstimate {
        if (lambda < 0.0 || lambda > 1.0 || Double.isNaN(lambda)) {
            throw new IllegalArgumentException("Shrinkage intensity must be in [0, 1], got: " + lambda);
        }
    }

    /// @return `λ · target + (1 − λ) · sample`
    public RealMatrix weights() {
        return blend(lambda);
    }

    /// Blends target and sample with an explicit intensity.
    ///
    /// An intensity of 1 gives the target alone, 0 gives the sample alone.
    public RealMatrix blend(double intensity) {
        return target.scalarMultiply(intensity).add(sample.scalarMultiply(1.0 - intensity));
    }
}
