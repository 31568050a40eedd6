package io.nosqlbench.reconcile.forecast;

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

/// Forecast distribution of one series at one horizon step.
///
/// Reconciliation reads only the mean and the variance. Quantiles serve point
/// forecast summaries such as the median.
public interface ForecastDistribution {

    /// @return the distribution family name, e.g. `normal`, `degenerate`, `sample`
    String family();

    double mean();

    double variance();

    /// @param p probability in [0, 1]
    /// @return the p-quantile
    double quantile(double p);

    /// @return true if the distribution is Gaussian, so variances can be propagated
    default boolean isGaussian() {
        return false;
    }
}
