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

import org.apache.commons.math3.distribution.NormalDistribution;

import java.util.Objects;

/// Normal forecast distribution N(μ, σ²).
///
/// A zero standard deviation is allowed and behaves as a point mass at the mean,
/// which happens for reconciled series whose variance collapses.
public final class GaussianForecast implements ForecastDistribution {

    public static final String FAMILY = "normal";

    private final double mean;
    private final double stdDev;

    public GaussianForecast(double mean, double stdDev) {
        if (stdDev < 0 || Double.isNaN(stdDev)) {
            throw new IllegalArgumentException("Standard deviation must be non-negative, got: " + stdDev);
        }
        this.mean = mean;
        this.stdDev = stdDev;
    }

    /// Creates a normal forecast from a variance.
    ///
    /// Tiny negative variances from rounding are clamped to zero.
    public static GaussianForecast ofVariance(double mean, double variance) {
        return new GaussianForecast(mean, Math.sqrt(Math.max(variance, 0.0)));
    }

    @Override
    public String family() {
        return FAMILY;
    }

    @Override
    public double mean() {
        return mean;
    }

    @Override
    public double variance() {
        return stdDev * stdDev;
    }

    public double stdDev() {
        return stdDev;
    }

    @Override
    public double quantile(double p) {
        if (p < 0 || p > 1) {
            throw new IllegalArgumentException("Probability must be in [0, 1], got: " + p);
        }
        if (stdDev == 0) {
            return mean;
        }
        return new NormalDistribution(null, mean, stdDev).inverseCumulativeProbability(p);
    }

    @Override
    public boolean isGaussian() {
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GaussianForecast)) return false;
        GaussianForecast that = (GaussianForecast) o;
        return Double.compare(that.mean, mean) == 0 && Double.compare(that.stdDev, stdDev) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mean, stdDev);
    }

    @Override
    public String toString() {
        return "N(" + mean + ", " + variance() + ")";
    }
}
