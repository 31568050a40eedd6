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

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/// Empirical forecast distribution given by simulated sample paths at one step.
public final class SampleForecast implements ForecastDistribution {

    public static final String FAMILY = "sample";

    private final double[] samples;

    public SampleForecast(double... samples) {
        if (samples == null || samples.length == 0) {
            throw new IllegalArgumentException("Samples cannot be null or empty");
        }
        this.samples = samples.clone();
    }

    @Override
    public String family() {
        return FAMILY;
    }

    @Override
    public double mean() {
        return StatUtils.mean(samples);
    }

    @Override
    public double variance() {
        return samples.length > 1 ? StatUtils.variance(samples) : 0.0;
    }

    @Override
    public double quantile(double p) {
        if (p < 0 || p > 1) {
            throw new IllegalArgumentException("Probability must be in [0, 1], got: " + p);
        }
        if (p == 0) {
            return StatUtils.min(samples);
        }
        return new Percentile().evaluate(samples, p * 100.0);
    }

    public int size() {
        return samples.length;
    }
}
