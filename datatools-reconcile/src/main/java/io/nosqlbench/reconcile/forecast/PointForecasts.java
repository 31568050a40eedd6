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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/// Named point forecast summaries computed from forecast distributions.
///
/// The default set holds only the mean, under the name [#MEAN]. Summaries are
/// recomputed from the reconciled distributions, never carried over from the
/// base forecasts.
///
/// ```java
/// PointForecasts points = PointForecasts.builder()
///     .with(PointForecasts.MEAN, ForecastDistribution::mean)
///     .with(".median", PointForecasts.median())
///     .with("q90", PointForecasts.quantile(0.9))
///     .build();
/// ```
public final class PointForecasts {

    public static final String MEAN = ".mean";

    private static final PointForecasts DEFAULTS = builder().with(MEAN, ForecastDistribution::mean).build();

    private final Map<String, ToDoubleFunction<ForecastDistribution>> summaries;

    private PointForecasts(Map<String, ToDoubleFunction<ForecastDistribution>> summaries) {
        this.summaries = Collections.unmodifiableMap(new LinkedHashMap<>(summaries));
    }

    /// @return the mean-only summary set
    public static PointForecasts defaults() {
        return DEFAULTS;
    }

    public static PointForecasts none() {
        return new PointForecasts(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ToDoubleFunction<ForecastDistribution> median() {
        return quantile(0.5);
    }

    public static ToDoubleFunction<ForecastDistribution> quantile(double p) {
        if (p < 0 || p > 1) {
            throw new IllegalArgumentException("Probability must be in [0, 1], got: " + p);
        }
        return d -> d.quantile(p);
    }

    public Set<String> names() {
        return summaries.keySet();
    }

    /// Evaluates every summary over a sequence of per-step distributions.
    ///
    /// @return summary name to one value per step, in declaration order
    public Map<String, double[]> apply(List<? extends ForecastDistribution> distributions) {
        Map<String, double[]> out = new LinkedHashMap<>();
        for (Map.Entry<String, ToDoubleFunction<ForecastDistribution>> e : summaries.entrySet()) {
            double[] values = new double[distributions.size()];
            for (int h = 0; h < values.length; h++) {
                values[h] = e.getValue().applyAsDouble(distributions.get(h));
            }
            out.put(e.getKey(), values);
        }
        return out;
    }

    public static final class Builder {
        private final Map<String, ToDoubleFunction<ForecastDistribution>> summaries = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder with(String name, ToDoubleFunction<ForecastDistribution> summary) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Point forecast name cannot be blank");
            }
            summaries.put(name, summary);
            return this;
        }

        public PointForecasts build() {
            return new PointForecasts(summaries);
        }
    }
}
