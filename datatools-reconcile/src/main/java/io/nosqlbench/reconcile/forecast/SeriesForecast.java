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

import io.nosqlbench.reconcile.hierarchy.SeriesKey;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Forecast of one series over a horizon.
///
/// Holds the per-step distributions together with the labelling needed to index
/// them downstream: the series key, the forecast variable name, the step interval
/// and the time index of each step. Point forecasts are derived from the
/// distributions by a [PointForecasts] set.
public final class SeriesForecast {

    private final SeriesKey key;
    private final String variable;
    private final ForecastInterval interval;
    private final long[] timeIndex;
    private final List<ForecastDistribution> distributions;
    private final Map<String, double[]> pointForecasts;

    public SeriesForecast(SeriesKey key, String variable, ForecastInterval interval, long[] timeIndex,
                          List<? extends ForecastDistribution> distributions, PointForecasts points) {
        if (key == null || interval == null || timeIndex == null || distributions == null) {
            throw new IllegalArgumentException("Key, interval, time index and distributions are required");
        }
        if (timeIndex.length != distributions.size()) {
            throw new IllegalArgumentException("Got " + timeIndex.length + " time points for "
                + distributions.size() + " distributions of " + key);
        }
        this.key = key;
        this.variable = variable == null ? "value" : variable;
        this.interval = interval;
        this.timeIndex = timeIndex.clone();
        this.distributions = Collections.unmodifiableList(new ArrayList<>(distributions));
        this.pointForecasts = Collections.unmodifiableMap(points.apply(this.distributions));
    }

    /// Creates a forecast with the default mean point forecast.
    public static SeriesForecast of(SeriesKey key, ForecastInterval interval, long[] timeIndex,
                                    List<? extends ForecastDistribution> distributions) {
        return new SeriesForecast(key, "value", interval, timeIndex, distributions, PointForecasts.defaults());
    }

    /// Returns a forecast for `newKey` with new distributions and this forecast's labelling.
    ///
    /// Point forecasts are recomputed from the new distributions.
    public SeriesForecast reconciled(SeriesKey newKey, List<? extends ForecastDistribution> newDistributions,
                                     PointForecasts points) {
        return new SeriesForecast(newKey, variable, interval, timeIndex, newDistributions, points);
    }

    public SeriesKey key() {
        return key;
    }

    public String variable() {
        return variable;
    }

    public ForecastInterval interval() {
        return interval;
    }

    public long[] timeIndex() {
        return timeIndex.clone();
    }

    public int horizon() {
        return distributions.size();
    }

    public List<ForecastDistribution> distributions() {
        return distributions;
    }

    public ForecastDistribution distribution(int step) {
        return distributions.get(step);
    }

    /// @return true if every step is Gaussian
    public boolean isGaussian() {
        for (ForecastDistribution d : distributions) {
            if (!d.isGaussian()) {
                return false;
            }
        }
        return true;
    }

    public Map<String, double[]> pointForecasts() {
        Map<String, double[]> copy = new LinkedHashMap<>();
        pointForecasts.forEach((name, values) -> copy.put(name, values.clone()));
        return copy;
    }

    /// @throws IllegalArgumentException if no point forecast has that name
    public double[] pointForecast(String name) {
        double[] values = pointForecasts.get(name);
        if (values == null) {
            throw new IllegalArgumentException("No point forecast named '" + name + "', have " + pointForecasts.keySet());
        }
        return values.clone();
    }

    public double[] means() {
        double[] means = new double[distributions.size()];
        for (int h = 0; h < means.length; h++) {
            means[h] = distributions.get(h).mean();
        }
        return means;
    }

    @Override
    public String toString() {
        return "SeriesForecast[" + key + ", " + variable + ", every " + interval + ", steps="
            + Arrays.toString(timeIndex) + ", " + distributions + "]";
    }
}
