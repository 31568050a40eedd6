package io.nosqlbench.reconcile;

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

import io.nosqlbench.reconcile.forecast.ForecastDistribution;
import io.nosqlbench.reconcile.forecast.ForecastInterval;
import io.nosqlbench.reconcile.forecast.GaussianForecast;
import io.nosqlbench.reconcile.forecast.ResidualSeries;
import io.nosqlbench.reconcile.forecast.SeriesForecast;
import io.nosqlbench.reconcile.hierarchy.SeriesKey;
import io.nosqlbench.reconcile.model.FittedModel;

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.function.DoubleFunction;

/// Fitted model double returning fixed per-step forecasts and residuals, counting calls.
public final class StaticModel implements FittedModel {

    public static final ForecastInterval MONTHLY = ForecastInterval.of(1, ChronoUnit.MONTHS);

    private final SeriesKey key;
    private final ForecastInterval interval;
    private final long firstStep;
    private final double[] means;
    private final DoubleFunction<ForecastDistribution> family;
    private final ResidualSeries residuals;

    private int forecastCalls;
    private int residualCalls;

    public StaticModel(SeriesKey key, ForecastInterval interval, long firstStep, double[] means,
                       DoubleFunction<ForecastDistribution> family, ResidualSeries residuals) {
        this.key = key;
        this.interval = interval;
        this.firstStep = firstStep;
        this.means = means;
        this.family = family;
        this.residuals = residuals;
    }

    /// Monthly Gaussian forecasts with unit standard deviation.
    public static StaticModel gaussian(SeriesKey key, ResidualSeries residuals, double... means) {
        return new StaticModel(key, MONTHLY, 100, means, m -> new GaussianForecast(m, 1.0), residuals);
    }

    @Override
    public SeriesForecast forecast(int horizon) {
        forecastCalls++;
        List<ForecastDistribution> distributions = new ArrayList<>(horizon);
        long[] index = new long[horizon];
        for (int h = 0; h < horizon; h++) {
            distributions.add(family.apply(means[h % means.length]));
            index[h] = firstStep + h;
        }
        return SeriesForecast.of(key, interval, index, distributions);
    }

    @Override
    public ResidualSeries residuals() {
        residualCalls++;
        return residuals;
    }

    public int forecastCalls() {
        return forecastCalls;
    }

    public int residualCalls() {
        return residualCalls;
    }
}
