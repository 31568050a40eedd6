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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// Applies a per-step reconciliation to base forecasts and rebuilds labelled output.
///
/// Each horizon step is handled on its own: the base means of all series at that
/// step are projected, and when every base distribution is Gaussian the variances
/// are propagated as well and the output is Gaussian. Otherwise each output
/// step is a point mass at the reconciled mean.
public final class ForecastAdapter {

    private static final Logger logger = LogManager.getLogger(ForecastAdapter.class);

    /// Reconciliation of one horizon step.
    public interface StepProjection {

        /// @param baseMeans base means at one step, one per input series
        /// @return reconciled means, one per output series
        double[] means(double[] baseMeans);

        /// @param baseVariances base variances at one step, one per input series
        /// @return reconciled variances, one per output series
        double[] variances(double[] baseVariances);
    }

    private final PointForecasts pointForecasts;

    public ForecastAdapter(PointForecasts pointForecasts) {
        this.pointForecasts = pointForecasts == null ? PointForecasts.defaults() : pointForecasts;
    }

    /// Verifies that all forecasts share one interval and one time index.
    ///
    /// @throws TemporalMismatchException if intervals, horizons or step times differ
    public static void requireCommonTemporalStructure(List<SeriesForecast> forecasts) {
        if (forecasts.isEmpty()) {
            throw new IllegalArgumentException("No forecasts to reconcile");
        }
        Set<ForecastInterval> intervals = new LinkedHashSet<>();
        for (SeriesForecast forecast : forecasts) {
            intervals.add(forecast.interval());
        }
        if (intervals.size() > 1) {
            throw new TemporalMismatchException("Reconciliation of temporal hierarchies is not supported, "
                + "series have intervals " + intervals);
        }
        long[] index = forecasts.get(0).timeIndex();
        for (SeriesForecast forecast : forecasts) {
            if (!Arrays.equals(index, forecast.timeIndex())) {
                throw new TemporalMismatchException("Series " + forecast.key() + " forecasts steps "
                    + Arrays.toString(forecast.timeIndex()) + " but " + forecasts.get(0).key()
                    + " forecasts " + Arrays.toString(index));
            }
        }
    }

    /// @return true if every step of every forecast is Gaussian
    public static boolean allGaussian(List<SeriesForecast> forecasts) {
        for (SeriesForecast forecast : forecasts) {
            if (!forecast.isGaussian()) {
                return false;
            }
        }
        return true;
    }

    /// Reconciles base forecasts step by step.
    ///
    /// @param base base forecasts, validated with [#requireCommonTemporalStructure(List)]
    /// @param outputKeys keys of the output series, in output order
    /// @param projection the per-step reconciliation
    /// @return one reconciled forecast per output key. Labelling comes from the base forecast at the
    ///     same position when input and output have the same series, otherwise from the first base forecast
    public List<SeriesForecast> apply(List<SeriesForecast> base, List<SeriesKey> outputKeys,
                                      StepProjection projection) {
        requireCommonTemporalStructure(base);
        int horizon = base.get(0).horizon();
        int inputs = base.size();
        int outputs = outputKeys.size();
        boolean gaussian = allGaussian(base);
        logger.debug("Reconciling {} steps from {} to {} series, gaussian={}", horizon, inputs, outputs, gaussian);

        List<List<ForecastDistribution>> reconciled = new ArrayList<>(outputs);
        for (int i = 0; i < outputs; i++) {
            reconciled.add(new ArrayList<>(horizon));
        }
        for (int h = 0; h < horizon; h++) {
            double[] means = new double[inputs];
            double[] variances = new double[inputs];
            for (int j = 0; j < inputs; j++) {
                ForecastDistribution d = base.get(j).distribution(h);
                means[j] = d.mean();
                variances[j] = d.variance();
            }
            double[] stepMeans = projection.means(means);
            double[] stepVariances = gaussian ? projection.variances(variances) : null;
            for (int i = 0; i < outputs; i++) {
                reconciled.get(i).add(gaussian
                    ? GaussianForecast.ofVariance(stepMeans[i], stepVariances[i])
                    : new DegenerateForecast(stepMeans[i]));
            }
        }

        List<SeriesForecast> out = new ArrayList<>(outputs);
        for (int i = 0; i < outputs; i++) {
            SeriesForecast template = inputs == outputs ? base.get(i) : base.get(0);
            out.add(template.reconciled(outputKeys.get(i), reconciled.get(i), pointForecasts));
        }
        return out;
    }
}
