package io.nosqlbench.reconcile.reconcile;

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

import io.nosqlbench.reconcile.forecast.ForecastAdapter;
import io.nosqlbench.reconcile.forecast.PointForecasts;
import io.nosqlbench.reconcile.forecast.ResidualAligner;
import io.nosqlbench.reconcile.forecast.SeriesForecast;
import io.nosqlbench.reconcile.hierarchy.KeyStructure;
import io.nosqlbench.reconcile.linalg.MatrixBackend;
import io.nosqlbench.reconcile.model.ModelTable;
import io.nosqlbench.reconcile.projection.Projector;
import io.nosqlbench.reconcile.projection.ReconciliationProjector;
import io.nosqlbench.reconcile.projection.VariancePropagator;
import io.nosqlbench.reconcile.weights.WeightEstimator;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/// Minimum trace reconciliation.
///
/// ## Steps of one call
///
/// 1. Forecast every series and check they share one interval and time index.
/// 2. Align residuals, when the weight method uses them.
/// 3. Estimate and validate the weight matrix W.
/// 4. Resolve the backend once and compute the projector P.
/// 5. Project the means of every step, and for Gaussian forecasts propagate variances.
///
/// The weight matrix and projector are computed once per call and reused for
/// every horizon step.
///
/// @see <a href="https://doi.org/10.1080/01621459.2018.1448825">Wickramasuriya, Athanasopoulos and
///     Hyndman (2019), Optimal forecast reconciliation for hierarchical and grouped time series
///     through trace minimization</a>
public final class MinTraceReconciler implements ReconciliationStrategy {

    private static final Logger logger = LogManager.getLogger(MinTraceReconciler.class);

    private final ReconciliationConfig config;
    private final WeightEstimator estimator;

    public MinTraceReconciler(ReconciliationConfig config) {
        this.config = config == null ? ReconciliationConfig.defaults() : config;
        this.estimator = new WeightEstimator(this.config.method());
    }

    public ReconciliationConfig config() {
        return config;
    }

    @Override
    public String name() {
        return "min_trace(" + config.method() + ")";
    }

    @Override
    public List<SeriesForecast> reconcile(ModelTable models, KeyStructure structure, int horizon,
                                          PointForecasts points) {
        List<SeriesForecast> base = models.forecast(horizon);
        ForecastAdapter.requireCommonTemporalStructure(base);

        double[][] residuals = config.method().usesResiduals()
            ? ResidualAligner.align(models.residuals()).values()
            : new double[0][];
        RealMatrix weights = estimator.estimate(residuals, structure);

        MatrixBackend backend = MatrixBackend.forMode(config.sparse());
        logger.info("Reconciling {} series ({} leaves) over {} steps with {} on the {} backend",
            structure.seriesCount(), structure.leafCount(), horizon, config.method(), backend.name());

        Projector projector = new ReconciliationProjector(backend).project(structure, weights);
        VariancePropagator propagator = new VariancePropagator(projector, weights);

        return new ForecastAdapter(points).apply(base, structure.table().keys(),
            new ForecastAdapter.StepProjection() {
                @Override
                public double[] means(double[] baseMeans) {
                    return projector.reconcile(baseMeans);
                }

                @Override
                public double[] variances(double[] baseVariances) {
                    return propagator.variances(baseVariances);
                }
            });
    }
}
