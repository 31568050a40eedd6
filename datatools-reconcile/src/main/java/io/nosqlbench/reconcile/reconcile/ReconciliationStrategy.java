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

import io.nosqlbench.reconcile.forecast.PointForecasts;
import io.nosqlbench.reconcile.forecast.SeriesForecast;
import io.nosqlbench.reconcile.hierarchy.KeyStructure;
import io.nosqlbench.reconcile.model.ModelTable;

import java.util.List;

/// A way of turning base forecasts of a hierarchy into coherent forecasts.
///
/// Implementations:
/// - [MinTraceReconciler] projects all base forecasts with an estimated weight matrix
/// - [BottomUpReconciler] sums leaf forecasts and ignores aggregate models
public interface ReconciliationStrategy {

    /// @return a short name for logs
    String name();

    /// Forecasts and reconciles every series of a hierarchy.
    ///
    /// @param models fitted models in key table order
    /// @param structure the resolved key structure
    /// @param horizon number of steps to forecast
    /// @param points point forecast summaries to compute from the reconciled distributions
    /// @return one reconciled forecast per series, in key table order
    List<SeriesForecast> reconcile(ModelTable models, KeyStructure structure, int horizon, PointForecasts points);
}
