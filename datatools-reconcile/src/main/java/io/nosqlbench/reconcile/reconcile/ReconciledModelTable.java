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

/// A model table with a reconciliation strategy attached.
///
/// Forecasting it forecasts the underlying models and reconciles the result, so
/// every call returns freshly reconciled forecasts owned by the caller.
public final class ReconciledModelTable {

    private final ModelTable models;
    private final KeyStructure structure;
    private final ReconciliationStrategy strategy;

    ReconciledModelTable(ModelTable models, KeyStructure structure, ReconciliationStrategy strategy) {
        this.models = models;
        this.structure = structure;
        this.strategy = strategy;
    }

    public ModelTable models() {
        return models;
    }

    public KeyStructure structure() {
        return structure;
    }

    public ReconciliationStrategy strategy() {
        return strategy;
    }

    /// Forecasts with the default mean point forecast.
    public List<SeriesForecast> forecast(int horizon) {
        return forecast(horizon, PointForecasts.defaults());
    }

    /// @return one reconciled forecast per series, in key table order
    public List<SeriesForecast> forecast(int horizon, PointForecasts points) {
        return strategy.reconcile(models, structure, horizon, points);
    }
}
