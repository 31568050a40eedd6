package io.nosqlbench.reconcile.model;

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

import io.nosqlbench.reconcile.forecast.ResidualSeries;
import io.nosqlbench.reconcile.forecast.SeriesForecast;
import io.nosqlbench.reconcile.hierarchy.HierarchyStructureException;
import io.nosqlbench.reconcile.hierarchy.KeyTable;
import io.nosqlbench.reconcile.hierarchy.SeriesKey;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Fitted models of a hierarchy, one per series, in a fixed order.
public final class ModelTable {

    private final Map<SeriesKey, FittedModel> models;

    private ModelTable(Map<SeriesKey, FittedModel> models) {
        this.models = Collections.unmodifiableMap(new LinkedHashMap<>(models));
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return models.size();
    }

    public List<SeriesKey> keys() {
        return new ArrayList<>(models.keySet());
    }

    public FittedModel model(SeriesKey key) {
        FittedModel model = models.get(key);
        if (model == null) {
            throw new IllegalArgumentException("No model for " + key);
        }
        return model;
    }

    /// Reorders this table to follow a key table.
    ///
    /// @throws HierarchyStructureException if a key table series has no model, or a model has no series
    public ModelTable alignedTo(KeyTable table) {
        Map<SeriesKey, FittedModel> ordered = new LinkedHashMap<>();
        for (SeriesKey key : table.keys()) {
            FittedModel model = models.get(key);
            if (model == null) {
                throw new HierarchyStructureException("No fitted model for series " + key);
            }
            ordered.put(key, model);
        }
        if (ordered.size() != models.size()) {
            List<SeriesKey> extra = new ArrayList<>(models.keySet());
            extra.removeAll(ordered.keySet());
            throw new HierarchyStructureException("Models " + extra + " have no series in the key table");
        }
        return new ModelTable(ordered);
    }

    /// Forecasts one series.
    ///
    /// @throws IllegalStateException if the model labels its forecast with another key
    public SeriesForecast forecast(SeriesKey key, int horizon) {
        if (horizon <= 0) {
            throw new IllegalArgumentException("Forecast horizon must be positive, got: " + horizon);
        }
        SeriesForecast forecast = model(key).forecast(horizon);
        if (!key.equals(forecast.key())) {
            throw new IllegalStateException("Model for " + key + " returned a forecast for " + forecast.key());
        }
        return forecast;
    }

    /// Forecasts every series, in table order.
    public List<SeriesForecast> forecast(int horizon) {
        List<SeriesForecast> out = new ArrayList<>(models.size());
        for (SeriesKey key : models.keySet()) {
            out.add(forecast(key, horizon));
        }
        return out;
    }

    /// Residuals of every series, in table order.
    public List<ResidualSeries> residuals() {
        List<ResidualSeries> out = new ArrayList<>(models.size());
        for (FittedModel model : models.values()) {
            out.add(model.residuals());
        }
        return out;
    }

    public static final class Builder {
        private final Map<SeriesKey, FittedModel> models = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder add(SeriesKey key, FittedModel model) {
            if (models.putIfAbsent(key, model) != null) {
                throw new IllegalArgumentException("Duplicate model for " + key);
            }
            return this;
        }

        public ModelTable build() {
            return new ModelTable(models);
        }
    }
}
