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

/// A model fitted to one series of a hierarchy.
///
/// Models are produced elsewhere; reconciliation only asks them for base
/// forecasts and for their one-step-ahead residuals on the training data.
public interface FittedModel {

    /// @param horizon number of steps to forecast, positive
    /// @return the base forecast of this model's series
    SeriesForecast forecast(int horizon);

    /// @return one-step-ahead residuals on the response scale
    ResidualSeries residuals();
}
