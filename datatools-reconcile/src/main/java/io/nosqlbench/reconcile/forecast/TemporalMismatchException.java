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

import io.nosqlbench.reconcile.ReconciliationException;

/// Thrown when the series of a hierarchy do not share one forecast interval and horizon.
///
/// Reconciliation across temporal granularities is not supported.
public class TemporalMismatchException extends ReconciliationException {

    public TemporalMismatchException(String message) {
        super(message);
    }
}
