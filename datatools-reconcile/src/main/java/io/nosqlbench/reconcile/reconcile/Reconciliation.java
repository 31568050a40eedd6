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

import io.nosqlbench.reconcile.hierarchy.KeyStructure;
import io.nosqlbench.reconcile.hierarchy.KeyTable;
import io.nosqlbench.reconcile.model.ModelTable;

/// Entry points for reconciling the fitted models of a hierarchy.
///
/// ```java
/// ReconciledModelTable reconciled = Reconciliation.reconcile(models, keyTable,
///     Reconciliation.minTrace("mint_shrink", "auto"));
/// List<SeriesForecast> forecasts = reconciled.forecast(12);
/// ```
public final class Reconciliation {

    private Reconciliation() {
        // Utility class
    }

    /// Attaches a strategy to a model table.
    ///
    /// The key table is resolved here, so structural errors surface before any forecast.
    ///
    /// @throws io.nosqlbench.reconcile.hierarchy.HierarchyStructureException if the key table has no
    ///     valid structure or does not match the models
    public static ReconciledModelTable reconcile(ModelTable models, KeyTable keyTable,
                                                 ReconciliationStrategy strategy) {
        if (strategy == null) {
            throw new IllegalArgumentException("Reconciliation strategy cannot be null");
        }
        KeyStructure structure = KeyStructure.of(keyTable);
        return new ReconciledModelTable(models.alignedTo(keyTable), structure, strategy);
    }

    /// Min-trace with the default method `wls_var` and automatic backend selection.
    public static ReconciliationStrategy minTrace() {
        return new MinTraceReconciler(ReconciliationConfig.defaults());
    }

    /// @throws io.nosqlbench.reconcile.weights.UnsupportedMethodException if the method is unknown
    public static ReconciliationStrategy minTrace(String method, String sparse) {
        return new MinTraceReconciler(new ReconciliationConfig(method, sparse));
    }

    public static ReconciliationStrategy minTrace(ReconciliationConfig config) {
        return new MinTraceReconciler(config);
    }

    public static ReconciliationStrategy bottomUp() {
        return new BottomUpReconciler();
    }
}
