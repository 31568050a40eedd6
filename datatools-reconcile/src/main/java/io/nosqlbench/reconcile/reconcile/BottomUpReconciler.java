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
import io.nosqlbench.reconcile.forecast.SeriesForecast;
import io.nosqlbench.reconcile.hierarchy.HierarchyStructureException;
import io.nosqlbench.reconcile.hierarchy.KeyStructure;
import io.nosqlbench.reconcile.hierarchy.SeriesKey;
import io.nosqlbench.reconcile.hierarchy.SummingMatrixBuilder;
import io.nosqlbench.reconcile.model.ModelTable;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// Bottom-up reconciliation.
///
/// Only the leaf models are forecast. Every series, leaves included, is then the
/// sum of its leaf forecasts through S. Gaussian variances add up across the
/// summed leaves, treating leaf errors as independent.
public final class BottomUpReconciler implements ReconciliationStrategy {

    private static final Logger logger = LogManager.getLogger(BottomUpReconciler.class);

    @Override
    public String name() {
        return "bottom_up";
    }

    @Override
    public List<SeriesForecast> reconcile(ModelTable models, KeyStructure structure, int horizon,
                                          PointForecasts points) {
        RealMatrix summing = SummingMatrixBuilder.levelMerge(structure);
        int[] leafRows = leafRows(summing, structure);

        List<SeriesKey> keys = structure.table().keys();
        List<SeriesForecast> leafForecasts = new ArrayList<>(leafRows.length);
        for (int row : leafRows) {
            leafForecasts.add(models.forecast(keys.get(row), horizon));
        }
        logger.info("Summing {} leaf forecasts into {} series over {} steps", leafRows.length,
            structure.seriesCount(), horizon);

        return new ForecastAdapter(points).apply(leafForecasts, keys, new ForecastAdapter.StepProjection() {
            @Override
            public double[] means(double[] leafMeans) {
                return summing.operate(leafMeans);
            }

            @Override
            public double[] variances(double[] leafVariances) {
                // diag(S diag(v) Sᵗ)
                double[] out = new double[summing.getRowDimension()];
                for (int i = 0; i < out.length; i++) {
                    double total = 0;
                    for (int j = 0; j < leafVariances.length; j++) {
                        double s = summing.getEntry(i, j);
                        total += s * s * leafVariances[j];
                    }
                    out[i] = total;
                }
                return out;
            }
        });
    }

    /// Selects the leaf row of every column of S.
    ///
    /// Leaf rows are the rows summing to 1. An aggregate over a single leaf also sums
    /// to 1; when a column has more than one such row, the structural leaf is kept.
    ///
    /// @return key table positions of the leaf rows, in column order
    static int[] leafRows(RealMatrix summing, KeyStructure structure) {
        double[] sums = SummingMatrixBuilder.rowSums(summing);
        int[] rows = new int[summing.getColumnDimension()];
        Arrays.fill(rows, -1);
        for (int i = 0; i < sums.length; i++) {
            if (sums[i] != 1.0) {
                continue;
            }
            int col = 0;
            while (summing.getEntry(i, col) != 1.0) {
                col++;
            }
            if (rows[col] < 0 || structure.isLeaf(i)) {
                rows[col] = i;
            }
        }
        for (int col = 0; col < rows.length; col++) {
            if (rows[col] < 0) {
                throw new HierarchyStructureException("No leaf row for column " + col + " of the summing matrix");
            }
        }
        return rows;
    }
}
