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

import io.nosqlbench.reconcile.StaticModel;
import io.nosqlbench.reconcile.TestHierarchies;
import io.nosqlbench.reconcile.forecast.GaussianForecast;
import io.nosqlbench.reconcile.forecast.ResidualSeries;
import io.nosqlbench.reconcile.forecast.SeriesForecast;
import io.nosqlbench.reconcile.hierarchy.KeyStructure;
import io.nosqlbench.reconcile.hierarchy.KeyTable;
import io.nosqlbench.reconcile.hierarchy.SeriesKey;
import io.nosqlbench.reconcile.hierarchy.SummingMatrixBuilder;
import io.nosqlbench.reconcile.model.ModelTable;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.nosqlbench.reconcile.hierarchy.SeriesKey.AGGREGATED;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class BottomUpReconcilerTest {

    private static final double TOLERANCE = 1e-12;

    private static final ResidualSeries RESIDUALS = ResidualSeries.startingAt(1, 0.1, -0.1);

    @Test
    void sumsLeafForecastsIntoTotal() {
        KeyTable table = TestHierarchies.totalAndLeaves(3);
        StaticModel total = StaticModel.gaussian(table.key(0), RESIDUALS, 100.0);
        ModelTable.Builder builder = ModelTable.builder().add(table.key(0), total);
        for (int i = 1; i <= 3; i++) {
            builder.add(table.key(i), StaticModel.gaussian(table.key(i), RESIDUALS, i, 10.0 * i));
        }

        List<SeriesForecast> out = Reconciliation.reconcile(builder.build(), table, Reconciliation.bottomUp())
            .forecast(2);

        assertEquals(4, out.size());
        assertEquals(table.key(0), out.get(0).key());
        assertArrayEquals(new double[]{6.0, 60.0}, out.get(0).means(), TOLERANCE);
        assertArrayEquals(new double[]{2.0, 20.0}, out.get(2).means(), TOLERANCE);
        assertEquals(3.0, out.get(0).distribution(0).variance(), TOLERANCE);
        assertEquals(1.0, out.get(3).distribution(1).variance(), TOLERANCE);
        assertInstanceOf(GaussianForecast.class, out.get(1).distribution(0));
    }

    @Test
    void neverForecastsAggregateModels() {
        KeyTable table = TestHierarchies.totalAndLeaves(2);
        StaticModel total = StaticModel.gaussian(table.key(0), RESIDUALS, 100.0);
        StaticModel r0 = StaticModel.gaussian(table.key(1), RESIDUALS, 1.0);
        StaticModel r1 = StaticModel.gaussian(table.key(2), RESIDUALS, 2.0);
        ModelTable models = ModelTable.builder()
            .add(table.key(0), total)
            .add(table.key(1), r0)
            .add(table.key(2), r1)
            .build();

        Reconciliation.reconcile(models, table, Reconciliation.bottomUp()).forecast(4);

        assertEquals(0, total.forecastCalls());
        assertEquals(0, total.residualCalls());
        assertEquals(1, r0.forecastCalls());
        assertEquals(0, r0.residualCalls());
    }

    @Test
    void followsMixedTableOrder() {
        KeyTable table = TestHierarchies.stateCity();
        ModelTable.Builder builder = ModelTable.builder();
        // A/x = 1, A/y = 2, B/z = 4
        double[] leafValues = {1.0, 0, 2.0, 0, 4.0, 0};
        for (int i = 0; i < table.size(); i++) {
            builder.add(table.key(i), StaticModel.gaussian(table.key(i), RESIDUALS, leafValues[i]));
        }

        List<SeriesForecast> out = Reconciliation.reconcile(builder.build(), table, Reconciliation.bottomUp())
            .forecast(1);

        double[] means = out.stream().mapToDouble(f -> f.means()[0]).toArray();
        assertArrayEquals(new double[]{1.0, 7.0, 2.0, 3.0, 4.0, 4.0}, means, TOLERANCE);
        assertEquals(SeriesKey.of("B", AGGREGATED), out.get(5).key());
    }

    @Test
    void totalIncludesLeavesOutsideIntermediateLevel() {
        KeyTable table = KeyTable.builder("region", "store")
            .add(new int[]{0}, AGGREGATED, AGGREGATED)
            .add(new int[]{1}, "east", AGGREGATED)
            .add(new int[]{2}, "east", "a")
            .add(new int[]{3}, "east", "b")
            .add(new int[]{4}, "west", "c")
            .build();
        double[] means = {0, 0, 1.0, 2.0, 4.0};
        ModelTable.Builder builder = ModelTable.builder();
        for (int i = 0; i < table.size(); i++) {
            builder.add(table.key(i), StaticModel.gaussian(table.key(i), RESIDUALS, means[i]));
        }

        List<SeriesForecast> out = Reconciliation.reconcile(builder.build(), table, Reconciliation.bottomUp())
            .forecast(1);

        assertEquals(7.0, out.get(0).means()[0], TOLERANCE);
        assertEquals(3.0, out.get(1).means()[0], TOLERANCE);
        assertEquals(4.0, out.get(4).means()[0], TOLERANCE);
    }

    @Test
    void prefersStructuralLeafOverSingleChildAggregate() {
        KeyTable table = KeyTable.builder("state", "city")
            .add(new int[]{0}, AGGREGATED, AGGREGATED)
            .add(new int[]{1}, "A", AGGREGATED)
            .add(new int[]{2}, "B", AGGREGATED)
            .add(new int[]{3}, "A", "x")
            .add(new int[]{4}, "B", "y")
            .add(new int[]{5}, "B", "z")
            .build();
        KeyStructure structure = KeyStructure.of(table);

        int[] rows = BottomUpReconciler.leafRows(SummingMatrixBuilder.levelMerge(structure), structure);

        assertArrayEquals(new int[]{3, 4, 5}, rows);
    }
}
