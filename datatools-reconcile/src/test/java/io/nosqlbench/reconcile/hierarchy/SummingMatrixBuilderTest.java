package io.nosqlbench.reconcile.hierarchy;

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

import io.nosqlbench.reconcile.TestHierarchies;
import io.nosqlbench.reconcile.linalg.MatrixOps;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static io.nosqlbench.reconcile.hierarchy.SeriesKey.AGGREGATED;
import static org.assertj.core.api.Assertions.*;

@DisplayName("SummingMatrixBuilder")
class SummingMatrixBuilderTest {

    @Test
    @DisplayName("builds total and leaf rows for a two-level hierarchy")
    void buildsTwoLevelMatrix() {
        RealMatrix s = SummingMatrixBuilder.dense(KeyStructure.of(TestHierarchies.totalAndTwoRegions()));

        assertThat(s.getData()).isDeepEqualTo(new double[][]{
            {1, 1},
            {1, 0},
            {0, 1}
        });
    }

    @Test
    @DisplayName("level merge, direct and sparse construction agree")
    void strategiesAgree() {
        for (KeyTable table : List.of(TestHierarchies.totalAndTwoRegions(), TestHierarchies.stateCity(),
            TestHierarchies.regionByPurpose(), TestHierarchies.totalAndLeaves(7))) {
            KeyStructure structure = KeyStructure.of(table);
            RealMatrix dense = SummingMatrixBuilder.dense(structure);

            assertThat(MatrixOps.maxAbsDifference(dense, SummingMatrixBuilder.levelMerge(structure)))
                .as("level merge for %s", table.dimensionNames())
                .isZero();
            assertThat(MatrixOps.maxAbsDifference(dense, SummingMatrixBuilder.sparse(structure)))
                .as("sparse for %s", table.dimensionNames())
                .isZero();
        }
    }

    @Test
    @DisplayName("level merge restores key table row order")
    void levelMergeRestoresOrder() {
        RealMatrix s = SummingMatrixBuilder.levelMerge(KeyStructure.of(TestHierarchies.stateCity()));

        assertThat(s.getData()).isDeepEqualTo(new double[][]{
            {1, 0, 0},
            {1, 1, 1},
            {0, 1, 0},
            {1, 1, 0},
            {0, 0, 1},
            {0, 0, 1}
        });
    }

    @Test
    @DisplayName("leaf rows are unit vectors and the total row is all ones")
    void leafAndTotalRows() {
        KeyStructure structure = KeyStructure.of(TestHierarchies.regionByPurpose());
        RealMatrix s = SummingMatrixBuilder.sparse(structure);

        for (int row : structure.leafSeries()) {
            assertThat(SummingMatrixBuilder.rowSums(s)[row]).isEqualTo(1.0);
            assertThat(s.getEntry(row, structure.leafColumn(row))).isEqualTo(1.0);
        }
        assertThat(s.getRow(0)).containsOnly(1.0);
    }

    @Test
    @DisplayName("S applied to leaf values reproduces every aggregate")
    void reproducesAggregates() {
        KeyTable table = TestHierarchies.regionByPurpose();
        RealMatrix s = SummingMatrixBuilder.levelMerge(KeyStructure.of(table));
        double nb = 3, nh = 5, sb = 7, sh = 11;

        double[] all = s.operate(new double[]{nb, nh, sb, sh});

        assertThat(all).containsExactly(
            nb + nh + sb + sh,
            nb + nh,
            sb + sh,
            nb + sb,
            nh + sh,
            nb, nh, sb, sh);
    }

    @Test
    @DisplayName("level merge reaches leaves an intermediate level does not cover")
    void levelMergeWithPartialIntermediateLevel() {
        KeyTable table = KeyTable.builder("region", "store")
            .add(new int[]{0}, AGGREGATED, AGGREGATED)
            .add(new int[]{1}, "east", AGGREGATED)
            .add(new int[]{2}, "east", "a")
            .add(new int[]{3}, "east", "b")
            .add(new int[]{4}, "west", "c")
            .build();
        KeyStructure structure = KeyStructure.of(table);

        RealMatrix s = SummingMatrixBuilder.levelMerge(structure);

        assertThat(s.getData()).isDeepEqualTo(new double[][]{
            {1, 1, 1},
            {1, 1, 0},
            {1, 0, 0},
            {0, 1, 0},
            {0, 0, 1}
        });
        assertThat(MatrixOps.maxAbsDifference(s, SummingMatrixBuilder.dense(structure))).isZero();
    }

    @Test
    @DisplayName("coordinate list has one entry per series and constituent leaf")
    void coordinateList() {
        List<int[]> coordinates = SummingMatrixBuilder.coordinates(KeyStructure.of(TestHierarchies.totalAndTwoRegions()));

        assertThat(coordinates.stream().map(Arrays::toString).collect(Collectors.toList()))
            .containsExactly("[0, 0]", "[0, 1]", "[1, 0]", "[2, 1]");
    }

    @Test
    @DisplayName("fails when a level cannot be ordered against the base level")
    void rejectsIncomparableLevels() {
        KeyTable table = KeyTable.builder("region", "purpose")
            .add(new int[]{0}, "north", AGGREGATED)
            .add(new int[]{1}, AGGREGATED, "holiday")
            .build();
        List<AggregationLevel> levels = List.of(
            new AggregationLevel(new boolean[]{false, true}, List.of(0)),
            new AggregationLevel(new boolean[]{true, false}, List.of(1)));

        assertThatThrownBy(() -> SummingMatrixBuilder.levelMerge(table, levels))
            .isInstanceOf(HierarchyStructureException.class)
            .hasMessageContaining("cannot be ordered");
    }

    @Test
    @DisplayName("aggregation levels compare elementwise")
    void levelOrdering() {
        AggregationLevel leaves = new AggregationLevel(new boolean[]{false, false}, List.of());
        AggregationLevel byRegion = new AggregationLevel(new boolean[]{false, true}, List.of());
        AggregationLevel byPurpose = new AggregationLevel(new boolean[]{true, false}, List.of());
        AggregationLevel total = new AggregationLevel(new boolean[]{true, true}, List.of());

        assertThat(total.isMoreAggregatedThan(byRegion)).isTrue();
        assertThat(byRegion.isMoreAggregatedThan(leaves)).isTrue();
        assertThat(leaves.isMoreAggregatedThan(byRegion)).isFalse();
        assertThat(byRegion.isComparableTo(byPurpose)).isFalse();
        assertThat(total.patternString()).isEqualTo("**");
    }
}
