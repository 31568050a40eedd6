package io.nosqlbench.reconcile.projection;

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
import io.nosqlbench.reconcile.hierarchy.KeyStructure;
import io.nosqlbench.reconcile.hierarchy.KeyTable;
import io.nosqlbench.reconcile.linalg.DenseMatrixBackend;
import io.nosqlbench.reconcile.linalg.MatrixOps;
import io.nosqlbench.reconcile.linalg.SparseMatrixBackend;
import io.nosqlbench.reconcile.weights.WeightEstimator;
import io.nosqlbench.reconcile.weights.WeightMethod;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Reconciliation projector")
class ReconciliationProjectorTest {

    private static final double TOLERANCE = 1e-9;

    private static final List<KeyTable> HIERARCHIES = List.of(
        TestHierarchies.totalAndTwoRegions(),
        TestHierarchies.totalAndLeaves(5),
        TestHierarchies.stateCity(),
        TestHierarchies.regionByPurpose()
    );

    private static double[][] independentResiduals(long seed, int rows, int cols) {
        Random random = new Random(seed);
        double[][] r = new double[rows][cols];
        for (int t = 0; t < rows; t++) {
            for (int j = 0; j < cols; j++) {
                r[t][j] = random.nextGaussian() * (1.0 + j);
            }
        }
        return r;
    }

    private static RealMatrix weightsFor(WeightMethod method, KeyStructure structure) {
        double[][] residuals = independentResiduals(42, 60, structure.seriesCount());
        return new WeightEstimator(method).estimate(residuals, structure);
    }

    @Nested
    @DisplayName("Coherence")
    class Coherence {

        @ParameterizedTest
        @EnumSource(WeightMethod.class)
        @DisplayName("Dense projection satisfies S P S = S")
        void denseIsCoherent(WeightMethod method) {
            for (KeyTable table : HIERARCHIES) {
                KeyStructure structure = KeyStructure.of(table);
                Projector projector = new ReconciliationProjector(new DenseMatrixBackend())
                    .project(structure, weightsFor(method, structure));
                assertThat(projector.coherenceError()).as("%s on %s", method, table.keys())
                    .isLessThan(TOLERANCE);
            }
        }

        @ParameterizedTest
        @EnumSource(WeightMethod.class)
        @DisplayName("Sparse projection satisfies S P S = S")
        void sparseIsCoherent(WeightMethod method) {
            for (KeyTable table : HIERARCHIES) {
                KeyStructure structure = KeyStructure.of(table);
                Projector projector = new ReconciliationProjector(new SparseMatrixBackend())
                    .project(structure, weightsFor(method, structure));
                assertThat(projector.coherenceError()).as("%s on %s", method, table.keys())
                    .isLessThan(TOLERANCE);
            }
        }

        @ParameterizedTest
        @EnumSource(WeightMethod.class)
        @DisplayName("Dense and sparse backends compute the same projection")
        void backendsAgree(WeightMethod method) {
            for (KeyTable table : HIERARCHIES) {
                KeyStructure structure = KeyStructure.of(table);
                RealMatrix weights = weightsFor(method, structure);
                Projector dense = new ReconciliationProjector(new DenseMatrixBackend()).project(structure, weights);
                Projector sparse = new ReconciliationProjector(new SparseMatrixBackend()).project(structure, weights);
                assertThat(MatrixOps.maxAbsDifference(dense.projection(), sparse.projection()))
                    .as("%s on %s", method, table.keys())
                    .isLessThan(TOLERANCE);
            }
        }

        @Test
        @DisplayName("Coherent base values pass through unchanged")
        void coherentValuesAreFixed() {
            KeyStructure structure = KeyStructure.of(TestHierarchies.stateCity());
            Projector projector = new ReconciliationProjector(new DenseMatrixBackend())
                .project(structure, weightsFor(WeightMethod.MINT_SHRINK, structure));

            double[] coherent = projector.summing().operate(new double[]{3.0, 4.0, 10.0});
            assertThat(projector.reconcile(coherent)).containsExactly(coherent, within(TOLERANCE));
        }

        @Test
        @DisplayName("Leaves without aggregates project onto themselves")
        void leavesOnly() {
            KeyTable table = KeyTable.builder("region")
                .add(new int[]{0}, "east")
                .add(new int[]{1}, "west")
                .build();
            KeyStructure structure = KeyStructure.of(table);

            Projector projector = new ReconciliationProjector(new SparseMatrixBackend())
                .project(structure, MatrixUtils.createRealIdentityMatrix(2));

            assertThat(projector.reconcile(new double[]{1.5, 2.5})).containsExactly(1.5, 2.5);
        }
    }

    @Nested
    @DisplayName("Values")
    class Values {

        private final KeyStructure structure = KeyStructure.of(TestHierarchies.totalAndTwoRegions());

        @Test
        @DisplayName("Structural weights split the incoherence by leaf count")
        void structuralWeights() {
            RealMatrix weights = new WeightEstimator(WeightMethod.WLS_STRUCT).estimate(new double[0][], structure);

            for (Projector projector : List.of(
                new ReconciliationProjector(new DenseMatrixBackend()).project(structure, weights),
                new ReconciliationProjector(new SparseMatrixBackend()).project(structure, weights))) {
                assertThat(projector.reconcile(new double[]{12.0, 5.0, 6.0}))
                    .as(projector.backend())
                    .containsExactly(new double[]{11.5, 5.25, 6.25}, within(TOLERANCE));
            }
        }

        @Test
        @DisplayName("Identity weights give equal reconciled variances of two thirds")
        void olsVariances() {
            RealMatrix weights = MatrixUtils.createRealIdentityMatrix(3);
            Projector projector = new ReconciliationProjector(new DenseMatrixBackend()).project(structure, weights);
            VariancePropagator propagator = new VariancePropagator(projector, weights);

            assertThat(propagator.variances(new double[]{1.0, 1.0, 1.0}))
                .containsExactly(new double[]{2.0 / 3.0, 2.0 / 3.0, 2.0 / 3.0}, within(TOLERANCE));
        }

        @Test
        @DisplayName("Variances scale with the base standard deviations")
        void variancesScale() {
            RealMatrix weights = MatrixUtils.createRealIdentityMatrix(3);
            Projector projector = new ReconciliationProjector(new DenseMatrixBackend()).project(structure, weights);
            VariancePropagator propagator = new VariancePropagator(projector, weights);

            assertThat(propagator.variances(new double[]{4.0, 4.0, 4.0}))
                .containsExactly(new double[]{8.0 / 3.0, 8.0 / 3.0, 8.0 / 3.0}, within(TOLERANCE));
        }

        @Test
        @DisplayName("Weight matrix must match the series count")
        void weightShapeMismatch() {
            assertThatThrownBy(() -> new ReconciliationProjector(new DenseMatrixBackend())
                .project(structure, MatrixUtils.createRealIdentityMatrix(2)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("3x3");
        }
    }
}
