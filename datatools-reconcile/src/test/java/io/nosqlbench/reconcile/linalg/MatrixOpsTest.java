package io.nosqlbench.reconcile.linalg;

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
import io.nosqlbench.reconcile.hierarchy.SummingMatrixBuilder;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Matrix helpers")
class MatrixOpsTest {

    @Test
    @DisplayName("cov2cor gives a unit diagonal and scaled off-diagonals")
    void covarianceToCorrelation() {
        RealMatrix covariance = new Array2DRowRealMatrix(new double[][]{
            {4.0, 2.0},
            {2.0, 9.0}
        });

        RealMatrix correlation = MatrixOps.cov2cor(covariance);

        assertThat(correlation.getEntry(0, 0)).isEqualTo(1.0);
        assertThat(correlation.getEntry(1, 1)).isEqualTo(1.0);
        assertThat(correlation.getEntry(0, 1)).isCloseTo(2.0 / 6.0, within(1e-15));
        assertThat(correlation.getEntry(1, 0)).isEqualTo(correlation.getEntry(0, 1));
    }

    @Test
    @DisplayName("cov2cor rejects a non-positive diagonal")
    void covarianceWithZeroVariance() {
        RealMatrix covariance = new Array2DRowRealMatrix(new double[][]{
            {1.0, 0.0},
            {0.0, 0.0}
        });

        assertThatThrownBy(() -> MatrixOps.cov2cor(covariance))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("entry 1");
    }

    @Test
    @DisplayName("Minimum eigenvalue of a symmetric matrix")
    void minimumEigenvalue() {
        RealMatrix m = new Array2DRowRealMatrix(new double[][]{
            {2.0, 1.0},
            {1.0, 2.0}
        });

        assertThat(MatrixOps.minEigenvalue(m)).isCloseTo(1.0, within(1e-12));
    }

    @Test
    @DisplayName("Constraint matrix annihilates the summing matrix")
    void constraintsAnnihilateSumming() {
        KeyStructure structure = KeyStructure.of(TestHierarchies.regionByPurpose());

        RealMatrix u = SparseMatrixBackend.constraints(structure);
        RealMatrix s = SummingMatrixBuilder.dense(structure);

        assertThat(u.getRowDimension()).isEqualTo(structure.aggregateCount());
        RealMatrix product = u.multiply(s);
        RealMatrix zero = new Array2DRowRealMatrix(product.getRowDimension(), product.getColumnDimension());
        assertThat(MatrixOps.maxAbsDifference(product, zero)).isZero();
    }

    @Test
    @DisplayName("Selection matrix picks leaf rows out of the summing matrix")
    void selectionPicksLeaves() {
        KeyStructure structure = KeyStructure.of(TestHierarchies.stateCity());

        RealMatrix j = SparseMatrixBackend.selection(structure);
        RealMatrix s = SummingMatrixBuilder.dense(structure);
        RealMatrix identity = MatrixUtils.createRealIdentityMatrix(3);

        assertThat(MatrixOps.maxAbsDifference(j.multiply(s), identity)).isZero();
    }

    @Test
    @DisplayName("Difference requires matching shapes")
    void differenceShapeMismatch() {
        assertThatThrownBy(() -> MatrixOps.maxAbsDifference(
            new Array2DRowRealMatrix(2, 2), new Array2DRowRealMatrix(2, 3)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
