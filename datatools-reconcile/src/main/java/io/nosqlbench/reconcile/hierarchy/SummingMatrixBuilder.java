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

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.OpenMapRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Builds the summing matrix S of a hierarchy.
///
/// S has one row per series in key table order and one column per leaf series.
/// Entry (i, j) is 1 when leaf j is summed into series i. Every leaf row is a
/// unit vector and the total row, when present, is all ones.
///
/// ## Construction strategies
///
/// | Method | Source | Result |
/// |--------|--------|--------|
/// | [#dense(KeyStructure)] | resolved leaf sets | dense matrix |
/// | [#sparse(KeyStructure)] | resolved leaf sets as a coordinate list | sparse matrix |
/// | [#levelMerge(KeyStructure)] | aggregation levels, merged onto the leaves | dense matrix |
///
/// All three produce the same matrix for a valid structure.
public final class SummingMatrixBuilder {

    private static final Logger logger = LogManager.getLogger(SummingMatrixBuilder.class);

    private SummingMatrixBuilder() {
        // Utility class
    }

    /// Builds S directly from the resolved leaf set of every series.
    public static RealMatrix dense(KeyStructure structure) {
        double[][] s = new double[structure.seriesCount()][structure.leafCount()];
        for (int i = 0; i < s.length; i++) {
            for (int col : structure.aggregation(i)) {
                s[i][col] = 1.0;
            }
        }
        return new Array2DRowRealMatrix(s, false);
    }

    /// Builds S as a sparse matrix from its coordinate list.
    ///
    /// One entry is written per (series, constituent leaf) pair with value 1.
    public static OpenMapRealMatrix sparse(KeyStructure structure) {
        OpenMapRealMatrix s = new OpenMapRealMatrix(structure.seriesCount(), structure.leafCount());
        for (int[] coordinate : coordinates(structure)) {
            s.setEntry(coordinate[0], coordinate[1], 1.0);
        }
        return s;
    }

    /// Coordinate list of the nonzero entries of S as `{row, column}` pairs, row-major.
    public static List<int[]> coordinates(KeyStructure structure) {
        List<int[]> coordinates = new ArrayList<>(structure.membershipCount());
        for (int i = 0; i < structure.seriesCount(); i++) {
            for (int col : structure.aggregation(i)) {
                coordinates.add(new int[]{i, col});
            }
        }
        return coordinates;
    }

    /// Builds S by merging aggregation levels from the leaves upward.
    ///
    /// @see #levelMerge(KeyTable, List)
    public static RealMatrix levelMerge(KeyStructure structure) {
        return levelMerge(structure.table(), structure.levels());
    }

    /// Builds S by merging aggregation levels onto the least aggregated level.
    ///
    /// The least aggregated level starts as an identity block and supplies the
    /// columns. Every other level `y` is merged onto that base level: each series of
    /// `y` gets the sum of the base rows it covers, so intermediate levels never
    /// decide which leaves an aggregate reaches. Rows are kept in a map from key
    /// table position to row data and are put back into key table order at the end.
    ///
    /// @throws HierarchyStructureException if a level is not more aggregated than the
    ///     base level, or a series covers no series of the base level
    static RealMatrix levelMerge(KeyTable table, List<AggregationLevel> levels) {
        List<AggregationLevel> ordered = new ArrayList<>(levels);
        ordered.sort(AggregationLevel::compareByAggregation);

        AggregationLevel base = ordered.get(0);
        int columns = base.series().size();
        Map<Integer, double[]> rows = new LinkedHashMap<>();
        for (int col = 0; col < columns; col++) {
            double[] unit = new double[columns];
            unit[col] = 1.0;
            rows.put(base.series().get(col), unit);
        }

        for (AggregationLevel y : ordered.subList(1, ordered.size())) {
            if (!y.isMoreAggregatedThan(base)) {
                throw new HierarchyStructureException("Aggregation level " + y.patternString()
                    + " cannot be ordered against base level " + base.patternString());
            }
            for (int seriesIndex : y.series()) {
                rows.put(seriesIndex, sumCovered(table, seriesIndex, base, rows));
            }
            logger.debug("Merged level {} onto level {}", y.patternString(), base.patternString());
        }

        if (rows.size() != table.size()) {
            throw new HierarchyStructureException("Merged " + rows.size() + " rows for a table of "
                + table.size() + " series");
        }
        double[][] s = new double[table.size()][];
        for (Map.Entry<Integer, double[]> row : rows.entrySet()) {
            s[row.getKey()] = row.getValue();
        }
        return new Array2DRowRealMatrix(s, false);
    }

    private static double[] sumCovered(KeyTable table, int seriesIndex, AggregationLevel x,
                                       Map<Integer, double[]> rows) {
        SeriesKey key = table.key(seriesIndex);
        double[] sum = null;
        for (int finer : x.series()) {
            if (key.covers(table.key(finer))) {
                double[] row = rows.get(finer);
                if (sum == null) {
                    sum = new double[row.length];
                }
                for (int c = 0; c < row.length; c++) {
                    sum[c] += row[c];
                }
            }
        }
        if (sum == null) {
            throw new HierarchyStructureException("Series " + key + " covers no series of level "
                + x.patternString());
        }
        for (double v : sum) {
            if (v > 1.0) {
                throw new HierarchyStructureException("Series " + key + " counts a leaf more than once");
            }
        }
        return sum;
    }

    /// Row sums of S; for each series, the number of leaves summed into it.
    public static double[] rowSums(RealMatrix s) {
        double[] sums = new double[s.getRowDimension()];
        for (int i = 0; i < sums.length; i++) {
            double total = 0;
            for (int j = 0; j < s.getColumnDimension(); j++) {
                total += s.getEntry(i, j);
            }
            sums[i] = total;
        }
        return sums;
    }
}
