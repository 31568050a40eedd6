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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Resolved aggregation structure of a [KeyTable].
///
/// ## Resolution
///
/// Series are grouped into [AggregationLevel]s by their aggregated-flag pattern.
/// Exactly one level may have no aggregated dimension; its series are the leaves,
/// and their key table order defines the leaf (column) order of every summing
/// matrix built from this structure. Each other series is resolved to the leaves
/// whose values agree with it on every dimension it does not aggregate.
///
/// ```
///  key table                 leaf columns     aggregation
///  ───────────────────────   ──────────────   ───────────
///  0  <agg>  <agg>                            {0, 1, 2}
///  1  east   <agg>                            {0, 1}
///  2  east   a        ──►    col 0            {0}
///  3  east   b        ──►    col 1            {1}
///  4  west   a        ──►    col 2            {2}
/// ```
///
/// ## Observation rows
///
/// Every key must be unique across the table, and leaf row sets must not overlap.
/// Rows are otherwise treated as opaque identifiers: the structure is derived
/// from the keys alone, so aggregate row sets are not compared against the union
/// of their leaves, and rows no leaf covers are not detected.
///
/// Instances are immutable and can be shared across reconciliation calls.
public final class KeyStructure {

    private static final Logger logger = LogManager.getLogger(KeyStructure.class);

    private final KeyTable table;
    private final List<AggregationLevel> levels;
    private final AggregationLevel leafLevel;
    private final int[] leafSeries;
    private final int[] leafColumnOf;
    private final int[][] aggregation;

    private KeyStructure(KeyTable table, List<AggregationLevel> levels, AggregationLevel leafLevel,
                         int[] leafSeries, int[][] aggregation) {
        this.table = table;
        this.levels = Collections.unmodifiableList(levels);
        this.leafLevel = leafLevel;
        this.leafSeries = leafSeries;
        this.aggregation = aggregation;
        this.leafColumnOf = new int[table.size()];
        Arrays.fill(leafColumnOf, -1);
        for (int col = 0; col < leafSeries.length; col++) {
            leafColumnOf[leafSeries[col]] = col;
        }
    }

    /// Resolves the aggregation structure of a key table.
    ///
    /// @param table the key table
    /// @return the resolved structure
    /// @throws HierarchyStructureException if a key repeats, there is not exactly one leaf level,
    ///     leaves share observation rows, or an aggregate series matches no leaf
    public static KeyStructure of(KeyTable table) {
        checkUniqueKeys(table);
        List<AggregationLevel> levels = groupLevels(table);

        List<AggregationLevel> leafLevels = new ArrayList<>();
        for (AggregationLevel level : levels) {
            if (level.isLeafLevel()) {
                leafLevels.add(level);
            }
        }
        if (leafLevels.size() != 1) {
            throw new HierarchyStructureException("Expected exactly one leaf level without aggregated "
                + "dimensions, found " + leafLevels.size() + " among levels " + patterns(levels));
        }
        AggregationLevel leafLevel = leafLevels.get(0);
        int[] leafSeries = leafLevel.series().stream().mapToInt(Integer::intValue).toArray();
        checkLeaves(table, leafSeries);

        int[][] aggregation = new int[table.size()][];
        for (int col = 0; col < leafSeries.length; col++) {
            aggregation[leafSeries[col]] = new int[]{col};
        }
        for (AggregationLevel level : levels) {
            if (level == leafLevel) {
                continue;
            }
            for (int seriesIndex : level.series()) {
                aggregation[seriesIndex] = matchLeaves(table, seriesIndex, leafSeries);
            }
        }

        logger.debug("Resolved {} series into {} levels with {} leaves", table.size(), levels.size(),
            leafSeries.length);
        return new KeyStructure(table, levels, leafLevel, leafSeries, aggregation);
    }

    private static List<AggregationLevel> groupLevels(KeyTable table) {
        Map<String, List<Integer>> byPattern = new LinkedHashMap<>();
        Map<String, boolean[]> patterns = new LinkedHashMap<>();
        for (int i = 0; i < table.size(); i++) {
            boolean[] pattern = table.key(i).aggregationPattern();
            String id = Arrays.toString(pattern);
            patterns.putIfAbsent(id, pattern);
            byPattern.computeIfAbsent(id, k -> new ArrayList<>()).add(i);
        }
        List<AggregationLevel> levels = new ArrayList<>(byPattern.size());
        for (Map.Entry<String, List<Integer>> e : byPattern.entrySet()) {
            levels.add(new AggregationLevel(patterns.get(e.getKey()), e.getValue()));
        }
        return levels;
    }

    private static void checkUniqueKeys(KeyTable table) {
        Set<SeriesKey> seen = new HashSet<>();
        for (SeriesKey key : table.keys()) {
            if (!seen.add(key)) {
                String kind = key.isLeaf() ? "Leaf" : "Aggregate";
                throw new HierarchyStructureException(kind + " series " + key + " appears more than once");
            }
        }
    }

    private static void checkLeaves(KeyTable table, int[] leafSeries) {
        BitSet rows = new BitSet();
        for (int seriesIndex : leafSeries) {
            KeyTable.Entry entry = table.entry(seriesIndex);
            for (int row : entry.rows()) {
                if (rows.get(row)) {
                    throw new HierarchyStructureException("Leaf series " + entry.key()
                        + " shares observation row " + row + " with another leaf");
                }
                rows.set(row);
            }
        }
    }

    private static int[] matchLeaves(KeyTable table, int seriesIndex, int[] leafSeries) {
        SeriesKey key = table.key(seriesIndex);
        List<Integer> matched = new ArrayList<>();
        for (int col = 0; col < leafSeries.length; col++) {
            if (key.covers(table.key(leafSeries[col]))) {
                matched.add(col);
            }
        }
        if (matched.isEmpty()) {
            throw new HierarchyStructureException("Aggregate series " + key + " does not contain any leaf series");
        }
        return matched.stream().mapToInt(Integer::intValue).toArray();
    }

    private static List<String> patterns(List<AggregationLevel> levels) {
        List<String> out = new ArrayList<>();
        for (AggregationLevel level : levels) {
            out.add(level.patternString());
        }
        return out;
    }

    public KeyTable table() {
        return table;
    }

    /// @return aggregation levels in order of first appearance in the key table
    public List<AggregationLevel> levels() {
        return levels;
    }

    public AggregationLevel leafLevel() {
        return leafLevel;
    }

    public int seriesCount() {
        return table.size();
    }

    public int leafCount() {
        return leafSeries.length;
    }

    public int aggregateCount() {
        return table.size() - leafSeries.length;
    }

    /// @return key table positions of the leaf series, in leaf column order
    public int[] leafSeries() {
        return leafSeries.clone();
    }

    /// @return key table positions of the non-leaf series, ascending
    public int[] aggregateSeries() {
        int[] out = new int[aggregateCount()];
        int k = 0;
        for (int i = 0; i < table.size(); i++) {
            if (leafColumnOf[i] < 0) {
                out[k++] = i;
            }
        }
        return out;
    }

    public boolean isLeaf(int seriesIndex) {
        return leafColumnOf[seriesIndex] >= 0;
    }

    /// @return the leaf column of a leaf series, or -1 for an aggregate
    public int leafColumn(int seriesIndex) {
        return leafColumnOf[seriesIndex];
    }

    /// Leaf columns summed into a series, ascending. A leaf maps to its own column.
    public int[] aggregation(int seriesIndex) {
        return aggregation[seriesIndex].clone();
    }

    /// Number of leaves summed into a series.
    public int aggregationSize(int seriesIndex) {
        return aggregation[seriesIndex].length;
    }

    /// Total number of (series, leaf) memberships, the nonzero count of the summing matrix.
    public int membershipCount() {
        int count = 0;
        for (int[] leaves : aggregation) {
            count += leaves.length;
        }
        return count;
    }
}
