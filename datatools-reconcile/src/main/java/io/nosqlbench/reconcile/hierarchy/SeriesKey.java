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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// Identifies one series of a hierarchy or grouping.
///
/// A key holds one value per dimension. A value is either a concrete category or
/// the [#AGGREGATED] marker, meaning the series is summed over that dimension.
/// A key with no aggregated dimension identifies a leaf series.
///
/// ```
/// region   purpose      kind
/// ───────  ───────────  ─────────────────────────────
/// NSW      Holiday      leaf
/// NSW      <aggregated> NSW, summed over purpose
/// <aggr.>  <aggregated> total
/// ```
public final class SeriesKey {

    /// Marker value for a dimension that has been summed over.
    public static final String AGGREGATED = "<aggregated>";

    private final List<String> values;

    private SeriesKey(List<String> values) {
        this.values = values;
    }

    /// Creates a key from per-dimension values.
    ///
    /// @param values one value per dimension; use [#AGGREGATED] for summed dimensions
    /// @return the key
    /// @throws IllegalArgumentException if no values are given or any value is null
    public static SeriesKey of(String... values) {
        return of(Arrays.asList(values));
    }

    public static SeriesKey of(List<String> values) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("A series key needs at least one dimension");
        }
        List<String> copy = new ArrayList<>(values.size());
        for (String value : values) {
            copy.add(Objects.requireNonNull(value, "Series key values cannot be null, use SeriesKey.AGGREGATED"));
        }
        return new SeriesKey(Collections.unmodifiableList(copy));
    }

    public int dimensions() {
        return values.size();
    }

    public String value(int dimension) {
        return values.get(dimension);
    }

    public List<String> values() {
        return values;
    }

    public boolean isAggregated(int dimension) {
        return AGGREGATED.equals(values.get(dimension));
    }

    /// Returns the aggregated flag of every dimension, in dimension order.
    public boolean[] aggregationPattern() {
        boolean[] pattern = new boolean[values.size()];
        for (int d = 0; d < pattern.length; d++) {
            pattern[d] = isAggregated(d);
        }
        return pattern;
    }

    /// @return true when no dimension is aggregated
    public boolean isLeaf() {
        for (int d = 0; d < values.size(); d++) {
            if (isAggregated(d)) {
                return false;
            }
        }
        return true;
    }

    /// Tests whether this key agrees with another on every dimension this key does not aggregate.
    ///
    /// For an aggregate key and a finer key this answers "is the finer series part of this one".
    ///
    /// @param finer a key with the same number of dimensions
    /// @return true if every non-aggregated value of this key equals the value in `finer`
    public boolean covers(SeriesKey finer) {
        if (finer.dimensions() != dimensions()) {
            throw new IllegalArgumentException("Keys differ in dimensions: " + this + " vs " + finer);
        }
        for (int d = 0; d < values.size(); d++) {
            if (!isAggregated(d) && !values.get(d).equals(finer.value(d))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SeriesKey)) return false;
        return values.equals(((SeriesKey) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "SeriesKey" + values;
    }
}
