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

/// A group of series that aggregate the same dimensions.
///
/// Levels are partially ordered by their aggregated flags: a level is more
/// aggregated than another when it aggregates every dimension the other does
/// and at least one more. The level with no aggregated dimension holds the leaves
/// and sits below every other level.
public final class AggregationLevel {

    private final boolean[] pattern;
    private final List<Integer> series;

    AggregationLevel(boolean[] pattern, List<Integer> series) {
        this.pattern = pattern.clone();
        this.series = Collections.unmodifiableList(new ArrayList<>(series));
    }

    /// @return the aggregated flag per dimension
    public boolean[] pattern() {
        return pattern.clone();
    }

    /// @return key table positions of the series in this level, ascending
    public List<Integer> series() {
        return series;
    }

    public int aggregatedCount() {
        int count = 0;
        for (boolean flag : pattern) {
            if (flag) count++;
        }
        return count;
    }

    public boolean isLeafLevel() {
        return aggregatedCount() == 0;
    }

    /// Elementwise comparison of aggregated flags.
    ///
    /// @param other a level over the same dimensions
    /// @return true if this level aggregates a strict superset of the dimensions `other` aggregates
    public boolean isMoreAggregatedThan(AggregationLevel other) {
        boolean strictly = false;
        for (int d = 0; d < pattern.length; d++) {
            if (other.pattern[d] && !pattern[d]) {
                return false;
            }
            if (pattern[d] && !other.pattern[d]) {
                strictly = true;
            }
        }
        return strictly;
    }

    public boolean isComparableTo(AggregationLevel other) {
        return Arrays.equals(pattern, other.pattern)
            || isMoreAggregatedThan(other)
            || other.isMoreAggregatedThan(this);
    }

    /// Orders levels by aggregated count, then lexicographically with non-aggregated first.
    static int compareByAggregation(AggregationLevel a, AggregationLevel b) {
        int byCount = Integer.compare(a.aggregatedCount(), b.aggregatedCount());
        if (byCount != 0) {
            return byCount;
        }
        for (int d = 0; d < a.pattern.length; d++) {
            if (a.pattern[d] != b.pattern[d]) {
                return a.pattern[d] ? 1 : -1;
            }
        }
        return 0;
    }

    /// Renders the pattern as `*` for aggregated and `.` for concrete dimensions.
    public String patternString() {
        StringBuilder sb = new StringBuilder(pattern.length);
        for (boolean flag : pattern) {
            sb.append(flag ? '*' : '.');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "AggregationLevel[" + patternString() + ", series=" + series + "]";
    }
}
