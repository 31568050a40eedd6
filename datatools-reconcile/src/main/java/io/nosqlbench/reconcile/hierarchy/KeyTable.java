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

/// Ordered description of every series in a hierarchy.
///
/// Each entry pairs a [SeriesKey] with the set of original observation rows that
/// belong to that series. Entry order is significant: summing matrix rows,
/// weight matrix rows and reconciled output all follow it.
///
/// ```java
/// KeyTable table = KeyTable.builder("region")
///     .add(new int[]{0}, SeriesKey.AGGREGATED)
///     .add(new int[]{1}, "east")
///     .add(new int[]{2}, "west")
///     .build();
/// ```
public final class KeyTable {

    /// One series definition.
    ///
    /// @param key the series key
    /// @param rows the original observation rows of this series, sorted ascending
    public record Entry(SeriesKey key, int[] rows) {
        public Entry {
            if (key == null) {
                throw new IllegalArgumentException("Entry key cannot be null");
            }
            rows = rows == null ? new int[0] : rows.clone();
            Arrays.sort(rows);
        }

        @Override
        public int[] rows() {
            return rows.clone();
        }

        /// Lowest observation row of this series, or [Integer#MAX_VALUE] if it has none.
        public int firstRow() {
            return rows.length == 0 ? Integer.MAX_VALUE : rows[0];
        }

        @Override
        public String toString() {
            return key + " rows=" + Arrays.toString(rows);
        }
    }

    private final List<String> dimensionNames;
    private final List<Entry> entries;

    private KeyTable(List<String> dimensionNames, List<Entry> entries) {
        this.dimensionNames = Collections.unmodifiableList(new ArrayList<>(dimensionNames));
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public static Builder builder(String... dimensionNames) {
        return new Builder(Arrays.asList(dimensionNames));
    }

    public List<String> dimensionNames() {
        return dimensionNames;
    }

    public int dimensions() {
        return dimensionNames.size();
    }

    public int size() {
        return entries.size();
    }

    public Entry entry(int index) {
        return entries.get(index);
    }

    public SeriesKey key(int index) {
        return entries.get(index).key();
    }

    public List<Entry> entries() {
        return entries;
    }

    /// @return every series key in table order
    public List<SeriesKey> keys() {
        List<SeriesKey> keys = new ArrayList<>(entries.size());
        for (Entry entry : entries) {
            keys.add(entry.key());
        }
        return keys;
    }

    /// @return the table position of `key`, or -1 if absent
    public int indexOf(SeriesKey key) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).key().equals(key)) {
                return i;
            }
        }
        return -1;
    }

    /// Builder for [KeyTable].
    public static final class Builder {
        private final List<String> dimensionNames;
        private final List<Entry> entries = new ArrayList<>();

        private Builder(List<String> dimensionNames) {
            if (dimensionNames.isEmpty()) {
                throw new IllegalArgumentException("A key table needs at least one dimension");
            }
            this.dimensionNames = dimensionNames;
        }

        public Builder add(int[] rows, String... values) {
            return add(SeriesKey.of(values), rows);
        }

        public Builder add(SeriesKey key, int... rows) {
            if (key.dimensions() != dimensionNames.size()) {
                throw new IllegalArgumentException("Key " + key + " has " + key.dimensions()
                    + " dimensions, table has " + dimensionNames.size() + " " + dimensionNames);
            }
            entries.add(new Entry(key, rows));
            return this;
        }

        public KeyTable build() {
            if (entries.isEmpty()) {
                throw new IllegalArgumentException("A key table needs at least one series");
            }
            return new KeyTable(dimensionNames, entries);
        }
    }
}
