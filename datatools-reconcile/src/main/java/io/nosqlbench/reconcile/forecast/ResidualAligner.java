package io.nosqlbench.reconcile.forecast;

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

import io.nosqlbench.reconcile.hierarchy.HierarchyStructureException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.TreeMap;

/// Aligns per-series residuals onto one timestamps × series matrix.
///
/// When every series carries the same timestamps the columns are bound directly.
/// Otherwise the series are joined by timestamp and any timestamp missing from a
/// series is dropped. In both cases a timestamp where any series has a NaN
/// residual is dropped, so only complete rows reach the covariance estimate.
public final class ResidualAligner {

    private static final Logger logger = LogManager.getLogger(ResidualAligner.class);

    private ResidualAligner() {
        // Utility class
    }

    /// Aligned residual matrix.
    ///
    /// @param timestamps the kept timestamps, ascending
    /// @param values residuals, `values[t][series]`
    public record AlignedResiduals(long[] timestamps, double[][] values) {
        public int rows() {
            return values.length;
        }

        public int series() {
            return values.length == 0 ? 0 : values[0].length;
        }
    }

    /// Aligns residuals, columns in the order given.
    ///
    /// @param residuals one residual series per hierarchy series
    /// @return the complete-case residual matrix
    /// @throws HierarchyStructureException if no timestamp is common to every series
    public static AlignedResiduals align(List<ResidualSeries> residuals) {
        if (residuals == null || residuals.isEmpty()) {
            throw new IllegalArgumentException("Residuals cannot be null or empty");
        }
        AlignedResiduals aligned = sharesTimestamps(residuals) ? bind(residuals) : join(residuals);
        AlignedResiduals complete = dropIncomplete(aligned);
        if (complete.rows() == 0) {
            throw new HierarchyStructureException("No timestamp has residuals for all "
                + residuals.size() + " series after alignment");
        }
        return complete;
    }

    private static boolean sharesTimestamps(List<ResidualSeries> residuals) {
        long[] first = residuals.get(0).timestamps();
        for (ResidualSeries series : residuals) {
            if (!Arrays.equals(first, series.timestamps())) {
                return false;
            }
        }
        return true;
    }

    private static AlignedResiduals bind(List<ResidualSeries> residuals) {
        int p = residuals.size();
        long[] timestamps = residuals.get(0).timestamps();
        double[][] values = new double[timestamps.length][p];
        for (int j = 0; j < p; j++) {
            double[] column = residuals.get(j).values();
            for (int t = 0; t < column.length; t++) {
                values[t][j] = column[t];
            }
        }
        return new AlignedResiduals(timestamps, values);
    }

    private static AlignedResiduals join(List<ResidualSeries> residuals) {
        int p = residuals.size();
        TreeMap<Long, double[]> rows = new TreeMap<>();
        TreeMap<Long, Integer> seen = new TreeMap<>();
        for (int j = 0; j < p; j++) {
            ResidualSeries series = residuals.get(j);
            long[] timestamps = series.timestamps();
            double[] column = series.values();
            for (int t = 0; t < timestamps.length; t++) {
                double[] row = rows.computeIfAbsent(timestamps[t], k -> new double[p]);
                row[j] = column[t];
                seen.merge(timestamps[t], 1, Integer::sum);
            }
        }
        int total = rows.size();
        rows.keySet().removeIf(ts -> seen.get(ts) < p);
        if (rows.size() < total) {
            logger.warn("Dropped {} of {} residual timestamps not shared by all {} series",
                total - rows.size(), total, p);
        }
        long[] timestamps = new long[rows.size()];
        double[][] values = new double[rows.size()][];
        int i = 0;
        for (var e : rows.entrySet()) {
            timestamps[i] = e.getKey();
            values[i] = e.getValue();
            i++;
        }
        return new AlignedResiduals(timestamps, values);
    }

    private static AlignedResiduals dropIncomplete(AlignedResiduals aligned) {
        List<Integer> keep = new ArrayList<>(aligned.rows());
        for (int t = 0; t < aligned.rows(); t++) {
            boolean complete = true;
            for (double v : aligned.values()[t]) {
                if (Double.isNaN(v)) {
                    complete = false;
                    break;
                }
            }
            if (complete) {
                keep.add(t);
            }
        }
        if (keep.size() == aligned.rows()) {
            return aligned;
        }
        logger.debug("Dropped {} residual rows with missing values", aligned.rows() - keep.size());
        long[] timestamps = new long[keep.size()];
        double[][] values = new double[keep.size()][];
        for (int i = 0; i < keep.size(); i++) {
            timestamps[i] = aligned.timestamps()[keep.get(i)];
            values[i] = aligned.values()[keep.get(i)];
        }
        return new AlignedResiduals(timestamps, values);
    }
}
