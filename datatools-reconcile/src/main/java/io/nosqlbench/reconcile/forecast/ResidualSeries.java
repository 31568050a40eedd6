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

import java.util.Arrays;

/// One-step-ahead residuals of a single series model.
///
/// @param timestamps time index of each residual, strictly increasing
/// @param values residual values; NaN marks a missing residual
public record ResidualSeries(long[] timestamps, double[] values) {

    public ResidualSeries {
        if (timestamps == null || values == null) {
            throw new IllegalArgumentException("Timestamps and values cannot be null");
        }
        if (timestamps.length != values.length) {
            throw new IllegalArgumentException("Got " + timestamps.length + " timestamps for "
                + values.length + " residuals");
        }
        for (int i = 1; i < timestamps.length; i++) {
            if (timestamps[i] <= timestamps[i - 1]) {
                throw new IllegalArgumentException("Residual timestamps must be strictly increasing at position " + i);
            }
        }
        timestamps = timestamps.clone();
        values = values.clone();
    }

    /// Residuals at consecutive timestamps starting from `start`.
    public static ResidualSeries startingAt(long start, double... values) {
        long[] timestamps = new long[values.length];
        for (int i = 0; i < values.length; i++) {
            timestamps[i] = start + i;
        }
        return new ResidualSeries(timestamps, values);
    }

    @Override
    public long[] timestamps() {
        return timestamps.clone();
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    public int size() {
        return values.length;
    }

    @Override
    public String toString() {
        return "ResidualSeries[n=" + values.length + ", " + Arrays.toString(Arrays.copyOf(timestamps,
            Math.min(3, timestamps.length))) + "...]";
    }
}
