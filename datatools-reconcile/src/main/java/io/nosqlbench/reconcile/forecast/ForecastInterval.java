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

import java.time.temporal.ChronoUnit;

/// Spacing between consecutive forecast steps, e.g. 1 month or 15 minutes.
///
/// @param amount number of units per step, positive
/// @param unit the time unit
public record ForecastInterval(long amount, ChronoUnit unit) {

    public ForecastInterval {
        if (amount <= 0) {
            throw new IllegalArgumentException("Interval amount must be positive, got: " + amount);
        }
        if (unit == null) {
            throw new IllegalArgumentException("Interval unit cannot be null");
        }
    }

    public static ForecastInterval of(long amount, ChronoUnit unit) {
        return new ForecastInterval(amount, unit);
    }

    @Override
    public String toString() {
        return amount + " " + unit.toString().toLowerCase();
    }
}
