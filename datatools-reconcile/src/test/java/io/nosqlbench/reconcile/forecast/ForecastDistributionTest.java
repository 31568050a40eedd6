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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Forecast distributions")
class ForecastDistributionTest {

    @Test
    @DisplayName("Gaussian quantiles follow the normal distribution")
    void gaussianQuantiles() {
        GaussianForecast g = new GaussianForecast(10.0, 2.0);

        assertThat(g.quantile(0.5)).isCloseTo(10.0, within(1e-9));
        assertThat(g.quantile(0.975)).isCloseTo(10.0 + 1.959964 * 2.0, within(1e-5));
        assertThat(g.variance()).isEqualTo(4.0);
        assertThat(g.isGaussian()).isTrue();
    }

    @Test
    @DisplayName("Zero-variance Gaussian collapses to its mean")
    void zeroVarianceGaussian() {
        GaussianForecast g = GaussianForecast.ofVariance(3.0, 0.0);

        assertThat(g.quantile(0.1)).isEqualTo(3.0);
        assertThat(g.quantile(0.9)).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Negative rounding noise in a variance is clamped")
    void clampsTinyNegativeVariance() {
        assertThat(GaussianForecast.ofVariance(1.0, -1e-15).stdDev()).isZero();
        assertThatThrownBy(() -> new GaussianForecast(1.0, -1.0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Sample forecasts summarize their draws")
    void sampleSummaries() {
        SampleForecast s = new SampleForecast(1.0, 2.0, 3.0, 4.0, 5.0);

        assertThat(s.mean()).isEqualTo(3.0);
        assertThat(s.variance()).isCloseTo(2.5, within(1e-12));
        assertThat(s.quantile(0.5)).isEqualTo(3.0);
        assertThat(s.isGaussian()).isFalse();
        assertThat(s.family()).isEqualTo(SampleForecast.FAMILY);
    }

    @Test
    @DisplayName("Degenerate forecasts have no spread")
    void degenerate() {
        DegenerateForecast d = new DegenerateForecast(7.5);

        assertThat(d.mean()).isEqualTo(7.5);
        assertThat(d.variance()).isZero();
        assertThat(d.quantile(0.01)).isEqualTo(7.5);
        assertThat(d.isGaussian()).isFalse();
    }
}
