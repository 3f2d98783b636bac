package com.tsmonitor.anomaly.engine.statistical;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SampleStatisticsTest {

    @Test
    void of_usesPopulationStdAndLinearQuartiles() {
        SampleStatistics stats = SampleStatistics.of(new double[] {1, 2, 3, 4, 5, 6, 7, 8, 9, 10});

        assertThat(stats.mean()).isEqualTo(5.5);
        assertThat(stats.std()).isCloseTo(Math.sqrt(8.25), within(1e-12));
        assertThat(stats.median()).isEqualTo(5.5);
        assertThat(stats.q1()).isCloseTo(3.25, within(1e-12));
        assertThat(stats.q3()).isCloseTo(7.75, within(1e-12));
        assertThat(stats.mad()).isEqualTo(2.5);
        assertThat(stats.lowerFence()).isCloseTo(3.25 - 1.5 * 4.5, within(1e-12));
    }
}
