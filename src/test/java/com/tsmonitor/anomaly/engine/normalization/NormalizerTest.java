package com.tsmonitor.anomaly.engine.normalization;

import com.tsmonitor.anomaly.exception.InvalidConfigurationException;
import com.tsmonitor.anomaly.exception.UnfittedStateException;
import com.tsmonitor.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class NormalizerTest {

    @ParameterizedTest
    @EnumSource(NormalizationMethod.class)
    void transformThenInverse_reproducesOriginal(NormalizationMethod method) {
        double[] train = TestDataFactory.gaussian(200, 40.0, 7.5, 11L);
        Normalizer normalizer = new Normalizer(method);

        double[] restored = normalizer.inverse(normalizer.transform(train, true));

        assertThat(restored).containsExactly(train, within(1e-9));
    }

    @Test
    void standard_centersAndScales() {
        Normalizer normalizer = new Normalizer(NormalizationMethod.STANDARD);
        // mean 5, population std 2
        double[] out = normalizer.transform(new double[] {2, 4, 4, 4, 5, 5, 7, 9}, true);

        assertThat(out[0]).isCloseTo(-1.5, within(1e-12));
        assertThat(out[7]).isCloseTo(2.0, within(1e-12));
    }

    @Test
    void minmax_mapsTrainingRangeToUnitInterval() {
        Normalizer normalizer = new Normalizer("minmax");
        double[] out = normalizer.transform(new double[] {10, 15, 20}, true);

        assertThat(out).containsExactly(new double[] {0.0, 0.5, 1.0}, within(1e-12));
        assertThat(normalizer.transform(new double[] {30}, false)[0]).isCloseTo(2.0, within(1e-12));
    }

    @Test
    void robust_usesMedianAndInterquartileRange() {
        Normalizer normalizer = new Normalizer(NormalizationMethod.ROBUST);
        // median 5, Q1 3, Q3 7
        normalizer.fit(new double[] {1, 2, 3, 4, 5, 6, 7, 8, 9});

        assertThat(normalizer.getState().getCenter()[0]).isEqualTo(5.0);
        assertThat(normalizer.getState().getScale()[0]).isEqualTo(4.0);
        assertThat(normalizer.transform(new double[] {13}, false)[0]).isCloseTo(2.0, within(1e-12));
    }

    @Test
    void transformBeforeFit_throwsUnfitted() {
        Normalizer normalizer = new Normalizer();

        assertThatThrownBy(() -> normalizer.transform(new double[] {1, 2}, false))
                .isInstanceOf(UnfittedStateException.class);
        assertThatThrownBy(() -> normalizer.inverse(new double[] {1, 2}))
                .isInstanceOf(UnfittedStateException.class);
    }

    @Test
    void constantSample_onlyRecenters() {
        Normalizer normalizer = new Normalizer();
        double[] out = normalizer.transform(TestDataFactory.constant(5, 3.0), true);

        assertThat(out).containsOnly(0.0);
        assertThat(normalizer.transform(new double[] {4.0}, false)[0]).isEqualTo(1.0);
    }

    @Test
    void twoDimensionalInput_isScaledPerFeature() {
        Normalizer normalizer = new Normalizer(NormalizationMethod.MINMAX);
        double[][] out = normalizer.transform(new double[][] {{0, 100}, {10, 300}, {5, 200}}, true);

        assertThat(out).hasNumberOfRows(3);
        assertThat(out[2]).containsExactly(new double[] {0.5, 0.5}, within(1e-12));
        assertThatThrownBy(() -> normalizer.transform(new double[][] {{1, 2, 3}}, false))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void unknownMethod_failsWithDescriptiveError() {
        assertThatThrownBy(() -> new Normalizer("quantile"))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("quantile");
    }
}
