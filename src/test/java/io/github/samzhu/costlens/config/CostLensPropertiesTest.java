package io.github.samzhu.costlens.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import io.github.samzhu.costlens.config.CostLensProperties.AnalysisConfig;

class CostLensPropertiesTest {

    @Test
    void shouldFillDefaultsWhenNothingIsConfigured() {
        CostLensProperties properties = CostLensProperties.defaults();

        assertThat(properties.analysis().topN()).isEqualTo(10);
        assertThat(properties.analysis().windowDays()).isEqualTo(7);
        assertThat(properties.distribution().digestCompression()).isEqualTo(100);
    }

    @Test
    void shouldKeepConfiguredZeroTopN() {
        // Given: top-n: 0 表示全部併入 Other
        AnalysisConfig config = new AnalysisConfig(7, 28, null, 0, null, null);

        // Then
        assertThat(config.topN()).isZero();
    }

    @Test
    void shouldFallBackWhenTopNIsNegative() {
        AnalysisConfig config = new AnalysisConfig(7, 28, null, -1, null, null);

        assertThat(config.topN()).isEqualTo(10);
    }
}
