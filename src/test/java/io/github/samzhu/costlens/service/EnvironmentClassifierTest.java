package io.github.samzhu.costlens.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.github.samzhu.costlens.config.CostLensProperties;
import io.github.samzhu.costlens.model.Aggregate;
import io.github.samzhu.costlens.model.Window;

class EnvironmentClassifierTest {

    private static final Window WINDOW = Window.endingOn(LocalDate.of(2025, 3, 7), 7);

    @Test
    void shouldRecognizeDefaultMarkersCaseInsensitively() {
        EnvironmentClassifier classifier = new EnvironmentClassifier(CostLensProperties.defaults());

        assertThat(classifier.isNonProduction("tenant-uat")).isTrue();
        assertThat(classifier.isNonProduction("Staging-Cluster")).isTrue();
        assertThat(classifier.isNonProduction("sandbox-dev")).isTrue();
        assertThat(classifier.isNonProduction("api-prod")).isFalse();
    }

    @Test
    void shouldUseConfiguredMarkers() {
        // Given
        CostLensProperties properties = new CostLensProperties(null,
            new CostLensProperties.EnvironmentConfig(List.of("sbx")), null);
        EnvironmentClassifier classifier = new EnvironmentClassifier(properties);

        // Then
        assertThat(classifier.isNonProduction("team-SBX-01")).isTrue();
        assertThat(classifier.isNonProduction("tenant-uat")).isFalse();
    }

    @Test
    void shouldSplitTotalsByEnvironment() {
        // Given
        EnvironmentClassifier classifier = new EnvironmentClassifier(CostLensProperties.defaults());
        List<Aggregate> aggregates = List.of(
            aggregate("api-prod", "1000"),
            aggregate("api-uat", "300"),
            aggregate("db-test", "100"));

        // When
        EnvironmentClassifier.EnvironmentSplit split = classifier.split(aggregates);

        // Then
        assertThat(split.nonProductionTotal()).isEqualByComparingTo("400");
        assertThat(split.productionTotal()).isEqualByComparingTo("1000");
        assertThat(split.nonProductionKeys()).containsExactly("api-uat", "db-test");
    }

    private Aggregate aggregate(String key, String total) {
        return Aggregate.of(key, WINDOW, new BigDecimal(total), 7);
    }
}
