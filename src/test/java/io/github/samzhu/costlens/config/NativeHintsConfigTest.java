package io.github.samzhu.costlens.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.aot.hint.RuntimeHints;
import org.springframework.aot.hint.predicate.RuntimeHintsPredicates;

import io.github.samzhu.costlens.dto.api.CostAnalysisRequest;
import io.github.samzhu.costlens.model.CostAnalysisReport;
import io.github.samzhu.costlens.model.RankedBreakdown;

class NativeHintsConfigTest {

    @Test
    void shouldRegisterJsonTypesForReflection() {
        // Given
        RuntimeHints hints = new RuntimeHints();

        // When
        new NativeHintsConfig.CostLensRuntimeHints().registerHints(hints, getClass().getClassLoader());

        // Then
        assertThat(RuntimeHintsPredicates.reflection().onType(CostAnalysisRequest.class)).accepts(hints);
        assertThat(RuntimeHintsPredicates.reflection().onType(CostAnalysisReport.class)).accepts(hints);
        assertThat(RuntimeHintsPredicates.reflection().onType(RankedBreakdown.Entry.class)).accepts(hints);
    }
}
