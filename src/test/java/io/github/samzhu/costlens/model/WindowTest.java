package io.github.samzhu.costlens.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;

import org.junit.jupiter.api.Test;

import io.github.samzhu.costlens.exception.CostValidationException;

class WindowTest {

    @Test
    void shouldCreateInclusiveWindowEndingOnDate() {
        // When
        Window window = Window.endingOn(LocalDate.of(2025, 3, 7), 7);

        // Then
        assertThat(window.startDate()).isEqualTo(LocalDate.of(2025, 3, 1));
        assertThat(window.contains(LocalDate.of(2025, 3, 1))).isTrue();
        assertThat(window.contains(LocalDate.of(2025, 3, 7))).isTrue();
        assertThat(window.contains(LocalDate.of(2025, 2, 28))).isFalse();
        assertThat(window.contains(LocalDate.of(2025, 3, 8))).isFalse();
    }

    @Test
    void precedingWindowShouldNotOverlap() {
        // Given
        Window current = Window.endingOn(LocalDate.of(2025, 3, 14), 7);

        // When
        Window previous = current.preceding(7);
        Window baseline = current.preceding(28);

        // Then
        assertThat(previous).isEqualTo(new Window(LocalDate.of(2025, 3, 1), LocalDate.of(2025, 3, 7), 7));
        assertThat(baseline.endDate()).isEqualTo(LocalDate.of(2025, 3, 7));
        assertThat(baseline.startDate()).isEqualTo(LocalDate.of(2025, 2, 8));
    }

    @Test
    void shouldRejectNonPositiveLength() {
        assertThatThrownBy(() -> Window.endingOn(LocalDate.of(2025, 3, 7), 0))
            .isInstanceOf(CostValidationException.class)
            .hasMessageContaining("lengthDays");
    }

    @Test
    void shouldRejectInconsistentBounds() {
        assertThatThrownBy(() -> new Window(LocalDate.of(2025, 3, 1), LocalDate.of(2025, 3, 5), 7))
            .isInstanceOf(CostValidationException.class);
    }
}
