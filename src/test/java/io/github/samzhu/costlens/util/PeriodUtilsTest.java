package io.github.samzhu.costlens.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.github.samzhu.costlens.exception.CostValidationException;
import io.github.samzhu.costlens.model.Window;

class PeriodUtilsTest {

    @Test
    void shouldLayOutAnalysisWindows() {
        // Given
        Window current = PeriodUtils.currentWindow(LocalDate.of(2025, 3, 28), 7);

        // When
        Window previous = PeriodUtils.previousWindow(current);
        Window baseline = PeriodUtils.baselineWindow(current, 14);
        Window lookback = PeriodUtils.lookbackWindow(current, 14);

        // Then
        assertThat(current.startDate()).isEqualTo(LocalDate.of(2025, 3, 22));
        assertThat(previous.startDate()).isEqualTo(LocalDate.of(2025, 3, 15));
        assertThat(previous.endDate()).isEqualTo(LocalDate.of(2025, 3, 21));
        assertThat(baseline.startDate()).isEqualTo(LocalDate.of(2025, 3, 8));
        assertThat(baseline.endDate()).isEqualTo(LocalDate.of(2025, 3, 21));
        assertThat(lookback.startDate()).isEqualTo(LocalDate.of(2025, 3, 8));
        assertThat(lookback.endDate()).isEqualTo(LocalDate.of(2025, 3, 28));
        assertThat(lookback.lengthDays()).isEqualTo(21);
    }

    @Test
    void shouldRejectLookbackLongerThanIntRange() {
        Window current = PeriodUtils.currentWindow(LocalDate.of(2025, 3, 28), 7);

        assertThatThrownBy(() -> PeriodUtils.lookbackWindow(current, Integer.MAX_VALUE))
            .isInstanceOf(CostValidationException.class)
            .hasMessageContaining("baselineDays");
    }

    @Test
    void shouldOnlyListWeeksOverlappingRange() {
        // Given: 一年的視窗
        Window window = Window.startingOn(LocalDate.of(2025, 3, 1), 365);

        // When
        List<Window> weeks = PeriodUtils.completeWeeks(window, LocalDate.of(2025, 3, 10), LocalDate.of(2025, 3, 20));

        // Then
        assertThat(weeks).extracting(Window::startDate)
            .containsExactly(LocalDate.of(2025, 3, 8), LocalDate.of(2025, 3, 15));
    }

    @Test
    void shouldDropTrailingPartialWeek() {
        // Given: 17 天視窗
        Window window = Window.startingOn(LocalDate.of(2025, 3, 1), 17);

        // When
        List<Window> weeks = PeriodUtils.completeWeeks(window);

        // Then
        assertThat(weeks).extracting(Window::startDate)
            .containsExactly(LocalDate.of(2025, 3, 1), LocalDate.of(2025, 3, 8));
    }
}
