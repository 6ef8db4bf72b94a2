package io.github.samzhu.costlens.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.costlens.exception.CostValidationException;
import io.github.samzhu.costlens.model.Aggregate;
import io.github.samzhu.costlens.model.RankedBreakdown;
import io.github.samzhu.costlens.model.Window;
import io.github.samzhu.costlens.util.CostMath;

class DimensionRankingServiceTest {

    private static final Window WINDOW = Window.endingOn(LocalDate.of(2025, 3, 7), 7);

    private DimensionRankingService service;

    @BeforeEach
    void setUp() {
        service = new DimensionRankingService();
    }

    @Test
    void shouldFoldTailIntoOther() {
        // Given
        List<Aggregate> aggregates = List.of(
            aggregate("d", "5"),
            aggregate("a", "50"),
            aggregate("c", "10"),
            aggregate("e", "5"),
            aggregate("b", "30"));

        // When
        RankedBreakdown result = service.rank(aggregates, 3);

        // Then
        assertThat(result.entries()).extracting(RankedBreakdown.Entry::dimensionKey)
            .containsExactly("a", "b", "c", DimensionRankingService.OTHER_KEY);
        assertThat(result.entries()).extracting(RankedBreakdown.Entry::total)
            .usingElementComparator(BigDecimal::compareTo)
            .containsExactly(new BigDecimal("50"), new BigDecimal("30"), new BigDecimal("10"), new BigDecimal("10"));
        assertThat(result.entries()).extracting(RankedBreakdown.Entry::percentOfTotal)
            .usingElementComparator(BigDecimal::compareTo)
            .containsExactly(new BigDecimal("50"), new BigDecimal("30"), new BigDecimal("10"), new BigDecimal("10"));
        assertThat(result.grandTotal()).isEqualByComparingTo("100");
        assertThat(result.foldedCount()).isEqualTo(2);
        assertThat(result.otherEntry()).isPresent();
    }

    @Test
    void shouldBreakTiesByDimensionKey() {
        // Given
        List<Aggregate> aggregates = List.of(
            aggregate("beta", "10"),
            aggregate("gamma", "20"),
            aggregate("alpha", "10"));

        // When
        RankedBreakdown result = service.rank(aggregates, 5);

        // Then
        assertThat(result.entries()).extracting(RankedBreakdown.Entry::dimensionKey)
            .containsExactly("gamma", "alpha", "beta");
        assertThat(result.otherEntry()).isEmpty();
        assertThat(result.foldedCount()).isZero();
    }

    @Test
    void entryTotalsShouldAddUpToGrandTotal() {
        // Given
        List<Aggregate> aggregates = List.of(
            aggregate("a", "12.34"),
            aggregate("b", "0.01"),
            aggregate("c", "99.99"),
            aggregate("d", "7.5"));

        // When
        RankedBreakdown result = service.rank(aggregates, 2);

        // Then
        BigDecimal sum = CostMath.sum(result.entries().stream().map(RankedBreakdown.Entry::total).toList());
        assertThat(sum).isEqualByComparingTo(result.grandTotal());
        assertThat(result.grandTotal()).isEqualByComparingTo("119.84");
    }

    @Test
    void shouldReportZeroPercentWhenGrandTotalIsZero() {
        RankedBreakdown result = service.rank(List.of(aggregate("a", "0"), aggregate("b", "0")), 1);

        assertThat(result.entries()).allSatisfy(entry ->
            assertThat(entry.percentOfTotal()).isEqualByComparingTo("0"));
    }

    @Test
    void shouldFoldEverythingWhenTopNIsZero() {
        RankedBreakdown result = service.rank(List.of(aggregate("a", "1"), aggregate("b", "2")), 0);

        assertThat(result.entries()).hasSize(1);
        assertThat(result.entries().get(0).other()).isTrue();
        assertThat(result.entries().get(0).total()).isEqualByComparingTo("3");
    }

    @Test
    void shouldRejectNegativeTopN() {
        assertThatThrownBy(() -> service.rank(List.of(aggregate("a", "1")), -1))
            .isInstanceOf(CostValidationException.class)
            .hasMessageContaining("topN");
    }

    @Test
    void shouldFilterAboveThresholdInRankOrder() {
        // Given
        List<Aggregate> aggregates = List.of(
            aggregate("a", "5"),
            aggregate("b", "500"),
            aggregate("c", "10"),
            aggregate("d", "10.01"));

        // When
        List<Aggregate> result = service.aboveThreshold(aggregates, new BigDecimal("10"));

        // Then
        assertThat(result).extracting(Aggregate::dimensionKey).containsExactly("b", "d");
    }

    private Aggregate aggregate(String key, String total) {
        return Aggregate.of(key, WINDOW, new BigDecimal(total), 7);
    }
}
