package io.github.samzhu.costlens.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

class CostMathTest {

    @Test
    void percentChangeShouldFollowZeroBaselinePolicy() {
        assertThat(CostMath.percentChange(new BigDecimal("100"), new BigDecimal("80")))
            .isEqualByComparingTo("25");
        assertThat(CostMath.percentChange(new BigDecimal("10"), BigDecimal.ZERO)).isNull();
        assertThat(CostMath.percentChange(BigDecimal.ZERO, BigDecimal.ZERO)).isEqualByComparingTo("0");
    }

    @Test
    void shouldNeverDivideByZero() {
        assertThat(CostMath.percentOf(new BigDecimal("5"), BigDecimal.ZERO)).isEqualByComparingTo("0");
        assertThat(CostMath.ratio(new BigDecimal("5"), BigDecimal.ZERO)).isNull();
    }

    @Test
    void perDayShouldRoundToSixDecimals() {
        assertThat(CostMath.perDay(new BigDecimal("30"), 7)).isEqualTo(new BigDecimal("4.285714"));
    }
}
