package io.github.samzhu.costlens.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.costlens.exception.CostValidationException;
import io.github.samzhu.costlens.model.RatioClassification;
import io.github.samzhu.costlens.model.RatioStatus;

class RatioMonitorServiceTest {

    private static final BigDecimal HEALTHY_MAX = new BigDecimal("0.3");

    private RatioMonitorService service;

    @BeforeEach
    void setUp() {
        service = new RatioMonitorService();
    }

    @Test
    void shouldAlertWhenRatioExceedsHealthyMax() {
        // When
        RatioClassification result = service.classify(new BigDecimal("400"), new BigDecimal("1000"), HEALTHY_MAX);

        // Then
        assertThat(result.ratio()).isEqualByComparingTo("0.4");
        assertThat(result.status()).isEqualTo(RatioStatus.ALERT);
    }

    @Test
    void shouldWarnWhenApproachingHealthyMax() {
        // 0.8 × 0.3 = 0.24
        assertThat(service.classify(new BigDecimal("250"), new BigDecimal("1000"), HEALTHY_MAX).status())
            .isEqualTo(RatioStatus.WARNING);
        assertThat(service.classify(new BigDecimal("300"), new BigDecimal("1000"), HEALTHY_MAX).status())
            .isEqualTo(RatioStatus.WARNING);
    }

    @Test
    void shouldBeHealthyWellBelowMax() {
        RatioClassification result = service.classify(new BigDecimal("200"), new BigDecimal("1000"), HEALTHY_MAX);

        assertThat(result.ratio()).isEqualByComparingTo("0.2");
        assertThat(result.status()).isEqualTo(RatioStatus.HEALTHY);
    }

    @Test
    void shouldAlertWhenDenominatorIsZeroButNumeratorIsNot() {
        RatioClassification result = service.classify(new BigDecimal("5"), BigDecimal.ZERO, HEALTHY_MAX);

        assertThat(result.ratio()).isNull();
        assertThat(result.status()).isEqualTo(RatioStatus.ALERT);
    }

    @Test
    void shouldBeHealthyWhenBothTotalsAreZero() {
        RatioClassification result = service.classify(BigDecimal.ZERO, BigDecimal.ZERO, HEALTHY_MAX);

        assertThat(result.ratio()).isNull();
        assertThat(result.status()).isEqualTo(RatioStatus.HEALTHY);
    }

    @Test
    void shouldRejectNegativeTotals() {
        assertThatThrownBy(() -> service.classify(new BigDecimal("-1"), BigDecimal.TEN, HEALTHY_MAX))
            .isInstanceOf(CostValidationException.class);
    }

    @Test
    void shouldRejectNonPositiveHealthyMax() {
        assertThatThrownBy(() -> service.classify(BigDecimal.ONE, BigDecimal.TEN, BigDecimal.ZERO))
            .isInstanceOf(CostValidationException.class)
            .hasMessageContaining("healthyMaxRatio");
    }
}
