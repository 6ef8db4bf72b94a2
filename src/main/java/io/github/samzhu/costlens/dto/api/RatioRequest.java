package io.github.samzhu.costlens.dto.api;

import java.math.BigDecimal;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * 比例分級請求。
 *
 * <p>用於 POST /api/v1/cost-analysis/ratio 端點。
 */
public record RatioRequest(
    @NotNull(message = "numeratorTotal is required")
    @PositiveOrZero(message = "numeratorTotal must be positive or zero")
    BigDecimal numeratorTotal,

    @NotNull(message = "denominatorTotal is required")
    @PositiveOrZero(message = "denominatorTotal must be positive or zero")
    BigDecimal denominatorTotal,

    @Positive(message = "healthyMaxRatio must be positive")
    BigDecimal healthyMaxRatio
) {}
