package io.github.samzhu.costlens.dto.api;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import io.github.samzhu.costlens.dto.RawCostRecord;
import io.github.samzhu.costlens.model.AnalysisParameters;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * 成本分析請求。
 *
 * <p>用於 POST /api/v1/cost-analysis 端點。未指定的參數使用 {@code costlens.analysis} 預設值。
 */
public record CostAnalysisRequest(
    @NotNull(message = "records is required")
    List<@Valid RawCostRecord> records,

    LocalDate endDate,

    @Positive(message = "windowDays must be positive")
    @Max(value = AnalysisParameters.MAX_WINDOW_DAYS, message = "windowDays must not exceed 3660")
    Integer windowDays,

    @Positive(message = "baselineDays must be positive")
    @Max(value = AnalysisParameters.MAX_WINDOW_DAYS, message = "baselineDays must not exceed 3660")
    Integer baselineDays,

    @Positive(message = "anomalyThresholdPercent must be positive")
    BigDecimal anomalyThresholdPercent,

    @PositiveOrZero(message = "topN must be positive or zero")
    Integer topN,

    @Positive(message = "healthyMaxRatio must be positive")
    BigDecimal healthyMaxRatio,

    Set<String> dimensions,

    Boolean environmentRatio
) {}
