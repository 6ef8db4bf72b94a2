package io.github.samzhu.costlens.dto.api;

import java.util.List;

import io.github.samzhu.costlens.dto.RawCostRecord;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

/**
 * 滾動平均請求。
 *
 * <p>用於 POST /api/v1/cost-analysis/rolling-averages 端點。
 */
public record RollingAverageRequest(
    @NotNull(message = "records is required")
    List<@Valid RawCostRecord> records
) {}
