package io.github.samzhu.costlens.dto.api;

import java.util.List;
import java.util.Map;

import io.github.samzhu.costlens.model.RollingAverage;

/**
 * 滾動平均回應。
 *
 * @param windowDays 視窗天數
 * @param dimensions 各維度的滾動平均，依結束日遞增
 */
public record RollingAverageResponse(
    int windowDays,
    Map<String, List<RollingAverage>> dimensions
) {}
