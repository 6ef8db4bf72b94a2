package io.github.samzhu.costlens.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Set;

import io.github.samzhu.costlens.exception.CostValidationException;

/**
 * 單次分析請求的完整參數。
 *
 * <p>每一種報表都只是此參數的一組設定（視窗長度、門檻、維度篩選），
 * 不需要為每種報表寫獨立的流程。
 *
 * @param endDate 分析結束日（含），null 表示使用資料中最後一天
 * @param windowDays 本期天數，上限 {@value #MAX_WINDOW_DAYS}
 * @param baselineDays 基準期天數，建議至少為本期 2 倍，上限 {@value #MAX_WINDOW_DAYS}
 * @param anomalyThresholdPercent 異常門檻百分比
 * @param topN 排行保留筆數
 * @param healthyMaxRatio 非正式 / 正式環境健康上限
 * @param peakMultiplier 單日尖峰判定倍數
 * @param dimensions 維度篩選，空集合表示全部
 * @param environmentRatio 是否計算環境成本比例
 */
public record AnalysisParameters(
    LocalDate endDate,
    int windowDays,
    int baselineDays,
    BigDecimal anomalyThresholdPercent,
    int topN,
    BigDecimal healthyMaxRatio,
    BigDecimal peakMultiplier,
    Set<String> dimensions,
    boolean environmentRatio
) {
    /**
     * 本期與基準期天數上限（約 10 年）。
     */
    public static final int MAX_WINDOW_DAYS = 3660;

    public AnalysisParameters {
        requireWindowLength("windowDays", windowDays);
        requireWindowLength("baselineDays", baselineDays);
        if (anomalyThresholdPercent == null || anomalyThresholdPercent.signum() <= 0) {
            throw new CostValidationException("anomalyThresholdPercent", "must be positive");
        }
        if (topN < 0) {
            throw new CostValidationException("topN", "must not be negative but was " + topN);
        }
        if (healthyMaxRatio == null || healthyMaxRatio.signum() <= 0) {
            throw new CostValidationException("healthyMaxRatio", "must be positive");
        }
        if (peakMultiplier == null || peakMultiplier.signum() <= 0) {
            throw new CostValidationException("peakMultiplier", "must be positive");
        }
        dimensions = dimensions == null ? Set.of() : Set.copyOf(dimensions);
    }

    private static void requireWindowLength(String field, int days) {
        if (days <= 0) {
            throw new CostValidationException(field, "must be positive but was " + days);
        }
        if (days > MAX_WINDOW_DAYS) {
            throw new CostValidationException(field,
                String.format("must not exceed %d days but was %d", MAX_WINDOW_DAYS, days));
        }
    }

    /**
     * 是否只分析指定的維度。
     */
    public boolean includes(String dimensionKey) {
        return dimensions.isEmpty() || dimensions.contains(dimensionKey);
    }
}
