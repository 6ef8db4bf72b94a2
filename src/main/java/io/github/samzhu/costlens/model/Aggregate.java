package io.github.samzhu.costlens.model;

import java.math.BigDecimal;

import io.github.samzhu.costlens.util.CostMath;

/**
 * 單一維度在一個視窗內的聚合結果。
 *
 * <p>{@code averagePerDay} 一律為 {@code total / window.lengthDays}（名目天數），
 * 不是 {@code total / sampleCount}，資料不完整時平均會偏低而不是被掩蓋。
 *
 * <p>{@code sampleCount = 0} 是合法狀態（資料不足），不是錯誤。
 *
 * @param dimensionKey 維度鍵
 * @param window 聚合視窗
 * @param total 視窗內金額總和
 * @param averagePerDay 每日平均（名目天數）
 * @param sampleCount 視窗內實際找到的紀錄數
 */
public record Aggregate(
    String dimensionKey,
    Window window,
    BigDecimal total,
    BigDecimal averagePerDay,
    int sampleCount
) {
    /**
     * 由總額建立聚合結果，平均以名目天數計算。
     */
    public static Aggregate of(String dimensionKey, Window window, BigDecimal total, int sampleCount) {
        return new Aggregate(dimensionKey, window, total,
            CostMath.perDay(total, window.lengthDays()), sampleCount);
    }

    /**
     * 樣本數是否足以產生趨勢或異常訊號（至少佔名目天數的一半）。
     */
    public boolean hasSufficientSamples() {
        return sampleCount > 0 && sampleCount * 2 >= window.lengthDays();
    }
}
