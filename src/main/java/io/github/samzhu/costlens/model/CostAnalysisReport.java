package io.github.samzhu.costlens.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * 單次分析的結構化結果，交給呈現層格式化。
 *
 * <p>趨勢與異常只包含樣本數足夠的維度；{@code environmentRatio} 未要求時為 null。
 *
 * @param currentWindow 本期視窗
 * @param previousWindow 前期視窗
 * @param baselineWindow 基準期視窗
 * @param currentTotal 本期所有維度總額
 * @param dimensions 各維度聚合明細，依維度鍵排序
 * @param trends 趨勢比較結果
 * @param anomalies 異常事件，依嚴重度遞減、維度鍵遞增
 * @param peakDays 單日尖峰
 * @param breakdown 本期維度排行
 * @param environmentRatio 非正式 / 正式環境比例
 */
public record CostAnalysisReport(
    Window currentWindow,
    Window previousWindow,
    Window baselineWindow,
    BigDecimal currentTotal,
    List<DimensionAnalysis> dimensions,
    List<TrendResult> trends,
    List<AnomalyEvent> anomalies,
    List<PeakDay> peakDays,
    RankedBreakdown breakdown,
    RatioClassification environmentRatio
) {
    /**
     * 沒有任何資料時的空報表。
     */
    public static CostAnalysisReport empty() {
        return new CostAnalysisReport(null, null, null, BigDecimal.ZERO,
            List.of(), List.of(), List.of(), List.of(),
            new RankedBreakdown(List.of(), BigDecimal.ZERO, 0), null);
    }
}
