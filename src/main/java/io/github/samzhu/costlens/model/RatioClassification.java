package io.github.samzhu.costlens.model;

import java.math.BigDecimal;

/**
 * 次要總額佔主要總額比例的分級結果。
 *
 * @param numeratorTotal 分子總額（例如非正式環境成本）
 * @param denominatorTotal 分母總額（例如正式環境成本）
 * @param ratio 比例，分母為 0 時為 null
 * @param healthyMaxRatio 健康上限
 * @param status 健康狀態
 */
public record RatioClassification(
    BigDecimal numeratorTotal,
    BigDecimal denominatorTotal,
    BigDecimal ratio,
    BigDecimal healthyMaxRatio,
    RatioStatus status
) {}
