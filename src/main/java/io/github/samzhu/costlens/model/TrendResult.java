package io.github.samzhu.costlens.model;

import java.math.BigDecimal;

/**
 * 相鄰兩期（本期 vs 前期）的趨勢比較結果。
 *
 * <p>前期平均為 0 而本期有支出時，{@code deltaPercent} 為 null、{@code newSpend} 為 true，
 * 方向為 {@link TrendDirection#INCREASING}。
 *
 * @param dimensionKey 維度鍵
 * @param current 本期聚合
 * @param previous 前期聚合
 * @param deltaAmount 每日平均差額（本期 - 前期）
 * @param deltaPercent 變化百分比，新增支出時為 null
 * @param newSpend 是否為新增支出
 * @param direction 趨勢方向
 */
public record TrendResult(
    String dimensionKey,
    Aggregate current,
    Aggregate previous,
    BigDecimal deltaAmount,
    BigDecimal deltaPercent,
    boolean newSpend,
    TrendDirection direction
) {}
