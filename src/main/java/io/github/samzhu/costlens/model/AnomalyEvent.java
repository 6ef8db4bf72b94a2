package io.github.samzhu.costlens.model;

import java.math.BigDecimal;

/**
 * 成本異常事件。
 *
 * <p>只有變化幅度達到門檻時才會建立；沒有事件即代表沒有異常。
 *
 * @param dimensionKey 維度鍵
 * @param currentAvg 本期每日平均
 * @param baselineAvg 基準期每日平均
 * @param deltaAmount 每日平均差額
 * @param deltaPercent 變化百分比，基準為 0 的新增支出時為 null
 * @param newSpend 是否為新增支出
 * @param severity 嚴重度
 * @param impactTotal 本期總影響金額（{@code deltaAmount × 本期天數}）
 */
public record AnomalyEvent(
    String dimensionKey,
    BigDecimal currentAvg,
    BigDecimal baselineAvg,
    BigDecimal deltaAmount,
    BigDecimal deltaPercent,
    boolean newSpend,
    Severity severity,
    BigDecimal impactTotal
) {}
