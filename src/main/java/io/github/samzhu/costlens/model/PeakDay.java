package io.github.samzhu.costlens.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 單日成本尖峰。
 *
 * @param dimensionKey 維度鍵
 * @param date 尖峰日期
 * @param amount 當日金額
 * @param average 視窗內實際樣本的平均
 * @param percentAboveAverage 高於平均的百分比
 */
public record PeakDay(
    String dimensionKey,
    LocalDate date,
    BigDecimal amount,
    BigDecimal average,
    BigDecimal percentAboveAverage
) {}
