package io.github.samzhu.costlens.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 以某日結尾的滾動視窗平均。
 *
 * @param endDate 視窗結束日
 * @param averagePerDay 每日平均（名目天數）
 * @param total 視窗總額
 * @param sampleCount 視窗內實際紀錄數
 */
public record RollingAverage(
    LocalDate endDate,
    BigDecimal averagePerDay,
    BigDecimal total,
    int sampleCount
) {}
