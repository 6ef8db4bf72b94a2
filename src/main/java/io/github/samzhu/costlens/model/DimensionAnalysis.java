package io.github.samzhu.costlens.model;

import java.util.List;

/**
 * 單一維度的聚合明細。
 *
 * @param dimensionKey 維度鍵
 * @param current 本期聚合
 * @param previous 前期聚合
 * @param baseline 基準期聚合
 * @param weeklyCosts 回溯期內每個完整週的聚合
 * @param distribution 回溯期每日成本分布
 */
public record DimensionAnalysis(
    String dimensionKey,
    Aggregate current,
    Aggregate previous,
    Aggregate baseline,
    List<Aggregate> weeklyCosts,
    CostDistribution distribution
) {}
