package io.github.samzhu.costlens.model;

/**
 * 每日成本分布統計。
 *
 * <p>百分位數以 T-Digest 演算法近似計算。
 *
 * @param dimensionKey 維度鍵
 * @param count 樣本天數
 * @param min 最小單日金額
 * @param max 最大單日金額
 * @param mean 單日平均（實際樣本）
 * @param p50 中位數
 * @param p90 第 90 百分位
 * @param p95 第 95 百分位
 * @param p99 第 99 百分位
 */
public record CostDistribution(
    String dimensionKey,
    long count,
    double min,
    double max,
    double mean,
    double p50,
    double p90,
    double p95,
    double p99
) {
    /**
     * 建立空的分布統計。
     */
    public static CostDistribution empty(String dimensionKey) {
        return new CostDistribution(dimensionKey, 0, 0, 0, 0, 0, 0, 0, 0);
    }
}
