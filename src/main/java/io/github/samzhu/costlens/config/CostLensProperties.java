package io.github.samzhu.costlens.config;

import java.math.BigDecimal;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * CostLens 服務的組態屬性，支援型別安全的配置綁定。
 *
 * <p>此配置包含以下部分：
 * <ul>
 *   <li>{@link AnalysisConfig} - 分析視窗長度與各項門檻的預設值</li>
 *   <li>{@link EnvironmentConfig} - 非正式環境的維度辨識標記</li>
 *   <li>{@link DistributionConfig} - 每日成本百分位計算設定 (T-Digest)</li>
 * </ul>
 *
 * <p>這些值只在 HTTP 邊界解析成 {@link io.github.samzhu.costlens.model.AnalysisParameters}，
 * 分析服務本身不讀取全域設定。
 *
 * <p>配置範例 (application.yaml)：
 * <pre>
 * costlens:
 *   analysis:
 *     window-days: 7
 *     baseline-days: 28
 *     anomaly-threshold-percent: 20
 *     top-n: 10
 *     healthy-max-ratio: 0.3
 *     peak-multiplier: 1.5
 *   environment:
 *     non-production-markers: [UAT, TEST, DEV, STAGING]
 *   distribution:
 *     digest-compression: 100
 * </pre>
 */
@ConfigurationProperties(prefix = "costlens")
public record CostLensProperties(
    AnalysisConfig analysis,
    EnvironmentConfig environment,
    DistributionConfig distribution
) {
    public CostLensProperties {
        if (analysis == null) {
            analysis = AnalysisConfig.defaults();
        }
        if (environment == null) {
            environment = EnvironmentConfig.defaults();
        }
        if (distribution == null) {
            distribution = DistributionConfig.defaults();
        }
    }

    /**
     * 建立全部使用預設值的設定。
     */
    public static CostLensProperties defaults() {
        return new CostLensProperties(null, null, null);
    }

    /**
     * 分析參數預設值。
     *
     * <p>請求未指定的參數以此補齊。基準期建議至少為本期的 2 倍長度。
     *
     * @param windowDays 本期視窗天數，預設 7（週對週比較）
     * @param baselineDays 異常偵測基準期天數，預設 28
     * @param anomalyThresholdPercent 異常門檻百分比，預設 20
     * @param topN 排行保留筆數，其餘併入 Other，預設 10；0 表示全部併入 Other
     * @param healthyMaxRatio 非正式環境 / 正式環境健康上限，預設 0.3
     * @param peakMultiplier 單日尖峰判定倍數，預設 1.5
     */
    public record AnalysisConfig(
        int windowDays,
        int baselineDays,
        BigDecimal anomalyThresholdPercent,
        Integer topN,
        BigDecimal healthyMaxRatio,
        BigDecimal peakMultiplier
    ) {
        public AnalysisConfig {
            if (windowDays <= 0) {
                windowDays = 7;
            }
            if (baselineDays <= 0) {
                baselineDays = 28;
            }
            if (anomalyThresholdPercent == null || anomalyThresholdPercent.signum() <= 0) {
                anomalyThresholdPercent = new BigDecimal("20");
            }
            if (topN == null || topN < 0) {
                topN = 10;
            }
            if (healthyMaxRatio == null || healthyMaxRatio.signum() <= 0) {
                healthyMaxRatio = new BigDecimal("0.3");
            }
            if (peakMultiplier == null || peakMultiplier.signum() <= 0) {
                peakMultiplier = new BigDecimal("1.5");
            }
        }

        /**
         * 建立預設分析設定。
         */
        public static AnalysisConfig defaults() {
            return new AnalysisConfig(0, 0, null, null, null, null);
        }
    }

    /**
     * 環境辨識設定。
     *
     * <p>維度鍵（轉大寫後）包含任一標記即視為非正式環境。
     *
     * @param nonProductionMarkers 非正式環境標記，預設 UAT、TEST、DEV、STAGING
     */
    public record EnvironmentConfig(
        List<String> nonProductionMarkers
    ) {
        public EnvironmentConfig {
            if (nonProductionMarkers == null || nonProductionMarkers.isEmpty()) {
                nonProductionMarkers = List.of("UAT", "TEST", "DEV", "STAGING");
            } else {
                nonProductionMarkers = List.copyOf(nonProductionMarkers);
            }
        }

        /**
         * 建立預設環境設定。
         */
        public static EnvironmentConfig defaults() {
            return new EnvironmentConfig(null);
        }
    }

    /**
     * 每日成本百分位計算設定。
     *
     * @param digestCompression T-Digest 壓縮因子，預設 100，範圍 50-200
     */
    public record DistributionConfig(
        int digestCompression
    ) {
        public DistributionConfig {
            if (digestCompression <= 0) {
                digestCompression = 100;
            }
        }

        /**
         * 建立預設百分位設定。
         */
        public static DistributionConfig defaults() {
            return new DistributionConfig(100);
        }
    }
}
