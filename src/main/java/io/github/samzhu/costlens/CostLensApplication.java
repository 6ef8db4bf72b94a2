package io.github.samzhu.costlens;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * CostLens Service - 成本時間序列聚合與異常偵測服務。
 *
 * <p>此服務接收外部帳單來源提供的每日成本資料（依服務、標籤、租戶、環境等維度拆分），
 * 並轉換為可供決策的訊號：
 * <ul>
 *   <li>滾動平均 (rolling average) 與週成本</li>
 *   <li>週對週趨勢變化 (week-over-week delta)</li>
 *   <li>維度排行與 Other 彙總</li>
 *   <li>異常偵測與嚴重度分級</li>
 *   <li>非正式環境 / 正式環境成本比例監控</li>
 * </ul>
 *
 * <p>處理流程（單向，不回頭）：
 * <pre>
 * 原始資料 → CostNormalizationService → WindowAggregationService / DimensionRankingService
 *                                              ↓
 *                          TrendAnalysisService / AnomalyDetectionService
 *                                              ↓
 *                                     RatioMonitorService → 結構化報表
 * </pre>
 */
@SpringBootApplication
public class CostLensApplication {

    private static final Logger log = LoggerFactory.getLogger(CostLensApplication.class);

    public static void main(String[] args) {
        log.info("Starting CostLens Service - cost trend and anomaly analytics");
        SpringApplication.run(CostLensApplication.class, args);
    }
}
