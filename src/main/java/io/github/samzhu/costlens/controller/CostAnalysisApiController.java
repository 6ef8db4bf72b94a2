package io.github.samzhu.costlens.controller;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.costlens.config.CostLensProperties;
import io.github.samzhu.costlens.config.CostLensProperties.AnalysisConfig;
import io.github.samzhu.costlens.dto.api.CostAnalysisRequest;
import io.github.samzhu.costlens.dto.api.RatioRequest;
import io.github.samzhu.costlens.dto.api.RollingAverageRequest;
import io.github.samzhu.costlens.dto.api.RollingAverageResponse;
import io.github.samzhu.costlens.model.AnalysisParameters;
import io.github.samzhu.costlens.model.CostAnalysisReport;
import io.github.samzhu.costlens.model.RatioClassification;
import io.github.samzhu.costlens.model.RollingAverage;
import io.github.samzhu.costlens.service.CostAnalysisService;
import io.github.samzhu.costlens.service.RatioMonitorService;
import jakarta.validation.Valid;

/**
 * 成本分析 REST API 控制器。
 *
 * <p>提供以下端點：
 * <ul>
 *   <li>{@code POST /api/v1/cost-analysis} - 完整分析（聚合、趨勢、異常、排行、環境比例）</li>
 *   <li>{@code POST /api/v1/cost-analysis/rolling-averages} - 各維度滾動平均</li>
 *   <li>{@code POST /api/v1/cost-analysis/ratio} - 兩個總額的比例分級</li>
 * </ul>
 *
 * <p>回應只包含結構化資料；金額格式、幣別符號等呈現工作由呼叫端處理。
 * 請求未指定的參數使用 {@code costlens.analysis} 預設值。
 */
@RestController
@RequestMapping("/api/v1/cost-analysis")
public class CostAnalysisApiController {

    private static final Logger log = LoggerFactory.getLogger(CostAnalysisApiController.class);

    private final CostAnalysisService analysisService;
    private final RatioMonitorService ratioService;
    private final CostLensProperties properties;

    public CostAnalysisApiController(CostAnalysisService analysisService,
                                     RatioMonitorService ratioService,
                                     CostLensProperties properties) {
        this.analysisService = analysisService;
        this.ratioService = ratioService;
        this.properties = properties;
    }

    /**
     * 執行完整成本分析。
     *
     * <p>端點：{@code POST /api/v1/cost-analysis}
     *
     * @param request 原始資料與分析參數
     * @return 分析報表
     */
    @PostMapping
    public ResponseEntity<CostAnalysisReport> analyze(@Valid @RequestBody CostAnalysisRequest request) {
        log.info("API request: analyze records={}, endDate={}, windowDays={}, dimensions={}",
            request.records().size(), request.endDate(), request.windowDays(), request.dimensions());

        CostAnalysisReport report = analysisService.analyze(request.records(), toParameters(request));

        log.debug("analyze response: {} dimensions, {} anomalies",
            report.dimensions().size(), report.anomalies().size());
        return ResponseEntity.ok(report);
    }

    /**
     * 計算各維度滾動平均。
     *
     * <p>端點：{@code POST /api/v1/cost-analysis/rolling-averages?windowDays=}
     *
     * @param windowDays 視窗天數，未指定時使用預設本期天數
     * @param request 原始資料
     * @return 各維度滾動平均
     */
    @PostMapping("/rolling-averages")
    public ResponseEntity<RollingAverageResponse> rollingAverages(
            @RequestParam(required = false) Integer windowDays,
            @Valid @RequestBody RollingAverageRequest request) {

        int effectiveWindow = windowDays != null ? windowDays : properties.analysis().windowDays();
        log.info("API request: rollingAverages records={}, windowDays={}", request.records().size(), effectiveWindow);

        Map<String, List<RollingAverage>> averages = analysisService.rollingAverages(request.records(), effectiveWindow);
        return ResponseEntity.ok(new RollingAverageResponse(effectiveWindow, averages));
    }

    /**
     * 比例分級。
     *
     * <p>端點：{@code POST /api/v1/cost-analysis/ratio}
     *
     * @param request 分子、分母總額與健康上限
     * @return 分級結果
     */
    @PostMapping("/ratio")
    public ResponseEntity<RatioClassification> classifyRatio(@Valid @RequestBody RatioRequest request) {
        log.info("API request: classifyRatio numerator={}, denominator={}",
            request.numeratorTotal(), request.denominatorTotal());

        RatioClassification result = ratioService.classify(
            request.numeratorTotal(),
            request.denominatorTotal(),
            request.healthyMaxRatio() != null ? request.healthyMaxRatio() : properties.analysis().healthyMaxRatio());
        return ResponseEntity.ok(result);
    }

    /**
     * 以預設值補齊請求參數。
     */
    private AnalysisParameters toParameters(CostAnalysisRequest request) {
        AnalysisConfig defaults = properties.analysis();
        return new AnalysisParameters(
            request.endDate(),
            request.windowDays() != null ? request.windowDays() : defaults.windowDays(),
            request.baselineDays() != null ? request.baselineDays() : defaults.baselineDays(),
            request.anomalyThresholdPercent() != null ? request.anomalyThresholdPercent() : defaults.anomalyThresholdPercent(),
            request.topN() != null ? request.topN() : defaults.topN(),
            request.healthyMaxRatio() != null ? request.healthyMaxRatio() : defaults.healthyMaxRatio(),
            defaults.peakMultiplier(),
            request.dimensions(),
            Boolean.TRUE.equals(request.environmentRatio()));
    }
}
