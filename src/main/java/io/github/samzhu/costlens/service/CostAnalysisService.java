package io.github.samzhu.costlens.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.costlens.dto.RawCostRecord;
import io.github.samzhu.costlens.model.Aggregate;
import io.github.samzhu.costlens.model.AnalysisParameters;
import io.github.samzhu.costlens.model.AnomalyEvent;
import io.github.samzhu.costlens.model.CostAnalysisReport;
import io.github.samzhu.costlens.model.DimensionAnalysis;
import io.github.samzhu.costlens.model.PeakDay;
import io.github.samzhu.costlens.model.RankedBreakdown;
import io.github.samzhu.costlens.model.RatioClassification;
import io.github.samzhu.costlens.model.RollingAverage;
import io.github.samzhu.costlens.model.TimeSeries;
import io.github.samzhu.costlens.model.TrendResult;
import io.github.samzhu.costlens.model.Window;
import io.github.samzhu.costlens.util.CostMath;
import io.github.samzhu.costlens.util.PeriodUtils;

/**
 * 成本分析流程服務。
 *
 * <p>把各元件串成單向流程，每種報表都是同一流程的一組參數：
 * <ol>
 *   <li>正規化原始資料 → 每個維度一條時間序列</li>
 *   <li>依維度篩選</li>
 *   <li>計算每個維度的本期、前期、基準期聚合</li>
 *   <li>樣本數足夠時產生趨勢與異常訊號</li>
 *   <li>本期總額排行（前 N 名 + Other）</li>
 *   <li>需要時計算非正式 / 正式環境比例</li>
 *   <li>回溯期內的單日尖峰、週成本與每日分布</li>
 * </ol>
 *
 * <p>視窗配置：
 * <pre>
 * |------ baseline (baselineDays) ------|-- current (windowDays) --|
 *                |-- previous (windowDays) --|
 * </pre>
 * 前期與基準期都緊鄰本期之前、與本期不重疊。
 *
 * <p>此服務沒有共享的可變狀態，不同請求可以完全平行執行。
 */
@Service
public class CostAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(CostAnalysisService.class);

    private static final Comparator<AnomalyEvent> BY_SEVERITY = Comparator
        .comparing(AnomalyEvent::severity, Comparator.reverseOrder())
        .thenComparing(AnomalyEvent::dimensionKey);

    private final CostNormalizationService normalizationService;
    private final WindowAggregationService aggregationService;
    private final TrendAnalysisService trendService;
    private final DimensionRankingService rankingService;
    private final AnomalyDetectionService anomalyService;
    private final RatioMonitorService ratioService;
    private final EnvironmentClassifier environmentClassifier;
    private final CostDistributionService distributionService;

    public CostAnalysisService(
            CostNormalizationService normalizationService,
            WindowAggregationService aggregationService,
            TrendAnalysisService trendService,
            DimensionRankingService rankingService,
            AnomalyDetectionService anomalyService,
            RatioMonitorService ratioService,
            EnvironmentClassifier environmentClassifier,
            CostDistributionService distributionService) {
        this.normalizationService = normalizationService;
        this.aggregationService = aggregationService;
        this.trendService = trendService;
        this.rankingService = rankingService;
        this.anomalyService = anomalyService;
        this.ratioService = ratioService;
        this.environmentClassifier = environmentClassifier;
        this.distributionService = distributionService;
    }

    /**
     * 執行完整分析。
     *
     * @param rawRecords 外部來源提供的原始成本資料
     * @param parameters 分析參數
     * @return 結構化分析報表
     * @throws io.github.samzhu.costlens.exception.CostValidationException 若輸入資料不合法
     */
    public CostAnalysisReport analyze(List<RawCostRecord> rawRecords, AnalysisParameters parameters) {
        long startTime = System.currentTimeMillis();
        Map<String, TimeSeries> seriesByKey = selectDimensions(normalizationService.normalize(rawRecords), parameters);

        LocalDate endDate = parameters.endDate() != null ? parameters.endDate() : latestDate(seriesByKey);
        if (endDate == null) {
            log.info("No cost data to analyze");
            return CostAnalysisReport.empty();
        }
        if (parameters.baselineDays() < 2L * parameters.windowDays()) {
            log.warn("Baseline of {} days is shorter than twice the {}-day window, anomaly signals may be noisy",
                parameters.baselineDays(), parameters.windowDays());
        }

        Window current = PeriodUtils.currentWindow(endDate, parameters.windowDays());
        Window previous = PeriodUtils.previousWindow(current);
        Window baseline = PeriodUtils.baselineWindow(current, parameters.baselineDays());
        Window lookback = PeriodUtils.lookbackWindow(current, parameters.baselineDays());

        log.info("Analyzing {} dimensions: current={}..{}, baseline={}..{}",
            seriesByKey.size(), current.startDate(), current.endDate(), baseline.startDate(), baseline.endDate());

        List<DimensionAnalysis> dimensions = new ArrayList<>();
        List<Aggregate> currentAggregates = new ArrayList<>();
        List<TrendResult> trends = new ArrayList<>();
        List<AnomalyEvent> anomalies = new ArrayList<>();
        List<PeakDay> peakDays = new ArrayList<>();

        for (TimeSeries series : seriesByKey.values()) {
            Aggregate currentAggregate = aggregationService.aggregate(series, current);
            Aggregate previousAggregate = aggregationService.aggregate(series, previous);
            Aggregate baselineAggregate = aggregationService.aggregate(series, baseline);
            currentAggregates.add(currentAggregate);

            if (currentAggregate.hasSufficientSamples() && previousAggregate.hasSufficientSamples()) {
                trends.add(trendService.compare(currentAggregate, previousAggregate));
            } else {
                log.debug("Trend suppressed for {}: samples current={}, previous={}",
                    series.dimensionKey(), currentAggregate.sampleCount(), previousAggregate.sampleCount());
            }

            if (currentAggregate.hasSufficientSamples() && baselineAggregate.hasSufficientSamples()) {
                anomalyService.detect(series.dimensionKey(), currentAggregate, baselineAggregate,
                        parameters.anomalyThresholdPercent())
                    .ifPresent(anomalies::add);
            }

            anomalyService.detectPeakDay(series, lookback, parameters.peakMultiplier())
                .ifPresent(peakDays::add);

            dimensions.add(new DimensionAnalysis(
                series.dimensionKey(),
                currentAggregate,
                previousAggregate,
                baselineAggregate,
                aggregationService.weeklyCosts(series, lookback),
                distributionService.distribution(series, lookback)));
        }

        anomalies.sort(BY_SEVERITY);
        RankedBreakdown breakdown = rankingService.rank(currentAggregates, parameters.topN());

        RatioClassification environmentRatio = null;
        if (parameters.environmentRatio()) {
            EnvironmentClassifier.EnvironmentSplit split = environmentClassifier.split(currentAggregates);
            environmentRatio = ratioService.classify(
                split.nonProductionTotal(), split.productionTotal(), parameters.healthyMaxRatio());
        }

        BigDecimal currentTotal = CostMath.sum(currentAggregates.stream().map(Aggregate::total).toList());
        long duration = System.currentTimeMillis() - startTime;
        log.info("Analysis completed in {}ms: total={}, trends={}, anomalies={}, peakDays={}",
            duration, currentTotal, trends.size(), anomalies.size(), peakDays.size());

        return new CostAnalysisReport(
            current,
            previous,
            baseline,
            currentTotal,
            List.copyOf(dimensions),
            List.copyOf(trends),
            List.copyOf(anomalies),
            List.copyOf(peakDays),
            breakdown,
            environmentRatio);
    }

    /**
     * 計算每個維度的滾動平均。
     *
     * <p>每個維度的惰性序列在此完整消費一次；需要再次使用請重新呼叫。
     *
     * @param rawRecords 原始成本資料
     * @param windowLength 視窗天數
     * @return 維度鍵 → 滾動平均列表，依維度鍵排序
     */
    public Map<String, List<RollingAverage>> rollingAverages(List<RawCostRecord> rawRecords, int windowLength) {
        Map<String, List<RollingAverage>> result = new LinkedHashMap<>();
        normalizationService.normalize(rawRecords).forEach((key, series) ->
            result.put(key, aggregationService.rollingWindows(series, windowLength).toList()));
        log.info("Computed {}-day rolling averages for {} dimensions", windowLength, result.size());
        return result;
    }

    private Map<String, TimeSeries> selectDimensions(Map<String, TimeSeries> seriesByKey,
                                                     AnalysisParameters parameters) {
        Map<String, TimeSeries> selected = new LinkedHashMap<>();
        seriesByKey.forEach((key, series) -> {
            if (parameters.includes(key)) {
                selected.put(key, series);
            }
        });
        return selected;
    }

    private LocalDate latestDate(Map<String, TimeSeries> seriesByKey) {
        return seriesByKey.values().stream()
            .map(TimeSeries::lastDate)
            .filter(Objects::nonNull)
            .max(Comparator.naturalOrder())
            .orElse(null);
    }
}
