package io.github.samzhu.costlens.service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.costlens.exception.CostValidationException;
import io.github.samzhu.costlens.model.Aggregate;
import io.github.samzhu.costlens.model.AnomalyEvent;
import io.github.samzhu.costlens.model.CostRecord;
import io.github.samzhu.costlens.model.PeakDay;
import io.github.samzhu.costlens.model.Severity;
import io.github.samzhu.costlens.model.TimeSeries;
import io.github.samzhu.costlens.model.Window;
import io.github.samzhu.costlens.util.CostMath;

/**
 * 成本異常偵測服務。
 *
 * <p>比較短的「本期」視窗與較長的歷史「基準期」視窗，依變化幅度分級。
 * 基準期應至少為本期 2 倍長度才有統計意義，但此服務不強制，由呼叫端負責。
 *
 * <p>嚴重度分級（固定，不可設定）：
 * <ul>
 *   <li>{@link Severity#CRITICAL}：|變化百分比| ≥ 50，或基準為 0 的新增支出</li>
 *   <li>{@link Severity#HIGH}：|本期總影響金額| ≥ 100</li>
 *   <li>{@link Severity#MODERATE}：其他達到門檻的變化</li>
 * </ul>
 *
 * <p>相同輸入永遠產生相同事件，不依賴系統時間或亂數。
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    public static final BigDecimal CRITICAL_PERCENT = new BigDecimal("50");
    public static final BigDecimal HIGH_IMPACT_FLOOR = new BigDecimal("100");
    public static final int MIN_PEAK_SAMPLES = 7;

    /**
     * 偵測本期相對於基準期的異常。
     *
     * <p>門檻為含等號：{@code |deltaPercent| ≥ thresholdPercent} 即產生事件。
     *
     * @param dimensionKey 維度鍵
     * @param current 本期聚合
     * @param baseline 基準期聚合
     * @param thresholdPercent 異常門檻百分比
     * @return 異常事件；未達門檻時為空
     * @throws CostValidationException 若門檻不是正數
     */
    public Optional<AnomalyEvent> detect(String dimensionKey, Aggregate current, Aggregate baseline,
                                         BigDecimal thresholdPercent) {
        if (thresholdPercent == null || thresholdPercent.signum() <= 0) {
            throw new CostValidationException("thresholdPercent", "must be positive");
        }

        BigDecimal deltaAmount = current.averagePerDay().subtract(baseline.averagePerDay());
        BigDecimal deltaPercent = CostMath.percentChange(current.averagePerDay(), baseline.averagePerDay());
        boolean newSpend = deltaPercent == null;

        if (!newSpend && deltaPercent.abs().compareTo(thresholdPercent) < 0) {
            return Optional.empty();
        }

        BigDecimal impactTotal = deltaAmount.multiply(BigDecimal.valueOf(current.window().lengthDays()));
        Severity severity = classify(deltaPercent, impactTotal);

        log.debug("Anomaly detected for {}: {}/day vs baseline {}/day ({}%, severity={}, impact={})",
            dimensionKey, current.averagePerDay(), baseline.averagePerDay(),
            newSpend ? "new spend" : deltaPercent, severity, impactTotal);

        return Optional.of(new AnomalyEvent(
            dimensionKey,
            current.averagePerDay(),
            baseline.averagePerDay(),
            deltaAmount,
            deltaPercent,
            newSpend,
            severity,
            impactTotal));
    }

    /**
     * 偵測視窗內的單日尖峰。
     *
     * <p>視窗內至少要有 {@value #MIN_PEAK_SAMPLES} 筆紀錄。
     * 最高單日金額（同額取較早日期）超過「實際樣本平均 × 倍數」時回報。
     *
     * @param series 時間序列
     * @param window 偵測視窗
     * @param multiplier 尖峰倍數，例如 1.5
     * @return 尖峰日；沒有尖峰時為空
     */
    public Optional<PeakDay> detectPeakDay(TimeSeries series, Window window, BigDecimal multiplier) {
        if (multiplier == null || multiplier.signum() <= 0) {
            throw new CostValidationException("multiplier", "must be positive");
        }

        List<CostRecord> samples = series.within(window);
        if (samples.size() < MIN_PEAK_SAMPLES) {
            return Optional.empty();
        }

        BigDecimal total = CostMath.sum(samples.stream().map(CostRecord::amount).toList());
        BigDecimal average = CostMath.perDay(total, samples.size());
        if (average.signum() == 0) {
            return Optional.empty();
        }

        CostRecord peak = samples.get(0);
        for (CostRecord record : samples) {
            if (record.amount().compareTo(peak.amount()) > 0) {
                peak = record;
            }
        }

        if (peak.amount().compareTo(average.multiply(multiplier)) <= 0) {
            return Optional.empty();
        }

        log.debug("Peak day for {}: {} on {} vs average {}",
            series.dimensionKey(), peak.amount(), peak.date(), average);
        return Optional.of(new PeakDay(
            series.dimensionKey(),
            peak.date(),
            peak.amount(),
            average,
            CostMath.percentChange(peak.amount(), average)));
    }

    private Severity classify(BigDecimal deltaPercent, BigDecimal impactTotal) {
        if (deltaPercent == null || deltaPercent.abs().compareTo(CRITICAL_PERCENT) >= 0) {
            return Severity.CRITICAL;
        }
        if (impactTotal.abs().compareTo(HIGH_IMPACT_FLOOR) >= 0) {
            return Severity.HIGH;
        }
        return Severity.MODERATE;
    }
}
