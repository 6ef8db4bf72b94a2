package io.github.samzhu.costlens.service;

import java.math.BigDecimal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.costlens.model.Aggregate;
import io.github.samzhu.costlens.model.TrendDirection;
import io.github.samzhu.costlens.model.TrendResult;
import io.github.samzhu.costlens.util.CostMath;

/**
 * 趨勢分析服務。
 *
 * <p>比較相鄰兩期（本期 vs 緊鄰的前期）的每日平均：
 * <pre>
 * deltaAmount  = current.averagePerDay - previous.averagePerDay
 * deltaPercent = deltaAmount / previous.averagePerDay × 100
 * </pre>
 *
 * <p>前期平均為 0 時：
 * <ul>
 *   <li>本期 &gt; 0：標記為新增支出，{@code deltaPercent = null}，方向為上升</li>
 *   <li>本期也為 0：{@code deltaPercent = 0}，方向為持平</li>
 * </ul>
 */
@Service
public class TrendAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(TrendAnalysisService.class);

    /**
     * 比較本期與前期。
     *
     * @param current 本期聚合
     * @param previous 前期聚合
     * @return 趨勢結果
     */
    public TrendResult compare(Aggregate current, Aggregate previous) {
        BigDecimal deltaAmount = current.averagePerDay().subtract(previous.averagePerDay());
        BigDecimal deltaPercent = CostMath.percentChange(current.averagePerDay(), previous.averagePerDay());

        if (deltaPercent == null) {
            log.debug("New spend for {}: previous average is zero, current {}/day",
                current.dimensionKey(), current.averagePerDay());
            return new TrendResult(current.dimensionKey(), current, previous,
                deltaAmount, null, true, TrendDirection.INCREASING);
        }

        TrendDirection direction = TrendDirection.of(deltaPercent);
        log.debug("Trend for {}: {} -> {} per day ({}%, {})",
            current.dimensionKey(), previous.averagePerDay(), current.averagePerDay(), deltaPercent, direction);
        return new TrendResult(current.dimensionKey(), current, previous,
            deltaAmount, deltaPercent, false, direction);
    }
}
