package io.github.samzhu.costlens.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.costlens.exception.CostValidationException;
import io.github.samzhu.costlens.model.Aggregate;
import io.github.samzhu.costlens.model.RankedBreakdown;
import io.github.samzhu.costlens.util.CostMath;

/**
 * 維度排行服務。
 *
 * <p>排序規則：總額遞減，同額時依維度鍵字典序遞增，相同輸入永遠得到相同輸出。
 * 前 N 名之外的維度併入名為 {@code "Other"} 的合成項目，總額不會遺漏或重複計算。
 *
 * <p>總額為 0 時所有百分比回報 0。
 */
@Service
public class DimensionRankingService {

    private static final Logger log = LoggerFactory.getLogger(DimensionRankingService.class);

    public static final String OTHER_KEY = "Other";

    static final Comparator<Aggregate> BY_TOTAL_DESC = Comparator
        .comparing(Aggregate::total, Comparator.reverseOrder())
        .thenComparing(Aggregate::dimensionKey);

    /**
     * 依總額排行並截取前 N 名。
     *
     * @param aggregates 各維度聚合
     * @param topN 保留筆數，0 表示全部併入 Other
     * @return 排行結果
     * @throws CostValidationException 若 topN 為負數
     */
    public RankedBreakdown rank(List<Aggregate> aggregates, int topN) {
        if (topN < 0) {
            throw new CostValidationException("topN", "must not be negative but was " + topN);
        }

        List<Aggregate> sorted = aggregates.stream().sorted(BY_TOTAL_DESC).toList();
        BigDecimal grandTotal = CostMath.sum(sorted.stream().map(Aggregate::total).toList());

        List<RankedBreakdown.Entry> entries = new ArrayList<>();
        int kept = Math.min(topN, sorted.size());
        for (Aggregate aggregate : sorted.subList(0, kept)) {
            entries.add(new RankedBreakdown.Entry(
                aggregate.dimensionKey(),
                aggregate.total(),
                CostMath.percentOf(aggregate.total(), grandTotal),
                false));
        }

        List<Aggregate> rest = sorted.subList(kept, sorted.size());
        if (!rest.isEmpty()) {
            BigDecimal otherTotal = CostMath.sum(rest.stream().map(Aggregate::total).toList());
            entries.add(new RankedBreakdown.Entry(
                OTHER_KEY,
                otherTotal,
                CostMath.percentOf(otherTotal, grandTotal),
                true));
        }

        log.debug("Ranked {} dimensions: top {} kept, {} folded into {}",
            sorted.size(), kept, rest.size(), OTHER_KEY);
        return new RankedBreakdown(entries, grandTotal, rest.size());
    }

    /**
     * 篩選總額超過門檻的維度。
     *
     * @param aggregates 各維度聚合
     * @param threshold 金額門檻（不含）
     * @return 超過門檻的聚合，排序規則與 {@link #rank} 相同
     */
    public List<Aggregate> aboveThreshold(List<Aggregate> aggregates, BigDecimal threshold) {
        if (threshold == null || threshold.signum() < 0) {
            throw new CostValidationException("threshold", "must be zero or positive");
        }
        return aggregates.stream()
            .filter(a -> a.total().compareTo(threshold) > 0)
            .sorted(BY_TOTAL_DESC)
            .toList();
    }
}
