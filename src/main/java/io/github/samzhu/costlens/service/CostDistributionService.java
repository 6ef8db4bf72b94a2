package io.github.samzhu.costlens.service;

import java.util.List;

import org.springframework.stereotype.Service;

import com.tdunning.math.stats.TDigest;

import io.github.samzhu.costlens.config.CostLensProperties;
import io.github.samzhu.costlens.model.CostDistribution;
import io.github.samzhu.costlens.model.CostRecord;
import io.github.samzhu.costlens.model.TimeSeries;
import io.github.samzhu.costlens.model.Window;

/**
 * T-Digest 每日成本百分位計算服務。
 *
 * <p>使用 T-Digest 演算法計算單日金額的百分位數 (P50/P90/P95/P99)，
 * 協助判斷單日支出是否偏離常態。
 *
 * @see <a href="https://github.com/tdunning/t-digest">T-Digest GitHub</a>
 */
@Service
public class CostDistributionService {

    private final int compression;

    public CostDistributionService(CostLensProperties properties) {
        this.compression = properties.distribution().digestCompression();
    }

    /**
     * 計算視窗內每日金額的分布。
     *
     * @param series 時間序列
     * @param window 統計視窗
     * @return 分布統計；視窗內沒有資料時回傳全 0
     */
    public CostDistribution distribution(TimeSeries series, Window window) {
        List<CostRecord> samples = series.within(window);
        if (samples.isEmpty()) {
            return CostDistribution.empty(series.dimensionKey());
        }

        TDigest digest = createDigest();
        double sum = 0;
        for (CostRecord record : samples) {
            double amount = record.amount().doubleValue();
            digest.add(amount);
            sum += amount;
        }

        return new CostDistribution(
            series.dimensionKey(),
            digest.size(),
            digest.getMin(),
            digest.getMax(),
            sum / samples.size(),
            digest.quantile(0.5),   // P50
            digest.quantile(0.9),   // P90
            digest.quantile(0.95),  // P95
            digest.quantile(0.99)   // P99
        );
    }

    private TDigest createDigest() {
        return TDigest.createMergingDigest(compression);
    }
}
