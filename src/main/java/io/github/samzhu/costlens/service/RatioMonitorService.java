package io.github.samzhu.costlens.service;

import java.math.BigDecimal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.costlens.exception.CostValidationException;
import io.github.samzhu.costlens.model.RatioClassification;
import io.github.samzhu.costlens.model.RatioStatus;
import io.github.samzhu.costlens.util.CostMath;

/**
 * 成本比例監控服務。
 *
 * <p>將次要總額（例如非正式環境成本）相對於主要總額（例如正式環境成本）的比例分級：
 * <ul>
 *   <li>{@link RatioStatus#ALERT}：ratio &gt; healthyMaxRatio</li>
 *   <li>{@link RatioStatus#WARNING}：ratio &gt; 0.8 × healthyMaxRatio</li>
 *   <li>{@link RatioStatus#HEALTHY}：其他</li>
 * </ul>
 *
 * <p>分母為 0 時：分子 &gt; 0 直接判定 ALERT（沒有正式環境基準本身就是訊號），
 * 兩者皆為 0 判定 HEALTHY；兩種情況 ratio 皆為 null。
 */
@Service
public class RatioMonitorService {

    private static final Logger log = LoggerFactory.getLogger(RatioMonitorService.class);

    public static final BigDecimal WARNING_MARGIN = new BigDecimal("0.8");

    /**
     * 比例分級。
     *
     * @param numeratorTotal 分子總額
     * @param denominatorTotal 分母總額
     * @param healthyMaxRatio 健康上限
     * @return 分級結果
     * @throws CostValidationException 若總額為負數或上限不是正數
     */
    public RatioClassification classify(BigDecimal numeratorTotal, BigDecimal denominatorTotal,
                                        BigDecimal healthyMaxRatio) {
        requireNonNegative("numeratorTotal", numeratorTotal);
        requireNonNegative("denominatorTotal", denominatorTotal);
        if (healthyMaxRatio == null || healthyMaxRatio.signum() <= 0) {
            throw new CostValidationException("healthyMaxRatio", "must be positive");
        }

        BigDecimal ratio = CostMath.ratio(numeratorTotal, denominatorTotal);
        RatioStatus status;
        if (ratio == null) {
            status = numeratorTotal.signum() > 0 ? RatioStatus.ALERT : RatioStatus.HEALTHY;
        } else if (ratio.compareTo(healthyMaxRatio) > 0) {
            status = RatioStatus.ALERT;
        } else if (ratio.compareTo(healthyMaxRatio.multiply(WARNING_MARGIN)) > 0) {
            status = RatioStatus.WARNING;
        } else {
            status = RatioStatus.HEALTHY;
        }

        log.debug("Ratio classified: {} / {} = {} (max {}) -> {}",
            numeratorTotal, denominatorTotal, ratio, healthyMaxRatio, status);
        return new RatioClassification(numeratorTotal, denominatorTotal, ratio, healthyMaxRatio, status);
    }

    private void requireNonNegative(String field, BigDecimal value) {
        if (value == null) {
            throw new CostValidationException(field, "is required");
        }
        if (value.signum() < 0) {
            throw new CostValidationException(field, "must not be negative but was " + value.toPlainString());
        }
    }
}
