package io.github.samzhu.costlens.model;

import java.math.BigDecimal;

/**
 * 趨勢方向。
 *
 * <p>變化百分比絕對值不超過 0.5 視為持平，避免四捨五入造成的雜訊。
 */
public enum TrendDirection {
    INCREASING,
    DECREASING,
    FLAT;

    private static final BigDecimal FLAT_BAND = new BigDecimal("0.5");

    /**
     * 依變化百分比判斷方向。
     */
    public static TrendDirection of(BigDecimal deltaPercent) {
        if (deltaPercent.compareTo(FLAT_BAND) > 0) {
            return INCREASING;
        }
        if (deltaPercent.compareTo(FLAT_BAND.negate()) < 0) {
            return DECREASING;
        }
        return FLAT;
    }
}
