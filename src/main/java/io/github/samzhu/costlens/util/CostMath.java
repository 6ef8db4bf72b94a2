package io.github.samzhu.costlens.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

import org.springframework.lang.Nullable;

/**
 * 成本運算工具類。
 *
 * <p>所有金額使用 {@link BigDecimal}，除法統一規則：
 * <ul>
 *   <li>金額、平均、比例：小數點後 6 位，HALF_UP</li>
 *   <li>百分比：小數點後 4 位，HALF_UP</li>
 * </ul>
 *
 * <p>分母為 0 時一律回傳定義好的值，不會拋出 {@link ArithmeticException}。
 */
public final class CostMath {

    public static final int AMOUNT_SCALE = 6;
    public static final int PERCENT_SCALE = 4;

    private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");

    private CostMath() {
        // 工具類不允許實例化
    }

    /**
     * 計算每日平均（以名目天數為分母）。
     *
     * @param total 視窗總額
     * @param days 名目天數，必須大於 0
     * @return 每日平均
     */
    public static BigDecimal perDay(BigDecimal total, int days) {
        return total.divide(BigDecimal.valueOf(days), AMOUNT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * 計算兩數比例。
     *
     * @return {@code numerator / denominator}；分母為 0 時回傳 null
     */
    @Nullable
    public static BigDecimal ratio(BigDecimal numerator, BigDecimal denominator) {
        if (denominator.signum() == 0) {
            return null;
        }
        return numerator.divide(denominator, AMOUNT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * 計算佔比百分比。
     *
     * @return {@code part / whole × 100}；整體為 0 時回傳 0
     */
    public static BigDecimal percentOf(BigDecimal part, BigDecimal whole) {
        if (whole.signum() == 0) {
            return BigDecimal.ZERO.setScale(PERCENT_SCALE);
        }
        return part.multiply(ONE_HUNDRED).divide(whole, PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * 計算相對於前值的變化百分比。
     *
     * <p>邊界規則：
     * <ul>
     *   <li>previous &gt; 0：{@code (current - previous) / previous × 100}</li>
     *   <li>previous = 0 且 current &gt; 0：回傳 null，代表「新增支出」</li>
     *   <li>兩者皆為 0：回傳 0</li>
     * </ul>
     *
     * @param current 本期值
     * @param previous 前期值
     * @return 變化百分比，新增支出時為 null
     */
    @Nullable
    public static BigDecimal percentChange(BigDecimal current, BigDecimal previous) {
        if (previous.signum() > 0) {
            return current.subtract(previous)
                .multiply(ONE_HUNDRED)
                .divide(previous, PERCENT_SCALE, RoundingMode.HALF_UP);
        }
        if (current.signum() > 0) {
            return null;
        }
        return BigDecimal.ZERO.setScale(PERCENT_SCALE);
    }

    /**
     * 加總金額。
     */
    public static BigDecimal sum(Collection<BigDecimal> amounts) {
        return amounts.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
