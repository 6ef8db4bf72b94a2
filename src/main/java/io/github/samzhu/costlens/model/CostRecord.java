package io.github.samzhu.costlens.model;

import java.math.BigDecimal;
import java.time.LocalDate;

import io.github.samzhu.costlens.exception.CostValidationException;

/**
 * 單一維度、單日的成本數字。
 *
 * <p>建立後不可變。金額不可為負數。
 *
 * @param date 日期
 * @param dimensionKey 維度鍵（服務、標籤值、租戶、環境等）
 * @param amount 金額
 */
public record CostRecord(
    LocalDate date,
    String dimensionKey,
    BigDecimal amount
) {
    public CostRecord {
        if (date == null) {
            throw new CostValidationException("date", "cost record date is required");
        }
        if (dimensionKey == null || dimensionKey.isBlank()) {
            throw new CostValidationException("dimensionKey", "cost record dimension key is required");
        }
        if (amount == null) {
            throw new CostValidationException("amount", "cost record amount is required");
        }
        if (amount.signum() < 0) {
            throw new CostValidationException("amount",
                String.format("negative amount %s for %s on %s", amount.toPlainString(), dimensionKey, date));
        }
    }
}
