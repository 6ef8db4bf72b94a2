package io.github.samzhu.costlens.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * 外部成本來源提供的原始成本資料。
 *
 * <p>各雲端供應商的回應格式都必須先轉成此格式，分析流程不會依供應商分支。
 * 同一批次中 {@code (date, dimensionKey)} 重複時，正規化會把金額相加。
 *
 * @param date 日期
 * @param dimensionKey 維度鍵
 * @param amount 金額（非負）
 */
public record RawCostRecord(
    @NotNull(message = "date is required")
    LocalDate date,

    @NotBlank(message = "dimensionKey is required")
    String dimensionKey,

    @NotNull(message = "amount is required")
    @PositiveOrZero(message = "amount must be positive or zero")
    BigDecimal amount
) {}
