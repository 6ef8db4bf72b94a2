package io.github.samzhu.costlens.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * 維度排行結果。
 *
 * <p>前 N 名依總額遞減（同額依維度鍵字典序），被截掉的維度併入最後一筆 Other。
 * 所有項目總額加總恆等於 {@code grandTotal}。
 *
 * @param entries 排行項目（含 Other）
 * @param grandTotal 所有輸入的總額
 * @param foldedCount 併入 Other 的維度數
 */
public record RankedBreakdown(
    List<Entry> entries,
    BigDecimal grandTotal,
    int foldedCount
) {
    public RankedBreakdown {
        entries = List.copyOf(entries);
    }

    /**
     * 取得 Other 項目（若有截斷）。
     */
    public Optional<Entry> otherEntry() {
        return entries.stream().filter(Entry::other).findFirst();
    }

    /**
     * 排行項目。
     *
     * @param dimensionKey 維度鍵，Other 項目為 {@code "Other"}
     * @param total 總額
     * @param percentOfTotal 佔總額百分比
     * @param other 是否為合成的 Other 項目
     */
    public record Entry(
        String dimensionKey,
        BigDecimal total,
        BigDecimal percentOfTotal,
        boolean other
    ) {}
}
