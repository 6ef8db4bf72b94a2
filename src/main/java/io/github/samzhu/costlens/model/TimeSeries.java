package io.github.samzhu.costlens.model;

import java.time.LocalDate;
import java.util.List;

import io.github.samzhu.costlens.exception.CostValidationException;

/**
 * 單一維度依日期排序的成本序列。
 *
 * <p>不變量：
 * <ul>
 *   <li>所有紀錄屬於同一個 {@code dimensionKey}</li>
 *   <li>日期嚴格遞增，同一天不會有兩筆</li>
 * </ul>
 *
 * <p>缺漏的日期<b>不會</b>補 0；聚合時視為「沒有資料」。
 *
 * @param dimensionKey 維度鍵
 * @param records 依日期遞增的紀錄
 */
public record TimeSeries(
    String dimensionKey,
    List<CostRecord> records
) {
    public TimeSeries {
        records = List.copyOf(records);
        LocalDate previous = null;
        for (CostRecord record : records) {
            if (!record.dimensionKey().equals(dimensionKey)) {
                throw new CostValidationException("dimensionKey",
                    String.format("record for '%s' in series '%s'", record.dimensionKey(), dimensionKey));
            }
            if (previous != null && !record.date().isAfter(previous)) {
                throw new CostValidationException("date",
                    String.format("series '%s' dates not strictly ascending at %s", dimensionKey, record.date()));
            }
            previous = record.date();
        }
    }

    /**
     * 取得落在視窗內的紀錄。
     */
    public List<CostRecord> within(Window window) {
        return records.stream()
            .filter(r -> window.contains(r.date()))
            .toList();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int size() {
        return records.size();
    }

    /**
     * @return 最後一筆紀錄的日期；空序列回傳 null
     */
    public LocalDate lastDate() {
        return records.isEmpty() ? null : records.get(records.size() - 1).date();
    }
}
