package io.github.samzhu.costlens.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.costlens.dto.RawCostRecord;
import io.github.samzhu.costlens.exception.CostValidationException;
import io.github.samzhu.costlens.model.CostRecord;
import io.github.samzhu.costlens.model.TimeSeries;

/**
 * 原始成本資料正規化服務。
 *
 * <p>把外部來源的 {@code (date, dimensionKey, amount)} 批次轉成每個維度一條 {@link TimeSeries}：
 * <ul>
 *   <li>依 {@code dimensionKey} 分組</li>
 *   <li>同一維度同一天的金額相加（上游重複列不會覆蓋）</li>
 *   <li>依日期遞增排序</li>
 * </ul>
 *
 * <p>驗證失敗立即拋出 {@link CostValidationException}，不做任何修補。
 * 空輸入回傳空 Map。同一批次重複呼叫得到相同結果。
 */
@Service
public class CostNormalizationService {

    private static final Logger log = LoggerFactory.getLogger(CostNormalizationService.class);

    /**
     * 正規化原始成本資料。
     *
     * @param rawRecords 原始資料，順序不限
     * @return 維度鍵 → 時間序列，依維度鍵排序且不可修改
     * @throws CostValidationException 若有負數金額、缺少日期或維度鍵
     */
    public Map<String, TimeSeries> normalize(List<RawCostRecord> rawRecords) {
        if (rawRecords == null || rawRecords.isEmpty()) {
            log.debug("Empty raw batch, nothing to normalize");
            return Map.of();
        }

        Map<String, TreeMap<LocalDate, BigDecimal>> grouped = new TreeMap<>();
        for (int i = 0; i < rawRecords.size(); i++) {
            RawCostRecord raw = rawRecords.get(i);
            validate(raw, i);
            grouped.computeIfAbsent(raw.dimensionKey(), key -> new TreeMap<>())
                .merge(raw.date(), raw.amount(), BigDecimal::add);
        }

        Map<String, TimeSeries> result = new LinkedHashMap<>();
        for (var entry : grouped.entrySet()) {
            List<CostRecord> records = new ArrayList<>(entry.getValue().size());
            entry.getValue().forEach((date, amount) -> records.add(new CostRecord(date, entry.getKey(), amount)));
            result.put(entry.getKey(), new TimeSeries(entry.getKey(), records));
        }

        log.debug("Normalized {} raw records into {} dimension series", rawRecords.size(), result.size());
        return Collections.unmodifiableMap(result);
    }

    private void validate(RawCostRecord raw, int index) {
        if (raw == null) {
            throw new CostValidationException("records[" + index + "]", "record is null");
        }
        if (raw.date() == null) {
            throw new CostValidationException("records[" + index + "].date", "date is required and must be orderable");
        }
        if (raw.dimensionKey() == null || raw.dimensionKey().isBlank()) {
            throw new CostValidationException("records[" + index + "].dimensionKey", "dimension key is required");
        }
        if (raw.amount() == null) {
            throw new CostValidationException("records[" + index + "].amount", "amount is required");
        }
        if (raw.amount().signum() < 0) {
            throw new CostValidationException("records[" + index + "].amount",
                String.format("negative amount %s for %s on %s",
                    raw.amount().toPlainString(), raw.dimensionKey(), raw.date()));
        }
    }
}
