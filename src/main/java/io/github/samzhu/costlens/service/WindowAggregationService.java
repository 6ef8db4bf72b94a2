package io.github.samzhu.costlens.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.costlens.exception.CostValidationException;
import io.github.samzhu.costlens.model.Aggregate;
import io.github.samzhu.costlens.model.CostRecord;
import io.github.samzhu.costlens.model.RollingAverage;
import io.github.samzhu.costlens.model.TimeSeries;
import io.github.samzhu.costlens.model.Window;
import io.github.samzhu.costlens.util.CostMath;
import io.github.samzhu.costlens.util.PeriodUtils;

/**
 * 視窗聚合服務。
 *
 * <p>計算單一維度在視窗內的總額與每日平均：
 * <ul>
 *   <li>總額 = 視窗內（含頭含尾）所有紀錄金額加總</li>
 *   <li>每日平均 = 總額 / 名目天數（不是實際樣本數）</li>
 *   <li>樣本數 = 視窗內實際找到的紀錄數</li>
 * </ul>
 *
 * <p>範例：7 天視窗只有 3 天資料時，平均會低於 7 天都有相同支出的維度，
 * 正確反映帳單資料不完整，而不是把它掩蓋掉。
 */
@Service
public class WindowAggregationService {

    private static final Logger log = LoggerFactory.getLogger(WindowAggregationService.class);

    /**
     * 聚合單一維度在視窗內的成本。
     *
     * <p>視窗內沒有任何紀錄時回傳 {@code total = 0, sampleCount = 0}，不拋出例外。
     *
     * @param series 時間序列
     * @param window 聚合視窗
     * @return 聚合結果
     */
    public Aggregate aggregate(TimeSeries series, Window window) {
        List<CostRecord> samples = series.within(window);
        BigDecimal total = samples.stream()
            .map(CostRecord::amount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        return Aggregate.of(series.dimensionKey(), window, total, samples.size());
    }

    /**
     * 計算滾動平均。
     *
     * <p>從序列第 {@code windowLength} 筆紀錄開始，對每個紀錄日期計算以該日結尾的滾動視窗平均。
     * 回傳的 Stream 是惰性的單次走訪，只能消費一次；需要再次使用時請重新呼叫。
     *
     * @param series 時間序列
     * @param windowLength 視窗天數
     * @return 依結束日遞增的滾動平均
     * @throws CostValidationException 若視窗天數不是正數
     */
    public Stream<RollingAverage> rollingWindows(TimeSeries series, int windowLength) {
        if (windowLength <= 0) {
            throw new CostValidationException("windowLength", "must be positive but was " + windowLength);
        }
        log.debug("Rolling {}-day averages requested for {} ({} records)",
            windowLength, series.dimensionKey(), series.size());
        Iterator<RollingAverage> iterator = new RollingIterator(series.records(), windowLength);
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
            false);
    }

    /**
     * 計算視窗內每個完整週的成本。
     *
     * <p>從視窗起始日開始每 7 天一組，尾端不足 7 天的部分捨去。
     * 只回傳從第一筆到最後一筆紀錄所在的週；兩者之間沒有資料的週仍以 0 回報。
     *
     * @param series 時間序列
     * @param window 來源視窗
     * @return 每週聚合，依日期遞增；視窗內沒有紀錄時為空
     */
    public List<Aggregate> weeklyCosts(TimeSeries series, Window window) {
        List<CostRecord> samples = series.within(window);
        if (samples.isEmpty()) {
            return List.of();
        }
        LocalDate firstDate = samples.get(0).date();
        LocalDate lastDate = samples.get(samples.size() - 1).date();
        return PeriodUtils.completeWeeks(window, firstDate, lastDate).stream()
            .map(week -> aggregate(series, week))
            .toList();
    }

    /**
     * 單次走訪的滾動視窗迭代器，以雙指標維護視窗總額。
     */
    private static final class RollingIterator implements Iterator<RollingAverage> {

        private final List<CostRecord> records;
        private final int windowLength;
        private int cursor;
        private int tail;
        private BigDecimal windowSum = BigDecimal.ZERO;

        RollingIterator(List<CostRecord> records, int windowLength) {
            this.records = records;
            this.windowLength = windowLength;
            // 先累加前 windowLength - 1 筆，第一個輸出點是第 windowLength 筆
            while (cursor < windowLength - 1 && cursor < records.size()) {
                windowSum = windowSum.add(records.get(cursor).amount());
                cursor++;
            }
        }

        @Override
        public boolean hasNext() {
            return cursor < records.size();
        }

        @Override
        public RollingAverage next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            CostRecord current = records.get(cursor);
            windowSum = windowSum.add(current.amount());

            Window window = Window.endingOn(current.date(), windowLength);
            while (records.get(tail).date().isBefore(window.startDate())) {
                windowSum = windowSum.subtract(records.get(tail).amount());
                tail++;
            }
            cursor++;

            return new RollingAverage(
                current.date(),
                CostMath.perDay(windowSum, windowLength),
                windowSum,
                cursor - tail);
        }
    }
}
