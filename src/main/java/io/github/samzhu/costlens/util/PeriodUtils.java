package io.github.samzhu.costlens.util;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

import io.github.samzhu.costlens.exception.CostValidationException;
import io.github.samzhu.costlens.model.Window;

/**
 * 分析視窗工具類。
 *
 * <p>依分析結束日推算本期、前期、基準期與回溯期。
 * 所有視窗皆為含頭含尾的日曆日區間，不依賴系統時間。
 */
public final class PeriodUtils {

    public static final int DAYS_PER_WEEK = 7;

    private PeriodUtils() {
        // 工具類不允許實例化
    }

    /**
     * 取得本期視窗。
     *
     * @param endDate 分析結束日（含）
     * @param windowDays 視窗天數
     * @return {@code [endDate - windowDays + 1, endDate]}
     */
    public static Window currentWindow(LocalDate endDate, int windowDays) {
        return Window.endingOn(endDate, windowDays);
    }

    /**
     * 取得緊鄰本期之前、長度相同的前期視窗（週對週比較使用）。
     */
    public static Window previousWindow(Window current) {
        return current.preceding(current.lengthDays());
    }

    /**
     * 取得緊鄰本期之前的基準期視窗，與本期不重疊。
     *
     * @param current 本期視窗
     * @param baselineDays 基準期天數
     */
    public static Window baselineWindow(Window current, int baselineDays) {
        return current.preceding(baselineDays);
    }

    /**
     * 取得從基準期開始到本期結束的完整回溯視窗。
     *
     * @throws CostValidationException 若總天數超出 int 範圍
     */
    public static Window lookbackWindow(Window current, int baselineDays) {
        long lengthDays = (long) baselineDays + current.lengthDays();
        if (lengthDays > Integer.MAX_VALUE) {
            throw new CostValidationException("baselineDays",
                String.format("lookback of %d days is too long", lengthDays));
        }
        return Window.startingOn(current.startDate().minusDays(baselineDays), (int) lengthDays);
    }

    /**
     * 將視窗切成從起始日開始的完整週，尾端不足 7 天的部分捨去。
     *
     * @param window 來源視窗
     * @return 週視窗列表，依日期遞增
     */
    public static List<Window> completeWeeks(Window window) {
        return completeWeeks(window, window.startDate(), window.endDate());
    }

    /**
     * 只取與 {@code [from, to]} 重疊的完整週。
     *
     * <p>週的切法與 {@link #completeWeeks(Window)} 相同（從視窗起始日每 7 天一組），
     * 產生的週數只取決於 {@code from..to} 的跨度，與視窗長度無關。
     *
     * @param window 來源視窗
     * @param from 起始日（含）
     * @param to 結束日（含）
     * @return 週視窗列表，依日期遞增；沒有重疊時為空
     */
    public static List<Window> completeWeeks(Window window, LocalDate from, LocalDate to) {
        LocalDate first = from.isBefore(window.startDate()) ? window.startDate() : from;
        LocalDate last = to.isAfter(window.endDate()) ? window.endDate() : to;
        if (first.isAfter(last)) {
            return List.of();
        }

        long weekCount = window.lengthDays() / DAYS_PER_WEEK;
        long firstWeek = ChronoUnit.DAYS.between(window.startDate(), first) / DAYS_PER_WEEK;
        long lastWeek = Math.min(ChronoUnit.DAYS.between(window.startDate(), last) / DAYS_PER_WEEK, weekCount - 1);

        List<Window> weeks = new ArrayList<>();
        for (long week = firstWeek; week <= lastWeek; week++) {
            weeks.add(Window.startingOn(window.startDate().plusDays(week * DAYS_PER_WEEK), DAYS_PER_WEEK));
        }
        return weeks;
    }
}
