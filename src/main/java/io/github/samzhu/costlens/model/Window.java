package io.github.samzhu.costlens.model;

import java.time.LocalDate;

import io.github.samzhu.costlens.exception.CostValidationException;

/**
 * 含頭含尾的連續日期區間。
 *
 * <p>純值物件，不持有任何狀態；{@code endDate = startDate + lengthDays - 1} 恆成立。
 *
 * @param startDate 起始日期（含）
 * @param endDate 結束日期（含）
 * @param lengthDays 名目天數，必須大於 0
 */
public record Window(
    LocalDate startDate,
    LocalDate endDate,
    int lengthDays
) {
    public Window {
        if (lengthDays <= 0) {
            throw new CostValidationException("lengthDays", "window length must be positive but was " + lengthDays);
        }
        if (startDate == null || endDate == null) {
            throw new CostValidationException("window", "start and end dates are required");
        }
        if (!startDate.plusDays(lengthDays - 1L).equals(endDate)) {
            throw new CostValidationException("window",
                String.format("%s..%s does not span %d days", startDate, endDate, lengthDays));
        }
    }

    /**
     * 建立以指定日期結尾的視窗。
     */
    public static Window endingOn(LocalDate endDate, int lengthDays) {
        if (lengthDays <= 0) {
            throw new CostValidationException("lengthDays", "window length must be positive but was " + lengthDays);
        }
        return new Window(endDate.minusDays(lengthDays - 1L), endDate, lengthDays);
    }

    /**
     * 建立以指定日期開始的視窗。
     */
    public static Window startingOn(LocalDate startDate, int lengthDays) {
        if (lengthDays <= 0) {
            throw new CostValidationException("lengthDays", "window length must be positive but was " + lengthDays);
        }
        return new Window(startDate, startDate.plusDays(lengthDays - 1L), lengthDays);
    }

    /**
     * 緊鄰此視窗之前（不重疊）、指定長度的視窗。
     */
    public Window preceding(int lengthDays) {
        return endingOn(startDate.minusDays(1), lengthDays);
    }

    /**
     * 判斷日期是否落在視窗內（含頭含尾）。
     */
    public boolean contains(LocalDate date) {
        return !date.isBefore(startDate) && !date.isAfter(endDate);
    }
}
