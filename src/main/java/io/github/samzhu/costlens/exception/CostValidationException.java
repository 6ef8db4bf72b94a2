package io.github.samzhu.costlens.exception;

/**
 * 成本資料驗證異常。
 *
 * <p>輸入資料格式錯誤或語意不合法時拋出，例如：
 * <ul>
 *   <li>負數金額（成本不會是負的）</li>
 *   <li>缺少日期，無法排序</li>
 *   <li>維度鍵為空</li>
 *   <li>視窗長度、門檻等參數不合法</li>
 * </ul>
 *
 * <p>此異常不會在分析流程內被攔截，直接傳遞給呼叫端；
 * HTTP 層由 {@link io.github.samzhu.costlens.controller.ApiExceptionHandler} 轉為 400 回應。
 */
public class CostValidationException extends RuntimeException {

    private final String field;

    public CostValidationException(String field, String message) {
        super(String.format("Invalid %s: %s", field, message));
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
