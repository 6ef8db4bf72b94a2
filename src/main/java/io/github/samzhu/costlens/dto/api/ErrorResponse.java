package io.github.samzhu.costlens.dto.api;

/**
 * API 錯誤回應。
 *
 * @param code 錯誤代碼
 * @param message 錯誤訊息
 * @param field 出錯的欄位，無法判斷時為 null
 */
public record ErrorResponse(
    String code,
    String message,
    String field
) {}
