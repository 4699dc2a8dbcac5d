package com.aiinpocket.totemboost.controller;

import com.aiinpocket.totemboost.exception.BoostException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * 全域 REST API 異常處理器。
 * 加持錯誤回傳 {"error": 訊息, "code": 錯誤碼}，HTTP 狀態碼由 BoostError 決定；
 * 其餘未預期的錯誤只記錄日誌，不把堆疊追蹤回給前端。
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(BoostException.class)
    public ResponseEntity<Map<String, String>> handleBoost(BoostException e) {
        if (e.getError().getHttpStatus() >= 500) {
            log.warn("[加持] 請求失敗 {}: {}", e.getError(), e.getMessage());
        } else {
            log.debug("[加持] 請求被拒 {}: {}", e.getError(), e.getMessage());
        }
        return ResponseEntity.status(e.getError().getHttpStatus())
                .body(Map.of("error", e.getMessage(), "code", e.getError().name()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleIllegalArgument(IllegalArgumentException e) {
        String msg = e.getMessage() != null ? e.getMessage() : "參數不正確";
        return ResponseEntity.badRequest().body(Map.of("error", msg, "code", "INVALID_ARGUMENT"));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidation(MethodArgumentNotValidException e) {
        return ResponseEntity.badRequest().body(Map.of("error", "請求欄位驗證失敗", "code", "INVALID_ARGUMENT"));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(Map.of("error", "請求格式不正確，請檢查欄位型別", "code", "INVALID_ARGUMENT"));
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<Map<String, String>> handleConcurrentUpdate(OptimisticLockingFailureException e) {
        log.info("[加持] 同一紀錄的並行請求衝突: {}", e.getMessage());
        return ResponseEntity.status(409).body(Map.of("error", "請求衝突，請稍後重試", "code", "CONFLICT"));
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<Map<String, String>> handleDuplicateWrite(DataIntegrityViolationException e) {
        log.info("[加持] 並行請求寫入重複資料: {}", e.getMostSpecificCause().getMessage());
        return ResponseEntity.status(409).body(Map.of("error", "請求衝突，請稍後重試", "code", "CONFLICT"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGeneral(Exception e) {
        log.error("[GlobalExceptionHandler] 未預期的錯誤", e);
        return ResponseEntity.internalServerError()
                .body(Map.of("error", "系統發生錯誤，請稍後重試", "code", "INTERNAL_ERROR"));
    }
}
