package com.safety.analysis.controller;

import com.safety.analysis.service.gsn.InvalidRelationshipException;
import com.safety.analysis.util.UnsupportedRatingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 统一异常处理：参数类错误返回 400，其余运行时错误返回 500
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidRelationshipException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidRelationship(InvalidRelationshipException ex) {
        log.error("【请求失败】-> GSN连接不合法: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, "Invalid relationship", ex.getMessage());
    }

    @ExceptionHandler(UnsupportedRatingException.class)
    public ResponseEntity<Map<String, Object>> handleUnsupportedRating(UnsupportedRatingException ex) {
        log.error("【请求失败】-> 不支持的评级查询: table={}, key={}", ex.getTable(), ex.getKey());
        return body(HttpStatus.BAD_REQUEST, "Unsupported rating", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        log.error("【请求失败】-> 参数错误: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, "Bad request", ex.getMessage());
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<Map<String, Object>> handleRuntime(RuntimeException ex) {
        log.error("【请求失败】-> 内部错误", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal error", ex.getMessage());
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, String message) {
        // Map.of 不允许 null 值
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
