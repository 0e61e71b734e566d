package com.edge.qms.controller;

import org.slf4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.HashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * 统一响应格式 {status, data, message}
 */
final class ApiResult {

    private ApiResult() {
    }

    static ResponseEntity<Map<String, Object>> success(Object data) {
        return success(data, null);
    }

    static ResponseEntity<Map<String, Object>> success(Object data, String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "success");
        response.put("data", data);
        if (message != null) {
            response.put("message", message);
        }
        return ResponseEntity.ok(response);
    }

    static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "error");
        response.put("message", message);
        return ResponseEntity.status(status).body(response);
    }

    /**
     * 按异常类型映射状态码：参数错误 400，不存在 404，状态冲突 409，其余 500
     */
    static ResponseEntity<Map<String, Object>> failure(Logger logger, String action, Exception e) {
        if (e instanceof NoSuchElementException) {
            logger.warn("{}: {}", action, e.getMessage());
            return error(HttpStatus.NOT_FOUND, e.getMessage());
        }
        if (e instanceof IllegalArgumentException) {
            logger.warn("{}: {}", action, e.getMessage());
            return error(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        if (e instanceof IllegalStateException) {
            logger.warn("{}: {}", action, e.getMessage());
            return error(HttpStatus.CONFLICT, e.getMessage());
        }
        logger.error(action, e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }
}
