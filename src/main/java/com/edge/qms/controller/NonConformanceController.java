package com.edge.qms.controller;

import com.edge.qms.dto.NonConformanceRequest;
import com.edge.qms.model.NonConformance;
import com.edge.qms.model.NonConformanceStatus;
import com.edge.qms.service.NonConformanceService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.NoSuchElementException;

/**
 * 不合格项控制器
 */
@RestController
@RequestMapping("/api/non-conformances")
@Tag(name = "不合格项", description = "NC 的创建、状态跟踪与关闭；记录审批通过后不合格测量项会自动创建 NC")
public class NonConformanceController {
    private static final Logger logger = LoggerFactory.getLogger(NonConformanceController.class);

    @Autowired
    private NonConformanceService nonConformanceService;

    @GetMapping
    @Operation(summary = "查询 NC", description = "按检出时间倒序，可按状态或记录过滤")
    public ResponseEntity<Map<String, Object>> listNonConformances(
            @RequestParam(required = false) NonConformanceStatus status,
            @RequestParam(required = false) String recordId) {
        try {
            return ApiResult.success(nonConformanceService.listNonConformances(status, recordId));
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to list non-conformances", e);
        }
    }

    @GetMapping("/{id}")
    @Operation(summary = "获取 NC")
    public ResponseEntity<Map<String, Object>> getNonConformance(@PathVariable String id) {
        try {
            NonConformance nc = nonConformanceService.getNonConformance(id)
                    .orElseThrow(() -> new NoSuchElementException("Non-conformance not found: " + id));
            return ApiResult.success(nc);
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to get non-conformance " + id, e);
        }
    }

    @PostMapping
    @Operation(summary = "新建 NC", description = "编号格式 NC-yyyy-NNN，初始状态 OPEN")
    public ResponseEntity<Map<String, Object>> createNonConformance(@RequestBody NonConformanceRequest request) {
        try {
            NonConformance nc = nonConformanceService.createNonConformance(request.getRecordId(),
                    request.getCriterionCode(), request.getTitle(), request.getDescription(),
                    request.getSeverity(), request.getTargetClosureDate());
            return ApiResult.success(nc, "Non-conformance created");
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to create non-conformance", e);
        }
    }

    @PutMapping("/{id}/status")
    @Operation(summary = "更新 NC 状态", description = "状态改为 CLOSED 时写入关闭时间，已关闭的 NC 返回 409")
    public ResponseEntity<Map<String, Object>> updateStatus(@PathVariable String id,
                                                            @RequestBody NonConformanceRequest request) {
        try {
            NonConformance nc = nonConformanceService.updateStatus(id, request.getStatus(),
                    request.getRootCause(), request.getCorrectiveAction());
            return ApiResult.success(nc);
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to update non-conformance " + id, e);
        }
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "删除 NC")
    public ResponseEntity<Map<String, Object>> deleteNonConformance(@PathVariable String id) {
        try {
            nonConformanceService.deleteNonConformance(id);
            return ApiResult.success(null, "Non-conformance deleted");
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to delete non-conformance " + id, e);
        }
    }
}
