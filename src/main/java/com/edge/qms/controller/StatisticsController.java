package com.edge.qms.controller;

import com.edge.qms.core.statistics.AggregationResult;
import com.edge.qms.model.DateRange;
import com.edge.qms.service.StatisticsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 控制图统计控制器
 */
@RestController
@RequestMapping("/api/statistics")
@Tag(name = "统计分析", description = "单值-移动极差控制图统计，不足 2 个数值时返回 chartable=false 及原因")
public class StatisticsController {
    private static final Logger logger = LoggerFactory.getLogger(StatisticsController.class);

    @Autowired
    private StatisticsService statisticsService;

    @GetMapping("/templates/{templateId}")
    @Operation(
            summary = "模板统计",
            description = """
                    对模板下每个数值检验项计算：均值、样本标准差、极差、UCL/LCL（均值 ± 3σ）、
                    移动极差序列、MR 均值、UCL_R（3.267 × MR 均值）、LCL_R = 0。

                    未指定日期时取最近 qms.report.lookback-limit 条记录。
                    """
    )
    public ResponseEntity<Map<String, Object>> templateStatistics(
            @PathVariable String templateId,
            @Parameter(description = "开始日期", example = "2026-01-01")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @Parameter(description = "结束日期", example = "2026-01-31")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
        try {
            List<AggregationResult> results = statisticsService.templateStatistics(templateId, DateRange.of(start, end));
            Map<String, Object> data = new HashMap<>();
            data.put("templateId", templateId);
            data.put("criteria", results);
            return ApiResult.success(data);
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to compute statistics of template " + templateId, e);
        }
    }

    @GetMapping("/templates/{templateId}/criteria/{code}")
    @Operation(summary = "单个检验项统计")
    public ResponseEntity<Map<String, Object>> criterionStatistics(
            @PathVariable String templateId,
            @PathVariable String code,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
        try {
            return ApiResult.success(statisticsService.criterionStatistics(templateId, code, DateRange.of(start, end)));
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to compute statistics of " + templateId + "/" + code, e);
        }
    }
}
