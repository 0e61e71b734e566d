package com.edge.qms.controller;

import com.edge.qms.model.DateRange;
import com.edge.qms.service.ReportService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.Map;

/**
 * 报表控制器
 */
@RestController
@RequestMapping("/api/reports")
@Tag(name = "报表", description = "合格率汇总与趋势、不合格检验项排行、模板使用情况、检验员与部门绩效、首页指标与 NC 报表")
public class ReportController {
    private static final Logger logger = LoggerFactory.getLogger(ReportController.class);

    @Autowired
    private ReportService reportService;

    @GetMapping("/compliance-summary")
    @Operation(summary = "合格率汇总", description = "合格率 = 合格记录 / (合格 + 不合格) × 100，尚无结论的记录计入 pending")
    public ResponseEntity<Map<String, Object>> complianceSummary(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
            @RequestParam(required = false) String department) {
        try {
            return ApiResult.success(reportService.complianceSummary(DateRange.of(start, end), department));
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to build compliance summary", e);
        }
    }

    @GetMapping("/criteria-failures")
    @Operation(summary = "不合格检验项排行")
    public ResponseEntity<Map<String, Object>> criteriaFailures(
            @RequestParam(required = false, defaultValue = "20") int topN) {
        try {
            return ApiResult.success(reportService.criteriaFailureReport(topN));
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to build criteria failure report", e);
        }
    }

    @GetMapping("/template-usage")
    @Operation(summary = "模板使用情况")
    public ResponseEntity<Map<String, Object>> templateUsage() {
        try {
            return ApiResult.success(reportService.templateUsageReport());
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to build template usage report", e);
        }
    }

    @GetMapping("/trend")
    @Operation(summary = "合格率趋势", description = "period 取 day / week / month / year，返回最近 limit 个周期")
    public ResponseEntity<Map<String, Object>> trend(
            @RequestParam(required = false, defaultValue = "month") String period,
            @RequestParam(required = false, defaultValue = "12") int limit) {
        try {
            return ApiResult.success(reportService.trendAnalysis(period, limit));
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to build trend report", e);
        }
    }

    @GetMapping("/inspector-performance")
    @Operation(summary = "检验员绩效", description = "按创建人统计检验次数、合格数、合格率与平均分")
    public ResponseEntity<Map<String, Object>> inspectorPerformance(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
        try {
            return ApiResult.success(reportService.inspectorPerformance(DateRange.of(start, end)));
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to build inspector performance report", e);
        }
    }

    @GetMapping("/department-performance")
    @Operation(summary = "部门绩效")
    public ResponseEntity<Map<String, Object>> departmentPerformance() {
        try {
            return ApiResult.success(reportService.departmentPerformance());
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to build department performance report", e);
        }
    }

    @GetMapping("/dashboard")
    @Operation(summary = "首页指标")
    public ResponseEntity<Map<String, Object>> dashboard() {
        try {
            return ApiResult.success(reportService.dashboardSummary());
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to build dashboard summary", e);
        }
    }

    @GetMapping("/non-conformances")
    @Operation(summary = "NC 汇总")
    public ResponseEntity<Map<String, Object>> nonConformanceSummary(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
        try {
            return ApiResult.success(reportService.nonConformanceSummary(DateRange.of(start, end)));
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to build non-conformance summary", e);
        }
    }

    @GetMapping("/non-conformances/overdue")
    @Operation(summary = "逾期未关闭的 NC")
    public ResponseEntity<Map<String, Object>> overdueNonConformances() {
        try {
            return ApiResult.success(reportService.overdueNonConformances());
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to build overdue non-conformance report", e);
        }
    }
}
