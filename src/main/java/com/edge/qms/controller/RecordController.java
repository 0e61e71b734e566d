package com.edge.qms.controller;

import com.edge.qms.dto.CreateRecordRequest;
import com.edge.qms.dto.MeasurementRequest;
import com.edge.qms.dto.StatusChangeRequest;
import com.edge.qms.model.DateRange;
import com.edge.qms.model.InspectionRecord;
import com.edge.qms.model.RecordStatus;
import com.edge.qms.service.RecordService;
import com.edge.qms.service.StatisticsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
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
import java.util.NoSuchElementException;

/**
 * 检验记录控制器
 */
@RestController
@RequestMapping("/api/records")
@Tag(name = "检验记录", description = "按模板创建记录、录入测量值、审批流转；每次录入后自动重算合格率")
public class RecordController {
    private static final Logger logger = LoggerFactory.getLogger(RecordController.class);

    @Autowired
    private RecordService recordService;

    @Autowired
    private StatisticsService statisticsService;

    @PostMapping
    @Operation(summary = "新建检验记录", description = "记录编号格式 REC-yyyyMMddHHmmss，同一秒内重复时追加 -n，初始状态 DRAFT")
    public ResponseEntity<Map<String, Object>> createRecord(@RequestBody CreateRecordRequest request) {
        try {
            InspectionRecord record = recordService.createRecord(request.getTemplateId(), request.getTitle(),
                    request.getBatchNumber(), request.getDepartment(), request.getCreatedBy());
            return ApiResult.success(record, "Record created");
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to create record", e);
        }
    }

    @GetMapping
    @Operation(summary = "查询检验记录", description = "按创建时间倒序，所有条件可选")
    public ResponseEntity<Map<String, Object>> queryRecords(
            @Parameter(description = "开始日期", example = "2026-01-01")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @Parameter(description = "结束日期", example = "2026-01-31")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
            @RequestParam(required = false) String templateId,
            @RequestParam(required = false) RecordStatus status,
            @RequestParam(required = false, defaultValue = "100") Integer limit) {
        try {
            List<InspectionRecord> records = recordService.queryRecords(DateRange.of(start, end), templateId,
                    status, limit);
            Map<String, Object> data = new HashMap<>();
            data.put("total", records.size());
            data.put("records", records);
            return ApiResult.success(data);
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to query records", e);
        }
    }

    @GetMapping("/{id}")
    @Operation(summary = "获取检验记录")
    public ResponseEntity<Map<String, Object>> getRecord(@PathVariable String id) {
        try {
            InspectionRecord record = recordService.getRecord(id)
                    .orElseThrow(() -> new NoSuchElementException("Record not found: " + id));
            return ApiResult.success(record);
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to get record " + id, e);
        }
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "删除检验记录")
    public ResponseEntity<Map<String, Object>> deleteRecord(@PathVariable String id) {
        try {
            recordService.deleteRecord(id);
            return ApiResult.success(null, "Record deleted");
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to delete record " + id, e);
        }
    }

    @PutMapping("/{id}/measurements/{code}")
    @Operation(
            summary = "录入测量值",
            description = """
                    判定合格性并替换该检验项已有的测量项，然后重算记录汇总。

                    **判定规则**：
                    | 类型 | PASS | FAIL | UNKNOWN |
                    |------|------|------|---------|
                    | NUMERIC | 在上下限内（含边界） | 越界 | 无法解析 |
                    | BOOLEAN | yes/true/1 | no/false/0 | 其他 |
                    | SELECT | 选项全部合格 | 含不合格选项 | 空值或未配置合格选项 |
                    | TEXT | override=true | override=false | 未提供 override |

                    终审（APPROVED / REJECTED / CLOSED）后的记录返回 409，请使用更正接口。
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "录入成功",
                    content = @Content(mediaType = "application/json", examples = @ExampleObject(value = """
                            {
                              "status": "success",
                              "data": {
                                "recordNumber": "REC-20260115093000",
                                "complianceScore": 66.67,
                                "overallCompliance": false,
                                "failedItemsCount": 1,
                                "items": [
                                  {"criterionCode": "DIM-001", "rawValue": "100.6", "numericValue": 100.6,
                                   "compliance": "FAIL", "deviation": 0.1}
                                ]
                              }
                            }
                            """))),
            @ApiResponse(responseCode = "409", description = "记录已终审")
    })
    public ResponseEntity<Map<String, Object>> recordMeasurement(@PathVariable String id,
                                                                 @PathVariable String code,
                                                                 @RequestBody MeasurementRequest request) {
        try {
            InspectionRecord record = recordService.recordMeasurement(id, code, request.getValue(),
                    request.getOperator(), request.getOverride(), request.getRemarks());
            return ApiResult.success(record);
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to record measurement " + code + " of record " + id, e);
        }
    }

    @PutMapping("/{id}/measurements/{code}/correction")
    @Operation(summary = "更正测量值", description = "任何状态下都可使用，必须提供 reason，测量项标记为已更正")
    public ResponseEntity<Map<String, Object>> correctMeasurement(@PathVariable String id,
                                                                  @PathVariable String code,
                                                                  @RequestBody MeasurementRequest request) {
        try {
            InspectionRecord record = recordService.correctMeasurement(id, code, request.getValue(),
                    request.getOperator(), request.getOverride(), request.getReason());
            return ApiResult.success(record, "Measurement corrected");
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to correct measurement " + code + " of record " + id, e);
        }
    }

    @PutMapping("/{id}/status")
    @Operation(
            summary = "变更记录状态",
            description = """
                    | 当前状态 | 可变更为 |
                    |----------|----------|
                    | DRAFT | SUBMITTED |
                    | SUBMITTED | DRAFT, UNDER_REVIEW, APPROVED, REJECTED |
                    | UNDER_REVIEW | APPROVED, REJECTED |
                    | APPROVED | CLOSED |
                    | REJECTED | DRAFT, CLOSED |

                    审批通过或关闭时，不合格测量项自动生成 NC。
                    """
    )
    public ResponseEntity<Map<String, Object>> changeStatus(@PathVariable String id,
                                                            @RequestBody StatusChangeRequest request) {
        try {
            return ApiResult.success(recordService.changeStatus(id, request.getStatus()));
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to change status of record " + id, e);
        }
    }

    @GetMapping("/{id}/statistics")
    @Operation(summary = "记录数据统计", description = "单条记录内所有数值测量项的数量、均值、标准差、最小值、最大值、极差")
    public ResponseEntity<Map<String, Object>> recordStatistics(@PathVariable String id) {
        try {
            return ApiResult.success(statisticsService.recordDataStatistics(id));
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to compute statistics of record " + id, e);
        }
    }
}
