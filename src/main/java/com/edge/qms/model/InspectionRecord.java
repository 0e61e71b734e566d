package com.edge.qms.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 检验记录
 * <p>
 * complianceScore / overallCompliance / failedItemsCount 为派生字段，
 * 每次测量项变化时由 RecordSummaryCalculator 重新计算，不单独修改。
 * overallCompliance 为 null 表示尚无可判定的测量项。
 */
@Value
@Builder(toBuilder = true)
public class InspectionRecord {
    String id;
    String recordNumber;
    String templateId;
    String standardCode;
    String title;
    String category;
    RecordStatus status;
    String batchNumber;
    String department;
    String createdBy;
    LocalDateTime createdAt;
    LocalDateTime completedAt;
    List<MeasurementItem> items;

    Double complianceScore;
    Boolean overallCompliance;
    int failedItemsCount;

    public List<MeasurementItem> getItems() {
        return items != null ? items : List.of();
    }

    /**
     * 用于图表标签的记录编号，缺省时回退到 ID
     */
    public String label() {
        return recordNumber != null ? recordNumber : id;
    }

    /**
     * 统计图横轴使用的时间：完成时间优先，否则创建时间
     */
    public LocalDateTime effectiveTimestamp() {
        return completedAt != null ? completedAt : createdAt;
    }
}
