package com.edge.qms.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * 记录中针对单个检验项的一次测量值
 * <p>
 * rawValue 保存原始输入，numericValue 为解析后的数值（无法解析时为 null）。
 * deviation 为相对最近越界限值的有符号偏差，合格时为 0，无法判定时为 null。
 */
@Value
@Builder(toBuilder = true)
public class MeasurementItem {
    String criterionCode;
    String rawValue;
    Double numericValue;
    Compliance compliance;
    Double deviation;
    LocalDateTime measuredAt;
    String measuredBy;
    String remarks;
    boolean corrected;
    String correctionReason;
}
