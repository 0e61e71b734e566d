package com.edge.qms.dto;

import com.edge.qms.model.NonConformanceStatus;
import com.edge.qms.model.Severity;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 新建 NC 或更新其状态（status 非空时为状态更新）
 */
@Data
@Schema(description = "不合格项请求")
public class NonConformanceRequest {
    private String recordId;
    private String criterionCode;

    @Schema(description = "标题", example = "尺寸超差")
    private String title;
    private String description;
    private Severity severity;

    @Schema(description = "目标关闭时间，缺省为检出后 qms.non-conformance.default-closure-days 天")
    private LocalDateTime targetClosureDate;

    private NonConformanceStatus status;
    private String rootCause;
    private String correctiveAction;
}
