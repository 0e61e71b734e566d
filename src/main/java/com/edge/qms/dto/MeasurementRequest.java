package com.edge.qms.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

/**
 * 录入或更正测量值
 */
@Data
@Schema(description = "测量值录入请求")
public class MeasurementRequest {
    @Schema(description = "原始测量值", example = "99.9")
    private String value;

    @Schema(description = "检验员", example = "zhangsan")
    private String operator;

    @Schema(description = "人工判定结果，TEXT 类型必填，null 表示自动判定")
    private Boolean override;

    @Schema(description = "备注")
    private String remarks;

    @Schema(description = "更正原因，仅更正接口使用")
    private String reason;
}
