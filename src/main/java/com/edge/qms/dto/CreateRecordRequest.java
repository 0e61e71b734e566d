package com.edge.qms.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

@Data
@Schema(description = "新建检验记录请求")
public class CreateRecordRequest {
    @Schema(description = "检验模板 ID", requiredMode = Schema.RequiredMode.REQUIRED, example = "T-001")
    private String templateId;

    @Schema(description = "记录标题，缺省为模板名称")
    private String title;

    @Schema(description = "批次号", example = "B20260115")
    private String batchNumber;

    @Schema(description = "部门", example = "QA")
    private String department;

    @Schema(description = "创建人", example = "zhangsan")
    private String createdBy;
}
