package com.edge.qms.core.update;

import lombok.Builder;
import lombok.Value;

/**
 * 服务端返回的版本信息，缺失字段为 "" 或 0
 */
@Value
@Builder
public class UpdateInfo {
    String version;
    String build;
    String downloadUrl;
    String releaseNotesUrl;
    String notes;
    double sizeMb;
}
